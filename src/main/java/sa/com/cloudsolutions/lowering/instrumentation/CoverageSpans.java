package sa.com.cloudsolutions.lowering.instrumentation;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The syntax covered by each slot of a method's coverage payload. Slot numbers are list indexes.
 */
public class CoverageSpans {
    private final String method;
    private final List<SyntaxNode> spans = new ArrayList<>();

    public CoverageSpans(String method) {
        this.method = method;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Allocate the next slot.
     * @param syntax the syntax that the slot records execution of
     * @return the slot number
     */
    int add(SyntaxNode syntax) {
        spans.add(syntax);
        return spans.size() - 1;
    }

    public SyntaxNode get(int slot) {
        return spans.get(slot);
    }

    public int size() {
        return spans.size();
    }

    public List<SyntaxNode> getSpans() {
        return Collections.unmodifiableList(spans);
    }
}
