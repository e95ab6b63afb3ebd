package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundGotoStatement extends BoundStatement {
    private final String label;

    public BoundGotoStatement(SyntaxNode syntax, String label, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
        this.label = label;
    }

    public BoundGotoStatement(SyntaxNode syntax, String label) {
        this(syntax, label, false);
    }

    public String getLabel() {
        return label;
    }
}
