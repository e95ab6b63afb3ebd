package sa.com.cloudsolutions.lowering.syntax;

import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;

import java.util.Optional;

/**
 * The source syntax that a bound node was derived from.
 *
 * A syntax node is either backed by a JavaParser {@link Node}, in which case its parent and source
 * range come from the JavaParser tree, or it is detached and only knows its kind and the parent it
 * was given. The latter is used for constructs that have no Java source form, such as goto
 * statements or catch filters.
 */
public class SyntaxNode {
    private final SyntaxKind kind;
    private final Node node;
    private final SyntaxNode parent;

    SyntaxNode(SyntaxKind kind, Node node, SyntaxNode parent) {
        this.kind = kind;
        this.node = node;
        this.parent = parent;
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public boolean isKind(SyntaxKind k) {
        return kind == k;
    }

    /**
     * @return the JavaParser node behind this syntax, empty for detached syntax.
     */
    public Optional<Node> getNode() {
        return Optional.ofNullable(node);
    }

    public Optional<SyntaxNode> getParent() {
        if (parent != null) {
            return Optional.of(parent);
        }
        if (node != null) {
            return node.getParentNode().map(SyntaxTrees::of);
        }
        return Optional.empty();
    }

    public Optional<Range> getRange() {
        if (node != null) {
            return node.getRange();
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return node != null ? kind + " " + node : kind.toString();
    }
}
