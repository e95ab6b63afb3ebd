package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

/**
 * A node of the semantically checked tree, before lowering.
 *
 * Bound nodes are immutable. They remember the syntax they were derived from and whether they
 * were synthesized by the compiler rather than written by the user.
 */
public abstract class BoundNode {
    private final SyntaxNode syntax;
    private final boolean compilerGenerated;

    protected BoundNode(SyntaxNode syntax, boolean compilerGenerated) {
        this.syntax = syntax;
        this.compilerGenerated = compilerGenerated;
    }

    public SyntaxNode getSyntax() {
        return syntax;
    }

    public boolean wasCompilerGenerated() {
        return compilerGenerated;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + syntax + (compilerGenerated ? ", generated]" : "]");
    }
}
