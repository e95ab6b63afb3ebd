package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

/**
 * {@code yield break} inside an iterator. Lowering synthesizes one at the end of every iterator block.
 */
public class BoundYieldBreakStatement extends BoundStatement {

    public BoundYieldBreakStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundYieldBreakStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
