package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

/**
 * A statement that lowers to nothing, kept as an anchor for instrumentation.
 */
public class BoundNoOpStatement extends BoundStatement {

    public BoundNoOpStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundNoOpStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
