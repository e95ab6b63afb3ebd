package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundExpressionStatement extends BoundStatement {

    public BoundExpressionStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundExpressionStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
