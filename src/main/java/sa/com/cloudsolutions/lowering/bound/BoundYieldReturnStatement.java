package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundYieldReturnStatement extends BoundStatement {

    public BoundYieldReturnStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundYieldReturnStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
