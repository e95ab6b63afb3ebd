package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundContinueStatement extends BoundStatement {

    public BoundContinueStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundContinueStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
