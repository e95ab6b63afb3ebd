package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundThrowStatement extends BoundStatement {

    public BoundThrowStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundThrowStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
