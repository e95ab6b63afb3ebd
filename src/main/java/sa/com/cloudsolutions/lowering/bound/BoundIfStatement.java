package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundIfStatement extends BoundStatement {

    public BoundIfStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundIfStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
