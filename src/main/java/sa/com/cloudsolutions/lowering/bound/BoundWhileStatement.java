package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundWhileStatement extends BoundStatement {

    public BoundWhileStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundWhileStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
