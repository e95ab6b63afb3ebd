package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundDoStatement extends BoundStatement {

    public BoundDoStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundDoStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
