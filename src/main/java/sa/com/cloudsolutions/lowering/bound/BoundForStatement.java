package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundForStatement extends BoundStatement {

    public BoundForStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundForStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
