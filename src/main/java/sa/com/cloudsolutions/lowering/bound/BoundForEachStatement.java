package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundForEachStatement extends BoundStatement {

    public BoundForEachStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundForEachStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
