package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundBreakStatement extends BoundStatement {

    public BoundBreakStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundBreakStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
