package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundBlock extends BoundStatement {

    public BoundBlock(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundBlock(SyntaxNode syntax) {
        this(syntax, false);
    }
}
