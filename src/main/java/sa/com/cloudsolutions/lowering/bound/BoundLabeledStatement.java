package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundLabeledStatement extends BoundStatement {

    public BoundLabeledStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundLabeledStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
