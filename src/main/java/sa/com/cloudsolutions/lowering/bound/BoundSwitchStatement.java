package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

public class BoundSwitchStatement extends BoundStatement {

    public BoundSwitchStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundSwitchStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
