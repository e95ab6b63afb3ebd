package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

/**
 * {@code lock} statement, the {@code synchronized} block of Java source.
 */
public class BoundLockStatement extends BoundStatement {

    public BoundLockStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundLockStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
