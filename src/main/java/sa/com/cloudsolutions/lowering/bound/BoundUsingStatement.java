package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

/**
 * {@code using} statement, the try-with-resources of Java source.
 */
public class BoundUsingStatement extends BoundStatement {

    public BoundUsingStatement(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundUsingStatement(SyntaxNode syntax) {
        this(syntax, false);
    }
}
