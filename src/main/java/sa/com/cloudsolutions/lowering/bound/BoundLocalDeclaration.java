package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

/**
 * Declaration of a single local variable.
 */
public class BoundLocalDeclaration extends BoundStatement {

    public BoundLocalDeclaration(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundLocalDeclaration(SyntaxNode syntax) {
        this(syntax, false);
    }
}
