package sa.com.cloudsolutions.lowering.bound;

import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

/**
 * A catch block of a try statement. Not a statement on its own.
 */
public class BoundCatchBlock extends BoundNode {

    public BoundCatchBlock(SyntaxNode syntax, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
    }

    public BoundCatchBlock(SyntaxNode syntax) {
        this(syntax, false);
    }
}
