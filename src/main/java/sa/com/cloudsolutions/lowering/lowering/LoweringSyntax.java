package sa.com.cloudsolutions.lowering.lowering;

import sa.com.cloudsolutions.lowering.bound.BoundStatement;
import sa.com.cloudsolutions.lowering.syntax.SyntaxKind;
import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Syntax shape checks that the lowering pass relies on.
 */
public class LoweringSyntax {

    private LoweringSyntax() {}

    /**
     * Decide whether a statement is the assignment of a field or property initial value.
     *
     * That is the case for a primary constructor parameter, or for an initial value expression
     * that belongs to a field declarator or to a property declaration. The expression may be
     * wrapped in an equals-value clause.
     *
     * @param initializer a statement produced while lowering field and property initializers
     * @return true if the statement has the shape of an initializer
     */
    public static boolean isFieldOrPropertyInitializer(BoundStatement initializer) {
        SyntaxNode syntax = initializer.getSyntax();
        if (syntax.isKind(SyntaxKind.PARAMETER)) {
            return true;
        }
        if (!syntax.getKind().isExpression()) {
            return false;
        }

        Optional<SyntaxNode> parent = syntax.getParent();
        if (parent.isPresent() && parent.get().isKind(SyntaxKind.EQUALS_VALUE_CLAUSE)) {
            parent = parent.get().getParent();
        }
        if (parent.isEmpty()) {
            return false;
        }

        SyntaxNode owner = parent.get();
        if (owner.isKind(SyntaxKind.PROPERTY_DECLARATION)) {
            return true;
        }
        return owner.isKind(SyntaxKind.VARIABLE_DECLARATOR) && owner.getParent()
                .map(p -> p.isKind(SyntaxKind.FIELD_DECLARATION))
                .orElse(false);
    }
}
