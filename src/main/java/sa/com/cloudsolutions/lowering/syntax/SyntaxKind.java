package sa.com.cloudsolutions.lowering.syntax;

/**
 * The kinds of syntax that an original bound node may be derived from.
 */
public enum SyntaxKind {
    BLOCK,
    EMPTY_STATEMENT,
    EXPRESSION_STATEMENT,
    LOCAL_DECLARATION_STATEMENT,
    VARIABLE_DECLARATOR,
    IF_STATEMENT,
    DO_STATEMENT,
    WHILE_STATEMENT,
    FOR_STATEMENT,
    FOR_EACH_STATEMENT,
    LOCK_STATEMENT,
    USING_STATEMENT,
    TRY_STATEMENT,
    CATCH_CLAUSE,
    LABELED_STATEMENT,
    SWITCH_STATEMENT,
    RETURN_STATEMENT,
    THROW_STATEMENT,
    BREAK_STATEMENT,
    CONTINUE_STATEMENT,
    GOTO_STATEMENT,
    YIELD_RETURN_STATEMENT,
    YIELD_BREAK_STATEMENT,
    FIELD_DECLARATION,
    PROPERTY_DECLARATION,
    EQUALS_VALUE_CLAUSE,
    PARAMETER,
    METHOD_DECLARATION,
    CONSTRUCTOR_DECLARATION,
    CLASS_DECLARATION,
    COMPILATION_UNIT,
    EXPRESSION(true),
    OTHER;

    private final boolean expression;

    SyntaxKind() {
        this(false);
    }

    SyntaxKind(boolean expression) {
        this.expression = expression;
    }

    public boolean isExpression() {
        return expression;
    }
}
