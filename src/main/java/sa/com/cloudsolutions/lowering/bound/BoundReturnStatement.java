package sa.com.cloudsolutions.lowering.bound;

import com.github.javaparser.ast.expr.Expression;
import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

import java.util.Optional;

/**
 * A return statement.
 * Lowering synthesizes an implicit return at the end of method bodies; those are compiler generated
 * and their syntax is the method's body block.
 */
public class BoundReturnStatement extends BoundStatement {
    private final Expression expression;

    public BoundReturnStatement(SyntaxNode syntax, Expression expression, boolean compilerGenerated) {
        super(syntax, compilerGenerated);
        this.expression = expression;
    }

    public BoundReturnStatement(SyntaxNode syntax, Expression expression) {
        this(syntax, expression, false);
    }

    public Optional<Expression> getExpression() {
        return Optional.ofNullable(expression);
    }
}
