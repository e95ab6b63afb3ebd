package sa.com.cloudsolutions.lowering.syntax;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;

import java.util.Optional;

/**
 * A catch clause, optionally guarded by a filter ({@code catch (E e) when (filter)}).
 * Java catch clauses parsed from source never carry a filter.
 */
public class CatchClauseSyntax extends SyntaxNode {
    private final Expression filter;

    CatchClauseSyntax(Node node, SyntaxNode parent, Expression filter) {
        super(SyntaxKind.CATCH_CLAUSE, node, parent);
        this.filter = filter;
    }

    public Optional<Expression> getFilter() {
        return Optional.ofNullable(filter);
    }
}
