package sa.com.cloudsolutions.lowering.syntax;

import com.github.javaparser.ast.Node;

import java.util.List;

/**
 * A local variable declaration statement such as {@code int a = 1, b = 2;}
 */
public class LocalDeclarationStatementSyntax extends SyntaxNode {
    private final List<String> variables;

    LocalDeclarationStatementSyntax(Node node, SyntaxNode parent, List<String> variables) {
        super(SyntaxKind.LOCAL_DECLARATION_STATEMENT, node, parent);
        this.variables = List.copyOf(variables);
    }

    /**
     * @return the names of the declared variables in declaration order
     */
    public List<String> getVariables() {
        return variables;
    }
}
