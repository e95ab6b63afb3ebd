package sa.com.cloudsolutions.lowering.syntax;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;

import java.util.List;

/**
 * Builds {@link SyntaxNode} instances.
 *
 * Java source is classified from the JavaParser AST. Constructs without a Java source form
 * are created detached from any JavaParser node.
 */
public class SyntaxTrees {

    private SyntaxTrees() {}

    /**
     * Classify a JavaParser node.
     * @param node the node that a bound node was derived from
     * @return a syntax node whose kind reflects the shape of the JavaParser node
     */
    public static SyntaxNode of(Node node) {
        if (node instanceof CatchClause) {
            return new CatchClauseSyntax(node, null, null);
        }
        if (node instanceof ExpressionStmt stmt && stmt.getExpression() instanceof VariableDeclarationExpr vdecl) {
            List<String> names = vdecl.getVariables().stream().map(VariableDeclarator::getNameAsString).toList();
            return new LocalDeclarationStatementSyntax(node, null, names);
        }
        return new SyntaxNode(kindOf(node), node, null);
    }

    static SyntaxKind kindOf(Node node) {
        if (node instanceof BlockStmt) {
            return SyntaxKind.BLOCK;
        }
        if (node instanceof EmptyStmt) {
            return SyntaxKind.EMPTY_STATEMENT;
        }
        if (node instanceof ExpressionStmt) {
            return SyntaxKind.EXPRESSION_STATEMENT;
        }
        if (node instanceof IfStmt) {
            return SyntaxKind.IF_STATEMENT;
        }
        if (node instanceof DoStmt) {
            return SyntaxKind.DO_STATEMENT;
        }
        if (node instanceof WhileStmt) {
            return SyntaxKind.WHILE_STATEMENT;
        }
        if (node instanceof ForStmt) {
            return SyntaxKind.FOR_STATEMENT;
        }
        if (node instanceof ForEachStmt) {
            return SyntaxKind.FOR_EACH_STATEMENT;
        }
        if (node instanceof SynchronizedStmt) {
            return SyntaxKind.LOCK_STATEMENT;
        }
        if (node instanceof TryStmt tryStmt) {
            return tryStmt.getResources().isEmpty() ? SyntaxKind.TRY_STATEMENT : SyntaxKind.USING_STATEMENT;
        }
        if (node instanceof LabeledStmt) {
            return SyntaxKind.LABELED_STATEMENT;
        }
        if (node instanceof SwitchStmt) {
            return SyntaxKind.SWITCH_STATEMENT;
        }
        if (node instanceof ReturnStmt) {
            return SyntaxKind.RETURN_STATEMENT;
        }
        if (node instanceof ThrowStmt) {
            return SyntaxKind.THROW_STATEMENT;
        }
        if (node instanceof BreakStmt) {
            return SyntaxKind.BREAK_STATEMENT;
        }
        if (node instanceof ContinueStmt) {
            return SyntaxKind.CONTINUE_STATEMENT;
        }
        if (node instanceof VariableDeclarator) {
            return SyntaxKind.VARIABLE_DECLARATOR;
        }
        if (node instanceof FieldDeclaration) {
            return SyntaxKind.FIELD_DECLARATION;
        }
        if (node instanceof Parameter) {
            return SyntaxKind.PARAMETER;
        }
        if (node instanceof MethodDeclaration) {
            return SyntaxKind.METHOD_DECLARATION;
        }
        if (node instanceof ConstructorDeclaration) {
            return SyntaxKind.CONSTRUCTOR_DECLARATION;
        }
        if (node instanceof ClassOrInterfaceDeclaration) {
            return SyntaxKind.CLASS_DECLARATION;
        }
        if (node instanceof CompilationUnit) {
            return SyntaxKind.COMPILATION_UNIT;
        }
        if (node instanceof Expression) {
            return SyntaxKind.EXPRESSION;
        }
        return SyntaxKind.OTHER;
    }

    public static SyntaxNode parseStatement(String code) {
        return of(StaticJavaParser.parseStatement(code));
    }

    public static SyntaxNode parseExpression(String code) {
        return of(StaticJavaParser.parseExpression(code));
    }

    /**
     * Create syntax that has no JavaParser counterpart.
     * @param kind the kind of construct
     * @param parent the enclosing syntax, may be null
     */
    public static SyntaxNode detached(SyntaxKind kind, SyntaxNode parent) {
        return new SyntaxNode(kind, null, parent);
    }

    public static SyntaxNode detached(SyntaxKind kind) {
        return detached(kind, null);
    }

    /**
     * A catch clause with a filter, {@code catch (E e) when (filter)}.
     * @param filter the filter expression; null for an unfiltered clause
     */
    public static CatchClauseSyntax catchClause(Expression filter) {
        return new CatchClauseSyntax(null, null, filter);
    }

    public static LocalDeclarationStatementSyntax localDeclaration(List<String> variables) {
        return new LocalDeclarationStatementSyntax(null, null, variables);
    }
}
