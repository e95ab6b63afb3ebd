package sa.com.cloudsolutions.lowering.lowering;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;

import java.util.Arrays;

/**
 * Builds lowered tree fragments for the method that is currently being lowered.
 *
 * One factory exists per lowering run and it is owned by the lowering pass. A policy that keeps
 * state for a single run, such as coverage, may hold on to the factory of that run.
 */
public class SyntheticNodeFactory {
    public static final String TEMP_PREFIX = "$temp";

    private final String currentMethod;
    private int tempCount;

    public SyntheticNodeFactory(String currentMethod) {
        this.currentMethod = currentMethod;
    }

    /**
     * @return the name of the method whose body is being lowered
     */
    public String getCurrentMethod() {
        return currentMethod;
    }

    /**
     * Allocate a temporary local that is unique within the current method.
     * @return a name expression referring to the new temporary
     */
    public NameExpr temp() {
        return new NameExpr(TEMP_PREFIX + tempCount++);
    }

    public int getTempCount() {
        return tempCount;
    }

    /**
     * Group statements so that they execute in order where a single statement is expected.
     */
    public BlockStmt statementList(Statement... statements) {
        return new BlockStmt(new NodeList<>(Arrays.asList(statements)));
    }

    public ExpressionStmt expressionStatement(Expression expression) {
        return new ExpressionStmt(expression);
    }

    public MethodCallExpr staticCall(String type, String method, Expression... args) {
        return new MethodCallExpr(new NameExpr(type), method, new NodeList<>(Arrays.asList(args)));
    }

    public IntegerLiteralExpr literal(int value) {
        return new IntegerLiteralExpr(String.valueOf(value));
    }

    public AssignExpr assignment(Expression target, Expression value) {
        return new AssignExpr(target, value, AssignExpr.Operator.ASSIGN);
    }

    public ArrayAccessExpr arrayElement(String array, int index) {
        return new ArrayAccessExpr(new NameExpr(array), literal(index));
    }

    public UnaryExpr increment(Expression target) {
        return new UnaryExpr(target, UnaryExpr.Operator.POSTFIX_INCREMENT);
    }
}
