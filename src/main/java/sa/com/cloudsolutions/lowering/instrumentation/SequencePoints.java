package sa.com.cloudsolutions.lowering.instrumentation;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import sa.com.cloudsolutions.lowering.lowering.SyntheticNodeFactory;
import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Builds the lowered form of debugger sequence points.
 *
 * A sequence point is a call on the sequence point type: {@code mark(line, column)} before a
 * statement, {@code condition(line, column, expr)} around a condition that evaluates to
 * {@code expr}. Syntax without a source range gets a {@code hidden()} point, where the debugger
 * never stops.
 */
public class SequencePoints {
    public static final String DEFAULT_TYPE = "$SequencePoint";
    public static final String MARK = "mark";
    public static final String CONDITION = "condition";
    public static final String HIDDEN = "hidden";

    private final String type;

    public SequencePoints(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    /**
     * Prefix a statement with a sequence point at the start of its syntax.
     */
    public Statement add(SyntaxNode syntax, Statement rewritten) {
        return new BlockStmt(new NodeList<>(marker(syntax.getRange().map(r -> r.begin)), rewritten));
    }

    /**
     * Prefix a statement with a sequence point at the end of its syntax, for example the closing
     * brace of a block.
     */
    public Statement addAtEnd(SyntaxNode syntax, Statement rewritten) {
        return new BlockStmt(new NodeList<>(marker(syntax.getRange().map(r -> r.end)), rewritten));
    }

    public Statement openBrace(SyntaxNode block) {
        return marker(block.getRange().map(r -> r.begin));
    }

    public Statement closeBrace(SyntaxNode block) {
        return marker(block.getRange().map(r -> r.end));
    }

    public Expression addConditional(SyntaxNode syntax, Expression condition, SyntheticNodeFactory factory) {
        Optional<Range> range = syntax.getRange();
        if (range.isEmpty()) {
            return condition;
        }
        Position begin = range.get().begin;
        return factory.staticCall(type, CONDITION, factory.literal(begin.line), factory.literal(begin.column), condition);
    }

    private Statement marker(Optional<Position> position) {
        if (position.isEmpty()) {
            return new ExpressionStmt(new MethodCallExpr(new NameExpr(type), HIDDEN));
        }
        Position p = position.get();
        return new ExpressionStmt(new MethodCallExpr(new NameExpr(type), MARK,
                new NodeList<Expression>(new IntegerLiteralExpr(String.valueOf(p.line)),
                        new IntegerLiteralExpr(String.valueOf(p.column)))));
    }
}
