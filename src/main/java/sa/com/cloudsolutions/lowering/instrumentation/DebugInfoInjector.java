package sa.com.cloudsolutions.lowering.instrumentation;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import sa.com.cloudsolutions.lowering.bound.BoundBlock;
import sa.com.cloudsolutions.lowering.bound.BoundBreakStatement;
import sa.com.cloudsolutions.lowering.bound.BoundCatchBlock;
import sa.com.cloudsolutions.lowering.bound.BoundContinueStatement;
import sa.com.cloudsolutions.lowering.bound.BoundDoStatement;
import sa.com.cloudsolutions.lowering.bound.BoundExpressionStatement;
import sa.com.cloudsolutions.lowering.bound.BoundForEachStatement;
import sa.com.cloudsolutions.lowering.bound.BoundForStatement;
import sa.com.cloudsolutions.lowering.bound.BoundGotoStatement;
import sa.com.cloudsolutions.lowering.bound.BoundIfStatement;
import sa.com.cloudsolutions.lowering.bound.BoundLabeledStatement;
import sa.com.cloudsolutions.lowering.bound.BoundLocalDeclaration;
import sa.com.cloudsolutions.lowering.bound.BoundLockStatement;
import sa.com.cloudsolutions.lowering.bound.BoundNoOpStatement;
import sa.com.cloudsolutions.lowering.bound.BoundReturnStatement;
import sa.com.cloudsolutions.lowering.bound.BoundSwitchStatement;
import sa.com.cloudsolutions.lowering.bound.BoundThrowStatement;
import sa.com.cloudsolutions.lowering.bound.BoundUsingStatement;
import sa.com.cloudsolutions.lowering.bound.BoundWhileStatement;
import sa.com.cloudsolutions.lowering.bound.BoundYieldBreakStatement;
import sa.com.cloudsolutions.lowering.bound.BoundYieldReturnStatement;
import sa.com.cloudsolutions.lowering.lowering.SyntheticNodeFactory;
import sa.com.cloudsolutions.lowering.syntax.SyntaxKind;

import java.util.Optional;

/**
 * Adds debugger sequence points to the lowered code.
 *
 * Statements get a sequence point at the start of their syntax, conditions are wrapped so that the
 * debugger can stop on them, and block braces get their own points. Holds no state, so a single
 * instance may be shared by concurrent lowering runs.
 */
public class DebugInfoInjector extends CompoundInstrumenter {
    public static final DebugInfoInjector SINGLETON = new DebugInfoInjector(NO_OP, new SequencePoints(SequencePoints.DEFAULT_TYPE));

    private final SequencePoints sequencePoints;

    public DebugInfoInjector(Instrumenter previous, SequencePoints sequencePoints) {
        super(previous);
        this.sequencePoints = sequencePoints;
    }

    public static InstrumentationLayer layer(SequencePoints sequencePoints) {
        return previous -> new DebugInfoInjector(previous, sequencePoints);
    }

    public SequencePoints getSequencePoints() {
        return sequencePoints;
    }

    @Override
    public Statement instrumentNoOpStatement(BoundNoOpStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentNoOpStatement(original, rewritten));
    }

    @Override
    public Statement instrumentYieldBreakStatement(BoundYieldBreakStatement original, Statement rewritten) {
        rewritten = super.instrumentYieldBreakStatement(original, rewritten);
        if (original.wasCompilerGenerated()) {
            // the implicit yield break at the end of an iterator body
            return sequencePoints.addAtEnd(original.getSyntax(), rewritten);
        }
        return sequencePoints.add(original.getSyntax(), rewritten);
    }

    @Override
    public Statement instrumentYieldReturnStatement(BoundYieldReturnStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentYieldReturnStatement(original, rewritten));
    }

    @Override
    public Optional<Statement> createBlockPrologue(BoundBlock original) {
        return append(super.createBlockPrologue(original), sequencePoints.openBrace(original.getSyntax()));
    }

    @Override
    public Optional<Statement> createBlockEpilogue(BoundBlock original) {
        return append(super.createBlockEpilogue(original), sequencePoints.closeBrace(original.getSyntax()));
    }

    @Override
    public Statement instrumentThrowStatement(BoundThrowStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentThrowStatement(original, rewritten));
    }

    @Override
    public Statement instrumentContinueStatement(BoundContinueStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentContinueStatement(original, rewritten));
    }

    @Override
    public Statement instrumentGotoStatement(BoundGotoStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentGotoStatement(original, rewritten));
    }

    @Override
    public Statement instrumentExpressionStatement(BoundExpressionStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentExpressionStatement(original, rewritten));
    }

    @Override
    public Statement instrumentFieldOrPropertyInitializer(BoundExpressionStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentFieldOrPropertyInitializer(original, rewritten));
    }

    @Override
    public Statement instrumentBreakStatement(BoundBreakStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentBreakStatement(original, rewritten));
    }

    @Override
    public Expression instrumentDoStatementCondition(BoundDoStatement original, Expression rewrittenCondition,
                                                     SyntheticNodeFactory factory) {
        rewrittenCondition = super.instrumentDoStatementCondition(original, rewrittenCondition, factory);
        return sequencePoints.addConditional(original.getSyntax(), rewrittenCondition, factory);
    }

    @Override
    public Expression instrumentWhileStatementCondition(BoundWhileStatement original, Expression rewrittenCondition,
                                                        SyntheticNodeFactory factory) {
        rewrittenCondition = super.instrumentWhileStatementCondition(original, rewrittenCondition, factory);
        return sequencePoints.addConditional(original.getSyntax(), rewrittenCondition, factory);
    }

    @Override
    public Expression instrumentForStatementCondition(BoundForStatement original, Expression rewrittenCondition,
                                                      SyntheticNodeFactory factory) {
        rewrittenCondition = super.instrumentForStatementCondition(original, rewrittenCondition, factory);
        return sequencePoints.addConditional(original.getSyntax(), rewrittenCondition, factory);
    }

    @Override
    public Statement instrumentForEachStatementCollectionVarDeclaration(BoundForEachStatement original,
                                                                       Statement collectionVarDecl) {
        collectionVarDecl = super.instrumentForEachStatementCollectionVarDeclaration(original, collectionVarDecl);
        return sequencePoints.add(original.getSyntax(), collectionVarDecl);
    }

    @Override
    public Statement instrumentForEachStatementIterationVarDeclaration(BoundForEachStatement original,
                                                                      Statement iterationVarDecl) {
        iterationVarDecl = super.instrumentForEachStatementIterationVarDeclaration(original, iterationVarDecl);
        return sequencePoints.add(original.getSyntax(), iterationVarDecl);
    }

    @Override
    public Statement instrumentIfStatement(BoundIfStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentIfStatement(original, rewritten));
    }

    @Override
    public Expression instrumentIfStatementCondition(BoundIfStatement original, Expression rewrittenCondition,
                                                     SyntheticNodeFactory factory) {
        rewrittenCondition = super.instrumentIfStatementCondition(original, rewrittenCondition, factory);
        return sequencePoints.addConditional(original.getSyntax(), rewrittenCondition, factory);
    }

    @Override
    public Statement instrumentLabelStatement(BoundLabeledStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentLabelStatement(original, rewritten));
    }

    @Override
    public Statement instrumentLocalInitialization(BoundLocalDeclaration original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentLocalInitialization(original, rewritten));
    }

    @Override
    public Statement instrumentLockTargetCapture(BoundLockStatement original, Statement lockTargetCapture) {
        return sequencePoints.add(original.getSyntax(), super.instrumentLockTargetCapture(original, lockTargetCapture));
    }

    @Override
    public Statement instrumentReturnStatement(BoundReturnStatement original, Statement rewritten) {
        rewritten = super.instrumentReturnStatement(original, rewritten);
        if (original.wasCompilerGenerated() && original.getExpression().isEmpty()
                && original.getSyntax().isKind(SyntaxKind.BLOCK)) {
            // implicit return at the end of a method body stops on the closing brace
            return sequencePoints.addAtEnd(original.getSyntax(), rewritten);
        }
        return sequencePoints.add(original.getSyntax(), rewritten);
    }

    @Override
    public Statement instrumentSwitchStatement(BoundSwitchStatement original, Statement rewritten) {
        return sequencePoints.add(original.getSyntax(), super.instrumentSwitchStatement(original, rewritten));
    }

    @Override
    public Expression instrumentSwitchStatementExpression(BoundSwitchStatement original, Expression rewrittenExpression,
                                                          SyntheticNodeFactory factory) {
        rewrittenExpression = super.instrumentSwitchStatementExpression(original, rewrittenExpression, factory);
        return sequencePoints.addConditional(original.getSyntax(), rewrittenExpression, factory);
    }

    @Override
    public Statement instrumentUsingTargetCapture(BoundUsingStatement original, Statement usingTargetCapture) {
        return sequencePoints.add(original.getSyntax(), super.instrumentUsingTargetCapture(original, usingTargetCapture));
    }

    @Override
    public Expression instrumentCatchClauseFilter(BoundCatchBlock original, Expression rewrittenFilter,
                                                  SyntheticNodeFactory factory) {
        rewrittenFilter = super.instrumentCatchClauseFilter(original, rewrittenFilter, factory);
        return sequencePoints.addConditional(original.getSyntax(), rewrittenFilter, factory);
    }
}
