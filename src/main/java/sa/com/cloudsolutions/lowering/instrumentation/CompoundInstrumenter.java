package sa.com.cloudsolutions.lowering.instrumentation;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
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

import java.util.Optional;

/**
 * An instrumenter that layers its own instrumentation on top of a previous one.
 *
 * Each method first delegates to the previous instrumenter. Subclasses override a method, call
 * {@code super} to get the previous instrumenter's result and then transform that result. A chain
 * is always terminated by {@link Instrumenter#NO_OP}, so the innermost transformation is the one
 * applied first.
 */
public class CompoundInstrumenter extends Instrumenter {
    private final Instrumenter previous;

    public CompoundInstrumenter(Instrumenter previous) {
        assert previous != null : "a chain must end with Instrumenter.NO_OP";
        this.previous = previous;
    }

    public Instrumenter getPrevious() {
        return previous;
    }

    /**
     * Combine a prologue or epilogue produced by the previous instrumenter with one of our own.
     * @param inner what the previous instrumenter created, may be empty
     * @param own the statement this instrumenter wants to add after it
     */
    protected static Optional<Statement> append(Optional<Statement> inner, Statement own) {
        if (inner.isEmpty()) {
            return Optional.of(own);
        }
        return Optional.of(new BlockStmt(new NodeList<>(inner.get(), own)));
    }

    @Override
    public Statement instrumentNoOpStatement(BoundNoOpStatement original, Statement rewritten) {
        return previous.instrumentNoOpStatement(original, rewritten);
    }

    @Override
    public Statement instrumentYieldBreakStatement(BoundYieldBreakStatement original, Statement rewritten) {
        return previous.instrumentYieldBreakStatement(original, rewritten);
    }

    @Override
    public Statement instrumentYieldReturnStatement(BoundYieldReturnStatement original, Statement rewritten) {
        return previous.instrumentYieldReturnStatement(original, rewritten);
    }

    @Override
    public Optional<Statement> createBlockPrologue(BoundBlock original) {
        return previous.createBlockPrologue(original);
    }

    @Override
    public Optional<Statement> createBlockEpilogue(BoundBlock original) {
        return previous.createBlockEpilogue(original);
    }

    @Override
    public Statement instrumentThrowStatement(BoundThrowStatement original, Statement rewritten) {
        return previous.instrumentThrowStatement(original, rewritten);
    }

    @Override
    public Statement instrumentContinueStatement(BoundContinueStatement original, Statement rewritten) {
        return previous.instrumentContinueStatement(original, rewritten);
    }

    @Override
    public Statement instrumentGotoStatement(BoundGotoStatement original, Statement rewritten) {
        return previous.instrumentGotoStatement(original, rewritten);
    }

    @Override
    public Statement instrumentExpressionStatement(BoundExpressionStatement original, Statement rewritten) {
        return previous.instrumentExpressionStatement(original, rewritten);
    }

    @Override
    public Statement instrumentFieldOrPropertyInitializer(BoundExpressionStatement original, Statement rewritten) {
        return previous.instrumentFieldOrPropertyInitializer(original, rewritten);
    }

    @Override
    public Statement instrumentBreakStatement(BoundBreakStatement original, Statement rewritten) {
        return previous.instrumentBreakStatement(original, rewritten);
    }

    @Override
    public Expression instrumentDoStatementCondition(BoundDoStatement original, Expression rewrittenCondition,
                                                     SyntheticNodeFactory factory) {
        return previous.instrumentDoStatementCondition(original, rewrittenCondition, factory);
    }

    @Override
    public Expression instrumentWhileStatementCondition(BoundWhileStatement original, Expression rewrittenCondition,
                                                        SyntheticNodeFactory factory) {
        return previous.instrumentWhileStatementCondition(original, rewrittenCondition, factory);
    }

    @Override
    public Expression instrumentForStatementCondition(BoundForStatement original, Expression rewrittenCondition,
                                                      SyntheticNodeFactory factory) {
        return previous.instrumentForStatementCondition(original, rewrittenCondition, factory);
    }

    @Override
    public Statement instrumentDoStatementConditionalGotoStart(BoundDoStatement original, Statement ifConditionGotoStart) {
        return previous.instrumentDoStatementConditionalGotoStart(original, ifConditionGotoStart);
    }

    @Override
    public Statement instrumentWhileStatementConditionalGotoStart(BoundWhileStatement original, Statement ifConditionGotoStart) {
        return previous.instrumentWhileStatementConditionalGotoStart(original, ifConditionGotoStart);
    }

    @Override
    public Statement instrumentForStatementConditionalGotoStart(BoundForStatement original, Statement branchBack) {
        return previous.instrumentForStatementConditionalGotoStart(original, branchBack);
    }

    @Override
    public Statement instrumentDoStatementGotoEnd(BoundDoStatement original, Statement gotoEnd) {
        return previous.instrumentDoStatementGotoEnd(original, gotoEnd);
    }

    @Override
    public Statement instrumentWhileStatementGotoEnd(BoundWhileStatement original, Statement gotoEnd) {
        return previous.instrumentWhileStatementGotoEnd(original, gotoEnd);
    }

    @Override
    public Statement instrumentForStatementGotoEnd(BoundForStatement original, Statement gotoEnd) {
        return previous.instrumentForStatementGotoEnd(original, gotoEnd);
    }

    @Override
    public Statement instrumentDoStatementGotoContinue(BoundDoStatement original, Statement gotoContinue) {
        return previous.instrumentDoStatementGotoContinue(original, gotoContinue);
    }

    @Override
    public Statement instrumentWhileStatementGotoContinue(BoundWhileStatement original, Statement gotoContinue) {
        return previous.instrumentWhileStatementGotoContinue(original, gotoContinue);
    }

    @Override
    public Statement instrumentForStatementGotoContinue(BoundForStatement original, Statement gotoContinue) {
        return previous.instrumentForStatementGotoContinue(original, gotoContinue);
    }

    @Override
    public Statement instrumentForEachStatementCollectionVarDeclaration(BoundForEachStatement original,
                                                                       Statement collectionVarDecl) {
        return previous.instrumentForEachStatementCollectionVarDeclaration(original, collectionVarDecl);
    }

    @Override
    public Statement instrumentForEachStatementIterationVarDeclaration(BoundForEachStatement original,
                                                                      Statement iterationVarDecl) {
        return previous.instrumentForEachStatementIterationVarDeclaration(original, iterationVarDecl);
    }

    @Override
    public Statement instrumentForEachStatementConditionalGotoStart(BoundForEachStatement original, Statement branchBack) {
        return previous.instrumentForEachStatementConditionalGotoStart(original, branchBack);
    }

    @Override
    public Statement instrumentForEachStatementGotoEnd(BoundForEachStatement original, Statement gotoEnd) {
        return previous.instrumentForEachStatementGotoEnd(original, gotoEnd);
    }

    @Override
    public Statement instrumentForEachStatementGotoContinue(BoundForEachStatement original, Statement gotoContinue) {
        return previous.instrumentForEachStatementGotoContinue(original, gotoContinue);
    }

    @Override
    public Statement instrumentForEachStatement(BoundForEachStatement original, Statement rewritten) {
        return previous.instrumentForEachStatement(original, rewritten);
    }

    @Override
    public Statement instrumentIfStatement(BoundIfStatement original, Statement rewritten) {
        return previous.instrumentIfStatement(original, rewritten);
    }

    @Override
    public Expression instrumentIfStatementCondition(BoundIfStatement original, Expression rewrittenCondition,
                                                     SyntheticNodeFactory factory) {
        return previous.instrumentIfStatementCondition(original, rewrittenCondition, factory);
    }

    @Override
    public Statement instrumentLabelStatement(BoundLabeledStatement original, Statement rewritten) {
        return previous.instrumentLabelStatement(original, rewritten);
    }

    @Override
    public Statement instrumentLocalInitialization(BoundLocalDeclaration original, Statement rewritten) {
        return previous.instrumentLocalInitialization(original, rewritten);
    }

    @Override
    public Statement instrumentLockTargetCapture(BoundLockStatement original, Statement lockTargetCapture) {
        return previous.instrumentLockTargetCapture(original, lockTargetCapture);
    }

    @Override
    public Statement instrumentReturnStatement(BoundReturnStatement original, Statement rewritten) {
        return previous.instrumentReturnStatement(original, rewritten);
    }

    @Override
    public Statement instrumentSwitchStatement(BoundSwitchStatement original, Statement rewritten) {
        return previous.instrumentSwitchStatement(original, rewritten);
    }

    @Override
    public Expression instrumentSwitchStatementExpression(BoundSwitchStatement original, Expression rewrittenExpression,
                                                          SyntheticNodeFactory factory) {
        return previous.instrumentSwitchStatementExpression(original, rewrittenExpression, factory);
    }

    @Override
    public Statement instrumentUsingTargetCapture(BoundUsingStatement original, Statement usingTargetCapture) {
        return previous.instrumentUsingTargetCapture(original, usingTargetCapture);
    }

    @Override
    public Expression instrumentCatchClauseFilter(BoundCatchBlock original, Expression rewrittenFilter,
                                                  SyntheticNodeFactory factory) {
        return previous.instrumentCatchClauseFilter(original, rewrittenFilter, factory);
    }
}
