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
import sa.com.cloudsolutions.lowering.bound.BoundNode;
import sa.com.cloudsolutions.lowering.bound.BoundNoOpStatement;
import sa.com.cloudsolutions.lowering.bound.BoundReturnStatement;
import sa.com.cloudsolutions.lowering.bound.BoundStatement;
import sa.com.cloudsolutions.lowering.bound.BoundSwitchStatement;
import sa.com.cloudsolutions.lowering.bound.BoundThrowStatement;
import sa.com.cloudsolutions.lowering.bound.BoundUsingStatement;
import sa.com.cloudsolutions.lowering.bound.BoundWhileStatement;
import sa.com.cloudsolutions.lowering.bound.BoundYieldBreakStatement;
import sa.com.cloudsolutions.lowering.bound.BoundYieldReturnStatement;
import sa.com.cloudsolutions.lowering.lowering.LoweringSyntax;
import sa.com.cloudsolutions.lowering.lowering.SyntheticNodeFactory;
import sa.com.cloudsolutions.lowering.syntax.CatchClauseSyntax;
import sa.com.cloudsolutions.lowering.syntax.LocalDeclarationStatementSyntax;
import sa.com.cloudsolutions.lowering.syntax.SyntaxKind;
import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Base class for components that instrument executable code while it is being lowered.
 *
 * The lowering pass calls these methods right after it has rewritten an instrumentable construct.
 * Every method receives at least
 * <ul>
 *     <li>the original bound node, as it was before lowering</li>
 *     <li>the statement or expression that lowering produced for it</li>
 * </ul>
 * and returns what should be emitted instead of the rewritten node. The methods here return the
 * rewritten node unchanged, so subclasses only override the attachment points they care about.
 *
 * The preconditions are checked with {@code assert}. A failing assertion means that the lowering
 * pass called the wrong method for a construct; it can never be caused by the program being
 * compiled.
 */
public class Instrumenter {
    /**
     * The instrumenter that does nothing. Used to terminate a chain of {@link CompoundInstrumenter}s.
     */
    public static final Instrumenter NO_OP = new Instrumenter();

    protected Instrumenter() {
    }

    private static Statement instrumentStatement(BoundStatement original, Statement rewritten) {
        assert !original.wasCompilerGenerated() : "compiler generated " + original;
        return rewritten;
    }

    private static boolean isKind(BoundNode original, SyntaxKind kind) {
        return original.getSyntax().isKind(kind);
    }

    /*
     * Loop scaffolding and condition hooks are only ever called for user written loops.
     */
    private static void assertUserWritten(BoundNode original, SyntaxKind kind) {
        assert !original.wasCompilerGenerated() : "compiler generated " + original;
        assert isKind(original, kind) : "expected " + kind + " but got " + original.getSyntax().getKind();
    }

    public Statement instrumentNoOpStatement(BoundNoOpStatement original, Statement rewritten) {
        return instrumentStatement(original, rewritten);
    }

    /**
     * Lowering synthesizes a {@code yield break} at the end of an iterator body. That one is compiler
     * generated and its syntax is the body block.
     */
    public Statement instrumentYieldBreakStatement(BoundYieldBreakStatement original, Statement rewritten) {
        assert !original.wasCompilerGenerated() || isKind(original, SyntaxKind.BLOCK)
                : "compiler generated yield break outside a block " + original;
        return rewritten;
    }

    public Statement instrumentYieldReturnStatement(BoundYieldReturnStatement original, Statement rewritten) {
        return instrumentStatement(original, rewritten);
    }

    /**
     * Create a statement associated with the open brace of a block.
     * @return the statement to emit before the block's content, empty if there is none
     */
    public Optional<Statement> createBlockPrologue(BoundBlock original) {
        assertUserWritten(original, SyntaxKind.BLOCK);
        return Optional.empty();
    }

    /**
     * Create a statement associated with the close brace of a block.
     * @return the statement to emit after the block's content, empty if there is none
     */
    public Optional<Statement> createBlockEpilogue(BoundBlock original) {
        assertUserWritten(original, SyntaxKind.BLOCK);
        return Optional.empty();
    }

    public Statement instrumentThrowStatement(BoundThrowStatement original, Statement rewritten) {
        return instrumentStatement(original, rewritten);
    }

    public Statement instrumentContinueStatement(BoundContinueStatement original, Statement rewritten) {
        return instrumentStatement(original, rewritten);
    }

    public Statement instrumentGotoStatement(BoundGotoStatement original, Statement rewritten) {
        return instrumentStatement(original, rewritten);
    }

    public Statement instrumentExpressionStatement(BoundExpressionStatement original, Statement rewritten) {
        return instrumentStatement(original, rewritten);
    }

    public Statement instrumentFieldOrPropertyInitializer(BoundExpressionStatement original, Statement rewritten) {
        assert LoweringSyntax.isFieldOrPropertyInitializer(original) : "not an initializer " + original;
        return instrumentStatement(original, rewritten);
    }

    public Statement instrumentBreakStatement(BoundBreakStatement original, Statement rewritten) {
        return instrumentStatement(original, rewritten);
    }

    public Expression instrumentDoStatementCondition(BoundDoStatement original, Expression rewrittenCondition,
                                                     SyntheticNodeFactory factory) {
        assertUserWritten(original, SyntaxKind.DO_STATEMENT);
        assert factory != null;
        return rewrittenCondition;
    }

    public Expression instrumentWhileStatementCondition(BoundWhileStatement original, Expression rewrittenCondition,
                                                        SyntheticNodeFactory factory) {
        assertUserWritten(original, SyntaxKind.WHILE_STATEMENT);
        assert factory != null;
        return rewrittenCondition;
    }

    public Expression instrumentForStatementCondition(BoundForStatement original, Expression rewrittenCondition,
                                                      SyntheticNodeFactory factory) {
        assertUserWritten(original, SyntaxKind.FOR_STATEMENT);
        assert factory != null;
        return rewrittenCondition;
    }

    /**
     * The conditional branch back to the start of the loop body, {@code if (condition) goto start}.
     */
    public Statement instrumentDoStatementConditionalGotoStart(BoundDoStatement original, Statement ifConditionGotoStart) {
        assertUserWritten(original, SyntaxKind.DO_STATEMENT);
        return ifConditionGotoStart;
    }

    public Statement instrumentWhileStatementConditionalGotoStart(BoundWhileStatement original, Statement ifConditionGotoStart) {
        assertUserWritten(original, SyntaxKind.WHILE_STATEMENT);
        return ifConditionGotoStart;
    }

    public Statement instrumentForStatementConditionalGotoStart(BoundForStatement original, Statement branchBack) {
        assertUserWritten(original, SyntaxKind.FOR_STATEMENT);
        return branchBack;
    }

    /**
     * The jump past the end of the loop.
     */
    public Statement instrumentDoStatementGotoEnd(BoundDoStatement original, Statement gotoEnd) {
        assertUserWritten(original, SyntaxKind.DO_STATEMENT);
        return gotoEnd;
    }

    public Statement instrumentWhileStatementGotoEnd(BoundWhileStatement original, Statement gotoEnd) {
        assertUserWritten(original, SyntaxKind.WHILE_STATEMENT);
        return gotoEnd;
    }

    public Statement instrumentForStatementGotoEnd(BoundForStatement original, Statement gotoEnd) {
        assertUserWritten(original, SyntaxKind.FOR_STATEMENT);
        return gotoEnd;
    }

    /**
     * The jump to the point where the loop condition is evaluated again.
     */
    public Statement instrumentDoStatementGotoContinue(BoundDoStatement original, Statement gotoContinue) {
        assertUserWritten(original, SyntaxKind.DO_STATEMENT);
        return gotoContinue;
    }

    public Statement instrumentWhileStatementGotoContinue(BoundWhileStatement original, Statement gotoContinue) {
        assertUserWritten(original, SyntaxKind.WHILE_STATEMENT);
        return gotoContinue;
    }

    public Statement instrumentForStatementGotoContinue(BoundForStatement original, Statement gotoContinue) {
        assertUserWritten(original, SyntaxKind.FOR_STATEMENT);
        return gotoContinue;
    }

    /**
     * The declaration of the temporary that holds the collection being iterated.
     */
    public Statement instrumentForEachStatementCollectionVarDeclaration(BoundForEachStatement original,
                                                                       Statement collectionVarDecl) {
        assertUserWritten(original, SyntaxKind.FOR_EACH_STATEMENT);
        return collectionVarDecl;
    }

    /**
     * The declaration of the iteration variable, assigned from the current element.
     */
    public Statement instrumentForEachStatementIterationVarDeclaration(BoundForEachStatement original,
                                                                      Statement iterationVarDecl) {
        assertUserWritten(original, SyntaxKind.FOR_EACH_STATEMENT);
        return iterationVarDecl;
    }

    public Statement instrumentForEachStatementConditionalGotoStart(BoundForEachStatement original, Statement branchBack) {
        assertUserWritten(original, SyntaxKind.FOR_EACH_STATEMENT);
        return branchBack;
    }

    public Statement instrumentForEachStatementGotoEnd(BoundForEachStatement original, Statement gotoEnd) {
        assertUserWritten(original, SyntaxKind.FOR_EACH_STATEMENT);
        return gotoEnd;
    }

    public Statement instrumentForEachStatementGotoContinue(BoundForEachStatement original, Statement gotoContinue) {
        assertUserWritten(original, SyntaxKind.FOR_EACH_STATEMENT);
        return gotoContinue;
    }

    public Statement instrumentForEachStatement(BoundForEachStatement original, Statement rewritten) {
        assert isKind(original, SyntaxKind.FOR_EACH_STATEMENT);
        return instrumentStatement(original, rewritten);
    }

    public Statement instrumentIfStatement(BoundIfStatement original, Statement rewritten) {
        assert isKind(original, SyntaxKind.IF_STATEMENT);
        return instrumentStatement(original, rewritten);
    }

    public Expression instrumentIfStatementCondition(BoundIfStatement original, Expression rewrittenCondition,
                                                     SyntheticNodeFactory factory) {
        assertUserWritten(original, SyntaxKind.IF_STATEMENT);
        assert factory != null;
        return rewrittenCondition;
    }

    public Statement instrumentLabelStatement(BoundLabeledStatement original, Statement rewritten) {
        assert isKind(original, SyntaxKind.LABELED_STATEMENT);
        return instrumentStatement(original, rewritten);
    }

    /**
     * The initialization of one local. Declarations with several declarators are split by lowering,
     * so the syntax is either that declarator or a declaration statement with a single variable.
     */
    public Statement instrumentLocalInitialization(BoundLocalDeclaration original, Statement rewritten) {
        assert isSingleVariableDeclaration(original.getSyntax()) : "not a single declarator " + original;
        return instrumentStatement(original, rewritten);
    }

    private static boolean isSingleVariableDeclaration(SyntaxNode syntax) {
        if (syntax.isKind(SyntaxKind.VARIABLE_DECLARATOR)) {
            return true;
        }
        return syntax instanceof LocalDeclarationStatementSyntax local && local.getVariables().size() == 1;
    }

    public Statement instrumentLockTargetCapture(BoundLockStatement original, Statement lockTargetCapture) {
        assertUserWritten(original, SyntaxKind.LOCK_STATEMENT);
        return lockTargetCapture;
    }

    /**
     * No precondition: lowering synthesizes implicit returns, so the original may be compiler generated.
     */
    public Statement instrumentReturnStatement(BoundReturnStatement original, Statement rewritten) {
        return rewritten;
    }

    public Statement instrumentSwitchStatement(BoundSwitchStatement original, Statement rewritten) {
        assert isKind(original, SyntaxKind.SWITCH_STATEMENT);
        return instrumentStatement(original, rewritten);
    }

    public Expression instrumentSwitchStatementExpression(BoundSwitchStatement original, Expression rewrittenExpression,
                                                          SyntheticNodeFactory factory) {
        assertUserWritten(original, SyntaxKind.SWITCH_STATEMENT);
        assert factory != null;
        return rewrittenExpression;
    }

    public Statement instrumentUsingTargetCapture(BoundUsingStatement original, Statement usingTargetCapture) {
        assertUserWritten(original, SyntaxKind.USING_STATEMENT);
        return usingTargetCapture;
    }

    public Expression instrumentCatchClauseFilter(BoundCatchBlock original, Expression rewrittenFilter,
                                                  SyntheticNodeFactory factory) {
        assertUserWritten(original, SyntaxKind.CATCH_CLAUSE);
        assert original.getSyntax() instanceof CatchClauseSyntax clause && clause.getFilter().isPresent()
                : "catch clause without a filter " + original;
        assert factory != null;
        return rewrittenFilter;
    }
}
