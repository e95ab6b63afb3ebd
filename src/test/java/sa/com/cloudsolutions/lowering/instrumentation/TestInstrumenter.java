package sa.com.cloudsolutions.lowering.instrumentation;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.TryStmt;
import org.junit.jupiter.api.Test;
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
import sa.com.cloudsolutions.lowering.syntax.SyntaxNode;
import sa.com.cloudsolutions.lowering.syntax.SyntaxTrees;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestInstrumenter {
    private final Instrumenter instrumenter = Instrumenter.NO_OP;
    private final SyntheticNodeFactory factory = new SyntheticNodeFactory("run");

    private static Statement rewritten() {
        return StaticJavaParser.parseStatement("$temp0 = x;");
    }

    private static Expression condition() {
        return StaticJavaParser.parseExpression("x > 0");
    }

    private static SyntaxNode syntax(String code) {
        return SyntaxTrees.parseStatement(code);
    }

    @Test
    void testSimpleStatementsAreReturnedUnchanged() {
        Statement s = rewritten();
        assertSame(s, instrumenter.instrumentNoOpStatement(new BoundNoOpStatement(syntax(";")), s));
        assertSame(s, instrumenter.instrumentThrowStatement(new BoundThrowStatement(syntax("throw e;")), s));
        assertSame(s, instrumenter.instrumentContinueStatement(new BoundContinueStatement(syntax("continue;")), s));
        assertSame(s, instrumenter.instrumentBreakStatement(new BoundBreakStatement(syntax("break;")), s));
        assertSame(s, instrumenter.instrumentExpressionStatement(new BoundExpressionStatement(syntax("x = 1;")), s));
        assertSame(s, instrumenter.instrumentGotoStatement(
                new BoundGotoStatement(SyntaxTrees.detached(SyntaxKind.GOTO_STATEMENT), "done"), s));
        assertSame(s, instrumenter.instrumentYieldReturnStatement(
                new BoundYieldReturnStatement(SyntaxTrees.detached(SyntaxKind.YIELD_RETURN_STATEMENT)), s));
        assertSame(s, instrumenter.instrumentYieldBreakStatement(
                new BoundYieldBreakStatement(SyntaxTrees.detached(SyntaxKind.YIELD_BREAK_STATEMENT)), s));
        assertSame(s, instrumenter.instrumentReturnStatement(new BoundReturnStatement(syntax("return 1;"), null), s));
    }

    @Test
    void testCompoundStatementsAreReturnedUnchanged() {
        Statement s = rewritten();
        assertSame(s, instrumenter.instrumentIfStatement(new BoundIfStatement(syntax("if (x) { }")), s));
        assertSame(s, instrumenter.instrumentLabelStatement(new BoundLabeledStatement(syntax("outer: while (x) { }")), s));
        assertSame(s, instrumenter.instrumentSwitchStatement(
                new BoundSwitchStatement(syntax("switch (x) { default: break; }")), s));
        assertSame(s, instrumenter.instrumentLockTargetCapture(
                new BoundLockStatement(syntax("synchronized (lock) { }")), s));
        assertSame(s, instrumenter.instrumentUsingTargetCapture(
                new BoundUsingStatement(syntax("try (Reader r = open()) { }")), s));
        assertSame(s, instrumenter.instrumentLocalInitialization(new BoundLocalDeclaration(syntax("int a = 1;")), s));
    }

    @Test
    void testLoopScaffoldingIsReturnedUnchanged() {
        Statement s = rewritten();
        BoundDoStatement doStmt = new BoundDoStatement(syntax("do { } while (x);"));
        BoundWhileStatement whileStmt = new BoundWhileStatement(syntax("while (x) { }"));
        BoundForStatement forStmt = new BoundForStatement(syntax("for (int i = 0; i < n; i++) { }"));
        BoundForEachStatement forEach = new BoundForEachStatement(syntax("for (String s : names) { }"));

        assertSame(s, instrumenter.instrumentDoStatementConditionalGotoStart(doStmt, s));
        assertSame(s, instrumenter.instrumentDoStatementGotoEnd(doStmt, s));
        assertSame(s, instrumenter.instrumentDoStatementGotoContinue(doStmt, s));
        assertSame(s, instrumenter.instrumentWhileStatementConditionalGotoStart(whileStmt, s));
        assertSame(s, instrumenter.instrumentWhileStatementGotoEnd(whileStmt, s));
        assertSame(s, instrumenter.instrumentWhileStatementGotoContinue(whileStmt, s));
        assertSame(s, instrumenter.instrumentForStatementConditionalGotoStart(forStmt, s));
        assertSame(s, instrumenter.instrumentForStatementGotoEnd(forStmt, s));
        assertSame(s, instrumenter.instrumentForStatementGotoContinue(forStmt, s));

        assertSame(s, instrumenter.instrumentForEachStatementCollectionVarDeclaration(forEach, s));
        assertSame(s, instrumenter.instrumentForEachStatementIterationVarDeclaration(forEach, s));
        assertSame(s, instrumenter.instrumentForEachStatementConditionalGotoStart(forEach, s));
        assertSame(s, instrumenter.instrumentForEachStatementGotoEnd(forEach, s));
        assertSame(s, instrumenter.instrumentForEachStatementGotoContinue(forEach, s));
        assertSame(s, instrumenter.instrumentForEachStatement(forEach, s));
    }

    @Test
    void testConditionsAreReturnedUnchanged() {
        Expression e = condition();
        assertSame(e, instrumenter.instrumentDoStatementCondition(new BoundDoStatement(syntax("do { } while (x);")), e, factory));
        assertSame(e, instrumenter.instrumentWhileStatementCondition(new BoundWhileStatement(syntax("while (x) { }")), e, factory));
        assertSame(e, instrumenter.instrumentForStatementCondition(
                new BoundForStatement(syntax("for (;;) { }")), e, factory));
        assertSame(e, instrumenter.instrumentIfStatementCondition(new BoundIfStatement(syntax("if (x) { }")), e, factory));
        assertSame(e, instrumenter.instrumentSwitchStatementExpression(
                new BoundSwitchStatement(syntax("switch (x) { }")), e, factory));
        assertSame(e, instrumenter.instrumentCatchClauseFilter(
                new BoundCatchBlock(SyntaxTrees.catchClause(StaticJavaParser.parseExpression("e.isTransient()"))), e, factory));
    }

    @Test
    void testBlockPrologueAndEpilogueAreEmpty() {
        BoundBlock block = new BoundBlock(syntax("{ int a = 1; }"));
        assertTrue(instrumenter.createBlockPrologue(block).isEmpty());
        assertTrue(instrumenter.createBlockEpilogue(block).isEmpty());
    }

    @Test
    void testFieldInitializer() {
        CompilationUnit cu = StaticJavaParser.parse("class A { int x = 5; }");
        Expression init = cu.findFirst(VariableDeclarator.class).orElseThrow().getInitializer().orElseThrow();
        Statement s = rewritten();

        assertSame(s, instrumenter.instrumentFieldOrPropertyInitializer(new BoundExpressionStatement(SyntaxTrees.of(init)), s));
        assertThrows(AssertionError.class, () ->
                instrumenter.instrumentFieldOrPropertyInitializer(new BoundExpressionStatement(syntax("x = 5;")), s));
    }

    @Test
    void testIfConditionRequiresIfStatement() {
        BoundIfStatement notAnIf = new BoundIfStatement(syntax("while (x) { }"));
        assertThrows(AssertionError.class, () -> instrumenter.instrumentIfStatementCondition(notAnIf, condition(), factory));
    }

    @Test
    void testConditionRequiresFactory() {
        BoundWhileStatement loop = new BoundWhileStatement(syntax("while (x) { }"));
        assertThrows(AssertionError.class, () -> instrumenter.instrumentWhileStatementCondition(loop, condition(), null));
    }

    @Test
    void testCompilerGeneratedStatementsAreRejected() {
        BoundBreakStatement generated = new BoundBreakStatement(syntax("break;"), true);
        assertThrows(AssertionError.class, () -> instrumenter.instrumentBreakStatement(generated, rewritten()));

        BoundWhileStatement loop = new BoundWhileStatement(syntax("while (x) { }"), true);
        assertThrows(AssertionError.class, () -> instrumenter.instrumentWhileStatementGotoContinue(loop, rewritten()));

        BoundBlock block = new BoundBlock(syntax("{ }"), true);
        assertThrows(AssertionError.class, () -> instrumenter.createBlockPrologue(block));
    }

    @Test
    void testGeneratedReturnIsAllowed() {
        BoundReturnStatement implicit = new BoundReturnStatement(syntax("{ foo(); }"), null, true);
        Statement s = rewritten();
        assertSame(s, instrumenter.instrumentReturnStatement(implicit, s));
    }

    @Test
    void testGeneratedYieldBreakOnlyForBlocks() {
        Statement s = rewritten();
        BoundYieldBreakStatement implicit = new BoundYieldBreakStatement(syntax("{ }"), true);
        assertSame(s, instrumenter.instrumentYieldBreakStatement(implicit, s));

        BoundYieldBreakStatement misplaced = new BoundYieldBreakStatement(
                SyntaxTrees.detached(SyntaxKind.YIELD_BREAK_STATEMENT), true);
        assertThrows(AssertionError.class, () -> instrumenter.instrumentYieldBreakStatement(misplaced, s));
    }

    @Test
    void testBlockPrologueRequiresBlock() {
        BoundBlock notABlock = new BoundBlock(syntax("x = 1;"));
        assertThrows(AssertionError.class, () -> instrumenter.createBlockEpilogue(notABlock));
    }

    @Test
    void testCatchFilterMustBePresent() {
        TryStmt tryStmt = (TryStmt) StaticJavaParser.parseStatement("try { } catch (Exception e) { }");
        BoundCatchBlock unfiltered = new BoundCatchBlock(SyntaxTrees.of(tryStmt.getCatchClauses().get(0)));
        assertThrows(AssertionError.class, () -> instrumenter.instrumentCatchClauseFilter(unfiltered, condition(), factory));
    }

    @Test
    void testLocalInitializationNeedsSingleVariable() {
        Statement s = rewritten();
        BoundLocalDeclaration declarator = new BoundLocalDeclaration(SyntaxTrees.detached(SyntaxKind.VARIABLE_DECLARATOR));
        assertDoesNotThrow(() -> instrumenter.instrumentLocalInitialization(declarator, s));

        BoundLocalDeclaration single = new BoundLocalDeclaration(SyntaxTrees.localDeclaration(List.of("a")));
        assertSame(s, instrumenter.instrumentLocalInitialization(single, s));

        BoundLocalDeclaration multiple = new BoundLocalDeclaration(syntax("int a = 1, b = 2;"));
        assertThrows(AssertionError.class, () -> instrumenter.instrumentLocalInitialization(multiple, s));
    }

    @Test
    void testForEachChecksSyntaxKind() {
        BoundForEachStatement notForEach = new BoundForEachStatement(syntax("for (;;) { }"));
        assertThrows(AssertionError.class, () -> instrumenter.instrumentForEachStatement(notForEach, rewritten()));
        assertThrows(AssertionError.class, () -> instrumenter.instrumentForEachStatementGotoEnd(notForEach, rewritten()));
    }

    @Test
    void testStatementHooksCheckSyntaxKind() {
        Statement s = rewritten();
        SyntaxNode loop = syntax("while (x) { }");

        assertThrows(AssertionError.class, () -> instrumenter.instrumentLockTargetCapture(new BoundLockStatement(loop), s));
        assertThrows(AssertionError.class, () ->
                instrumenter.instrumentUsingTargetCapture(new BoundUsingStatement(syntax("try { } finally { }")), s));
        assertThrows(AssertionError.class, () -> instrumenter.instrumentSwitchStatement(new BoundSwitchStatement(loop), s));
        assertThrows(AssertionError.class, () -> instrumenter.instrumentLabelStatement(new BoundLabeledStatement(loop), s));
    }

    @Test
    void testConditionHooksCheckSyntaxKind() {
        SyntaxNode ifStmt = syntax("if (x) { }");

        assertThrows(AssertionError.class, () ->
                instrumenter.instrumentSwitchStatementExpression(new BoundSwitchStatement(ifStmt), condition(), factory));
        assertThrows(AssertionError.class, () ->
                instrumenter.instrumentDoStatementCondition(new BoundDoStatement(ifStmt), condition(), factory));
        assertThrows(AssertionError.class, () ->
                instrumenter.instrumentForStatementCondition(new BoundForStatement(ifStmt), condition(), factory));
    }

    @Test
    void testGeneratedIfStatementIsRejected() {
        BoundIfStatement generated = new BoundIfStatement(syntax("if (x) { }"), true);
        assertThrows(AssertionError.class, () -> instrumenter.instrumentIfStatement(generated, rewritten()));
    }
}
