package sa.com.cloudsolutions.lowering.syntax;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.stmt.TryStmt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestSyntaxTrees {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "{ }                                   | BLOCK",
        ";                                     | EMPTY_STATEMENT",
        "foo();                                | EXPRESSION_STATEMENT",
        "int a = 1;                            | LOCAL_DECLARATION_STATEMENT",
        "if (x) { }                            | IF_STATEMENT",
        "do { } while (x);                     | DO_STATEMENT",
        "while (x) { }                         | WHILE_STATEMENT",
        "for (int i = 0; i < n; i++) { }       | FOR_STATEMENT",
        "for (String s : names) { }            | FOR_EACH_STATEMENT",
        "synchronized (lock) { }               | LOCK_STATEMENT",
        "try (Reader r = open()) { }           | USING_STATEMENT",
        "try { } finally { }                   | TRY_STATEMENT",
        "outer: while (x) { }                  | LABELED_STATEMENT",
        "switch (x) { default: break; }        | SWITCH_STATEMENT",
        "return;                               | RETURN_STATEMENT",
        "throw e;                              | THROW_STATEMENT",
        "break;                                | BREAK_STATEMENT",
        "continue;                             | CONTINUE_STATEMENT"
    })
    void testStatementKinds(String code, SyntaxKind kind) {
        SyntaxNode syntax = SyntaxTrees.parseStatement(code);
        assertEquals(kind, syntax.getKind());
        assertTrue(syntax.getNode().isPresent());
        assertTrue(syntax.getRange().isPresent());
    }

    @Test
    void testLocalDeclarationVariables() {
        SyntaxNode syntax = SyntaxTrees.parseStatement("int a = 1, b = 2;");
        LocalDeclarationStatementSyntax local = assertInstanceOf(LocalDeclarationStatementSyntax.class, syntax);
        assertEquals(List.of("a", "b"), local.getVariables());
    }

    @Test
    void testJavaCatchClauseHasNoFilter() {
        TryStmt tryStmt = (TryStmt) StaticJavaParser.parseStatement("try { } catch (Exception e) { }");
        SyntaxNode syntax = SyntaxTrees.of(tryStmt.getCatchClauses().get(0));

        CatchClauseSyntax clause = assertInstanceOf(CatchClauseSyntax.class, syntax);
        assertTrue(clause.getFilter().isEmpty());
        assertTrue(clause.getParent().isPresent());
        assertEquals(SyntaxKind.TRY_STATEMENT, clause.getParent().get().getKind());
    }

    @Test
    void testParentsFollowJavaParserTree() {
        CompilationUnit cu = StaticJavaParser.parse("class A { int x = 5; }");
        VariableDeclarator declarator = cu.findFirst(VariableDeclarator.class).orElseThrow();

        SyntaxNode init = SyntaxTrees.of(declarator.getInitializer().orElseThrow());
        assertTrue(init.getKind().isExpression());

        SyntaxNode parent = init.getParent().orElseThrow();
        assertEquals(SyntaxKind.VARIABLE_DECLARATOR, parent.getKind());
        assertEquals(SyntaxKind.FIELD_DECLARATION, parent.getParent().orElseThrow().getKind());
    }

    @Test
    void testDetachedSyntax() {
        SyntaxNode method = SyntaxTrees.detached(SyntaxKind.METHOD_DECLARATION);
        SyntaxNode yield = SyntaxTrees.detached(SyntaxKind.YIELD_BREAK_STATEMENT, method);

        assertTrue(yield.getNode().isEmpty());
        assertTrue(yield.getRange().isEmpty());
        assertEquals(method, yield.getParent().orElseThrow());
        assertFalse(method.getParent().isPresent());
    }

    @Test
    void testFilteredCatchClause() {
        CatchClauseSyntax clause = SyntaxTrees.catchClause(StaticJavaParser.parseExpression("e.isTransient()"));
        assertTrue(clause.isKind(SyntaxKind.CATCH_CLAUSE));
        assertEquals("e.isTransient()", clause.getFilter().orElseThrow().toString());
    }
}
