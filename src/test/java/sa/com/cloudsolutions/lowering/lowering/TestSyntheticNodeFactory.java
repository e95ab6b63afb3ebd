package sa.com.cloudsolutions.lowering.lowering;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TestSyntheticNodeFactory {

    @Test
    void testTempsAreUnique() {
        SyntheticNodeFactory factory = new SyntheticNodeFactory("compute");
        assertEquals("$temp0", factory.temp().getNameAsString());
        assertEquals("$temp1", factory.temp().getNameAsString());
        assertEquals(2, factory.getTempCount());
        assertEquals("$temp0", new SyntheticNodeFactory("other").temp().getNameAsString());
    }

    @Test
    void testBuilders() {
        SyntheticNodeFactory factory = new SyntheticNodeFactory("compute");

        assertEquals("Trace.enter(1)", factory.staticCall("Trace", "enter", factory.literal(1)).toString());
        assertEquals("hits[3]++", factory.increment(factory.arrayElement("hits", 3)).toString());
        assertEquals("$temp0 = x", factory.assignment(factory.temp(), StaticJavaParser.parseExpression("x")).toString());

        BlockStmt list = factory.statementList(
                factory.expressionStatement(StaticJavaParser.parseExpression("a()")),
                StaticJavaParser.parseStatement("b();"));
        assertEquals(2, list.getStatements().size());
        assertEquals("a();", list.getStatement(0).toString());
    }
}
