package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.Language;
import org.dxworks.codeslice.model.FunctionGraphs;
import org.dxworks.codeslice.model.Statement;
import org.dxworks.codeslice.model.StatementKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.dxworks.codeslice.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.*;

class StatementCollectorTest {

    private final FunctionAnalyzer analyzer = new FunctionAnalyzer();

    @Test
    void statementsAreNumberedFromOneInSourceOrder() throws Exception {
        List<Statement> statements = analyzer.analyze(sample("c/scenario_a.c"), "f", Language.C).getStatements();

        assertEquals(8, statements.size());
        for (int i = 0; i < statements.size(); i++) {
            assertEquals(i + 1, statements.get(i).getId());
        }
        Statement predicate = statements.get(4);
        assertEquals(StatementKind.IF, predicate.getKind());
        assertEquals("if (result > 10)", predicate.getText());
        assertEquals(9, predicate.getLine());
        assertEquals(Set.of("result"), predicate.getUses());
        assertTrue(predicate.getDefs().isEmpty());
    }

    @Test
    void declarationsDefineAndReadTheirInitializers() throws Exception {
        Statement x = analyzer.analyze(sample("c/scenario_a.c"), "f", Language.C).statement(1);

        assertEquals(StatementKind.DECL, x.getKind());
        assertEquals("int x = a + 1;", x.getText());
        assertEquals(Set.of("x"), x.getDefs());
        assertEquals(Set.of("a"), x.getUses());
    }

    @Test
    void lvaluesCallsAndInputArguments() throws Exception {
        FunctionGraphs graphs = analyzer.analyze(sample("c/defuse.c"), "io", Language.C);

        Statement uninitialized = graphs.statement(1);
        assertTrue(uninitialized.getDefs().isEmpty());
        assertTrue(uninitialized.getUses().isEmpty());

        Statement scanf = graphs.statement(2);
        assertEquals(StatementKind.CALL, scanf.getKind());
        assertEquals(Set.of("value"), scanf.getDefs());

        Statement subscript = graphs.statement(3);
        assertEquals(Set.of("arr"), subscript.getDefs());
        assertEquals(Set.of("n", "value"), subscript.getUses());

        Statement compound = graphs.statement(4);
        assertEquals(Set.of("p"), compound.getDefs());
        assertEquals(Set.of("arr", "p"), compound.getUses());

        Statement printf = graphs.statement(5);
        assertEquals(StatementKind.CALL, printf.getKind());
        assertTrue(printf.getDefs().isEmpty());
        assertEquals(Set.of("p"), printf.getUses());

        Statement array = graphs.statement(6);
        assertTrue(array.getDefs().isEmpty());
        assertEquals(Set.of("n"), array.getUses());

        Statement increment = graphs.statement(7);
        assertEquals(StatementKind.EXPR, increment.getKind());
        assertEquals(Set.of("value"), increment.getDefs());
        assertEquals(Set.of("value"), increment.getUses());
    }

    @Test
    void loopHeadersCarryTheirInitializerConditionAndUpdate() throws Exception {
        FunctionGraphs graphs = analyzer.analyze(sample("c/control.c"), "skip_odd", Language.C);
        Statement header = graphs.statement(2);

        assertEquals(StatementKind.FOR, header.getKind());
        assertEquals("for (int i = 0; i < limit; i++)", header.getText());
        assertEquals(Set.of("i"), header.getDefs());
        assertEquals(Set.of("i", "limit"), header.getUses());
    }

    @Test
    void doLoopPredicateFollowsItsBody() throws Exception {
        FunctionGraphs graphs = analyzer.analyze(sample("c/control.c"), "count_down", Language.C);
        Statement predicate = graphs.statement(4);

        assertEquals(StatementKind.DO, predicate.getKind());
        assertEquals("while (n > 0)", predicate.getText());
        assertEquals(7, predicate.getLine());
        assertEquals(5, graphs.statement(2).getLine());
    }

    @Test
    void caseLabelsAreStatements() throws Exception {
        FunctionGraphs graphs = analyzer.analyze(sample("c/control.c"), "classify", Language.C);

        assertEquals(10, graphs.getStatements().size());
        assertEquals("switch (code)", graphs.statement(2).getText());
        assertEquals("case 1", graphs.statement(3).getText());
        assertEquals(StatementKind.CASE, graphs.statement(6).getKind());
        assertEquals("case 3", graphs.statement(7).getText());
        assertEquals(StatementKind.BREAK, graphs.statement(9).getKind());
    }

    @Test
    void rangeForDefinesItsLoopVariable() throws Exception {
        FunctionGraphs graphs = analyzer.analyze(sample("cpp/shapes.cpp"), "total", Language.CPP);
        Statement header = graphs.statement(2);

        assertEquals(StatementKind.FOR, header.getKind());
        assertEquals(Set.of("v"), header.getDefs());
        assertEquals(Set.of("values"), header.getUses());
        assertEquals(Set.of("sum"), graphs.statement(3).getDefs());
    }

    @Test
    void gotoIsUnsupported() {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> analyzer.analyze(sample("c/jumps.c"), "k", Language.C));
        assertEquals("goto_statement", e.getNodeKind());
        assertEquals(3, e.getLine());
    }

    @Test
    void labelsAreUnsupported() {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                () -> analyzer.analyze(sample("c/jumps.c"), "h", Language.C));
        assertEquals("labeled_statement", e.getNodeKind());
        assertEquals(12, e.getLine());
    }

    @Test
    void breakOutsideLoopIsRejected() {
        String source = "void stray(void)\n{\n    break;\n}\n";
        assertThrows(UnsupportedConstructException.class, () -> analyzer.analyze(source, "stray", Language.C));
    }

    @Test
    void commentsAndEmptyStatementsAreSkipped() throws Exception {
        String source = "int quiet(int a)\n{\n    // nothing here\n    ;\n    return a;\n}\n";
        List<Statement> statements = analyzer.analyze(source, "quiet", Language.C).getStatements();

        assertEquals(1, statements.size());
        assertEquals(StatementKind.RETURN, statements.get(0).getKind());
        assertEquals(Set.of("a"), statements.get(0).getUses());
    }
}
