package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.Language;
import org.dxworks.codeslice.model.Edge;
import org.dxworks.codeslice.model.EdgeKind;
import org.dxworks.codeslice.model.FunctionGraphs;
import org.dxworks.codeslice.model.Graph;
import org.dxworks.codeslice.model.Statement;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.dxworks.codeslice.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.*;

class DependenceBuilderTest {

    private final FunctionAnalyzer analyzer = new FunctionAnalyzer();

    private static Edge control(int source, int target, String label) {
        return new Edge(source, target, label, EdgeKind.CDG);
    }

    private static Edge data(int source, int target) {
        return new Edge(source, target, "", EdgeKind.DDG);
    }

    @Test
    void controlDependenceFollowsNesting() throws Exception {
        Graph cdg = analyzer.analyze(sample("c/scenario_a.c"), "f", Language.C).getCdg();
        assertEquals(List.of(control(5, 6, "true")), cdg.getEdges());
    }

    @Test
    void loopBodyDependsOnTheHeaderNotOnEarlierStatements() throws Exception {
        Graph cdg = analyzer.analyze(sample("c/control.c"), "skip_odd", Language.C).getCdg();
        assertEquals(List.of(
                control(2, 3, "true"), control(2, 5, "true"), control(3, 4, "true")), cdg.getEdges());
    }

    @Test
    void switchCasesDependOnTheSwitch() throws Exception {
        Graph cdg = analyzer.analyze(sample("c/control.c"), "classify", Language.C).getCdg();
        assertEquals(List.of(
                control(2, 3, "case 1"), control(2, 6, "case 2"), control(2, 7, "case 3"),
                control(3, 4, ""), control(3, 5, ""), control(7, 8, ""), control(7, 9, "")), cdg.getEdges());
    }

    @Test
    void reachingDefinitionsThroughBranches() throws Exception {
        Graph ddg = analyzer.analyze(sample("c/scenario_a.c"), "f", Language.C).getDdg();

        assertEquals(List.of(
                data(1, 3), data(2, 3), data(3, 4), data(4, 5), data(4, 6), data(4, 7),
                data(6, 7), data(7, 8)), ddg.getEdges());
        assertTrue(ddg.getEdges().get(0).carries("x"));
        assertTrue(ddg.getEdges().get(5).carries("result"));
    }

    @Test
    void loopCarriedDefinitionsReachTheHeader() throws Exception {
        Graph ddg = analyzer.analyze(sample("c/sum_loop.c"), "sum", Language.C).getDdg();

        assertEquals(List.of(
                data(1, 4), data(1, 6), data(2, 3), data(2, 4), data(2, 5),
                data(4, 6), data(5, 3), data(5, 4)), ddg.getEdges());
    }

    @Test
    void everyDataEdgeIsSoundAgainstDefsAndUses() throws Exception {
        FunctionGraphs graphs = analyzer.analyze(sample("c/control.c"), "skip_odd", Language.C);
        for (Edge edge : graphs.getDdg().getEdges()) {
            Statement source = graphs.statement(edge.getSource());
            Statement target = graphs.statement(edge.getTarget());
            assertFalse(edge.getVariables().isEmpty());
            for (String variable : edge.getVariables()) {
                assertTrue(source.getDefs().contains(variable), edge + " source does not define " + variable);
                assertTrue(target.getUses().contains(variable), edge + " target does not use " + variable);
            }
        }
    }

    @Test
    void programDependenceIsTheUnionOfBoth() throws Exception {
        FunctionGraphs graphs = analyzer.analyze(sample("c/sum_loop.c"), "sum", Language.C);
        Set<Edge> expected = new HashSet<>(graphs.getCdg().getEdges());
        expected.addAll(graphs.getDdg().getEdges());

        assertEquals(expected, new HashSet<>(graphs.getPdg().getEdges()));
        assertEquals(expected.size(), graphs.getPdg().getEdgeCount());
        assertEquals(graphs.getStatements(), graphs.getPdg().getNodes());
    }

    @Test
    void graphsAreDeterministic() throws Exception {
        FunctionGraphs first = analyzer.analyze(sample("c/control.c"), "classify", Language.C);
        FunctionGraphs second = analyzer.analyze(sample("c/control.c"), "classify", Language.C);

        assertEquals(first.getCfg().getEdges(), second.getCfg().getEdges());
        assertEquals(first.getPdg().getEdges(), second.getPdg().getEdges());
    }
}
