package org.dxworks.codeslice.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codeslice.Language;
import org.dxworks.codeslice.analyzer.FunctionAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.dxworks.codeslice.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.*;

class GraphSerializationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> it = node.fieldNames();
        it.forEachRemaining(names::add);
        return names;
    }

    @Test
    void graphFieldsAndOrder() throws Exception {
        FunctionGraphs graphs = new FunctionAnalyzer().analyze(sample("c/scenario_a.c"), "f", Language.C);
        JsonNode json = MAPPER.valueToTree(graphs.getPdg());

        assertEquals(List.of("graph_type", "nodes", "edges", "node_count", "edge_count"), fieldNames(json));
        assertEquals("PDG", json.get("graph_type").asText());
        assertEquals(8, json.get("node_count").asInt());
        assertEquals(9, json.get("edge_count").asInt());

        JsonNode node = json.get("nodes").get(0);
        assertEquals(List.of("id", "type", "text", "line", "defs", "uses"), fieldNames(node));
        assertEquals(1, node.get("id").asInt());
        assertEquals("decl", node.get("type").asText());
        assertEquals("int x = a + 1;", node.get("text").asText());
        assertEquals(4, node.get("line").asInt());
        assertEquals("x", node.get("defs").get(0).asText());
        assertEquals("a", node.get("uses").get(0).asText());

        JsonNode edge = json.get("edges").get(0);
        assertEquals(List.of("source_id", "target_id", "label", "type"), fieldNames(edge));
        assertEquals(1, edge.get("source_id").asInt());
        assertEquals(3, edge.get("target_id").asInt());
        assertEquals("DDG", edge.get("type").asText());
    }

    @Test
    void sliceResultFields() throws Exception {
        FunctionAnalyzer analyzer = new FunctionAnalyzer();
        FunctionGraphs graphs = analyzer.analyze(sample("c/scenario_a.c"), "f", Language.C);
        JsonNode json = MAPPER.valueToTree(analyzer.slice(graphs, "z", 6, SliceType.BOTH));

        assertEquals(List.of("variable", "line", "slice_type", "lines"), fieldNames(json));
        assertEquals("both", json.get("slice_type").asText());
        assertEquals("backward", json.get("lines").get(0).get("provenance").asText());
    }

    @Test
    void parameterReportFields() throws Exception {
        FunctionAnalyzer analyzer = new FunctionAnalyzer();
        JsonNode json = MAPPER.valueToTree(analyzer.parameters(analyzer.analyze(sample("c/params.c"), "g", Language.C)));

        assertEquals("g", json.get("function_name").asText());
        JsonNode a = json.get("parameters").get(0);
        assertEquals("a", a.get("parameter_name").asText());
        assertTrue(a.get("affects_return").asBoolean());
        assertEquals(5, a.get("shared_lines").get("b").get(0).asInt());
        assertTrue(json.has("return_lines"));
    }

    @Test
    void statisticsCountDependences() throws Exception {
        FunctionGraphs graphs = new FunctionAnalyzer().analyze(sample("c/scenario_a.c"), "f", Language.C);
        GraphStatistics statistics = GraphStatistics.of(graphs.getPdg());

        assertEquals(8, statistics.nodes);
        assertEquals(1, statistics.controlDependencies);
        assertEquals(8, statistics.dataDependencies);
        assertEquals(9, statistics.totalDependencies);
    }
}
