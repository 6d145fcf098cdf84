package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One {@code function} record of the batch JSONL output.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FunctionReport {
    public String kind = "function";
    public String file;
    public String language;
    public FunctionInfo function;
    public GraphStatistics statistics;
    public ParameterAnalysis parameters;
    public Map<String, Graph> graphs;

    public void addGraph(Graph graph) {
        if (graphs == null) {
            graphs = new LinkedHashMap<>();
        }
        graphs.put(graph.getKind().name().toLowerCase(), graph);
    }
}
