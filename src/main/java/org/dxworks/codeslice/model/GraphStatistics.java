package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class GraphStatistics {
    public int nodes;
    @JsonProperty("control_dependencies")
    public int controlDependencies;
    @JsonProperty("data_dependencies")
    public int dataDependencies;
    @JsonProperty("total_dependencies")
    public int totalDependencies;

    public static GraphStatistics of(Graph pdg) {
        GraphStatistics statistics = new GraphStatistics();
        statistics.nodes = pdg.getNodeCount();
        statistics.controlDependencies = pdg.edgesOfKind(EdgeKind.CDG).size();
        statistics.dataDependencies = pdg.edgesOfKind(EdgeKind.DDG).size();
        statistics.totalDependencies = pdg.getEdgeCount();
        return statistics;
    }
}
