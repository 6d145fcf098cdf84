package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Nodes and edges of one dependence view. The serialized field set and order are fixed.
 */
@JsonPropertyOrder({"graph_type", "nodes", "edges", "node_count", "edge_count"})
public final class Graph {

    private final GraphKind kind;
    private final List<Statement> nodes;
    private final List<Edge> edges;
    private final Map<Integer, Statement> byId = new LinkedHashMap<>();

    public Graph(GraphKind kind, List<Statement> nodes, List<Edge> edges) {
        this.kind = kind;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        for (Statement node : nodes) {
            byId.put(node.getId(), node);
        }
    }

    @JsonProperty("graph_type")
    public GraphKind getKind() {
        return kind;
    }

    public List<Statement> getNodes() {
        return nodes;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    @JsonProperty("node_count")
    public int getNodeCount() {
        return nodes.size();
    }

    @JsonProperty("edge_count")
    public int getEdgeCount() {
        return edges.size();
    }

    public Optional<Statement> node(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<Edge> edgesOfKind(EdgeKind edgeKind) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getKind() == edgeKind) result.add(edge);
        }
        return result;
    }
}
