package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

@JsonPropertyOrder({"source_id", "target_id", "label", "type"})
public final class Edge {

    private final int source;
    private final int target;
    private final String label;
    private final EdgeKind kind;
    // variables inducing a DDG edge
    private final SortedSet<String> variables;

    public Edge(int source, int target, String label, EdgeKind kind) {
        this(source, target, label, kind, Collections.emptySet());
    }

    public Edge(int source, int target, String label, EdgeKind kind, Collection<String> variables) {
        this.source = source;
        this.target = target;
        this.label = label == null ? "" : label;
        this.kind = kind;
        this.variables = Collections.unmodifiableSortedSet(new TreeSet<>(variables));
    }

    @JsonProperty("source_id")
    public int getSource() {
        return source;
    }

    @JsonProperty("target_id")
    public int getTarget() {
        return target;
    }

    public String getLabel() {
        return label;
    }

    @JsonProperty("type")
    public EdgeKind getKind() {
        return kind;
    }

    @JsonIgnore
    public SortedSet<String> getVariables() {
        return variables;
    }

    public boolean carries(String variable) {
        return variables.contains(variable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge other = (Edge) o;
        return source == other.source && target == other.target
                && label.equals(other.label) && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, label, kind);
    }

    @Override
    public String toString() {
        return kind + " " + source + " -> " + target + (label.isEmpty() ? "" : " [" + label + "]");
    }
}
