package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.model.Construct;
import org.dxworks.codeslice.model.Edge;
import org.dxworks.codeslice.model.EdgeKind;
import org.dxworks.codeslice.model.Graph;
import org.dxworks.codeslice.model.GraphKind;
import org.dxworks.codeslice.model.Statement;
import org.dxworks.codeslice.model.StatementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Control and data dependences of a function body.
 * <p>
 * Control dependence is structural: a statement depends on the innermost predicate whose branch
 * contains it. Data dependence comes from reaching definitions propagated over the CFG to a
 * fixed point, so definitions carried around loop back-edges are found.
 */
public class DependenceBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DependenceBuilder.class);

    private static final Comparator<Edge> EDGE_ORDER = Comparator
            .comparingInt(Edge::getSource)
            .thenComparingInt(Edge::getTarget)
            .thenComparing(Edge::getKind)
            .thenComparing(Edge::getLabel);

    public static Graph controlDependence(List<Statement> nodes, Construct root) {
        List<Edge> edges = new ArrayList<>();
        controlDependence(root.getBody(), null, "", edges);
        edges.sort(EDGE_ORDER);
        return new Graph(GraphKind.CDG, nodes, edges);
    }

    private static void controlDependence(List<Construct> constructs, Statement controller, String label,
                                          List<Edge> edges) {
        for (Construct construct : constructs) {
            controlDependence(construct, controller, label, edges);
        }
    }

    private static void controlDependence(Construct construct, Statement controller, String label,
                                          List<Edge> edges) {
        if (construct.getKind() == StatementKind.COMPOUND) {
            controlDependence(construct.getBody(), controller, label, edges);
            return;
        }

        Statement statement = construct.getStatement();
        if (controller != null) {
            edges.add(new Edge(controller.getId(), statement.getId(), label, EdgeKind.CDG));
        }

        switch (construct.getKind()) {
            case IF:
                controlDependence(construct.getBody(), statement, ControlFlowBuilder.TRUE, edges);
                if (construct.hasAlternative()) {
                    controlDependence(construct.getAlternative(), statement, ControlFlowBuilder.FALSE, edges);
                }
                break;
            case WHILE:
            case FOR:
            case DO:
                controlDependence(construct.getBody(), statement, ControlFlowBuilder.TRUE, edges);
                break;
            case SWITCH:
                for (Construct child : construct.getBody()) {
                    String caseLabel = child.getKind() == StatementKind.CASE ? child.getStatement().getText() : "";
                    controlDependence(child, statement, caseLabel, edges);
                }
                break;
            case CASE:
                controlDependence(construct.getBody(), statement, "", edges);
                break;
            default:
                break;
        }
    }

    /**
     * Reaching definitions over the CFG. Only statements in {@code nodes} take part; the CFG exit
     * node defines and uses nothing.
     */
    public static Graph dataDependence(List<Statement> nodes, Graph cfg) {
        Map<Integer, Statement> byId = new HashMap<>();
        for (Statement node : nodes) {
            byId.put(node.getId(), node);
        }

        Map<Integer, List<Integer>> predecessors = new HashMap<>();
        Map<Integer, List<Integer>> successors = new HashMap<>();
        for (Edge edge : cfg.getEdges()) {
            predecessors.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge.getSource());
            successors.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
        }

        Map<Integer, Set<Definition>> in = new HashMap<>();
        Map<Integer, Set<Definition>> out = new HashMap<>();
        for (Statement node : nodes) {
            in.put(node.getId(), new HashSet<>());
            out.put(node.getId(), new HashSet<>());
        }

        Deque<Integer> worklist = new ArrayDeque<>();
        Set<Integer> queued = new HashSet<>();
        for (Statement node : nodes) {
            worklist.add(node.getId());
            queued.add(node.getId());
        }

        int iterations = 0;
        while (!worklist.isEmpty()) {
            int id = worklist.poll();
            queued.remove(id);
            iterations++;

            Set<Definition> reaching = new HashSet<>();
            for (int predecessor : predecessors.getOrDefault(id, List.of())) {
                Set<Definition> predecessorOut = out.get(predecessor);
                if (predecessorOut != null) {
                    reaching.addAll(predecessorOut);
                }
            }
            in.put(id, reaching);

            Statement statement = byId.get(id);
            Set<Definition> leaving = new HashSet<>();
            for (Definition definition : reaching) {
                if (!statement.getDefs().contains(definition.variable)) {
                    leaving.add(definition);
                }
            }
            for (String variable : statement.getDefs()) {
                leaving.add(new Definition(id, variable));
            }

            if (!leaving.equals(out.get(id))) {
                out.put(id, leaving);
                for (int successor : successors.getOrDefault(id, List.of())) {
                    if (byId.containsKey(successor) && queued.add(successor)) {
                        worklist.add(successor);
                    }
                }
            }
        }
        logger.debug("Reaching definitions stable after {} node visits over {} statements", iterations, nodes.size());

        // one edge per (definition, use) pair, carrying every inducing variable
        Map<Integer, Map<Integer, Set<String>>> pairs = new TreeMap<>();
        for (Statement statement : nodes) {
            for (Definition definition : in.get(statement.getId())) {
                if (definition.statementId != statement.getId()
                        && statement.getUses().contains(definition.variable)) {
                    pairs.computeIfAbsent(definition.statementId, k -> new TreeMap<>())
                            .computeIfAbsent(statement.getId(), k -> new TreeSet<>())
                            .add(definition.variable);
                }
            }
        }

        List<Edge> edges = new ArrayList<>();
        pairs.forEach((source, targets) -> targets.forEach((target, variables) ->
                edges.add(new Edge(source, target, "", EdgeKind.DDG, variables))));
        return new Graph(GraphKind.DDG, nodes, edges);
    }

    public static Graph programDependence(List<Statement> nodes, Graph cdg, Graph ddg) {
        Set<Edge> union = new LinkedHashSet<>(cdg.getEdges());
        union.addAll(ddg.getEdges());
        List<Edge> edges = new ArrayList<>(union);
        edges.sort(EDGE_ORDER);
        return new Graph(GraphKind.PDG, nodes, edges);
    }

    private static final class Definition {
        final int statementId;
        final String variable;

        Definition(int statementId, String variable) {
            this.statementId = statementId;
            this.variable = variable;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Definition)) return false;
            Definition other = (Definition) o;
            return statementId == other.statementId && variable.equals(other.variable);
        }

        @Override
        public int hashCode() {
            return Objects.hash(statementId, variable);
        }
    }
}
