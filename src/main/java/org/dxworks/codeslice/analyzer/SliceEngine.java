package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.model.Edge;
import org.dxworks.codeslice.model.EdgeKind;
import org.dxworks.codeslice.model.Graph;
import org.dxworks.codeslice.model.Provenance;
import org.dxworks.codeslice.model.SliceLine;
import org.dxworks.codeslice.model.SliceResult;
import org.dxworks.codeslice.model.SliceType;
import org.dxworks.codeslice.model.Statement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Backward and forward traversal of a program dependence graph.
 * <p>
 * From the seed statement only the dependences on the queried variable are followed; every
 * statement reached afterwards follows all of its dependences. Visited statements are tracked so
 * cycles through loop-carried dependences terminate.
 */
public class SliceEngine {

    private final Graph pdg;
    private final Map<Integer, List<Edge>> incoming = new HashMap<>();
    private final Map<Integer, List<Edge>> outgoing = new HashMap<>();

    public SliceEngine(Graph pdg) {
        this.pdg = pdg;
        for (Edge edge : pdg.getEdges()) {
            incoming.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge);
            outgoing.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge);
        }
    }

    public SliceResult slice(String variable, int line, SliceType type) throws InvalidTargetException {
        List<Statement> seeds = seeds(variable, line);
        SliceResult result = new SliceResult();
        result.variable = variable;
        result.line = line;
        result.sliceType = type;

        switch (type) {
            case BACKWARD:
                addLines(result, lines(backward(seeds, variable)), Provenance.BACKWARD);
                break;
            case FORWARD:
                addLines(result, lines(forward(seeds, variable)), Provenance.FORWARD);
                break;
            case BOTH: {
                SortedSet<Integer> backwardLines = lines(backward(seeds, variable));
                SortedSet<Integer> forwardLines = lines(forward(seeds, variable));
                SortedSet<Integer> all = new TreeSet<>(backwardLines);
                all.addAll(forwardLines);
                for (int l : all) {
                    Provenance provenance = backwardLines.contains(l)
                            ? (forwardLines.contains(l) ? Provenance.BOTH : Provenance.BACKWARD)
                            : Provenance.FORWARD;
                    result.lines.add(new SliceLine(l, provenance));
                }
                break;
            }
        }
        return result;
    }

    /**
     * Statements occupying {@code line} that define or use {@code variable}. A statement spread
     * over several lines occupies every line from its first to its last.
     */
    public List<Statement> seeds(String variable, int line) throws InvalidTargetException {
        List<Statement> onLine = new ArrayList<>();
        for (Statement statement : pdg.getNodes()) {
            if (statement.getLine() <= line && line <= statement.getEndLine()
                    && statement.getId() != IdAllocator.ENTRY_ID) {
                onLine.add(statement);
            }
        }
        if (onLine.isEmpty()) {
            throw new InvalidTargetException("No statement at line " + line);
        }

        List<Statement> seeds = new ArrayList<>();
        for (Statement statement : onLine) {
            if (statement.mentions(variable)) {
                seeds.add(statement);
            }
        }
        if (seeds.isEmpty()) {
            throw new InvalidTargetException("Variable '" + variable + "' is neither defined nor used at line " + line);
        }
        return seeds;
    }

    /**
     * @param variable the queried variable, or null to follow every dependence of the seeds
     */
    public Set<Integer> backward(Collection<Statement> seeds, String variable) {
        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        for (Statement seed : seeds) {
            visited.add(seed.getId());
        }
        for (Statement seed : seeds) {
            boolean restricted = variable != null && seed.getUses().contains(variable);
            for (Edge edge : incoming.getOrDefault(seed.getId(), List.of())) {
                boolean follow = !restricted
                        || edge.getKind() == EdgeKind.CDG
                        || edge.carries(variable);
                if (follow && visited.add(edge.getSource())) {
                    queue.add(edge.getSource());
                }
            }
        }
        while (!queue.isEmpty()) {
            int id = queue.poll();
            for (Edge edge : incoming.getOrDefault(id, List.of())) {
                if (visited.add(edge.getSource())) {
                    queue.add(edge.getSource());
                }
            }
        }
        return visited;
    }

    public Set<Integer> forward(Collection<Statement> seeds, String variable) {
        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        for (Statement seed : seeds) {
            visited.add(seed.getId());
        }
        for (Statement seed : seeds) {
            boolean usesVariable = seed.getUses().contains(variable);
            for (Edge edge : outgoing.getOrDefault(seed.getId(), List.of())) {
                boolean follow = usesVariable
                        || (edge.getKind() == EdgeKind.DDG && edge.carries(variable));
                if (follow && visited.add(edge.getTarget())) {
                    queue.add(edge.getTarget());
                }
            }
        }
        while (!queue.isEmpty()) {
            int id = queue.poll();
            for (Edge edge : outgoing.getOrDefault(id, List.of())) {
                if (visited.add(edge.getTarget())) {
                    queue.add(edge.getTarget());
                }
            }
        }
        return visited;
    }

    /**
     * Source lines of the given statements, the synthetic entry excluded.
     */
    public SortedSet<Integer> lines(Collection<Integer> statementIds) {
        SortedSet<Integer> lines = new TreeSet<>();
        for (int id : statementIds) {
            if (id == IdAllocator.ENTRY_ID) continue;
            pdg.node(id).ifPresent(statement -> lines.add(statement.getLine()));
        }
        return lines;
    }

    private static void addLines(SliceResult result, SortedSet<Integer> lines, Provenance provenance) {
        for (int line : lines) {
            result.lines.add(new SliceLine(line, provenance));
        }
    }
}
