package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.model.Construct;
import org.dxworks.codeslice.model.Edge;
import org.dxworks.codeslice.model.EdgeKind;
import org.dxworks.codeslice.model.Graph;
import org.dxworks.codeslice.model.GraphKind;
import org.dxworks.codeslice.model.Statement;
import org.dxworks.codeslice.model.StatementKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the control-flow graph of a function body by structural recursion over its constructs.
 * <p>
 * Each construct receives the pending edges that flow into it and returns the pending edges
 * that leave it. A synthetic {@code exit} node collects every {@code return} and the fall-through
 * of the body.
 */
public class ControlFlowBuilder {

    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String LOOP_BACK = "loop-back";
    public static final String DEFAULT = "default";

    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final List<Integer> returns = new ArrayList<>();

    private ControlFlowBuilder() {
    }

    /**
     * @param entry optional synthetic entry statement placed before the body; may be null
     */
    public static Graph build(List<Statement> statements, Construct root, Statement entry) {
        ControlFlowBuilder builder = new ControlFlowBuilder();

        List<Pending> incoming = entry != null
                ? List.of(new Pending(entry.getId(), ""))
                : Collections.emptyList();
        List<Pending> fallThrough = builder.sequence(root.getBody(), incoming);

        int maxId = entry != null ? entry.getId() : IdAllocator.ENTRY_ID;
        int lastLine = entry != null ? entry.getLine() : 0;
        for (Statement statement : statements) {
            maxId = Math.max(maxId, statement.getId());
            lastLine = Math.max(lastLine, statement.getEndLine());
        }
        Statement exit = new Statement(maxId + 1, StatementKind.EXIT, "exit", lastLine, lastLine,
                Collections.emptySet(), Collections.emptySet());

        builder.link(fallThrough, exit.getId());
        for (int returnId : builder.returns) {
            builder.edge(returnId, exit.getId(), "");
        }

        List<Statement> nodes = new ArrayList<>();
        if (entry != null) {
            nodes.add(entry);
        }
        nodes.addAll(statements);
        nodes.add(exit);
        return new Graph(GraphKind.CFG, nodes, new ArrayList<>(builder.edges));
    }

    private List<Pending> sequence(List<Construct> constructs, List<Pending> incoming) {
        List<Pending> current = incoming;
        for (Construct construct : constructs) {
            current = visit(construct, current);
        }
        return current;
    }

    private List<Pending> visit(Construct construct, List<Pending> incoming) {
        Statement statement = construct.getStatement();
        switch (construct.getKind()) {
            case COMPOUND:
                return sequence(construct.getBody(), incoming);
            case EXPR:
            case DECL:
            case CALL:
                link(incoming, statement.getId());
                return single(statement.getId(), "");
            case RETURN:
                link(incoming, statement.getId());
                returns.add(statement.getId());
                return Collections.emptyList();
            case BREAK:
                link(incoming, statement.getId());
                frames.peek().breaks.add(new Pending(statement.getId(), ""));
                return Collections.emptyList();
            case CONTINUE:
                link(incoming, statement.getId());
                edge(statement.getId(), innermostLoop().continueTarget, LOOP_BACK);
                return Collections.emptyList();
            case IF:
                return visitIf(construct, incoming);
            case WHILE:
            case FOR:
                return visitLoop(construct, incoming);
            case DO:
                return visitDo(construct, incoming);
            case SWITCH:
                return visitSwitch(construct, incoming);
            case CASE:
                // reached only through visitSwitch; a stray case behaves like a plain label
                link(incoming, statement.getId());
                return sequence(construct.getBody(), single(statement.getId(), ""));
            case EXIT:
            default:
                throw new IllegalStateException("Unexpected construct " + construct.getKind());
        }
    }

    private List<Pending> visitIf(Construct construct, List<Pending> incoming) {
        int predicate = construct.getStatement().getId();
        link(incoming, predicate);

        List<Pending> exits = new ArrayList<>(sequence(construct.getBody(), single(predicate, TRUE)));
        if (construct.hasAlternative()) {
            exits.addAll(sequence(construct.getAlternative(), single(predicate, FALSE)));
        } else {
            exits.add(new Pending(predicate, FALSE));
        }
        return exits;
    }

    private List<Pending> visitLoop(Construct construct, List<Pending> incoming) {
        int predicate = construct.getStatement().getId();
        link(incoming, predicate);

        Frame frame = new Frame(true, predicate);
        frames.push(frame);
        List<Pending> bodyExits = sequence(construct.getBody(), single(predicate, TRUE));
        frames.pop();

        for (Pending exit : bodyExits) {
            edge(exit.source, predicate, LOOP_BACK);
        }
        List<Pending> exits = new ArrayList<>();
        exits.add(new Pending(predicate, FALSE));
        exits.addAll(frame.breaks);
        return exits;
    }

    private List<Pending> visitDo(Construct construct, List<Pending> incoming) {
        int predicate = construct.getStatement().getId();
        int bodyEntry = entryOf(construct.getBody(), predicate);

        Frame frame = new Frame(true, predicate);
        frames.push(frame);
        List<Pending> bodyExits = sequence(construct.getBody(), incoming);
        frames.pop();

        link(bodyExits, predicate);
        edge(predicate, bodyEntry, TRUE);

        List<Pending> exits = new ArrayList<>();
        exits.add(new Pending(predicate, FALSE));
        exits.addAll(frame.breaks);
        return exits;
    }

    private List<Pending> visitSwitch(Construct construct, List<Pending> incoming) {
        int predicate = construct.getStatement().getId();
        link(incoming, predicate);

        Frame frame = new Frame(false, -1);
        frames.push(frame);
        boolean hasDefault = false;
        List<Pending> current = Collections.emptyList();
        for (Construct child : construct.getBody()) {
            if (child.getKind() == StatementKind.CASE) {
                Statement label = child.getStatement();
                hasDefault |= DEFAULT.equals(label.getText());
                // fallthrough from the previous case, then the dispatch edge
                link(current, label.getId());
                edge(predicate, label.getId(), label.getText());
                current = sequence(child.getBody(), single(label.getId(), ""));
            } else {
                current = visit(child, current);
            }
        }
        frames.pop();

        List<Pending> exits = new ArrayList<>(current);
        exits.addAll(frame.breaks);
        if (!hasDefault) {
            exits.add(new Pending(predicate, DEFAULT));
        }
        return exits;
    }

    /**
     * First statement executed when entering the constructs, or {@code fallback} when they are empty.
     */
    private static int entryOf(List<Construct> constructs, int fallback) {
        for (Construct construct : constructs) {
            switch (construct.getKind()) {
                case COMPOUND: {
                    int nested = entryOf(construct.getBody(), -1);
                    if (nested >= 0) {
                        return nested;
                    }
                    break;
                }
                case DO:
                    return entryOf(construct.getBody(), construct.getStatement().getId());
                default:
                    return construct.getStatement().getId();
            }
        }
        return fallback;
    }

    private Frame innermostLoop() {
        for (Frame frame : frames) {
            if (frame.loop) {
                return frame;
            }
        }
        throw new IllegalStateException("continue outside a loop");
    }

    private void link(List<Pending> pending, int target) {
        for (Pending p : pending) {
            edge(p.source, target, p.label);
        }
    }

    private void edge(int source, int target, String label) {
        edges.add(new Edge(source, target, label, EdgeKind.CFG));
    }

    private static List<Pending> single(int source, String label) {
        return List.of(new Pending(source, label));
    }

    private static final class Pending {
        final int source;
        final String label;

        Pending(int source, String label) {
            this.source = source;
            this.label = label;
        }
    }

    private static final class Frame {
        final boolean loop;
        final int continueTarget;
        final List<Pending> breaks = new ArrayList<>();

        Frame(boolean loop, int continueTarget) {
            this.loop = loop;
            this.continueTarget = continueTarget;
        }
    }
}
