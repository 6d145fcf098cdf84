package org.dxworks.codeslice.report;

import org.dxworks.codeslice.model.Edge;
import org.dxworks.codeslice.model.EdgeKind;
import org.dxworks.codeslice.model.Graph;
import org.dxworks.codeslice.model.Statement;
import org.dxworks.codeslice.model.StatementKind;

/**
 * Renders a graph in Graphviz DOT. Predicates are diamonds, the synthetic entry and exit are
 * ellipses, and every label carries the source line as a subscript.
 */
public class GraphDotWriter {

    private static final String SEP = "\n";

    public static String toDot(Graph graph, String name) {
        StringBuilder str = new StringBuilder();
        str.append("digraph \"").append(escapeQuoted(name)).append("\" {").append(SEP);
        str.append("  rankdir=TB;").append(SEP);
        str.append("  node [fontname=\"Arial\"];").append(SEP);
        str.append("  edge [fontname=\"Arial\"];").append(SEP);

        for (Statement node : graph.getNodes()) {
            str.append("  ").append(node.getId())
                    .append(" [shape=").append(shape(node))
                    .append(", label=<").append(escapeHtml(node.getText()))
                    .append("<SUB>").append(node.getLine()).append("</SUB>>];")
                    .append(SEP);
        }
        for (Edge edge : graph.getEdges()) {
            str.append("  ").append(edge.getSource()).append(" -> ").append(edge.getTarget());
            String label = edge.getKind() == EdgeKind.DDG
                    ? String.join(", ", edge.getVariables())
                    : edge.getLabel();
            str.append(" [label=\"").append(escapeQuoted(label)).append("\"");
            if (edge.getKind() == EdgeKind.DDG) {
                str.append(", style=dotted, color=red");
            } else if (edge.getKind() == EdgeKind.CDG) {
                str.append(", color=blue");
            }
            str.append("];").append(SEP);
        }
        str.append("}").append(SEP);
        return str.toString();
    }

    private static String shape(Statement node) {
        if (node.getKind() == StatementKind.EXIT || node.getId() == 0) {
            return "ellipse";
        }
        return node.getKind().isBranch() ? "diamond" : "rectangle";
    }

    static String escapeHtml(String text) {
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static String escapeQuoted(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
