package org.dxworks.codeslice.analyzer;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (node == null || node.isNull()) return null;
        return getText(sourceBytes, node.getStartByte(), node.getEndByte());
    }

    /**
     * Text between two UTF-8 byte offsets. Tree-sitter reports byte offsets, Java strings are UTF-16.
     */
    public static String getText(byte[] sourceBytes, int startByte, int endByte) {
        if (startByte < 0) startByte = 0;
        if (endByte > sourceBytes.length) endByte = sourceBytes.length;
        if (startByte >= endByte) return "";

        String text = new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        // Normalize line endings to LF for cross-platform consistency
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    public static boolean isPresent(TSNode node) {
        return node != null && !node.isNull();
    }

    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(parent)) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> findAllDescendants(TSNode root, String nodeType) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(root)) return result;

        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (!isPresent(node)) continue;

            if (nodeType.equals(node.getType())) {
                result.add(node);
            }
            int count = node.getNamedChildCount();
            for (int i = count - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (isPresent(child)) {
                    stack.push(child);
                }
            }
        }
        return result;
    }

    /**
     * First ERROR or MISSING node in document order, including anonymous children.
     */
    public static TSNode findFirstError(TSNode root) {
        if (!isPresent(root) || !root.hasError()) return null;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (!isPresent(node)) continue;
            if (node.isError() || node.isMissing()) {
                return node;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (isPresent(child) && (child.hasError() || child.isMissing())) {
                    stack.push(child);
                }
            }
        }
        return root;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (!isPresent(parent)) return null;
        TSNode child = parent.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    public static boolean sameNode(TSNode a, TSNode b) {
        return isPresent(a) && isPresent(b)
                && a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (!isPresent(node)) return false;
        return isTypeOneOf(node.getType(), types);
    }
}
