package org.dxworks.codeslice.analyzer;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;

/**
 * A parsed translation unit. Keeps the tree referenced while its nodes are in use.
 */
public final class ParsedSource {

    private final byte[] sourceBytes;
    private final TSTree tree;

    ParsedSource(String sourceCode, TSTree tree) {
        this.sourceBytes = sourceCode.getBytes(StandardCharsets.UTF_8);
        this.tree = tree;
    }

    public TSNode getRootNode() {
        return tree.getRootNode();
    }

    public String text(TSNode node) {
        return TreeSitterHelper.getNodeText(sourceBytes, node);
    }

    public String text(int startByte, int endByte) {
        return TreeSitterHelper.getText(sourceBytes, startByte, endByte);
    }
}
