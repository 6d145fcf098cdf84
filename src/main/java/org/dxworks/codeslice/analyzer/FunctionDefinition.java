package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.model.FunctionInfo;
import org.treesitter.TSNode;

public final class FunctionDefinition {

    private final FunctionInfo info;
    private final TSNode node;
    private final TSNode body;

    FunctionDefinition(FunctionInfo info, TSNode node, TSNode body) {
        this.info = info;
        this.node = node;
        this.body = body;
    }

    public FunctionInfo getInfo() {
        return info;
    }

    public TSNode getNode() {
        return node;
    }

    public TSNode getBody() {
        return body;
    }
}
