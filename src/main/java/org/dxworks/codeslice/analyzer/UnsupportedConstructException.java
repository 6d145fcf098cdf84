package org.dxworks.codeslice.analyzer;

public class UnsupportedConstructException extends AnalysisException {

    private final String nodeKind;
    private final int line;

    public UnsupportedConstructException(String nodeKind, int line) {
        this(nodeKind, line, "Unsupported construct '" + nodeKind + "'");
    }

    public UnsupportedConstructException(String nodeKind, int line, String message) {
        super(message + " at line " + line);
        this.nodeKind = nodeKind;
        this.line = line;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public int getLine() {
        return line;
    }
}
