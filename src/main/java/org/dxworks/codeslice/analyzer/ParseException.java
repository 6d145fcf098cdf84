package org.dxworks.codeslice.analyzer;

public class ParseException extends AnalysisException {

    private final int line;

    public ParseException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
