package org.dxworks.codeslice.analyzer;

public class InvalidTargetException extends AnalysisException {

    public InvalidTargetException(String message) {
        super(message);
    }
}
