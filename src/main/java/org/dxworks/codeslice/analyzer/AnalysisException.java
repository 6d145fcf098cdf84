package org.dxworks.codeslice.analyzer;

/**
 * Base of every failure reported for a single function analysis. Nothing below it is recovered
 * inside the analyzer; callers decide whether to continue with the next function.
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
