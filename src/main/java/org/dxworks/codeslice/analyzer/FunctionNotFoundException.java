package org.dxworks.codeslice.analyzer;

public class FunctionNotFoundException extends AnalysisException {

    private final String functionName;

    public FunctionNotFoundException(String functionName) {
        super("Function not found: " + functionName);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
