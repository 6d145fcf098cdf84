package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ParameterQuery {
    @JsonProperty("function_text")
    public String functionText;
    @JsonProperty("function_name")
    public String functionName;
    public String language;

    public ParameterQuery() {
    }

    public ParameterQuery(String functionText, String functionName, String language) {
        this.functionText = functionText;
        this.functionName = functionName;
        this.language = language;
    }
}
