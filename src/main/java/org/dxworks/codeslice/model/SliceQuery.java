package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SliceQuery {
    @JsonProperty("function_text")
    public String functionText;
    @JsonProperty("function_name")
    public String functionName;
    public String language;
    public String variable;
    public int line;
    @JsonProperty("slice_type")
    public SliceType sliceType = SliceType.BACKWARD;

    public SliceQuery() {
    }

    public SliceQuery(String functionText, String functionName, String language,
                      String variable, int line, SliceType sliceType) {
        this.functionText = functionText;
        this.functionName = functionName;
        this.language = language;
        this.variable = variable;
        this.line = line;
        this.sliceType = sliceType;
    }
}
