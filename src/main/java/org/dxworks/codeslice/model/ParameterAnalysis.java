package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class ParameterAnalysis {
    @JsonProperty("function_name")
    public String functionName;
    public List<ParameterSliceResult> parameters = new ArrayList<>();
    @JsonProperty("return_lines")
    public List<Integer> returnLines = new ArrayList<>();
}
