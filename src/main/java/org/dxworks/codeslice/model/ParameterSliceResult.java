package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ParameterSliceResult {
    @JsonProperty("parameter_name")
    public String parameterName;
    @JsonProperty("forward_lines")
    public List<Integer> forwardLines = new ArrayList<>();
    @JsonProperty("affects_return")
    public boolean affectsReturn;
    public List<String> interactions = new ArrayList<>();
    // lines reached by both this parameter and the interacting one
    @JsonProperty("shared_lines")
    public Map<String, List<Integer>> sharedLines = new LinkedHashMap<>();
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String snippet;
}
