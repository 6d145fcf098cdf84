package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class FunctionInfo {
    public String name;
    public String signature;
    public List<String> parameters = new ArrayList<>();
    @JsonProperty("start_line")
    public int startLine;
    @JsonProperty("end_line")
    public int endLine;
}
