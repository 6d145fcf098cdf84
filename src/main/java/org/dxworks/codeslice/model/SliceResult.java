package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"variable", "line", "slice_type", "lines"})
public class SliceResult {
    public String variable;
    public int line;
    @JsonProperty("slice_type")
    public SliceType sliceType;
    public List<SliceLine> lines = new ArrayList<>();

    public List<Integer> lineNumbers() {
        List<Integer> numbers = new ArrayList<>();
        for (SliceLine sliceLine : lines) {
            numbers.add(sliceLine.line);
        }
        return numbers;
    }
}
