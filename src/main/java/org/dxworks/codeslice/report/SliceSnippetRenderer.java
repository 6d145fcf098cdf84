package org.dxworks.codeslice.report;

import org.dxworks.codeslice.model.ParameterAnalysis;
import org.dxworks.codeslice.model.ParameterSliceResult;
import org.dxworks.codeslice.model.SliceResult;

import java.util.Collection;
import java.util.TreeSet;

/**
 * Numbered code excerpt of the source lines selected by a slice.
 */
public class SliceSnippetRenderer {

    public static String render(String sourceCode, Collection<Integer> lines) {
        String[] sourceLines = sourceCode.replace("\r\n", "\n").replace("\r", "\n").split("\n", -1);
        StringBuilder snippet = new StringBuilder();
        for (int line : new TreeSet<>(lines)) {
            if (line < 1 || line > sourceLines.length) continue;
            snippet.append(String.format("/* line %3d */ %s", line, sourceLines[line - 1].stripTrailing()))
                    .append("\n");
        }
        return snippet.toString();
    }

    public static String render(String sourceCode, SliceResult slice) {
        return render(sourceCode, slice.lineNumbers());
    }

    public static void attach(ParameterAnalysis analysis, String sourceCode) {
        for (ParameterSliceResult parameter : analysis.parameters) {
            parameter.snippet = render(sourceCode, parameter.forwardLines);
        }
    }
}
