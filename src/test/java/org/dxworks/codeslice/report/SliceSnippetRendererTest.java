package org.dxworks.codeslice.report;

import org.approvaltests.Approvals;
import org.dxworks.codeslice.analyzer.FunctionAnalyzer;
import org.dxworks.codeslice.model.ParameterAnalysis;
import org.dxworks.codeslice.model.ParameterQuery;
import org.dxworks.codeslice.model.SliceQuery;
import org.dxworks.codeslice.model.SliceResult;
import org.dxworks.codeslice.model.SliceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.codeslice.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.*;

class SliceSnippetRendererTest {

    @Test
    void snippet_ScenarioA_BackwardTemp() throws Exception {
        String source = sample("c/scenario_a.c");
        SliceResult slice = new FunctionAnalyzer().slice(new SliceQuery(source, "f", "c", "temp", 13, SliceType.BACKWARD));
        Approvals.verify(SliceSnippetRenderer.render(source, slice));
    }

    @Test
    void attachesOneSnippetPerParameter() throws Exception {
        String source = sample("c/params.c");
        FunctionAnalyzer analyzer = new FunctionAnalyzer();
        ParameterAnalysis analysis = analyzer.parameters(new ParameterQuery(source, "g", "c"));

        SliceSnippetRenderer.attach(analysis, source);

        assertEquals("/* line   3 */     int t = a;\n"
                        + "/* line   5 */         t = t + b;\n"
                        + "/* line   7 */     return t;\n",
                analysis.parameters.get(0).snippet);
    }

    @Test
    void linesOutsideTheSourceAreIgnored() {
        assertEquals("/* line   2 */ b\n", SliceSnippetRenderer.render("a\r\nb\r\n", List.of(2, 0, 40)));
    }
}
