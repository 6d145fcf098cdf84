package org.dxworks.codeslice.report;

import org.approvaltests.Approvals;
import org.dxworks.codeslice.Language;
import org.dxworks.codeslice.analyzer.FunctionAnalyzer;
import org.dxworks.codeslice.model.FunctionGraphs;
import org.junit.jupiter.api.Test;

import static org.dxworks.codeslice.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.*;

class GraphDotWriterTest {

    @Test
    void dot_ScenarioA_Pdg() throws Exception {
        FunctionGraphs graphs = new FunctionAnalyzer().analyze(sample("c/scenario_a.c"), "f", Language.C);
        Approvals.verify(GraphDotWriter.toDot(graphs.getPdg(), "f PDG"));
    }

    @Test
    void dot_DoLoop_Cfg() throws Exception {
        FunctionGraphs graphs = new FunctionAnalyzer().analyze(sample("c/control.c"), "count_down", Language.C);
        Approvals.verify(GraphDotWriter.toDot(graphs.getCfg(), "count_down CFG"));
    }

    @Test
    void escapesMarkupInStatementText() {
        assertEquals("a &lt;&lt; 2 &amp;&amp; s == &quot;x&quot;",
                GraphDotWriter.escapeHtml("a << 2 && s == \"x\""));
    }
}
