package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.Language;
import org.dxworks.codeslice.model.FunctionGraphs;
import org.dxworks.codeslice.model.FunctionInfo;
import org.dxworks.codeslice.model.Graph;
import org.dxworks.codeslice.model.ParameterAnalysis;
import org.dxworks.codeslice.model.ParameterQuery;
import org.dxworks.codeslice.model.SliceQuery;
import org.dxworks.codeslice.model.SliceResult;
import org.dxworks.codeslice.model.SliceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the analysis: source text and a function name in, graphs, slices and parameter
 * reports out. Every call parses and builds from scratch; nothing is cached between calls.
 */
public class FunctionAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(FunctionAnalyzer.class);

    private final SourceParser parser = new SourceParser();
    private final FunctionLocator locator = new FunctionLocator();

    public ParsedSource parse(String sourceCode, Language language) {
        return parser.parse(sourceCode, language);
    }

    public List<FunctionDefinition> functions(ParsedSource source) {
        return locator.locateAll(source);
    }

    public List<FunctionInfo> listFunctions(String sourceCode, Language language) {
        List<FunctionInfo> result = new ArrayList<>();
        for (FunctionDefinition function : functions(parse(sourceCode, language))) {
            result.add(function.getInfo());
        }
        return result;
    }

    public FunctionGraphs analyze(String sourceCode, String functionName, Language language) throws AnalysisException {
        ParsedSource source = parse(sourceCode, language);
        return analyze(source, locator.locate(source, functionName));
    }

    public FunctionGraphs analyze(ParsedSource source, FunctionDefinition function) throws AnalysisException {
        if (function.getNode().hasError()) {
            throw new ParseException("Syntax error in function '" + function.getInfo().name + "'",
                    TreeSitterHelper.startLine(TreeSitterHelper.findFirstError(function.getNode())));
        }

        CollectedBody body = StatementCollector.collect(source, function.getBody());
        Graph cfg = ControlFlowBuilder.build(body.getStatements(), body.getRoot(), null);
        Graph cdg = DependenceBuilder.controlDependence(body.getStatements(), body.getRoot());
        Graph ddg = DependenceBuilder.dataDependence(body.getStatements(), cfg);
        Graph pdg = DependenceBuilder.programDependence(body.getStatements(), cdg, ddg);

        logger.debug("{}: {} statements, {} CFG edges, {} CDG edges, {} DDG edges",
                function.getInfo().name, body.getStatements().size(),
                cfg.getEdgeCount(), cdg.getEdgeCount(), ddg.getEdgeCount());
        return new FunctionGraphs(function.getInfo(), body.getStatements(), body.getRoot(), cfg, cdg, ddg, pdg);
    }

    public SliceResult slice(SliceQuery query) throws AnalysisException {
        FunctionGraphs graphs = analyze(query.functionText, query.functionName, language(query.language));
        return slice(graphs, query.variable, query.line,
                query.sliceType != null ? query.sliceType : SliceType.BACKWARD);
    }

    public SliceResult slice(FunctionGraphs graphs, String variable, int line, SliceType type)
            throws InvalidTargetException {
        return new SliceEngine(graphs.getPdg()).slice(variable, line, type);
    }

    public ParameterAnalysis parameters(ParameterQuery query) throws AnalysisException {
        return parameters(analyze(query.functionText, query.functionName, language(query.language)));
    }

    public ParameterAnalysis parameters(FunctionGraphs graphs) {
        return ParameterAnalyzer.analyze(graphs);
    }

    private static Language language(String name) throws AnalysisException {
        return Language.fromName(name)
                .orElseThrow(() -> new AnalysisException("Unsupported language: " + name));
    }
}
