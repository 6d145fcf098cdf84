package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.model.FunctionGraphs;
import org.dxworks.codeslice.model.FunctionInfo;
import org.dxworks.codeslice.model.Graph;
import org.dxworks.codeslice.model.ParameterAnalysis;
import org.dxworks.codeslice.model.ParameterSliceResult;
import org.dxworks.codeslice.model.Statement;
import org.dxworks.codeslice.model.StatementKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-parameter reach over the dependence graph of a function whose body is preceded by a
 * synthetic entry statement defining every formal parameter.
 * <p>
 * Two parameters interact when their forward slices share a line. This is a candidate for
 * review, not a proven dependence.
 */
public class ParameterAnalyzer {

    public static ParameterAnalysis analyze(FunctionGraphs graphs) {
        FunctionInfo function = graphs.getFunction();
        List<Statement> statements = graphs.getStatements();
        Statement entry = entryStatement(function);
        List<Statement> nodes = new ArrayList<>();
        nodes.add(entry);
        nodes.addAll(statements);

        Graph cfg = ControlFlowBuilder.build(statements, graphs.getRoot(), entry);
        Graph cdg = DependenceBuilder.controlDependence(nodes, graphs.getRoot());
        Graph ddg = DependenceBuilder.dataDependence(nodes, cfg);
        SliceEngine engine = new SliceEngine(DependenceBuilder.programDependence(nodes, cdg, ddg));

        Set<Integer> returnSlice = new HashSet<>();
        for (Statement statement : statements) {
            if (statement.getKind() == StatementKind.RETURN) {
                returnSlice.addAll(engine.backward(List.of(statement), null));
            }
        }
        SortedSet<Integer> returnLines = engine.lines(returnSlice);

        Map<String, SortedSet<Integer>> reach = new LinkedHashMap<>();
        for (String parameter : function.parameters) {
            reach.put(parameter, engine.lines(engine.forward(List.of(entry), parameter)));
        }

        ParameterAnalysis analysis = new ParameterAnalysis();
        analysis.functionName = function.name;
        analysis.returnLines.addAll(returnLines);
        for (Map.Entry<String, SortedSet<Integer>> parameter : reach.entrySet()) {
            ParameterSliceResult result = new ParameterSliceResult();
            result.parameterName = parameter.getKey();
            result.forwardLines.addAll(parameter.getValue());
            result.affectsReturn = !Collections.disjoint(parameter.getValue(), returnLines);

            for (Map.Entry<String, SortedSet<Integer>> other : reach.entrySet()) {
                if (other.getKey().equals(parameter.getKey())) continue;
                SortedSet<Integer> shared = new TreeSet<>(parameter.getValue());
                shared.retainAll(other.getValue());
                if (!shared.isEmpty()) {
                    result.interactions.add(other.getKey());
                    result.sharedLines.put(other.getKey(), new ArrayList<>(shared));
                }
            }
            analysis.parameters.add(result);
        }
        return analysis;
    }

    static Statement entryStatement(FunctionInfo function) {
        return new Statement(IdAllocator.ENTRY_ID, StatementKind.DECL, function.signature,
                function.startLine, function.startLine, function.parameters, Collections.emptySet());
    }
}
