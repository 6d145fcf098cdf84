package org.dxworks.codeslice.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every graph built for one function, plus the statements and structure they were built from.
 */
public final class FunctionGraphs {

    private final FunctionInfo function;
    private final List<Statement> statements;
    private final Construct root;
    private final Graph cfg;
    private final Graph cdg;
    private final Graph ddg;
    private final Graph pdg;
    private final Map<Integer, Statement> byId;

    public FunctionGraphs(FunctionInfo function, List<Statement> statements, Construct root,
                          Graph cfg, Graph cdg, Graph ddg, Graph pdg) {
        this.function = function;
        this.statements = Collections.unmodifiableList(statements);
        this.root = root;
        this.cfg = cfg;
        this.cdg = cdg;
        this.ddg = ddg;
        this.pdg = pdg;
        this.byId = statements.stream().collect(Collectors.toMap(Statement::getId, Function.identity()));
    }

    public FunctionInfo getFunction() {
        return function;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Statement statement(int id) {
        return byId.get(id);
    }

    public Construct getRoot() {
        return root;
    }

    public Graph getCfg() {
        return cfg;
    }

    public Graph getCdg() {
        return cdg;
    }

    public Graph getDdg() {
        return ddg;
    }

    public Graph getPdg() {
        return pdg;
    }

    public Graph graph(GraphKind kind) {
        return switch (kind) {
            case CFG -> cfg;
            case CDG -> cdg;
            case DDG -> ddg;
            case PDG -> pdg;
        };
    }
}
