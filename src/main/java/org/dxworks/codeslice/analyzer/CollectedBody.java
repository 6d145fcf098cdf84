package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.model.Construct;
import org.dxworks.codeslice.model.Statement;

import java.util.Collections;
import java.util.List;

/**
 * Output of the statement collector: statements in id order and the structure holding them.
 */
public final class CollectedBody {

    private final List<Statement> statements;
    private final Construct root;

    CollectedBody(List<Statement> statements, Construct root) {
        this.statements = Collections.unmodifiableList(statements);
        this.root = root;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public Construct getRoot() {
        return root;
    }
}
