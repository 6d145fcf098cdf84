package org.dxworks.codeslice.model;

import java.util.Collections;
import java.util.List;

/**
 * Structural view of a function body: a statement with the constructs nested under it.
 * <p>
 * {@code body} holds the then-branch, the loop body, the cases of a switch or the statements
 * of a case. {@code alternative} is the else-branch and is null when absent. Compound blocks
 * carry no statement.
 */
public final class Construct {

    private final StatementKind kind;
    private final Statement statement;
    private final List<Construct> body;
    private final List<Construct> alternative;

    private Construct(StatementKind kind, Statement statement, List<Construct> body, List<Construct> alternative) {
        this.kind = kind;
        this.statement = statement;
        this.body = Collections.unmodifiableList(body);
        this.alternative = alternative == null ? null : Collections.unmodifiableList(alternative);
    }

    public static Construct compound(List<Construct> children) {
        return new Construct(StatementKind.COMPOUND, null, children, null);
    }

    public static Construct simple(Statement statement) {
        return new Construct(statement.getKind(), statement, List.of(), null);
    }

    public static Construct nested(Statement statement, List<Construct> body) {
        return new Construct(statement.getKind(), statement, body, null);
    }

    public static Construct branch(Statement statement, List<Construct> then, List<Construct> otherwise) {
        return new Construct(statement.getKind(), statement, then, otherwise);
    }

    public StatementKind getKind() {
        return kind;
    }

    public Statement getStatement() {
        return statement;
    }

    public List<Construct> getBody() {
        return body;
    }

    public List<Construct> getAlternative() {
        return alternative;
    }

    public boolean hasAlternative() {
        return alternative != null;
    }
}
