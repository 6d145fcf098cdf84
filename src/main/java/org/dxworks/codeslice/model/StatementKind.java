package org.dxworks.codeslice.model;

public enum StatementKind {
    EXPR("expr"),
    DECL("decl"),
    IF("if"),
    WHILE("while"),
    DO("do"),
    FOR("for"),
    SWITCH("switch"),
    CASE("case"),
    BREAK("break"),
    CONTINUE("continue"),
    RETURN("return"),
    COMPOUND("compound"),
    CALL("call"),
    EXIT("exit");

    private final String name;

    StatementKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean isLoop() {
        return this == WHILE || this == DO || this == FOR;
    }

    /**
     * Kinds that choose between successors; rendered as diamonds and used as CDG sources.
     */
    public boolean isBranch() {
        return this == IF || isLoop() || this == SWITCH;
    }
}
