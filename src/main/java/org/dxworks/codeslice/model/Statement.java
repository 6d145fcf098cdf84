package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One analyzable statement of a function body. Def/use sets are fixed at construction.
 */
@JsonPropertyOrder({"id", "type", "text", "line", "defs", "uses"})
public final class Statement {

    private final int id;
    private final StatementKind kind;
    private final String text;
    private final int line;
    private final int endLine;
    private final SortedSet<String> defs;
    private final SortedSet<String> uses;

    public Statement(int id, StatementKind kind, String text, int line, int endLine,
                     Collection<String> defs, Collection<String> uses) {
        this.id = id;
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.endLine = Math.max(line, endLine);
        this.defs = Collections.unmodifiableSortedSet(new TreeSet<>(defs));
        this.uses = Collections.unmodifiableSortedSet(new TreeSet<>(uses));
    }

    public int getId() {
        return id;
    }

    @JsonIgnore
    public StatementKind getKind() {
        return kind;
    }

    @JsonProperty("type")
    public String getType() {
        return kind.getName();
    }

    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    @JsonIgnore
    public int getEndLine() {
        return endLine;
    }

    public SortedSet<String> getDefs() {
        return defs;
    }

    public SortedSet<String> getUses() {
        return uses;
    }

    public boolean mentions(String variable) {
        return defs.contains(variable) || uses.contains(variable);
    }

    @Override
    public String toString() {
        return id + "@" + line + " [" + kind.getName() + "] " + text;
    }
}
