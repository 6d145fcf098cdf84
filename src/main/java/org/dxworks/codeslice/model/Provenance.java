package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Provenance {
    BACKWARD("backward"),
    FORWARD("forward"),
    BOTH("both");

    private final String name;

    Provenance(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }
}
