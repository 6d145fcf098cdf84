package org.dxworks.codeslice.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum SliceType {
    BACKWARD("backward"),
    FORWARD("forward"),
    BOTH("both");

    private final String name;

    SliceType(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public static Optional<SliceType> fromName(String name) {
        for (SliceType type : values()) {
            if (type.name.equalsIgnoreCase(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
