package org.dxworks.codeslice.model;

import java.util.Optional;

public enum GraphKind {
    CFG,
    CDG,
    DDG,
    PDG;

    public static Optional<GraphKind> fromName(String name) {
        if (name == null) return Optional.empty();
        for (GraphKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
