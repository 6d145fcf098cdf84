package org.dxworks.codeslice;

import java.util.List;
import java.util.Optional;

public enum Language {
    C("c", List.of(".c", ".h")),
    CPP("cpp", List.of(".cpp", ".cc", ".cxx", ".hpp", ".hh"));

    private final String name;
    private final List<String> extensions;

    Language(String name, List<String> extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public boolean matchesFileName(String fileName) {
        String lower = fileName.toLowerCase();
        for (String extension : extensions) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public static Optional<Language> fromName(String name) {
        if (name == null) return Optional.empty();
        for (Language language : values()) {
            if (language.name.equalsIgnoreCase(name) || language.name().equalsIgnoreCase(name)) {
                return Optional.of(language);
            }
        }
        if ("c++".equalsIgnoreCase(name)) {
            return Optional.of(CPP);
        }
        return Optional.empty();
    }
}
