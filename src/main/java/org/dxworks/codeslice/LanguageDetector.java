package org.dxworks.codeslice;

import java.nio.file.Path;
import java.util.Optional;

public class LanguageDetector {

    public static Optional<Language> detectLanguage(Path filePath) {
        String fileName = filePath.getFileName().toString();
        for (Language language : Language.values()) {
            if (language.matchesFileName(fileName)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
