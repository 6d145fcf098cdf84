package org.dxworks.codeslice;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Skips discovered files matching wildcard patterns read from an {@code .ignore} file and from
 * the configured excludes. A pattern is tried against the path relative to the analyzed root and
 * against the absolute path; {@code *} also matches across directories. Later patterns win, and a
 * pattern starting with {@code !} accepts again what an earlier one rejected.
 */
public class SourceFileFilter {

    private static final Logger logger = LoggerFactory.getLogger(SourceFileFilter.class);

    private final List<String> patterns;

    public SourceFileFilter(Collection<String> patterns) {
        List<String> cleaned = new ArrayList<>();
        for (String pattern : patterns) {
            String trimmed = pattern.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                cleaned.add(trimmed);
            }
        }
        this.patterns = Collections.unmodifiableList(cleaned);
    }

    public static SourceFileFilter load(Path ignoreFile, Collection<String> excludes) {
        List<String> patterns = new ArrayList<>();
        if (Files.isRegularFile(ignoreFile)) {
            try {
                patterns.addAll(Files.readAllLines(ignoreFile, StandardCharsets.UTF_8));
            } catch (IOException e) {
                logger.warn("Ignoring unreadable {}: {}", ignoreFile, e.getMessage());
            }
        }
        patterns.addAll(excludes);
        return new SourceFileFilter(patterns);
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public boolean accepts(Path root, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String absolutePath = FilenameUtils.separatorsToUnix(absolute.toString());
        String relativePath = FilenameUtils.separatorsToUnix(
                root.toAbsolutePath().normalize().relativize(absolute).toString());

        boolean accepted = true;
        for (String pattern : patterns) {
            boolean negated = pattern.startsWith("!");
            String wildcard = negated ? pattern.substring(1) : pattern;
            if (FilenameUtils.wildcardMatch(relativePath, wildcard, IOCase.SENSITIVE)
                    || FilenameUtils.wildcardMatch(absolutePath, wildcard, IOCase.SENSITIVE)) {
                accepted = negated;
            }
        }
        return accepted;
    }
}
