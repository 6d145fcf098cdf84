package org.dxworks.codeslice;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceFileFilterTest {

    @TempDir
    Path tempDir;

    @Test
    void acceptsEverythingWithoutPatterns() {
        SourceFileFilter filter = new SourceFileFilter(List.of());
        assertTrue(filter.accepts(tempDir, tempDir.resolve("src/main.c")));
    }

    @Test
    void matchesRelativeAndAbsolutePaths() {
        SourceFileFilter filter = new SourceFileFilter(List.of("vendor/*", "*/generated/*"));

        assertFalse(filter.accepts(tempDir, tempDir.resolve("vendor/zlib/inflate.c")));
        assertFalse(filter.accepts(tempDir, tempDir.resolve("lib/generated/parser.c")));
        assertTrue(filter.accepts(tempDir, tempDir.resolve("lib/main.c")));
    }

    @Test
    void negatedPatternAcceptsAgain() {
        SourceFileFilter filter = new SourceFileFilter(List.of("vendor/*", "!vendor/keep.c"));

        assertTrue(filter.accepts(tempDir, tempDir.resolve("vendor/keep.c")));
        assertFalse(filter.accepts(tempDir, tempDir.resolve("vendor/drop.c")));
    }

    @Test
    void readsIgnoreFileAndAppendsExcludes() throws Exception {
        Path ignoreFile = tempDir.resolve(".ignore");
        Files.writeString(ignoreFile, "# third party\n*/test/*\n\n");

        SourceFileFilter filter = SourceFileFilter.load(ignoreFile, List.of("*.h"));

        assertEquals(List.of("*/test/*", "*.h"), filter.getPatterns());
        assertFalse(filter.accepts(tempDir, tempDir.resolve("lib/test/check.c")));
        assertFalse(filter.accepts(tempDir, tempDir.resolve("lib/util.h")));
        assertTrue(filter.accepts(tempDir, tempDir.resolve("lib/util.c")));
    }

    @Test
    void missingIgnoreFileMeansOnlyExcludes() {
        SourceFileFilter filter = SourceFileFilter.load(tempDir.resolve(".ignore"), List.of("big.c"));
        assertEquals(List.of("big.c"), filter.getPatterns());
    }
}
