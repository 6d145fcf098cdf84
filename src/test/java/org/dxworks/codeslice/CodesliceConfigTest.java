package org.dxworks.codeslice;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodesliceConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        CodesliceConfig config = CodesliceConfig.load(tempDir.resolve("codeslice-config.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertFalse(config.isIncludeGraphs());
        assertTrue(config.isIncludeSnippets());
        assertTrue(config.getExcludes().isEmpty());
    }

    @Test
    void readsYaml() throws Exception {
        Path file = tempDir.resolve("codeslice-config.yml");
        Files.writeString(file, "maxFileLines: 500\nincludeGraphs: true\nexcludes:\n  - \"**/vendor/**\"\n");

        CodesliceConfig config = CodesliceConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertTrue(config.isIncludeGraphs());
        assertTrue(config.isIncludeSnippets());
        assertEquals(List.of("**/vendor/**"), config.getExcludes());
    }

    @Test
    void invalidYamlFallsBackToDefaults() throws Exception {
        Path file = tempDir.resolve("codeslice-config.yml");
        Files.writeString(file, "maxFileLines: [not a number\n");

        assertEquals(20000, CodesliceConfig.load(file).getMaxFileLines());
    }

    @Test
    void nonPositiveLineLimitIsIgnored() {
        assertEquals(20000, CodesliceConfig.with(0, false, true, List.of()).getMaxFileLines());
    }
}
