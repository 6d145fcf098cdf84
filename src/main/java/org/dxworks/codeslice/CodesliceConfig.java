package org.dxworks.codeslice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CodesliceConfig {

    private static final Logger logger = LoggerFactory.getLogger(CodesliceConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "codeslice-config.yml";
    private static final boolean DEFAULT_INCLUDE_GRAPHS = false;
    private static final boolean DEFAULT_INCLUDE_SNIPPETS = true;

    private final int maxFileLines;
    private final boolean includeGraphs;
    private final boolean includeSnippets;
    private final List<String> excludes;

    private CodesliceConfig(int maxFileLines, boolean includeGraphs, boolean includeSnippets, List<String> excludes) {
        this.maxFileLines = maxFileLines;
        this.includeGraphs = includeGraphs;
        this.includeSnippets = includeSnippets;
        this.excludes = Collections.unmodifiableList(new ArrayList<>(excludes));
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isIncludeGraphs() {
        return includeGraphs;
    }

    public boolean isIncludeSnippets() {
        return includeSnippets;
    }

    public List<String> getExcludes() {
        return excludes;
    }

    public static CodesliceConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodesliceConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        yamlConfig.maxFileLines != null ? yamlConfig.maxFileLines : DEFAULT_MAX_FILE_LINES,
                        yamlConfig.includeGraphs != null ? yamlConfig.includeGraphs : DEFAULT_INCLUDE_GRAPHS,
                        yamlConfig.includeSnippets != null ? yamlConfig.includeSnippets : DEFAULT_INCLUDE_SNIPPETS,
                        yamlConfig.excludes != null ? yamlConfig.excludes : Collections.emptyList());
            }
        } catch (IOException e) {
            logger.warn("Ignoring unreadable {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static CodesliceConfig defaults() {
        return new CodesliceConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_INCLUDE_GRAPHS, DEFAULT_INCLUDE_SNIPPETS,
                Collections.emptyList());
    }

    public static CodesliceConfig with(int maxFileLines, boolean includeGraphs, boolean includeSnippets,
                                       List<String> excludes) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new CodesliceConfig(effectiveMaxFileLines, includeGraphs, includeSnippets, excludes);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean includeGraphs;
        public Boolean includeSnippets;
        public List<String> excludes;
    }
}
