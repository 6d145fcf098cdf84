package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.Language;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCpp;

import java.util.EnumMap;
import java.util.Map;

public class SourceParser {

    private static final Map<Language, TSLanguage> TREE_SITTER_LANGUAGES = new EnumMap<>(Language.class);

    static {
        TREE_SITTER_LANGUAGES.put(Language.C, new TreeSitterC());
        TREE_SITTER_LANGUAGES.put(Language.CPP, new TreeSitterCpp());
    }

    public ParsedSource parse(String sourceCode, Language language) {
        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        TSLanguage tsLanguage = TREE_SITTER_LANGUAGES.get(language);
        if (tsLanguage == null) {
            throw new IllegalArgumentException("No Tree-sitter language available for: " + language);
        }

        TSParser parser = new TSParser();
        parser.setLanguage(tsLanguage);
        TSTree tree = parser.parseString(null, sourceCode);
        return new ParsedSource(sourceCode, tree);
    }
}
