package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.model.FunctionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.codeslice.analyzer.TreeSitterHelper.*;

/**
 * Finds function definitions in a parsed translation unit, including C++ methods defined inside
 * classes and namespaces.
 */
public class FunctionLocator {

    private static final Logger logger = LoggerFactory.getLogger(FunctionLocator.class);

    public List<FunctionDefinition> locateAll(ParsedSource source) {
        List<FunctionDefinition> result = new ArrayList<>();
        for (TSNode definition : findAllDescendants(source.getRootNode(), "function_definition")) {
            FunctionDefinition function = describe(source, definition);
            if (function != null) {
                result.add(function);
            }
        }
        return result;
    }

    public FunctionDefinition locate(ParsedSource source, String name) throws AnalysisException {
        List<FunctionDefinition> matches = new ArrayList<>();
        for (FunctionDefinition function : locateAll(source)) {
            if (matchesName(function.getInfo().name, name)) {
                matches.add(function);
            }
        }

        if (matches.isEmpty()) {
            TSNode error = findFirstError(source.getRootNode());
            if (error != null) {
                throw new ParseException("Could not parse source while looking for '" + name + "'", startLine(error));
            }
            throw new FunctionNotFoundException(name);
        }
        if (matches.size() > 1) {
            logger.debug("{} definitions named '{}', using the one at line {}",
                    matches.size(), name, matches.get(0).getInfo().startLine);
        }

        FunctionDefinition function = matches.get(0);
        TSNode error = findFirstError(function.getNode());
        if (error != null) {
            throw new ParseException("Syntax error in function '" + name + "'", startLine(error));
        }
        return function;
    }

    static boolean matchesName(String declared, String requested) {
        if (declared == null || requested == null) return false;
        if (declared.equals(requested)) return true;
        int qualifier = declared.lastIndexOf("::");
        return qualifier >= 0 && declared.substring(qualifier + 2).equals(requested);
    }

    private FunctionDefinition describe(ParsedSource source, TSNode definition) {
        TSNode body = getChildByFieldName(definition, "body");
        TSNode declarator = findFunctionDeclarator(getChildByFieldName(definition, "declarator"));
        if (body == null || declarator == null) {
            return null;
        }

        FunctionInfo info = new FunctionInfo();
        info.name = normalizeInline(source.text(getChildByFieldName(declarator, "declarator")));
        info.signature = normalizeInline(source.text(definition.getStartByte(), body.getStartByte()));
        info.startLine = startLine(definition);
        info.endLine = endLine(definition);

        for (TSNode parameter : namedChildren(getChildByFieldName(declarator, "parameters"))) {
            if (!isNodeTypeOneOf(parameter, "parameter_declaration", "optional_parameter_declaration")) {
                continue;
            }
            String parameterName = DefUseExtractor.declaredName(source, getChildByFieldName(parameter, "declarator"));
            if (parameterName != null) {
                info.parameters.add(parameterName);
            }
        }
        return new FunctionDefinition(info, definition, body);
    }

    private static TSNode findFunctionDeclarator(TSNode declarator) {
        TSNode current = declarator;
        while (isPresent(current)) {
            if ("function_declarator".equals(current.getType())) {
                return current;
            }
            TSNode inner = getChildByFieldName(current, "declarator");
            current = inner != null ? inner : (current.getNamedChildCount() > 0 ? current.getNamedChild(0) : null);
        }
        return null;
    }
}
