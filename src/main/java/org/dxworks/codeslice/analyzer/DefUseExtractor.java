package org.dxworks.codeslice.analyzer;

import org.treesitter.TSNode;

import java.util.Set;
import java.util.TreeSet;

import static org.dxworks.codeslice.analyzer.TreeSitterHelper.*;

/**
 * Collects the variables a statement writes ({@code defs}) and reads ({@code uses}).
 * <p>
 * Variables are plain identifiers matched by name. Field names, type names, literals and
 * qualified C++ names are never variables. The callee of a direct call is not a use; calls are
 * opaque, except that {@code &x} passed to an input function also defines {@code x}.
 */
public class DefUseExtractor {

    private static final Set<String> INPUT_FUNCTIONS = Set.of("scanf", "fscanf", "sscanf", "gets", "fgets");

    private static final String[] IGNORED_NODES = {
            "field_identifier", "type_identifier", "primitive_type", "sized_type_specifier",
            "type_descriptor", "qualified_identifier", "namespace_identifier", "template_argument_list",
            "number_literal", "string_literal", "char_literal", "raw_string_literal",
            "concatenated_string", "true", "false", "null", "nullptr", "this", "comment"
    };

    private static final String[] DECLARATOR_NODES = {
            "identifier", "init_declarator", "pointer_declarator", "array_declarator",
            "reference_declarator", "parenthesized_declarator", "function_declarator"
    };

    private final ParsedSource source;
    private final Set<String> defs = new TreeSet<>();
    private final Set<String> uses = new TreeSet<>();

    public DefUseExtractor(ParsedSource source) {
        this.source = source;
    }

    public Set<String> getDefs() {
        return defs;
    }

    public Set<String> getUses() {
        return uses;
    }

    /**
     * Reads an expression or a declaration.
     */
    public DefUseExtractor visit(TSNode node) {
        if (!isPresent(node) || isNodeTypeOneOf(node, IGNORED_NODES)) {
            return this;
        }

        switch (node.getType()) {
            case "identifier":
                uses.add(source.text(node));
                break;
            case "assignment_expression":
                visitAssignment(node);
                break;
            case "update_expression":
                assign(operand(node), true);
                break;
            case "call_expression":
                visitCall(node);
                break;
            case "field_expression":
                visit(operand(node));
                break;
            case "declaration":
                visitDeclarators(node);
                break;
            case "init_declarator":
                declare(node);
                break;
            default:
                for (TSNode child : namedChildren(node)) {
                    visit(child);
                }
        }
        return this;
    }

    private void visitAssignment(TSNode node) {
        TSNode left = getChildByFieldName(node, "left");
        TSNode right = getChildByFieldName(node, "right");
        String operator = left != null && right != null
                ? source.text(left.getEndByte(), right.getStartByte()).trim()
                : "=";
        assign(left, !"=".equals(operator));
        visit(right);
    }

    private void visitCall(TSNode node) {
        TSNode function = getChildByFieldName(node, "function");
        String callee = null;
        if (isNodeTypeOneOf(function, "identifier")) {
            callee = source.text(function);
        } else if (!isNodeTypeOneOf(function, "template_function")) {
            visit(function);
        }

        boolean input = callee != null && INPUT_FUNCTIONS.contains(callee);
        for (TSNode argument : namedChildren(getChildByFieldName(node, "arguments"))) {
            if (input && isAddressOf(argument)) {
                assign(operand(argument), false);
            }
            visit(argument);
        }
    }

    /**
     * Range-based for: the loop variable is defined from the range expression.
     */
    public DefUseExtractor visitRangeHeader(TSNode node) {
        String name = declaredName(source, getChildByFieldName(node, "declarator"));
        if (name != null) {
            defs.add(name);
        }
        return visit(getChildByFieldName(node, "right"));
    }

    private void visitDeclarators(TSNode node) {
        for (TSNode child : namedChildren(node)) {
            if (isNodeTypeOneOf(child, DECLARATOR_NODES)) {
                declare(child);
            } else if (!isNodeTypeOneOf(child, "storage_class_specifier", "type_qualifier", "attribute_specifier")) {
                visit(child);
            }
        }
    }

    /**
     * A declarator defines its name only when it has an initializer. Array sizes are uses.
     */
    private void declare(TSNode declarator) {
        if (!isPresent(declarator)) return;
        switch (declarator.getType()) {
            case "init_declarator": {
                TSNode inner = getChildByFieldName(declarator, "declarator");
                declare(inner);
                String name = declaredName(source, inner);
                if (name != null) {
                    defs.add(name);
                }
                visit(getChildByFieldName(declarator, "value"));
                break;
            }
            case "array_declarator":
                visit(getChildByFieldName(declarator, "size"));
                declare(getChildByFieldName(declarator, "declarator"));
                break;
            case "pointer_declarator":
            case "reference_declarator":
            case "parenthesized_declarator":
                for (TSNode child : namedChildren(declarator)) {
                    declare(child);
                }
                break;
            default:
                // identifier or a local prototype: nothing read
                break;
        }
    }

    /**
     * The base identifier of an lvalue is defined; index expressions inside it are read.
     */
    private void assign(TSNode target, boolean alsoRead) {
        if (!isPresent(target) || isNodeTypeOneOf(target, IGNORED_NODES)) return;
        switch (target.getType()) {
            case "identifier": {
                String name = source.text(target);
                defs.add(name);
                if (alsoRead) {
                    uses.add(name);
                }
                break;
            }
            case "subscript_expression": {
                TSNode base = operand(target);
                assign(base, alsoRead);
                for (TSNode child : namedChildren(target)) {
                    if (!sameNode(child, base)) {
                        visit(child);
                    }
                }
                break;
            }
            case "field_expression":
            case "pointer_expression":
            case "parenthesized_expression":
                assign(operand(target), alsoRead);
                break;
            default:
                visit(target);
        }
    }

    private boolean isAddressOf(TSNode node) {
        return isNodeTypeOneOf(node, "pointer_expression") && source.text(node).startsWith("&");
    }

    private static TSNode operand(TSNode node) {
        TSNode argument = getChildByFieldName(node, "argument");
        if (argument != null) return argument;
        return node.getNamedChildCount() > 0 ? node.getNamedChild(0) : null;
    }

    /**
     * Name introduced by a declarator, looking through pointer, reference, array and
     * parenthesized wrappers. Null for abstract declarators.
     */
    static String declaredName(ParsedSource source, TSNode declarator) {
        TSNode current = declarator;
        while (isPresent(current)) {
            if (isNodeTypeOneOf(current, "identifier", "field_identifier")) {
                return source.text(current);
            }
            if (!isNodeTypeOneOf(current, DECLARATOR_NODES)) {
                return null;
            }
            TSNode inner = getChildByFieldName(current, "declarator");
            current = inner != null ? inner : (current.getNamedChildCount() > 0 ? current.getNamedChild(0) : null);
        }
        return null;
    }
}
