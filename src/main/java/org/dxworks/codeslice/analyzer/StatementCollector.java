package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.model.Construct;
import org.dxworks.codeslice.model.Statement;
import org.dxworks.codeslice.model.StatementKind;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

import static org.dxworks.codeslice.analyzer.TreeSitterHelper.*;

/**
 * Walks a function body and emits its statements in source order together with the
 * structure of the control constructs that contain them.
 * <p>
 * Headers of {@code if}, {@code while}, {@code for} and {@code switch} become one statement
 * each; a {@code do} loop is represented by its trailing {@code while (cond)}. Blocks only group
 * their children. Labels and {@code goto} are rejected.
 */
public class StatementCollector {

    private final ParsedSource source;
    private final IdAllocator ids = new IdAllocator();
    private final List<Statement> statements = new ArrayList<>();
    private final Deque<StatementKind> enclosing = new ArrayDeque<>();

    private StatementCollector(ParsedSource source) {
        this.source = source;
    }

    public static CollectedBody collect(ParsedSource source, TSNode body) throws UnsupportedConstructException {
        StatementCollector collector = new StatementCollector(source);
        Construct root = Construct.compound(collector.collectBlock(body));
        collector.statements.sort(Comparator.comparingInt(Statement::getId));
        return new CollectedBody(collector.statements, root);
    }

    private List<Construct> collectBlock(TSNode block) throws UnsupportedConstructException {
        List<Construct> result = new ArrayList<>();
        for (TSNode child : namedChildren(block)) {
            add(result, collectStatement(child));
        }
        return result;
    }

    private Construct collectStatement(TSNode node) throws UnsupportedConstructException {
        switch (node.getType()) {
            case "comment":
                return null;
            case "compound_statement":
                return Construct.compound(collectBlock(node));
            case "expression_statement":
                return collectExpression(node);
            case "declaration":
                return Construct.simple(statement(StatementKind.DECL, node, extractor().visit(node)));
            case "return_statement":
                return Construct.simple(statement(StatementKind.RETURN, node, visitChildren(node)));
            case "break_statement":
                if (enclosing.isEmpty()) {
                    throw new UnsupportedConstructException(node.getType(), startLine(node),
                            "'break' outside a loop or switch");
                }
                return Construct.simple(statement(StatementKind.BREAK, node, extractor()));
            case "continue_statement":
                if (enclosing.stream().noneMatch(StatementKind::isLoop)) {
                    throw new UnsupportedConstructException(node.getType(), startLine(node),
                            "'continue' outside a loop");
                }
                return Construct.simple(statement(StatementKind.CONTINUE, node, extractor()));
            case "if_statement":
                return collectIf(node);
            case "while_statement":
                return collectLoop(node, StatementKind.WHILE,
                        extractor().visit(getChildByFieldName(node, "condition")));
            case "for_statement":
                return collectLoop(node, StatementKind.FOR, extractor()
                        .visit(getChildByFieldName(node, "initializer"))
                        .visit(getChildByFieldName(node, "condition"))
                        .visit(getChildByFieldName(node, "update")));
            case "for_range_loop":
                return collectLoop(node, StatementKind.FOR, extractor().visitRangeHeader(node));
            case "do_statement":
                return collectDo(node);
            case "switch_statement":
                return collectSwitch(node);
            case "case_statement":
                throw new UnsupportedConstructException(node.getType(), startLine(node),
                        "'case' label outside a switch");
            default:
                // goto_statement, labeled_statement, preprocessor lines and anything else
                throw new UnsupportedConstructException(node.getType(), startLine(node));
        }
    }

    private Construct collectExpression(TSNode node) {
        TSNode expression = firstCodeChild(node);
        if (expression == null) {
            return null;
        }
        TSNode unwrapped = expression;
        while (isNodeTypeOneOf(unwrapped, "parenthesized_expression") && unwrapped.getNamedChildCount() > 0) {
            unwrapped = unwrapped.getNamedChild(0);
        }
        StatementKind kind = isNodeTypeOneOf(unwrapped, "call_expression") ? StatementKind.CALL : StatementKind.EXPR;
        return Construct.simple(statement(kind, node, extractor().visit(expression)));
    }

    private Construct collectIf(TSNode node) throws UnsupportedConstructException {
        TSNode condition = getChildByFieldName(node, "condition");
        TSNode consequence = getChildByFieldName(node, "consequence");
        TSNode alternative = getChildByFieldName(node, "alternative");

        Statement header = header(StatementKind.IF, node, consequence, extractor().visit(condition));
        List<Construct> then = asList(collectStatement(consequence));
        List<Construct> otherwise = null;
        if (alternative != null) {
            TSNode elseBody = isNodeTypeOneOf(alternative, "else_clause") ? firstCodeChild(alternative) : alternative;
            otherwise = elseBody == null ? new ArrayList<>() : asList(collectStatement(elseBody));
        }
        return Construct.branch(header, then, otherwise);
    }

    private Construct collectLoop(TSNode node, StatementKind kind, DefUseExtractor headerDefUse)
            throws UnsupportedConstructException {
        TSNode body = getChildByFieldName(node, "body");
        Statement header = header(kind, node, body, headerDefUse);
        enclosing.push(kind);
        try {
            return Construct.nested(header, asList(collectStatement(body)));
        } finally {
            enclosing.pop();
        }
    }

    private Construct collectDo(TSNode node) throws UnsupportedConstructException {
        TSNode body = getChildByFieldName(node, "body");
        TSNode condition = getChildByFieldName(node, "condition");

        List<Construct> loopBody;
        enclosing.push(StatementKind.DO);
        try {
            loopBody = asList(collectStatement(body));
        } finally {
            enclosing.pop();
        }

        // the predicate follows its body in source order
        DefUseExtractor defUse = extractor().visit(condition);
        Statement predicate = new Statement(ids.next(), StatementKind.DO,
                "while " + normalizeInline(source.text(condition)),
                startLine(condition), endLine(condition), defUse.getDefs(), defUse.getUses());
        statements.add(predicate);
        return Construct.nested(predicate, loopBody);
    }

    private Construct collectSwitch(TSNode node) throws UnsupportedConstructException {
        TSNode body = getChildByFieldName(node, "body");
        Statement header = header(StatementKind.SWITCH, node, body,
                extractor().visit(getChildByFieldName(node, "condition")));

        List<Construct> cases = new ArrayList<>();
        enclosing.push(StatementKind.SWITCH);
        try {
            for (TSNode child : namedChildren(body)) {
                if (isNodeTypeOneOf(child, "case_statement", "default_statement")) {
                    cases.add(collectCase(child));
                } else {
                    add(cases, collectStatement(child));
                }
            }
        } finally {
            enclosing.pop();
        }
        return Construct.nested(header, cases);
    }

    private Construct collectCase(TSNode node) throws UnsupportedConstructException {
        TSNode value = getChildByFieldName(node, "value");
        String text = value != null ? "case " + normalizeInline(source.text(value)) : "default";
        DefUseExtractor defUse = extractor().visit(value);
        int line = startLine(node);
        Statement label = new Statement(ids.next(), StatementKind.CASE, text,
                line, value != null ? endLine(value) : line, defUse.getDefs(), defUse.getUses());
        statements.add(label);

        List<Construct> body = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            if (!sameNode(child, value)) {
                add(body, collectStatement(child));
            }
        }
        return Construct.nested(label, body);
    }

    private Statement statement(StatementKind kind, TSNode node, DefUseExtractor defUse) {
        Statement statement = new Statement(ids.next(), kind, normalizeInline(source.text(node)),
                startLine(node), endLine(node), defUse.getDefs(), defUse.getUses());
        statements.add(statement);
        return statement;
    }

    /**
     * Header statement: the source text from the keyword up to the body.
     */
    private Statement header(StatementKind kind, TSNode node, TSNode body, DefUseExtractor defUse) {
        int headerEnd = body != null ? body.getStartByte() : node.getEndByte();
        int lastLine = startLine(node);
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (isPresent(child) && child.getEndByte() <= headerEnd) {
                lastLine = Math.max(lastLine, endLine(child));
            }
        }
        Statement statement = new Statement(ids.next(), kind,
                normalizeInline(source.text(node.getStartByte(), headerEnd)),
                startLine(node), lastLine, defUse.getDefs(), defUse.getUses());
        statements.add(statement);
        return statement;
    }

    private DefUseExtractor extractor() {
        return new DefUseExtractor(source);
    }

    private DefUseExtractor visitChildren(TSNode node) {
        DefUseExtractor defUse = extractor();
        for (TSNode child : namedChildren(node)) {
            defUse.visit(child);
        }
        return defUse;
    }

    private static TSNode firstCodeChild(TSNode node) {
        for (TSNode child : namedChildren(node)) {
            if (!"comment".equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static List<Construct> asList(Construct construct) {
        List<Construct> result = new ArrayList<>();
        add(result, construct);
        return result;
    }

    private static void add(List<Construct> constructs, Construct construct) {
        if (construct != null) {
            constructs.add(construct);
        }
    }
}
