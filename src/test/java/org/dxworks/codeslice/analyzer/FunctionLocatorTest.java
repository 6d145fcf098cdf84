package org.dxworks.codeslice.analyzer;

import org.dxworks.codeslice.Language;
import org.dxworks.codeslice.model.FunctionInfo;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.codeslice.TestUtils.sample;
import static org.junit.jupiter.api.Assertions.*;

class FunctionLocatorTest {

    private final FunctionAnalyzer analyzer = new FunctionAnalyzer();

    @Test
    void listsEveryDefinitionInSourceOrder() throws IOException {
        List<FunctionInfo> functions = analyzer.listFunctions(sample("c/control.c"), Language.C);

        assertEquals(List.of("count_down", "classify", "skip_odd"),
                functions.stream().map(f -> f.name).collect(Collectors.toList()));
        FunctionInfo classify = functions.get(1);
        assertEquals("int classify(int code)", classify.signature);
        assertEquals(List.of("code"), classify.parameters);
        assertEquals(11, classify.startLine);
        assertEquals(24, classify.endLine);
    }

    @Test
    void readsPointerAndStructParameters() throws IOException {
        FunctionInfo io = analyzer.listFunctions(sample("c/defuse.c"), Language.C).get(0);
        assertEquals("io", io.name);
        assertEquals(List.of("arr", "p", "n"), io.parameters);
    }

    @Test
    void findsQualifiedCppFunctionBySimpleName() throws Exception {
        ParsedSource source = analyzer.parse(sample("cpp/shapes.cpp"), Language.CPP);
        FunctionDefinition area = new FunctionLocator().locate(source, "area");

        assertEquals("Shape::area", area.getInfo().name);
        assertEquals(List.of("w", "h"), area.getInfo().parameters);
        assertEquals(3, area.getInfo().startLine);
        assertEquals(6, area.getInfo().endLine);
    }

    @Test
    void readsDefaultedAndReferenceParameters() throws Exception {
        ParsedSource source = analyzer.parse(sample("cpp/shapes.cpp"), Language.CPP);
        FunctionLocator locator = new FunctionLocator();

        assertEquals(List.of("v"), locator.locate(source, "twice").getInfo().parameters);
        assertEquals("static int twice(int v = 2)", locator.locate(source, "twice").getInfo().signature);
        assertEquals(List.of("values"), locator.locate(source, "total").getInfo().parameters);
    }

    @Test
    void missingFunctionIsReported() {
        FunctionNotFoundException e = assertThrows(FunctionNotFoundException.class,
                () -> analyzer.analyze(sample("c/params.c"), "nope", Language.C));
        assertEquals("nope", e.getFunctionName());
    }

    @Test
    void syntaxErrorInTargetIsAParseFailure() {
        String source = "int broken(int a)\n{\n    int x = ;\n    return x;\n}\n";
        assertThrows(ParseException.class, () -> analyzer.analyze(source, "broken", Language.C));
    }

    @Test
    void qualifiedNamesMatchOnTheLastSegment() {
        assertTrue(FunctionLocator.matchesName("geo::Shape::area", "area"));
        assertTrue(FunctionLocator.matchesName("area", "area"));
        assertFalse(FunctionLocator.matchesName("Shape::area", "Shape"));
    }
}
