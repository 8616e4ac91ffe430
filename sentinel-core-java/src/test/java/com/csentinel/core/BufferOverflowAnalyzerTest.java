package com.csentinel.core;

import com.csentinel.core.analysis.BufferOverflowAnalyzer;
import com.csentinel.core.analysis.Severity;
import com.csentinel.core.analysis.Vulnerability;
import com.csentinel.core.analysis.VulnerabilityType;
import com.csentinel.core.ast.Program;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.lexer.Lexer;
import com.csentinel.core.parser.Parser;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BufferOverflowAnalyzerTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/c-samples");

    private final Diagnostics diagnostics = Diagnostics.silent();
    private final BufferOverflowAnalyzer analyzer = new BufferOverflowAnalyzer(diagnostics);

    private List<Vulnerability> analyze(String source) {
        Program program = new Parser(SentinelConfig.defaults(), diagnostics).parse(source);
        return analyzer.analyze(program);
    }

    private List<Vulnerability> analyzeBody(String body) {
        return analyze("void f(char *y, char *s) {\n" + body + "\n}");
    }

    // --- Heap vs stack ---

    @Test
    void assignedMallocThenStrcpyIsHeapOverflow() {
        List<Vulnerability> found = analyzeBody("char *buf;\nbuf = malloc(16);\nstrcpy(buf, y);");

        assertEquals(1, found.size());
        Vulnerability v = found.get(0);
        assertEquals(VulnerabilityType.HEAP_OVERFLOW, v.type());
        assertEquals("strcpy", v.function());
        assertEquals("buf", v.variable());
        assertEquals(Severity.CRITICAL, v.severity());
        assertEquals(9.8, v.severityScore());
        assertEquals(4, v.line());
        assertEquals("Unsafe function 'strcpy' writes to heap buffer 'buf'", v.message());
    }

    @Test
    void plainLocalBufferIsStackOverflow() {
        List<Vulnerability> found = analyzeBody("char buf[8];\nstrcpy(buf, y);");
        assertEquals(1, found.size());
        assertEquals(VulnerabilityType.STACK_OVERFLOW, found.get(0).type());
    }

    @Test
    void castAllocatorInDeclarationIsHeap() {
        List<Vulnerability> found = analyzeBody("char *p = (char *)calloc(4, 1);\nstrcat(p, s);");
        assertEquals(VulnerabilityType.HEAP_OVERFLOW, found.get(0).type());
        assertEquals("strcat", found.get(0).function());
    }

    @Test
    void reallocAssignmentThroughCastIsHeap() {
        List<Vulnerability> found = analyzeBody("char *p;\np = (char *)realloc(p, 64);\ngets(p);");
        assertEquals(VulnerabilityType.HEAP_OVERFLOW, found.get(0).type());
    }

    @Test
    void compoundAssignmentDoesNotRecordProvenance() {
        List<Vulnerability> found = analyzeBody("long q;\nq += malloc(4);\ngets(q);");
        assertEquals(VulnerabilityType.STACK_OVERFLOW, found.get(0).type());
    }

    // --- Target resolution ---

    @Test
    void scanfWritesItsLastArgument() {
        List<Vulnerability> found = analyzeBody("int n;\nchar name[8];\nscanf(\"%d %s\", &n, name);");
        assertEquals(1, found.size());
        assertEquals("scanf", found.get(0).function());
        assertEquals("name", found.get(0).variable());
    }

    @Test
    void targetLabels() {
        List<Vulnerability> found = analyzeBody(
                "gets(rec.field);\ngets(node->name);\ngets(rows[3]);\nscanf(\"%d\", &count);\ngets(table[0]->cells[1].text);");
        assertEquals(List.of("rec.field", "node->name", "rows[]", "&count", "table[]->cells[].text"),
                found.stream().map(Vulnerability::variable).collect(Collectors.toList()));
    }

    @Test
    void memberOfHeapPointerIsHeap() {
        List<Vulnerability> found = analyzeBody("struct rec *r = malloc(sizeof(struct rec));\ngets(r->name);");
        assertEquals(VulnerabilityType.HEAP_OVERFLOW, found.get(0).type());
        assertEquals("r->name", found.get(0).variable());
    }

    @Test
    void unresolvableTargetsAreSkipped() {
        List<Vulnerability> found = analyzeBody(
                "strcpy(next_buffer(), y);\nstrcpy(*pp, y);\nscanf(\"no conversions\");\ngets();");
        assertTrue(found.isEmpty(), "Got " + found);
    }

    @Test
    void nonIdentifierCalleesAreSkipped() {
        List<Vulnerability> found = analyzeBody("(*handler)(buf);\nops.gets(buf);\nhandlers[0](buf);");
        assertTrue(found.isEmpty(), "Got " + found);
    }

    @Test
    void boundedFunctionsYieldNothing() {
        Program program = new Parser(SentinelConfig.defaults(), diagnostics)
                .parse(Lexer.readSource(FIXTURES.resolve("bounded_copy.c")));
        assertTrue(analyzer.analyze(program).isEmpty());
        assertFalse(diagnostics.hasErrors());
    }

    // --- Whole files and reuse ---

    @Test
    void userRegistryFixture() {
        Program program = new Parser(SentinelConfig.defaults(), diagnostics)
                .parse(Lexer.readSource(FIXTURES.resolve("user_registry.c")));
        List<Vulnerability> found = analyzer.analyze(program);

        assertEquals(List.of("gets", "scanf", "gets", "strcpy", "strcpy", "strcat", "scanf"),
                found.stream().map(Vulnerability::function).collect(Collectors.toList()));
        assertEquals(List.of(29, 32, 40, 44, 53, 54, 64),
                found.stream().map(Vulnerability::line).collect(Collectors.toList()));
        assertEquals(List.of(
                        VulnerabilityType.HEAP_OVERFLOW, VulnerabilityType.HEAP_OVERFLOW,
                        VulnerabilityType.STACK_OVERFLOW, VulnerabilityType.STACK_OVERFLOW,
                        VulnerabilityType.HEAP_OVERFLOW, VulnerabilityType.HEAP_OVERFLOW,
                        VulnerabilityType.STACK_OVERFLOW),
                found.stream().map(Vulnerability::type).collect(Collectors.toList()));
        assertEquals("users[]->password", found.get(3).variable());
        assertEquals("&choice", found.get(6).variable());
        assertFalse(diagnostics.hasErrors());
    }

    @Test
    void stateDoesNotLeakBetweenRuns() {
        analyze("char *a = malloc(4);");
        assertTrue(analyzer.heapVariables().contains("a"));

        List<Vulnerability> second = analyze("void f() { char a[4]; gets(a); }");
        assertEquals(VulnerabilityType.STACK_OVERFLOW, second.get(0).type());
        assertFalse(analyzer.heapVariables().contains("a"));
    }

    @Test
    void reanalyzingSameTreeGivesSameFindings() {
        Program program = new Parser(SentinelConfig.defaults(), diagnostics)
                .parse("void f(char *y) { char *b = malloc(2); strcpy(b, y); gets(b); }");
        List<Vulnerability> first = analyzer.analyze(program);
        List<Vulnerability> second = analyzer.analyze(program);
        assertEquals(2, first.size());
        assertEquals(first, second);
    }
}
