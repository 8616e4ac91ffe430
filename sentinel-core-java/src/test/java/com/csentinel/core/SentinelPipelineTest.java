package com.csentinel.core;

import com.csentinel.core.analysis.Vulnerability;
import com.csentinel.core.diagnostics.Diagnostic;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;
import com.csentinel.core.lexer.Lexer;
import com.csentinel.core.pipeline.AnalysisResult;
import com.csentinel.core.pipeline.SentinelPipeline;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: runs the whole pipeline on the C fixtures.
 */
class SentinelPipelineTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/c-samples");

    private static AnalysisResult registry;

    @BeforeAll
    static void runPipeline() {
        registry = new SentinelPipeline(SentinelConfig.defaults(), Diagnostics.silent())
                .runFile(FIXTURES.resolve("user_registry.c"));
    }

    @Test
    void producesAllArtifacts() {
        assertFalse(registry.tokens().isEmpty());
        assertNotNull(registry.program());
        assertEquals(List.of("register_user", "change_password", "export_users", "main"),
                List.copyOf(registry.cfgs().keySet()));
        assertEquals(7, registry.vulnerabilities().size());
    }

    @Test
    void cleanFileHasNoDiagnostics() {
        assertTrue(registry.diagnostics().isEmpty(), "Unexpected: " + registry.diagnostics());
    }

    @Test
    void everyCfgHasAnEntryBlock() {
        registry.cfgs().forEach((name, cfg) -> {
            assertNotNull(cfg.getEntry(), name);
            assertEquals("entry_" + name, cfg.getEntry().getLabel());
        });
    }

    @Test
    void syntaxErrorsTravelWithPartialResults() {
        AnalysisResult result = new SentinelPipeline(SentinelConfig.defaults(), Diagnostics.silent())
                .runFile(FIXTURES.resolve("missing_semicolon.c"));

        assertTrue(result.cfgs().containsKey("after_one"));
        assertTrue(result.cfgs().containsKey("after_two"));
        assertTrue(result.vulnerabilities().isEmpty());

        boolean parserError = false;
        for (Diagnostic d : result.diagnostics()) {
            parserError |= d.phase() == Phase.PARSER && d.level() == Diagnostic.Level.ERROR;
        }
        assertTrue(parserError);
    }

    @Test
    void lexicalErrorsAreWarningsNotFailures() {
        AnalysisResult result = new SentinelPipeline(SentinelConfig.defaults(), Diagnostics.silent())
                .run("void f(char *y) { char b[4]; ` strcpy(b, y); }");
        List<Vulnerability> found = result.vulnerabilities();
        assertEquals(1, found.size());
        assertFalse(result.diagnostics().isEmpty());
    }

    @Test
    void nonUtf8SourceIsDecodedWithWarning() {
        AnalysisResult result = new SentinelPipeline(SentinelConfig.defaults(), Diagnostics.silent())
                .runFile(FIXTURES.resolve("latin1_comment.c"));

        assertEquals(List.of("greet"), List.copyOf(result.cfgs().keySet()));
        assertEquals(1, result.vulnerabilities().size());
        Vulnerability v = result.vulnerabilities().get(0);
        assertEquals("buf", v.variable());
        assertEquals(Integer.valueOf(7), v.line());

        assertEquals(1, result.diagnostics().size(), "Unexpected: " + result.diagnostics());
        Diagnostic warning = result.diagnostics().get(0);
        assertEquals(Phase.LEXER, warning.phase());
        assertEquals(Diagnostic.Level.WARNING, warning.level());
        assertTrue(warning.message().contains("not valid UTF-8"), warning.message());
    }

    @Test
    void longOperatorChainIsASyntaxErrorNotACrash() {
        String source = "int f() { int x = 0; x = 1" + " + 1".repeat(50_000) + "; return x; }";

        AnalysisResult result = assertDoesNotThrow(
                () -> new SentinelPipeline(SentinelConfig.defaults(), Diagnostics.silent()).run(source));

        assertTrue(result.cfgs().containsKey("f"));
        List<String> entry = result.cfgs().get("f").getEntry().getInstructions();
        assertEquals("return x", entry.get(entry.size() - 1));

        List<Diagnostic> parserErrors = new ArrayList<>();
        for (Diagnostic d : result.diagnostics()) {
            if (d.phase() == Phase.PARSER) parserErrors.add(d);
        }
        assertFalse(parserErrors.isEmpty());
        assertTrue(parserErrors.get(0).message().contains("nesting deeper than 256"),
                parserErrors.get(0).message());
        for (Diagnostic d : result.diagnostics()) {
            assertNotEquals(Phase.CFG, d.phase(), d.message());
            assertNotEquals(Phase.ANALYSIS, d.phase(), d.message());
        }
    }

    @Test
    void findingAtTheBottomOfALongChainIsReported() {
        String source = "void f(char *y) { char b[4]; int x; x = strcpy(b, y)" + " + 1".repeat(249) + "; }";

        AnalysisResult result = new SentinelPipeline(SentinelConfig.defaults(), Diagnostics.silent()).run(source);

        assertTrue(result.diagnostics().isEmpty(), "Unexpected: " + result.diagnostics());
        assertEquals(1, result.vulnerabilities().size());
        assertEquals("b", result.vulnerabilities().get(0).variable());
    }

    @Test
    void missingFileIsHardFailure() {
        SentinelPipeline pipeline = new SentinelPipeline(SentinelConfig.defaults(), Diagnostics.silent());
        assertThrows(Lexer.SourceReadException.class,
                () -> pipeline.runFile(FIXTURES.resolve("nope.c")));
    }
}
