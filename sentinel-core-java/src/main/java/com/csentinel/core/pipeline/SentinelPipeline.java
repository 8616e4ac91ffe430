package com.csentinel.core.pipeline;

import com.csentinel.core.SentinelConfig;
import com.csentinel.core.analysis.BufferOverflowAnalyzer;
import com.csentinel.core.analysis.Vulnerability;
import com.csentinel.core.ast.Program;
import com.csentinel.core.cfg.CfgBuilder;
import com.csentinel.core.cfg.ControlFlowGraph;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;
import com.csentinel.core.lexer.Lexer;
import com.csentinel.core.lexer.Token;
import com.csentinel.core.parser.Parser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates one translation unit: tokens, AST, one CFG per function, then
 * the buffer-overflow findings. Every stage gets fresh state; only a missing
 * or unreadable input file propagates as an exception.
 */
public class SentinelPipeline {

    private final SentinelConfig config;
    private final Diagnostics diagnostics;

    public SentinelPipeline(SentinelConfig config, Diagnostics diagnostics) {
        this.config = config;
        this.diagnostics = diagnostics;
    }

    public SentinelPipeline(SentinelConfig config) {
        this(config, config.echoDiagnostics ? Diagnostics.toStderr() : Diagnostics.silent());
    }

    /** @throws Lexer.SourceReadException if the file is missing or unreadable */
    public AnalysisResult runFile(Path sourceFile) {
        return run(Lexer.readSource(sourceFile, diagnostics));
    }

    public AnalysisResult run(String cleanedSource) {
        // 1. Tokens
        List<Token> tokens = new Lexer(diagnostics).tokenize(cleanedSource);

        // 2. AST
        Program program;
        try {
            program = new Parser(config, diagnostics).parse(tokens);
        } catch (RuntimeException e) {
            diagnostics.error(Phase.PIPELINE, "Parser failed: " + e);
            program = new Program(Collections.emptyList());
        }

        // 3. Control-flow graphs
        Map<String, ControlFlowGraph> cfgs = new CfgBuilder(diagnostics).buildAll(program);

        // 4. Findings
        List<Vulnerability> vulnerabilities =
                new BufferOverflowAnalyzer(diagnostics, config.traversalDepthLimit()).analyze(program);
        diagnostics.info(Phase.ANALYSIS, "analysis finished, findings = " + vulnerabilities.size());

        return new AnalysisResult(
                Collections.unmodifiableList(tokens),
                program,
                Collections.unmodifiableMap(cfgs),
                vulnerabilities,
                new ArrayList<>(diagnostics.entries()));
    }
}
