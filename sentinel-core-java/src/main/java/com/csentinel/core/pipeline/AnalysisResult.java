package com.csentinel.core.pipeline;

import com.csentinel.core.analysis.Vulnerability;
import com.csentinel.core.ast.Program;
import com.csentinel.core.cfg.ControlFlowGraph;
import com.csentinel.core.diagnostics.Diagnostic;
import com.csentinel.core.lexer.Token;

import java.util.List;
import java.util.Map;

/**
 * Everything one run produced. Parts may be partial when the source had
 * lexical or syntax errors; {@code diagnostics} then says what went wrong.
 */
public record AnalysisResult(
    List<Token> tokens,
    Program program,
    Map<String, ControlFlowGraph> cfgs,
    List<Vulnerability> vulnerabilities,
    List<Diagnostic> diagnostics
) {}
