package com.csentinel.cli.report;

import com.csentinel.cli.render.AstJsonConverter;
import com.csentinel.cli.render.AstTextRenderer;
import com.csentinel.cli.report.ReportModel.*;
import com.csentinel.core.cfg.BasicBlock;
import com.csentinel.core.cfg.ControlFlowGraph;
import com.csentinel.core.lexer.Token;
import com.csentinel.core.pipeline.AnalysisResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens one pipeline result into the report shape.
 */
public class ReportAssembler {

    private final AstTextRenderer textRenderer = new AstTextRenderer();
    private final AstJsonConverter jsonConverter;

    public ReportAssembler(AstJsonConverter jsonConverter) {
        this.jsonConverter = jsonConverter;
    }

    public ReportAssembler() {
        this(new AstJsonConverter());
    }

    public ReportRoot assemble(String fileName, String preprocessedCode, AnalysisResult result) {
        ReportRoot root = new ReportRoot();
        root.status = "success";
        root.fileName = fileName;
        root.preprocessedCode = preprocessedCode;
        root.tokens = tokens(result.tokens());
        root.ast = jsonConverter.convert(result.program());
        root.astText = textRenderer.render(result.program());
        root.cfg = cfgs(result.cfgs());
        root.vulnerabilities = new ArrayList<>(result.vulnerabilities());
        root.totalIssues = result.vulnerabilities().size();
        root.diagnostics = new ArrayList<>(result.diagnostics());
        return root;
    }

    private static List<ReportToken> tokens(List<Token> tokens) {
        List<ReportToken> result = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            ReportToken rt = new ReportToken();
            rt.line = t.line();
            rt.column = t.column();
            rt.type = t.type().name();
            rt.value = t.value();
            result.add(rt);
        }
        return result;
    }

    private static Map<String, ReportCfg> cfgs(Map<String, ControlFlowGraph> graphs) {
        Map<String, ReportCfg> result = new LinkedHashMap<>();
        for (Map.Entry<String, ControlFlowGraph> entry : graphs.entrySet()) {
            ControlFlowGraph graph = entry.getValue();
            ReportCfg cfg = new ReportCfg();
            cfg.entryId = graph.getEntry() != null ? graph.getEntry().getId() : null;
            cfg.blocks = new ArrayList<>();
            for (BasicBlock block : graph.getBlocks()) {
                ReportBlock rb = new ReportBlock();
                rb.id = block.getId();
                rb.label = block.getLabel();
                rb.instructions = new ArrayList<>(block.getInstructions());
                rb.successors = new ArrayList<>();
                for (BasicBlock succ : block.getSuccessors()) rb.successors.add(succ.getId());
                cfg.blocks.add(rb);
            }
            result.put(entry.getKey(), cfg);
        }
        return result;
    }
}
