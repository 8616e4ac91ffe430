package com.csentinel.cli;

import com.csentinel.cli.config.ConfigReader;
import com.csentinel.cli.preprocess.CommentStripper;
import com.csentinel.cli.report.ReportAssembler;
import com.csentinel.cli.report.ReportModel;
import com.csentinel.cli.report.ReportSerializer;
import com.csentinel.core.SentinelConfig;
import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;
import com.csentinel.core.lexer.Lexer;
import com.csentinel.core.pipeline.AnalysisResult;
import com.csentinel.core.pipeline.SentinelPipeline;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar sentinel-cli-java.jar analyze \
 *     --input  <file.c> \
 *     --output <output-dir> \
 *     [--config <config.json>] [--quiet]
 */
public class SentinelMain {

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[c-sentinel] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar sentinel-cli-java.jar analyze " +
                               "--input <file.c> --output <dir> [--config <json>] [--quiet]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[c-sentinel] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static Path run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String inputPath = null;
        String outputDir = null;
        String configPath = null;
        boolean quiet = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input"  -> inputPath  = requireNext(args, i++, "--input");
                case "--output" -> outputDir  = requireNext(args, i++, "--output");
                case "--config" -> configPath = requireNext(args, i++, "--config");
                case "--quiet"  -> quiet = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (inputPath == null) throw new UsageException("--input is required");
        if (outputDir == null) throw new UsageException("--output is required");

        Path input  = Paths.get(inputPath);
        Path output = Paths.get(outputDir);

        // 1. Configuration
        SentinelConfig config = configPath != null
                ? new ConfigReader().read(Paths.get(configPath)).toConfig()
                : SentinelConfig.defaults();
        Diagnostics diagnostics = config.echoDiagnostics && !quiet
                ? Diagnostics.toStderr()
                : Diagnostics.silent();

        // 2. Read and strip comments
        diagnostics.info(Phase.PIPELINE, "Reading source: " + input);
        String source = Lexer.readSource(input, diagnostics);
        String cleaned = new CommentStripper(diagnostics).strip(source);

        // 3. Tokens, AST, CFGs, findings
        AnalysisResult result = new SentinelPipeline(config, diagnostics).run(cleaned);
        diagnostics.info(Phase.PIPELINE, "Analysis complete: "
                + result.tokens().size() + " tokens, "
                + result.cfgs().size() + " functions, "
                + result.vulnerabilities().size() + " issues");

        // 4. Report
        String fileName = input.getFileName() != null ? input.getFileName().toString() : inputPath;
        ReportModel.ReportRoot report = new ReportAssembler().assemble(fileName, cleaned, result);
        Path written = new ReportSerializer(diagnostics).write(report, output);

        diagnostics.info(Phase.PIPELINE, "Done.");
        return written;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
