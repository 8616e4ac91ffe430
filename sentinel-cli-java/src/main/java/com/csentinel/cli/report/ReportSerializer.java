package com.csentinel.cli.report;

import com.csentinel.core.diagnostics.Diagnostics;
import com.csentinel.core.diagnostics.Phase;
import com.google.gson.GsonBuilder;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes report.json, plus metadata.json with tool and run info.
 */
public class ReportSerializer {

    public static final String REPORT_FILE = "report.json";
    public static final String METADATA_FILE = "metadata.json";
    public static final String TOOL_VERSION = "0.1.0";

    private final Diagnostics diagnostics;

    public ReportSerializer(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code root} to {@code outputDir/report.json} and a small
     * {@code outputDir/metadata.json}.
     *
     * @param root      assembled report
     * @param outputDir directory to write into (created if absent)
     * @return path of the written report.json
     */
    public Path write(ReportModel.ReportRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + outputDir, e);
        }

        var gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

        Path reportPath = outputDir.resolve(REPORT_FILE);
        try (Writer w = new FileWriter(reportPath.toFile(), StandardCharsets.UTF_8)) {
            gson.toJson(root, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + REPORT_FILE + ": " + e.getMessage(), e);
        }
        diagnostics.info(Phase.PIPELINE, REPORT_FILE + " written: " + reportPath);

        var meta = new Metadata(root.fileName, "c", TOOL_VERSION, root.totalIssues, Instant.now().toString());
        Path metaPath = outputDir.resolve(METADATA_FILE);
        try (Writer w = new FileWriter(metaPath.toFile(), StandardCharsets.UTF_8)) {
            gson.toJson(meta, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + METADATA_FILE + ": " + e.getMessage(), e);
        }
        diagnostics.info(Phase.PIPELINE, METADATA_FILE + " written: " + metaPath);
        return reportPath;
    }

    /** Simple metadata record for Gson serialization. */
    private record Metadata(
            String fileName,
            String language,
            String toolVersion,
            int totalIssues,
            String timestamp
    ) {}
}
