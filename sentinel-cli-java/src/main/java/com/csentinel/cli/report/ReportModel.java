package com.csentinel.cli.report;

import com.csentinel.core.analysis.Vulnerability;
import com.csentinel.core.diagnostics.Diagnostic;
import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * POJOs of report.json.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ReportModel {

    private ReportModel() {}

    public static class ReportRoot {
        @SerializedName("status")            public String status;
        @SerializedName("file_name")         public String fileName;
        @SerializedName("preprocessed_code") public String preprocessedCode;
        @SerializedName("tokens")            public List<ReportToken> tokens;
        @SerializedName("ast")               public AstJson ast;
        @SerializedName("ast_text")          public String astText;
        @SerializedName("cfg")               public Map<String, ReportCfg> cfg;
        @SerializedName("vulnerabilities")   public List<Vulnerability> vulnerabilities;
        @SerializedName("total_issues")      public int totalIssues;
        @SerializedName("diagnostics")       public List<Diagnostic> diagnostics;
    }

    public static class ReportToken {
        @SerializedName("line")   public int line;
        @SerializedName("column") public int column;
        @SerializedName("type")   public String type;
        @SerializedName("value")  public String value;
    }

    public static class AstJson {
        @SerializedName("node")       public String node;
        @SerializedName("line")       public Integer line;        // nullable
        @SerializedName("attributes") public Map<String, Object> attributes;  // nullable
        @SerializedName("children")   public List<AstJson> children;
    }

    public static class ReportCfg {
        @SerializedName("entry_id") public String entryId;
        @SerializedName("blocks")   public List<ReportBlock> blocks;
    }

    public static class ReportBlock {
        @SerializedName("id")           public String id;
        @SerializedName("label")        public String label;
        @SerializedName("instructions") public List<String> instructions;
        @SerializedName("successors")   public List<String> successors;
    }
}
