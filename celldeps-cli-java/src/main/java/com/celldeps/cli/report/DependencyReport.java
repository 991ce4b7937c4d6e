package com.celldeps.cli.report;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs matching the dependencies.json report schema v0.1.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class DependencyReport {

    private DependencyReport() {}

    public static class ReportRoot {
        @SerializedName("report_version")   public String reportVersion;
        @SerializedName("notebook_name")    public String notebookName;
        @SerializedName("analyzer_version") public String analyzerVersion;
        @SerializedName("generated_at")     public String generatedAt;
        @SerializedName("cells")            public List<CellReport> cells;
    }

    public static class CellReport {
        @SerializedName("id")     public String id;
        @SerializedName("reads")  public List<String> reads;
        @SerializedName("writes") public List<String> writes;
        @SerializedName("error")  public CellError error;  // nullable
    }

    public static class CellError {
        @SerializedName("kind")    public String kind;     // parse_error, analysis_error
        @SerializedName("line")    public Integer line;    // nullable
        @SerializedName("message") public String message;
    }
}
