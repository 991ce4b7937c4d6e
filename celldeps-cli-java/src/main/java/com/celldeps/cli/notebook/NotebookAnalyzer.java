package com.celldeps.cli.notebook;

import com.celldeps.analyzer.AnalysisFailure;
import com.celldeps.analyzer.AnalysisResult;
import com.celldeps.analyzer.DependencyAnalyzer;
import com.celldeps.analyzer.scope.IdentifierClassifier;
import com.celldeps.cli.manifest.CellSource;
import com.celldeps.cli.report.DependencyReport.CellError;
import com.celldeps.cli.report.DependencyReport.CellReport;
import com.celldeps.cli.report.DependencyReport.ReportRoot;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Runs the dependency analyzer over every cell of a notebook and assembles the report.
 * Cells are analyzed in order; a cell that fails to parse is reported, not fatal.
 */
public class NotebookAnalyzer {

    public static final String REPORT_VERSION = "0.1";
    public static final String ANALYZER_VERSION = "0.1.0";

    private final Clock clock;

    public NotebookAnalyzer() {
        this(Clock.systemUTC());
    }

    public NotebookAnalyzer(Clock clock) {
        this.clock = clock;
    }

    public ReportRoot analyze(String notebookName, List<CellSource> cells, Collection<String> extraBuiltins) {
        DependencyAnalyzer analyzer = new DependencyAnalyzer(
                IdentifierClassifier.defaults().withAdditional(extraBuiltins));

        List<CellReport> reports = new ArrayList<>();
        int failed = 0;
        for (CellSource cell : cells) {
            AnalysisResult result = analyzer.analyze(cell.source());
            if (result.hasError()) {
                failed++;
                System.err.println("[celldeps-cli] Cell '" + cell.id() + "': " + result.error().describe());
            }
            reports.add(toCellReport(cell.id(), result));
        }
        System.err.println("[celldeps-cli] Analyzed " + cells.size() + " cells, " + failed + " with errors");

        ReportRoot root = new ReportRoot();
        root.reportVersion = REPORT_VERSION;
        root.notebookName = notebookName;
        root.analyzerVersion = ANALYZER_VERSION;
        root.generatedAt = Instant.now(clock).toString();
        root.cells = reports;
        return root;
    }

    /** Lossless mapping of one analysis result onto the report schema. */
    public static CellReport toCellReport(String id, AnalysisResult result) {
        CellReport report = new CellReport();
        report.id = id;
        report.reads = result.reads();
        report.writes = result.writes();
        if (result.hasError()) {
            AnalysisFailure failure = result.error();
            CellError error = new CellError();
            error.kind = failure.kind().name().toLowerCase(Locale.ROOT);
            error.line = failure.line();
            error.message = failure.message();
            report.error = error;
        }
        return report;
    }
}
