package com.celldeps.cli.notebook;

import com.celldeps.analyzer.AnalysisResult;
import com.celldeps.analyzer.DependencyAnalyzer;
import com.celldeps.cli.manifest.CellSource;
import com.celldeps.cli.manifest.NotebookManifest;
import com.celldeps.cli.manifest.NotebookManifestReader;
import com.celldeps.cli.report.DependencyReport.CellReport;
import com.celldeps.cli.report.DependencyReport.ReportRoot;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test: analyzes the sales-report notebook fixture end to end.
 */
class NotebookAnalyzerTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/notebook");

    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private static ReportRoot report;

    @BeforeAll
    static void runAnalysis() {
        NotebookManifestReader reader = new NotebookManifestReader();
        NotebookManifest manifest = reader.read(FIXTURE_ROOT.resolve("manifest.json"));
        List<CellSource> cells = reader.loadCells(manifest, FIXTURE_ROOT);
        report = new NotebookAnalyzer(FIXED).analyze(manifest.getNotebookName(), cells, manifest.getExtraBuiltins());
    }

    private static CellReport cell(String id) {
        return report.cells.stream().filter(c -> c.id.equals(id)).findFirst().orElseThrow();
    }

    @Test
    void headerFields() {
        assertEquals("0.1", report.reportVersion);
        assertEquals("0.1.0", report.analyzerVersion);
        assertEquals("sales-report", report.notebookName);
        assertEquals("2026-03-01T12:00:00Z", report.generatedAt);
    }

    @Test
    void cellsKeepManifestOrder() {
        assertEquals(List.of("load", "clean", "summary", "plot", "broken"),
                report.cells.stream().map(c -> c.id).toList());
    }

    @Test
    void importsAndAssignmentsAreWrites() {
        CellReport load = cell("load");
        assertEquals(List.of(), load.reads);
        // code point order puts upper case first
        assertEquals(List.of("RAW_PATH", "df", "pd"), load.writes);
        assertNull(load.error);
    }

    @Test
    void nameBoundEarlierInCellIsNotARead() {
        CellReport clean = cell("clean");
        assertEquals(List.of("df"), clean.reads);
        assertEquals(List.of("clean", "threshold"), clean.writes);
    }

    @Test
    void extraBuiltinsAreNotReads() {
        CellReport summary = cell("summary");
        assertEquals(List.of("clean"), summary.reads);
        assertEquals(List.of("summary"), summary.writes);
    }

    @Test
    void parameterDefaultsAreReadButParametersAreNot() {
        CellReport plot = cell("plot");
        assertEquals(List.of("summary", "top_n"), plot.reads);
        assertEquals(List.of("best", "top_regions"), plot.writes);
    }

    @Test
    void brokenCellCarriesParseError() {
        CellReport broken = cell("broken");
        assertTrue(broken.reads.isEmpty());
        assertTrue(broken.writes.isEmpty());
        assertNotNull(broken.error);
        assertEquals("parse_error", broken.error.kind);
        assertEquals(2, broken.error.line);
        assertEquals("expected ':'", broken.error.message);
    }

    @Test
    void analysisErrorHasNoLine() {
        AnalysisResult failed = new DependencyAnalyzer().analyze("x = " + "(".repeat(100_000) + "1" + ")".repeat(100_000));
        CellReport mapped = NotebookAnalyzer.toCellReport("deep", failed);
        assertEquals("analysis_error", mapped.error.kind);
        assertNull(mapped.error.line);
        assertTrue(mapped.error.message.startsWith("Failed to analyze dependencies: "));
    }
}
