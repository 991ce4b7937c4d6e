package com.celldeps.cli.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link DependencyReport.ReportRoot} to dependencies.json.
 * Cells keep their manifest order; null fields are written explicitly.
 */
public class ReportSerializer {

    public static final String REPORT_FILE = "dependencies.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code root} to {@code outputDir/dependencies.json}.
     *
     * @param outputDir directory to write into (created if absent)
     * @return the written file
     */
    public Path write(DependencyReport.ReportRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + outputDir, e);
        }
        Path reportPath = outputDir.resolve(REPORT_FILE);
        try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            GSON.toJson(root, w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + REPORT_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[celldeps-cli] " + REPORT_FILE + " written: " + reportPath);
        return reportPath;
    }

    /** Pretty-printed JSON for a single cell, as printed by the {@code analyze} command. */
    public String toJson(DependencyReport.CellReport cell) {
        return GSON.toJson(cell);
    }
}
