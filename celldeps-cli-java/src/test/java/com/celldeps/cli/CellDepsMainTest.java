package com.celldeps.cli;

import com.celldeps.cli.report.DependencyReport;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellDepsMainTest {

    private static final PrintStream DISCARD = new PrintStream(new ByteArrayOutputStream());

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(CellDepsMain.UsageException.class, () -> CellDepsMain.run(new String[]{}, DISCARD));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(CellDepsMain.UsageException.class,
                () -> CellDepsMain.run(new String[]{"record"}, DISCARD));
    }

    @Test
    void analyzeRequiresFile() {
        Exception ex = assertThrows(CellDepsMain.UsageException.class,
                () -> CellDepsMain.run(new String[]{"analyze", "--builtin", "spark"}, DISCARD));
        assertEquals("--file is required", ex.getMessage());
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        Exception ex = assertThrows(CellDepsMain.UsageException.class,
                () -> CellDepsMain.run(new String[]{"analyze", "--file"}, DISCARD));
        assertEquals("--file requires an argument", ex.getMessage());
    }

    @Test
    void notebookRequiresManifestAndOutput() {
        assertThrows(CellDepsMain.UsageException.class,
                () -> CellDepsMain.run(new String[]{"notebook", "--output", "/tmp/out"}, DISCARD));
        assertThrows(CellDepsMain.UsageException.class,
                () -> CellDepsMain.run(new String[]{"notebook", "--manifest", "/tmp/m.json"}, DISCARD));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(CellDepsMain.UsageException.class,
                () -> CellDepsMain.run(new String[]{"notebook", "--foo", "bar"}, DISCARD));
    }

    @Test
    void analyzePrintsCellResult(@TempDir Path tmp) throws Exception {
        Path cell = tmp.resolve("cell.py");
        Files.writeString(cell, "y = x + spark.range(3).count()\n");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CellDepsMain.run(new String[]{"analyze", "--file", cell.toString(), "--builtin", "spark"},
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        DependencyReport.CellReport printed = new Gson().fromJson(
                buffer.toString(StandardCharsets.UTF_8), DependencyReport.CellReport.class);
        assertEquals("cell.py", printed.id);
        assertEquals(List.of("x"), printed.reads);
        assertEquals(List.of("y"), printed.writes);
        assertNull(printed.error);
    }

    @Test
    void analyzeReportsSyntaxErrorInOutputNotAsFailure(@TempDir Path tmp) throws Exception {
        Path cell = tmp.resolve("bad.py");
        Files.writeString(cell, "x = (1,\n");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CellDepsMain.run(new String[]{"analyze", "--file", cell.toString()},
                new PrintStream(buffer, true, StandardCharsets.UTF_8));

        DependencyReport.CellReport printed = new Gson().fromJson(
                buffer.toString(StandardCharsets.UTF_8), DependencyReport.CellReport.class);
        assertTrue(printed.reads.isEmpty());
        assertTrue(printed.writes.isEmpty());
        assertEquals("parse_error", printed.error.kind);
        assertEquals(1, printed.error.line);
    }

    @Test
    void analyzeMissingFileFails(@TempDir Path tmp) {
        assertThrows(UncheckedIOException.class, () -> CellDepsMain.run(
                new String[]{"analyze", "--file", tmp.resolve("missing.py").toString()}, DISCARD));
    }

    @Test
    void notebookWritesReport(@TempDir Path tmp) throws Exception {
        Files.writeString(tmp.resolve("manifest.json"), """
            {
              "notebook_name": "tiny",
              "cells": [
                { "id": "a", "source": "x = 1" },
                { "id": "b", "source": "y = x * 2" }
              ]
            }
            """);
        Path out = tmp.resolve("out");
        CellDepsMain.run(new String[]{"notebook", "--manifest", tmp.resolve("manifest.json").toString(),
                "--output", out.toString()}, DISCARD);

        assertTrue(Files.exists(out.resolve("dependencies.json")));
    }
}
