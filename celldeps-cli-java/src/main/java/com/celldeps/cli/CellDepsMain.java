package com.celldeps.cli;

import com.celldeps.analyzer.AnalysisResult;
import com.celldeps.analyzer.DependencyAnalyzer;
import com.celldeps.analyzer.scope.IdentifierClassifier;
import com.celldeps.cli.manifest.CellSource;
import com.celldeps.cli.manifest.NotebookManifest;
import com.celldeps.cli.manifest.NotebookManifestReader;
import com.celldeps.cli.notebook.NotebookAnalyzer;
import com.celldeps.cli.report.DependencyReport;
import com.celldeps.cli.report.ReportSerializer;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for the celldeps command line.
 *
 * Usage:
 *   java -jar celldeps-cli-java.jar analyze --file <cell.py> [--builtin <name>]...
 *   java -jar celldeps-cli-java.jar notebook \
 *     --manifest <path-to-manifest.json> \
 *     --output   <output-dir>
 */
public class CellDepsMain {

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[celldeps-cli] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar celldeps-cli-java.jar analyze --file <cell.py> [--builtin <name>]...");
            System.err.println("       java -jar celldeps-cli-java.jar notebook --manifest <path> --output <dir>");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[celldeps-cli] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        switch (args[0]) {
            case "analyze"  -> runAnalyze(args, out);
            case "notebook" -> runNotebook(args);
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        }
    }

    /** Analyzes a single cell file and prints its JSON result to {@code out}. */
    private static void runAnalyze(String[] args, PrintStream out) {
        String file = null;
        List<String> builtins = new ArrayList<>();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--file"    -> file = requireNext(args, i++, "--file");
                case "--builtin" -> builtins.add(requireNext(args, i++, "--builtin"));
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (file == null) throw new UsageException("--file is required");

        Path cellPath = Paths.get(file);
        String source;
        try {
            source = Files.readString(cellPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cell file " + cellPath + ": " + e.getMessage(), e);
        }

        DependencyAnalyzer analyzer = new DependencyAnalyzer(
                IdentifierClassifier.defaults().withAdditional(builtins));
        AnalysisResult result = analyzer.analyze(source);
        String id = cellPath.getFileName() != null ? cellPath.getFileName().toString() : file;
        out.println(new ReportSerializer().toJson(NotebookAnalyzer.toCellReport(id, result)));
    }

    /** Analyzes every cell listed in a manifest and writes dependencies.json. */
    private static void runNotebook(String[] args) {
        String manifestPath = null;
        String outputDir = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--manifest" -> manifestPath = requireNext(args, i++, "--manifest");
                case "--output"   -> outputDir    = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (manifestPath == null) throw new UsageException("--manifest is required");
        if (outputDir == null)    throw new UsageException("--output is required");

        Path manifest = Paths.get(manifestPath);
        Path output   = Paths.get(outputDir);

        // 1. Read manifest and cell sources; file cells are relative to the manifest's directory
        System.err.println("[celldeps-cli] Reading manifest: " + manifest);
        NotebookManifestReader reader = new NotebookManifestReader();
        NotebookManifest config = reader.read(manifest);
        List<CellSource> cells = reader.loadCells(config, manifest.toAbsolutePath().getParent());

        // 2. Analyze
        System.err.println("[celldeps-cli] Analyzing notebook '" + config.getNotebookName() + "'...");
        DependencyReport.ReportRoot report = new NotebookAnalyzer()
                .analyze(config.getNotebookName(), cells, config.getExtraBuiltins());

        // 3. Serialize
        System.err.println("[celldeps-cli] Writing output to: " + output);
        new ReportSerializer().write(report, output);

        System.err.println("[celldeps-cli] Done.");
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
