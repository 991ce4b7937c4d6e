package com.celldeps.analyzer;

import com.celldeps.analyzer.scope.IdentifierClassifier;
import com.celldeps.analyzer.syntax.ParsedCell;
import com.celldeps.analyzer.syntax.PythonParser;
import com.celldeps.analyzer.syntax.PythonSyntaxException;

import java.util.List;
import java.util.Objects;

/**
 * Extracts the read and write sets of a notebook cell.
 *
 * <p>Pipeline: parse the source, walk the tree from a fresh cell frame, drop
 * reserved names from the reads, sort. Failures never escape {@link #analyze}:
 * they come back as the error half of the result.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public class DependencyAnalyzer {

    private final IdentifierClassifier classifier;

    public DependencyAnalyzer() {
        this(IdentifierClassifier.defaults());
    }

    public DependencyAnalyzer(IdentifierClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Analyzes one cell.
     *
     * @param source the cell's Python source
     * @return sorted reads and writes, or a parse/analysis error with empty lists
     */
    public AnalysisResult analyze(String source) {
        if (source == null) {
            return AnalysisResult.failure(AnalysisFailure.analysisError("source must not be null"));
        }
        try {
            ParsedCell cell = PythonParser.parse(source);
            DependencyWalker walker = new DependencyWalker();
            walker.walkCell(cell);

            List<String> reads = walker.reads().stream()
                    .filter(name -> !classifier.isReserved(name))
                    .toList();
            return AnalysisResult.success(reads, walker.writes());
        } catch (PythonSyntaxException e) {
            AnalysisFailure failure = AnalysisFailure.parseError(e.getMessage(), e.getLine());
            System.err.println("[celldeps] WARN: " + failure.describe());
            return AnalysisResult.failure(failure);
        } catch (RuntimeException | StackOverflowError e) {
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            AnalysisFailure failure = AnalysisFailure.analysisError("Failed to analyze dependencies: " + detail);
            System.err.println("[celldeps] ERROR: " + failure.message());
            return AnalysisResult.failure(failure);
        }
    }
}
