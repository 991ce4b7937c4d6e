package com.celldeps.analyzer;

import java.util.Objects;

/**
 * Error half of an {@link AnalysisResult}.
 *
 * @param line 1-based line of a parse error; null for analysis errors
 */
public record AnalysisFailure(ErrorKind kind, String message, Integer line) {

    public AnalysisFailure {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static AnalysisFailure parseError(String message, int line) {
        return new AnalysisFailure(ErrorKind.PARSE_ERROR, message, line);
    }

    public static AnalysisFailure analysisError(String message) {
        return new AnalysisFailure(ErrorKind.ANALYSIS_ERROR, message, null);
    }

    /** The message shown to notebook users, e.g. {@code Syntax error at line 2: expected ':'}. */
    public String describe() {
        if (kind == ErrorKind.PARSE_ERROR) {
            return "Syntax error at line " + line + ": " + message;
        }
        return message;
    }
}
