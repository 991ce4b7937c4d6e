package com.celldeps.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Outcome of analyzing one cell: the external names it reads, the names it binds,
 * or the reason analysis failed. Exactly one of "lists populated" and "error set"
 * holds; a failed result has empty lists.
 */
public record AnalysisResult(List<String> reads, List<String> writes, AnalysisFailure error) {

    public AnalysisResult {
        reads = List.copyOf(reads);
        writes = List.copyOf(writes);
    }

    /** Sorts and de-duplicates both collections. */
    public static AnalysisResult success(Collection<String> reads, Collection<String> writes) {
        return new AnalysisResult(sorted(reads), sorted(writes), null);
    }

    public static AnalysisResult failure(AnalysisFailure error) {
        return new AnalysisResult(List.of(), List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }

    private static List<String> sorted(Collection<String> names) {
        List<String> list = new ArrayList<>(names.stream().distinct().toList());
        list.sort(null);
        return list;
    }
}
