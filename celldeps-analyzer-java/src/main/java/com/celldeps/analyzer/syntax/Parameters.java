package com.celldeps.analyzer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parameter list of a {@code def} or {@code lambda}.
 */
public record Parameters(List<Parameter> parameters) {

    public static final Parameters EMPTY = new Parameters(List.of());

    public enum Kind { POSITIONAL_ONLY, POSITIONAL, VAR_POSITIONAL, KEYWORD_ONLY, VAR_KEYWORD }

    /**
     * @param annotation   nullable; always null for lambda parameters
     * @param defaultValue nullable
     */
    public record Parameter(String name, Kind kind, Expr annotation, Expr defaultValue) {}

    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Parameter p : parameters) names.add(p.name());
        return names;
    }

    /** Default values, evaluated where the function is defined. */
    public List<Expr> defaults() {
        return parameters.stream().map(Parameter::defaultValue).filter(Objects::nonNull).toList();
    }

    public List<Expr> annotations() {
        return parameters.stream().map(Parameter::annotation).filter(Objects::nonNull).toList();
    }
}
