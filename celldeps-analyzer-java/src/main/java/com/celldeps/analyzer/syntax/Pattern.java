package com.celldeps.analyzer.syntax;

import java.util.List;

/**
 * Patterns of a {@code match} statement's {@code case} clauses.
 */
public sealed interface Pattern {

    /** Capture pattern; {@code name} is null for the wildcard {@code _}. */
    record Capture(String name) implements Pattern {}

    /** Literal or dotted-name value pattern. */
    record Value(Expr value) implements Pattern {}

    record SequencePattern(List<Pattern> elements) implements Pattern {}

    /** {@code *name} inside a sequence pattern; {@code name} is null for {@code *_}. */
    record Star(String name) implements Pattern {}

    /** {@code rest} is the nullable {@code **rest} capture. */
    record Mapping(List<Expr> keys, List<Pattern> values, String rest) implements Pattern {}

    /** Keyword sub-patterns are kept without their attribute names. */
    record ClassPattern(Expr cls, List<Pattern> arguments) implements Pattern {}

    record As(Pattern pattern, String name) implements Pattern {}

    record Or(List<Pattern> alternatives) implements Pattern {}
}
