package com.celldeps.analyzer.syntax;

import java.util.List;

/**
 * Expression nodes.
 *
 * <p>Only forms that bind or reference names get their own case. Operators, calls,
 * displays and the like are all {@link Compound}: a label plus the operands
 * evaluated in load context.</p>
 */
public sealed interface Expr {

    int line();

    record Name(String id, ExprContext ctx, int line) implements Expr {}

    /** {@code value.attr}; {@code ctx} is the context of the whole attribute expression. */
    record Attribute(Expr value, String attr, ExprContext ctx, int line) implements Expr {}

    record Subscript(Expr value, Expr slice, ExprContext ctx, int line) implements Expr {}

    record Starred(Expr value, ExprContext ctx, int line) implements Expr {}

    /** Tuple or list display; the only displays that can be assignment targets. */
    record Sequence(SequenceKind kind, List<Expr> elements, ExprContext ctx, int line) implements Expr {}

    /** Number, string without replacement fields, {@code True}/{@code False}/{@code None} or {@code ...}. */
    record Literal(String text, int line) implements Expr {}

    /**
     * Any other expression: {@code form} names it for error messages ("function call",
     * "expression", "f-string expression", ...) and {@code operands} are its sub-expressions.
     */
    record Compound(String form, List<Expr> operands, int line) implements Expr {}

    record Lambda(Parameters parameters, Expr body, int line) implements Expr {}

    /**
     * List, set or dict comprehension, or generator expression. {@code results} is the
     * element, or key and value for dict comprehensions.
     */
    record Comprehension(String form, List<Expr> results, List<ComprehensionClause> clauses, int line) implements Expr {}

    /** Assignment expression {@code target := value}. */
    record NamedExpr(Name target, Expr value, int line) implements Expr {}

    enum SequenceKind { TUPLE, LIST }

    /** One {@code [async] for target in iterable if cond...} clause. */
    record ComprehensionClause(Expr target, Expr iterable, List<Expr> conditions, boolean async) {}
}
