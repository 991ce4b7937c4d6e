package com.celldeps.analyzer.syntax;

import java.util.List;

/**
 * Statement nodes. Nullable components are noted per record; lists are never null.
 */
public sealed interface Stmt {

    int line();

    record ExprStmt(Expr value, int line) implements Stmt {}

    /** {@code t1 = t2 = value}; targets are in store context. */
    record Assign(List<Expr> targets, Expr value, int line) implements Stmt {}

    record AugAssign(Expr target, String operator, Expr value, int line) implements Stmt {}

    /** {@code target: annotation [= value]}; {@code value} is nullable. */
    record AnnAssign(Expr target, Expr annotation, Expr value, int line) implements Stmt {}

    /** {@code returns} is nullable. */
    record FunctionDef(String name, List<TypeParam> typeParams, Parameters parameters, Expr returns,
                       List<Expr> decorators, List<Stmt> body, boolean async, int line) implements Stmt {}

    /** {@code arguments} holds base classes and keyword values, e.g. a metaclass. */
    record ClassDef(String name, List<TypeParam> typeParams, List<Expr> arguments,
                    List<Expr> decorators, List<Stmt> body, int line) implements Stmt {}

    record Import(List<Alias> names, int line) implements Stmt {}

    /**
     * {@code from module import names}; {@code module} is null for {@code from . import x},
     * {@code level} counts the leading dots.
     */
    record ImportFrom(String module, List<Alias> names, int level, int line) implements Stmt {}

    record TypeAlias(String name, List<TypeParam> typeParams, Expr value, int line) implements Stmt {}

    /** {@code value} is nullable. */
    record Return(Expr value, int line) implements Stmt {}

    record Delete(List<Expr> targets, int line) implements Stmt {}

    /** Both components nullable. */
    record Raise(Expr exception, Expr cause, int line) implements Stmt {}

    /** {@code message} is nullable. */
    record Assert(Expr test, Expr message, int line) implements Stmt {}

    /** {@code global} or {@code nonlocal} declaration. */
    record ScopeDeclaration(String keyword, List<String> names, int line) implements Stmt {}

    /** {@code pass}, {@code break} or {@code continue}. */
    record Jump(String keyword, int line) implements Stmt {}

    record If(Expr test, List<Stmt> body, List<Stmt> orElse, int line) implements Stmt {}

    record While(Expr test, List<Stmt> body, List<Stmt> orElse, int line) implements Stmt {}

    record For(Expr target, Expr iterable, List<Stmt> body, List<Stmt> orElse, boolean async, int line) implements Stmt {}

    record With(List<WithItem> items, List<Stmt> body, boolean async, int line) implements Stmt {}

    record Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orElse, List<Stmt> finalBody,
               int line) implements Stmt {}

    record Match(Expr subject, List<MatchCase> cases, int line) implements Stmt {}

    /** One imported name; {@code asName} is nullable. */
    record Alias(String name, String asName) {

        /**
         * The local name the import binds: the alias when given, otherwise the
         * leading component of a dotted module name.
         */
        public String boundName() {
            if (asName != null) return asName;
            int dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
    }

    /** {@code target} is nullable. */
    record WithItem(Expr context, Expr target) {}

    /** {@code type} and {@code name} are nullable. */
    record ExceptHandler(Expr type, String name, List<Stmt> body, int line) {}

    /** {@code guard} is nullable. */
    record MatchCase(Pattern pattern, Expr guard, List<Stmt> body) {}

    /** PEP 695 type parameter; {@code bound} is nullable. */
    record TypeParam(String name, Expr bound) {}
}
