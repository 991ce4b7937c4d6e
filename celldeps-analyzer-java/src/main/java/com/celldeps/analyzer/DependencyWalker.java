package com.celldeps.analyzer;

import com.celldeps.analyzer.scope.IdentifierClassifier;
import com.celldeps.analyzer.scope.ScopeTracker;
import com.celldeps.analyzer.syntax.Expr;
import com.celldeps.analyzer.syntax.Expr.Attribute;
import com.celldeps.analyzer.syntax.Expr.Comprehension;
import com.celldeps.analyzer.syntax.Expr.ComprehensionClause;
import com.celldeps.analyzer.syntax.Expr.Compound;
import com.celldeps.analyzer.syntax.Expr.Lambda;
import com.celldeps.analyzer.syntax.Expr.Name;
import com.celldeps.analyzer.syntax.Expr.NamedExpr;
import com.celldeps.analyzer.syntax.Expr.Sequence;
import com.celldeps.analyzer.syntax.Expr.Starred;
import com.celldeps.analyzer.syntax.Expr.Subscript;
import com.celldeps.analyzer.syntax.ExprContext;
import com.celldeps.analyzer.syntax.ParsedCell;
import com.celldeps.analyzer.syntax.Pattern;
import com.celldeps.analyzer.syntax.Stmt;
import com.celldeps.analyzer.syntax.Stmt.Alias;
import com.celldeps.analyzer.syntax.Stmt.ExceptHandler;
import com.celldeps.analyzer.syntax.Stmt.MatchCase;
import com.celldeps.analyzer.syntax.Stmt.TypeParam;
import com.celldeps.analyzer.syntax.Stmt.WithItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the raw reads and writes of one parsed cell.
 *
 * <p>A name in load position is a read unless it is bound in the innermost frame
 * at that point of the walk. Raw reads still include builtins and the wildcard
 * sentinel; {@link DependencyAnalyzer} filters them.</p>
 *
 * <p>Single use: create one walker per cell.</p>
 */
class DependencyWalker {

    private final ScopeTracker scope = new ScopeTracker();
    private final Set<String> reads = new LinkedHashSet<>();

    void walkCell(ParsedCell cell) {
        walkStatements(cell.body());
    }

    Set<String> reads() {
        return Collections.unmodifiableSet(reads);
    }

    Set<String> writes() {
        return scope.writes();
    }

    private void walkStatements(List<Stmt> statements) {
        for (Stmt statement : statements) {
            walk(statement);
        }
    }

    private void walkExpressions(List<Expr> expressions) {
        for (Expr expression : expressions) {
            walk(expression);
        }
    }

    private void walkIfPresent(Expr expression) {
        if (expression != null) {
            walk(expression);
        }
    }

    private void read(String name) {
        if (!scope.isLocallyBound(name)) {
            reads.add(name);
        }
    }

    // --- Statements ---

    private void walk(Stmt stmt) {
        if (stmt instanceof Stmt.ExprStmt s) {
            walk(s.value());
        } else if (stmt instanceof Stmt.Assign s) {
            walk(s.value());
            walkExpressions(s.targets());
        } else if (stmt instanceof Stmt.AugAssign s) {
            walk(s.value());
            if (s.target() instanceof Name name) {
                read(name.id());
                scope.bind(name.id());
            } else {
                walk(s.target());
            }
        } else if (stmt instanceof Stmt.AnnAssign s) {
            walk(s.annotation());
            walkIfPresent(s.value());
            walk(s.target());
        } else if (stmt instanceof Stmt.FunctionDef s) {
            walkFunctionDef(s);
        } else if (stmt instanceof Stmt.ClassDef s) {
            walkClassDef(s);
        } else if (stmt instanceof Stmt.Import s) {
            for (Alias alias : s.names()) {
                scope.bind(alias.boundName());
            }
        } else if (stmt instanceof Stmt.ImportFrom s) {
            for (Alias alias : s.names()) {
                if (alias.name().equals("*")) {
                    reads.add(IdentifierClassifier.WILDCARD_IMPORT);
                } else {
                    scope.bind(alias.asName() != null ? alias.asName() : alias.name());
                }
            }
        } else if (stmt instanceof Stmt.TypeAlias s) {
            scope.bind(s.name());
            try (ScopeTracker.Frame ignored = scope.enter(typeParamNames(s.typeParams()))) {
                walkTypeParamBounds(s.typeParams());
                walk(s.value());
            }
        } else if (stmt instanceof Stmt.Return s) {
            walkIfPresent(s.value());
        } else if (stmt instanceof Stmt.Delete s) {
            walkExpressions(s.targets());
        } else if (stmt instanceof Stmt.Raise s) {
            walkIfPresent(s.exception());
            walkIfPresent(s.cause());
        } else if (stmt instanceof Stmt.Assert s) {
            walk(s.test());
            walkIfPresent(s.message());
        } else if (stmt instanceof Stmt.If s) {
            walk(s.test());
            walkStatements(s.body());
            walkStatements(s.orElse());
        } else if (stmt instanceof Stmt.While s) {
            walk(s.test());
            walkStatements(s.body());
            walkStatements(s.orElse());
        } else if (stmt instanceof Stmt.For s) {
            walk(s.iterable());
            walk(s.target());
            walkStatements(s.body());
            walkStatements(s.orElse());
        } else if (stmt instanceof Stmt.With s) {
            for (WithItem item : s.items()) {
                walk(item.context());
                walkIfPresent(item.target());
            }
            walkStatements(s.body());
        } else if (stmt instanceof Stmt.Try s) {
            walkStatements(s.body());
            for (ExceptHandler handler : s.handlers()) {
                walkIfPresent(handler.type());
                if (handler.name() != null) {
                    scope.bind(handler.name());
                }
                walkStatements(handler.body());
            }
            walkStatements(s.orElse());
            walkStatements(s.finalBody());
        } else if (stmt instanceof Stmt.Match s) {
            walk(s.subject());
            for (MatchCase matchCase : s.cases()) {
                walk(matchCase.pattern());
                walkIfPresent(matchCase.guard());
                walkStatements(matchCase.body());
            }
        }
        // global, nonlocal, pass, break and continue neither read nor bind
    }

    private void walkFunctionDef(Stmt.FunctionDef def) {
        walkExpressions(def.decorators());
        walkExpressions(def.parameters().defaults());
        List<String> typeParams = typeParamNames(def.typeParams());
        if (typeParams.isEmpty()) {
            walkSignature(def);
        } else {
            try (ScopeTracker.Frame ignored = scope.enter(typeParams)) {
                walkTypeParamBounds(def.typeParams());
                walkSignature(def);
            }
        }
        scope.bind(def.name());

        List<String> locals = new ArrayList<>(typeParams);
        locals.addAll(def.parameters().names());
        try (ScopeTracker.Frame ignored = scope.enter(locals)) {
            walkStatements(def.body());
        }
    }

    private void walkSignature(Stmt.FunctionDef def) {
        walkExpressions(def.parameters().annotations());
        walkIfPresent(def.returns());
    }

    private void walkClassDef(Stmt.ClassDef def) {
        walkExpressions(def.decorators());
        List<String> typeParams = typeParamNames(def.typeParams());
        if (typeParams.isEmpty()) {
            walkExpressions(def.arguments());
        } else {
            try (ScopeTracker.Frame ignored = scope.enter(typeParams)) {
                walkTypeParamBounds(def.typeParams());
                walkExpressions(def.arguments());
            }
        }
        scope.bind(def.name());
        try (ScopeTracker.Frame ignored = scope.enter(typeParams)) {
            walkStatements(def.body());
        }
    }

    private static List<String> typeParamNames(List<TypeParam> typeParams) {
        return typeParams.stream().map(TypeParam::name).toList();
    }

    private void walkTypeParamBounds(List<TypeParam> typeParams) {
        for (TypeParam param : typeParams) {
            walkIfPresent(param.bound());
        }
    }

    // --- Expressions ---

    private void walk(Expr expr) {
        if (expr instanceof Name name) {
            if (name.ctx() == ExprContext.LOAD) {
                read(name.id());
            } else if (name.ctx() == ExprContext.STORE) {
                scope.bind(name.id());
            }
        } else if (expr instanceof Attribute attribute) {
            // only the base matters, whatever the attribute's own context
            walk(attribute.value());
        } else if (expr instanceof Subscript subscript) {
            walk(subscript.value());
            walk(subscript.slice());
        } else if (expr instanceof Starred starred) {
            walk(starred.value());
        } else if (expr instanceof Sequence sequence) {
            walkExpressions(sequence.elements());
        } else if (expr instanceof Compound compound) {
            walkExpressions(compound.operands());
        } else if (expr instanceof Lambda lambda) {
            walkExpressions(lambda.parameters().defaults());
            try (ScopeTracker.Frame ignored = scope.enter(lambda.parameters().names())) {
                walk(lambda.body());
            }
        } else if (expr instanceof Comprehension comprehension) {
            walkComprehension(comprehension);
        } else if (expr instanceof NamedExpr named) {
            walk(named.value());
            scope.bindEnclosing(named.target().id());
        }
        // literals reference nothing
    }

    private void walkComprehension(Comprehension comprehension) {
        List<ComprehensionClause> clauses = comprehension.clauses();
        walk(clauses.get(0).iterable());
        try (ScopeTracker.Frame ignored = scope.enterComprehension()) {
            for (int i = 0; i < clauses.size(); i++) {
                ComprehensionClause clause = clauses.get(i);
                if (i > 0) {
                    walk(clause.iterable());
                }
                walk(clause.target());
                walkExpressions(clause.conditions());
            }
            walkExpressions(comprehension.results());
        }
    }

    // --- Patterns ---

    private void walk(Pattern pattern) {
        if (pattern instanceof Pattern.Capture capture) {
            bindIfPresent(capture.name());
        } else if (pattern instanceof Pattern.Value value) {
            walk(value.value());
        } else if (pattern instanceof Pattern.SequencePattern sequence) {
            sequence.elements().forEach(this::walk);
        } else if (pattern instanceof Pattern.Star star) {
            bindIfPresent(star.name());
        } else if (pattern instanceof Pattern.Mapping mapping) {
            walkExpressions(mapping.keys());
            mapping.values().forEach(this::walk);
            bindIfPresent(mapping.rest());
        } else if (pattern instanceof Pattern.ClassPattern classPattern) {
            walk(classPattern.cls());
            classPattern.arguments().forEach(this::walk);
        } else if (pattern instanceof Pattern.As as) {
            walk(as.pattern());
            scope.bind(as.name());
        } else if (pattern instanceof Pattern.Or or) {
            or.alternatives().forEach(this::walk);
        }
    }

    private void bindIfPresent(String name) {
        if (name != null) {
            scope.bind(name);
        }
    }
}
