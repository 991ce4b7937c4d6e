package com.celldeps.analyzer.syntax;

import com.celldeps.analyzer.syntax.Expr.Attribute;
import com.celldeps.analyzer.syntax.Expr.Comprehension;
import com.celldeps.analyzer.syntax.Expr.ComprehensionClause;
import com.celldeps.analyzer.syntax.Expr.Compound;
import com.celldeps.analyzer.syntax.Expr.Lambda;
import com.celldeps.analyzer.syntax.Expr.Literal;
import com.celldeps.analyzer.syntax.Expr.Name;
import com.celldeps.analyzer.syntax.Expr.NamedExpr;
import com.celldeps.analyzer.syntax.Expr.Sequence;
import com.celldeps.analyzer.syntax.Expr.SequenceKind;
import com.celldeps.analyzer.syntax.Expr.Starred;
import com.celldeps.analyzer.syntax.Expr.Subscript;
import com.celldeps.analyzer.syntax.Parameters.Parameter;
import com.celldeps.analyzer.syntax.Stmt.Alias;
import com.celldeps.analyzer.syntax.Stmt.ExceptHandler;
import com.celldeps.analyzer.syntax.Stmt.MatchCase;
import com.celldeps.analyzer.syntax.Stmt.TypeParam;
import com.celldeps.analyzer.syntax.Stmt.WithItem;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.celldeps.analyzer.syntax.TreeSitterNodes.column;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.endLine;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.field;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.fieldChildren;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.firstChild;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.hasChild;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.lastChild;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.line;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.namedChildren;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.unfieldedChildren;

/**
 * Converts an error-free tree-sitter Python tree into {@link Stmt}, {@link Expr} and
 * {@link Pattern} records, rejecting what the grammar accepts but CPython does not.
 *
 * <p>One instance per cell; not thread-safe.</p>
 */
final class ParseTreeConverter {

    /** Deeper nesting is refused with an {@link IllegalStateException}. */
    static final int MAX_DEPTH = 1_000;

    private static final Set<String> HARD_KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
        "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
        "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield"
    );

    private static final Set<String> COMPOUND_STATEMENTS = Set.of(
        "if_statement", "for_statement", "while_statement", "try_statement", "with_statement",
        "function_definition", "class_definition", "decorated_definition", "match_statement"
    );

    /** How CPython names each block owner in "expected an indented block" errors. */
    private static final Map<String, String> BLOCK_OWNERS = Map.ofEntries(
        Map.entry("function_definition", "function definition"),
        Map.entry("class_definition", "class definition"),
        Map.entry("if_statement", "'if' statement"),
        Map.entry("elif_clause", "'elif' statement"),
        Map.entry("else_clause", "'else' statement"),
        Map.entry("for_statement", "'for' statement"),
        Map.entry("while_statement", "'while' statement"),
        Map.entry("try_statement", "'try' statement"),
        Map.entry("except_clause", "'except' statement"),
        Map.entry("except_group_clause", "'except*' statement"),
        Map.entry("finally_clause", "'finally' statement"),
        Map.entry("with_statement", "'with' statement"),
        Map.entry("match_statement", "'match' statement"),
        Map.entry("case_clause", "'case' statement")
    );

    private static final Set<String> STRING_PREFIXES = Set.of("", "r", "u", "b", "br", "rb", "f", "fr", "rf");

    private static final Set<String> CONVERSIONS = Set.of("s", "r", "a");

    private final byte[] utf8;
    private final int lineCount;
    private int depth;

    ParseTreeConverter(byte[] utf8) {
        this.utf8 = utf8;
        int lines = 1;
        for (int i = 0; i < utf8.length; i++) {
            if (utf8[i] == '\n' && i < utf8.length - 1) lines++;
        }
        this.lineCount = lines;
    }

    ParsedCell convertModule(TSNode module) {
        List<TSNode> statements = namedChildren(module);
        checkIndentation(statements, 0);
        return new ParsedCell(convertStatements(statements));
    }

    // --- Blocks ---

    /** Body of a compound statement or clause; {@code owner} names the construct in errors. */
    private List<Stmt> block(TSNode owner, TSNode block) {
        List<TSNode> statements = block == null ? List.of() : namedChildren(block);
        if (statements.isEmpty()) {
            throw new PythonSyntaxException("expected an indented block after "
                    + BLOCK_OWNERS.getOrDefault(owner.getType(), "statement") + " on line " + line(owner),
                    Math.min(line(owner) + 1, lineCount));
        }
        TSNode first = statements.get(0);
        if (line(first) != line(owner)) {
            checkIndentation(statements, column(first));
        }
        return convertStatements(statements);
    }

    private List<Stmt> convertStatements(List<TSNode> statements) {
        List<Stmt> body = new ArrayList<>();
        for (TSNode statement : statements) {
            body.add(statement(statement));
        }
        return List.copyOf(body);
    }

    /** Statements that start a line must all start at {@code indent}. */
    private void checkIndentation(List<TSNode> statements, int indent) {
        TSNode previous = null;
        for (TSNode statement : statements) {
            boolean startsLine = previous == null || endLine(previous) < line(statement);
            if (startsLine && column(statement) != indent) {
                boolean afterBlock = previous != null && COMPOUND_STATEMENTS.contains(previous.getType())
                        && endLine(previous) > line(previous);
                String message = column(statement) > indent && !afterBlock
                        ? "unexpected indent"
                        : "unindent does not match any outer indentation level";
                throw new PythonSyntaxException(message, line(statement));
            }
            previous = statement;
        }
    }

    // --- Statements ---

    private Stmt statement(TSNode n) {
        enter(n);
        try {
            return convertStatement(n);
        } finally {
            depth--;
        }
    }

    private Stmt convertStatement(TSNode n) {
        int line = line(n);
        switch (n.getType()) {
            case "expression_statement":
                return expressionStatement(n);
            case "import_statement":
                return new Stmt.Import(aliases(fieldChildren(n, "name")), line);
            case "import_from_statement":
                return importFrom(n);
            case "future_import_statement":
                return new Stmt.ImportFrom("__future__", aliases(fieldChildren(n, "name")), 0, line);
            case "print_statement":
                throw new PythonSyntaxException("Missing parentheses in call to 'print'. Did you mean print(...)?", line);
            case "exec_statement":
                throw new PythonSyntaxException("Missing parentheses in call to 'exec'. Did you mean exec(...)?", line);
            case "pass_statement", "break_statement", "continue_statement":
                return new Stmt.Jump(text(n), line);
            case "return_statement": {
                List<TSNode> value = namedChildren(n);
                return new Stmt.Return(value.isEmpty() ? null : value(value.get(0)), line);
            }
            case "delete_statement":
                return delete(n);
            case "raise_statement":
                return raise(n);
            case "assert_statement": {
                List<TSNode> parts = namedChildren(n);
                return new Stmt.Assert(expression(parts.get(0)), parts.size() > 1 ? expression(parts.get(1)) : null, line);
            }
            case "global_statement", "nonlocal_statement": {
                List<String> names = new ArrayList<>();
                for (TSNode name : namedChildren(n)) {
                    names.add(identifier(name));
                }
                return new Stmt.ScopeDeclaration(n.getType().startsWith("global") ? "global" : "nonlocal",
                        List.copyOf(names), line);
            }
            case "type_alias_statement":
                return typeAlias(n);
            case "if_statement":
                return ifStatement(n);
            case "while_statement":
                return new Stmt.While(expression(field(n, "condition")), block(n, field(n, "body")),
                        elseBlock(field(n, "alternative")), line);
            case "for_statement":
                return new Stmt.For(target(field(n, "left"), ExprContext.STORE), value(field(n, "right")),
                        block(n, field(n, "body")), elseBlock(field(n, "alternative")), hasChild(n, "async"), line);
            case "try_statement":
                return tryStatement(n);
            case "with_statement":
                return withStatement(n);
            case "function_definition":
                return functionDef(n, List.of());
            case "class_definition":
                return classDef(n, List.of());
            case "decorated_definition":
                return decorated(n);
            case "match_statement":
                return match(n);
            default:
                throw new PythonSyntaxException("invalid syntax", line);
        }
    }

    private Stmt expressionStatement(TSNode n) {
        List<TSNode> parts = namedChildren(n);
        TSNode first = parts.get(0);
        if (parts.size() == 1 && first.getType().equals("assignment")) {
            return assignment(first);
        }
        if (parts.size() == 1 && first.getType().equals("augmented_assignment")) {
            return augmentedAssignment(first);
        }
        if (parts.size() == 1 && !hasChild(n, ",")) {
            return new Stmt.ExprStmt(value(first), line(n));
        }
        return new Stmt.ExprStmt(new Sequence(SequenceKind.TUPLE, expressions(parts), ExprContext.LOAD, line(n)), line(n));
    }

    private Stmt assignment(TSNode n) {
        TSNode annotation = field(n, "type");
        if (annotation != null) {
            TSNode right = field(n, "right");
            if (right != null && right.getType().equals("assignment")) {
                throw new PythonSyntaxException("invalid syntax", line(right));
            }
            Expr target = expression(field(n, "left"));
            if (target instanceof Sequence sequence) {
                throw new PythonSyntaxException("only single target (not " + describe(sequence) + ") can be annotated",
                        line(n));
            }
            if (!(target instanceof Name || target instanceof Attribute || target instanceof Subscript)) {
                throw new PythonSyntaxException("illegal target for annotation", line(n));
            }
            return new Stmt.AnnAssign(toTarget(target, ExprContext.STORE), expression(annotation),
                    right == null ? null : value(right), line(n));
        }

        List<Expr> targets = new ArrayList<>();
        TSNode current = n;
        while (true) {
            Expr target = expression(field(current, "left"));
            if (target instanceof Starred) {
                throw new PythonSyntaxException("starred assignment target must be in a list or tuple", line(current));
            }
            targets.add(toTarget(target, ExprContext.STORE));
            TSNode right = field(current, "right");
            if (!right.getType().equals("assignment")) {
                return new Stmt.Assign(List.copyOf(targets), value(right), line(n));
            }
            if (field(right, "type") != null) {
                throw new PythonSyntaxException("invalid syntax", line(right));
            }
            current = right;
        }
    }

    private Stmt augmentedAssignment(TSNode n) {
        Expr target = expression(field(n, "left"));
        if (!(target instanceof Name || target instanceof Attribute || target instanceof Subscript)) {
            throw new PythonSyntaxException("'" + describe(target) + "' is an illegal expression for augmented assignment",
                    line(n));
        }
        return new Stmt.AugAssign(toTarget(target, ExprContext.STORE), text(field(n, "operator")),
                value(field(n, "right")), line(n));
    }

    private Stmt importFrom(TSNode n) {
        TSNode module = field(n, "module_name");
        String name;
        int level = 0;
        if (module.getType().equals("relative_import")) {
            level = text(firstChild(module, "import_prefix")).length();
            TSNode dotted = firstChild(module, "dotted_name");
            name = dotted == null ? null : dottedName(dotted);
        } else {
            name = dottedName(module);
        }

        if (hasChild(n, "wildcard_import")) {
            return new Stmt.ImportFrom(name, List.of(new Alias("*", null)), level, line(n));
        }
        TSNode last = lastChild(n);
        if (last != null && last.getType().equals(",") && !hasChild(n, "(")) {
            throw new PythonSyntaxException("trailing comma not allowed without surrounding parentheses", line(last));
        }
        return new Stmt.ImportFrom(name, aliases(fieldChildren(n, "name")), level, line(n));
    }

    private List<Alias> aliases(List<TSNode> names) {
        List<Alias> aliases = new ArrayList<>();
        for (TSNode name : names) {
            if (name.getType().equals("aliased_import")) {
                aliases.add(new Alias(dottedName(field(name, "name")), identifier(field(name, "alias"))));
            } else {
                aliases.add(new Alias(dottedName(name), null));
            }
        }
        return List.copyOf(aliases);
    }

    private String dottedName(TSNode dotted) {
        StringBuilder name = new StringBuilder();
        for (TSNode part : namedChildren(dotted)) {
            if (name.length() > 0) name.append('.');
            name.append(identifier(part));
        }
        return name.toString();
    }

    private Stmt delete(TSNode n) {
        TSNode operand = namedChildren(n).get(0);
        List<TSNode> parts = operand.getType().equals("expression_list") ? namedChildren(operand) : List.of(operand);
        List<Expr> targets = new ArrayList<>();
        for (TSNode part : parts) {
            targets.add(target(part, ExprContext.DEL));
        }
        return new Stmt.Delete(List.copyOf(targets), line(n));
    }

    private Stmt raise(TSNode n) {
        List<TSNode> exception = unfieldedChildren(n);
        Expr value = null;
        if (!exception.isEmpty()) {
            if (exception.get(0).getType().equals("expression_list")) {
                throw new PythonSyntaxException("invalid syntax", line(exception.get(0)));
            }
            value = expression(exception.get(0));
        }
        TSNode cause = field(n, "cause");
        return new Stmt.Raise(value, cause == null ? null : expression(cause), line(n));
    }

    private Stmt typeAlias(TSNode n) {
        List<TSNode> types = namedChildren(n);
        TSNode head = namedChildren(types.get(0)).get(0);
        String name;
        List<TypeParam> typeParams = List.of();
        if (head.getType().equals("generic_type")) {
            name = identifier(firstChild(head, "identifier"));
            typeParams = typeParams(firstChild(head, "type_parameter"));
        } else if (head.getType().equals("identifier")) {
            name = identifier(head);
        } else {
            throw new PythonSyntaxException("invalid syntax", line(head));
        }
        return new Stmt.TypeAlias(name, typeParams, expression(types.get(1)), line(n));
    }

    private List<TypeParam> typeParams(TSNode list) {
        if (list == null) {
            return List.of();
        }
        List<TypeParam> params = new ArrayList<>();
        for (TSNode type : namedChildren(list)) {
            TSNode inner = namedChildren(type).get(0);
            switch (inner.getType()) {
                case "identifier" -> params.add(new TypeParam(identifier(inner), null));
                case "constrained_type" -> {
                    List<TSNode> parts = namedChildren(inner);
                    params.add(new TypeParam(identifier(namedChildren(parts.get(0)).get(0)), expression(parts.get(1))));
                }
                case "splat_type" -> params.add(new TypeParam(identifier(firstChild(inner, "identifier")), null));
                default -> throw new PythonSyntaxException("invalid syntax", line(inner));
            }
        }
        if (params.isEmpty()) {
            throw new PythonSyntaxException("Type parameter list cannot be empty", line(list));
        }
        return List.copyOf(params);
    }

    private Stmt ifStatement(TSNode n) {
        List<TSNode> alternatives = fieldChildren(n, "alternative");
        List<Stmt> orElse = List.of();
        for (int i = alternatives.size() - 1; i >= 0; i--) {
            TSNode clause = alternatives.get(i);
            if (clause.getType().equals("elif_clause")) {
                orElse = List.of(new Stmt.If(expression(field(clause, "condition")),
                        block(clause, field(clause, "consequence")), orElse, line(clause)));
            } else {
                orElse = block(clause, field(clause, "body"));
            }
        }
        return new Stmt.If(expression(field(n, "condition")), block(n, field(n, "consequence")), orElse, line(n));
    }

    private List<Stmt> elseBlock(TSNode clause) {
        return clause == null ? List.of() : block(clause, field(clause, "body"));
    }

    private Stmt tryStatement(TSNode n) {
        List<Stmt> body = block(n, field(n, "body"));
        List<ExceptHandler> handlers = new ArrayList<>();
        List<Stmt> orElse = List.of();
        List<Stmt> finalBody = List.of();
        for (TSNode clause : namedChildren(n)) {
            switch (clause.getType()) {
                case "except_clause", "except_group_clause" -> handlers.add(exceptHandler(clause));
                case "else_clause" -> orElse = block(clause, field(clause, "body"));
                case "finally_clause" -> finalBody = block(clause, firstChild(clause, "block"));
                default -> { }
            }
        }
        return new Stmt.Try(body, List.copyOf(handlers), orElse, finalBody, line(n));
    }

    private ExceptHandler exceptHandler(TSNode clause) {
        List<TSNode> parts = new ArrayList<>();
        for (TSNode child : namedChildren(clause)) {
            if (!child.getType().equals("block")) {
                parts.add(child);
            }
        }
        if (parts.size() > 1) {
            throw new PythonSyntaxException("multiple exception types must be parenthesized", line(parts.get(1)));
        }
        Expr type = null;
        String name = null;
        if (!parts.isEmpty()) {
            TSNode part = parts.get(0);
            if (part.getType().equals("as_pattern")) {
                type = expression(namedChildren(part).get(0));
                name = identifier(namedChildren(field(part, "alias")).get(0));
            } else {
                type = expression(part);
            }
        }
        return new ExceptHandler(type, name, block(clause, firstChild(clause, "block")), line(clause));
    }

    private Stmt withStatement(TSNode n) {
        List<WithItem> items = new ArrayList<>();
        for (TSNode item : namedChildren(firstChild(n, "with_clause"))) {
            TSNode value = field(item, "value");
            if (value.getType().equals("as_pattern")) {
                TSNode alias = namedChildren(field(value, "alias")).get(0);
                items.add(new WithItem(expression(namedChildren(value).get(0)), target(alias, ExprContext.STORE)));
            } else {
                items.add(new WithItem(expression(value), null));
            }
        }
        return new Stmt.With(List.copyOf(items), block(n, field(n, "body")), hasChild(n, "async"), line(n));
    }

    private Stmt decorated(TSNode n) {
        List<Expr> decorators = new ArrayList<>();
        for (TSNode decorator : namedChildren(n)) {
            if (decorator.getType().equals("decorator")) {
                decorators.add(expression(namedChildren(decorator).get(0)));
            }
        }
        TSNode definition = field(n, "definition");
        return definition.getType().equals("class_definition")
                ? classDef(definition, List.copyOf(decorators))
                : functionDef(definition, List.copyOf(decorators));
    }

    private Stmt functionDef(TSNode n, List<Expr> decorators) {
        TSNode returns = field(n, "return_type");
        return new Stmt.FunctionDef(identifier(field(n, "name")), typeParams(field(n, "type_parameters")),
                parameters(field(n, "parameters")), returns == null ? null : expression(returns),
                decorators, block(n, field(n, "body")), hasChild(n, "async"), line(n));
    }

    private Stmt classDef(TSNode n, List<Expr> decorators) {
        TSNode superclasses = field(n, "superclasses");
        return new Stmt.ClassDef(identifier(field(n, "name")), typeParams(field(n, "type_parameters")),
                superclasses == null ? List.of() : arguments(superclasses), decorators,
                block(n, field(n, "body")), line(n));
    }

    private Parameters parameters(TSNode list) {
        if (list == null) {
            return Parameters.EMPTY;
        }
        List<Parameter> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean star = false;
        boolean slash = false;
        boolean sawDefault = false;
        boolean sawVarKeyword = false;
        int bareStarAt = -1;

        for (TSNode child : namedChildren(list)) {
            if (sawVarKeyword) {
                throw new PythonSyntaxException("arguments cannot follow var-keyword argument", line(child));
            }
            Parameter param;
            switch (child.getType()) {
                case "positional_separator" -> {
                    if (params.isEmpty()) {
                        throw new PythonSyntaxException("at least one argument must precede /", line(child));
                    }
                    if (slash) {
                        throw new PythonSyntaxException("/ may appear only once", line(child));
                    }
                    if (star) {
                        throw new PythonSyntaxException("/ must be ahead of *", line(child));
                    }
                    slash = true;
                    params.replaceAll(p -> new Parameter(p.name(), Parameters.Kind.POSITIONAL_ONLY,
                            p.annotation(), p.defaultValue()));
                    continue;
                }
                case "keyword_separator" -> {
                    if (star) {
                        throw new PythonSyntaxException("* argument may appear only once", line(child));
                    }
                    star = true;
                    bareStarAt = params.size();
                    continue;
                }
                case "identifier" -> param = new Parameter(identifier(child), plainKind(star), null, null);
                case "default_parameter" -> param = new Parameter(identifier(field(child, "name")), plainKind(star),
                        null, expression(field(child, "value")));
                case "typed_default_parameter" -> param = new Parameter(identifier(field(child, "name")),
                        plainKind(star), expression(field(child, "type")), expression(field(child, "value")));
                case "typed_parameter" -> {
                    TSNode inner = unfieldedChildren(child).get(0);
                    Expr annotation = expression(field(child, "type"));
                    param = switch (inner.getType()) {
                        case "identifier" -> new Parameter(identifier(inner), plainKind(star), annotation, null);
                        case "list_splat_pattern" -> splat(inner, Parameters.Kind.VAR_POSITIONAL, annotation);
                        case "dictionary_splat_pattern" -> splat(inner, Parameters.Kind.VAR_KEYWORD, annotation);
                        default -> throw new PythonSyntaxException("invalid syntax", line(inner));
                    };
                }
                case "list_splat_pattern" -> param = splat(child, Parameters.Kind.VAR_POSITIONAL, null);
                case "dictionary_splat_pattern" -> param = splat(child, Parameters.Kind.VAR_KEYWORD, null);
                default -> throw new PythonSyntaxException("invalid syntax", line(child));
            }

            if (param.kind() == Parameters.Kind.VAR_POSITIONAL) {
                if (star) {
                    throw new PythonSyntaxException("* argument may appear only once", line(child));
                }
                star = true;
            } else if (param.kind() == Parameters.Kind.VAR_KEYWORD) {
                sawVarKeyword = true;
            } else if (param.kind() == Parameters.Kind.POSITIONAL) {
                if (param.defaultValue() != null) {
                    sawDefault = true;
                } else if (sawDefault) {
                    throw new PythonSyntaxException("parameter without a default follows parameter with a default",
                            line(child));
                }
            }
            if (!seen.add(param.name())) {
                throw new PythonSyntaxException("duplicate argument '" + param.name() + "' in function definition",
                        line(child));
            }
            params.add(param);
        }

        if (bareStarAt >= 0 && (bareStarAt == params.size()
                || params.get(bareStarAt).kind() != Parameters.Kind.KEYWORD_ONLY)) {
            throw new PythonSyntaxException("named arguments must follow bare *", line(list));
        }
        return new Parameters(List.copyOf(params));
    }

    private static Parameters.Kind plainKind(boolean afterStar) {
        return afterStar ? Parameters.Kind.KEYWORD_ONLY : Parameters.Kind.POSITIONAL;
    }

    private Parameter splat(TSNode pattern, Parameters.Kind kind, Expr annotation) {
        return new Parameter(identifier(firstChild(pattern, "identifier")), kind, annotation, null);
    }

    // --- match ---

    private Stmt match(TSNode n) {
        List<TSNode> subjects = fieldChildren(n, "subject");
        Expr subject = subjects.size() == 1 && !hasChild(n, ",")
                ? expression(subjects.get(0))
                : new Sequence(SequenceKind.TUPLE, expressions(subjects), ExprContext.LOAD, line(n));

        List<MatchCase> cases = new ArrayList<>();
        TSNode body = field(n, "body");
        for (TSNode clause : body == null ? List.<TSNode>of() : namedChildren(body)) {
            List<TSNode> patterns = new ArrayList<>();
            for (TSNode child : namedChildren(clause)) {
                if (child.getType().equals("case_pattern")) {
                    patterns.add(child);
                }
            }
            Pattern pattern = patterns.size() == 1 && !hasChild(clause, ",")
                    ? pattern(patterns.get(0))
                    : new Pattern.SequencePattern(patterns(patterns));
            TSNode guard = field(clause, "guard");
            cases.add(new MatchCase(pattern, guard == null ? null : expression(namedChildren(guard).get(0)),
                    block(clause, field(clause, "consequence"))));
        }
        if (cases.isEmpty()) {
            throw new PythonSyntaxException("expected an indented block after 'match' statement on line " + line(n),
                    Math.min(line(n) + 1, lineCount));
        }
        return new Stmt.Match(subject, List.copyOf(cases), line(n));
    }

    private List<Pattern> patterns(List<TSNode> nodes) {
        List<Pattern> patterns = new ArrayList<>();
        for (TSNode node : nodes) {
            patterns.add(pattern(node));
        }
        return List.copyOf(patterns);
    }

    private Pattern pattern(TSNode n) {
        enter(n);
        try {
            return convertPattern(n);
        } finally {
            depth--;
        }
    }

    private Pattern convertPattern(TSNode n) {
        List<TSNode> parts = namedChildren(n);
        switch (n.getType()) {
            case "case_pattern":
                if (parts.isEmpty()) {
                    return new Pattern.Capture(null);
                }
                return pattern(parts.get(0));
            case "dotted_name":
                if (parts.size() == 1) {
                    String name = identifier(parts.get(0));
                    return new Pattern.Capture(name.equals("_") ? null : name);
                }
                return new Pattern.Value(dottedValue(n));
            case "union_pattern": {
                List<Pattern> alternatives = new ArrayList<>();
                for (int i = 0; i < n.getChildCount(); i++) {
                    TSNode child = n.getChild(i);
                    if (child.isNamed() && !child.isExtra()) {
                        alternatives.add(pattern(child));
                    } else if (child.getType().equals("_")) {
                        alternatives.add(new Pattern.Capture(null));
                    }
                }
                return new Pattern.Or(List.copyOf(alternatives));
            }
            case "as_pattern": {
                String name = identifier(parts.get(parts.size() - 1));
                if (name.equals("_")) {
                    throw new PythonSyntaxException("cannot use '_' as a target", line(n));
                }
                return new Pattern.As(pattern(parts.get(0)), name);
            }
            case "list_pattern", "tuple_pattern":
                return new Pattern.SequencePattern(patterns(parts));
            case "splat_pattern": {
                TSNode name = firstChild(n, "identifier");
                if (hasChild(n, "**")) {
                    throw new PythonSyntaxException("invalid syntax", line(n));
                }
                return new Pattern.Star(name == null || text(name).equals("_") ? null : identifier(name));
            }
            case "dict_pattern":
                return mappingPattern(n);
            case "class_pattern": {
                List<Pattern> arguments = new ArrayList<>();
                for (TSNode argument : parts.subList(1, parts.size())) {
                    arguments.add(pattern(argument));
                }
                return new Pattern.ClassPattern(dottedValue(parts.get(0)), List.copyOf(arguments));
            }
            case "keyword_pattern":
                return parts.size() > 1 ? pattern(parts.get(1)) : new Pattern.Capture(null);
            case "integer", "float", "string", "concatenated_string", "true", "false", "none", "complex_pattern":
                return new Pattern.Value(literalPattern(n));
            default:
                throw new PythonSyntaxException("invalid syntax", line(n));
        }
    }

    private Pattern mappingPattern(TSNode n) {
        List<Expr> keys = new ArrayList<>();
        List<Pattern> values = new ArrayList<>();
        String rest = null;
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            String fieldName = n.getFieldNameForChild(i);
            if ("key".equals(fieldName)) {
                keys.add(child.getType().equals("dotted_name") ? dottedValue(child) : literalPattern(child));
            } else if ("value".equals(fieldName)) {
                values.add(pattern(child));
            } else if (child.getType().equals("splat_pattern")) {
                TSNode name = firstChild(child, "identifier");
                rest = name == null ? null : identifier(name);
            }
        }
        return new Pattern.Mapping(List.copyOf(keys), List.copyOf(values), rest);
    }

    /** Literal pattern; only the strings in it can reference names, through f-string fields. */
    private Expr literalPattern(TSNode n) {
        if (n.getType().equals("string") || n.getType().equals("concatenated_string")) {
            Expr value = expression(n);
            if (value instanceof Compound) {
                throw new PythonSyntaxException("patterns may only match literals and attribute lookups", line(n));
            }
            return value;
        }
        if (n.getType().equals("case_pattern")) {
            return literalPattern(namedChildren(n).get(0));
        }
        for (TSNode part : namedChildren(n)) {
            literalPattern(part);
        }
        if (n.getType().equals("integer")) checkInteger(n);
        if (n.getType().equals("float")) checkFloat(n);
        return new Literal(text(n), line(n));
    }

    /** {@code a.b.c} as a load of {@code a} followed by attribute lookups. */
    private Expr dottedValue(TSNode dotted) {
        List<TSNode> parts = namedChildren(dotted);
        Expr value = new Name(identifier(parts.get(0)), ExprContext.LOAD, line(dotted));
        for (TSNode part : parts.subList(1, parts.size())) {
            value = new Attribute(value, identifier(part), ExprContext.LOAD, line(part));
        }
        return value;
    }

    // --- Expressions ---

    /** Right-hand side of an assignment, return, for or yield: a bare tuple is allowed. */
    private Expr value(TSNode n) {
        if (n.getType().equals("list_splat")) {
            throw new PythonSyntaxException("can't use starred expression here", line(n));
        }
        return expression(n);
    }

    private List<Expr> expressions(List<TSNode> nodes) {
        List<Expr> result = new ArrayList<>();
        for (TSNode node : nodes) {
            result.add(expression(node));
        }
        return List.copyOf(result);
    }

    private Expr target(TSNode n, ExprContext ctx) {
        return toTarget(expression(n), ctx);
    }

    private Expr expression(TSNode n) {
        enter(n);
        try {
            return convertExpression(n);
        } finally {
            depth--;
        }
    }

    private Expr convertExpression(TSNode n) {
        int line = line(n);
        List<TSNode> parts = namedChildren(n);
        switch (n.getType()) {
            case "identifier", "keyword_identifier":
                return new Name(identifier(n), ExprContext.LOAD, line);
            case "integer":
                checkInteger(n);
                return new Literal(text(n), line);
            case "float":
                checkFloat(n);
                return new Literal(text(n), line);
            case "true", "false", "none", "ellipsis":
                return new Literal(text(n), line);
            case "string":
                return strings(List.of(n), line);
            case "concatenated_string":
                return strings(parts, line);
            case "attribute":
                return new Attribute(expression(field(n, "object")), identifier(field(n, "attribute")),
                        ExprContext.LOAD, line);
            case "subscript": {
                List<TSNode> indices = fieldChildren(n, "subscript");
                Expr slice = indices.size() == 1 && !hasChild(n, ",")
                        ? expression(indices.get(0))
                        : new Sequence(SequenceKind.TUPLE, expressions(indices), ExprContext.LOAD, line);
                return new Subscript(expression(field(n, "value")), slice, ExprContext.LOAD, line);
            }
            case "slice":
                return new Compound("slice", expressions(parts), line);
            case "call": {
                List<Expr> operands = new ArrayList<>();
                operands.add(expression(field(n, "function")));
                TSNode arguments = field(n, "arguments");
                if (arguments.getType().equals("generator_expression")) {
                    operands.add(expression(arguments));
                } else {
                    operands.addAll(arguments(arguments));
                }
                return new Compound("function call", List.copyOf(operands), line);
            }
            case "list", "list_pattern":
                return new Sequence(SequenceKind.LIST, expressions(parts), ExprContext.LOAD, line);
            case "tuple", "expression_list", "pattern_list", "type_parameter":
                return new Sequence(SequenceKind.TUPLE, expressions(parts), ExprContext.LOAD, line);
            case "tuple_pattern":
                if (parts.size() == 1 && !hasChild(n, ",")) {
                    return expression(parts.get(0));
                }
                return new Sequence(SequenceKind.TUPLE, expressions(parts), ExprContext.LOAD, line);
            case "list_splat", "list_splat_pattern":
                return new Starred(expression(parts.get(0)), ExprContext.LOAD, line);
            case "set":
                return new Compound("set display", expressions(parts), line);
            case "dictionary": {
                List<Expr> operands = new ArrayList<>();
                for (TSNode item : parts) {
                    if (item.getType().equals("pair")) {
                        operands.add(expression(field(item, "key")));
                        operands.add(expression(field(item, "value")));
                    } else {
                        operands.add(expression(namedChildren(item).get(0)));
                    }
                }
                return new Compound("dict literal", List.copyOf(operands), line);
            }
            case "list_comprehension":
                return comprehension(n, "list comprehension");
            case "set_comprehension":
                return comprehension(n, "set comprehension");
            case "dictionary_comprehension":
                return comprehension(n, "dict comprehension");
            case "generator_expression":
                return comprehension(n, "generator expression");
            case "parenthesized_expression", "type":
                return expression(parts.get(0));
            case "named_expression": {
                TSNode name = field(n, "name");
                Name target = new Name(identifier(name), ExprContext.STORE, line(name));
                return new NamedExpr(target, expression(field(n, "value")), line);
            }
            case "lambda":
                return new Lambda(parameters(field(n, "parameters")), expression(field(n, "body")), line);
            case "conditional_expression":
                return new Compound("conditional expression", expressions(parts), line);
            case "boolean_operator", "binary_operator", "unary_operator", "not_operator":
                return new Compound("expression", expressions(parts), line);
            case "comparison_operator":
                if (hasChild(n, "<>")) {
                    throw new PythonSyntaxException("invalid syntax", line);
                }
                return new Compound("comparison", expressions(parts), line);
            case "await":
                return new Compound("await expression", expressions(parts), line);
            case "yield":
                return new Compound("yield expression", parts.isEmpty() ? List.of() : List.of(value(parts.get(0))), line);
            case "generic_type": {
                TSNode params = firstChild(n, "type_parameter");
                Expr base = expression(parts.get(0));
                return params == null ? base : new Subscript(base, expression(params), ExprContext.LOAD, line);
            }
            case "member_type":
                return new Attribute(expression(parts.get(0)), identifier(parts.get(1)), ExprContext.LOAD, line);
            case "union_type", "constrained_type", "splat_type":
                return new Compound("expression", expressions(parts), line);
            default:
                throw new IllegalStateException("Unsupported syntax node '" + n.getType() + "' at line " + line);
        }
    }

    /** Call or class-definition arguments, in order; keyword names are dropped. */
    private List<Expr> arguments(TSNode list) {
        List<Expr> operands = new ArrayList<>();
        boolean sawKeyword = false;
        boolean sawKeywordUnpacking = false;
        for (TSNode argument : namedChildren(list)) {
            switch (argument.getType()) {
                case "keyword_argument" -> {
                    sawKeyword = true;
                    identifier(field(argument, "name"));
                    operands.add(expression(field(argument, "value")));
                }
                case "dictionary_splat" -> {
                    sawKeywordUnpacking = true;
                    operands.add(expression(namedChildren(argument).get(0)));
                }
                case "list_splat" -> {
                    if (sawKeywordUnpacking) {
                        throw new PythonSyntaxException(
                                "iterable argument unpacking follows keyword argument unpacking", line(argument));
                    }
                    operands.add(expression(argument));
                }
                default -> {
                    if (sawKeywordUnpacking) {
                        throw new PythonSyntaxException("positional argument follows keyword argument unpacking",
                                line(argument));
                    }
                    if (sawKeyword) {
                        throw new PythonSyntaxException("positional argument follows keyword argument", line(argument));
                    }
                    operands.add(expression(argument));
                }
            }
        }
        return List.copyOf(operands);
    }

    private Expr comprehension(TSNode n, String form) {
        TSNode body = field(n, "body");
        List<Expr> results = body.getType().equals("pair")
                ? List.of(expression(field(body, "key")), expression(field(body, "value")))
                : List.of(expression(body));

        List<ComprehensionClause> clauses = new ArrayList<>();
        Expr target = null;
        Expr iterable = null;
        boolean async = false;
        List<Expr> conditions = new ArrayList<>();
        for (TSNode clause : namedChildren(n)) {
            if (clause.getType().equals("for_in_clause")) {
                if (target != null) {
                    clauses.add(new ComprehensionClause(target, iterable, List.copyOf(conditions), async));
                    conditions.clear();
                }
                List<TSNode> iterables = fieldChildren(clause, "right");
                if (iterables.size() != 1) {
                    throw new PythonSyntaxException("invalid syntax", line(clause));
                }
                target = target(field(clause, "left"), ExprContext.STORE);
                iterable = expression(iterables.get(0));
                async = hasChild(clause, "async");
            } else if (clause.getType().equals("if_clause")) {
                conditions.add(expression(namedChildren(clause).get(0)));
            }
        }
        clauses.add(new ComprehensionClause(target, iterable, List.copyOf(conditions), async));
        return new Comprehension(form, results, List.copyOf(clauses), line(n));
    }

    /**
     * Adjacent string literals. Plain literals collapse to one {@link Literal}; if any
     * part is an f-string the result is a compound over its replacement fields.
     */
    private Expr strings(List<TSNode> parts, int line) {
        List<Expr> fields = new ArrayList<>();
        boolean bytes = false;
        boolean text = false;
        boolean formatted = false;
        for (TSNode part : parts) {
            String prefix = prefixOf(part);
            if (prefix.indexOf('b') >= 0) {
                bytes = true;
            } else {
                text = true;
            }
            if (prefix.indexOf('f') >= 0) {
                formatted = true;
                for (TSNode interpolation : namedChildren(part)) {
                    if (interpolation.getType().equals("interpolation")) {
                        replacementField(interpolation, fields);
                    }
                }
            }
        }
        if (bytes && text) {
            throw new PythonSyntaxException("cannot mix bytes and nonbytes literals", line);
        }
        if (!formatted) {
            return new Literal(text(parts.get(0)), line);
        }
        return new Compound("f-string expression", List.copyOf(fields), line);
    }

    private String prefixOf(TSNode string) {
        String start = text(firstChild(string, "string_start"));
        int quote = 0;
        while (quote < start.length() && start.charAt(quote) != '\'' && start.charAt(quote) != '"') {
            quote++;
        }
        String prefix = start.substring(0, quote).toLowerCase(Locale.ROOT);
        if (quote == start.length() || !STRING_PREFIXES.contains(prefix)) {
            throw new PythonSyntaxException("invalid syntax", line(string));
        }
        return prefix;
    }

    /** {@code {expression!conversion:format}}; nested fields in the format spec are collected too. */
    private void replacementField(TSNode interpolation, List<Expr> fields) {
        fields.add(expression(field(interpolation, "expression")));
        TSNode conversion = field(interpolation, "type_conversion");
        if (conversion != null) {
            String character = text(conversion).substring(1);
            if (!CONVERSIONS.contains(character)) {
                throw new PythonSyntaxException("f-string: invalid conversion character '" + character
                        + "': expected 's', 'r', or 'a'", line(conversion));
            }
        }
        TSNode format = field(interpolation, "format_specifier");
        if (format != null) {
            for (TSNode nested : namedChildren(format)) {
                if (nested.getType().equals("format_expression")) {
                    fields.add(expression(field(nested, "expression")));
                }
            }
        }
    }

    // --- Targets ---

    /** Re-labels {@code expr} as an assignment or deletion target. */
    private static Expr toTarget(Expr expr, ExprContext ctx) {
        if (expr instanceof Name name) {
            return new Name(name.id(), ctx, name.line());
        }
        if (expr instanceof Attribute attribute) {
            return new Attribute(attribute.value(), attribute.attr(), ctx, attribute.line());
        }
        if (expr instanceof Subscript subscript) {
            return new Subscript(subscript.value(), subscript.slice(), ctx, subscript.line());
        }
        if (expr instanceof Starred starred && ctx == ExprContext.STORE) {
            return new Starred(toTarget(starred.value(), ctx), ctx, starred.line());
        }
        if (expr instanceof Sequence sequence) {
            List<Expr> elements = new ArrayList<>();
            int starredCount = 0;
            for (Expr element : sequence.elements()) {
                if (element instanceof Starred) {
                    starredCount++;
                }
                elements.add(toTarget(element, ctx));
            }
            if (starredCount > 1) {
                throw new PythonSyntaxException("multiple starred expressions in assignment", sequence.line());
            }
            return new Sequence(sequence.kind(), List.copyOf(elements), ctx, sequence.line());
        }
        String verb = ctx == ExprContext.DEL ? "delete" : "assign to";
        throw new PythonSyntaxException("cannot " + verb + " " + describe(expr), expr.line());
    }

    /** CPython's name for an expression kind in error messages. */
    private static String describe(Expr expr) {
        if (expr instanceof Literal literal) {
            return switch (literal.text()) {
                case "True", "False", "None" -> literal.text();
                case "..." -> "ellipsis";
                default -> "literal";
            };
        }
        if (expr instanceof Sequence sequence) {
            return sequence.kind() == SequenceKind.TUPLE ? "tuple" : "list";
        }
        if (expr instanceof Compound compound) {
            return compound.form();
        }
        if (expr instanceof Comprehension comprehension) {
            return comprehension.form();
        }
        if (expr instanceof Lambda) {
            return "lambda";
        }
        if (expr instanceof NamedExpr) {
            return "named expression";
        }
        if (expr instanceof Starred) {
            return "starred";
        }
        if (expr instanceof Attribute) {
            return "attribute";
        }
        if (expr instanceof Subscript) {
            return "subscript";
        }
        return "name";
    }

    // --- Tokens ---

    private String identifier(TSNode n) {
        String name = text(n);
        if (HARD_KEYWORDS.contains(name)) {
            throw new PythonSyntaxException("invalid syntax", line(n));
        }
        return name;
    }

    private void checkInteger(TSNode n) {
        String literal = text(n);
        if (!NumberLiterals.isInteger(literal) && !NumberLiterals.isImaginary(literal)) {
            throw new PythonSyntaxException(NumberLiterals.errorFor(literal), line(n));
        }
    }

    private void checkFloat(TSNode n) {
        String literal = text(n);
        if (!NumberLiterals.isFloat(literal) && !NumberLiterals.isImaginary(literal)) {
            throw new PythonSyntaxException(NumberLiterals.errorFor(literal), line(n));
        }
    }

    private String text(TSNode n) {
        return TreeSitterNodes.text(utf8, n);
    }

    private void enter(TSNode n) {
        if (++depth > MAX_DEPTH) {
            throw new IllegalStateException("nesting deeper than " + MAX_DEPTH + " levels at line " + line(n));
        }
    }
}
