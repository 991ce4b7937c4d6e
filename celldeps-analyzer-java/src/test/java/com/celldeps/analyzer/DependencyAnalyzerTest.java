package com.celldeps.analyzer;

import com.celldeps.analyzer.scope.IdentifierClassifier;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class DependencyAnalyzerTest {

    private final DependencyAnalyzer analyzer = new DependencyAnalyzer();

    private void assertDeps(String source, List<String> reads, List<String> writes) {
        AnalysisResult result = analyzer.analyze(source);
        assertNull(result.error(), () -> "unexpected error: " + result.error());
        assertEquals(reads, result.reads(), "reads of:\n" + source);
        assertEquals(writes, result.writes(), "writes of:\n" + source);
    }

    // --- Basic scenarios ---

    @Test
    void literalAssignment() {
        assertDeps("x = 5", List.of(), List.of("x"));
    }

    @Test
    void singleDependency() {
        assertDeps("y = x + 1", List.of("x"), List.of("y"));
    }

    @Test
    void multipleDependencies() {
        assertDeps("z = x + y", List.of("x", "y"), List.of("z"));
    }

    @Test
    void functionDefinition() {
        assertDeps("def foo(a):\n    return a + 1", List.of(), List.of("foo"));
    }

    @Test
    void importAlias() {
        assertDeps("import pandas as pd", List.of(), List.of("pd"));
    }

    @Test
    void attributeCall() {
        assertDeps("df2 = df1.head(10)", List.of("df1"), List.of("df2"));
    }

    @Test
    void augmentedAssignment() {
        assertDeps("x += 5", List.of("x"), List.of("x"));
    }

    @Test
    void malformedSourceIsParseError() {
        AnalysisResult result = analyzer.analyze("def foo():");
        assertTrue(result.hasError());
        assertEquals(ErrorKind.PARSE_ERROR, result.error().kind());
        assertEquals(1, result.error().line());
        assertTrue(result.reads().isEmpty());
        assertTrue(result.writes().isEmpty());
    }

    @Test
    void pandasPipeline() {
        String source = """
            import pandas as pd
            df = pd.read_csv('data.csv')
            result = df[df['col'] > threshold]
            """;
        assertDeps(source, List.of("threshold"), List.of("df", "pd", "result"));
    }

    // --- Properties ---

    @Test
    void analysisIsIdempotent() {
        String source = "total = sum(values) + offset\nlabel = f'{total:.2f}'";
        assertEquals(analyzer.analyze(source), analyzer.analyze(source));
    }

    @Test
    void independentStatementOrderDoesNotMatter() {
        assertEquals(analyzer.analyze("a = x\nb = y"), analyzer.analyze("b = y\na = x"));
    }

    @Test
    void readsAndWritesAreSortedAndDistinct() {
        assertDeps("c = zeta + alpha + zeta\nb = 1\na = 2\nb = 3", List.of("alpha", "zeta"), List.of("a", "b", "c"));
    }

    @Test
    void sortingIsByCodePoint() {
        assertDeps("r = b + B + _a", List.of("B", "_a", "b"), List.of("r"));
    }

    @Test
    void nameBoundEarlierIsNotARead() {
        assertDeps("x = 5\ny = x + 1", List.of(), List.of("x", "y"));
    }

    @Test
    void nameUsedBeforeBindingIsARead() {
        assertDeps("y = x + 1\nx = 5", List.of("x"), List.of("x", "y"));
    }

    @Test
    void bindingInsideBranchCountsForLaterStatements() {
        assertDeps("if flag:\n    v = 1\nw = v", List.of("flag"), List.of("v", "w"));
    }

    @Test
    void builtinsAreNeverReads() {
        assertDeps("n = len(print(range(3), True, None, False))\nraise ValueError(str(n))",
                List.of(), List.of("n"));
    }

    @Test
    void extraBuiltinsAreNeverReads() {
        DependencyAnalyzer custom = new DependencyAnalyzer(
                IdentifierClassifier.defaults().withAdditional(List.of("display")));
        AnalysisResult result = custom.analyze("display(df)");
        assertEquals(List.of("df"), result.reads());
    }

    // --- Functions and lambdas ---

    @Test
    void functionLocalsDoNotLeak() {
        String source = """
            def scale(values, factor=default_factor, *rest, key=None, **options):
                scaled = [v * factor for v in values]
                tmp = helper(scaled, rest, key, options)
                return tmp
            """;
        // comprehension variables are written even inside a function
        assertDeps(source, List.of("default_factor", "helper"), List.of("scale", "scaled", "tmp", "v"));
    }

    @Test
    void functionBodyReadsOuterNames() {
        assertDeps("def f():\n    return threshold * 2", List.of("threshold"), List.of("f"));
    }

    @Test
    void recursiveFunctionDoesNotReadItself() {
        assertDeps("def fact(n):\n    return 1 if n < 2 else n * fact(n - 1)", List.of(), List.of("fact"));
    }

    @Test
    void functionNameUsableAfterDefinition() {
        assertDeps("def f(x):\n    return x\ny = f(z)", List.of("z"), List.of("f", "y"));
    }

    @Test
    void decoratorsDefaultsAndAnnotationsAreReadOutside() {
        String source = """
            @register(registry)
            def handler(event: Event, retries: int = max_retries) -> Response:
                return event
            """;
        assertDeps(source, List.of("Event", "Response", "max_retries", "register", "registry"), List.of("handler"));
    }

    @Test
    void lambdaParametersAreLocal() {
        assertDeps("key = lambda row, col=default: row[col] + offset",
                List.of("default", "offset"), List.of("key"));
    }

    @Test
    void nestedFunctionSeesEnclosingParameters() {
        String source = """
            def outer(a):
                def inner(b):
                    return a + b + c
                return inner
            """;
        assertDeps(source, List.of("c"), List.of("inner", "outer"));
    }

    @Test
    void genericFunctionTypeParametersAreLocal() {
        assertDeps("def first[T](items: list[T]) -> T:\n    return items[0]", List.of(), List.of("first"));
    }

    // --- Classes ---

    @Test
    void classBodyIsItsOwnFrame() {
        String source = """
            class Model(Base, metaclass=Meta):
                rate = default_rate
                def predict(self, x):
                    return self.weights @ x
            m = Model()
            """;
        assertDeps(source, List.of("Base", "Meta", "default_rate"), List.of("Model", "m", "predict", "rate"));
    }

    // --- Imports ---

    @Test
    void dottedImportBindsLeadingComponent() {
        assertDeps("import os.path\np = os.path.join(root, 'x')", List.of("root"), List.of("os", "p"));
    }

    @Test
    void fromImportBindsNamesAndAliases() {
        assertDeps("from collections import OrderedDict, defaultdict as dd\nx = dd(list)",
                List.of(), List.of("OrderedDict", "dd", "x"));
    }

    @Test
    void relativeImportReadsNothing() {
        assertDeps("from .utils import helper", List.of(), List.of("helper"));
    }

    @Test
    void wildcardImportIsSuppressed() {
        assertDeps("from math import *\ny = sqrt(2)", List.of("sqrt"), List.of("y"));
    }

    // --- Attributes and subscripts ---

    @Test
    void attributeAssignmentReadsBase() {
        assertDeps("df.columns = names", List.of("df", "names"), List.of());
    }

    @Test
    void subscriptAssignmentReadsContainerAndIndex() {
        assertDeps("cache[key] = value", List.of("cache", "key", "value"), List.of());
    }

    @Test
    void augmentedAttributeAssignmentReadsBase() {
        assertDeps("counter.total += step", List.of("counter", "step"), List.of());
    }

    @Test
    void augmentedAssignmentOfLocalNameIsNotARead() {
        assertDeps("x = 0\nx += 1", List.of(), List.of("x"));
    }

    @Test
    void deleteNameDoesNothing() {
        assertDeps("del temp", List.of(), List.of());
        assertDeps("del frame['col']", List.of("frame"), List.of());
    }

    // --- Assignment forms ---

    @Test
    void valueIsWalkedBeforeTargets() {
        assertDeps("x = x + 1", List.of("x"), List.of("x"));
    }

    @Test
    void unpackingAndChainedTargets() {
        assertDeps("a, (b, *c) = d = source", List.of("source"), List.of("a", "b", "c", "d"));
    }

    @Test
    void annotatedAssignment() {
        assertDeps("limit: Final[int] = base * 2", List.of("Final", "base"), List.of("limit"));
        assertDeps("pending: list", List.of(), List.of("pending"));
    }

    @Test
    void walrusBindsName() {
        assertDeps("if (n := len(items)) > 10:\n    print(n)", List.of("items"), List.of("n"));
    }

    // --- Comprehensions ---

    @Test
    void comprehensionVariablesAreLocalButWritten() {
        assertDeps("squares = [x * x for x in numbers if x > cutoff]",
                List.of("cutoff", "numbers"), List.of("squares", "x"));
    }

    @Test
    void nestedComprehensionClauses() {
        assertDeps("pairs = {(i, j): i * j for i in rows for j in range(i) if j not in skip}",
                List.of("rows", "skip"), List.of("i", "j", "pairs"));
    }

    @Test
    void walrusInComprehensionBindsInEnclosingScope() {
        assertDeps("[y := f(x) for x in xs]\nz = y", List.of("f", "xs"), List.of("x", "y", "z"));
    }

    @Test
    void walrusInNestedComprehensionIsVisibleToLaterClauses() {
        assertDeps("pairs = [(a, last) for row in rows if (last := row[-1]) for a in row]\nfinal = last",
                List.of("rows"), List.of("a", "final", "last", "pairs", "row"));
    }

    @Test
    void walrusInComprehensionInsideFunctionStaysInFunction() {
        assertDeps("def f(xs):\n    [m := x for x in xs]\n    return m\nprint(m)",
                List.of("m"), List.of("f", "m", "x"));
    }

    @Test
    void comprehensionVariableDoesNotBindOutside() {
        assertDeps("total = sum(v for v in values)\nlast = v", List.of("v", "values"), List.of("last", "total", "v"));
    }

    // --- Control flow ---

    @Test
    void forLoopTargetsAreWrites() {
        String source = """
            for i, row in enumerate(rows):
                acc.append(row * weight)
            else:
                done = i
            """;
        assertDeps(source, List.of("acc", "rows", "weight"), List.of("done", "i", "row"));
    }

    @Test
    void withAndExceptBindNames() {
        String source = """
            try:
                with open(path) as fh:
                    data = fh.read()
            except (IOError, ParseError) as err:
                log(err)
            finally:
                close_all()
            """;
        assertDeps(source, List.of("ParseError", "close_all", "log", "path"), List.of("data", "err", "fh"));
    }

    @Test
    void matchStatementCapturesAndReads() {
        String source = """
            match event:
                case Click(x=px, y=py) if px > limit:
                    handle(px, py)
                case {"type": Kind.KEY, **extra}:
                    pass
                case [first, *others] as seq:
                    pass
                case _:
                    fallback()
            """;
        assertDeps(source,
                List.of("Click", "Kind", "event", "fallback", "handle", "limit"),
                List.of("extra", "first", "others", "px", "py", "seq"));
    }

    @Test
    void globalDeclarationIsIgnored() {
        assertDeps("def bump():\n    global count\n    count = count + 1", List.of("count"), List.of("bump", "count"));
    }

    @Test
    void typeAliasBindsName() {
        assertDeps("type Matrix[T] = list[list[T]] | Fallback", List.of("Fallback"), List.of("Matrix"));
    }

    // --- Strings ---

    @Test
    void fStringFieldsAreReads() {
        assertDeps("msg = f'{user.name!r} has {count:>{width}} items'",
                List.of("count", "user", "width"), List.of("msg"));
    }

    @Test
    void plainStringsAreNotReads() {
        assertDeps("s = '{not_a_name}' + \"\"\"x\"\"\"", List.of(), List.of("s"));
    }

    // --- Errors ---

    @Test
    void parseErrorCarriesLineAndMessage() {
        AnalysisResult result = analyzer.analyze("x = 1\nif x\n    y = 2\n");
        assertEquals(new AnalysisFailure(ErrorKind.PARSE_ERROR, "expected ':'", 2), result.error());
        assertEquals("Syntax error at line 2: expected ':'", result.error().describe());
    }

    @Test
    void malformedLiteralsAreParseErrors() {
        List<String> sources = List.of("x = 0777", "x = 0xg", "x = 0b2", "x = 1_", "x = 1__0",
                "x = f'{a!}'", "x = f'{a!x}'");
        for (String source : sources) {
            AnalysisResult result = analyzer.analyze(source);
            assertTrue(result.hasError(), source);
            assertEquals(ErrorKind.PARSE_ERROR, result.error().kind(), source);
            assertEquals(1, result.error().line(), source);
            assertTrue(result.reads().isEmpty(), source);
            assertTrue(result.writes().isEmpty(), source);
        }
    }

    @Test
    void pythonTwoPrintIsParseError() {
        AnalysisResult result = analyzer.analyze("x = 1\nprint x\n");
        assertEquals(new AnalysisFailure(ErrorKind.PARSE_ERROR,
                "Missing parentheses in call to 'print'. Did you mean print(...)?", 2), result.error());
    }

    @Test
    void unterminatedStringIsParseError() {
        AnalysisResult result = analyzer.analyze("s = 'abc");
        assertEquals(ErrorKind.PARSE_ERROR, result.error().kind());
        assertEquals(1, result.error().line());
    }

    @Test
    void nullSourceIsAnalysisError() {
        AnalysisResult result = analyzer.analyze(null);
        assertEquals(ErrorKind.ANALYSIS_ERROR, result.error().kind());
        assertEquals("source must not be null", result.error().describe());
        assertNull(result.error().line());
    }

    @Test
    void pathologicalNestingIsAnalysisError() {
        String source = "x = " + "(".repeat(100_000) + "1" + ")".repeat(100_000);
        AnalysisResult result = analyzer.analyze(source);
        assertTrue(result.hasError());
        assertEquals(ErrorKind.ANALYSIS_ERROR, result.error().kind());
        assertTrue(result.error().message().startsWith("Failed to analyze dependencies: "));
        assertTrue(result.reads().isEmpty());
    }

    @Test
    void emptySourceHasNoDependencies() {
        assertDeps("", List.of(), List.of());
        assertDeps("# just a comment\n\n", List.of(), List.of());
    }

    @Test
    void resultListsAreUnmodifiable() {
        AnalysisResult result = analyzer.analyze("y = x");
        assertThrows(UnsupportedOperationException.class, () -> result.reads().add("z"));
        assertThrows(UnsupportedOperationException.class, () -> result.writes().clear());
    }

    // --- Concurrency ---

    @Test
    void concurrentAnalysesAgree() throws Exception {
        List<String> sources = List.of(
                "import numpy as np\narr = np.zeros(n)",
                "def f(a):\n    return a + b",
                "y = [x for x in data]",
                "def broken(:\n    pass");
        List<AnalysisResult> expected = sources.stream().map(analyzer::analyze).toList();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<AnalysisResult>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String source = sources.get(i % sources.size());
                futures.add(pool.submit(() -> analyzer.analyze(source)));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected.get(i % sources.size()), futures.get(i).get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
