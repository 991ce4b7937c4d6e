package com.celldeps.analyzer.scope;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Names every cell can assume exist, which are therefore never reported as reads:
 * the public names of Python 3.12's {@code builtins} module, the module-level
 * dunders, and {@link #WILDCARD_IMPORT}.
 *
 * <p>Immutable; {@link #withAdditional} returns an extended copy.</p>
 */
public final class IdentifierClassifier {

    /** Raw read recorded for {@code from m import *}. Never a valid identifier. */
    public static final String WILDCARD_IMPORT = "*";

    private static final List<String> BUILTINS = List.of(
        // constants
        "True", "False", "None", "Ellipsis", "NotImplemented",
        "copyright", "credits", "license", "exit", "quit",
        // functions
        "abs", "aiter", "all", "anext", "any", "ascii", "bin", "breakpoint", "callable",
        "chr", "compile", "delattr", "dir", "divmod", "eval", "exec", "format",
        "getattr", "globals", "hasattr", "hash", "help", "hex", "id", "input",
        "isinstance", "issubclass", "iter", "len", "locals", "max", "min", "next",
        "oct", "open", "ord", "pow", "print", "repr", "round", "setattr", "sorted",
        "sum", "vars", "__import__", "__build_class__",
        // types
        "bool", "bytearray", "bytes", "classmethod", "complex", "dict", "enumerate",
        "filter", "float", "frozenset", "int", "list", "map", "memoryview", "object",
        "property", "range", "reversed", "set", "slice", "staticmethod", "str",
        "super", "tuple", "type", "zip",
        // exceptions and warnings
        "ArithmeticError", "AssertionError", "AttributeError", "BaseException",
        "BaseExceptionGroup", "BlockingIOError", "BrokenPipeError", "BufferError",
        "BytesWarning", "ChildProcessError", "ConnectionAbortedError", "ConnectionError",
        "ConnectionRefusedError", "ConnectionResetError", "DeprecationWarning", "EOFError",
        "EncodingWarning", "EnvironmentError", "Exception", "ExceptionGroup",
        "FileExistsError", "FileNotFoundError", "FloatingPointError", "FutureWarning",
        "GeneratorExit", "IOError", "ImportError", "ImportWarning", "IndentationError",
        "IndexError", "InterruptedError", "IsADirectoryError", "KeyError",
        "KeyboardInterrupt", "LookupError", "MemoryError", "ModuleNotFoundError",
        "NameError", "NotADirectoryError", "NotImplementedError", "OSError",
        "OverflowError", "PendingDeprecationWarning", "PermissionError",
        "ProcessLookupError", "RecursionError", "ReferenceError", "ResourceWarning",
        "RuntimeError", "RuntimeWarning", "StopAsyncIteration", "StopIteration",
        "SyntaxError", "SyntaxWarning", "SystemError", "SystemExit", "TabError",
        "TimeoutError", "TypeError", "UnboundLocalError", "UnicodeDecodeError",
        "UnicodeEncodeError", "UnicodeError", "UnicodeTranslateError", "UnicodeWarning",
        "UserWarning", "ValueError", "Warning", "ZeroDivisionError",
        // module attributes
        "__name__", "__doc__", "__file__", "__builtins__", "__spec__", "__loader__",
        "__package__", "__debug__"
    );

    private static final IdentifierClassifier DEFAULTS = new IdentifierClassifier(defaultNames());

    private final Set<String> reserved;

    private IdentifierClassifier(Set<String> reserved) {
        this.reserved = Set.copyOf(reserved);
    }

    public static IdentifierClassifier defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a classifier that also treats {@code names} as always defined, e.g.
     * objects a notebook runtime injects ({@code display}, {@code spark}).
     */
    public IdentifierClassifier withAdditional(Collection<String> names) {
        if (names.isEmpty()) return this;
        Set<String> extended = new HashSet<>(reserved);
        extended.addAll(names);
        return new IdentifierClassifier(extended);
    }

    /** True if a read of {@code name} is not a dependency on another cell. */
    public boolean isReserved(String name) {
        return reserved.contains(name);
    }

    private static Set<String> defaultNames() {
        Set<String> names = new HashSet<>(BUILTINS);
        names.add(WILDCARD_IMPORT);
        return names;
    }
}
