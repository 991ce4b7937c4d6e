package com.celldeps.analyzer.syntax;

import org.treesitter.TSInputEncoding;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Set;

import static com.celldeps.analyzer.syntax.TreeSitterNodes.line;
import static com.celldeps.analyzer.syntax.TreeSitterNodes.text;

/**
 * Parses one cell with the tree-sitter Python grammar and converts the concrete
 * tree into {@link Stmt} records.
 *
 * <p>tree-sitter recovers from errors instead of failing, so the first {@code ERROR}
 * or missing node is turned into a {@link PythonSyntaxException}. The grammar also
 * accepts a few things CPython does not (Python 2 statements, malformed number
 * literals, some invalid targets); {@link ParseTreeConverter} rejects those while
 * converting.</p>
 *
 * <p>A new native parser is created per call, so {@link #parse} is thread-safe.</p>
 */
public final class PythonParser {

    private static final TSLanguage PYTHON = new TreeSitterPython();

    private static final int READ_CHUNK = 8192;

    /** Statement keywords whose header line must end with a colon. */
    private static final Set<String> BLOCK_KEYWORDS = Set.of(
        "if", "elif", "else", "while", "for", "with", "def", "class", "try", "except", "finally", "match", "case"
    );

    private static final Map<String, String> CLOSERS = Map.of("(", ")", "[", "]", "{", "}");

    private PythonParser() {}

    /**
     * Parses one cell.
     *
     * @throws PythonSyntaxException if {@code source} is not valid Python 3
     */
    public static ParsedCell parse(String source) {
        byte[] utf8 = source.getBytes(StandardCharsets.UTF_8);
        TSParser parser = new TSParser();
        parser.setLanguage(PYTHON);
        TSTree tree = parser.parse(new byte[READ_CHUNK], null, (buffer, offset, position) -> {
            if (offset >= utf8.length) {
                return 0;
            }
            int length = Math.min(buffer.length, utf8.length - offset);
            System.arraycopy(utf8, offset, buffer, 0, length);
            return length;
        }, TSInputEncoding.TSInputEncodingUTF8);

        TSNode root = tree.getRootNode();
        if (root.hasError()) {
            throw syntaxError(firstError(root), utf8);
        }
        return new ParseTreeConverter(utf8).convertModule(root);
    }

    /** Preorder search, iterative so that deeply nested input cannot overflow the stack. */
    private static TSNode firstError(TSNode root) {
        Deque<TSNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TSNode node = pending.pop();
            if (node.isError() || node.isMissing()) {
                return node;
            }
            if (!node.hasError()) {
                continue;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                pending.push(node.getChild(i));
            }
        }
        return root;
    }

    private static PythonSyntaxException syntaxError(TSNode node, byte[] utf8) {
        if (node.isMissing()) {
            String message = node.isNamed() ? "invalid syntax" : "expected '" + node.getType() + "'";
            return new PythonSyntaxException(message, line(node));
        }
        if (node.getChildCount() == 0) {
            return new PythonSyntaxException("invalid syntax", line(node));
        }

        TSNode first = node.getChild(0);
        if (first.getType().equals("string_start")) {
            String quote = text(utf8, first);
            if (quote.endsWith("'''") || quote.endsWith("\"\"\"")) {
                return new PythonSyntaxException(
                        "unterminated triple-quoted string literal (detected at line " + lastLine(utf8) + ")", line(node));
            }
            return new PythonSyntaxException(
                    "unterminated string literal (detected at line " + line(node) + ")", line(node));
        }

        if (!first.isNamed() && BLOCK_KEYWORDS.contains(first.getType())) {
            String header = headerLine(text(utf8, node));
            if (!header.endsWith(":")) {
                return new PythonSyntaxException("expected ':'", line(node));
            }
            if (first.getType().equals("try")) {
                return new PythonSyntaxException("expected 'except' or 'finally' block", line(node));
            }
        }

        TSNode unclosed = unclosedBracket(node);
        if (unclosed != null && node.getEndByte() >= lastCodeByte(utf8)) {
            return new PythonSyntaxException("'" + unclosed.getType() + "' was never closed", line(unclosed));
        }
        return new PythonSyntaxException("invalid syntax", line(node));
    }

    /** First line of {@code text} without a trailing comment or whitespace. */
    private static String headerLine(String text) {
        int newline = text.indexOf('\n');
        String header = newline < 0 ? text : text.substring(0, newline);
        int comment = header.indexOf('#');
        if (comment >= 0) {
            header = header.substring(0, comment);
        }
        return header.strip();
    }

    /** The innermost opening bracket among the direct children of an error node that is never closed. */
    private static TSNode unclosedBracket(TSNode node) {
        Deque<TSNode> open = new ArrayDeque<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            String type = child.getType();
            if (CLOSERS.containsKey(type)) {
                open.push(child);
            } else if (!open.isEmpty() && type.equals(CLOSERS.get(open.peek().getType()))) {
                open.pop();
            }
        }
        return open.peek();
    }

    private static int lastCodeByte(byte[] utf8) {
        int end = utf8.length;
        while (end > 0 && Character.isWhitespace(utf8[end - 1])) {
            end--;
        }
        return end;
    }

    private static int lastLine(byte[] utf8) {
        int lines = 1;
        for (int i = 0; i < lastCodeByte(utf8); i++) {
            if (utf8[i] == '\n') lines++;
        }
        return lines;
    }
}
