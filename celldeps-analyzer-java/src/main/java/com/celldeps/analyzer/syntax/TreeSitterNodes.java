package com.celldeps.analyzer.syntax;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Null-safe accessors over tree-sitter nodes. Comments and other extras are skipped.
 */
final class TreeSitterNodes {

    private TreeSitterNodes() {}

    /** The child under {@code field}, or null. */
    static TSNode field(TSNode node, String field) {
        TSNode child = node.getChildByFieldName(field);
        return child == null || child.isNull() ? null : child;
    }

    /** Every child under {@code field}, for fields that repeat. */
    static List<TSNode> fieldChildren(TSNode node, String field) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (field.equals(node.getFieldNameForChild(i))) {
                result.add(node.getChild(i));
            }
        }
        return result;
    }

    static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;
            if (child.isNamed() && !child.isExtra()) {
                result.add(child);
            }
        }
        return result;
    }

    /** Named children that are not under any field. */
    static List<TSNode> unfieldedChildren(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;
            if (child.isNamed() && !child.isExtra() && node.getFieldNameForChild(i) == null) {
                result.add(child);
            }
        }
        return result;
    }

    static TSNode firstChild(TSNode node, String type) {
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    static boolean hasChild(TSNode node, String type) {
        return firstChild(node, type) != null;
    }

    /** The last child that is not a comment. */
    static TSNode lastChild(TSNode node) {
        for (int i = node.getChildCount() - 1; i >= 0; i--) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull() && !child.isExtra()) {
                return child;
            }
        }
        return null;
    }

    /** 1-based line the node starts on. */
    static int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    static int column(TSNode node) {
        return node.getStartPoint().getColumn();
    }

    static String text(byte[] utf8, TSNode node) {
        int start = node.getStartByte();
        int end = Math.min(node.getEndByte(), utf8.length);
        if (start >= end) return "";
        return new String(utf8, start, end - start, StandardCharsets.UTF_8);
    }
}
