package com.celldeps.analyzer.syntax;

/**
 * How an expression is used: evaluated, bound, or deleted.
 */
public enum ExprContext {
    LOAD,
    STORE,
    DEL
}
