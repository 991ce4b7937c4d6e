package com.celldeps.analyzer.syntax;

import java.util.List;

/**
 * Root of a parsed cell: its top-level statements in source order.
 */
public record ParsedCell(List<Stmt> body) {}
