package com.celldeps.cli.manifest;

/**
 * A cell's id and its resolved source text.
 */
public record CellSource(String id, String source) {}
