package com.celldeps.analyzer;

/**
 * Why an analysis produced no result.
 */
public enum ErrorKind {
    /** The cell is not valid Python 3. */
    PARSE_ERROR,
    /** The cell parsed but could not be analyzed. */
    ANALYSIS_ERROR
}
