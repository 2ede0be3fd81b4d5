package com.solparser.diagnostics;

/**
 * Kinds of recoverable problems. Fatal conditions are raised as exceptions instead.
 */
public enum DiagnosticKind {
    /** Reported by the recognizer while building the concrete tree. */
    SYNTAX_ERROR,
    /** A concrete tree node did not have the shape its lowering expects. */
    MALFORMED_CONSTRUCT,
    /** Conflicting modifier keywords, resolved by priority. */
    AMBIGUOUS_ATTRIBUTE
}
