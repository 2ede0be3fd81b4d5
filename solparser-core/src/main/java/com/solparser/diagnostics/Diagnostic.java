package com.solparser.diagnostics;

import com.solparser.ast.SourceRange;

/**
 * A recoverable problem found while recognizing or lowering a source unit.
 *
 * @param rule name of the grammar rule being lowered, or {@code null} for recognizer errors
 */
public record Diagnostic(
    Severity severity,
    DiagnosticKind kind,
    String message,
    SourceRange range,
    String rule
) {
    public static Diagnostic error(DiagnosticKind kind, String message, SourceRange range, String rule) {
        return new Diagnostic(Severity.ERROR, kind, message, range, rule);
    }

    public static Diagnostic warning(DiagnosticKind kind, String message, SourceRange range, String rule) {
        return new Diagnostic(Severity.WARNING, kind, message, range, rule);
    }

    /**
     * Formats the diagnostic as a single line, e.g.
     * {@code [MALFORMED_CONSTRUCT] line 3:12 - unexpected expression shape}.
     */
    public String format() {
        return String.format("[%s] line %d:%d - %s", kind, range.startLine(), range.startColumn(), message);
    }
}
