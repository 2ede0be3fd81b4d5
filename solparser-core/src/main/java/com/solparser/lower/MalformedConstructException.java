package com.solparser.lower;

import com.solparser.diagnostics.Diagnostic;

/**
 * Unwinds a handler to the nearest dispatch boundary, where the context is replaced by an
 * {@link com.solparser.ast.Unrecognized} node. Never escapes the visitor.
 */
final class MalformedConstructException extends RuntimeException {

    private final Diagnostic diagnostic;
    private final boolean reported;

    MalformedConstructException(Diagnostic diagnostic, boolean reported) {
        super(diagnostic.message(), null, false, false);
        this.diagnostic = diagnostic;
        this.reported = reported;
    }

    Diagnostic diagnostic() {
        return diagnostic;
    }

    /**
     * True when the diagnostic already sits in the sink, because it was raised for a child
     * placeholder that the parent could not hold.
     */
    boolean reported() {
        return reported;
    }
}
