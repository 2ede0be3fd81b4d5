package com.solparser;

import com.solparser.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown by strict parsing when the recognizer reported syntax errors.
 */
public class ParseException extends RuntimeException {

    private final List<Diagnostic> errors;

    public ParseException(List<Diagnostic> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    private static String describe(List<Diagnostic> errors) {
        if (errors.isEmpty()) {
            return "Syntax error";
        }
        Diagnostic first = errors.get(0);
        return first.message() + " (" + first.range().startLine() + ":" + first.range().startColumn() + ")";
    }
}
