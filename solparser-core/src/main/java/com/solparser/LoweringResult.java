package com.solparser;

import com.solparser.ast.SourceUnit;
import com.solparser.diagnostics.Diagnostic;
import com.solparser.diagnostics.DiagnosticKind;

import java.util.List;

/**
 * The AST of one source unit together with every diagnostic reported while producing it.
 * {@code tokens} is empty unless requested through {@link ParseOptions#tokens()}.
 */
public record LoweringResult(SourceUnit sourceUnit, List<Diagnostic> diagnostics, List<SourceToken> tokens) {

    public LoweringResult(SourceUnit sourceUnit, List<Diagnostic> diagnostics) {
        this(sourceUnit, diagnostics, List.of());
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public List<Diagnostic> diagnostics(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
