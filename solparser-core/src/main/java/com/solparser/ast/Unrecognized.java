package com.solparser.ast;

import com.solparser.diagnostics.Diagnostic;

/**
 * Placeholder for a construct that could not be lowered. It stands in wherever a node of any
 * category is expected and carries the diagnostic that was reported for it.
 *
 * @param rule the grammar rule whose context was malformed
 * @param text the source text the context covered
 */
public record Unrecognized(
    SourceRange loc,
    String rule,
    String text,
    Diagnostic diagnostic
) implements SourceUnitPart, ContractPart, Statement, TypeName, AssemblyExpression {
    @Override
    public String type() {
        return "Unrecognized";
    }
}
