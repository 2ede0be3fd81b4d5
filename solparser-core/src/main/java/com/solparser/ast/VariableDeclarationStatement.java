package com.solparser.ast;

import java.util.List;

/**
 * A local declaration. Tuple declarations keep skipped positions as {@code null} entries,
 * so {@code (uint a, , uint c) = f();} has three variables.
 */
public record VariableDeclarationStatement(
    SourceRange loc,
    List<VariableDeclaration> variables,
    Expression initialValue
) implements Statement {
    @Override
    public String type() {
        return "VariableDeclarationStatement";
    }
}
