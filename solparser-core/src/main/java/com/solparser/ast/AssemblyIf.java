package com.solparser.ast;

public record AssemblyIf(
    SourceRange loc,
    AssemblyExpression condition,
    AssemblyBlock body
) implements AssemblyItem {
    @Override
    public String type() {
        return "AssemblyIf";
    }
}
