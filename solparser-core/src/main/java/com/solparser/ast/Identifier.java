package com.solparser.ast;

public record Identifier(
    SourceRange loc,
    String name
) implements Expression, AssemblyItem {
    @Override
    public String type() {
        return "Identifier";
    }
}
