package com.solparser.ast;

public record ElementaryTypeName(
    SourceRange loc,
    String name,
    StateMutability stateMutability
) implements TypeName {
    @Override
    public String type() {
        return "ElementaryTypeName";
    }
}
