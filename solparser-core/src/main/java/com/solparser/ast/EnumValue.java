package com.solparser.ast;

public record EnumValue(
    SourceRange loc,
    String name
) implements Node {
    @Override
    public String type() {
        return "EnumValue";
    }
}
