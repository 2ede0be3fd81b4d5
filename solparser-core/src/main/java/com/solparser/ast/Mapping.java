package com.solparser.ast;

public record Mapping(
    SourceRange loc,
    TypeName keyType,
    Identifier keyName,
    TypeName valueType,
    Identifier valueName
) implements TypeName {
    @Override
    public String type() {
        return "Mapping";
    }
}
