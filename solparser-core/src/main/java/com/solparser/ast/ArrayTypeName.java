package com.solparser.ast;

public record ArrayTypeName(
    SourceRange loc,
    TypeName baseTypeName,
    Expression length
) implements TypeName {
    @Override
    public String type() {
        return "ArrayTypeName";
    }
}
