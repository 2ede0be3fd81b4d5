package com.solparser.ast;

public record UserDefinedTypeName(
    SourceRange loc,
    String namePath
) implements TypeName {
    @Override
    public String type() {
        return "UserDefinedTypeName";
    }
}
