package com.solparser.ast;

public record FileLevelConstant(
    SourceRange loc,
    TypeName typeName,
    String name,
    Identifier identifier,
    Expression initialValue,
    Visibility visibility,
    StateMutability stateMutability,
    boolean declaredConst,
    boolean immutable
) implements SourceUnitPart {
    @Override
    public String type() {
        return "FileLevelConstant";
    }
}
