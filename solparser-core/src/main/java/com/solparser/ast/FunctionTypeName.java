package com.solparser.ast;

import java.util.List;

public record FunctionTypeName(
    SourceRange loc,
    List<VariableDeclaration> parameterTypes,
    List<VariableDeclaration> returnTypes,
    Visibility visibility,
    StateMutability stateMutability
) implements TypeName {
    @Override
    public String type() {
        return "FunctionTypeName";
    }
}
