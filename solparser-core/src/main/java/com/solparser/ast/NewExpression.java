package com.solparser.ast;

public record NewExpression(
    SourceRange loc,
    TypeName typeName
) implements Expression {
    @Override
    public String type() {
        return "NewExpression";
    }
}
