package com.solparser.ast;

public record Conditional(
    SourceRange loc,
    Expression condition,
    Expression trueExpression,
    Expression falseExpression
) implements Expression {
    @Override
    public String type() {
        return "Conditional";
    }
}
