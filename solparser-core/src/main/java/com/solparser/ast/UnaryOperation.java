package com.solparser.ast;

public record UnaryOperation(
    SourceRange loc,
    String operator,
    Expression subExpression,
    boolean prefix
) implements Expression {
    @Override
    public String type() {
        return "UnaryOperation";
    }
}
