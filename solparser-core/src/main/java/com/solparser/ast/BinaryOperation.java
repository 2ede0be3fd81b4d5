package com.solparser.ast;

public record BinaryOperation(
    SourceRange loc,
    String operator,
    Expression left,
    Expression right
) implements Expression {
    @Override
    public String type() {
        return "BinaryOperation";
    }
}
