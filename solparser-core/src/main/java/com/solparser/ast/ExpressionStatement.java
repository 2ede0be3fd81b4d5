package com.solparser.ast;

public record ExpressionStatement(
    SourceRange loc,
    Expression expression
) implements Statement {
    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
