package com.solparser.ast;

public record ReturnStatement(
    SourceRange loc,
    Expression expression
) implements Statement {
    @Override
    public String type() {
        return "ReturnStatement";
    }
}
