package com.solparser.ast;

public record IndexAccess(
    SourceRange loc,
    Expression base,
    Expression index
) implements Expression {
    @Override
    public String type() {
        return "IndexAccess";
    }
}
