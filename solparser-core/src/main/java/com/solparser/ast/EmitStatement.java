package com.solparser.ast;

public record EmitStatement(
    SourceRange loc,
    Expression eventCall
) implements Statement {
    @Override
    public String type() {
        return "EmitStatement";
    }
}
