package com.solparser.ast;

public record ThrowStatement(
    SourceRange loc
) implements Statement {
    @Override
    public String type() {
        return "ThrowStatement";
    }
}
