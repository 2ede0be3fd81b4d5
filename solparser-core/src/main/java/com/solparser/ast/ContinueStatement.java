package com.solparser.ast;

public record ContinueStatement(
    SourceRange loc
) implements Statement {
    @Override
    public String type() {
        return "ContinueStatement";
    }
}
