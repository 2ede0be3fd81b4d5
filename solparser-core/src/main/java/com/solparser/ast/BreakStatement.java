package com.solparser.ast;

public record BreakStatement(
    SourceRange loc
) implements Statement {
    @Override
    public String type() {
        return "BreakStatement";
    }
}
