package com.solparser.ast;

public record UncheckedStatement(
    SourceRange loc,
    Block block
) implements Statement {
    @Override
    public String type() {
        return "UncheckedStatement";
    }
}
