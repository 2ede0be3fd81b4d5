package com.solparser.ast;

public record WhileStatement(
    SourceRange loc,
    Expression condition,
    Statement body
) implements Statement {
    @Override
    public String type() {
        return "WhileStatement";
    }
}
