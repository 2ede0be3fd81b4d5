package com.solparser.ast;

public record DoWhileStatement(
    SourceRange loc,
    Expression condition,
    Statement body
) implements Statement {
    @Override
    public String type() {
        return "DoWhileStatement";
    }
}
