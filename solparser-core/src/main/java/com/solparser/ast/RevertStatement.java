package com.solparser.ast;

public record RevertStatement(
    SourceRange loc,
    Expression revertCall
) implements Statement {
    @Override
    public String type() {
        return "RevertStatement";
    }
}
