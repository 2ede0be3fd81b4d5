package com.solparser.ast;

public record IfStatement(
    SourceRange loc,
    Expression condition,
    Statement trueBody,
    Statement falseBody
) implements Statement {
    @Override
    public String type() {
        return "IfStatement";
    }
}
