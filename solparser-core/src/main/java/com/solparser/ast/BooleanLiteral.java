package com.solparser.ast;

public record BooleanLiteral(
    SourceRange loc,
    boolean value
) implements Expression, AssemblyExpression {
    @Override
    public String type() {
        return "BooleanLiteral";
    }
}
