package com.solparser.ast;

public record HexNumber(
    SourceRange loc,
    String value
) implements AssemblyExpression {
    @Override
    public String type() {
        return "HexNumber";
    }
}
