package com.solparser.ast;

public record DecimalNumber(
    SourceRange loc,
    String value
) implements AssemblyExpression {
    @Override
    public String type() {
        return "DecimalNumber";
    }
}
