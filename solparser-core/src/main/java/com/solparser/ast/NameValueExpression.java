package com.solparser.ast;

public record NameValueExpression(
    SourceRange loc,
    Expression expression,
    NameValueList arguments
) implements Expression {
    @Override
    public String type() {
        return "NameValueExpression";
    }
}
