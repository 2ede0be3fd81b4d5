package com.solparser.ast;

public record MemberAccess(
    SourceRange loc,
    Expression expression,
    String memberName
) implements Expression {
    @Override
    public String type() {
        return "MemberAccess";
    }
}
