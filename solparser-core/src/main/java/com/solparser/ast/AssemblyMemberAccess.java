package com.solparser.ast;

public record AssemblyMemberAccess(
    SourceRange loc,
    Identifier expression,
    Identifier memberName
) implements AssemblyExpression {
    @Override
    public String type() {
        return "AssemblyMemberAccess";
    }
}
