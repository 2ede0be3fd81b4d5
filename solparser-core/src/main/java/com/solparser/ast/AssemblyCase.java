package com.solparser.ast;

public record AssemblyCase(
    SourceRange loc,
    AssemblyExpression value,
    AssemblyBlock block,
    boolean defaultCase
) implements Node {
    @Override
    public String type() {
        return "AssemblyCase";
    }
}
