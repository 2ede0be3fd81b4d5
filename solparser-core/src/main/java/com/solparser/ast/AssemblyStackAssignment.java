package com.solparser.ast;

public record AssemblyStackAssignment(
    SourceRange loc,
    AssemblyExpression expression,
    String name
) implements AssemblyItem {
    @Override
    public String type() {
        return "AssemblyStackAssignment";
    }
}
