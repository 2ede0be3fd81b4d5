package com.solparser.ast;

public record AssemblyFor(
    SourceRange loc,
    AssemblyItem pre,
    AssemblyExpression condition,
    AssemblyItem post,
    AssemblyBlock body
) implements AssemblyItem {
    @Override
    public String type() {
        return "AssemblyFor";
    }
}
