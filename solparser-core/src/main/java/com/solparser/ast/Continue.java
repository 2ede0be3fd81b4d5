package com.solparser.ast;

public record Continue(
    SourceRange loc
) implements AssemblyItem {
    @Override
    public String type() {
        return "Continue";
    }
}
