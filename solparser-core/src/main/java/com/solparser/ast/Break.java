package com.solparser.ast;

public record Break(
    SourceRange loc
) implements AssemblyItem {
    @Override
    public String type() {
        return "Break";
    }
}
