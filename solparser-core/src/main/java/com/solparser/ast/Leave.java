package com.solparser.ast;

public record Leave(
    SourceRange loc
) implements AssemblyItem {
    @Override
    public String type() {
        return "Leave";
    }
}
