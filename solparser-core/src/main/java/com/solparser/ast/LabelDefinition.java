package com.solparser.ast;

public record LabelDefinition(
    SourceRange loc,
    String name
) implements AssemblyItem {
    @Override
    public String type() {
        return "LabelDefinition";
    }
}
