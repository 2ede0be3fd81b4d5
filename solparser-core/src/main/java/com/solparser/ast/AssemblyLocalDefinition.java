package com.solparser.ast;

import java.util.List;

public record AssemblyLocalDefinition(
    SourceRange loc,
    List<AssemblyItem> names,
    AssemblyExpression expression
) implements AssemblyItem {
    @Override
    public String type() {
        return "AssemblyLocalDefinition";
    }
}
