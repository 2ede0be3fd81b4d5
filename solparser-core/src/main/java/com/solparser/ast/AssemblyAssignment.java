package com.solparser.ast;

import java.util.List;

public record AssemblyAssignment(
    SourceRange loc,
    List<AssemblyItem> names,
    AssemblyExpression expression
) implements AssemblyItem {
    @Override
    public String type() {
        return "AssemblyAssignment";
    }
}
