package com.solparser.ast;

import java.util.List;

public record AssemblySwitch(
    SourceRange loc,
    AssemblyExpression expression,
    List<AssemblyCase> cases
) implements AssemblyItem {
    @Override
    public String type() {
        return "AssemblySwitch";
    }
}
