package com.solparser.ast;

import java.util.List;

public record AssemblyBlock(
    SourceRange loc,
    List<AssemblyItem> operations
) implements AssemblyItem {
    @Override
    public String type() {
        return "AssemblyBlock";
    }
}
