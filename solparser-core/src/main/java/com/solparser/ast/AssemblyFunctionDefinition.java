package com.solparser.ast;

import java.util.List;

public record AssemblyFunctionDefinition(
    SourceRange loc,
    String name,
    List<Identifier> arguments,
    List<Identifier> returnArguments,
    AssemblyBlock body
) implements AssemblyItem {
    @Override
    public String type() {
        return "AssemblyFunctionDefinition";
    }
}
