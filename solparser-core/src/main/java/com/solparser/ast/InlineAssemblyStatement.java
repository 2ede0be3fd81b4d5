package com.solparser.ast;

import java.util.List;

public record InlineAssemblyStatement(
    SourceRange loc,
    String language,
    List<String> flags,
    AssemblyBlock body
) implements Statement {
    @Override
    public String type() {
        return "InlineAssemblyStatement";
    }
}
