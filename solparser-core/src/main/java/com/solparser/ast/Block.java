package com.solparser.ast;

import java.util.List;

public record Block(
    SourceRange loc,
    List<Statement> statements
) implements Statement {
    @Override
    public String type() {
        return "Block";
    }
}
