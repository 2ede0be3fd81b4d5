package com.solparser.ast;

import java.util.List;

public record CatchClause(
    SourceRange loc,
    String kind,
    boolean reasonStringType,
    List<VariableDeclaration> parameters,
    Block body
) implements Node {
    @Override
    public String type() {
        return "CatchClause";
    }
}
