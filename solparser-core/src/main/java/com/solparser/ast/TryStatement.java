package com.solparser.ast;

import java.util.List;

public record TryStatement(
    SourceRange loc,
    Expression expression,
    List<VariableDeclaration> returnParameters,
    Block body,
    List<CatchClause> catchClauses
) implements Statement {
    @Override
    public String type() {
        return "TryStatement";
    }
}
