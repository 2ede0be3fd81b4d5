package com.solparser.ast;

import java.util.List;

public record FunctionCall(
    SourceRange loc,
    Expression expression,
    List<Expression> arguments,
    List<String> names,
    List<Identifier> identifiers
) implements Expression {
    @Override
    public String type() {
        return "FunctionCall";
    }
}
