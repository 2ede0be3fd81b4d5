package com.solparser.ast;

import java.util.List;

public record TupleExpression(
    SourceRange loc,
    List<Expression> components,
    boolean array
) implements Expression {
    @Override
    public String type() {
        return "TupleExpression";
    }
}
