package com.solparser.ast;

public record IndexRangeAccess(
    SourceRange loc,
    Expression base,
    Expression indexStart,
    Expression indexEnd
) implements Expression {
    @Override
    public String type() {
        return "IndexRangeAccess";
    }
}
