package com.solparser.ast;

public record NumberLiteral(
    SourceRange loc,
    String number,
    String subdenomination
) implements Expression, AssemblyItem {
    @Override
    public String type() {
        return "NumberLiteral";
    }
}
