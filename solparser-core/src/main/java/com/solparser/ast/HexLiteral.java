package com.solparser.ast;

import java.util.List;

public record HexLiteral(
    SourceRange loc,
    String value,
    List<String> parts
) implements Expression, AssemblyExpression {
    @Override
    public String type() {
        return "HexLiteral";
    }
}
