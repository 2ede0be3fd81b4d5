package com.solparser.ast;

import java.util.List;

public record AssemblyCall(
    SourceRange loc,
    String functionName,
    List<AssemblyExpression> arguments
) implements AssemblyExpression {
    @Override
    public String type() {
        return "AssemblyCall";
    }
}
