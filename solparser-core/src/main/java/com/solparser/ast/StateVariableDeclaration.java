package com.solparser.ast;

import java.util.List;

public record StateVariableDeclaration(
    SourceRange loc,
    List<VariableDeclaration> variables,
    Expression initialValue
) implements ContractPart {
    @Override
    public String type() {
        return "StateVariableDeclaration";
    }
}
