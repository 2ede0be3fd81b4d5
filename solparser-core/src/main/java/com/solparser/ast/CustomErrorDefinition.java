package com.solparser.ast;

import java.util.List;

public record CustomErrorDefinition(
    SourceRange loc,
    String name,
    List<VariableDeclaration> parameters
) implements SourceUnitPart, ContractPart {
    @Override
    public String type() {
        return "CustomErrorDefinition";
    }
}
