package com.solparser.ast;

import java.util.List;

public record StructDefinition(
    SourceRange loc,
    String name,
    List<VariableDeclaration> members
) implements SourceUnitPart, ContractPart {
    @Override
    public String type() {
        return "StructDefinition";
    }
}
