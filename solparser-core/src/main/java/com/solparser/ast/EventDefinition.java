package com.solparser.ast;

import java.util.List;

public record EventDefinition(
    SourceRange loc,
    String name,
    List<VariableDeclaration> parameters,
    boolean anonymous
) implements SourceUnitPart, ContractPart {
    @Override
    public String type() {
        return "EventDefinition";
    }
}
