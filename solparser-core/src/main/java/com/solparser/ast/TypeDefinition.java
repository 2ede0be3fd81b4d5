package com.solparser.ast;

public record TypeDefinition(
    SourceRange loc,
    String name,
    ElementaryTypeName definition
) implements SourceUnitPart, ContractPart {
    @Override
    public String type() {
        return "TypeDefinition";
    }
}
