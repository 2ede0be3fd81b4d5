package com.solparser.ast;

import java.util.List;

public record EnumDefinition(
    SourceRange loc,
    String name,
    List<EnumValue> members
) implements SourceUnitPart, ContractPart {
    @Override
    public String type() {
        return "EnumDefinition";
    }
}
