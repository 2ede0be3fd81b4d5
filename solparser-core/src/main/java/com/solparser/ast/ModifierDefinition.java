package com.solparser.ast;

import java.util.List;

public record ModifierDefinition(
    SourceRange loc,
    String name,
    List<VariableDeclaration> parameters,
    Block body,
    boolean virtual,
    List<UserDefinedTypeName> override
) implements ContractPart {
    @Override
    public String type() {
        return "ModifierDefinition";
    }
}
