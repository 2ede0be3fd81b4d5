package com.solparser.ast;

import java.util.List;

public record ContractDefinition(
    SourceRange loc,
    String name,
    ContractKind kind,
    List<InheritanceSpecifier> baseContracts,
    List<ContractPart> subNodes
) implements SourceUnitPart {
    @Override
    public String type() {
        return "ContractDefinition";
    }
}
