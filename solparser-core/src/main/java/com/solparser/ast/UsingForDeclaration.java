package com.solparser.ast;

import java.util.List;

/**
 * {@code using L for T;} or {@code using {f, g as +} for T global;}. A {@code null} type name
 * stands for {@code *}.
 */
public record UsingForDeclaration(
    SourceRange loc,
    TypeName typeName,
    String libraryName,
    List<String> functions,
    List<String> operators,
    boolean global
) implements SourceUnitPart, ContractPart {
    @Override
    public String type() {
        return "UsingForDeclaration";
    }
}
