package com.solparser.ast;

import java.util.List;

public record InheritanceSpecifier(
    SourceRange loc,
    UserDefinedTypeName baseName,
    List<Expression> arguments
) implements Node {
    @Override
    public String type() {
        return "InheritanceSpecifier";
    }
}
