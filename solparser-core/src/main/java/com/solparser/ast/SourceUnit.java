package com.solparser.ast;

import java.util.List;

public record SourceUnit(
    SourceRange loc,
    List<SourceUnitPart> children
) implements Node {
    @Override
    public String type() {
        return "SourceUnit";
    }
}
