package com.solparser.ast;

public record PragmaDirective(
    SourceRange loc,
    String name,
    String value
) implements SourceUnitPart {
    @Override
    public String type() {
        return "PragmaDirective";
    }
}
