package com.solparser.ast;

import java.util.List;

/**
 * An {@code import} directive. {@code symbolAliases} is {@code null} unless the directive
 * uses the braced {@code import {A as B} from "path"} form.
 */
public record ImportDirective(
    SourceRange loc,
    String path,
    StringLiteral pathLiteral,
    String unitAlias,
    Identifier unitAliasIdentifier,
    List<SymbolAlias> symbolAliases
) implements SourceUnitPart {
    @Override
    public String type() {
        return "ImportDirective";
    }

    public record SymbolAlias(Identifier symbol, Identifier alias) {}
}
