package com.solparser.ast;

import java.util.List;

public record NameValueList(
    SourceRange loc,
    List<String> names,
    List<Identifier> identifiers,
    List<Expression> arguments
) implements Node {
    @Override
    public String type() {
        return "NameValueList";
    }
}
