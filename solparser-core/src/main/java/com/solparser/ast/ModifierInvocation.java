package com.solparser.ast;

import java.util.List;

/**
 * A modifier or base constructor call in a function header. {@code arguments} is {@code null}
 * when the invocation has no parentheses at all.
 */
public record ModifierInvocation(
    SourceRange loc,
    String name,
    List<Expression> arguments
) implements Node {
    @Override
    public String type() {
        return "ModifierInvocation";
    }
}
