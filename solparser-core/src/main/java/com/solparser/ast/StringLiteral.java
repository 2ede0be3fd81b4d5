package com.solparser.ast;

import java.util.List;

/**
 * A string literal made of one or more adjacent fragments. {@code parts} holds each fragment
 * without quotes or {@code unicode} prefix, {@code unicode} flags the prefixed ones and
 * {@code value} is the concatenation.
 */
public record StringLiteral(
    SourceRange loc,
    String value,
    List<String> parts,
    List<Boolean> unicode
) implements Expression, AssemblyExpression {
    @Override
    public String type() {
        return "StringLiteral";
    }
}
