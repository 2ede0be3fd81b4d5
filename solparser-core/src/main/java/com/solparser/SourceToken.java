package com.solparser;

import com.solparser.ast.SourceRange;

/**
 * A token of the default channel. {@code type} is the token's symbolic name, or its quoted
 * literal for punctuation and keywords without one.
 */
public record SourceToken(String type, String value, SourceRange loc) {
}
