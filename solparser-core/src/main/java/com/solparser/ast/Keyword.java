package com.solparser.ast;

/**
 * Implemented by the attribute enums that render as a Solidity keyword.
 */
public interface Keyword {
    String keyword();
}
