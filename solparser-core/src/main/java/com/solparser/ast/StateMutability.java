package com.solparser.ast;

/**
 * State mutability of a function, function type or variable.
 */
public enum StateMutability implements Keyword {
    DEFAULT("default"),
    PURE("pure"),
    VIEW("view"),
    PAYABLE("payable"),
    CONSTANT("constant");

    private final String keyword;

    StateMutability(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    public static StateMutability fromKeyword(String keyword) {
        for (StateMutability value : values()) {
            if (value.keyword.equals(keyword)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown state mutability: " + keyword);
    }
}
