package com.solparser.ast;

/**
 * The keyword a contract-like declaration was introduced with. {@code abstract contract}
 * is its own kind.
 */
public enum ContractKind implements Keyword {
    CONTRACT("contract"),
    ABSTRACT("abstract"),
    INTERFACE("interface"),
    LIBRARY("library");

    private final String keyword;

    ContractKind(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    public static ContractKind fromKeyword(String keyword) {
        for (ContractKind value : values()) {
            if (value.keyword.equals(keyword)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown contract kind: " + keyword);
    }
}
