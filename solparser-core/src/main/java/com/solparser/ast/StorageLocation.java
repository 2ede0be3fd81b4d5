package com.solparser.ast;

public enum StorageLocation implements Keyword {
    DEFAULT("default"),
    MEMORY("memory"),
    STORAGE("storage"),
    CALLDATA("calldata");

    private final String keyword;

    StorageLocation(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    public static StorageLocation fromKeyword(String keyword) {
        for (StorageLocation value : values()) {
            if (value.keyword.equals(keyword)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown storage location: " + keyword);
    }
}
