package com.solparser.ast;

public enum Visibility implements Keyword {
    PUBLIC("public"),
    PRIVATE("private"),
    INTERNAL("internal"),
    EXTERNAL("external");

    private final String keyword;

    Visibility(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String keyword() {
        return keyword;
    }

    public static Visibility fromKeyword(String keyword) {
        for (Visibility value : values()) {
            if (value.keyword.equals(keyword)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown visibility: " + keyword);
    }
}
