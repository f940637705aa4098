package com.jsast.ast;

/**
 * The kind of an object literal {@link Property}.
 */
public enum PropertyKind {
    INIT("init"),
    GET("get"),
    SET("set");

    private final String keyword;

    PropertyKind(String keyword) {
        this.keyword = keyword;
    }

    /** {@code "init"}, {@code "get"} or {@code "set"}. */
    public String keyword() {
        return keyword;
    }

    public boolean isAccessor() {
        return this != INIT;
    }

    public static PropertyKind fromKeyword(String keyword) {
        for (PropertyKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown property kind: " + keyword);
    }
}
