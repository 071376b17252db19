package com.idl.compiler.model;

/**
 * The three flavours of struct-like definitions.
 */
public enum StructKind {
    STRUCT("struct"),
    UNION("union"),
    EXCEPTION("exception");

    private final String keyword;

    StructKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
