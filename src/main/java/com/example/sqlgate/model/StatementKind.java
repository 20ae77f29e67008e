package com.example.sqlgate.model;

public enum StatementKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    DDL,
    OTHER;

    public boolean isMutatingDml() {
        return this == INSERT || this == UPDATE || this == DELETE;
    }

    public boolean isMutating() {
        return this != SELECT;
    }

    /** UPDATE and DELETE are the kinds whose blast radius is bounded by a WHERE clause. */
    public boolean takesPredicate() {
        return this == UPDATE || this == DELETE;
    }
}
