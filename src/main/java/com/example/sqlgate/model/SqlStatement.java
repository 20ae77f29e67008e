package com.example.sqlgate.model;

import java.util.Objects;

/**
 * A captured statement: the raw text, its fingerprint and the parse outcome.
 * Exactly one of {@code parsed} and {@code parseError} is non-null.
 */
public record SqlStatement(String sql, String fingerprint, ParsedStatement parsed, String parseError) {

    public SqlStatement {
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(fingerprint, "fingerprint");
        if ((parsed == null) == (parseError == null)) {
            throw new IllegalArgumentException("Exactly one of parsed and parseError must be present");
        }
    }

    public static SqlStatement parsed(String sql, String fingerprint, ParsedStatement parsed) {
        return new SqlStatement(sql, fingerprint, parsed, null);
    }

    public static SqlStatement unparseable(String sql, String fingerprint, String parseError) {
        return new SqlStatement(sql, fingerprint, null, parseError);
    }

    public boolean isParsed() {
        return parsed != null;
    }
}
