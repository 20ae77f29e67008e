package com.example.sqlgate.config;

import java.util.Locale;

/**
 * Snapshot strategy family of the target database.
 */
public enum BackendType {
    SQLITE_LIKE("sqlite-like"),
    TRANSACTIONAL_ENGINE("transactional-engine");

    private final String key;

    BackendType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static BackendType fromKey(String value) {
        String candidate = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (BackendType type : values()) {
            if (type.key.equals(candidate) || type.name().equalsIgnoreCase(candidate)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown backend '" + value + "'; expected sqlite-like or transactional-engine");
    }
}
