package com.example.sqlgate.model;

/**
 * A value that came out differently when a past run was re-derived.
 */
public record ReplayDivergence(String field, String recorded, String replayed) {
}
