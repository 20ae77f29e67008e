package com.example.sqlgate.model;

/**
 * Explicit, separately audited permission to route a CRITICAL statement through approval
 * instead of blocking it.
 */
public record ElevatedOverride(String authorizedBy, String reason) {

    public ElevatedOverride {
        if (authorizedBy == null || authorizedBy.isBlank()) {
            throw new IllegalArgumentException("An elevated override must name who authorized it");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("An elevated override must state a reason");
        }
    }
}
