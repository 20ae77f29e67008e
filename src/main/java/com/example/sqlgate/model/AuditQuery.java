package com.example.sqlgate.model;

import java.time.Instant;

/**
 * Filter over audit records; null bounds are open. {@code from} is inclusive, {@code to} exclusive.
 */
public record AuditQuery(Instant from, Instant to, RiskLevel minLevel) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null);
    }

    public boolean matches(AuditRecord record) {
        if (from != null && record.timestamp().isBefore(from)) {
            return false;
        }
        if (to != null && !record.timestamp().isBefore(to)) {
            return false;
        }
        return minLevel == null || record.riskLevel().isAtLeast(minLevel);
    }
}
