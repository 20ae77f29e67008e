package com.example.sqlgate.model;

/**
 * Totally ordered risk levels; declaration order is severity order.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public RiskLevel escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
