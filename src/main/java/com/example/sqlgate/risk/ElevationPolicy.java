package com.example.sqlgate.risk;

import com.example.sqlgate.model.RiskLevel;

import java.util.Locale;

/**
 * How a protected table raises the level of a write against it.
 */
public enum ElevationPolicy {
    ESCALATE_ONE_LEVEL,
    ALWAYS_CRITICAL;

    public RiskLevel apply(RiskLevel level) {
        return this == ALWAYS_CRITICAL ? RiskLevel.CRITICAL : level.escalate();
    }

    public static ElevationPolicy fromKey(String key) {
        if (key == null || key.isBlank()) {
            return ESCALATE_ONE_LEVEL;
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown elevation policy: " + key, e);
        }
    }
}
