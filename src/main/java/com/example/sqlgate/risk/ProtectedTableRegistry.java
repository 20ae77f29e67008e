package com.example.sqlgate.risk;

import com.example.sqlgate.util.StatementNormalizer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only map of protected table names to their elevation policy. Names are matched
 * case-insensitively, by qualified name first and then by the unqualified table name.
 */
public final class ProtectedTableRegistry {

    private static final ProtectedTableRegistry EMPTY = new ProtectedTableRegistry(Map.of());

    private final Map<String, ElevationPolicy> policies;

    public ProtectedTableRegistry(Map<String, ElevationPolicy> policies) {
        Map<String, ElevationPolicy> normalized = new LinkedHashMap<>();
        policies.forEach((name, policy) -> {
            String key = StatementNormalizer.normalizeIdentifier(name);
            if (key == null || key.isEmpty()) {
                throw new IllegalArgumentException("Protected table name must not be blank");
            }
            normalized.put(key, policy == null ? ElevationPolicy.ESCALATE_ONE_LEVEL : policy);
        });
        this.policies = Collections.unmodifiableMap(normalized);
    }

    public static ProtectedTableRegistry empty() {
        return EMPTY;
    }

    /**
     * Parses {@code "users, audit.visits:ALWAYS_CRITICAL"}; entries without a policy escalate one level.
     */
    public static ProtectedTableRegistry parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return EMPTY;
        }
        Map<String, ElevationPolicy> policies = new LinkedHashMap<>();
        for (String entry : spec.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int colon = trimmed.lastIndexOf(':');
            if (colon < 0) {
                policies.put(trimmed, ElevationPolicy.ESCALATE_ONE_LEVEL);
            } else {
                policies.put(trimmed.substring(0, colon).trim(), ElevationPolicy.fromKey(trimmed.substring(colon + 1)));
            }
        }
        return new ProtectedTableRegistry(policies);
    }

    public Optional<ElevationPolicy> lookup(String table) {
        String key = StatementNormalizer.normalizeIdentifier(table);
        if (key == null || key.isEmpty()) {
            return Optional.empty();
        }
        ElevationPolicy policy = policies.get(key);
        if (policy == null) {
            int dot = key.lastIndexOf('.');
            if (dot >= 0) {
                policy = policies.get(key.substring(dot + 1));
            }
        }
        return Optional.ofNullable(policy);
    }

    public boolean isProtected(String table) {
        return lookup(table).isPresent();
    }

    public Map<String, ElevationPolicy> asMap() {
        return policies;
    }
}
