package com.example.sqlgate.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable handle to a point-in-time capture. {@code shadowTables} maps each captured
 * table to the table holding its copy.
 */
public record SnapshotRef(
        String id,
        Instant createdAt,
        String backend,
        List<String> tables,
        Map<String, String> shadowTables
) {

    public SnapshotRef {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(backend, "backend");
        tables = List.copyOf(tables);
        shadowTables = Collections.unmodifiableMap(new LinkedHashMap<>(shadowTables));
    }

    public String location() {
        return shadowTables.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(","));
    }
}
