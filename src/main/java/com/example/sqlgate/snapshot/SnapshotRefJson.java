package com.example.sqlgate.snapshot;

import com.example.sqlgate.model.SnapshotRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link SnapshotRef}, shared by the snapshot catalog and the audit log.
 */
public final class SnapshotRefJson {

    private SnapshotRefJson() {
    }

    public static ObjectNode toJson(ObjectMapper mapper, SnapshotRef ref) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", ref.id());
        node.put("created_at", ref.createdAt().toString());
        node.put("backend", ref.backend());
        ArrayNode tables = node.putArray("tables");
        ref.tables().forEach(tables::add);
        ObjectNode location = node.putObject("location");
        ref.shadowTables().forEach(location::put);
        return node;
    }

    public static SnapshotRef fromJson(JsonNode node) {
        List<String> tables = new ArrayList<>();
        for (JsonNode table : node.path("tables")) {
            tables.add(table.asText());
        }
        Map<String, String> location = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> field : node.path("location").properties()) {
            location.put(field.getKey(), field.getValue().asText());
        }
        return new SnapshotRef(
                requireText(node, "id"),
                Instant.parse(requireText(node, "created_at")),
                requireText(node, "backend"),
                tables,
                location
        );
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Snapshot JSON is missing '" + field + "'");
        }
        return value.asText();
    }
}
