package com.example.sqlgate.tools;

import com.example.sqlgate.SqlGate;
import com.example.sqlgate.model.AuditQuery;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.RiskLevel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

public class AuditQueryTool implements Tool {
    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final ObjectMapper mapper;
    private final SqlGate sqlGate;

    public AuditQueryTool(ObjectMapper mapper, SqlGate sqlGate) {
        this.mapper = mapper;
        this.sqlGate = sqlGate;
    }

    @Override
    public String getName() {
        return "audit.query";
    }

    @Override
    public String getDescription() {
        return "List audited runs in a time range (from inclusive, to exclusive) at or above a risk level.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        properties.putObject("from").put("type", "string").put("description", "ISO-8601 instant, inclusive.");
        properties.putObject("to").put("type", "string").put("description", "ISO-8601 instant, exclusive.");
        ArrayNode levels = properties.putObject("minLevel").put("type", "string").putArray("enum");
        for (RiskLevel level : RiskLevel.values()) {
            levels.add(level.name());
        }
        properties.putObject("limit")
                .put("type", "integer")
                .put("minimum", 1)
                .put("default", DEFAULT_LIMIT)
                .put("description", "Maximum number of records, newest kept (max " + MAX_LIMIT + ").");
        schema.set("properties", properties);
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) throws Exception {
        AuditQuery query = new AuditQuery(
                instant(arguments, "from"),
                instant(arguments, "to"),
                level(optionalText(arguments, "minLevel")));
        int limit = Math.max(1, Math.min(arguments.path("limit").asInt(DEFAULT_LIMIT), MAX_LIMIT));

        List<AuditRecord> records = sqlGate.auditLog().query(query);
        List<AuditRecord> page = records.subList(Math.max(0, records.size() - limit), records.size());
        ObjectNode result = mapper.createObjectNode();
        ArrayNode items = result.putArray("records");
        for (AuditRecord record : page) {
            items.add(sqlGate.codec().encode(record));
        }
        result.put("totalCount", records.size());
        result.put("returned", page.size());
        return result;
    }

    private Instant instant(JsonNode arguments, String field) {
        String value = optionalText(arguments, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'" + field + "' is not an ISO-8601 instant: " + value, e);
        }
    }

    private RiskLevel level(String value) {
        if (value == null) {
            return null;
        }
        try {
            return RiskLevel.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown risk level: " + value, e);
        }
    }
}
