package com.example.sqlgate.tools;

import com.example.sqlgate.SqlGate;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.ElevatedOverride;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class SqlSubmitTool implements Tool {

    private final ObjectMapper mapper;
    private final SqlGate sqlGate;

    public SqlSubmitTool(ObjectMapper mapper, SqlGate sqlGate) {
        this.mapper = mapper;
        this.sqlGate = sqlGate;
    }

    @Override
    public String getName() {
        return "sql.submit";
    }

    @Override
    public String getDescription() {
        return "Submit one SQL statement to the gate. Low-risk statements run immediately; riskier ones "
                + "wait for an operator to approve them out of band and are snapshotted first. Returns the audit record.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        properties.putObject("sql").put("type", "string");
        properties.putObject("overrideBy")
                .put("type", "string")
                .put("description", "Who authorised running a CRITICAL statement.");
        properties.putObject("overrideReason")
                .put("type", "string")
                .put("description", "Why the CRITICAL statement must run.");
        schema.set("properties", properties);
        var required = mapper.createArrayNode();
        required.add("sql");
        schema.set("required", required);
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) throws Exception {
        String sql = requireText(arguments, "sql");
        String overrideBy = optionalText(arguments, "overrideBy");
        String overrideReason = optionalText(arguments, "overrideReason");
        ElevatedOverride override = null;
        if (overrideBy != null || overrideReason != null) {
            override = new ElevatedOverride(overrideBy, overrideReason);
        }
        AuditRecord record = sqlGate.gate().submit(sql, override);
        return sqlGate.codec().encode(record);
    }
}
