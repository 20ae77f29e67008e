package com.example.sqlgate.tools;

import com.example.sqlgate.SqlGate;
import com.example.sqlgate.model.ReplayDivergence;
import com.example.sqlgate.model.ReplayTrace;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class AuditReplayTool implements Tool {

    private final ObjectMapper mapper;
    private final SqlGate sqlGate;

    public AuditReplayTool(ObjectMapper mapper, SqlGate sqlGate) {
        this.mapper = mapper;
        this.sqlGate = sqlGate;
    }

    @Override
    public String getName() {
        return "audit.replay";
    }

    @Override
    public String getDescription() {
        return "Re-derive the dry run and risk assessment of an audited run and report differences. Never executes.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        properties.putObject("runId").put("type", "string");
        schema.set("properties", properties);
        var required = mapper.createArrayNode();
        required.add("runId");
        schema.set("required", required);
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) throws Exception {
        ReplayTrace trace = sqlGate.replay().replay(requireText(arguments, "runId"));
        ObjectNode result = mapper.createObjectNode();
        result.put("runId", trace.runId());
        result.put("sql", trace.sql());
        result.put("replayedAt", trace.replayedAt().toString());
        result.put("recordedLevel", trace.recordedAssessment().level().name());
        result.put("replayedLevel", trace.replayedAssessment().level().name());
        if (trace.replayedDryRun() == null) {
            result.putNull("replayedDryRun");
        } else {
            result.set("replayedDryRun", sqlGate.codec().encodeDryRun(trace.replayedDryRun()));
        }
        result.put("consistent", trace.consistent());
        ArrayNode divergences = result.putArray("divergences");
        for (ReplayDivergence divergence : trace.divergences()) {
            ObjectNode node = divergences.addObject();
            node.put("field", divergence.field());
            node.put("recorded", divergence.recorded());
            node.put("replayed", divergence.replayed());
        }
        return result;
    }
}
