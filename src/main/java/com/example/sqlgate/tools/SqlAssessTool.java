package com.example.sqlgate.tools;

import com.example.sqlgate.SqlGate;
import com.example.sqlgate.gate.GatePreview;
import com.example.sqlgate.model.ParsedStatement;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.model.RuleMatch;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Classifies a statement without running or auditing it.
 */
public class SqlAssessTool implements Tool {

    private final ObjectMapper mapper;
    private final SqlGate sqlGate;

    public SqlAssessTool(ObjectMapper mapper, SqlGate sqlGate) {
        this.mapper = mapper;
        this.sqlGate = sqlGate;
    }

    @Override
    public String getName() {
        return "sql.assess";
    }

    @Override
    public String getDescription() {
        return "Parse, dry-run and classify a SQL statement without executing it.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        properties.putObject("sql").put("type", "string");
        schema.set("properties", properties);
        var required = mapper.createArrayNode();
        required.add("sql");
        schema.set("required", required);
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) {
        GatePreview preview = sqlGate.gate().preview(requireText(arguments, "sql"));

        ObjectNode result = mapper.createObjectNode();
        result.put("sql", preview.statement().sql());
        result.put("fingerprint", preview.statement().fingerprint());
        result.put("parsed", preview.statement().isParsed());
        if (preview.statement().isParsed()) {
            ParsedStatement parsed = preview.statement().parsed();
            result.put("kind", parsed.kind().name());
            ArrayNode targets = result.putArray("targetTables");
            parsed.targetTables().forEach(targets::add);
            ArrayNode referenced = result.putArray("referencedTables");
            parsed.referencedTables().forEach(referenced::add);
        } else {
            result.put("parseError", preview.statement().parseError());
        }

        result.put("riskLevel", preview.assessment().level().name());
        ArrayNode rules = result.putArray("rules");
        for (RuleMatch match : preview.assessment().matches()) {
            ObjectNode rule = rules.addObject();
            rule.put("id", match.ruleId());
            rule.put("rationale", match.rationale());
        }
        if (preview.dryRun() == null) {
            result.putNull("dryRun");
        } else {
            result.set("dryRun", sqlGate.codec().encodeDryRun(preview.dryRun()));
        }
        if (preview.dryRunError() != null) {
            result.put("dryRunError", preview.dryRunError());
        }
        result.put("route", route(preview));
        return result;
    }

    private String route(GatePreview preview) {
        RiskLevel level = preview.assessment().level();
        if (level == RiskLevel.CRITICAL) {
            return "BLOCK";
        }
        if (preview.dryRunError() != null) {
            return "ABORT";
        }
        return level == RiskLevel.LOW ? "AUTO_APPROVE" : "REQUIRE_APPROVAL";
    }
}
