package com.example.sqlgate.audit;

import com.example.sqlgate.model.AbortReason;
import com.example.sqlgate.model.ApprovalDecision;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.ElevatedOverride;
import com.example.sqlgate.model.ExecutionOutcome;
import com.example.sqlgate.model.ExecutionStatus;
import com.example.sqlgate.model.FinalStatus;
import com.example.sqlgate.model.GateState;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.model.RuleMatch;
import com.example.sqlgate.model.StepRecord;
import com.example.sqlgate.snapshot.SnapshotRefJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts audit records to and from their persisted JSON form.
 */
public class AuditRecordCodec {

    private final ObjectMapper mapper;

    public AuditRecordCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode encode(AuditRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put("run_id", record.runId());
        node.put("timestamp", record.timestamp().toString());
        node.put("sql", record.sql());
        putNullable(node, "fingerprint", record.fingerprint());
        node.put("risk_level", record.riskLevel().name());

        ArrayNode rules = node.putArray("risk_rules");
        ArrayNode reasons = node.putArray("risk_reasons");
        for (RuleMatch match : record.riskAssessment().matches()) {
            rules.add(match.ruleId());
            reasons.add(match.rationale());
        }

        if (record.dryRunResult() == null) {
            node.putNull("dry_run");
        } else {
            node.set("dry_run", encodeDryRun(record.dryRunResult()));
        }
        node.put("approval_decision", record.approvalDecision().name());
        if (record.snapshotRef() == null) {
            node.putNull("snapshot_ref");
        } else {
            node.set("snapshot_ref", SnapshotRefJson.toJson(mapper, record.snapshotRef()));
        }

        ObjectNode execution = node.putObject("execution");
        ExecutionOutcome outcome = record.executionOutcome();
        execution.put("status", outcome.status().name());
        if (outcome.affectedRows() != null) {
            execution.put("affected_rows", outcome.affectedRows());
        }
        if (outcome.error() != null) {
            execution.put("error", outcome.error());
        }

        node.put("final_status", record.finalStatus().name());
        putNullable(node, "abort_reason", record.abortReason() == null ? null : record.abortReason().name());
        if (record.override() == null) {
            node.putNull("override");
        } else {
            ObjectNode override = node.putObject("override");
            override.put("authorized_by", record.override().authorizedBy());
            override.put("reason", record.override().reason());
        }

        ArrayNode steps = node.putArray("steps");
        for (StepRecord step : record.steps()) {
            ObjectNode stepNode = steps.addObject();
            stepNode.put("state", step.state().name());
            stepNode.put("at", step.at().toString());
            putNullable(stepNode, "note", step.note());
        }
        putNullable(node, "summary", record.summary());
        return node;
    }

    public ObjectNode encodeDryRun(DryRunResult dryRun) {
        ObjectNode node = mapper.createObjectNode();
        node.put("estimated_rows", dryRun.estimatedRows());
        node.put("exact", dryRun.exact());
        putNullable(node, "rewritten_query", dryRun.rewrittenQuery());
        return node;
    }

    public AuditRecord decode(JsonNode node) {
        List<RuleMatch> matches = new ArrayList<>();
        JsonNode rules = node.path("risk_rules");
        JsonNode reasons = node.path("risk_reasons");
        for (int i = 0; i < rules.size(); i++) {
            matches.add(new RuleMatch(rules.get(i).asText(), reasons.path(i).asText("")));
        }
        RiskAssessment assessment = new RiskAssessment(RiskLevel.valueOf(text(node, "risk_level")), matches);

        DryRunResult dryRun = null;
        JsonNode dryRunNode = node.get("dry_run");
        if (dryRunNode != null && !dryRunNode.isNull()) {
            dryRun = new DryRunResult(
                    dryRunNode.path("estimated_rows").asLong(),
                    dryRunNode.path("exact").asBoolean(),
                    nullableText(dryRunNode, "rewritten_query"));
        }

        JsonNode snapshotNode = node.get("snapshot_ref");
        JsonNode executionNode = node.path("execution");
        ExecutionStatus status = ExecutionStatus.valueOf(text(executionNode, "status"));
        ExecutionOutcome outcome = new ExecutionOutcome(
                status,
                executionNode.hasNonNull("affected_rows") ? executionNode.get("affected_rows").asLong() : null,
                nullableText(executionNode, "error"));

        JsonNode overrideNode = node.get("override");
        ElevatedOverride override = overrideNode == null || overrideNode.isNull()
                ? null
                : new ElevatedOverride(text(overrideNode, "authorized_by"), text(overrideNode, "reason"));

        List<StepRecord> steps = new ArrayList<>();
        for (JsonNode step : node.path("steps")) {
            steps.add(new StepRecord(GateState.valueOf(text(step, "state")), Instant.parse(text(step, "at")),
                    nullableText(step, "note")));
        }

        String abortReason = nullableText(node, "abort_reason");
        return new AuditRecord(
                text(node, "run_id"),
                Instant.parse(text(node, "timestamp")),
                text(node, "sql"),
                nullableText(node, "fingerprint"),
                assessment,
                dryRun,
                ApprovalDecision.valueOf(text(node, "approval_decision")),
                snapshotNode == null || snapshotNode.isNull() ? null : SnapshotRefJson.fromJson(snapshotNode),
                outcome,
                FinalStatus.valueOf(text(node, "final_status")),
                abortReason == null ? null : AbortReason.valueOf(abortReason),
                override,
                steps,
                nullableText(node, "summary")
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Audit record is missing '" + field + "'");
        }
        return value.asText();
    }

    private static String nullableText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static void putNullable(ObjectNode node, String key, String value) {
        if (value == null) {
            node.putNull(key);
        } else {
            node.put(key, value);
        }
    }
}
