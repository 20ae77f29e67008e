package com.example.sqlgate.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AuditRecordTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void executionRequiresApproval() {
        assertThrows(IllegalStateException.class,
                () -> record(RiskLevel.LOW, ApprovalDecision.DENIED, null, ExecutionOutcome.success(1), FinalStatus.DONE, null));
    }

    @Test
    void highRiskExecutionRequiresSnapshot() {
        assertThrows(IllegalStateException.class,
                () -> record(RiskLevel.HIGH, ApprovalDecision.APPROVED, null, ExecutionOutcome.success(1), FinalStatus.DONE, null));
        assertDoesNotThrow(
                () -> record(RiskLevel.HIGH, ApprovalDecision.APPROVED, snapshot(), ExecutionOutcome.success(1), FinalStatus.DONE, null));
    }

    @Test
    void criticalExecutionRequiresOverride() {
        assertThrows(IllegalStateException.class,
                () -> record(RiskLevel.CRITICAL, ApprovalDecision.APPROVED, snapshot(), ExecutionOutcome.failed("x"), FinalStatus.DONE, null));
        assertDoesNotThrow(() -> record(RiskLevel.CRITICAL, ApprovalDecision.APPROVED, snapshot(), ExecutionOutcome.success(0),
                FinalStatus.DONE, new ElevatedOverride("dba", "cleanup")));
    }

    @Test
    void blockedRunsNeverExecute() {
        assertDoesNotThrow(
                () -> record(RiskLevel.CRITICAL, ApprovalDecision.NONE, null, ExecutionOutcome.notRun(), FinalStatus.BLOCKED, null));
    }

    @Test
    void overrideNeedsWhoAndWhy() {
        assertThrows(IllegalArgumentException.class, () -> new ElevatedOverride(" ", "reason"));
        assertThrows(IllegalArgumentException.class, () -> new ElevatedOverride("dba", null));
    }

    private static SnapshotRef snapshot() {
        return new SnapshotRef("SNAPSHOT_1", NOW, "transactional-engine", List.of("t"), Map.of("t", "snap_t"));
    }

    private static AuditRecord record(RiskLevel level, ApprovalDecision decision, SnapshotRef snapshot,
                                      ExecutionOutcome outcome, FinalStatus status, ElevatedOverride override) {
        return new AuditRecord("RUN_1", NOW, "sql", "fp",
                new RiskAssessment(level, List.of(new RuleMatch("R", "r"))), null, decision, snapshot, outcome,
                status, null, override, List.of(), null);
    }
}
