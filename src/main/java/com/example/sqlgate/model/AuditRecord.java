package com.example.sqlgate.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The single immutable record written for every finished run.
 *
 * <p>Construction enforces the execution invariant: a statement is only ever executed after
 * an automatic or explicit approval, a HIGH or CRITICAL statement only with a snapshot, and a
 * CRITICAL statement only under an elevated override.
 */
public record AuditRecord(
        String runId,
        Instant timestamp,
        String sql,
        String fingerprint,
        RiskAssessment riskAssessment,
        DryRunResult dryRunResult,
        ApprovalDecision approvalDecision,
        SnapshotRef snapshotRef,
        ExecutionOutcome executionOutcome,
        FinalStatus finalStatus,
        AbortReason abortReason,
        ElevatedOverride override,
        List<StepRecord> steps,
        String summary
) {

    public AuditRecord {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(sql, "sql");
        Objects.requireNonNull(riskAssessment, "riskAssessment");
        Objects.requireNonNull(approvalDecision, "approvalDecision");
        Objects.requireNonNull(executionOutcome, "executionOutcome");
        Objects.requireNonNull(finalStatus, "finalStatus");
        steps = steps == null ? List.of() : List.copyOf(steps);

        if (executionOutcome.attempted()) {
            if (!approvalDecision.permitsExecution()) {
                throw new IllegalStateException("Run " + runId + " executed without approval ("
                        + approvalDecision + ")");
            }
            RiskLevel level = riskAssessment.level();
            if (level.isAtLeast(RiskLevel.HIGH) && snapshotRef == null) {
                throw new IllegalStateException("Run " + runId + " executed a " + level
                        + " statement without a snapshot");
            }
            if (level == RiskLevel.CRITICAL && override == null) {
                throw new IllegalStateException("Run " + runId + " executed a CRITICAL statement without an override");
            }
        }
        if (finalStatus == FinalStatus.BLOCKED && executionOutcome.attempted()) {
            throw new IllegalStateException("Run " + runId + " is BLOCKED but records an execution");
        }
    }

    public RiskLevel riskLevel() {
        return riskAssessment.level();
    }
}
