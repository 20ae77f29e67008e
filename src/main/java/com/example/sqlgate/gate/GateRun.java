package com.example.sqlgate.gate;

import com.example.sqlgate.model.AbortReason;
import com.example.sqlgate.model.ApprovalDecision;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.ElevatedOverride;
import com.example.sqlgate.model.ExecutionOutcome;
import com.example.sqlgate.model.FinalStatus;
import com.example.sqlgate.model.GateState;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.model.RuleMatch;
import com.example.sqlgate.model.SnapshotRef;
import com.example.sqlgate.model.SqlStatement;
import com.example.sqlgate.model.StepRecord;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one submission while it moves through the gate. Confined to one thread.
 */
final class GateRun {

    static final String RULE_INTERNAL_ERROR = "INTERNAL_ERROR";

    private final String runId;
    private final String sql;
    private final ElevatedOverride override;
    private final Clock clock;
    private final Instant receivedAt;
    private final List<StepRecord> steps = new ArrayList<>();

    private GateState state;
    private SqlStatement statement;
    private DryRunResult dryRun;
    private RiskAssessment assessment;
    private ApprovalDecision decision = ApprovalDecision.NONE;
    private SnapshotRef snapshot;
    private ExecutionOutcome outcome = ExecutionOutcome.notRun();
    private AbortReason abortReason;

    GateRun(String runId, String sql, ElevatedOverride override, Clock clock) {
        this.runId = runId;
        this.sql = sql;
        this.override = override;
        this.clock = clock;
        this.receivedAt = clock.instant();
        this.state = GateState.RECEIVED;
        steps.add(new StepRecord(GateState.RECEIVED, receivedAt, null));
    }

    void transition(GateState next, String note) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + state + " to " + next);
        }
        state = next;
        steps.add(new StepRecord(next, clock.instant(), note));
    }

    void abort(AbortReason reason, String note) {
        abortReason = reason;
        transition(GateState.ABORTED, reason + (note == null ? "" : ": " + note));
    }

    /**
     * Ends the run after an unexpected failure. States before assessment are passed through
     * so the recorded trace still follows the permitted transitions.
     */
    void failInternally(RuntimeException failure) {
        String message = failure.getClass().getSimpleName() + (failure.getMessage() == null ? "" : ": " + failure.getMessage());
        if (assessment == null) {
            assessment = new RiskAssessment(RiskLevel.CRITICAL, List.of(new RuleMatch(RULE_INTERNAL_ERROR, message)));
        }
        if (state.isTerminal()) {
            return;
        }
        if (state == GateState.AUDITED) {
            transition(GateState.DONE, message);
            return;
        }
        while (state != GateState.RISK_ASSESSED && state.successors().size() == 1) {
            transition(state.successors().iterator().next(), "skipped after internal error");
        }
        abort(AbortReason.INTERNAL_ERROR, message);
    }

    AuditRecord toRecord() {
        FinalStatus finalStatus = switch (state) {
            case DONE -> FinalStatus.DONE;
            case BLOCKED -> FinalStatus.BLOCKED;
            case ABORTED -> FinalStatus.ABORTED;
            default -> throw new IllegalStateException("Run " + runId + " is not finished: " + state);
        };
        return new AuditRecord(
                runId,
                receivedAt,
                sql,
                statement == null ? null : statement.fingerprint(),
                assessment,
                dryRun,
                decision,
                snapshot,
                outcome,
                finalStatus,
                abortReason,
                override,
                steps,
                summary(finalStatus)
        );
    }

    private String summary(FinalStatus finalStatus) {
        StringBuilder summary = new StringBuilder(runId)
                .append(": ").append(finalStatus)
                .append(" risk=").append(assessment.level());
        if (dryRun != null) {
            summary.append(" estimated_rows=").append(dryRun.estimatedRows());
        }
        summary.append(" approval=").append(decision);
        if (snapshot != null) {
            summary.append(" snapshot=").append(snapshot.id());
        }
        summary.append(" execution=").append(outcome.status());
        if (outcome.affectedRows() != null) {
            summary.append(" affected_rows=").append(outcome.affectedRows());
        }
        if (abortReason != null) {
            summary.append(" reason=").append(abortReason);
        }
        return summary.toString();
    }

    String runId() {
        return runId;
    }

    String sql() {
        return sql;
    }

    ElevatedOverride override() {
        return override;
    }

    GateState state() {
        return state;
    }

    SqlStatement statement() {
        return statement;
    }

    void statement(SqlStatement statement) {
        this.statement = statement;
    }

    DryRunResult dryRun() {
        return dryRun;
    }

    void dryRun(DryRunResult dryRun) {
        this.dryRun = dryRun;
    }

    RiskAssessment assessment() {
        return assessment;
    }

    void assessment(RiskAssessment assessment) {
        this.assessment = assessment;
    }

    void decision(ApprovalDecision decision) {
        this.decision = decision;
    }

    void snapshot(SnapshotRef snapshot) {
        this.snapshot = snapshot;
    }

    void outcome(ExecutionOutcome outcome) {
        this.outcome = outcome;
    }
}
