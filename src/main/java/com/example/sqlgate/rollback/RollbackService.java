package com.example.sqlgate.rollback;

import com.example.sqlgate.NotFoundException;
import com.example.sqlgate.audit.AuditLog;
import com.example.sqlgate.gate.LockTimeoutException;
import com.example.sqlgate.gate.TableLockManager;
import com.example.sqlgate.model.AbortReason;
import com.example.sqlgate.model.ApprovalDecision;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.ExecutionOutcome;
import com.example.sqlgate.model.FinalStatus;
import com.example.sqlgate.model.GateState;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.model.RuleMatch;
import com.example.sqlgate.model.SnapshotRef;
import com.example.sqlgate.model.StepRecord;
import com.example.sqlgate.snapshot.BackendException;
import com.example.sqlgate.snapshot.SnapshotManager;
import com.example.sqlgate.util.RunIds;
import com.example.sqlgate.util.StatementNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Restores snapshots on operator request. Every restore attempt on a known snapshot is audited
 * as its own run.
 */
public class RollbackService {
    public static final String RULE_SNAPSHOT_RESTORE = "SNAPSHOT_RESTORE";

    private static final Logger LOGGER = LoggerFactory.getLogger(RollbackService.class);

    private final SnapshotManager snapshots;
    private final AuditLog auditLog;
    private final TableLockManager locks;
    private final Duration lockTimeout;
    private final Clock clock;

    public RollbackService(SnapshotManager snapshots, AuditLog auditLog, TableLockManager locks,
                           Duration lockTimeout, Clock clock) {
        this.snapshots = snapshots;
        this.auditLog = auditLog;
        this.locks = locks;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
    }

    public List<SnapshotRef> listSnapshots() throws IOException {
        return snapshots.list();
    }

    public AuditRecord rollback(String snapshotId) throws NotFoundException, IOException {
        SnapshotRef ref = snapshots.find(snapshotId)
                .orElseThrow(() -> new NotFoundException("Unknown snapshot: " + snapshotId));
        String runId = RunIds.next("RUN", clock);
        Instant receivedAt = clock.instant();
        List<StepRecord> steps = new ArrayList<>();
        steps.add(new StepRecord(GateState.RECEIVED, receivedAt, "restore " + snapshotId));

        ExecutionOutcome outcome = ExecutionOutcome.notRun();
        FinalStatus finalStatus = FinalStatus.DONE;
        AbortReason abortReason = null;
        boolean interrupted = false;
        try (TableLockManager.Lease ignored = locks.acquire(ref.tables(), lockTimeout)) {
            try {
                long rows = snapshots.restore(snapshotId);
                outcome = ExecutionOutcome.success(rows);
            } catch (BackendException e) {
                LOGGER.warn("Restore of {} failed", snapshotId, e);
                outcome = ExecutionOutcome.failed(e.getMessage());
            }
            steps.add(new StepRecord(GateState.EXECUTED, clock.instant(), outcome.status().name()));
            steps.add(new StepRecord(GateState.DONE, clock.instant(), null));
        } catch (LockTimeoutException e) {
            finalStatus = FinalStatus.ABORTED;
            abortReason = AbortReason.LOCK_TIMEOUT;
            steps.add(new StepRecord(GateState.ABORTED, clock.instant(), e.getMessage()));
        } catch (IOException e) {
            LOGGER.error("Restore of {}: table lock files unavailable", snapshotId, e);
            finalStatus = FinalStatus.ABORTED;
            abortReason = AbortReason.INTERNAL_ERROR;
            steps.add(new StepRecord(GateState.ABORTED, clock.instant(), "table lock: " + e.getMessage()));
        } catch (InterruptedException e) {
            interrupted = true;
            finalStatus = FinalStatus.ABORTED;
            abortReason = AbortReason.CANCELLED;
            steps.add(new StepRecord(GateState.ABORTED, clock.instant(), "interrupted waiting for table locks"));
        }

        String sql = "RESTORE SNAPSHOT " + snapshotId;
        RiskAssessment assessment = new RiskAssessment(RiskLevel.HIGH, List.of(new RuleMatch(RULE_SNAPSHOT_RESTORE,
                "Overwrites " + String.join(", ", ref.tables()) + " with the contents of " + snapshotId)));
        AuditRecord record = new AuditRecord(runId, receivedAt, sql, StatementNormalizer.fingerprint(sql),
                assessment, null, ApprovalDecision.APPROVED, ref, outcome, finalStatus, abortReason, null, steps,
                summary(runId, snapshotId, outcome, finalStatus));
        try {
            auditLog.append(record);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info(record.summary());
        return record;
    }

    private static String summary(String runId, String snapshotId, ExecutionOutcome outcome, FinalStatus finalStatus) {
        StringBuilder summary = new StringBuilder(runId).append(": ").append(finalStatus)
                .append(" restore of ").append(snapshotId)
                .append(" execution=").append(outcome.status());
        if (outcome.affectedRows() != null) {
            summary.append(" restored_rows=").append(outcome.affectedRows());
        }
        return summary.toString();
    }
}
