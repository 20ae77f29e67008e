package com.example.sqlgate.gate;

import com.example.sqlgate.audit.AuditLog;
import com.example.sqlgate.dryrun.DryRunEstimator;
import com.example.sqlgate.dryrun.DryRunException;
import com.example.sqlgate.model.AbortReason;
import com.example.sqlgate.model.ApprovalDecision;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.ElevatedOverride;
import com.example.sqlgate.model.ExecutionOutcome;
import com.example.sqlgate.model.GateState;
import com.example.sqlgate.model.ParsedStatement;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.model.SnapshotRef;
import com.example.sqlgate.model.SqlStatement;
import com.example.sqlgate.model.StatementKind;
import com.example.sqlgate.parse.SqlParseException;
import com.example.sqlgate.parse.SqlParser;
import com.example.sqlgate.risk.RiskClassifier;
import com.example.sqlgate.snapshot.SnapshotException;
import com.example.sqlgate.snapshot.SnapshotManager;
import com.example.sqlgate.util.RunIds;
import com.example.sqlgate.util.StatementNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a statement through parse, dry run, classification, approval, snapshot and execution,
 * and writes exactly one audit record per submission.
 *
 * <p>LOW statements run without asking. MEDIUM and HIGH wait for the {@link Approver} and are
 * snapshotted before they run. CRITICAL statements are blocked unless submitted with an
 * {@link ElevatedOverride}, in which case they are handled like HIGH.
 */
public class ApprovalGate implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApprovalGate.class);

    private final SqlParser parser;
    private final DryRunEstimator estimator;
    private final RiskClassifier classifier;
    private final SnapshotManager snapshots;
    private final Approver approver;
    private final StatementExecutor executor;
    private final AuditLog auditLog;
    private final TableLockManager locks;
    private final Duration approvalTimeout;
    private final Duration lockTimeout;
    private final Clock clock;
    private final ExecutorService approvalPool;

    public ApprovalGate(SqlParser parser, DryRunEstimator estimator, RiskClassifier classifier,
                        SnapshotManager snapshots, Approver approver, StatementExecutor executor,
                        AuditLog auditLog, TableLockManager locks, Duration approvalTimeout,
                        Duration lockTimeout, Clock clock) {
        this.parser = parser;
        this.estimator = estimator;
        this.classifier = classifier;
        this.snapshots = snapshots;
        this.approver = approver;
        this.executor = executor;
        this.auditLog = auditLog;
        this.locks = locks;
        this.approvalTimeout = approvalTimeout;
        this.lockTimeout = lockTimeout;
        this.clock = clock;
        this.approvalPool = Executors.newCachedThreadPool(daemonThreads());
    }

    public AuditRecord submit(String sql) throws IOException {
        return submit(sql, null);
    }

    /**
     * Runs the full pipeline. Never throws for a refused, failed or aborted statement; the
     * outcome is in the returned record. An {@link IOException} means the audit record could
     * not be written.
     */
    public AuditRecord submit(String sql, ElevatedOverride override) throws IOException {
        if (sql == null) {
            throw new IllegalArgumentException("sql must not be null");
        }
        GateRun run = new GateRun(RunIds.next("RUN", clock), sql, override, clock);
        LOGGER.info("Received {}: {}", run.runId(), sql);
        try {
            process(run);
        } catch (RuntimeException e) {
            LOGGER.error("Run {} failed unexpectedly", run.runId(), e);
            run.failInternally(e);
        }
        AuditRecord record = run.toRecord();
        // an interrupted thread would close the audit file channel mid-write
        boolean interrupted = Thread.interrupted();
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

    /**
     * Parses, estimates and classifies without approval, snapshot, execution or audit.
     */
    public GatePreview preview(String sql) {
        SqlStatement statement = parse(sql);
        DryRunResult dryRun = null;
        String dryRunError = null;
        try {
            dryRun = estimator.estimate(statement).orElse(null);
        } catch (DryRunException e) {
            dryRunError = e.getMessage();
        }
        return new GatePreview(statement, dryRun, classifier.classify(statement, dryRun), dryRunError);
    }

    private void process(GateRun run) {
        SqlStatement statement = parse(run.sql());
        run.statement(statement);
        run.transition(GateState.PARSED, statement.isParsed()
                ? statement.parsed().kind().name()
                : "parse failed: " + statement.parseError());

        String dryRunError = null;
        try {
            Optional<DryRunResult> dryRun = estimator.estimate(statement);
            run.dryRun(dryRun.orElse(null));
            run.transition(GateState.DRYRUN_DONE, dryRun.map(result -> result.estimatedRows() + " rows via " + result.rewrittenQuery())
                    .orElse("no estimate"));
        } catch (DryRunException e) {
            dryRunError = e.getMessage();
            run.transition(GateState.DRYRUN_DONE, "failed: " + dryRunError);
        }

        RiskAssessment assessment = classifier.classify(statement, run.dryRun());
        run.assessment(assessment);
        run.transition(GateState.RISK_ASSESSED, assessment.level() + " " + assessment.ruleIds());

        ElevatedOverride override = run.override();
        if (assessment.level() == RiskLevel.CRITICAL) {
            if (override == null || !statement.isParsed()) {
                String note = override == null ? "CRITICAL without override" : "override does not apply to unparseable SQL";
                run.transition(GateState.BLOCKED, note);
                return;
            }
            LOGGER.warn("Run {}: CRITICAL statement routed to approval under override by {} ({})",
                    run.runId(), override.authorizedBy(), override.reason());
        }

        if (dryRunError != null) {
            run.abort(AbortReason.DRY_RUN_FAILED, dryRunError);
            return;
        }

        try {
            if (assessment.level() == RiskLevel.LOW) {
                run.decision(ApprovalDecision.AUTO);
                run.transition(GateState.AUTO_APPROVED, null);
                runUnderLocks(run, false);
                return;
            }

            run.transition(GateState.PENDING_APPROVAL, "timeout " + approvalTimeout);
            ApprovalResponse response = awaitApproval(new ApprovalRequest(run.runId(), statement, assessment,
                    run.dryRun(), override, approvalTimeout));
            switch (response) {
                case YES -> {
                    run.decision(ApprovalDecision.APPROVED);
                    runUnderLocks(run, true);
                }
                case TIMEOUT -> {
                    run.decision(ApprovalDecision.TIMED_OUT);
                    run.abort(AbortReason.TIMEOUT, "no answer within " + approvalTimeout);
                }
                default -> {
                    run.decision(ApprovalDecision.DENIED);
                    run.abort(AbortReason.DENIED, null);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.abort(AbortReason.CANCELLED, "interrupted in " + run.state());
        }
    }

    private void runUnderLocks(GateRun run, boolean snapshotFirst) throws InterruptedException {
        ParsedStatement parsed = run.statement().parsed();
        List<String> lockTables = parsed.kind() == StatementKind.SELECT ? List.of() : parsed.referencedTables();
        try (TableLockManager.Lease ignored = locks.acquire(lockTables, lockTimeout)) {
            if (snapshotFirst) {
                try {
                    SnapshotRef snapshot = snapshots.create(snapshotTables(parsed));
                    run.snapshot(snapshot);
                    run.transition(GateState.SNAPSHOTTED, snapshot.id());
                } catch (SnapshotException e) {
                    LOGGER.warn("Run {}: snapshot failed", run.runId(), e);
                    run.abort(AbortReason.SNAPSHOT_FAILED, e.getMessage());
                    return;
                }
            } else {
                run.transition(GateState.SKIPPED_SNAPSHOT, null);
            }

            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted before execution");
            }
            execute(run);
        } catch (LockTimeoutException e) {
            run.abort(AbortReason.LOCK_TIMEOUT, e.getMessage());
        } catch (IOException e) {
            LOGGER.error("Run {}: table lock files unavailable", run.runId(), e);
            run.abort(AbortReason.INTERNAL_ERROR, "table lock: " + e.getMessage());
        }
    }

    private void execute(GateRun run) {
        ExecutionOutcome outcome;
        try {
            ExecutionResult result = executor.execute(run.sql());
            outcome = ExecutionOutcome.success(result.affectedRows());
        } catch (SQLException e) {
            LOGGER.warn("Run {}: execution failed", run.runId(), e);
            outcome = ExecutionOutcome.failed(e.getMessage());
        }
        run.outcome(outcome);
        run.transition(GateState.EXECUTED, outcome.status()
                + (outcome.affectedRows() == null ? "" : " " + outcome.affectedRows() + " rows"));
        run.transition(GateState.AUDITED, null);
        run.transition(GateState.DONE, null);
    }

    private ApprovalResponse awaitApproval(ApprovalRequest request) throws InterruptedException {
        Future<ApprovalResponse> answer = approvalPool.submit(() -> approver.requestApproval(request));
        try {
            ApprovalResponse response = answer.get(approvalTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return response == null ? ApprovalResponse.NO : response;
        } catch (TimeoutException e) {
            answer.cancel(true);
            return ApprovalResponse.TIMEOUT;
        } catch (ExecutionException e) {
            LOGGER.warn("Approver failed for run {}; treating as denial", request.runId(), e.getCause());
            return ApprovalResponse.NO;
        } catch (InterruptedException e) {
            answer.cancel(true);
            throw e;
        }
    }

    private SqlStatement parse(String sql) {
        String fingerprint = StatementNormalizer.fingerprint(sql);
        try {
            return SqlStatement.parsed(sql, fingerprint, parser.parse(sql));
        } catch (SqlParseException e) {
            LOGGER.debug("Parse failed", e);
            return SqlStatement.unparseable(sql, fingerprint, e.getMessage());
        }
    }

    /**
     * Tables a CREATE introduces do not exist yet and are left out.
     */
    static List<String> snapshotTables(ParsedStatement parsed) {
        Set<String> tables = new LinkedHashSet<>(parsed.referencedTables());
        if (parsed.isCreate()) {
            parsed.targetTables().forEach(tables::remove);
        }
        return new ArrayList<>(tables);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sql-gate-approval-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        approvalPool.shutdownNow();
    }
}
