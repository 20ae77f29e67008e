package com.example.sqlgate;

import com.example.sqlgate.audit.AuditLog;
import com.example.sqlgate.audit.AuditRecordCodec;
import com.example.sqlgate.audit.JsonFileAuditLog;
import com.example.sqlgate.config.GateConfig;
import com.example.sqlgate.db.ConnectionProvider;
import com.example.sqlgate.db.DriverManagerConnectionProvider;
import com.example.sqlgate.dryrun.DryRunEstimator;
import com.example.sqlgate.gate.ApprovalGate;
import com.example.sqlgate.gate.Approver;
import com.example.sqlgate.gate.JdbcStatementExecutor;
import com.example.sqlgate.gate.StatementExecutor;
import com.example.sqlgate.gate.TableLockManager;
import com.example.sqlgate.parse.DruidSqlParser;
import com.example.sqlgate.replay.ReplayEngine;
import com.example.sqlgate.risk.ProtectedTableRegistry;
import com.example.sqlgate.risk.RiskClassifier;
import com.example.sqlgate.rollback.RollbackService;
import com.example.sqlgate.snapshot.SnapshotManager;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;

/**
 * Wires the gate components from a {@link GateConfig}. The gate and the rollback service share
 * one lock manager, backed by lock files in {@code lock_dir} so other processes are excluded too.
 */
public class SqlGate implements AutoCloseable {

    private final AuditLog auditLog;
    private final AuditRecordCodec codec;
    private final SnapshotManager snapshots;
    private final ApprovalGate gate;
    private final ReplayEngine replay;
    private final RollbackService rollback;

    public SqlGate(GateConfig config, Approver approver) {
        this(config, approver, new DriverManagerConnectionProvider(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword()),
                Clock.systemUTC(), new ObjectMapper());
    }

    public SqlGate(GateConfig config, Approver approver, ConnectionProvider connections, Clock clock, ObjectMapper mapper) {
        this(config, approver, connections, new JdbcStatementExecutor(connections), clock, mapper);
    }

    public SqlGate(GateConfig config, Approver approver, ConnectionProvider connections, StatementExecutor executor,
                   Clock clock, ObjectMapper mapper) {
        DruidSqlParser parser = new DruidSqlParser(config.dialect());
        DryRunEstimator estimator = new DryRunEstimator(connections, config.dryRunTimeout());
        RiskClassifier classifier = new RiskClassifier(ProtectedTableRegistry.parse(config.protectedTables()),
                config.rowCountThresholdMediumHigh());
        TableLockManager locks = new TableLockManager(config.lockDir());

        this.auditLog = new JsonFileAuditLog(config.auditDir(), mapper);
        this.codec = new AuditRecordCodec(mapper);
        this.snapshots = new SnapshotManager(connections, SnapshotManager.backendFor(config.backend()),
                config.snapshotDir(), mapper, clock);
        this.gate = new ApprovalGate(parser, estimator, classifier, snapshots, approver,
                executor, auditLog, locks, config.approvalTimeout(),
                config.lockTimeout(), clock);
        this.replay = new ReplayEngine(auditLog, parser, estimator, classifier, clock);
        this.rollback = new RollbackService(snapshots, auditLog, locks, config.lockTimeout(), clock);
    }

    public ApprovalGate gate() {
        return gate;
    }

    public AuditLog auditLog() {
        return auditLog;
    }

    public AuditRecordCodec codec() {
        return codec;
    }

    public SnapshotManager snapshots() {
        return snapshots;
    }

    public ReplayEngine replay() {
        return replay;
    }

    public RollbackService rollback() {
        return rollback;
    }

    @Override
    public void close() {
        gate.close();
    }
}
