package com.example.sqlgate.replay;

import com.example.sqlgate.GateFixture;
import com.example.sqlgate.NotFoundException;
import com.example.sqlgate.TestDatabase;
import com.example.sqlgate.gate.ApprovalGate;
import com.example.sqlgate.gate.ApprovalResponse;
import com.example.sqlgate.gate.StaticApprover;
import com.example.sqlgate.model.AuditQuery;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.ReplayDivergence;
import com.example.sqlgate.model.ReplayTrace;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.risk.ProtectedTableRegistry;
import com.example.sqlgate.risk.RiskClassifier;
import com.example.sqlgate.rollback.RollbackService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplayEngineTest {

    private static final String PURGE = "DELETE FROM visits WHERE visit_date < '2010-01-01'";

    @TempDir
    Path tempDir;

    private TestDatabase database;
    private GateFixture fixture;
    private ReplayEngine replay;

    @BeforeEach
    void setUp() throws Exception {
        database = TestDatabase.clinic();
        fixture = new GateFixture(database, tempDir, "users", 1000);
        replay = new ReplayEngine(fixture.auditLog, fixture.parser, fixture.estimator, fixture.classifier,
                Clock.systemUTC());
    }

    @AfterEach
    void tearDown() throws Exception {
        database.shutdown();
    }

    @Test
    void unchangedDatabaseReplaysConsistently() throws Exception {
        AuditRecord record = deniedPurge();

        ReplayTrace trace = replay.replay(record.runId());

        assertTrue(trace.consistent(), () -> "unexpected divergences " + trace.divergences());
        assertEquals(RiskLevel.HIGH, trace.replayedAssessment().level());
        assertEquals(3214, trace.replayedDryRun().estimatedRows());
    }

    @Test
    void replayNeverExecutesOrAudits() throws Exception {
        AuditRecord record = deniedPurge();

        replay.replay(record.runId());
        replay.replay(record.runId());

        assertEquals(3224, database.count("visits"));
        assertEquals(1, fixture.auditLog.query(AuditQuery.all()).size());
    }

    @Test
    void changedDataShowsUpAsDivergence() throws Exception {
        AuditRecord record = deniedPurge();
        database.execute("DELETE FROM visits WHERE visit_id > 100 AND visit_id < 5000");

        ReplayTrace trace = replay.replay(record.runId());

        assertFalse(trace.consistent());
        Map<String, ReplayDivergence> byField = trace.divergences().stream()
                .collect(Collectors.toMap(ReplayDivergence::field, divergence -> divergence));
        assertEquals(new ReplayDivergence("risk_level", "HIGH", "LOW"), byField.get("risk_level"));
        assertEquals(new ReplayDivergence("estimated_rows", "3214", "100"), byField.get("estimated_rows"));
        assertEquals(RiskLevel.HIGH, trace.recordedAssessment().level());
    }

    @Test
    void changedClassifierSettingsShowUpAsDivergence() throws Exception {
        AuditRecord record = deniedPurge();
        ReplayEngine stricter = new ReplayEngine(fixture.auditLog, fixture.parser, fixture.estimator,
                new RiskClassifier(ProtectedTableRegistry.parse("visits:ALWAYS_CRITICAL"), 1000), Clock.systemUTC());

        ReplayTrace trace = stricter.replay(record.runId());

        assertEquals(RiskLevel.CRITICAL, trace.replayedAssessment().level());
        assertTrue(trace.divergences().stream().anyMatch(divergence -> divergence.field().equals("risk_rules")));
    }

    @Test
    void droppedTableIsReportedAsDryRunDivergence() throws Exception {
        AuditRecord record = deniedPurge();
        database.execute("DROP TABLE visits");

        ReplayTrace trace = replay.replay(record.runId());

        assertTrue(trace.divergences().stream().anyMatch(divergence -> divergence.field().equals("dry_run")));
        assertTrue(trace.divergences().stream().noneMatch(divergence -> divergence.field().equals("estimated_rows")));
    }

    @Test
    void snapshotRestoreRunsAreNotReplayed() throws Exception {
        AuditRecord purge;
        try (ApprovalGate gate = fixture.gate(new StaticApprover(ApprovalResponse.YES))) {
            purge = gate.submit(PURGE);
        }
        RollbackService rollback = new RollbackService(fixture.snapshots, fixture.auditLog, fixture.locks,
                Duration.ofSeconds(1), Clock.systemUTC());
        AuditRecord restore = rollback.rollback(purge.snapshotRef().id());

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> replay.replay(restore.runId()));
        assertTrue(error.getMessage().contains("snapshot restore"), error.getMessage());
        assertTrue(replay.replay(purge.runId()).consistent());
    }

    @Test
    void unknownRunIsNotFound() {
        assertThrows(NotFoundException.class, () -> replay.replay("RUN_missing"));
    }

    private AuditRecord deniedPurge() throws Exception {
        try (ApprovalGate gate = fixture.gate(StaticApprover.denyAll())) {
            return gate.submit(PURGE);
        }
    }
}
