package com.example.sqlgate;

import com.example.sqlgate.config.GateConfig;
import com.example.sqlgate.gate.JdbcStatementExecutor;
import com.example.sqlgate.gate.StatementExecutor;
import com.example.sqlgate.gate.StaticApprover;
import com.example.sqlgate.model.AbortReason;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.ExecutionStatus;
import com.example.sqlgate.model.FinalStatus;
import com.example.sqlgate.model.SnapshotRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Two independently wired gates over one database, the way the MCP server and a CLI rollback run.
 */
class SqlGateTest {

    @TempDir
    Path tempDir;

    private TestDatabase database;

    @BeforeEach
    void setUp() throws Exception {
        database = TestDatabase.clinic();
    }

    @AfterEach
    void tearDown() throws Exception {
        database.shutdown();
    }

    @Test
    void rollbackWaitsForAStatementRunningInAnotherGate() throws Exception {
        CountDownLatch executing = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        JdbcStatementExecutor jdbc = new JdbcStatementExecutor(database);
        StatementExecutor slow = sql -> {
            executing.countDown();
            try {
                finish.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return jdbc.execute(sql);
        };

        try (SqlGate server = new SqlGate(config("runs-server"), StaticApprover.denyAll(), database, slow,
                Clock.systemUTC(), new ObjectMapper());
             SqlGate cli = new SqlGate(config("runs-cli"), StaticApprover.denyAll(), database,
                     Clock.systemUTC(), new ObjectMapper())) {
            SnapshotRef snapshot = cli.snapshots().create(List.of("visits"));

            CompletableFuture<AuditRecord> submitted = CompletableFuture.supplyAsync(() -> {
                try {
                    return server.gate().submit("DELETE FROM visits WHERE visit_id = 1");
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            });
            assertTrue(executing.await(5, TimeUnit.SECONDS));

            AuditRecord restore = cli.rollback().rollback(snapshot.id());

            assertEquals(FinalStatus.ABORTED, restore.finalStatus());
            assertEquals(AbortReason.LOCK_TIMEOUT, restore.abortReason());
            assertEquals(ExecutionStatus.NOT_RUN, restore.executionOutcome().status());
            assertFalse(submitted.isDone());

            finish.countDown();
            AuditRecord delete = submitted.get(5, TimeUnit.SECONDS);
            assertEquals(FinalStatus.DONE, delete.finalStatus());
            assertEquals(3223, database.count("visits"));

            AuditRecord retried = cli.rollback().rollback(snapshot.id());
            assertEquals(FinalStatus.DONE, retried.finalStatus());
            assertEquals(3224, database.count("visits"));
        }
    }

    private GateConfig config(String auditDir) {
        Properties properties = new Properties();
        properties.setProperty(GateConfig.JDBC_URL, database.url());
        properties.setProperty(GateConfig.PROTECTED_TABLES, "users");
        properties.setProperty(GateConfig.AUDIT_DIR, tempDir.resolve(auditDir).toString());
        properties.setProperty(GateConfig.SNAPSHOT_DIR, tempDir.resolve("snapshots").toString());
        properties.setProperty(GateConfig.LOCK_DIR, tempDir.resolve("locks").toString());
        properties.setProperty(GateConfig.LOCK_TIMEOUT, "300ms");
        return GateConfig.fromProperties(properties);
    }
}
