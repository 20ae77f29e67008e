package com.example.sqlgate.snapshot;

import com.example.sqlgate.NotFoundException;
import com.example.sqlgate.TestDatabase;
import com.example.sqlgate.model.SnapshotRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotManagerTest {

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
    void transactionalBackendRoundTrip() throws Exception {
        assertRoundTrip(manager(new TransactionalCopyBackend()), "transactional-engine");
    }

    @Test
    void tableCopyBackendRoundTrip() throws Exception {
        assertRoundTrip(manager(new TableCopyBackend()), "sqlite-like");
    }

    @Test
    void restoreRecreatesDroppedTable() throws Exception {
        SnapshotManager manager = manager(new TransactionalCopyBackend());
        SnapshotRef ref = manager.create(List.of("condition_occurrence"));

        database.execute("DROP TABLE condition_occurrence");
        assertFalse(database.tableExists("condition_occurrence"));

        assertEquals(2, manager.restore(ref.id()));
        assertEquals(2, database.count("condition_occurrence"));
    }

    @Test
    void failedRestoreLeavesTablesUntouched() throws Exception {
        SnapshotManager manager = manager(new TransactionalCopyBackend());
        SnapshotRef ref = manager.create(List.of("person", "visits"));
        database.execute("DELETE FROM person WHERE person_id = 1",
                "ALTER TABLE visits ADD COLUMN note VARCHAR(10)");

        assertThrows(BackendException.class, () -> manager.restore(ref.id()));
        assertEquals(2, database.count("person"));
        assertEquals(3224, database.count("visits"));
    }

    @Test
    void failedCaptureLeavesNoShadowTables() throws Exception {
        SnapshotManager manager = manager(new TableCopyBackend());

        assertThrows(SnapshotException.class, () -> manager.create(List.of("person", "zz_missing")));
        assertEquals(0, database.queryLong(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE UPPER(TABLE_NAME) LIKE 'SNAP\\_%'"));
        assertTrue(manager.list().isEmpty());
    }

    @Test
    void tablesWhoseNamesSanitizeAlikeGetDistinctShadows() throws Exception {
        database.execute(
                "CREATE SCHEMA s",
                "CREATE TABLE s.t (id INT PRIMARY KEY, v INT)",
                "INSERT INTO s.t VALUES (1, 10), (2, 20)",
                "CREATE TABLE s_t (id INT PRIMARY KEY, v INT)",
                "INSERT INTO s_t VALUES (1, 0)");
        SnapshotManager manager = manager(new TransactionalCopyBackend());

        SnapshotRef ref = manager.create(List.of("s.t", "s_t"));

        assertEquals(2, ref.shadowTables().values().stream().distinct().count());
        database.execute("DELETE FROM s.t", "DELETE FROM s_t");
        assertEquals(3, manager.restore(ref.id()));
        assertEquals(2, database.count("s.t"));
        assertEquals(1, database.count("s_t"));
    }

    @Test
    void emptyTableSetYieldsEmptySnapshot() throws Exception {
        SnapshotRef ref = manager(new TransactionalCopyBackend()).create(List.of());

        assertTrue(ref.tables().isEmpty());
        assertTrue(ref.id().startsWith("SNAPSHOT_"));
    }

    @Test
    void unknownSnapshotIsNotFound() {
        SnapshotManager manager = manager(new TransactionalCopyBackend());

        assertThrows(NotFoundException.class, () -> manager.restore("SNAPSHOT_19700101_000000_deadbeef"));
        assertTrue(manager.find("../etc/passwd").isEmpty());
    }

    @Test
    void listsSnapshotsFromCatalog() throws Exception {
        SnapshotManager manager = manager(new TransactionalCopyBackend());
        SnapshotRef first = manager.create(List.of("person"));
        SnapshotRef second = manager.create(List.of("users"));

        List<SnapshotRef> listed = manager.list();

        assertEquals(2, listed.size());
        assertTrue(listed.contains(first));
        assertTrue(listed.contains(second));
        assertTrue(Files.exists(tempDir.resolve("snapshots").resolve(first.id() + ".json")));
    }

    private void assertRoundTrip(SnapshotManager manager, String backend) throws Exception {
        SnapshotRef ref = manager.create(List.of("visits", "person"));
        assertEquals(backend, ref.backend());
        assertEquals(List.of("person", "visits"), ref.tables());

        database.execute("DELETE FROM visits WHERE visit_date < '2010-01-01'",
                "UPDATE person SET name = 'changed'");
        assertEquals(10, database.count("visits"));

        long restored = manager.restore(ref.id());

        assertEquals(3224 + 3, restored);
        assertEquals(3224, database.count("visits"));
        assertEquals(0, database.queryLong("SELECT COUNT(*) FROM person WHERE name = 'changed'"));
        assertEquals(ref, manager.find(ref.id()).orElseThrow());
    }

    private SnapshotManager manager(SnapshotBackend backend) {
        return new SnapshotManager(database, backend, tempDir.resolve("snapshots"), new ObjectMapper(), Clock.systemUTC());
    }
}
