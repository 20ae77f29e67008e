package com.example.sqlgate.snapshot;

import com.example.sqlgate.NotFoundException;
import com.example.sqlgate.config.BackendType;
import com.example.sqlgate.db.ConnectionProvider;
import com.example.sqlgate.model.SnapshotRef;
import com.example.sqlgate.util.DurableFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Stream;

/**
 * Captures tables into shadow tables before a risky statement runs and restores them on request.
 * Each snapshot is described by one JSON file in the catalog directory.
 */
public class SnapshotManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotManager.class);
    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final String CATALOG_SUFFIX = ".json";

    private final ConnectionProvider connections;
    private final SnapshotBackend backend;
    private final Path catalogDir;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SnapshotManager(ConnectionProvider connections, SnapshotBackend backend, Path catalogDir,
                           ObjectMapper mapper, Clock clock) {
        this.connections = connections;
        this.backend = backend;
        this.catalogDir = catalogDir;
        this.mapper = mapper;
        this.clock = clock;
    }

    public static SnapshotBackend backendFor(BackendType type) {
        return switch (type) {
            case SQLITE_LIKE -> new TableCopyBackend();
            case TRANSACTIONAL_ENGINE -> new TransactionalCopyBackend();
        };
    }

    /**
     * Copies every table in {@code tables}. An empty set yields a snapshot with no tables.
     */
    public SnapshotRef create(Collection<String> tables) throws SnapshotException {
        Instant createdAt = clock.instant();
        String suffix = randomHex();
        String id = "SNAPSHOT_" + ID_FORMAT.format(createdAt) + "_" + suffix;

        Map<String, String> shadowByTable = new LinkedHashMap<>();
        int position = 0;
        for (String table : new TreeSet<>(tables)) {
            shadowByTable.put(table, ShadowTables.shadowName(suffix, position++, table));
        }

        if (!shadowByTable.isEmpty()) {
            try (Connection connection = connections.open()) {
                backend.capture(connection, shadowByTable);
            } catch (SQLException | RuntimeException e) {
                throw new SnapshotException("Snapshot of " + shadowByTable.keySet() + " failed: " + e.getMessage(), e);
            }
        }

        SnapshotRef ref = new SnapshotRef(id, createdAt, backend.name(), new ArrayList<>(shadowByTable.keySet()), shadowByTable);
        try {
            DurableFiles.writeNew(catalogFile(id), mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(SnapshotRefJson.toJson(mapper, ref)));
        } catch (IOException e) {
            SQLException cleanupFailure = new SQLException("Catalog write failed for " + id, e);
            dropShadows(shadowByTable.values(), cleanupFailure);
            throw new SnapshotException("Could not record snapshot " + id + ": " + e.getMessage(), cleanupFailure);
        }
        LOGGER.info("Created snapshot {} of {} using {}", id, ref.tables(), backend.name());
        return ref;
    }

    /**
     * Replaces the contents of every captured table with its shadow copy in one transaction.
     * Tables dropped since the capture are recreated from the shadow's structure.
     *
     * @return number of rows written back
     */
    public long restore(String snapshotId) throws NotFoundException, BackendException {
        SnapshotRef ref = find(snapshotId)
                .orElseThrow(() -> new NotFoundException("Unknown snapshot: " + snapshotId));

        List<String> recreated = new ArrayList<>();
        try (Connection connection = connections.open()) {
            try {
                connection.setAutoCommit(true);
                try (Statement statement = connection.createStatement()) {
                    for (Map.Entry<String, String> entry : ref.shadowTables().entrySet()) {
                        if (!ShadowTables.exists(connection, entry.getValue())) {
                            throw new SQLException("Shadow table " + entry.getValue() + " of snapshot " + snapshotId + " is missing");
                        }
                        if (!ShadowTables.exists(connection, entry.getKey())) {
                            statement.execute("CREATE TABLE " + entry.getKey() + " AS SELECT * FROM " + entry.getValue() + " WHERE 1=0");
                            recreated.add(entry.getKey());
                        }
                    }
                }

                long restored = 0;
                connection.setAutoCommit(false);
                try (Statement statement = connection.createStatement()) {
                    for (Map.Entry<String, String> entry : ref.shadowTables().entrySet()) {
                        statement.executeUpdate("DELETE FROM " + entry.getKey());
                        restored += statement.executeUpdate("INSERT INTO " + entry.getKey() + " SELECT * FROM " + entry.getValue());
                    }
                    connection.commit();
                } catch (SQLException e) {
                    connection.rollback();
                    throw e;
                } finally {
                    connection.setAutoCommit(true);
                }
                LOGGER.info("Restored snapshot {} ({} rows)", snapshotId, restored);
                return restored;
            } catch (SQLException e) {
                ShadowTables.dropAfterFailure(connection, recreated, e);
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            throw new BackendException("Restore of " + snapshotId + " failed: " + e.getMessage(), e);
        }
    }

    public List<SnapshotRef> list() throws IOException {
        if (Files.notExists(catalogDir)) {
            return List.of();
        }
        List<SnapshotRef> refs = new ArrayList<>();
        try (Stream<Path> files = Files.list(catalogDir)) {
            for (Path file : files.filter(path -> path.getFileName().toString().endsWith(CATALOG_SUFFIX)).toList()) {
                refs.add(read(file));
            }
        }
        refs.sort(Comparator.comparing(SnapshotRef::createdAt).thenComparing(SnapshotRef::id));
        return refs;
    }

    public Optional<SnapshotRef> find(String snapshotId) {
        if (snapshotId == null || snapshotId.isBlank() || snapshotId.contains("/") || snapshotId.contains("\\")) {
            return Optional.empty();
        }
        Path file = catalogFile(snapshotId);
        if (Files.notExists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(read(file));
        } catch (IOException e) {
            throw new IllegalStateException("Snapshot catalog entry " + file + " is unreadable", e);
        }
    }

    private SnapshotRef read(Path file) throws IOException {
        try {
            return SnapshotRefJson.fromJson(mapper.readTree(file.toFile()));
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed snapshot catalog entry " + file, e);
        }
    }

    private void dropShadows(Collection<String> shadows, SQLException failure) {
        try (Connection connection = connections.open()) {
            ShadowTables.dropAfterFailure(connection, new ArrayList<>(shadows), failure);
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private Path catalogFile(String snapshotId) {
        return catalogDir.resolve(snapshotId + CATALOG_SUFFIX);
    }

    private static String randomHex() {
        return String.format("%08x", ThreadLocalRandom.current().nextInt());
    }
}
