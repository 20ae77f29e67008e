package com.example.sqlgate.snapshot;

import com.example.sqlgate.config.BackendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One {@code CREATE TABLE ... AS SELECT} per table, for engines without multi-table snapshot
 * isolation. Tables are copied one after another, so the copies are only mutually consistent
 * while writers are held off by the table locks.
 */
public class TableCopyBackend implements SnapshotBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableCopyBackend.class);

    @Override
    public String name() {
        return BackendType.SQLITE_LIKE.key();
    }

    @Override
    public void capture(Connection connection, Map<String, String> shadowByTable) throws SQLException {
        connection.setAutoCommit(true);
        List<String> created = new ArrayList<>();
        try (Statement statement = connection.createStatement()) {
            for (Map.Entry<String, String> entry : shadowByTable.entrySet()) {
                statement.execute("CREATE TABLE " + entry.getValue() + " AS SELECT * FROM " + entry.getKey());
                created.add(entry.getValue());
            }
        } catch (SQLException e) {
            ShadowTables.dropAfterFailure(connection, created, e);
            throw e;
        }
        LOGGER.debug("Copied {} table(s)", created.size());
    }
}
