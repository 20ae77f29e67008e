package com.example.sqlgate.snapshot;

import com.example.sqlgate.config.BackendType;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Creates empty shadow tables, then fills all of them inside one SERIALIZABLE transaction so
 * every copy reflects the same point in time.
 */
public class TransactionalCopyBackend implements SnapshotBackend {

    @Override
    public String name() {
        return BackendType.TRANSACTIONAL_ENGINE.key();
    }

    @Override
    public void capture(Connection connection, Map<String, String> shadowByTable) throws SQLException {
        List<String> created = new ArrayList<>();
        try {
            connection.setAutoCommit(true);
            try (Statement statement = connection.createStatement()) {
                for (Map.Entry<String, String> entry : shadowByTable.entrySet()) {
                    statement.execute("CREATE TABLE " + entry.getValue() + " AS SELECT * FROM " + entry.getKey() + " WHERE 1=0");
                    created.add(entry.getValue());
                }
            }

            connection.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                for (Map.Entry<String, String> entry : shadowByTable.entrySet()) {
                    statement.executeUpdate("INSERT INTO " + entry.getValue() + " SELECT * FROM " + entry.getKey());
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            ShadowTables.dropAfterFailure(connection, created, e);
            throw e;
        }
    }
}
