package com.example.sqlgate.gate;

import com.example.sqlgate.db.ConnectionProvider;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Runs a statement in its own transaction. For queries the number of returned rows is reported.
 */
public class JdbcStatementExecutor implements StatementExecutor {

    private final ConnectionProvider connections;

    public JdbcStatementExecutor(ConnectionProvider connections) {
        this.connections = connections;
    }

    @Override
    public ExecutionResult execute(String sql) throws SQLException {
        try (Connection connection = connections.open()) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                long affected;
                if (statement.execute(sql)) {
                    affected = 0;
                    try (ResultSet resultSet = statement.getResultSet()) {
                        while (resultSet.next()) {
                            affected++;
                        }
                    }
                } else {
                    affected = Math.max(0, statement.getUpdateCount());
                }
                connection.commit();
                return new ExecutionResult(affected);
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        }
    }
}
