package com.example.sqlgate.dryrun;

import com.example.sqlgate.db.ConnectionProvider;
import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.ParsedStatement;
import com.example.sqlgate.model.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Estimates how many rows a statement would touch by rewriting it into a {@code COUNT(*)} query.
 * Counts run in a read-only transaction that is always rolled back, so estimating twice against an
 * unchanged database gives the same result.
 */
public class DryRunEstimator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DryRunEstimator.class);

    private final ConnectionProvider connections;
    private final Duration queryTimeout;

    public DryRunEstimator(ConnectionProvider connections, Duration queryTimeout) {
        this.connections = connections;
        this.queryTimeout = queryTimeout;
    }

    /**
     * Returns empty for statements with no meaningful row estimate: unparsed input, schema
     * changes other than TRUNCATE, and unrecognised statements.
     */
    public Optional<DryRunResult> estimate(SqlStatement statement) throws DryRunException {
        if (!statement.isParsed()) {
            return Optional.empty();
        }
        ParsedStatement parsed = statement.parsed();
        switch (parsed.kind()) {
            case SELECT:
                return Optional.of(count(List.of("SELECT COUNT(*) FROM (" + parsed.querySql() + ") dry_run"), true));
            case UPDATE:
            case DELETE:
                return Optional.of(count(List.of(predicateCount(parsed)), !parsed.isMultiTable()));
            case INSERT:
                if (parsed.literalRowCount() != null) {
                    int rows = parsed.literalRowCount();
                    return Optional.of(new DryRunResult(rows, true, "SELECT " + rows + " AS estimated_rows"));
                }
                if (parsed.querySql() == null) {
                    return Optional.empty();
                }
                return Optional.of(count(List.of("SELECT COUNT(*) FROM (" + parsed.querySql() + ") dry_run"), false));
            case DDL:
                if ("TRUNCATE".equals(parsed.ddlOperation()) && !parsed.targetTables().isEmpty()) {
                    List<String> queries = new ArrayList<>();
                    for (String table : parsed.targetTables()) {
                        queries.add("SELECT COUNT(*) FROM " + table);
                    }
                    return Optional.of(count(queries, true));
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    private String predicateCount(ParsedStatement parsed) {
        StringBuilder query = new StringBuilder("SELECT COUNT(*) FROM ").append(parsed.tableSourceSql());
        if (parsed.hasPredicate()) {
            query.append(" WHERE ").append(parsed.predicateSql());
        }
        return query.toString();
    }

    private DryRunResult count(List<String> queries, boolean exact) throws DryRunException {
        String rewritten = String.join("; ", queries);
        LOGGER.debug("Dry run: {}", rewritten);
        try (Connection connection = connections.open()) {
            connection.setAutoCommit(false);
            connection.setReadOnly(true);
            try {
                long total = 0;
                for (String query : queries) {
                    total += countRows(connection, query);
                }
                return new DryRunResult(total, exact, rewritten);
            } finally {
                connection.rollback();
            }
        } catch (SQLException | RuntimeException e) {
            throw new DryRunException("Dry run failed for '" + rewritten + "': " + e.getMessage(), e);
        }
    }

    private long countRows(Connection connection, String query) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(timeoutSeconds());
            try (ResultSet resultSet = statement.executeQuery(query)) {
                if (!resultSet.next()) {
                    throw new SQLException("Count query returned no row: " + query);
                }
                return resultSet.getLong(1);
            }
        }
    }

    private int timeoutSeconds() {
        long seconds = Math.max(1, queryTimeout.toSeconds());
        return (int) Math.min(Integer.MAX_VALUE, seconds);
    }
}
