package com.example.sqlgate.snapshot;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;

final class ShadowTables {

    private ShadowTables() {
    }

    /**
     * Drops {@code tables}; any failure is attached to {@code primary} as suppressed.
     */
    static void dropAfterFailure(Connection connection, List<String> tables, SQLException primary) {
        for (String table : tables) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("DROP TABLE IF EXISTS " + table);
            } catch (SQLException e) {
                primary.addSuppressed(e);
            }
        }
    }

    static boolean exists(Connection connection, String qualifiedName) throws SQLException {
        String schema = null;
        String table = qualifiedName;
        int dot = qualifiedName.lastIndexOf('.');
        if (dot >= 0) {
            schema = qualifiedName.substring(0, dot);
            table = qualifiedName.substring(dot + 1);
        }
        DatabaseMetaData metaData = connection.getMetaData();
        for (String candidate : List.of(table, table.toUpperCase(Locale.ROOT), table.toLowerCase(Locale.ROOT))) {
            String schemaPattern = schema == null ? null : matchCase(schema, candidate, table);
            try (ResultSet tables = metaData.getTables(null, schemaPattern, candidate, null)) {
                if (tables.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String matchCase(String schema, String candidate, String table) {
        if (candidate.equals(table)) {
            return schema;
        }
        return candidate.equals(table.toUpperCase(Locale.ROOT)) ? schema.toUpperCase(Locale.ROOT) : schema.toLowerCase(Locale.ROOT);
    }

    /**
     * The position keeps names distinct when sanitizing folds two tables together ({@code s.t}, {@code s_t}).
     */
    static String shadowName(String suffix, int position, String table) {
        String sanitized = table.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return "snap_" + suffix + "_" + position + "_" + sanitized;
    }
}
