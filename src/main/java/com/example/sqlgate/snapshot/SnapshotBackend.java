package com.example.sqlgate.snapshot;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;

/**
 * Strategy for copying live tables into shadow tables. Implementations leave no shadow
 * table behind when they fail.
 */
public interface SnapshotBackend {

    String name();

    /**
     * @param shadowByTable live table name to the shadow table name it is copied into
     */
    void capture(Connection connection, Map<String, String> shadowByTable) throws SQLException;
}
