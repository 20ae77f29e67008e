package com.example.sqlgate.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of fresh connections to the guarded database. Callers close what they open.
 */
@FunctionalInterface
public interface ConnectionProvider {

    Connection open() throws SQLException;
}
