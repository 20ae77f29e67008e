package com.example.sqlgate.gate;

import java.sql.SQLException;

@FunctionalInterface
public interface StatementExecutor {

    ExecutionResult execute(String sql) throws SQLException;
}
