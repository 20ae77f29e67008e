package com.example.sqlgate.model;

import java.util.List;
import java.util.Objects;

/**
 * Parser-independent view of a single SQL statement: only what classification,
 * estimation and snapshotting need.
 *
 * @param kind             statement kind
 * @param ddlOperation     DDL operation name such as {@code DROP TABLE}, null for non-DDL
 * @param targetTables     tables the statement writes or alters
 * @param touchedTables    tables in the statement's own table sources (target, joins, FROM)
 * @param referencedTables every table named anywhere in the statement
 * @param tableSourceSql   FROM-clause text used for count rewrites of UPDATE/DELETE
 * @param predicateSql     WHERE clause text, null when absent
 * @param literalRowCount  number of VALUES rows of an INSERT, null otherwise
 * @param querySql         the query of a SELECT, or the source query of INSERT ... SELECT
 */
public record ParsedStatement(
        StatementKind kind,
        String ddlOperation,
        List<String> targetTables,
        List<String> touchedTables,
        List<String> referencedTables,
        String tableSourceSql,
        String predicateSql,
        Integer literalRowCount,
        String querySql
) {

    public ParsedStatement {
        Objects.requireNonNull(kind, "kind");
        targetTables = List.copyOf(targetTables);
        touchedTables = List.copyOf(touchedTables);
        referencedTables = List.copyOf(referencedTables);
    }

    public boolean hasPredicate() {
        return predicateSql != null && !predicateSql.isBlank();
    }

    public boolean isMultiTable() {
        return touchedTables.size() > 1;
    }

    public boolean isCreate() {
        return kind == StatementKind.DDL && ddlOperation != null && ddlOperation.startsWith("CREATE");
    }
}
