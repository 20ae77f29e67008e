package com.example.sqlgate.parse;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLAlterTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLCreateTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLDeleteStatement;
import com.alibaba.druid.sql.ast.statement.SQLDropTableStatement;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLInsertStatement;
import com.alibaba.druid.sql.ast.statement.SQLJoinTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectStatement;
import com.alibaba.druid.sql.ast.statement.SQLTableSource;
import com.alibaba.druid.sql.ast.statement.SQLTruncateStatement;
import com.alibaba.druid.sql.ast.statement.SQLUpdateStatement;
import com.alibaba.druid.sql.visitor.SchemaStatVisitor;
import com.alibaba.druid.stat.TableStat;
import com.example.sqlgate.model.ParsedStatement;
import com.example.sqlgate.model.StatementKind;
import com.example.sqlgate.util.StatementNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link SqlParser} backed by the Alibaba Druid SQL parser.
 */
public class DruidSqlParser implements SqlParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DruidSqlParser.class);
    private static final Pattern DDL_CLASS_NAME = Pattern.compile("(Drop|Create|Alter|Truncate|Rename|Comment)");

    private final DbType dbType;

    public DruidSqlParser(String dialect) {
        this.dbType = resolveDbType(dialect);
    }

    @Override
    public ParsedStatement parse(String sql) throws SqlParseException {
        if (sql == null || sql.isBlank()) {
            throw new SqlParseException("Statement is empty");
        }
        String body = StatementNormalizer.stripTrailingSemicolons(sql);
        if (body.isEmpty()) {
            throw new SqlParseException("Statement is empty");
        }

        List<SQLStatement> statements;
        try {
            statements = SQLUtils.parseStatements(body, dbType);
        } catch (RuntimeException e) {
            throw new SqlParseException("Unparseable SQL: " + e.getMessage(), e);
        }
        if (statements == null || statements.size() != 1) {
            int count = statements == null ? 0 : statements.size();
            throw new SqlParseException("Expected exactly one statement but found " + count);
        }

        try {
            return describe(statements.get(0));
        } catch (RuntimeException e) {
            throw new SqlParseException("Unsupported statement structure: " + e.getMessage(), e);
        }
    }

    private ParsedStatement describe(SQLStatement statement) {
        Set<String> referenced = referencedTables(statement);

        if (statement instanceof SQLSelectStatement select) {
            return new ParsedStatement(StatementKind.SELECT, null, List.of(), list(referenced), list(referenced),
                    null, null, null, render(select.getSelect()));
        }

        if (statement instanceof SQLDeleteStatement delete) {
            Set<String> targets = tableNames(delete.getTableSource());
            Set<String> touched = new LinkedHashSet<>(targets);
            touched.addAll(tableNames(delete.getFrom()));
            String source = delete.getFrom() != null ? render(delete.getFrom()) : render(delete.getTableSource());
            referenced.addAll(touched);
            return new ParsedStatement(StatementKind.DELETE, null, list(targets), list(touched), list(referenced),
                    source, render(delete.getWhere()), null, null);
        }

        if (statement instanceof SQLUpdateStatement update) {
            Set<String> targets = tableNames(update.getTableSource());
            Set<String> touched = new LinkedHashSet<>(targets);
            touched.addAll(tableNames(update.getFrom()));
            String source = render(update.getTableSource());
            if (update.getFrom() != null) {
                source = source + ", " + render(update.getFrom());
            }
            referenced.addAll(touched);
            return new ParsedStatement(StatementKind.UPDATE, null, list(targets), list(touched), list(referenced),
                    source, render(update.getWhere()), null, null);
        }

        if (statement instanceof SQLInsertStatement insert) {
            Set<String> targets = tableNames(insert.getTableSource());
            SQLSelect query = insert.getQuery();
            Integer literalRows = query == null ? insert.getValuesList().size() : null;
            referenced.addAll(targets);
            return new ParsedStatement(StatementKind.INSERT, null, list(targets), list(targets), list(referenced),
                    render(insert.getTableSource()), null, literalRows, query == null ? null : render(query));
        }

        String ddlOperation = ddlOperation(statement);
        if (ddlOperation != null) {
            Set<String> targets = ddlTargets(statement);
            if (targets.isEmpty()) {
                targets.addAll(referenced);
            }
            referenced.addAll(targets);
            return new ParsedStatement(StatementKind.DDL, ddlOperation, list(targets), list(targets), list(referenced),
                    null, null, null, null);
        }

        LOGGER.debug("Unrecognized statement type {}", statement.getClass().getName());
        return new ParsedStatement(StatementKind.OTHER, null, List.of(), list(referenced), list(referenced),
                null, null, null, null);
    }

    private String ddlOperation(SQLStatement statement) {
        if (statement instanceof SQLTruncateStatement) {
            return "TRUNCATE";
        }
        if (statement instanceof SQLDropTableStatement) {
            return "DROP TABLE";
        }
        if (statement instanceof SQLAlterTableStatement) {
            return "ALTER TABLE";
        }
        if (statement instanceof SQLCreateTableStatement) {
            return "CREATE TABLE";
        }
        String name = statement.getClass().getSimpleName().replaceAll("Statement$", "");
        Matcher matcher = DDL_CLASS_NAME.matcher(name);
        if (!matcher.find()) {
            return null;
        }
        return name.substring(matcher.start())
                .replaceAll("([a-z])([A-Z])", "$1 $2")
                .toUpperCase(Locale.ROOT);
    }

    private Set<String> ddlTargets(SQLStatement statement) {
        Set<String> targets = new LinkedHashSet<>();
        if (statement instanceof SQLDropTableStatement drop) {
            for (SQLExprTableSource source : drop.getTableSources()) {
                collectTableNames(source, targets);
            }
        } else if (statement instanceof SQLTruncateStatement truncate) {
            for (SQLExprTableSource source : truncate.getTableSources()) {
                collectTableNames(source, targets);
            }
        } else if (statement instanceof SQLAlterTableStatement alter) {
            collectTableNames(alter.getTableSource(), targets);
        } else if (statement instanceof SQLCreateTableStatement create) {
            collectTableNames(create.getTableSource(), targets);
        }
        return targets;
    }

    private Set<String> referencedTables(SQLStatement statement) {
        Set<String> names = new LinkedHashSet<>();
        try {
            SchemaStatVisitor visitor = SQLUtils.createSchemaStatVisitor(dbType);
            statement.accept(visitor);
            for (TableStat.Name name : visitor.getTables().keySet()) {
                String normalized = StatementNormalizer.normalizeIdentifier(name.getName());
                if (normalized != null && !normalized.isEmpty()) {
                    names.add(normalized);
                }
            }
        } catch (RuntimeException e) {
            LOGGER.debug("Table visitor failed for {}; falling back to table sources", statement.getClass().getSimpleName(), e);
        }
        return names;
    }

    private Set<String> tableNames(SQLTableSource source) {
        Set<String> names = new LinkedHashSet<>();
        collectTableNames(source, names);
        return names;
    }

    private void collectTableNames(SQLTableSource source, Set<String> names) {
        if (source instanceof SQLExprTableSource exprSource) {
            String name = StatementNormalizer.normalizeIdentifier(render(exprSource.getExpr()));
            if (name != null && !name.isEmpty()) {
                names.add(name);
            }
        } else if (source instanceof SQLJoinTableSource join) {
            collectTableNames(join.getLeft(), names);
            collectTableNames(join.getRight(), names);
        }
    }

    private String render(SQLObject object) {
        if (object == null) {
            return null;
        }
        return SQLUtils.toSQLString(object, dbType);
    }

    private static List<String> list(Set<String> values) {
        return new ArrayList<>(values);
    }

    private static DbType resolveDbType(String dialect) {
        String candidate = dialect == null || dialect.isBlank() ? "h2" : dialect.trim().toLowerCase(Locale.ROOT);
        try {
            return DbType.valueOf(candidate);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported SQL dialect: " + dialect, e);
        }
    }
}
