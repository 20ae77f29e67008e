package com.example.sqlgate.dryrun;

import com.example.sqlgate.TestDatabase;
import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.SqlStatement;
import com.example.sqlgate.parse.DruidSqlParser;
import com.example.sqlgate.util.StatementNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DryRunEstimatorTest {

    private final DruidSqlParser parser = new DruidSqlParser("h2");
    private TestDatabase database;
    private DryRunEstimator estimator;

    @BeforeEach
    void setUp() throws Exception {
        database = TestDatabase.clinic();
        estimator = new DryRunEstimator(database, Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() throws Exception {
        database.shutdown();
    }

    @Test
    void countsSelectRowsExactly() throws Exception {
        DryRunResult result = estimate("SELECT * FROM person").orElseThrow();

        assertEquals(3, result.estimatedRows());
        assertTrue(result.exact());
        assertTrue(result.rewrittenQuery().startsWith("SELECT COUNT(*) FROM ("));
    }

    @Test
    void countsRowsMatchedByDeletePredicate() throws Exception {
        DryRunResult result = estimate("DELETE FROM visits WHERE visit_date < '2010-01-01'").orElseThrow();

        assertEquals(3214, result.estimatedRows());
        assertTrue(result.exact());
        assertEquals(3224, database.count("visits"));
    }

    @Test
    void countsWholeTableForUnfilteredUpdate() throws Exception {
        assertEquals(5, estimate("UPDATE users SET email = NULL").orElseThrow().estimatedRows());
    }

    @Test
    void usesLiteralRowCountForInsertValues() throws Exception {
        DryRunResult result = estimate("INSERT INTO person VALUES (4, 'Barbara'), (5, 'Alan')").orElseThrow();

        assertEquals(2, result.estimatedRows());
        assertTrue(result.exact());
        assertEquals("SELECT 2 AS estimated_rows", result.rewrittenQuery());
        assertEquals(3, database.count("person"));
    }

    @Test
    void insertSelectEstimateIsNotExact() throws Exception {
        DryRunResult result = estimate("INSERT INTO person SELECT person_id + 10, name FROM person").orElseThrow();

        assertEquals(3, result.estimatedRows());
        assertFalse(result.exact());
    }

    @Test
    void truncateCountsTheWholeTable() throws Exception {
        assertEquals(3224, estimate("TRUNCATE TABLE visits").orElseThrow().estimatedRows());
    }

    @Test
    void otherDdlHasNoEstimate() throws Exception {
        assertTrue(estimate("DROP TABLE condition_occurrence").isEmpty());
        assertTrue(database.tableExists("condition_occurrence"));
    }

    @Test
    void unparsedStatementHasNoEstimate() throws Exception {
        assertTrue(estimator.estimate(SqlStatement.unparseable("garbage", "fp", "bad")).isEmpty());
    }

    @Test
    void isIdempotent() throws Exception {
        String sql = "DELETE FROM visits WHERE visit_date < '2010-01-01'";

        Optional<DryRunResult> first = estimate(sql);
        Optional<DryRunResult> second = estimate(sql);

        assertEquals(first, second);
        assertEquals(3224, database.count("visits"));
    }

    @Test
    void failsForUnknownTable() {
        DryRunException error = assertThrows(DryRunException.class, () -> estimate("DELETE FROM missing_table WHERE id = 1"));
        assertTrue(error.getMessage().contains("missing_table"));
    }

    private Optional<DryRunResult> estimate(String sql) throws Exception {
        return estimator.estimate(SqlStatement.parsed(sql, StatementNormalizer.fingerprint(sql), parser.parse(sql)));
    }
}
