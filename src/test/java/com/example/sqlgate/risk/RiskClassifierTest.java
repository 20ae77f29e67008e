package com.example.sqlgate.risk;

import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.ParsedStatement;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.model.SqlStatement;
import com.example.sqlgate.model.StatementKind;
import com.example.sqlgate.parse.DruidSqlParser;
import com.example.sqlgate.util.StatementNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RiskClassifierTest {

    private final DruidSqlParser parser = new DruidSqlParser("h2");
    private final RiskClassifier classifier = new RiskClassifier(ProtectedTableRegistry.parse("users"), 1000);

    @Test
    void plainSelectIsLow() throws Exception {
        RiskAssessment assessment = classifier.classify(statement("SELECT * FROM person"), new DryRunResult(3, true, "q"));

        assertEquals(RiskLevel.LOW, assessment.level());
        assertEquals(List.of(RiskClassifier.RULE_DEFAULT), assessment.ruleIds());
    }

    @Test
    void everyDdlOperationIsCritical() throws Exception {
        for (String sql : List.of("DROP TABLE visits", "TRUNCATE TABLE visits", "ALTER TABLE visits ADD COLUMN note VARCHAR(10)",
                "CREATE TABLE scratch (id INT)")) {
            RiskAssessment assessment = classifier.classify(statement(sql));
            assertEquals(RiskLevel.CRITICAL, assessment.level(), sql);
            assertTrue(assessment.ruleIds().contains(RiskClassifier.RULE_DDL), sql);
        }
    }

    @Test
    void unparseableInputIsCritical() {
        SqlStatement broken = SqlStatement.unparseable("DELETE FROM", "fp", "syntax error");

        RiskAssessment assessment = classifier.classify(broken);

        assertEquals(RiskLevel.CRITICAL, assessment.level());
        assertEquals(List.of(RiskClassifier.RULE_PARSE_FAILED), assessment.ruleIds());
    }

    @Test
    void unrecognisedStatementIsCritical() {
        ParsedStatement other = new ParsedStatement(StatementKind.OTHER, null, List.of(), List.of(), List.of(),
                null, null, null, null);

        assertEquals(RiskLevel.CRITICAL, classifier.classify(SqlStatement.parsed("CALL x()", "fp", other)).level());
    }

    @Test
    void unfilteredWritesAreAtLeastHigh() throws Exception {
        for (String sql : List.of("DELETE FROM visits", "UPDATE visits SET visit_date = NULL")) {
            RiskAssessment assessment = classifier.classify(statement(sql), new DryRunResult(3, true, "q"));
            assertTrue(assessment.level().isAtLeast(RiskLevel.HIGH), sql);
            assertTrue(assessment.ruleIds().contains(RiskClassifier.RULE_UNFILTERED_WRITE), sql);
        }
    }

    @Test
    void rowCountAboveThresholdRaisesToHigh() throws Exception {
        SqlStatement delete = statement("DELETE FROM visits WHERE visit_date < '2010-01-01'");

        assertEquals(RiskLevel.LOW, classifier.classify(delete, new DryRunResult(1000, true, "q")).level());
        RiskAssessment above = classifier.classify(delete, new DryRunResult(1001, true, "q"));
        assertEquals(RiskLevel.HIGH, above.level());
        assertEquals(List.of(RiskClassifier.RULE_ROW_COUNT), above.ruleIds());
    }

    @Test
    void protectedTableEscalatesOneLevel() throws Exception {
        RiskAssessment filtered = classifier.classify(statement("DELETE FROM users WHERE id = 1"), new DryRunResult(1, true, "q"));
        RiskAssessment unfiltered = classifier.classify(statement("DELETE FROM users"), new DryRunResult(5, true, "q"));

        assertEquals(RiskLevel.MEDIUM, filtered.level());
        assertEquals(List.of(RiskClassifier.RULE_PROTECTED_TABLE), filtered.ruleIds());
        assertEquals(RiskLevel.CRITICAL, unfiltered.level());
        assertEquals(List.of(RiskClassifier.RULE_UNFILTERED_WRITE, RiskClassifier.RULE_PROTECTED_TABLE), unfiltered.ruleIds());
    }

    @Test
    void protectedTableMatchesQualifiedAndCaseInsensitiveNames() throws Exception {
        RiskAssessment assessment = classifier.classify(statement("UPDATE PUBLIC.USERS SET email = 'x' WHERE id = 1"));

        assertEquals(RiskLevel.MEDIUM, assessment.level());
    }

    @Test
    void alwaysCriticalPolicyGoesStraightToCritical() throws Exception {
        RiskClassifier strict = new RiskClassifier(ProtectedTableRegistry.parse("users:ALWAYS_CRITICAL"), 1000);

        assertEquals(RiskLevel.CRITICAL, strict.classify(statement("UPDATE users SET email = 'x' WHERE id = 1")).level());
    }

    @Test
    void readsOfProtectedTablesAreNotEscalated() throws Exception {
        assertEquals(RiskLevel.LOW, classifier.classify(statement("SELECT * FROM users")).level());
    }

    @Test
    void multiTableWriteEscalates() {
        ParsedStatement joinedDelete = new ParsedStatement(StatementKind.DELETE, null, List.of("visits"),
                List.of("visits", "person"), List.of("visits", "person"), "visits, person", "visits.visit_id = person.person_id",
                null, null);

        RiskAssessment assessment = classifier.classify(SqlStatement.parsed("DELETE ...", "fp", joinedDelete));

        assertEquals(RiskLevel.MEDIUM, assessment.level());
        assertEquals(List.of(RiskClassifier.RULE_MULTI_TABLE), assessment.ruleIds());
    }

    @Test
    void classificationIsDeterministic() throws Exception {
        SqlStatement delete = statement("DELETE FROM users");
        DryRunResult dryRun = new DryRunResult(5, true, "q");

        assertEquals(classifier.classify(delete, dryRun), classifier.classify(delete, dryRun));
    }

    private SqlStatement statement(String sql) throws Exception {
        return SqlStatement.parsed(sql, StatementNormalizer.fingerprint(sql), parser.parse(sql));
    }
}
