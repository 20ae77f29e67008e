package com.example.sqlgate.risk;

import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.ParsedStatement;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.model.RuleMatch;
import com.example.sqlgate.model.SqlStatement;
import com.example.sqlgate.model.StatementKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a statement, and optionally its dry-run estimate, to a {@link RiskAssessment}.
 * Base rules set a floor; protected-table and multi-table rules then escalate the level
 * reached so far. Pure: same inputs, same assessment.
 */
public class RiskClassifier {
    public static final String RULE_DDL = "DDL";
    public static final String RULE_PARSE_FAILED = "PARSE_FAILED";
    public static final String RULE_UNRECOGNIZED = "UNRECOGNIZED_STATEMENT";
    public static final String RULE_UNFILTERED_WRITE = "UNFILTERED_WRITE";
    public static final String RULE_ROW_COUNT = "ROW_COUNT_ABOVE_THRESHOLD";
    public static final String RULE_PROTECTED_TABLE = "PROTECTED_TABLE";
    public static final String RULE_MULTI_TABLE = "MULTI_TABLE_WRITE";
    public static final String RULE_DEFAULT = "DEFAULT";

    private final ProtectedTableRegistry registry;
    private final long rowCountThreshold;

    public RiskClassifier(ProtectedTableRegistry registry, long rowCountThreshold) {
        if (rowCountThreshold < 0) {
            throw new IllegalArgumentException("rowCountThreshold must not be negative");
        }
        this.registry = registry == null ? ProtectedTableRegistry.empty() : registry;
        this.rowCountThreshold = rowCountThreshold;
    }

    public RiskAssessment classify(SqlStatement statement) {
        return classify(statement, null);
    }

    public RiskAssessment classify(SqlStatement statement, DryRunResult dryRun) {
        if (!statement.isParsed()) {
            return new RiskAssessment(RiskLevel.CRITICAL, List.of(
                    new RuleMatch(RULE_PARSE_FAILED, "Statement could not be parsed: " + statement.parseError())));
        }

        ParsedStatement parsed = statement.parsed();
        List<RuleMatch> matches = new ArrayList<>();
        RiskLevel level = RiskLevel.LOW;

        if (parsed.kind() == StatementKind.DDL) {
            level = RiskLevel.CRITICAL;
            matches.add(new RuleMatch(RULE_DDL, parsed.ddlOperation() + " changes schema or discards data"));
        }
        if (parsed.kind() == StatementKind.OTHER) {
            level = RiskLevel.CRITICAL;
            matches.add(new RuleMatch(RULE_UNRECOGNIZED, "Statement type is not recognised; refusing to guess its effect"));
        }
        if (parsed.kind().takesPredicate() && !parsed.hasPredicate()) {
            level = RiskLevel.max(level, RiskLevel.HIGH);
            matches.add(new RuleMatch(RULE_UNFILTERED_WRITE,
                    parsed.kind() + " without WHERE affects every row of " + String.join(", ", parsed.targetTables())));
        }
        if (parsed.kind().isMutating() && dryRun != null && dryRun.estimatedRows() > rowCountThreshold) {
            level = RiskLevel.max(level, RiskLevel.HIGH);
            matches.add(new RuleMatch(RULE_ROW_COUNT, "Estimated " + dryRun.estimatedRows()
                    + " rows exceeds threshold " + rowCountThreshold));
        }

        if (parsed.kind().isMutatingDml()) {
            Optional<RuleMatch> protectedMatch = Optional.empty();
            RiskLevel escalated = level;
            for (String table : parsed.targetTables()) {
                Optional<ElevationPolicy> policy = registry.lookup(table);
                if (policy.isPresent()) {
                    RiskLevel candidate = policy.get().apply(level);
                    if (protectedMatch.isEmpty() || candidate.compareTo(escalated) > 0) {
                        escalated = candidate;
                        protectedMatch = Optional.of(new RuleMatch(RULE_PROTECTED_TABLE,
                                "Writes protected table " + table + " (" + policy.get() + ")"));
                    }
                }
            }
            if (protectedMatch.isPresent()) {
                level = escalated;
                matches.add(protectedMatch.get());
            }
        }

        if (parsed.kind().isMutating() && parsed.isMultiTable()) {
            level = level.escalate();
            matches.add(new RuleMatch(RULE_MULTI_TABLE,
                    "Touches " + parsed.touchedTables().size() + " tables: " + String.join(", ", parsed.touchedTables())));
        }

        if (matches.isEmpty()) {
            matches.add(new RuleMatch(RULE_DEFAULT, "No risk rule matched"));
        }
        return new RiskAssessment(level, matches);
    }
}
