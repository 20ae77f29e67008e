package com.example.sqlgate.replay;

import com.example.sqlgate.NotFoundException;
import com.example.sqlgate.audit.AuditLog;
import com.example.sqlgate.dryrun.DryRunEstimator;
import com.example.sqlgate.dryrun.DryRunException;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.ReplayDivergence;
import com.example.sqlgate.model.ReplayTrace;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.SqlStatement;
import com.example.sqlgate.parse.SqlParseException;
import com.example.sqlgate.parse.SqlParser;
import com.example.sqlgate.risk.RiskClassifier;
import com.example.sqlgate.rollback.RollbackService;
import com.example.sqlgate.util.StatementNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Re-evaluates an audited statement against the current database and classifier settings and
 * reports where the result differs from what was recorded. Has no way to execute anything.
 */
public class ReplayEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplayEngine.class);

    private final AuditLog auditLog;
    private final SqlParser parser;
    private final DryRunEstimator estimator;
    private final RiskClassifier classifier;
    private final Clock clock;

    public ReplayEngine(AuditLog auditLog, SqlParser parser, DryRunEstimator estimator,
                        RiskClassifier classifier, Clock clock) {
        this.auditLog = auditLog;
        this.parser = parser;
        this.estimator = estimator;
        this.classifier = classifier;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if {@code runId} records a snapshot restore, which has no
     *                                  statement to re-evaluate
     */
    public ReplayTrace replay(String runId) throws NotFoundException, IOException {
        AuditRecord recorded = auditLog.get(runId);
        if (recorded.riskAssessment().ruleIds().contains(RollbackService.RULE_SNAPSHOT_RESTORE)) {
            throw new IllegalArgumentException("Run " + runId
                    + " is a snapshot restore; only submitted statements can be replayed");
        }
        String sql = recorded.sql();
        String fingerprint = StatementNormalizer.fingerprint(sql);

        SqlStatement statement;
        try {
            statement = SqlStatement.parsed(sql, fingerprint, parser.parse(sql));
        } catch (SqlParseException e) {
            statement = SqlStatement.unparseable(sql, fingerprint, e.getMessage());
        }

        List<ReplayDivergence> divergences = new ArrayList<>();
        DryRunResult replayedDryRun = null;
        try {
            replayedDryRun = estimator.estimate(statement).orElse(null);
        } catch (DryRunException e) {
            divergences.add(new ReplayDivergence("dry_run", describe(recorded.dryRunResult()), "failed: " + e.getMessage()));
        }
        RiskAssessment replayed = classifier.classify(statement, replayedDryRun);
        RiskAssessment original = recorded.riskAssessment();

        compare(divergences, "risk_level", original.level().name(), replayed.level().name());
        compare(divergences, "risk_rules", String.valueOf(original.ruleIds()), String.valueOf(replayed.ruleIds()));
        if (divergences.stream().noneMatch(divergence -> divergence.field().equals("dry_run"))) {
            DryRunResult before = recorded.dryRunResult();
            compare(divergences, "estimated_rows",
                    before == null ? null : String.valueOf(before.estimatedRows()),
                    replayedDryRun == null ? null : String.valueOf(replayedDryRun.estimatedRows()));
            compare(divergences, "exact",
                    before == null ? null : String.valueOf(before.exact()),
                    replayedDryRun == null ? null : String.valueOf(replayedDryRun.exact()));
        }

        if (!divergences.isEmpty()) {
            LOGGER.info("Replay of {} diverged in {} field(s)", runId, divergences.size());
        }
        return new ReplayTrace(runId, sql, clock.instant(), original, replayed,
                recorded.dryRunResult(), replayedDryRun, divergences);
    }

    private static void compare(List<ReplayDivergence> divergences, String field, String recorded, String replayed) {
        if (!Objects.equals(recorded, replayed)) {
            divergences.add(new ReplayDivergence(field, recorded, replayed));
        }
    }

    private static String describe(DryRunResult dryRun) {
        return dryRun == null ? null : dryRun.estimatedRows() + (dryRun.exact() ? " (exact)" : " (estimate)");
    }
}
