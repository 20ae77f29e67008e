package com.example.sqlgate.gate;

import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.ElevatedOverride;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.SqlStatement;

import java.time.Duration;

/**
 * What an approver is shown. {@code dryRun} and {@code override} may be null.
 */
public record ApprovalRequest(
        String runId,
        SqlStatement statement,
        RiskAssessment assessment,
        DryRunResult dryRun,
        ElevatedOverride override,
        Duration timeout
) {
}
