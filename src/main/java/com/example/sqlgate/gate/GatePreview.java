package com.example.sqlgate.gate;

import com.example.sqlgate.model.DryRunResult;
import com.example.sqlgate.model.RiskAssessment;
import com.example.sqlgate.model.SqlStatement;

/**
 * Parse, estimate and classification of a statement without approval, snapshot or execution.
 */
public record GatePreview(SqlStatement statement, DryRunResult dryRun, RiskAssessment assessment, String dryRunError) {
}
