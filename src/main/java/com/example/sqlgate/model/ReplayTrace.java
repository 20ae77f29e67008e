package com.example.sqlgate.model;

import java.time.Instant;
import java.util.List;

public record ReplayTrace(
        String runId,
        String sql,
        Instant replayedAt,
        RiskAssessment recordedAssessment,
        RiskAssessment replayedAssessment,
        DryRunResult recordedDryRun,
        DryRunResult replayedDryRun,
        List<ReplayDivergence> divergences
) {

    public ReplayTrace {
        divergences = List.copyOf(divergences);
    }

    public boolean consistent() {
        return divergences.isEmpty();
    }
}
