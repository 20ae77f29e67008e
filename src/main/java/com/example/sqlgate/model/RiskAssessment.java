package com.example.sqlgate.model;

import java.util.List;
import java.util.Objects;

public record RiskAssessment(RiskLevel level, List<RuleMatch> matches) {

    public RiskAssessment {
        Objects.requireNonNull(level, "level");
        matches = List.copyOf(matches);
    }

    public List<String> ruleIds() {
        return matches.stream().map(RuleMatch::ruleId).toList();
    }

    public List<String> reasons() {
        return matches.stream().map(RuleMatch::rationale).toList();
    }
}
