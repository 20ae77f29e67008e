package com.example.sqlgate.model;

public record RuleMatch(String ruleId, String rationale) {
}
