package com.example.sqlgate.model;

public record DryRunResult(long estimatedRows, boolean exact, String rewrittenQuery) {

    public DryRunResult {
        if (estimatedRows < 0) {
            throw new IllegalArgumentException("estimatedRows must not be negative: " + estimatedRows);
        }
    }
}
