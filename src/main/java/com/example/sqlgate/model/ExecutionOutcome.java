package com.example.sqlgate.model;

import java.util.Objects;

public record ExecutionOutcome(ExecutionStatus status, Long affectedRows, String error) {

    private static final ExecutionOutcome NOT_RUN = new ExecutionOutcome(ExecutionStatus.NOT_RUN, null, null);

    public ExecutionOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static ExecutionOutcome notRun() {
        return NOT_RUN;
    }

    public static ExecutionOutcome success(long affectedRows) {
        return new ExecutionOutcome(ExecutionStatus.SUCCESS, affectedRows, null);
    }

    public static ExecutionOutcome failed(String error) {
        return new ExecutionOutcome(ExecutionStatus.FAILED, null, error == null ? "unknown error" : error);
    }

    public boolean attempted() {
        return status != ExecutionStatus.NOT_RUN;
    }
}
