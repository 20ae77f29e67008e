package com.example.sqlgate.model;

public enum ApprovalDecision {
    NONE,
    AUTO,
    APPROVED,
    DENIED,
    TIMED_OUT;

    public boolean permitsExecution() {
        return this == AUTO || this == APPROVED;
    }
}
