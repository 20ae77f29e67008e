package com.example.sqlgate.model;

public enum AbortReason {
    DENIED,
    TIMEOUT,
    DRY_RUN_FAILED,
    SNAPSHOT_FAILED,
    LOCK_TIMEOUT,
    CANCELLED,
    INTERNAL_ERROR
}
