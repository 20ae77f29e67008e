package com.example.sqlgate.model;

public enum FinalStatus {
    DONE,
    ABORTED,
    BLOCKED
}
