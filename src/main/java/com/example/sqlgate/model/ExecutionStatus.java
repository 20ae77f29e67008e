package com.example.sqlgate.model;

public enum ExecutionStatus {
    NOT_RUN,
    SUCCESS,
    FAILED
}
