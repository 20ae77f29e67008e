package com.example.sqlgate.gate;

public enum ApprovalResponse {
    YES,
    NO,
    TIMEOUT
}
