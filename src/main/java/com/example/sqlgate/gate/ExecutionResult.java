package com.example.sqlgate.gate;

public record ExecutionResult(long affectedRows) {
}
