package com.example.sqlgate.model;

import java.time.Instant;

public record StepRecord(GateState state, Instant at, String note) {
}
