package com.example.sqlgate.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * States of the approval pipeline and the transitions permitted between them.
 */
public enum GateState {
    RECEIVED,
    PARSED,
    DRYRUN_DONE,
    RISK_ASSESSED,
    AUTO_APPROVED,
    PENDING_APPROVAL,
    BLOCKED,
    SNAPSHOTTED,
    SKIPPED_SNAPSHOT,
    EXECUTED,
    AUDITED,
    DONE,
    ABORTED;

    private static final Map<GateState, Set<GateState>> TRANSITIONS = new EnumMap<>(GateState.class);

    static {
        TRANSITIONS.put(RECEIVED, EnumSet.of(PARSED));
        TRANSITIONS.put(PARSED, EnumSet.of(DRYRUN_DONE));
        TRANSITIONS.put(DRYRUN_DONE, EnumSet.of(RISK_ASSESSED));
        TRANSITIONS.put(RISK_ASSESSED, EnumSet.of(AUTO_APPROVED, PENDING_APPROVAL, BLOCKED, ABORTED));
        TRANSITIONS.put(AUTO_APPROVED, EnumSet.of(SKIPPED_SNAPSHOT, ABORTED));
        TRANSITIONS.put(PENDING_APPROVAL, EnumSet.of(SNAPSHOTTED, ABORTED));
        TRANSITIONS.put(SNAPSHOTTED, EnumSet.of(EXECUTED, ABORTED));
        TRANSITIONS.put(SKIPPED_SNAPSHOT, EnumSet.of(EXECUTED, ABORTED));
        TRANSITIONS.put(EXECUTED, EnumSet.of(AUDITED, ABORTED));
        TRANSITIONS.put(AUDITED, EnumSet.of(DONE));
        TRANSITIONS.put(BLOCKED, EnumSet.noneOf(GateState.class));
        TRANSITIONS.put(DONE, EnumSet.noneOf(GateState.class));
        TRANSITIONS.put(ABORTED, EnumSet.noneOf(GateState.class));
    }

    public boolean canTransitionTo(GateState next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<GateState> successors() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
