package com.example.sqlgate.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GateStateTest {

    @Test
    void abortIsOnlyReachableAfterAssessment() {
        assertFalse(GateState.RECEIVED.canTransitionTo(GateState.ABORTED));
        assertFalse(GateState.PARSED.canTransitionTo(GateState.ABORTED));
        assertFalse(GateState.DRYRUN_DONE.canTransitionTo(GateState.ABORTED));
        assertTrue(GateState.RISK_ASSESSED.canTransitionTo(GateState.ABORTED));
        assertTrue(GateState.PENDING_APPROVAL.canTransitionTo(GateState.ABORTED));
    }

    @Test
    void executionFollowsSnapshotDecision() {
        assertFalse(GateState.PENDING_APPROVAL.canTransitionTo(GateState.EXECUTED));
        assertFalse(GateState.AUTO_APPROVED.canTransitionTo(GateState.SNAPSHOTTED));
        assertTrue(GateState.SNAPSHOTTED.canTransitionTo(GateState.EXECUTED));
        assertTrue(GateState.SKIPPED_SNAPSHOT.canTransitionTo(GateState.EXECUTED));
    }

    @Test
    void terminalStatesHaveNoSuccessors() {
        assertTrue(GateState.DONE.isTerminal());
        assertTrue(GateState.BLOCKED.isTerminal());
        assertTrue(GateState.ABORTED.isTerminal());
        assertFalse(GateState.AUDITED.isTerminal());
    }
}
