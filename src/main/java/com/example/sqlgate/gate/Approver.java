package com.example.sqlgate.gate;

import java.io.IOException;

/**
 * Decides whether a MEDIUM or HIGH statement may run. The gate calls it on a worker thread and
 * cancels it when the approval timeout elapses, so implementations should block interruptibly.
 * A thrown exception or a null answer counts as a denial.
 */
@FunctionalInterface
public interface Approver {

    ApprovalResponse requestApproval(ApprovalRequest request) throws IOException, InterruptedException;
}
