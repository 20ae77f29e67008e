package com.example.sqlgate.gate;

/**
 * Gives the same answer to every request.
 */
public class StaticApprover implements Approver {

    private final ApprovalResponse response;

    public StaticApprover(ApprovalResponse response) {
        this.response = response;
    }

    public static StaticApprover denyAll() {
        return new StaticApprover(ApprovalResponse.NO);
    }

    @Override
    public ApprovalResponse requestApproval(ApprovalRequest request) {
        return response;
    }
}
