package com.example.sqlgate.gate;

import com.example.sqlgate.model.RuleMatch;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * Asks an operator on the terminal. End of input counts as "no".
 */
public class ConsoleApprover implements Approver {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleApprover(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public ApprovalResponse requestApproval(ApprovalRequest request) throws IOException, InterruptedException {
        out.println("Run " + request.runId() + " needs approval");
        out.println("  SQL:   " + request.statement().sql());
        out.println("  Risk:  " + request.assessment().level());
        for (RuleMatch match : request.assessment().matches()) {
            out.println("         " + match.ruleId() + ": " + match.rationale());
        }
        if (request.dryRun() != null) {
            out.println("  Rows:  " + request.dryRun().estimatedRows() + (request.dryRun().exact() ? "" : " (estimate)"));
        }
        if (request.override() != null) {
            out.println("  Override by " + request.override().authorizedBy() + ": " + request.override().reason());
        }

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Approval prompt cancelled");
            }
            out.print("Proceed with execution? (yes/no): ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                return ApprovalResponse.NO;
            }
            String answer = line.trim().toLowerCase(Locale.ROOT);
            if (answer.equals("yes") || answer.equals("y")) {
                return ApprovalResponse.YES;
            }
            if (answer.equals("no") || answer.equals("n")) {
                return ApprovalResponse.NO;
            }
            out.println("Please answer yes or no.");
        }
    }
}
