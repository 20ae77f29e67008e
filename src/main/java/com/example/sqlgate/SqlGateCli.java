package com.example.sqlgate;

import com.example.sqlgate.config.GateConfig;
import com.example.sqlgate.gate.Approver;
import com.example.sqlgate.gate.ConsoleApprover;
import com.example.sqlgate.gate.FileApprovalInbox;
import com.example.sqlgate.gate.StaticApprover;
import com.example.sqlgate.model.AuditQuery;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.model.ElevatedOverride;
import com.example.sqlgate.model.ExecutionStatus;
import com.example.sqlgate.model.ReplayDivergence;
import com.example.sqlgate.model.ReplayTrace;
import com.example.sqlgate.model.RiskLevel;
import com.example.sqlgate.model.RuleMatch;
import com.example.sqlgate.model.SnapshotRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * <pre>
 * sql-gate [--config FILE] run SQL [--approver console|inbox|deny] [--override-by WHO --override-reason WHY]
 * sql-gate [--config FILE] rollback [SNAPSHOT_ID] [--yes]
 * sql-gate [--config FILE] snapshots
 * sql-gate [--config FILE] replay RUN_ID
 * sql-gate [--config FILE] audit [--from ISO] [--to ISO] [--min-level LEVEL]
 * sql-gate [--config FILE] approve|deny RUN_ID
 * sql-gate [--config FILE] pending
 * </pre>
 */
public class SqlGateCli {
    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_BLOCKED = 2;
    public static final int EXIT_ABORTED = 3;
    public static final int EXIT_EXECUTION_FAILED = 4;

    private static final Logger LOGGER = LoggerFactory.getLogger(SqlGateCli.class);
    private static final Set<String> FLAGS = Set.of("--yes");
    private static final Duration INBOX_POLL_INTERVAL = Duration.ofMillis(500);

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public SqlGateCli(BufferedReader in, PrintStream out, PrintStream err) {
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(new SqlGateCli(stdin, System.out, System.err).run(args));
    }

    public int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            printUsage();
            return EXIT_ERROR;
        }
        if (arguments.positional().isEmpty() || arguments.positional().get(0).equals("help")) {
            printUsage();
            return arguments.positional().isEmpty() ? EXIT_ERROR : EXIT_OK;
        }

        String command = arguments.positional().get(0);
        try {
            String configFile = arguments.option("--config");
            GateConfig config = GateConfig.load(configFile == null ? null : Path.of(configFile));
            return switch (command) {
                case "run" -> runStatement(config, arguments);
                case "rollback" -> rollback(config, arguments);
                case "snapshots" -> listSnapshots(config);
                case "replay" -> replay(config, arguments);
                case "audit" -> audit(config, arguments);
                case "approve" -> answer(config, arguments, true);
                case "deny" -> answer(config, arguments, false);
                case "pending" -> pending(config);
                default -> {
                    err.println("Unknown command: " + command);
                    printUsage();
                    yield EXIT_ERROR;
                }
            };
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (NotFoundException e) {
            err.println(e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            LOGGER.error("Command '{}' failed", command, e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int runStatement(GateConfig config, Arguments arguments) throws IOException {
        String sql = arguments.requirePositional(1, "run needs a SQL statement");
        ElevatedOverride override = null;
        String overrideBy = arguments.option("--override-by");
        String overrideReason = arguments.option("--override-reason");
        if (overrideBy != null || overrideReason != null) {
            override = new ElevatedOverride(overrideBy, overrideReason);
        }

        try (SqlGate sqlGate = new SqlGate(config, approver(config, arguments.option("--approver")))) {
            AuditRecord record = sqlGate.gate().submit(sql, override);
            printRecord(record);
            return exitCode(record);
        }
    }

    private Approver approver(GateConfig config, String kind) {
        String selected = kind == null ? "console" : kind.toLowerCase(Locale.ROOT);
        return switch (selected) {
            case "console" -> new ConsoleApprover(in, out);
            case "inbox" -> new FileApprovalInbox(config.approvalDir(), INBOX_POLL_INTERVAL, new ObjectMapper(), Clock.systemUTC());
            case "deny" -> StaticApprover.denyAll();
            default -> throw new IllegalArgumentException("Unknown approver: " + kind);
        };
    }

    private int rollback(GateConfig config, Arguments arguments) throws IOException, NotFoundException {
        try (SqlGate sqlGate = new SqlGate(config, StaticApprover.denyAll())) {
            String snapshotId = arguments.positional().size() > 1 ? arguments.positional().get(1) : null;
            if (snapshotId == null) {
                List<SnapshotRef> refs = sqlGate.rollback().listSnapshots();
                if (refs.isEmpty()) {
                    out.println("No snapshots available.");
                    return EXIT_OK;
                }
                printSnapshots(refs);
                out.print("Snapshot to restore (number, blank to cancel): ");
                out.flush();
                String choice = in.readLine();
                if (choice == null || choice.isBlank()) {
                    out.println("Rollback cancelled.");
                    return EXIT_ABORTED;
                }
                snapshotId = select(refs, choice.trim());
            }

            if (!arguments.flag("--yes") && !confirm("Restore snapshot " + snapshotId + "? This overwrites the current table contents. (yes/no): ")) {
                out.println("Rollback cancelled.");
                return EXIT_ABORTED;
            }
            AuditRecord record = sqlGate.rollback().rollback(snapshotId);
            printRecord(record);
            return exitCode(record);
        }
    }

    private String select(List<SnapshotRef> refs, String choice) {
        try {
            int index = Integer.parseInt(choice);
            if (index < 1 || index > refs.size()) {
                throw new IllegalArgumentException("No snapshot numbered " + choice);
            }
            return refs.get(index - 1).id();
        } catch (NumberFormatException e) {
            return choice;
        }
    }

    private boolean confirm(String prompt) throws IOException {
        while (true) {
            out.print(prompt);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                return false;
            }
            String answer = line.trim().toLowerCase(Locale.ROOT);
            if (answer.equals("yes") || answer.equals("y")) {
                return true;
            }
            if (answer.equals("no") || answer.equals("n")) {
                return false;
            }
        }
    }

    private int listSnapshots(GateConfig config) throws IOException {
        try (SqlGate sqlGate = new SqlGate(config, StaticApprover.denyAll())) {
            List<SnapshotRef> refs = sqlGate.rollback().listSnapshots();
            if (refs.isEmpty()) {
                out.println("No snapshots available.");
            } else {
                printSnapshots(refs);
            }
            return EXIT_OK;
        }
    }

    private int replay(GateConfig config, Arguments arguments) throws IOException, NotFoundException {
        String runId = arguments.requirePositional(1, "replay needs a run id");
        try (SqlGate sqlGate = new SqlGate(config, StaticApprover.denyAll())) {
            ReplayTrace trace = sqlGate.replay().replay(runId);
            out.println("Replay of " + trace.runId() + ": " + trace.sql());
            out.println("  recorded " + trace.recordedAssessment().level() + " " + trace.recordedAssessment().ruleIds());
            out.println("  replayed " + trace.replayedAssessment().level() + " " + trace.replayedAssessment().ruleIds());
            if (trace.consistent()) {
                out.println("  no divergence");
            }
            for (ReplayDivergence divergence : trace.divergences()) {
                out.println("  " + divergence.field() + ": recorded=" + divergence.recorded() + " replayed=" + divergence.replayed());
            }
            return EXIT_OK;
        }
    }

    private int audit(GateConfig config, Arguments arguments) throws IOException {
        AuditQuery query = new AuditQuery(
                instant(arguments.option("--from"), "--from"),
                instant(arguments.option("--to"), "--to"),
                level(arguments.option("--min-level")));
        try (SqlGate sqlGate = new SqlGate(config, StaticApprover.denyAll())) {
            List<AuditRecord> records = sqlGate.auditLog().query(query);
            for (AuditRecord record : records) {
                out.println(record.timestamp() + " " + record.summary());
            }
            out.println(records.size() + " record(s)");
            return EXIT_OK;
        }
    }

    private int answer(GateConfig config, Arguments arguments, boolean approve) throws IOException, NotFoundException {
        String runId = arguments.requirePositional(1, (approve ? "approve" : "deny") + " needs a run id");
        if (approve) {
            FileApprovalInbox.approve(config.approvalDir(), runId);
            out.println("Approved " + runId);
        } else {
            FileApprovalInbox.deny(config.approvalDir(), runId);
            out.println("Denied " + runId);
        }
        return EXIT_OK;
    }

    private int pending(GateConfig config) throws IOException {
        List<JsonNode> pending = FileApprovalInbox.listPending(config.approvalDir(), new ObjectMapper());
        for (JsonNode request : pending) {
            out.println(request.path("run_id").asText() + " " + request.path("risk_level").asText()
                    + " " + request.path("sql").asText());
        }
        out.println(pending.size() + " pending request(s)");
        return EXIT_OK;
    }

    private void printRecord(AuditRecord record) {
        out.println(record.summary());
        for (RuleMatch match : record.riskAssessment().matches()) {
            out.println("  " + match.ruleId() + ": " + match.rationale());
        }
        if (record.executionOutcome().error() != null) {
            out.println("  error: " + record.executionOutcome().error());
        }
    }

    private void printSnapshots(List<SnapshotRef> refs) {
        for (int i = 0; i < refs.size(); i++) {
            SnapshotRef ref = refs.get(i);
            out.println((i + 1) + ". " + ref.id() + "  " + ref.createdAt() + "  " + ref.backend() + "  " + ref.tables());
        }
    }

    static int exitCode(AuditRecord record) {
        return switch (record.finalStatus()) {
            case BLOCKED -> EXIT_BLOCKED;
            case ABORTED -> EXIT_ABORTED;
            case DONE -> record.executionOutcome().status() == ExecutionStatus.FAILED ? EXIT_EXECUTION_FAILED : EXIT_OK;
        };
    }

    private static Instant instant(String value, String option) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(option + " is not an ISO-8601 instant: " + value, e);
        }
    }

    private static RiskLevel level(String value) {
        if (value == null) {
            return null;
        }
        try {
            return RiskLevel.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown risk level: " + value, e);
        }
    }

    private void printUsage() {
        err.println("Usage: sql-gate [--config FILE] <command> [options]");
        err.println("  run SQL [--approver console|inbox|deny] [--override-by WHO --override-reason WHY]");
        err.println("  rollback [SNAPSHOT_ID] [--yes]");
        err.println("  snapshots");
        err.println("  replay RUN_ID");
        err.println("  audit [--from ISO] [--to ISO] [--min-level LOW|MEDIUM|HIGH|CRITICAL]");
        err.println("  approve RUN_ID | deny RUN_ID | pending");
    }

    private record Arguments(List<String> positional, Map<String, String> options, Set<String> flags) {

        static Arguments parse(String[] args) {
            List<String> positional = new ArrayList<>();
            Map<String, String> options = new HashMap<>();
            Set<String> flags = new HashSet<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (FLAGS.contains(arg)) {
                    flags.add(arg);
                } else if (arg.startsWith("--")) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Option " + arg + " needs a value");
                    }
                    options.put(arg, args[++i]);
                } else {
                    positional.add(arg);
                }
            }
            return new Arguments(positional, options, flags);
        }

        String option(String name) {
            return options.get(name);
        }

        boolean flag(String name) {
            return flags.contains(name);
        }

        String requirePositional(int index, String message) {
            if (positional.size() <= index) {
                throw new IllegalArgumentException(message);
            }
            return positional.get(index);
        }
    }
}
