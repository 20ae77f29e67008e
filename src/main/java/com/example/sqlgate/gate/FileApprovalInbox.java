package com.example.sqlgate.gate;

import com.example.sqlgate.NotFoundException;
import com.example.sqlgate.model.RuleMatch;
import com.example.sqlgate.util.DurableFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Approval through the file system. A request is published as {@code <run_id>.pending.json};
 * an operator answers by creating {@code <run_id>.approve} or {@code <run_id>.deny}, usually
 * with the {@code approve}/{@code deny} CLI commands. Whoever submits the statement cannot
 * answer it through the same channel.
 */
public class FileApprovalInbox implements Approver {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileApprovalInbox.class);
    private static final String PENDING_SUFFIX = ".pending.json";
    private static final String APPROVE_SUFFIX = ".approve";
    private static final String DENY_SUFFIX = ".deny";
    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path directory;
    private final Duration pollInterval;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FileApprovalInbox(Path directory, Duration pollInterval, ObjectMapper mapper, Clock clock) {
        this.directory = directory;
        this.pollInterval = pollInterval;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public ApprovalResponse requestApproval(ApprovalRequest request) throws IOException, InterruptedException {
        String runId = requireRunId(request.runId());
        Path pending = directory.resolve(runId + PENDING_SUFFIX);
        DurableFiles.writeNew(pending, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(describe(request)));
        LOGGER.info("Waiting for approval of {} in {}", runId, directory.toAbsolutePath());
        try {
            while (true) {
                if (Files.exists(directory.resolve(runId + DENY_SUFFIX))) {
                    return ApprovalResponse.NO;
                }
                if (Files.exists(directory.resolve(runId + APPROVE_SUFFIX))) {
                    return ApprovalResponse.YES;
                }
                Thread.sleep(pollInterval.toMillis());
            }
        } finally {
            // a stale answer would decide a later request reusing this run id
            Files.deleteIfExists(pending);
            Files.deleteIfExists(directory.resolve(runId + APPROVE_SUFFIX));
            Files.deleteIfExists(directory.resolve(runId + DENY_SUFFIX));
        }
    }

    public static void approve(Path directory, String runId) throws NotFoundException, IOException {
        answer(directory, runId, APPROVE_SUFFIX);
    }

    public static void deny(Path directory, String runId) throws NotFoundException, IOException {
        answer(directory, runId, DENY_SUFFIX);
    }

    /**
     * Pending requests, oldest first.
     */
    public static List<JsonNode> listPending(Path directory, ObjectMapper mapper) throws IOException {
        if (Files.notExists(directory)) {
            return List.of();
        }
        List<JsonNode> pending = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(path -> path.getFileName().toString().endsWith(PENDING_SUFFIX)).toList()) {
                pending.add(mapper.readTree(file.toFile()));
            }
        }
        pending.sort(Comparator.comparing(node -> node.path("requested_at").asText()));
        return pending;
    }

    private static void answer(Path directory, String runId, String suffix) throws NotFoundException, IOException {
        String id = requireRunId(runId);
        if (Files.notExists(directory.resolve(id + PENDING_SUFFIX))) {
            throw new NotFoundException("No pending approval for run " + runId);
        }
        try {
            Files.createFile(directory.resolve(id + suffix));
        } catch (FileAlreadyExistsException e) {
            LOGGER.debug("Run {} already answered with {}", id, suffix);
        }
    }

    private ObjectNode describe(ApprovalRequest request) {
        ObjectNode node = mapper.createObjectNode();
        node.put("run_id", request.runId());
        node.put("requested_at", clock.instant().toString());
        node.put("timeout", request.timeout().toString());
        node.put("sql", request.statement().sql());
        node.put("risk_level", request.assessment().level().name());
        ArrayNode reasons = node.putArray("risk_reasons");
        for (RuleMatch match : request.assessment().matches()) {
            reasons.add(match.ruleId() + ": " + match.rationale());
        }
        if (request.dryRun() == null) {
            node.putNull("estimated_rows");
        } else {
            node.put("estimated_rows", request.dryRun().estimatedRows());
        }
        if (request.override() != null) {
            node.put("override_by", request.override().authorizedBy());
        }
        return node;
    }

    private static String requireRunId(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        return runId;
    }
}
