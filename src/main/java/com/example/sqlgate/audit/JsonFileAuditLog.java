package com.example.sqlgate.audit;

import com.example.sqlgate.NotFoundException;
import com.example.sqlgate.model.AuditQuery;
import com.example.sqlgate.model.AuditRecord;
import com.example.sqlgate.util.DurableFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Audit log kept as one JSON file per run, {@code <run_id>.json}, in a directory.
 */
public class JsonFileAuditLog implements AuditLog {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileAuditLog.class);
    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper mapper;
    private final AuditRecordCodec codec;

    public JsonFileAuditLog(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper;
        this.codec = new AuditRecordCodec(mapper);
    }

    @Override
    public synchronized void append(AuditRecord record) throws IOException {
        Path file = fileFor(record.runId());
        byte[] content = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(codec.encode(record));
        try {
            DurableFiles.writeNew(file, content);
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("Audit record for run " + record.runId() + " already exists", e);
        }
        LOGGER.info("Audited {} -> {}", record.runId(), record.finalStatus());
    }

    @Override
    public AuditRecord get(String runId) throws NotFoundException, IOException {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new NotFoundException("Unknown run: " + runId);
        }
        Path file = directory.resolve(runId + SUFFIX);
        if (Files.notExists(file)) {
            throw new NotFoundException("Unknown run: " + runId);
        }
        return read(file);
    }

    @Override
    public List<AuditRecord> query(AuditQuery query) throws IOException {
        if (Files.notExists(directory)) {
            return List.of();
        }
        List<AuditRecord> records = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(path -> path.getFileName().toString().endsWith(SUFFIX)).toList()) {
                AuditRecord record = read(file);
                if (query.matches(record)) {
                    records.add(record);
                }
            }
        }
        records.sort(Comparator.comparing(AuditRecord::timestamp).thenComparing(AuditRecord::runId));
        return records;
    }

    private Path fileFor(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        return directory.resolve(runId + SUFFIX);
    }

    private AuditRecord read(Path file) throws IOException {
        try {
            return codec.decode(mapper.readTree(file.toFile()));
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Malformed audit record " + file, e);
        }
    }
}
