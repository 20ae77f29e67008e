package com.example.sqlgate.audit;

import com.example.sqlgate.NotFoundException;
import com.example.sqlgate.model.AuditQuery;
import com.example.sqlgate.model.AuditRecord;

import java.io.IOException;
import java.util.List;

/**
 * Append-only store of finished runs. Records are never updated or deleted.
 */
public interface AuditLog {

    /**
     * Durably stores {@code record}.
     *
     * @throws IllegalStateException if a record with the same run id already exists
     */
    void append(AuditRecord record) throws IOException;

    AuditRecord get(String runId) throws NotFoundException, IOException;

    /**
     * Records matching {@code query}, oldest first.
     */
    List<AuditRecord> query(AuditQuery query) throws IOException;
}
