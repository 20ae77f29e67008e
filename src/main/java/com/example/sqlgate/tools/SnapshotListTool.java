package com.example.sqlgate.tools;

import com.example.sqlgate.SqlGate;
import com.example.sqlgate.model.SnapshotRef;
import com.example.sqlgate.snapshot.SnapshotRefJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public class SnapshotListTool implements Tool {

    private final ObjectMapper mapper;
    private final SqlGate sqlGate;

    public SnapshotListTool(ObjectMapper mapper, SqlGate sqlGate) {
        this.mapper = mapper;
        this.sqlGate = sqlGate;
    }

    @Override
    public String getName() {
        return "snapshot.list";
    }

    @Override
    public String getDescription() {
        return "List recorded table snapshots, oldest first. Restoring is only possible from the command line.";
    }

    @Override
    public ObjectNode getInputSchema() {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        schema.set("properties", mapper.createObjectNode());
        return schema;
    }

    @Override
    public JsonNode call(JsonNode arguments) throws Exception {
        List<SnapshotRef> refs = sqlGate.rollback().listSnapshots();
        ObjectNode result = mapper.createObjectNode();
        ArrayNode snapshots = result.putArray("snapshots");
        for (SnapshotRef ref : refs) {
            snapshots.add(SnapshotRefJson.toJson(mapper, ref));
        }
        result.put("totalCount", refs.size());
        return result;
    }
}
