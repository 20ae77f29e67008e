package com.example.sqlgate;

import com.example.sqlgate.config.GateConfig;
import com.example.sqlgate.db.DriverManagerConnectionProvider;
import com.example.sqlgate.gate.FileApprovalInbox;
import com.example.sqlgate.tools.AuditQueryTool;
import com.example.sqlgate.tools.AuditReplayTool;
import com.example.sqlgate.tools.SnapshotListTool;
import com.example.sqlgate.tools.SqlAssessTool;
import com.example.sqlgate.tools.SqlSubmitTool;
import com.example.sqlgate.tools.Tool;
import com.example.sqlgate.tools.ToolRegistry;
import com.example.sqlgate.util.JarLocationResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MCP server exposing the gate over stdio. Approvals for statements submitted here come from
 * the file inbox, answered with {@code sql-gate approve|deny <run_id>}.
 */
public class SqlGateServer {

    private static final String LOG_FILE_PATH = configureSimpleLogger();
    private static final Logger LOGGER = LoggerFactory.getLogger(SqlGateServer.class);
    private static final Duration INBOX_POLL_INTERVAL = Duration.ofMillis(500);

    private final ObjectMapper mapper = new ObjectMapper();
    private final McpJsonMapper mcpJsonMapper = McpJsonMapper.getDefault();
    private final ToolRegistry registry = new ToolRegistry();
    private final SqlGate sqlGate;

    public SqlGateServer(GateConfig config) {
        Clock clock = Clock.systemUTC();
        this.sqlGate = new SqlGate(config,
                new FileApprovalInbox(config.approvalDir(), INBOX_POLL_INTERVAL, mapper, clock),
                new DriverManagerConnectionProvider(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword()),
                clock, mapper);
        registry.register(new SqlSubmitTool(mapper, sqlGate));
        registry.register(new SqlAssessTool(mapper, sqlGate));
        registry.register(new SnapshotListTool(mapper, sqlGate));
        registry.register(new AuditQueryTool(mapper, sqlGate));
        registry.register(new AuditReplayTool(mapper, sqlGate));
    }

    public static void main(String[] args) throws IOException {
        Path configFile = args.length > 0 ? Path.of(args[0]) : null;
        new SqlGateServer(GateConfig.load(configFile)).start();
    }

    public void start() {
        List<McpServerFeatures.SyncToolSpecification> tools = registry.list().stream()
                .map(this::toToolSpecification)
                .toList();

        if (LOG_FILE_PATH != null) {
            LOGGER.info("Logging sql-gate server output to {}", LOG_FILE_PATH);
        }

        StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(mcpJsonMapper);

        McpSyncServer server = McpServer
                .sync(transportProvider)
                .serverInfo(new McpSchema.Implementation("sql-gate", "0.1.0"))
                .jsonMapper(mcpJsonMapper)
                .tools(tools)
                .build();

        keepServerAlive(server, tools.size());
    }

    List<Tool> tools() {
        return registry.list();
    }

    private static String configureSimpleLogger() {
        String existing = System.getProperty("org.slf4j.simpleLogger.logFile");
        if (existing != null && !existing.isBlank()) {
            return existing;
        }

        try {
            Path logFile = JarLocationResolver.resolveBesideJar(SqlGateServer.class, "sql-gate-server.log");
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null && Files.notExists(parent)) {
                Files.createDirectories(parent);
            }
            String absolutePath = logFile.toAbsolutePath().toString();
            System.setProperty("org.slf4j.simpleLogger.logFile", absolutePath);
            return absolutePath;
        } catch (IOException | RuntimeException ex) {
            System.err.println("Failed to configure simple logger file output: " + ex.getMessage());
            return null;
        }
    }

    private void keepServerAlive(McpSyncServer server, int toolCount) {
        CountDownLatch shutdown = new CountDownLatch(1);
        AtomicBoolean closed = new AtomicBoolean(false);

        Runnable shutdownHook = () -> {
            if (closed.compareAndSet(false, true)) {
                try {
                    LOGGER.info("Shutting down sql-gate server");
                    server.closeGracefully();
                    sqlGate.close();
                } catch (Exception e) {
                    LOGGER.warn("Error while shutting down sql-gate server", e);
                } finally {
                    shutdown.countDown();
                }
            }
        };

        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook, "sql-gate-server-shutdown"));

        LOGGER.info("sql-gate server started with {} tool(s); awaiting requests...", toolCount);
        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("sql-gate server interrupted; shutting down");
            shutdownHook.run();
        }
    }

    private McpServerFeatures.SyncToolSpecification toToolSpecification(Tool tool) {
        McpSchema.Tool descriptor = McpSchema.Tool.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(mcpJsonMapper, serializeSchema(tool))
                .build();
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(descriptor)
                .callHandler((exchange, request) -> executeTool(tool, request))
                .build();
    }

    private String serializeSchema(Tool tool) {
        JsonNode schema = tool.getInputSchema();
        if (schema == null) {
            throw new IllegalStateException("Tool " + tool.getName() + " must provide an input schema");
        }
        return schema.toString();
    }

    McpSchema.CallToolResult executeTool(Tool tool, McpSchema.CallToolRequest request) {
        JsonNode arguments = request.arguments() == null
                ? mapper.createObjectNode()
                : mapper.valueToTree(request.arguments());
        try {
            JsonNode result = tool.call(arguments);
            McpSchema.CallToolResult.Builder builder = McpSchema.CallToolResult.builder().isError(false);
            if (result == null || result.isNull()) {
                builder.addTextContent("null");
            } else {
                builder.structuredContent(mapper.convertValue(result, Object.class));
                builder.addTextContent(renderResultText(result));
            }
            return builder.build();
        } catch (Exception ex) {
            LOGGER.error("Tool '{}' execution failed", tool.getName(), ex);
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            return McpSchema.CallToolResult.builder()
                    .isError(true)
                    .addTextContent("Tool execution failed: " + message)
                    .build();
        }
    }

    private String renderResultText(JsonNode result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Falling back to toString for tool result", e);
            return result.toString();
        }
    }
}
