package com.example.sqlgate.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GateConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledDefaultsApplyWithoutFile() throws Exception {
        GateConfig config = GateConfig.load(null, Map.of(), new Properties());

        assertEquals("", config.protectedTables());
        assertEquals(1000, config.rowCountThresholdMediumHigh());
        assertEquals(Duration.ofMinutes(5), config.approvalTimeout());
        assertEquals(BackendType.TRANSACTIONAL_ENGINE, config.backend());
        assertEquals("h2", config.dialect());
        assertEquals(Path.of("runs"), config.auditDir());
        assertEquals(Path.of("locks"), config.lockDir());
        assertEquals(Duration.ofSeconds(30), config.lockTimeout());
    }

    @Test
    void fileThenEnvironmentThenSystemPropertiesOverride() throws Exception {
        Path file = tempDir.resolve("gate.properties");
        Files.writeString(file, String.join("\n",
                "protected_tables=users",
                "row_count_threshold_medium_high=50",
                "backend=sqlite-like",
                "approval_timeout=10s"), StandardCharsets.UTF_8);
        Properties system = new Properties();
        system.setProperty("sqlgate.approval_timeout", "PT2M");

        GateConfig config = GateConfig.load(file,
                Map.of("SQLGATE_ROW_COUNT_THRESHOLD_MEDIUM_HIGH", "75", "SQLGATE_APPROVAL_TIMEOUT", "1h"),
                system);

        assertEquals("users", config.protectedTables());
        assertEquals(75, config.rowCountThresholdMediumHigh());
        assertEquals(BackendType.SQLITE_LIKE, config.backend());
        assertEquals(Duration.ofMinutes(2), config.approvalTimeout());
    }

    @Test
    void parsesShortAndIsoDurations() {
        assertEquals(Duration.ofMillis(500), GateConfig.parseDuration("500ms", "k"));
        assertEquals(Duration.ofSeconds(45), GateConfig.parseDuration("45", "k"));
        assertEquals(Duration.ofMinutes(5), GateConfig.parseDuration(" 5m ", "k"));
        assertEquals(Duration.ofHours(2), GateConfig.parseDuration("2h", "k"));
        assertEquals(Duration.ofSeconds(90), GateConfig.parseDuration("pt90s", "k"));
        assertThrows(IllegalArgumentException.class, () -> GateConfig.parseDuration("soon", "k"));
        assertThrows(IllegalArgumentException.class, () -> GateConfig.parseDuration("", "k"));
    }

    @Test
    void rejectsInvalidValues() {
        Properties negative = new Properties();
        negative.setProperty(GateConfig.ROW_COUNT_THRESHOLD, "-1");
        assertThrows(IllegalArgumentException.class, () -> GateConfig.fromProperties(negative));

        Properties zeroTimeout = new Properties();
        zeroTimeout.setProperty(GateConfig.APPROVAL_TIMEOUT, "0s");
        assertThrows(IllegalArgumentException.class, () -> GateConfig.fromProperties(zeroTimeout));

        Properties backend = new Properties();
        backend.setProperty(GateConfig.BACKEND, "oracle-flashback");
        assertThrows(IllegalArgumentException.class, () -> GateConfig.fromProperties(backend));
    }
}
