package com.example.sqlgate.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gate settings. Values are layered: bundled {@code sql-gate.properties}, then an optional
 * file, then {@code SQLGATE_<KEY>} environment variables, then {@code -Dsqlgate.<key>} system
 * properties.
 */
public record GateConfig(
        String protectedTables,
        long rowCountThresholdMediumHigh,
        Duration approvalTimeout,
        BackendType backend,
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        String dialect,
        Path auditDir,
        Path snapshotDir,
        Path approvalDir,
        Path lockDir,
        Duration lockTimeout,
        Duration dryRunTimeout
) {
    public static final String PROTECTED_TABLES = "protected_tables";
    public static final String ROW_COUNT_THRESHOLD = "row_count_threshold_medium_high";
    public static final String APPROVAL_TIMEOUT = "approval_timeout";
    public static final String BACKEND = "backend";
    public static final String JDBC_URL = "jdbc_url";
    public static final String JDBC_USER = "jdbc_user";
    public static final String JDBC_PASSWORD = "jdbc_password";
    public static final String DIALECT = "dialect";
    public static final String AUDIT_DIR = "audit_dir";
    public static final String SNAPSHOT_DIR = "snapshot_dir";
    public static final String APPROVAL_DIR = "approval_dir";
    public static final String LOCK_DIR = "lock_dir";
    public static final String LOCK_TIMEOUT = "lock_timeout";
    public static final String DRY_RUN_TIMEOUT = "dry_run_timeout";

    private static final String DEFAULTS_RESOURCE = "/sql-gate.properties";
    private static final String SYSTEM_PREFIX = "sqlgate.";
    private static final String ENV_PREFIX = "SQLGATE_";
    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");

    public GateConfig {
        if (rowCountThresholdMediumHigh < 0) {
            throw new IllegalArgumentException(ROW_COUNT_THRESHOLD + " must not be negative");
        }
        requirePositive(approvalTimeout, APPROVAL_TIMEOUT);
        requirePositive(lockTimeout, LOCK_TIMEOUT);
        requirePositive(dryRunTimeout, DRY_RUN_TIMEOUT);
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException(JDBC_URL + " is required");
        }
    }

    public static GateConfig load(Path file) throws IOException {
        return load(file, System.getenv(), System.getProperties());
    }

    static GateConfig load(Path file, Map<String, String> env, Properties systemProperties) throws IOException {
        Properties merged = bundledDefaults();
        if (file != null) {
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                Properties fromFile = new Properties();
                fromFile.load(reader);
                merged.putAll(fromFile);
            }
        }
        for (String key : merged.stringPropertyNames()) {
            String envValue = env.get(ENV_PREFIX + key.toUpperCase(Locale.ROOT));
            if (envValue != null) {
                merged.setProperty(key, envValue);
            }
            String sysValue = systemProperties.getProperty(SYSTEM_PREFIX + key);
            if (sysValue != null) {
                merged.setProperty(key, sysValue);
            }
        }
        return fromProperties(merged);
    }

    /**
     * Builds a config from explicit properties layered over the bundled defaults.
     */
    public static GateConfig fromProperties(Properties properties) {
        Properties merged = bundledDefaults();
        merged.putAll(properties);
        return new GateConfig(
                merged.getProperty(PROTECTED_TABLES, ""),
                parseLong(merged.getProperty(ROW_COUNT_THRESHOLD, "1000"), ROW_COUNT_THRESHOLD),
                parseDuration(merged.getProperty(APPROVAL_TIMEOUT, "5m"), APPROVAL_TIMEOUT),
                BackendType.fromKey(merged.getProperty(BACKEND, "transactional-engine")),
                merged.getProperty(JDBC_URL),
                merged.getProperty(JDBC_USER, ""),
                merged.getProperty(JDBC_PASSWORD, ""),
                merged.getProperty(DIALECT, "h2"),
                Path.of(merged.getProperty(AUDIT_DIR, "runs")),
                Path.of(merged.getProperty(SNAPSHOT_DIR, "snapshots")),
                Path.of(merged.getProperty(APPROVAL_DIR, "approvals")),
                Path.of(merged.getProperty(LOCK_DIR, "locks")),
                parseDuration(merged.getProperty(LOCK_TIMEOUT, "30s"), LOCK_TIMEOUT),
                parseDuration(merged.getProperty(DRY_RUN_TIMEOUT, "30s"), DRY_RUN_TIMEOUT)
        );
    }

    /**
     * Accepts ISO-8601 ({@code PT5M}) or the short forms {@code 500ms}, {@code 30s}, {@code 5m},
     * {@code 2h}; a bare number means seconds.
     */
    public static Duration parseDuration(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " must not be empty");
        }
        String trimmed = value.trim();
        if (trimmed.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException(key + " is not a valid duration: " + value, e);
            }
        }
        Matcher matcher = SHORT_DURATION.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException(key + " is not a valid duration: " + value);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "s" : matcher.group(2);
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            default -> Duration.ofSeconds(amount);
        };
    }

    private static long parseLong(String value, String key) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + value, e);
        }
    }

    private static void requirePositive(Duration duration, String key) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(key + " must be a positive duration");
        }
    }

    private static Properties bundledDefaults() {
        Properties defaults = new Properties();
        try (InputStream in = GateConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                defaults.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read bundled " + DEFAULTS_RESOURCE, e);
        }
        return defaults;
    }
}
