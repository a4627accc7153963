package automata.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Configuration holder for the engine.
 * All settings have sensible defaults.
 */
public final class EngineConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/automata;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;
    private boolean skipLocked = false;

    // Worker settings
    private String workerId = defaultWorkerId();
    private Duration pollInterval = Duration.ofSeconds(30);
    private int batchSize = 10;
    private Duration claimTimeout = Duration.ofMinutes(15);
    private Duration dueSoonWindow = Duration.ofHours(1);
    private Duration maxBackoff = Duration.ofHours(1);

    // Cleanup settings
    private int retentionDays = 30;
    private int executionHistoryCap = 100;

    // Action settings
    private Duration actionTimeout = Duration.ofMinutes(10);
    private Duration webhookTimeout = Duration.ofSeconds(30);
    private String defaultModel = "claude-3-5-sonnet-20241022";
    private int logTruncateLength = 500;
    private int scrapeContentLimit = 10_000;

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        EngineConfig config = new EngineConfig();

        String dbUrl = System.getenv("AUTOMATA_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.withDatabaseUrl(dbUrl);
        }

        String pollMs = System.getenv("AUTOMATA_POLL_INTERVAL_MS");
        if (pollMs != null && !pollMs.isBlank()) {
            config.pollInterval = Duration.ofMillis(Long.parseLong(pollMs));
        }

        String batch = System.getenv("AUTOMATA_BATCH_SIZE");
        if (batch != null && !batch.isBlank()) {
            config.batchSize = Integer.parseInt(batch);
        }

        String retention = System.getenv("AUTOMATA_RETENTION_DAYS");
        if (retention != null && !retention.isBlank()) {
            config.retentionDays = Integer.parseInt(retention);
        }

        String historyCap = System.getenv("AUTOMATA_EXECUTION_HISTORY_CAP");
        if (historyCap != null && !historyCap.isBlank()) {
            config.executionHistoryCap = Integer.parseInt(historyCap);
        }

        String workerId = System.getenv("AUTOMATA_WORKER_ID");
        if (workerId != null && !workerId.isBlank()) {
            config.workerId = workerId;
        }

        config.validate();
        return config;
    }

    /**
     * Loads settings from an INI file with optional sections
     * [database], [worker], [cleanup] and [actions]. Missing keys keep their defaults.
     */
    public static EngineConfig fromIni(File file) throws IOException {
        Ini ini = new Ini(file);
        EngineConfig config = new EngineConfig();

        Profile.Section db = ini.get("database");
        if (db != null) {
            String url = opt(db, "url");
            if (url != null) {
                config.withDatabaseUrl(url);
            }
            config.databasePoolSize = optInt(db, "pool_size", config.databasePoolSize);
            String skip = opt(db, "skip_locked");
            if (skip != null) {
                config.skipLocked = Boolean.parseBoolean(skip);
            }
        }

        Profile.Section worker = ini.get("worker");
        if (worker != null) {
            String id = opt(worker, "id");
            if (id != null) {
                config.workerId = id;
            }
            config.pollInterval = Duration.ofMillis(optLong(worker, "poll_interval_ms", config.pollInterval.toMillis()));
            config.batchSize = optInt(worker, "batch_size", config.batchSize);
            config.claimTimeout = Duration.ofMillis(optLong(worker, "claim_timeout_ms", config.claimTimeout.toMillis()));
            config.maxBackoff = Duration.ofMillis(optLong(worker, "max_backoff_ms", config.maxBackoff.toMillis()));
        }

        Profile.Section cleanup = ini.get("cleanup");
        if (cleanup != null) {
            config.retentionDays = optInt(cleanup, "retention_days", config.retentionDays);
            config.executionHistoryCap = optInt(cleanup, "execution_history_cap", config.executionHistoryCap);
        }

        Profile.Section actions = ini.get("actions");
        if (actions != null) {
            config.actionTimeout = Duration.ofMillis(optLong(actions, "timeout_ms", config.actionTimeout.toMillis()));
            config.webhookTimeout = Duration.ofMillis(
                    optLong(actions, "webhook_timeout_ms", config.webhookTimeout.toMillis()));
            String model = opt(actions, "default_model");
            if (model != null) {
                config.defaultModel = model;
            }
            config.logTruncateLength = optInt(actions, "log_truncate_length", config.logTruncateLength);
            config.scrapeContentLimit = optInt(actions, "scrape_content_limit", config.scrapeContentLimit);
        }

        config.validate();
        return config;
    }

    /**
     * A claim must outlive the longest action, otherwise another worker can pick the task up
     * while it is still running.
     *
     * @throws IllegalArgumentException if the action timeout is not shorter than the claim timeout
     */
    public EngineConfig validate() {
        if (actionTimeout.compareTo(claimTimeout) >= 0) {
            throw new IllegalArgumentException("Action timeout (" + actionTimeout.toMillis()
                    + "ms) must be shorter than claim timeout (" + claimTimeout.toMillis() + "ms)");
        }
        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    /** Whether due-task selection adds FOR UPDATE SKIP LOCKED (PostgreSQL). */
    public boolean skipLocked() {
        return skipLocked;
    }

    public String workerId() {
        return workerId;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration claimTimeout() {
        return claimTimeout;
    }

    public Duration dueSoonWindow() {
        return dueSoonWindow;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    public int retentionDays() {
        return retentionDays;
    }

    public int executionHistoryCap() {
        return executionHistoryCap;
    }

    public Duration actionTimeout() {
        return actionTimeout;
    }

    public Duration webhookTimeout() {
        return webhookTimeout;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public int logTruncateLength() {
        return logTruncateLength;
    }

    public int scrapeContentLimit() {
        return scrapeContentLimit;
    }

    // Fluent setters for testing/customization; they modify this instance
    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        this.skipLocked = url.startsWith("jdbc:postgresql:");
        return this;
    }

    public EngineConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public EngineConfig withBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public EngineConfig withWorkerId(String workerId) {
        this.workerId = workerId;
        return this;
    }

    public EngineConfig withClaimTimeout(Duration claimTimeout) {
        this.claimTimeout = claimTimeout;
        return this;
    }

    public EngineConfig withExecutionHistoryCap(int cap) {
        this.executionHistoryCap = cap;
        return this;
    }

    public EngineConfig withRetentionDays(int days) {
        this.retentionDays = days;
        return this;
    }

    public EngineConfig withActionTimeout(Duration timeout) {
        this.actionTimeout = timeout;
        return this;
    }

    public EngineConfig withDefaultModel(String model) {
        this.defaultModel = model;
        return this;
    }

    private static String defaultWorkerId() {
        String jvm = ManagementFactory.getRuntimeMXBean().getName();
        return "worker-" + ((jvm != null && !jvm.isBlank()) ? jvm : "local");
    }

    private static String opt(Profile.Section s, String key) {
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static int optInt(Profile.Section s, String key, int def) {
        String v = opt(s, key);
        return v == null ? def : Integer.parseInt(v);
    }

    private static long optLong(Profile.Section s, String key, long def) {
        String v = opt(s, key);
        return v == null ? def : Long.parseLong(v);
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", workerId='" + workerId + '\'' +
                ", pollIntervalMs=" + pollInterval.toMillis() +
                ", batchSize=" + batchSize +
                ", skipLocked=" + skipLocked +
                '}';
    }
}
