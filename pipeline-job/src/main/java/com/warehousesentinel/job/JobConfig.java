package com.warehousesentinel.job;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Typed, immutable configuration of a pipeline run.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * a scheduled container or a shell can configure the job without flags.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code GCP_PROJECT_ID}: BigQuery project; blank uses the client
 * default</li>
 * <li>{@code DEFINITIONS_PATH}: YAML definitions file; blank uses the
 * classpath {@code definitions.yml}</li>
 * <li>{@code RUN_MODE}: {@code entities}, {@code reports},
 * {@code superlatives}, {@code monitors} or {@code all} (default)</li>
 * <li>{@code ACCOUNT_IDS}: comma-separated account scope for reports and
 * superlatives</li>
 * <li>{@code WORKER_THREADS} (4), {@code QUERY_TIMEOUT_SECONDS} (300),
 * {@code UNIT_TIMEOUT_SECONDS} (900), {@code QUERY_MAX_RETRIES} (3),
 * {@code QUERY_RETRY_BACKOFF_MS} (1000)</li>
 * </ul>
 *
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    /**
     * Stages a run executes.
     */
    public enum RunMode {
        ENTITIES, REPORTS, SUPERLATIVES, MONITORS, ALL;

        public static RunMode fromString(String value) {
            Objects.requireNonNull(value, "Run mode must not be null");
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown run mode: '" + value
                        + "'. Supported: entities, reports, superlatives, monitors, all", e);
            }
        }

        public boolean includes(RunMode stage) {
            return this == ALL || this == stage;
        }
    }

    // ---------------------------------------------------------------
    // Warehouse
    // ---------------------------------------------------------------
    private final String projectId;
    private final Duration queryTimeout;
    private final int maxRetries;
    private final Duration retryBackoff;

    // ---------------------------------------------------------------
    // Definitions
    // ---------------------------------------------------------------
    private final String definitionsPath;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final RunMode runMode;
    private final List<String> accountIds;
    private final int workerThreads;
    private final Duration unitTimeout;

    private JobConfig(Builder b) {
        this.projectId = b.projectId;
        this.queryTimeout = b.queryTimeout;
        this.maxRetries = b.maxRetries;
        this.retryBackoff = b.retryBackoff;
        this.definitionsPath = b.definitionsPath;
        this.runMode = b.runMode;
        this.accountIds = List.copyOf(b.accountIds);
        this.workerThreads = b.workerThreads;
        this.unitTimeout = b.unitTimeout;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static JobConfig fromEnvironment(UnaryOperator<String> lookup) {
        try {
            return new Builder()
                    .projectId(env(lookup, "GCP_PROJECT_ID", ""))
                    .definitionsPath(env(lookup, "DEFINITIONS_PATH", ""))
                    .runMode(RunMode.fromString(env(lookup, "RUN_MODE", "all")))
                    .accountIds(parseList(env(lookup, "ACCOUNT_IDS", "")))
                    .workerThreads(Integer.parseInt(env(lookup, "WORKER_THREADS", "4")))
                    .queryTimeout(Duration.ofSeconds(Long.parseLong(env(lookup, "QUERY_TIMEOUT_SECONDS", "300"))))
                    .unitTimeout(Duration.ofSeconds(Long.parseLong(env(lookup, "UNIT_TIMEOUT_SECONDS", "900"))))
                    .maxRetries(Integer.parseInt(env(lookup, "QUERY_MAX_RETRIES", "3")))
                    .retryBackoff(Duration.ofMillis(Long.parseLong(env(lookup, "QUERY_RETRY_BACKOFF_MS", "1000"))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return the BigQuery project, or an empty string for the client default
     */
    public String getProjectId() {
        return projectId;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public String getDefinitionsPath() {
        return definitionsPath;
    }

    public RunMode getRunMode() {
        return runMode;
    }

    public List<String> getAccountIds() {
        return accountIds;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Duration getUnitTimeout() {
        return unitTimeout;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (worker threads &gt; 0, positive timeouts, non-negative retry
     * settings).
     * </p>
     */
    public static class Builder {
        private String projectId = "";
        private Duration queryTimeout = Duration.ofSeconds(300);
        private int maxRetries = 3;
        private Duration retryBackoff = Duration.ofSeconds(1);
        private String definitionsPath = "";
        private RunMode runMode = RunMode.ALL;
        private List<String> accountIds = List.of();
        private int workerThreads = 4;
        private Duration unitTimeout = Duration.ofSeconds(900);

        public Builder projectId(String v) {
            this.projectId = v;
            return this;
        }

        public Builder queryTimeout(Duration v) {
            this.queryTimeout = v;
            return this;
        }

        public Builder maxRetries(int v) {
            this.maxRetries = v;
            return this;
        }

        public Builder retryBackoff(Duration v) {
            this.retryBackoff = v;
            return this;
        }

        public Builder definitionsPath(String v) {
            this.definitionsPath = v;
            return this;
        }

        public Builder runMode(RunMode v) {
            this.runMode = v;
            return this;
        }

        public Builder accountIds(List<String> v) {
            this.accountIds = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder unitTimeout(Duration v) {
            this.unitTimeout = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(projectId, "projectId required");
            Objects.requireNonNull(definitionsPath, "definitionsPath required");
            Objects.requireNonNull(runMode, "runMode required");
            Objects.requireNonNull(accountIds, "accountIds required");
            requirePositive(queryTimeout, "queryTimeout");
            requirePositive(unitTimeout, "unitTimeout");
            Objects.requireNonNull(retryBackoff, "retryBackoff required");

            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
            }
            if (retryBackoff.isNegative()) {
                throw new IllegalArgumentException("retryBackoff must not be negative, got: " + retryBackoff);
            }

            return new JobConfig(this);
        }

        private static void requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(UnaryOperator<String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "projectId='" + projectId + '\'' +
                ", definitionsPath='" + definitionsPath + '\'' +
                ", runMode=" + runMode +
                ", accountIds=" + accountIds +
                ", workerThreads=" + workerThreads +
                ", queryTimeout=" + queryTimeout +
                ", unitTimeout=" + unitTimeout +
                ", maxRetries=" + maxRetries +
                ", retryBackoff=" + retryBackoff +
                '}';
    }
}
