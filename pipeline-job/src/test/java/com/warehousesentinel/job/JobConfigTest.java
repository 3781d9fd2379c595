package com.warehousesentinel.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should fall back to defaults when no variable is set")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromEnvironment(name -> null);

        assertThat(config.getProjectId()).isEmpty();
        assertThat(config.getDefinitionsPath()).isEmpty();
        assertThat(config.getRunMode()).isEqualTo(JobConfig.RunMode.ALL);
        assertThat(config.getAccountIds()).isEmpty();
        assertThat(config.getWorkerThreads()).isEqualTo(4);
        assertThat(config.getQueryTimeout()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.getUnitTimeout()).isEqualTo(Duration.ofSeconds(900));
        assertThat(config.getMaxRetries()).isEqualTo(3);
        assertThat(config.getRetryBackoff()).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    @DisplayName("Should read every variable from the environment")
    void shouldReadEnvironment() {
        Map<String, String> env = Map.of(
                "GCP_PROJECT_ID", "acme-analytics",
                "DEFINITIONS_PATH", "/etc/sentinel/definitions.yml",
                "RUN_MODE", "Monitors",
                "ACCOUNT_IDS", " acc-1, acc-2 ,,",
                "WORKER_THREADS", "8",
                "QUERY_TIMEOUT_SECONDS", "60",
                "QUERY_MAX_RETRIES", "0");

        JobConfig config = JobConfig.fromEnvironment(env::get);

        assertThat(config.getProjectId()).isEqualTo("acme-analytics");
        assertThat(config.getDefinitionsPath()).isEqualTo("/etc/sentinel/definitions.yml");
        assertThat(config.getRunMode()).isEqualTo(JobConfig.RunMode.MONITORS);
        assertThat(config.getAccountIds()).containsExactly("acc-1", "acc-2");
        assertThat(config.getWorkerThreads()).isEqualTo(8);
        assertThat(config.getQueryTimeout()).isEqualTo(Duration.ofMinutes(1));
        assertThat(config.getMaxRetries()).isZero();
    }

    @Test
    @DisplayName("Should reject a non-numeric worker count")
    void shouldRejectMalformedNumber() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of("WORKER_THREADS", "many")::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to parse numeric environment variable");
    }

    @Test
    @DisplayName("Should reject an unknown run mode")
    void shouldRejectUnknownRunMode() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of("RUN_MODE", "everything")::get))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown run mode: 'everything'");
    }

    @Test
    @DisplayName("Should validate ranges at build time")
    void shouldValidateRanges() {
        assertThatThrownBy(() -> new JobConfig.Builder().workerThreads(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads");
        assertThatThrownBy(() -> new JobConfig.Builder().queryTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("queryTimeout");
        assertThatThrownBy(() -> new JobConfig.Builder().maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRetries");
    }

    @Test
    @DisplayName("Should include only the selected stage unless running all")
    void shouldSelectStages() {
        assertThat(JobConfig.RunMode.ALL.includes(JobConfig.RunMode.REPORTS)).isTrue();
        assertThat(JobConfig.RunMode.REPORTS.includes(JobConfig.RunMode.REPORTS)).isTrue();
        assertThat(JobConfig.RunMode.REPORTS.includes(JobConfig.RunMode.MONITORS)).isFalse();
        assertThat(JobConfig.RunMode.fromString("superlatives").includes(JobConfig.RunMode.SUPERLATIVES)).isTrue();
        assertThat(JobConfig.RunMode.ALL.includes(JobConfig.RunMode.SUPERLATIVES)).isTrue();
    }
}
