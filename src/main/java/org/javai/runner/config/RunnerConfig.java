package org.javai.runner.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;
import org.javai.runner.retry.RetryPolicy;

import java.time.Duration;
import java.util.List;

/**
 * Runner configuration as loaded from YAML. Missing sections and fields take defaults.
 *
 * <pre>{@code
 * claude:
 *   binary: claude
 *   timeout_seconds: 300
 *   skip_permissions: true
 * retry:
 *   max_retries: 3
 * cache:
 *   enabled: true
 *   ttl_hours: 24
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunnerConfig(ClaudeSettings claude, RetrySettings retry, CacheSettings cache) {

    public RunnerConfig {
        claude = claude == null ? ClaudeSettings.defaults() : claude;
        retry = retry == null ? RetrySettings.defaults() : retry;
        cache = cache == null ? CacheSettings.defaults() : cache;
    }

    public static RunnerConfig defaults() {
        return new RunnerConfig(null, null, null);
    }

    /**
     * @throws RunnerException {@link RunnerError#INVALID_CONFIG} naming the first bad field
     */
    public RunnerConfig validate() throws RunnerException {
        if (claude.binary().isBlank()) {
            throw invalid("claude.binary", claude.binary(), "must not be blank");
        }
        if (claude.timeoutSeconds() <= 0) {
            throw invalid("claude.timeout_seconds", claude.timeoutSeconds(), "must be positive");
        }
        if (claude.maxOutputBytes() < 0) {
            throw invalid("claude.max_output_bytes", claude.maxOutputBytes(), "must not be negative");
        }
        if (retry.maxRetries() < 0) {
            throw invalid("retry.max_retries", retry.maxRetries(), "must not be negative");
        }
        if (retry.initialDelayMillis() < 0 || retry.maxDelayMillis() < 0) {
            throw invalid("retry.initial_delay_millis", retry.initialDelayMillis(), "delays must not be negative");
        }
        if (retry.multiplier() < 1.0) {
            throw invalid("retry.multiplier", retry.multiplier(), "must be at least 1.0");
        }
        if (cache.ttlHours() <= 0) {
            throw invalid("cache.ttl_hours", cache.ttlHours(), "must be positive");
        }
        return this;
    }

    private static RunnerException invalid(String field, Object value, String problem) {
        return new RunnerException(RunnerError.INVALID_CONFIG,
                "invalid configuration: " + field + "=" + value + " " + problem);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClaudeSettings(String binary, Integer timeoutSeconds, Boolean skipPermissions,
                                 List<String> extraArgs, Long maxOutputBytes) {

        public static final String DEFAULT_BINARY = "claude";
        public static final int DEFAULT_TIMEOUT_SECONDS = 300;

        public ClaudeSettings {
            binary = binary == null ? DEFAULT_BINARY : binary;
            timeoutSeconds = timeoutSeconds == null ? DEFAULT_TIMEOUT_SECONDS : timeoutSeconds;
            skipPermissions = skipPermissions != null && skipPermissions;
            extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
            maxOutputBytes = maxOutputBytes == null ? 0L : maxOutputBytes;
        }

        public static ClaudeSettings defaults() {
            return new ClaudeSettings(null, null, null, null, null);
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }

        ClaudeSettings withBinary(String binary) {
            return new ClaudeSettings(binary, timeoutSeconds, skipPermissions, extraArgs, maxOutputBytes);
        }

        ClaudeSettings withTimeoutSeconds(int timeoutSeconds) {
            return new ClaudeSettings(binary, timeoutSeconds, skipPermissions, extraArgs, maxOutputBytes);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetrySettings(Integer maxRetries, Long initialDelayMillis, Long maxDelayMillis, Double multiplier) {

        public RetrySettings {
            RetryPolicy d = RetryPolicy.defaults();
            maxRetries = maxRetries == null ? d.maxRetries() : maxRetries;
            initialDelayMillis = initialDelayMillis == null ? d.initialDelay().toMillis() : initialDelayMillis;
            maxDelayMillis = maxDelayMillis == null ? d.maxDelay().toMillis() : maxDelayMillis;
            multiplier = multiplier == null ? d.multiplier() : multiplier;
        }

        public static RetrySettings defaults() {
            return new RetrySettings(null, null, null, null);
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxRetries, Duration.ofMillis(initialDelayMillis),
                    Duration.ofMillis(maxDelayMillis), multiplier);
        }
    }

    /**
     * @param dir cache directory; relative paths resolve against the work directory, null
     *            means {@code ~/.analysis-runner/cache}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CacheSettings(Boolean enabled, String dir, Integer ttlHours) {

        public CacheSettings {
            enabled = enabled == null || enabled;
            ttlHours = ttlHours == null ? 24 : ttlHours;
        }

        public static CacheSettings defaults() {
            return new CacheSettings(null, null, null);
        }

        public Duration ttl() {
            return Duration.ofHours(ttlHours);
        }

        CacheSettings withDir(String dir) {
            return new CacheSettings(enabled, dir, ttlHours);
        }
    }

    RunnerConfig withClaude(ClaudeSettings claude) {
        return new RunnerConfig(claude, retry, cache);
    }

    RunnerConfig withCache(CacheSettings cache) {
        return new RunnerConfig(claude, retry, cache);
    }
}
