package org.javai.runner;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One analysis to run: which capability, with which inputs, under which limits.
 *
 * <pre>{@code
 * RunRequest request = RunRequest.builder("code-review")
 *     .input("diff", diff)
 *     .cacheKey(prNumber)
 *     .timeout(Duration.ofMinutes(3))
 *     .build();
 * }</pre>
 */
public final class RunRequest {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String id;
    private final String capability;
    private final Map<String, String> inputs;
    private final Duration timeout;
    private final Long cacheKey;
    private final boolean force;

    private RunRequest(Builder builder) {
        this.capability = builder.capability;
        this.id = builder.id != null ? builder.id : capability + "-" + SEQUENCE.incrementAndGet();
        this.inputs = Map.copyOf(builder.inputs);
        this.timeout = builder.timeout;
        this.cacheKey = builder.cacheKey;
        this.force = builder.force;
    }

    public static Builder builder(String capability) {
        return new Builder(capability);
    }

    /**
     * Identifies the run in the process manager and in reports. Unique per runner.
     */
    public String id() {
        return id;
    }

    public String capability() {
        return capability;
    }

    public Map<String, String> inputs() {
        return inputs;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    public OptionalLong cacheKey() {
        return cacheKey == null ? OptionalLong.empty() : OptionalLong.of(cacheKey);
    }

    /**
     * Whether a cached result must be ignored.
     */
    public boolean force() {
        return force;
    }

    @Override
    public String toString() {
        return "RunRequest[" + id + ", capability=" + capability
                + (cacheKey != null ? ", cacheKey=" + cacheKey : "") + (force ? ", force" : "") + "]";
    }

    public static final class Builder {
        private final String capability;
        private final Map<String, String> inputs = new LinkedHashMap<>();
        private String id;
        private Duration timeout;
        private Long cacheKey;
        private boolean force;

        private Builder(String capability) {
            this.capability = Objects.requireNonNull(capability, "capability must not be null");
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder input(String name, String value) {
            this.inputs.put(name, value);
            return this;
        }

        public Builder inputs(Map<String, String> inputs) {
            this.inputs.putAll(inputs);
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder cacheKey(long cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public RunRequest build() {
            return new RunRequest(this);
        }
    }
}
