package com.umitunal.qworker.config;

import com.umitunal.qworker.ratelimit.RateLimitRule;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * Options shared by every worker of a process.
 */
public class WorkerConfig {
    public static final String RESOURCE_NAME = "qworker.properties";

    public static final String MAX_REQUEST_RETRIES = "qworker.max-request-retries";
    public static final String AGGREGATION_DELAY_SECONDS = "qworker.aggregation-delay-seconds";
    public static final String LOOP_IDLE_INTERVAL_SECONDS = "qworker.loop-idle-interval-seconds";
    public static final String LOOP_MAX_BATCH_SIZE = "qworker.loop-max-batch-size";
    public static final String QUARANTINE_DIRECTORY = "qworker.quarantine-directory";
    public static final String MIRROR_RATE_LIMIT_RULES = "qworker.mirror.rate-limit-rules";
    public static final String EMAIL_GATEWAY_PATTERN = "qworker.email-gateway-pattern";
    public static final String HOST_NAME = "qworker.host-name";

    private final int maxRequestRetries;
    private final Duration aggregationDelay;
    private final Duration loopIdleInterval;
    private final int loopMaxBatchSize;
    private final Path quarantineDirectory;
    private final List<RateLimitRule> mirrorRateLimitRules;
    private final String emailGatewayPattern;
    private final String hostName;

    private WorkerConfig(Builder builder) {
        this.maxRequestRetries = builder.maxRequestRetries;
        this.aggregationDelay = builder.aggregationDelay;
        this.loopIdleInterval = builder.loopIdleInterval;
        this.loopMaxBatchSize = builder.loopMaxBatchSize;
        this.quarantineDirectory = builder.quarantineDirectory;
        this.mirrorRateLimitRules = builder.mirrorRateLimitRules;
        this.emailGatewayPattern = builder.emailGatewayPattern;
        this.hostName = builder.hostName;
    }

    public int getMaxRequestRetries() { return maxRequestRetries; }
    public Duration getAggregationDelay() { return aggregationDelay; }
    public Duration getLoopIdleInterval() { return loopIdleInterval; }
    public int getLoopMaxBatchSize() { return loopMaxBatchSize; }
    public Path getQuarantineDirectory() { return quarantineDirectory; }
    public List<RateLimitRule> getMirrorRateLimitRules() { return mirrorRateLimitRules; }
    public String getEmailGatewayPattern() { return emailGatewayPattern; }
    public String getHostName() { return hostName; }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Load {@value #RESOURCE_NAME} from the classpath if present, then apply
     * JVM system properties with the same keys on top.
     */
    public static WorkerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = WorkerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("qworker.")) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return fromProperties(properties);
    }

    public static WorkerConfig fromProperties(Properties properties) {
        Builder builder = newBuilder();

        String value = properties.getProperty(MAX_REQUEST_RETRIES);
        if (value != null) {
            builder.withMaxRequestRetries(parseInt(MAX_REQUEST_RETRIES, value));
        }
        value = properties.getProperty(AGGREGATION_DELAY_SECONDS);
        if (value != null) {
            builder.withAggregationDelay(Duration.ofSeconds(parseInt(AGGREGATION_DELAY_SECONDS, value)));
        }
        value = properties.getProperty(LOOP_IDLE_INTERVAL_SECONDS);
        if (value != null) {
            builder.withLoopIdleInterval(Duration.ofSeconds(parseInt(LOOP_IDLE_INTERVAL_SECONDS, value)));
        }
        value = properties.getProperty(LOOP_MAX_BATCH_SIZE);
        if (value != null) {
            builder.withLoopMaxBatchSize(parseInt(LOOP_MAX_BATCH_SIZE, value));
        }
        value = properties.getProperty(QUARANTINE_DIRECTORY);
        if (value != null && !value.isBlank()) {
            builder.withQuarantineDirectory(Paths.get(value.trim()));
        }
        value = properties.getProperty(MIRROR_RATE_LIMIT_RULES);
        if (value != null) {
            try {
                builder.withMirrorRateLimitRules(RateLimitRule.parseRules(value));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for " + MIRROR_RATE_LIMIT_RULES + ": " + value, e);
            }
        }
        value = properties.getProperty(EMAIL_GATEWAY_PATTERN);
        if (value != null) {
            builder.withEmailGatewayPattern(value.trim());
        }
        value = properties.getProperty(HOST_NAME);
        if (value != null && !value.isBlank()) {
            builder.withHostName(value.trim());
        }

        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public static class Builder {
        private int maxRequestRetries = 3;
        private Duration aggregationDelay = Duration.ofSeconds(5);
        private Duration loopIdleInterval = Duration.ofSeconds(1);
        private int loopMaxBatchSize = 1000;
        private Path quarantineDirectory = Paths.get("var", "queue_error");
        private List<RateLimitRule> mirrorRateLimitRules = List.of(new RateLimitRule(60, 50));
        private String emailGatewayPattern = "";
        private String hostName = "localhost";

        private Builder() {
        }

        /**
         * Retries after the first attempt before a job is quarantined.
         * Default: 3
         */
        public Builder withMaxRequestRetries(int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException(MAX_REQUEST_RETRIES + " must be >= 0: " + retries);
            }
            this.maxRequestRetries = retries;
            return this;
        }

        /**
         * Window of a deferred aggregation, anchored at the first event of a key.
         * Default: 5 seconds
         */
        public Builder withAggregationDelay(Duration delay) {
            if (delay.isNegative()) {
                throw new IllegalArgumentException(AGGREGATION_DELAY_SECONDS + " must be >= 0: " + delay);
            }
            this.aggregationDelay = delay;
            return this;
        }

        /**
         * Sleep of a loop worker when its queue was empty.
         * Default: 1 second
         */
        public Builder withLoopIdleInterval(Duration interval) {
            if (interval.isNegative()) {
                throw new IllegalArgumentException(LOOP_IDLE_INTERVAL_SECONDS + " must be >= 0: " + interval);
            }
            this.loopIdleInterval = interval;
            return this;
        }

        /**
         * Upper bound on the jobs a loop worker hands to one batch.
         * Default: 1000
         */
        public Builder withLoopMaxBatchSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException(LOOP_MAX_BATCH_SIZE + " must be positive: " + size);
            }
            this.loopMaxBatchSize = size;
            return this;
        }

        /**
         * Directory holding the per-queue {@code .errors} files.
         * Default: var/queue_error
         */
        public Builder withQuarantineDirectory(Path directory) {
            this.quarantineDirectory = directory;
            return this;
        }

        public Builder withMirrorRateLimitRules(List<RateLimitRule> rules) {
            this.mirrorRateLimitRules = List.copyOf(rules);
            return this;
        }

        /**
         * Address pattern of the inbound mail gateway, e.g. {@code %s@example.com}.
         * Empty disables the missed-message bypass.
         */
        public Builder withEmailGatewayPattern(String pattern) {
            this.emailGatewayPattern = pattern;
            return this;
        }

        public Builder withHostName(String hostName) {
            this.hostName = hostName;
            return this;
        }

        public WorkerConfig build() {
            return new WorkerConfig(this);
        }
    }
}
