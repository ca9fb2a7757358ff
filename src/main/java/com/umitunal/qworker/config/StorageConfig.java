package com.umitunal.qworker.config;

import com.umitunal.qworker.serialization.PayloadFormat;

import java.time.Duration;

/**
 * Configuration for the RocksDB-backed queue client.
 */
public class StorageConfig {
    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int backgroundThreads;
    private final PayloadFormat payloadFormat;
    private final Duration pollInterval;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.backgroundThreads = builder.backgroundThreads;
        this.payloadFormat = builder.payloadFormat;
        this.pollInterval = builder.pollInterval;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public PayloadFormat getPayloadFormat() { return payloadFormat; }
    public Duration getPollInterval() { return pollInterval; }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = true;
        private int memoryBufferSizeMB = 16;
        private int backgroundThreads = 2;
        private PayloadFormat payloadFormat = PayloadFormat.JSON;
        private Duration pollInterval = Duration.ofMillis(100);

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Sync the write-ahead log on every publish and delete.
         * Slower, but a published job survives a crash.
         * Default: true
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memory buffer size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Set number of background flush/compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Encoding of stored payloads.
         * Default: JSON
         */
        public Builder withPayloadFormat(PayloadFormat format) {
            this.payloadFormat = format;
            return this;
        }

        /**
         * How long the consumption loop waits when every registered queue is empty.
         * Default: 100 ms
         */
        public Builder withPollInterval(Duration interval) {
            this.pollInterval = interval;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
