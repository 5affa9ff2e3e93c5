package com.telemetry.pipeline.ingest;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the ingestion queues and their consumers.
 *
 * @param queueCapacity   capacity of each of the two queues
 * @param batchSize       maximum number of items flushed in one bulk call
 * @param batchTimeout    how long a consumer waits for the first item, and how long a batch stays open after it
 * @param idleBackoff     pause after a wait that returned nothing
 * @param shutdownTimeout how long {@code stop()} waits for the consumers to finish
 */
public record IngestionConfig(
        int queueCapacity,
        int batchSize,
        Duration batchTimeout,
        Duration idleBackoff,
        Duration shutdownTimeout
) {
    public IngestionConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        requirePositive(batchTimeout, "batchTimeout");
        requirePositive(idleBackoff, "idleBackoff");
        requirePositive(shutdownTimeout, "shutdownTimeout");
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " is required");
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Default configuration: 50,000 items per queue, batches of 1,000, 1s batch timeout,
     * 100ms idle backoff, 5s shutdown timeout.
     */
    public static IngestionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int queueCapacity = 50_000;
        private int batchSize = 1_000;
        private Duration batchTimeout = Duration.ofSeconds(1);
        private Duration idleBackoff = Duration.ofMillis(100);
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder batchTimeout(Duration batchTimeout) {
            this.batchTimeout = batchTimeout;
            return this;
        }

        public Builder idleBackoff(Duration idleBackoff) {
            this.idleBackoff = idleBackoff;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public IngestionConfig build() {
            return new IngestionConfig(queueCapacity, batchSize, batchTimeout, idleBackoff, shutdownTimeout);
        }
    }
}
