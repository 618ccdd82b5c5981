package com.property.reconciliation.api;

import java.time.Duration;

/**
 * Tunables for the reconcile loop and the stats snapshot.
 */
public class ReconciliationOptions {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_RETRY_BACKOFF_MS = 5;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STATS_TTL = Duration.ofSeconds(30);

    private final int maxRetries;
    private final long retryBackoffMs;
    private final Duration timeout;
    private final Duration statsTtl;

    private ReconciliationOptions(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.retryBackoffMs = builder.retryBackoffMs;
        this.timeout = builder.timeout;
        this.statsTtl = builder.statsTtl;
    }

    /**
     * Conflicting writes tolerated before a reconcile gives up.
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Base pause between attempts; grows linearly with the attempt number.
     */
    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getStatsTtl() {
        return statsTtl;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long retryBackoffMs = DEFAULT_RETRY_BACKOFF_MS;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration statsTtl = DEFAULT_STATS_TTL;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder statsTtl(Duration statsTtl) {
            this.statsTtl = statsTtl;
            return this;
        }

        public ReconciliationOptions build() {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must be >= 0");
            }
            if (retryBackoffMs < 0) {
                throw new IllegalArgumentException("retryBackoffMs must be >= 0");
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            if (statsTtl == null || statsTtl.isNegative() || statsTtl.isZero()) {
                throw new IllegalArgumentException("statsTtl must be positive");
            }
            return new ReconciliationOptions(this);
        }
    }
}
