package com.umitunal.leasejob.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Polling, concurrency and lease settings for a scheduler instance.
 * <p>
 * Every option is required; there are no implicit defaults.
 * <ul>
 *   <li>{@code processEvery} - poll tick interval in milliseconds</li>
 *   <li>{@code defaultConcurrency} - max simultaneous executions per job name</li>
 *   <li>{@code maxConcurrency} - max simultaneous executions across all names</li>
 *   <li>{@code defaultLockLimit} - max jobs of one name claimed per tick</li>
 *   <li>{@code lockLimit} - max jobs claimed per tick across all names</li>
 *   <li>{@code defaultLockLifetime} - lease duration in milliseconds</li>
 * </ul>
 */
public class SchedulerConfig {
    private final long processEvery;
    private final int defaultConcurrency;
    private final int maxConcurrency;
    private final int defaultLockLimit;
    private final int lockLimit;
    private final long defaultLockLifetime;

    private SchedulerConfig(Builder builder) {
        this.processEvery = builder.processEvery;
        this.defaultConcurrency = builder.defaultConcurrency;
        this.maxConcurrency = builder.maxConcurrency;
        this.defaultLockLimit = builder.defaultLockLimit;
        this.lockLimit = builder.lockLimit;
        this.defaultLockLifetime = builder.defaultLockLifetime;
    }

    public long getProcessEvery() { return processEvery; }
    public int getDefaultConcurrency() { return defaultConcurrency; }
    public int getMaxConcurrency() { return maxConcurrency; }
    public int getDefaultLockLimit() { return defaultLockLimit; }
    public int getLockLimit() { return lockLimit; }
    public long getDefaultLockLifetime() { return defaultLockLifetime; }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format(
            "SchedulerConfig{processEvery=%d, defaultConcurrency=%d, maxConcurrency=%d, "
                + "defaultLockLimit=%d, lockLimit=%d, defaultLockLifetime=%d}",
            processEvery, defaultConcurrency, maxConcurrency,
            defaultLockLimit, lockLimit, defaultLockLifetime
        );
    }

    public static class Builder {
        private long processEvery = -1;
        private int defaultConcurrency = -1;
        private int maxConcurrency = -1;
        private int defaultLockLimit = -1;
        private int lockLimit = -1;
        private long defaultLockLifetime = -1;

        private Builder() {
        }

        public Builder processEvery(long millis) {
            this.processEvery = positive("processEvery", millis);
            return this;
        }

        public Builder defaultConcurrency(int count) {
            this.defaultConcurrency = (int) positive("defaultConcurrency", count);
            return this;
        }

        public Builder maxConcurrency(int count) {
            this.maxConcurrency = (int) positive("maxConcurrency", count);
            return this;
        }

        public Builder defaultLockLimit(int count) {
            this.defaultLockLimit = (int) positive("defaultLockLimit", count);
            return this;
        }

        public Builder lockLimit(int count) {
            this.lockLimit = (int) positive("lockLimit", count);
            return this;
        }

        public Builder defaultLockLifetime(long millis) {
            this.defaultLockLifetime = positive("defaultLockLifetime", millis);
            return this;
        }

        /**
         * @throws IllegalStateException if any option was never set
         */
        public SchedulerConfig build() {
            List<String> missing = new ArrayList<>();
            if (processEvery < 0) missing.add("processEvery");
            if (defaultConcurrency < 0) missing.add("defaultConcurrency");
            if (maxConcurrency < 0) missing.add("maxConcurrency");
            if (defaultLockLimit < 0) missing.add("defaultLockLimit");
            if (lockLimit < 0) missing.add("lockLimit");
            if (defaultLockLifetime < 0) missing.add("defaultLockLifetime");

            if (!missing.isEmpty()) {
                throw new IllegalStateException("Missing scheduler options: " + String.join(", ", missing));
            }
            return new SchedulerConfig(this);
        }

        private static long positive(String option, long value) {
            if (value <= 0) {
                throw new IllegalArgumentException(option + " must be positive, got " + value);
            }
            return value;
        }
    }
}
