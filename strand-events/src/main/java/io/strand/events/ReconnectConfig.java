// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff between reconnect attempts after the event stream is lost.
 *
 * <ul>
 *   <li>{@code backoffBaseMs} - delay before the first reconnect attempt (default: 500ms)</li>
 *   <li>{@code backoffMaxMs} - maximum delay cap (default: 30000ms)</li>
 *   <li>{@code jitterMin} - minimum jitter percentage (default: 0.10 = 10%)</li>
 *   <li>{@code jitterMax} - maximum jitter percentage (default: 0.25 = 25%)</li>
 * </ul>
 *
 * <p><strong>Backoff Formula:</strong>
 * <pre>
 *   delay = min(base * 2^(attempt-1), max)
 *   finalDelay = delay + delay * random(jitterMin, jitterMax)
 * </pre>
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * ReconnectConfig fast = ReconnectConfig.builder()
 *     .backoffBaseMs(50)
 *     .backoffMaxMs(1000)
 *     .build();
 * }</pre>
 *
 * @param backoffBaseMs base delay in milliseconds (must be &gt; 0)
 * @param backoffMaxMs  maximum delay cap in milliseconds (must be &gt;= backoffBaseMs)
 * @param jitterMin     minimum jitter percentage (must be &gt;= 0 and &lt; jitterMax)
 * @param jitterMax     maximum jitter percentage (must be &gt; jitterMin)
 */
public record ReconnectConfig(
        long backoffBaseMs,
        long backoffMaxMs,
        double jitterMin,
        double jitterMax) {

    /** Default base delay: 500ms. */
    public static final long DEFAULT_BACKOFF_BASE_MS = 500;

    /** Default maximum delay: 30000ms. */
    public static final long DEFAULT_BACKOFF_MAX_MS = 30_000;

    /** Default minimum jitter: 10%. */
    public static final double DEFAULT_JITTER_MIN = 0.10;

    /** Default maximum jitter: 25%. */
    public static final double DEFAULT_JITTER_MAX = 0.25;

    /** Exponent cap so that {@code 1L << shift} cannot overflow. */
    private static final int MAX_SHIFT = 30;

    public ReconnectConfig {
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException("backoffBaseMs must be > 0, got: " + backoffBaseMs);
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                    "backoffMaxMs must be >= backoffBaseMs, got: " + backoffMaxMs + " < " + backoffBaseMs);
        }
        if (jitterMin < 0) {
            throw new IllegalArgumentException("jitterMin must be >= 0, got: " + jitterMin);
        }
        if (jitterMax <= jitterMin) {
            throw new IllegalArgumentException(
                    "jitterMax must be > jitterMin, got: " + jitterMax + " <= " + jitterMin);
        }
    }

    /**
     * Returns the default configuration.
     *
     * @return default config with 500ms base, 30000ms max, 10-25% jitter
     */
    public static ReconnectConfig defaults() {
        return new ReconnectConfig(
                DEFAULT_BACKOFF_BASE_MS,
                DEFAULT_BACKOFF_MAX_MS,
                DEFAULT_JITTER_MIN,
                DEFAULT_JITTER_MAX);
    }

    /**
     * Computes the delay before the given reconnect attempt, jitter included.
     *
     * @param attempt the 1-based attempt number
     * @return the delay in milliseconds
     */
    public long delayMillis(final long attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got: " + attempt);
        }
        int shift = (int) Math.min(attempt - 1, MAX_SHIFT);
        long delay = Math.min(backoffBaseMs * (1L << shift), backoffMaxMs);
        if (delay < 0) {
            delay = backoffMaxMs;
        }
        double jitter = ThreadLocalRandom.current().nextDouble(jitterMin, jitterMax);
        return delay + (long) (delay * jitter);
    }

    /**
     * Creates a new builder for custom configuration.
     *
     * @return a new builder initialized with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ReconnectConfig}. All values start at their defaults.
     */
    public static final class Builder {
        private long backoffBaseMs = DEFAULT_BACKOFF_BASE_MS;
        private long backoffMaxMs = DEFAULT_BACKOFF_MAX_MS;
        private double jitterMin = DEFAULT_JITTER_MIN;
        private double jitterMax = DEFAULT_JITTER_MAX;

        private Builder() {}

        public Builder backoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
            return this;
        }

        public Builder backoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
            return this;
        }

        public Builder jitterMin(double jitterMin) {
            this.jitterMin = jitterMin;
            return this;
        }

        public Builder jitterMax(double jitterMax) {
            this.jitterMax = jitterMax;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return new immutable {@link ReconnectConfig}
         * @throws IllegalArgumentException if any parameter is invalid
         */
        public ReconnectConfig build() {
            return new ReconnectConfig(backoffBaseMs, backoffMaxMs, jitterMin, jitterMax);
        }
    }
}
