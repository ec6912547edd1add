// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for {@link DefaultEventClient}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * EventServiceConfig config = EventServiceConfig.builder()
 *         .bufferSize(500)
 *         .backpressurePolicy(BackpressurePolicy.BLOCK)
 *         .connectTimeout(Duration.ofSeconds(5))
 *         .reconnect(ReconnectConfig.builder().backoffBaseMs(100).build())
 *         .build();
 * }</pre>
 *
 * <p>
 * Zero or {@code null} values fall back to the defaults.
 *
 * @param bufferSize           capacity of every subscriber channel (default 100)
 * @param backpressurePolicy   what to do when a channel is full (default {@link BackpressurePolicy#TIMEOUT})
 * @param consumerTimeout      how long {@link BackpressurePolicy#TIMEOUT} waits (default 500ms)
 * @param connectTimeout       deadline for establishing the stream, per attempt (default 10s)
 * @param reconnect            backoff between reconnect attempts
 * @param maxReconnectAttempts attempts before giving up after a drop; 0 means unlimited (default 0)
 * @param logger               logger every component of the service writes to
 * @param metrics              metrics collector (default {@link EventMetrics#noop()})
 * @param threadFactory        factory for the receive/dispatch and connect threads
 */
public record EventServiceConfig(
        int bufferSize,
        BackpressurePolicy backpressurePolicy,
        Duration consumerTimeout,
        Duration connectTimeout,
        ReconnectConfig reconnect,
        int maxReconnectAttempts,
        Logger logger,
        EventMetrics metrics,
        ThreadFactory threadFactory) {

    private static final int DEFAULT_BUFFER_SIZE = 100;
    private static final Duration DEFAULT_CONSUMER_TIMEOUT = Duration.ofMillis(500);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final AtomicInteger THREAD_ID = new AtomicInteger(0);

    public EventServiceConfig {
        if (bufferSize <= 0)
            bufferSize = DEFAULT_BUFFER_SIZE;
        if (backpressurePolicy == null)
            backpressurePolicy = BackpressurePolicy.TIMEOUT;
        if (consumerTimeout == null)
            consumerTimeout = DEFAULT_CONSUMER_TIMEOUT;
        if (connectTimeout == null)
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        if (reconnect == null)
            reconnect = ReconnectConfig.defaults();
        if (logger == null)
            logger = LoggerFactory.getLogger(DefaultEventClient.class);
        if (metrics == null)
            metrics = EventMetrics.noop();
        if (threadFactory == null)
            threadFactory = EventServiceConfig::newDaemonThread;

        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0, got: " + maxReconnectAttempts);
        }
        if (consumerTimeout.isNegative() || consumerTimeout.isZero()) {
            throw new IllegalArgumentException("consumerTimeout must be positive, got: " + consumerTimeout);
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive, got: " + connectTimeout);
        }
    }

    /**
     * Creates a configuration with all defaults.
     *
     * @return a new EventServiceConfig with default settings
     */
    public static EventServiceConfig defaults() {
        return new EventServiceConfig(0, null, null, null, null, 0, null, null, null);
    }

    /**
     * Creates a builder for constructing an EventServiceConfig.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    private static Thread newDaemonThread(Runnable r) {
        // Mask off sign bit to keep ids non-negative after overflow
        int id = THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
        Thread t = new Thread(r, "strand-events-" + id);
        t.setDaemon(true);
        return t;
    }

    /**
     * Builder for {@link EventServiceConfig}.
     */
    public static final class Builder {
        private int bufferSize = 0;
        private @Nullable BackpressurePolicy backpressurePolicy = null;
        private @Nullable Duration consumerTimeout = null;
        private @Nullable Duration connectTimeout = null;
        private @Nullable ReconnectConfig reconnect = null;
        private int maxReconnectAttempts = 0;
        private @Nullable Logger logger = null;
        private @Nullable EventMetrics metrics = null;
        private @Nullable ThreadFactory threadFactory = null;

        private Builder() {
        }

        /**
         * Sets the capacity of each subscriber channel. Default: 100.
         */
        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        /**
         * Sets the policy applied when a subscriber channel is full. Default: TIMEOUT.
         */
        public Builder backpressurePolicy(BackpressurePolicy policy) {
            this.backpressurePolicy = policy;
            return this;
        }

        /**
         * Sets how long {@link BackpressurePolicy#TIMEOUT} waits for room. Default: 500ms.
         */
        public Builder consumerTimeout(Duration timeout) {
            this.consumerTimeout = timeout;
            return this;
        }

        /**
         * Sets the deadline for establishing the stream. Default: 10 seconds.
         */
        public Builder connectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder reconnect(ReconnectConfig reconnect) {
            this.reconnect = reconnect;
            return this;
        }

        /**
         * Caps reconnect attempts after a drop. Default: 0 (retry until closed).
         */
        public Builder maxReconnectAttempts(int attempts) {
            this.maxReconnectAttempts = attempts;
            return this;
        }

        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public Builder metrics(EventMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder threadFactory(ThreadFactory threadFactory) {
            this.threadFactory = threadFactory;
            return this;
        }

        /**
         * Builds the EventServiceConfig.
         *
         * @return a new EventServiceConfig
         */
        public EventServiceConfig build() {
            return new EventServiceConfig(
                    bufferSize,
                    backpressurePolicy,
                    consumerTimeout,
                    connectTimeout,
                    reconnect,
                    maxReconnectAttempts,
                    logger,
                    metrics,
                    threadFactory);
        }
    }
}
