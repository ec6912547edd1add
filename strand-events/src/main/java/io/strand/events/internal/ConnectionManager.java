// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import io.strand.core.InternalApi;
import io.strand.core.error.BlockDecodingException;
import io.strand.core.error.ConnectionException;
import io.strand.core.error.ConnectionTimeoutException;
import io.strand.core.error.ServiceClosedException;
import io.strand.events.ConnectionEvent;
import io.strand.events.ConnectionState;
import io.strand.events.EventConnection;
import io.strand.events.EventMetrics;
import io.strand.events.EventServiceConfig;
import io.strand.events.EventSource;
import io.strand.events.RawEvent;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Owns the upstream event stream and the single background thread that reads it.
 *
 * <p>
 * <strong>State Machine:</strong>
 *
 * <pre>
 *                      connect()
 *   DISCONNECTED ───────────────────► CONNECTING
 *        ▲                               │  │
 *        │          open failed/timeout  │  │ open succeeded
 *        ├───────────────────────────────┘  ▼
 *        │        stream error/EOF       CONNECTED
 *        └────────────────────────────────  │
 *          (background reconnect with       │
 *           backoff: DISCONNECTED ⇄         │
 *           CONNECTING until success)       │
 *                                           ▼ close()
 *                  CLOSING ─────────────► CLOSED
 * </pre>
 *
 * <p>
 * The receive thread reads raw events and hands them to the {@link Dispatcher}. When
 * the stream fails it publishes {@code ConnectionEvent(false, cause)}, waits
 * according to {@link io.strand.events.ReconnectConfig} and reopens the stream from
 * the block after the last one dispatched, until it succeeds, the configured number
 * of attempts is exhausted, or the manager is closed.
 */
@InternalApi
public final class ConnectionManager implements AutoCloseable {

    private static final long JOIN_TIMEOUT_MS = 5_000;

    private final EventSource source;
    private final Dispatcher dispatcher;
    private final SubscriberRegistry registry;
    private final EventServiceConfig config;
    private final Logger log;
    private final EventMetrics metrics;
    private final ExecutorService connectExecutor;

    private final ReentrantLock connectLock = new ReentrantLock();
    private final CountDownLatch closeSignal = new CountDownLatch(1);
    private final Object stateLock = new Object();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    // Guarded by stateLock
    private @Nullable EventConnection connection;
    private @Nullable Thread receiveThread;
    private boolean closed;

    public ConnectionManager(
            final EventSource source,
            final Dispatcher dispatcher,
            final SubscriberRegistry registry,
            final EventServiceConfig config) {
        this.source = Objects.requireNonNull(source, "source");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.log = config.logger();
        this.metrics = config.metrics();
        this.connectExecutor = Executors.newCachedThreadPool(config.threadFactory());
    }

    /**
     * Opens the stream and starts the receive thread.
     *
     * <p>
     * Does nothing while connected or while the receive thread is re-establishing a
     * lost stream.
     *
     * @param timeout the connect deadline
     * @throws ConnectionTimeoutException if the stream is not up in time
     * @throws ConnectionException        if the stream cannot be established
     * @throws ServiceClosedException     if the manager is closed
     */
    public void connect(final Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        connectLock.lock();
        try {
            synchronized (stateLock) {
                if (closed) {
                    throw new ServiceClosedException("Event service is closed");
                }
                if (receiveThread != null) {
                    log.debug("Already connected to {}, state={}", source.endpoint(), state);
                    return;
                }
                state = ConnectionState.CONNECTING;
            }
            log.info("Connecting to {}", source.endpoint());

            EventConnection opened;
            try {
                opened = openWithin(dispatcher.resumeFrom(), timeout);
            } catch (RuntimeException e) {
                markDisconnected();
                log.warn("Failed to connect to {}: {}", source.endpoint(), e.getMessage());
                throw e;
            }

            synchronized (stateLock) {
                if (!activate(opened)) {
                    opened.close();
                    throw new ServiceClosedException("Event service closed while connecting");
                }
                Thread thread = config.threadFactory().newThread(() -> runLoop(opened));
                receiveThread = thread;
                thread.start();
            }
            log.info("Connected to {}", source.endpoint());
        } finally {
            connectLock.unlock();
        }
    }

    /**
     * Seals the registry and closes, but only if no registration is outstanding.
     *
     * @return {@code true} if the manager is now closed
     */
    public boolean closeIfIdle() {
        if (!registry.sealIfEmpty()) {
            return false;
        }
        close();
        return true;
    }

    /**
     * Closes the stream, every remaining subscriber channel and the receive thread.
     * Idempotent.
     */
    @Override
    public void close() {
        Thread loop;
        EventConnection current;
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
            state = ConnectionState.CLOSING;
            loop = receiveThread;
            current = connection;
            connection = null;
        }
        closeSignal.countDown();
        if (current != null) {
            closeConnection(current);
        }
        boolean otherThread = loop != null && loop != Thread.currentThread();
        if (otherThread) {
            loop.interrupt();
        }
        for (Subscriber subscriber : registry.closeAll()) {
            subscriber.channel().close();
        }
        if (otherThread) {
            awaitTermination(loop);
        }
        connectExecutor.shutdownNow();
        state = ConnectionState.CLOSED;
        log.info("Event service for {} closed", source.endpoint());
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isClosed() {
        synchronized (stateLock) {
            return closed;
        }
    }

    private void runLoop(final EventConnection first) {
        EventConnection current = first;
        try {
            while (true) {
                Throwable failure = receive(current);
                closeConnection(current);
                if (failure == null || isClosed()) {
                    return;
                }
                onStreamLost(failure);
                current = reconnect();
                if (current == null) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!isClosed()) {
                log.warn("Receive thread for {} interrupted", source.endpoint());
            }
            closeConnection(current);
        } finally {
            releaseReceiveThread();
        }
    }

    /**
     * Detaches the calling receive thread so that a later {@link #connect} starts a new one.
     * Has no effect once another thread has taken over.
     */
    private void releaseReceiveThread() {
        synchronized (stateLock) {
            if (receiveThread != Thread.currentThread()) {
                return;
            }
            receiveThread = null;
            if (!closed) {
                connection = null;
                state = ConnectionState.DISCONNECTED;
            }
        }
    }

    /**
     * Reads and dispatches until the stream fails.
     *
     * @return the failure, or {@code null} if the manager was closed
     */
    private @Nullable Throwable receive(final EventConnection current) throws InterruptedException {
        while (!isClosed()) {
            RawEvent event;
            try {
                event = current.next();
            } catch (BlockDecodingException e) {
                dispatcher.reportDispatchError(e);
                continue;
            } catch (RuntimeException e) {
                return e;
            }
            if (event == null) {
                return new ConnectionException("Event stream ended", source.endpoint(), null);
            }
            dispatcher.dispatch(event);
        }
        return null;
    }

    private void onStreamLost(final Throwable failure) {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            connection = null;
            state = ConnectionState.DISCONNECTED;
        }
        log.warn("Lost event stream from {}: {}", source.endpoint(), failure.getMessage());
        metrics.onConnectionLost(failure);
        dispatcher.publishConnectionEvent(ConnectionEvent.disconnected(failure));
    }

    private @Nullable EventConnection reconnect() throws InterruptedException {
        int maxAttempts = config.maxReconnectAttempts();
        @Nullable RuntimeException lastError = null;
        for (long attempt = 1; maxAttempts == 0 || attempt <= maxAttempts; attempt++) {
            long delayMs = config.reconnect().delayMillis(attempt);
            log.info("Scheduling reconnect attempt {} to {} in {}ms", attempt, source.endpoint(), delayMs);
            if (closeSignal.await(delayMs, TimeUnit.MILLISECONDS)) {
                return null;
            }
            synchronized (stateLock) {
                if (closed) {
                    return null;
                }
                state = ConnectionState.CONNECTING;
            }
            EventConnection opened;
            try {
                opened = openWithin(dispatcher.resumeFrom(), config.connectTimeout());
            } catch (ServiceClosedException e) {
                return null;
            } catch (RuntimeException e) {
                lastError = e;
                markDisconnected();
                log.warn("Reconnect attempt {} to {} failed: {}", attempt, source.endpoint(), e.getMessage());
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Interrupted while reconnecting");
                }
                continue;
            }
            synchronized (stateLock) {
                if (!activate(opened)) {
                    opened.close();
                    return null;
                }
            }
            metrics.onReconnect(attempt);
            log.info("Reconnected to {} on attempt {}", source.endpoint(), attempt);
            return opened;
        }
        log.error("Max reconnect attempts ({}) exceeded, giving up on {}", maxAttempts, source.endpoint());
        releaseReceiveThread();
        dispatcher.publishConnectionEvent(ConnectionEvent.disconnected(new ConnectionException(
                "Gave up reconnecting after " + maxAttempts + " attempts", source.endpoint(), lastError)));
        return null;
    }

    /**
     * Installs a freshly opened connection. Must hold {@code stateLock}.
     *
     * @return {@code false} if the manager was closed meanwhile
     */
    private boolean activate(final EventConnection opened) {
        if (closed) {
            return false;
        }
        connection = opened;
        state = ConnectionState.CONNECTED;
        dispatcher.publishConnectionEvent(ConnectionEvent.connectedEvent());
        return true;
    }

    private void markDisconnected() {
        synchronized (stateLock) {
            if (!closed) {
                state = ConnectionState.DISCONNECTED;
            }
        }
    }

    /**
     * Opens a stream on the connect executor and waits at most {@code timeout} for it.
     *
     * <p>
     * Whichever side decides first wins: if the deadline passes before the source
     * returns, a connection that still arrives later is closed by the opening task.
     */
    private EventConnection openWithin(final @Nullable Long startBlock, final Duration timeout) {
        AtomicBoolean decided = new AtomicBoolean();
        Future<EventConnection> future;
        try {
            future = connectExecutor.submit(() -> {
                EventConnection opened = source.open(startBlock, timeout);
                if (!decided.compareAndSet(false, true)) {
                    opened.close();
                }
                return opened;
            });
        } catch (RejectedExecutionException e) {
            throw new ServiceClosedException("Event service is closed");
        }
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (decided.compareAndSet(false, true)) {
                future.cancel(true);
                throw new ConnectionTimeoutException(source.endpoint(), timeout);
            }
            // The source returned right at the deadline and the connection is ours
            return awaitHandedOver(future);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConnectionException ce) {
                throw ce;
            }
            throw new ConnectionException("Failed to open event stream", source.endpoint(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (decided.compareAndSet(false, true)) {
                future.cancel(true);
                throw new ConnectionException("Interrupted while connecting", source.endpoint(), e);
            }
            return awaitHandedOver(future);
        }
    }

    private EventConnection awaitHandedOver(final Future<EventConnection> future) {
        boolean interrupted = Thread.interrupted();
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    throw new ConnectionException("Failed to open event stream", source.endpoint(), e.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void closeConnection(final EventConnection current) {
        try {
            current.close();
        } catch (RuntimeException e) {
            log.warn("Error closing event stream from {}", source.endpoint(), e);
        }
    }

    private void awaitTermination(final Thread loop) {
        try {
            loop.join(JOIN_TIMEOUT_MS);
            if (loop.isAlive()) {
                log.warn("Receive thread {} did not terminate within {}ms", loop.getName(), JOIN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for receive thread to stop", e);
        }
    }
}
