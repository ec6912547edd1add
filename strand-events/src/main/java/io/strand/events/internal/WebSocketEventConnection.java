// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import io.netty.channel.Channel;
import io.strand.core.InternalApi;
import io.strand.core.error.ConnectionException;
import io.strand.events.EventConnection;
import io.strand.events.RawEvent;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;

/**
 * {@link EventConnection} fed by a Netty WebSocket channel.
 *
 * <p>
 * The I/O thread appends raw frame text to an inbox; {@link #next()} decodes on the
 * reading thread so that a slow dispatcher never blocks the event loop. When the
 * inbox grows past {@value #HIGH_WATER_MARK} frames, auto-read is switched off
 * until the reader has drained it below {@value #LOW_WATER_MARK}.
 */
@InternalApi
public final class WebSocketEventConnection implements EventConnection {

    static final int HIGH_WATER_MARK = 1024;
    static final int LOW_WATER_MARK = 256;

    private final String endpoint;
    private final LinkedBlockingQueue<Object> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean();
    private volatile @Nullable Channel channel;

    public WebSocketEventConnection(final String endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    /**
     * Binds the connection to its channel once the socket is connected.
     */
    public void attach(final Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Called on the I/O thread for every text frame.
     */
    void onText(final String text) {
        if (ended.get()) {
            return;
        }
        inbox.add(text);
        Channel ch = channel;
        if (ch != null && inbox.size() >= HIGH_WATER_MARK && ch.config().isAutoRead()) {
            ch.config().setAutoRead(false);
        }
    }

    /**
     * Called when the stream ends. Only the first call has an effect.
     *
     * @param cause the failure, or {@code null} for an orderly close
     */
    void onClosed(final @Nullable Throwable cause) {
        if (ended.compareAndSet(false, true)) {
            inbox.add(new EndOfStream(cause));
        }
    }

    @Override
    public @Nullable RawEvent next() throws InterruptedException {
        Object item = inbox.take();
        if (item instanceof EndOfStream end) {
            // Keep the marker so later calls see the same outcome
            inbox.add(end);
            if (end.cause() == null) {
                return null;
            }
            throw new ConnectionException("WebSocket event stream failed", endpoint, end.cause());
        }
        resumeReadingIfDrained();
        return BlockJsonCodec.decodeEvent((String) item);
    }

    @Override
    public void close() {
        onClosed(null);
        Channel ch = channel;
        if (ch != null && ch.isOpen()) {
            ch.close();
        }
    }

    int pendingFrames() {
        return inbox.size();
    }

    private void resumeReadingIfDrained() {
        Channel ch = channel;
        if (ch != null && inbox.size() <= LOW_WATER_MARK && !ch.config().isAutoRead()) {
            ch.config().setAutoRead(true);
        }
    }

    private record EndOfStream(@Nullable Throwable cause) {
    }
}
