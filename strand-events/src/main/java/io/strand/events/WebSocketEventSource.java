// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.strand.core.error.ConnectionException;
import io.strand.core.error.ConnectionTimeoutException;
import io.strand.events.internal.BlockJsonCodec;
import io.strand.events.internal.EventFrameHandler;
import io.strand.events.internal.WebSocketEventConnection;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.net.ssl.SSLException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventSource} reading JSON block events from a WebSocket endpoint.
 *
 * <p>
 * Every {@link #open} creates a new channel, performs the WebSocket handshake and
 * sends a subscribe request carrying the start block. The server then streams one
 * block or filtered block per text frame. See {@link BlockJsonCodec} for the wire
 * format.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (WebSocketEventSource source = WebSocketEventSource.create("ws://localhost:7053/events");
 *      EventClient client = DefaultEventClient.builder(source).build()) {
 *     EventRegistration<BlockEvent> blocks = client.registerBlockEvent();
 *     client.connect();
 *     BlockEvent first = blocks.events().take();
 * }
 * }</pre>
 *
 * <p>
 * <b>Thread Safety:</b> This class is thread-safe. The event service opens at most
 * one connection at a time, but nothing prevents several services from sharing a
 * source.
 */
public final class WebSocketEventSource implements EventSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventSource.class);
    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private final WebSocketEventSourceConfig config;
    private final URI uri;
    private final EventLoopGroup group;
    /** True if we created the EventLoopGroup internally and are responsible for shutting it down. */
    private final boolean ownsEventLoopGroup;
    private final @Nullable SslContext sslContext;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WebSocketEventSource(final WebSocketEventSourceConfig config) {
        this.config = config;
        this.uri = URI.create(config.url());
        this.sslContext = "wss".equalsIgnoreCase(uri.getScheme()) ? buildSslContext(uri) : null;
        if (config.eventLoopGroup() != null) {
            this.group = config.eventLoopGroup();
            this.ownsEventLoopGroup = false;
        } else {
            this.group = new NioEventLoopGroup(config.ioThreads(), (ThreadFactory) WebSocketEventSource::newIoThread);
            this.ownsEventLoopGroup = true;
        }
    }

    /**
     * Creates a source for the given URL with default settings.
     *
     * @param url the WebSocket URL
     * @return a new source
     */
    public static WebSocketEventSource create(final String url) {
        return new WebSocketEventSource(WebSocketEventSourceConfig.withDefaults(url));
    }

    @Override
    public EventConnection open(final @Nullable Long startBlock, final Duration timeout) {
        if (closed.get()) {
            throw new ConnectionException("Event source is closed", endpoint(), null);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        WebSocketEventConnection connection = new WebSocketEventConnection(endpoint());
        EventFrameHandler handler = new EventFrameHandler(
                WebSocketClientHandshakerFactory.newHandshaker(
                        uri, WebSocketVersion.V13, null, false, new DefaultHttpHeaders(), config.maxFrameSize()),
                BlockJsonCodec.encodeSubscribe(startBlock, config.filtered()),
                connection);

        int port = port(uri);
        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        p.addLast(new WebSocketFrameAggregator(config.maxFrameSize()));
                        p.addLast(handler);
                    }
                });

        Channel channel = null;
        try {
            ChannelFuture connectFuture = b.connect(uri.getHost(), port);
            channel = connectFuture.channel();
            connection.attach(channel);
            if (!connectFuture.await(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
                throw new ConnectionTimeoutException(endpoint(), timeout);
            }
            if (!connectFuture.isSuccess()) {
                throw new ConnectionException("Failed to connect", endpoint(), connectFuture.cause());
            }
            ChannelFuture handshake = handler.handshakeFuture();
            if (!handshake.await(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
                throw new ConnectionTimeoutException(endpoint(), timeout);
            }
            if (!handshake.isSuccess()) {
                throw new ConnectionException("WebSocket handshake failed", endpoint(), handshake.cause());
            }
            log.debug("Opened event stream to {} from block {}", endpoint(), startBlock);
            return connection;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeChannel(channel);
            throw new ConnectionException("Interrupted while connecting", endpoint(), e);
        } catch (RuntimeException e) {
            closeChannel(channel);
            throw e;
        }
    }

    @Override
    public String endpoint() {
        return uri.toString();
    }

    /**
     * Shuts down the internally created EventLoopGroup. An external group is left
     * running. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (ownsEventLoopGroup) {
            try {
                group.shutdownGracefully(0, 2, TimeUnit.SECONDS).await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while shutting down EventLoopGroup", e);
            }
        }
    }

    private static void closeChannel(final @Nullable Channel channel) {
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
    }

    private static long remainingMillis(final long deadlineNanos) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    private static int port(final URI uri) {
        int port = uri.getPort();
        if (port == -1) {
            port = "wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }

    private static SslContext buildSslContext(final URI uri) {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new ConnectionException("Failed to initialise TLS", uri.toString(), e);
        }
    }

    private static Thread newIoThread(Runnable r) {
        int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
        Thread t = new Thread(r, "strand-events-io-" + id);
        t.setDaemon(true);
        return t;
    }
}
