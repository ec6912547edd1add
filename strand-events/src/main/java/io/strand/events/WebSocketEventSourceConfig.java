// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.netty.channel.EventLoopGroup;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Configuration for {@link WebSocketEventSource}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * WebSocketEventSourceConfig config = WebSocketEventSourceConfig.builder("wss://peer0.example.com/events")
 *         .filtered(true)
 *         .maxFrameSize(4 * 1024 * 1024)
 *         .build();
 * }</pre>
 *
 * <p>
 * <strong>External EventLoopGroup:</strong> When an {@code eventLoopGroup} is
 * given, the source does not shut it down on close; the caller owns its lifecycle.
 *
 * @param url            WebSocket URL (ws:// or wss://)
 * @param ioThreads      Netty I/O threads when the source creates its own group (default 1)
 * @param maxFrameSize   maximum aggregated frame size in bytes (default 1MB, max 64MB)
 * @param eventLoopGroup optional externally managed group
 * @param filtered       whether to request filtered blocks instead of full blocks
 */
public record WebSocketEventSourceConfig(
        String url,
        int ioThreads,
        int maxFrameSize,
        @Nullable EventLoopGroup eventLoopGroup,
        boolean filtered) {

    private static final int DEFAULT_IO_THREADS = 1;
    private static final int DEFAULT_MAX_FRAME_SIZE = 1024 * 1024;       // 1MB
    private static final int MAX_FRAME_SIZE_LIMIT = 64 * 1024 * 1024;    // 64MB

    public WebSocketEventSourceConfig {
        validateUrl(url);
        if (ioThreads <= 0)
            ioThreads = DEFAULT_IO_THREADS;
        if (maxFrameSize <= 0)
            maxFrameSize = DEFAULT_MAX_FRAME_SIZE;

        if (maxFrameSize > MAX_FRAME_SIZE_LIMIT) {
            throw new IllegalArgumentException(
                    "maxFrameSize (" + maxFrameSize + ") exceeds maximum allowed (" + MAX_FRAME_SIZE_LIMIT
                            + " bytes / 64MB)");
        }
    }

    /**
     * Creates a configuration with default settings.
     *
     * @param url the WebSocket URL
     * @return a new config
     */
    public static WebSocketEventSourceConfig withDefaults(String url) {
        return new WebSocketEventSourceConfig(url, 0, 0, null, false);
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    private static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid WebSocket URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("url must use ws:// or wss://, got: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("url has no host: " + url);
        }
    }

    /**
     * Builder for {@link WebSocketEventSourceConfig}.
     */
    public static final class Builder {
        private final String url;
        private int ioThreads = 0;
        private int maxFrameSize = 0;
        private @Nullable EventLoopGroup eventLoopGroup = null;
        private boolean filtered = false;

        private Builder(String url) {
            this.url = url;
        }

        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Sets the maximum size of an aggregated WebSocket message. Default: 1MB.
         */
        public Builder maxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        /**
         * Uses an externally managed EventLoopGroup. The source will not shut it down.
         */
        public Builder eventLoopGroup(EventLoopGroup eventLoopGroup) {
            this.eventLoopGroup = eventLoopGroup;
            return this;
        }

        /**
         * Requests filtered blocks (validation results only) from the server.
         */
        public Builder filtered(boolean filtered) {
            this.filtered = filtered;
            return this;
        }

        public WebSocketEventSourceConfig build() {
            return new WebSocketEventSourceConfig(url, ioThreads, maxFrameSize, eventLoopGroup, filtered);
        }
    }
}
