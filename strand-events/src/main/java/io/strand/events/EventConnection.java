// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.error.BlockDecodingException;
import io.strand.core.error.ConnectionException;
import org.jspecify.annotations.Nullable;

/**
 * One established upstream stream, as handed out by an {@link EventSource}.
 *
 * <p>
 * The event service reads from a connection on a single background thread and
 * closes it exactly once, either when the stream fails or when the service closes.
 */
public interface EventConnection extends AutoCloseable {

    /**
     * Blocks until the next raw event arrives.
     *
     * @return the next event, or {@code null} when the peer ended the stream normally
     * @throws ConnectionException     if the stream failed
     * @throws BlockDecodingException  if one event could not be decoded; the stream stays usable
     * @throws InterruptedException    if the reading thread was interrupted
     */
    @Nullable RawEvent next() throws InterruptedException;

    /**
     * Releases the underlying network resource and wakes a blocked {@link #next()}.
     * Must be idempotent.
     */
    @Override
    void close();
}
