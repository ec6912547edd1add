// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.error;

/**
 * Thrown when raw block data received from the event stream cannot be decoded.
 *
 * <p>
 * A decoding failure affects a single raw event only; the event service reports
 * it and keeps serving the rest of the stream.
 */
public final class BlockDecodingException extends StrandException {

    public BlockDecodingException(final String message) {
        super(message);
    }

    public BlockDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
