// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.error;

/**
 * Base runtime exception for all Strand failures.
 *
 * <p>
 * This sealed class forms the root of Strand's exception hierarchy, ensuring
 * every event-service error can be caught with a single catch clause while
 * keeping the set of failure kinds closed.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * StrandException
 * ├── {@link InvalidArgumentException} - malformed filter, pattern or id at registration
 * ├── {@link PermissionDeniedException} - caller not authorized for an event kind
 * ├── {@link ServiceClosedException} - operation attempted after close
 * ├── {@link BlockDecodingException} - raw block data could not be decoded
 * └── {@link ConnectionException} - upstream event stream failures
 *     └── {@link ConnectionTimeoutException} - connect deadline exceeded
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     client.connect();
 * } catch (ConnectionTimeoutException e) {
 *     // Peer did not answer in time
 * } catch (ConnectionException e) {
 *     // Any other stream failure
 * } catch (StrandException e) {
 *     // Catch-all for any other Strand error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class StrandException extends RuntimeException
        permits InvalidArgumentException,
        PermissionDeniedException,
        ServiceClosedException,
        BlockDecodingException,
        ConnectionException {

    public StrandException(final String message) {
        super(message);
    }

    public StrandException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
