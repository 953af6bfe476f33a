// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.error;

/**
 * A running watch failed, typically because the connection dropped.
 * <p>
 * Delivered to the watch's error handler, never thrown to callers.
 */
public final class TransportStreamException extends ChainwatchException {

    public TransportStreamException(final String message) {
        super(message);
    }

    public TransportStreamException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
