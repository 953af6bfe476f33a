// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.error;

/**
 * A live watch (block, pending transaction or contract event) could not be established.
 */
public final class TransportStartException extends ChainwatchException {

    public TransportStartException(final String message) {
        super(message);
    }

    public TransportStartException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
