// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.error;

/**
 * Base runtime exception for every chainwatch failure.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * ChainwatchException
 * ├── {@link AbiException} - malformed event signature
 * ├── {@link BackfillException} - a historical log scan failed as a whole
 * ├── {@link RpcException} - JSON-RPC communication failures
 * ├── {@link TransportStartException} - a live watch could not be established
 * └── {@link TransportStreamException} - a running watch failed
 * </pre>
 *
 * <p>
 * Failures of user callbacks are never wrapped in this hierarchy; they are
 * logged by the dispatcher and do not reach the caller.
 *
 * @since 0.1.0
 */
public sealed class ChainwatchException extends RuntimeException
        permits AbiException,
        BackfillException,
        RpcException,
        TransportStartException,
        TransportStreamException {

    public ChainwatchException(final String message) {
        super(message);
    }

    public ChainwatchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
