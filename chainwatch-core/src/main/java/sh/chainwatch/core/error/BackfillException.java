// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.error;

/**
 * A historical log scan failed before any result could be delivered.
 * <p>
 * Failures of individual callbacks during delivery do not produce this exception.
 *
 * @since 0.1.0
 */
public final class BackfillException extends ChainwatchException {

    private final long fromBlock;
    private final Long toBlock;

    public BackfillException(final String message, final long fromBlock, final Long toBlock, final Throwable cause) {
        super(message, cause);
        this.fromBlock = fromBlock;
        this.toBlock = toBlock;
    }

    public long fromBlock() {
        return fromBlock;
    }

    /**
     * @return the requested upper bound, or {@code null} when it was to be resolved to the chain head
     */
    public Long toBlock() {
        return toBlock;
    }
}
