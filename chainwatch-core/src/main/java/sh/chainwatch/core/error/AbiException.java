// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.core.error;

/**
 * Thrown when an event signature in a supplied ABI cannot be parsed.
 */
public final class AbiException extends ChainwatchException {

    public AbiException(final String message) {
        super(message);
    }
}
