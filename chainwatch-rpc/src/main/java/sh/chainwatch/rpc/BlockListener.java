// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import sh.chainwatch.core.model.BlockHeader;
import sh.chainwatch.rpc.subscription.EventCallback;

/**
 * Receives each new block header.
 */
@FunctionalInterface
public interface BlockListener extends EventCallback<BlockHeader> {
}
