// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.rpc.subscription.EventCallback;

/**
 * Receives logs of one contract event, live and, when requested, historical ones.
 */
@FunctionalInterface
public interface ContractEventListener extends EventCallback<LogEntry> {
}
