// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.util.Map;
import java.util.Objects;

import sh.chainwatch.rpc.internal.RpcUtils;

/**
 * A bounded {@code eth_getLogs} request; both ends inclusive.
 */
public record LogQuery(ContractEventFilter filter, long fromBlock, long toBlock) {

    public LogQuery {
        Objects.requireNonNull(filter, "filter");
        if (fromBlock < 0) {
            throw new IllegalArgumentException("fromBlock cannot be negative: " + fromBlock);
        }
        if (toBlock < fromBlock) {
            throw new IllegalArgumentException("toBlock " + toBlock + " is before fromBlock " + fromBlock);
        }
    }

    Map<String, Object> toRpcParams() {
        final Map<String, Object> params = filter.toRpcParams();
        params.put("fromBlock", RpcUtils.toHexBlock(fromBlock));
        params.put("toBlock", RpcUtils.toHexBlock(toBlock));
        return params;
    }
}
