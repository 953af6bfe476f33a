// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.chainwatch.core.abi.EventSignature;
import sh.chainwatch.core.types.Address;

/**
 * Selects the logs of one contract, optionally narrowed to one event.
 *
 * <p>When {@code event} is {@code null} or anonymous, every log of the contract matches;
 * otherwise only logs whose first topic is the event selector.
 *
 * @param address contract emitting the logs
 * @param event   event to narrow to, or {@code null}
 */
public record ContractEventFilter(Address address, @Nullable EventSignature event) {

    public ContractEventFilter {
        Objects.requireNonNull(address, "address");
    }

    /**
     * @return the JSON-RPC filter object shared by {@code eth_getLogs} and {@code eth_subscribe("logs")}
     */
    public Map<String, Object> toRpcParams() {
        final Map<String, Object> params = new LinkedHashMap<>();
        params.put("address", address.value());
        if (event != null && !event.anonymous()) {
            params.put("topics", List.of(event.topic().value()));
        }
        return params;
    }
}
