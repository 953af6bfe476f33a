// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(String jsonrpc, String method, List<?> params, long id) {

    public static JsonRpcRequest of(final String method, final List<?> params, final long id) {
        return new JsonRpcRequest("2.0", method, params == null ? List.of() : params, id);
    }
}
