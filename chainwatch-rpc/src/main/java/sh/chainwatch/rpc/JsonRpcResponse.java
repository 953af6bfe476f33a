// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import static sh.chainwatch.rpc.internal.RpcUtils.MAPPER;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response. Exactly one of {@code result} and {@code error} is meaningful;
 * check {@link #hasError()} first.
 *
 * @param jsonrpc protocol version, always "2.0"
 * @param result  the result, {@code null} on error or for a null result
 * @param error   the error object, {@code null} on success
 * @param id      id of the request this answers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    public boolean hasError() {
        return error != null;
    }

    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    /**
     * @return the object result (block, transaction), or {@code null}
     * @throws IllegalArgumentException if the result is not an object
     */
    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }

    /**
     * @return the array result (logs), or {@code null}
     * @throws IllegalArgumentException if the result is not an array
     */
    @SuppressWarnings("unchecked")
    public @Nullable List<Object> resultAsList() {
        if (result == null) {
            return null;
        }
        if (result instanceof List<?>) {
            return (List<Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<List<Object>>() {});
    }
}
