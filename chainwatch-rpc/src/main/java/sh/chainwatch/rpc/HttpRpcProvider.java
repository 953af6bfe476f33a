// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import static sh.chainwatch.rpc.internal.RpcUtils.MAPPER;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.JsonProcessingException;

import sh.chainwatch.core.DebugLogger;
import sh.chainwatch.core.LogFormatter;
import sh.chainwatch.core.error.RpcException;
import sh.chainwatch.rpc.internal.RpcUtils;

/**
 * JSON-RPC over HTTP POST, for one-shot reads.
 *
 * <p>
 * Used as the read channel of {@link ChainWatcher#connect(String, String)}: log scans
 * and transaction lookups go over HTTP while the WebSocket only carries subscriptions.
 * {@link #subscribe} is not supported.
 *
 * <p>
 * <strong>Error mapping:</strong>
 * <ul>
 * <li>non-2xx status: code {@code -32001}, the response body as data</li>
 * <li>body that is not JSON-RPC: code {@code -32700}</li>
 * <li>I/O failure or interrupt: code {@code -32000} with the cause attached</li>
 * <li>JSON-RPC error object: its own code, message and flattened data</li>
 * </ul>
 */
public final class HttpRpcProvider implements RpcProvider {

    private final RpcConfig config;
    private final URI endpoint;
    private final HttpClient client;
    private final AtomicLong nextId = new AtomicLong(1L);

    private HttpRpcProvider(final RpcConfig config) {
        this.config = config;
        this.endpoint = URI.create(config.url());
        this.client = HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build();
    }

    public static HttpRpcProvider create(final RpcConfig config) {
        return new HttpRpcProvider(Objects.requireNonNull(config, "config"));
    }

    public static HttpRpcProvider create(final String url) {
        return create(RpcConfig.withDefaults(url));
    }

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        final JsonRpcRequest request = JsonRpcRequest.of(method, params, nextId.getAndIncrement());
        final long started = System.nanoTime();
        final HttpResponse<String> reply = post(request);
        final long micros = (System.nanoTime() - started) / 1_000L;

        final int status = reply.statusCode();
        if (status / 100 != 2) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, status, "HTTP " + status, micros));
            throw new RpcException(-32001, "HTTP error for method " + method + ": " + status,
                    reply.body(), request.id());
        }
        final JsonRpcResponse response = decode(request, reply.body());
        final JsonRpcError error = response.error();
        if (error != null) {
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, error.code(), error.message(), micros));
            throw new RpcException(
                    error.code(), error.message(), RpcUtils.extractErrorData(error.data()), request.id());
        }
        DebugLogger.logRpc(LogFormatter.formatRpc(method, micros));
        return response;
    }

    private HttpResponse<String> post(final JsonRpcRequest request) {
        final String body;
        try {
            body = MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    -32700, "Unable to serialize JSON-RPC request for " + request.method(), null, request.id(), e);
        }
        final HttpRequest.Builder http = HttpRequest.newBuilder(endpoint)
                .timeout(config.readTimeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        config.headers().forEach(http::header);
        try {
            return client.send(http.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(-32000, "Interrupted while calling " + request.method(), null, request.id(), e);
        } catch (IOException e) {
            throw new RpcException(-32000, "Network error calling " + request.method() + " at " + endpoint.getHost(),
                    null, request.id(), e);
        }
    }

    private static JsonRpcResponse decode(final JsonRpcRequest request, final String body) {
        try {
            return MAPPER.readValue(body, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    -32700, "Unable to parse JSON-RPC response for method " + request.method(), body, request.id(), e);
        }
    }
}
