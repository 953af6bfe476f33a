// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import static sh.chainwatch.rpc.internal.RpcUtils.MAPPER;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.chainwatch.core.DebugLogger;
import sh.chainwatch.core.LogFormatter;
import sh.chainwatch.core.error.RpcException;
import sh.chainwatch.core.error.TransportStreamException;
import sh.chainwatch.rpc.internal.RpcUtils;

/**
 * JSON-RPC over a WebSocket, with {@code eth_subscribe} push support.
 *
 * <p>Connection policy:
 * <ul>
 *   <li>The socket is opened by {@link #create(RpcConfig)}.</li>
 *   <li>When it closes or fails, every pending request fails, and every open
 *   subscription receives one {@link TransportStreamException} through its error
 *   handler and is forgotten.</li>
 *   <li>The provider does not reconnect on its own. The next {@link #send} or
 *   {@link #subscribe} opens a fresh socket, so the caller's retry policy decides
 *   when reconnection happens.</li>
 * </ul>
 *
 * <p>Notifications are handed to subscription callbacks on the socket's listener
 * thread. Callbacks must not call {@link #send} synchronously; responses are read
 * by that same thread.
 */
public final class WebSocketRpcProvider implements RpcProvider {

    private static final Logger log = LoggerFactory.getLogger(WebSocketRpcProvider.class);

    private static final long SWEEP_INTERVAL_MS = 500;

    private final RpcConfig config;
    private final HttpClient httpClient;
    private final Object connectLock = new Object();
    private volatile @Nullable WebSocket webSocket;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final ConcurrentHashMap<Long, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SubscriptionSink> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong(0);

    private final ScheduledExecutorService timeouts =
            Executors.newSingleThreadScheduledExecutor(
                    ChainExecutors.daemon("chainwatch-ws-timeouts", false));
    private final ScheduledFuture<?> sweeper;

    private WebSocketRpcProvider(final RpcConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
        this.sweeper = timeouts.scheduleAtFixedRate(
                this::expireRequests, SWEEP_INTERVAL_MS, SWEEP_INTERVAL_MS, TimeUnit.MILLISECONDS);
        try {
            connect();
        } catch (RpcException e) {
            close();
            throw e;
        }
    }

    /**
     * Opens the socket.
     *
     * @throws RpcException if the handshake fails
     */
    public static WebSocketRpcProvider create(final RpcConfig config) {
        return new WebSocketRpcProvider(Objects.requireNonNull(config, "config"));
    }

    public static WebSocketRpcProvider create(final String url) {
        return create(RpcConfig.withDefaults(url));
    }

    public boolean isConnected() {
        return webSocket != null;
    }

    // ==================== Connection Management ====================

    private WebSocket connect() {
        synchronized (connectLock) {
            if (closed.get()) {
                throw new RpcException(-32000, "Provider is closed", null, null);
            }
            final WebSocket current = webSocket;
            if (current != null) {
                return current;
            }
            try {
                final WebSocket.Builder builder = httpClient.newWebSocketBuilder()
                        .connectTimeout(config.connectTimeout());
                config.headers().forEach(builder::header);
                final WebSocket opened = builder
                        .buildAsync(URI.create(config.url()), new Listener())
                        .get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
                webSocket = opened;
                DebugLogger.logRpc("[WS] connected url=%s", config.url());
                return opened;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RpcException(-32000, "Interrupted while connecting to " + config.url(), null, null, e);
            } catch (ExecutionException | TimeoutException e) {
                throw new RpcException(-32000, "Failed to connect to " + config.url(), null, null,
                        e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e);
            }
        }
    }

    private void connectionLost(final WebSocket socket, final Throwable cause) {
        synchronized (connectLock) {
            if (webSocket != socket) {
                return;
            }
            webSocket = null;
        }
        if (!closed.get()) {
            log.warn("WebSocket connection to {} lost: {}", config.url(), cause.getMessage());
        }
        failAll(cause);
    }

    private void failAll(final Throwable cause) {
        final RpcException requestError =
                new RpcException(-32000, "Connection lost: " + cause.getMessage(), null, null, cause);
        for (Long id : List.copyOf(pendingRequests.keySet())) {
            final PendingRequest pending = pendingRequests.remove(id);
            if (pending != null) {
                pending.future.completeExceptionally(requestError);
            }
        }
        for (String id : List.copyOf(subscriptions.keySet())) {
            final SubscriptionSink sink = subscriptions.remove(id);
            if (sink != null) {
                sink.fail(new TransportStreamException("Subscription " + id + " terminated", cause));
            }
        }
    }

    private void expireRequests() {
        if (pendingRequests.isEmpty()) {
            return;
        }
        final long now = System.nanoTime();
        final long timeoutNanos = config.readTimeout().toNanos();
        pendingRequests.forEach((id, pending) -> {
            if (now - pending.startNanos > timeoutNanos && pendingRequests.remove(id, pending)) {
                pending.future.completeExceptionally(new RpcException(
                        -32000, "Request timed out after " + config.readTimeout().toMillis() + "ms", null, id));
            }
        });
    }

    // ==================== Requests ====================

    @Override
    public JsonRpcResponse send(final String method, final List<?> params) throws RpcException {
        return await(method, sendAsync(method, params, null));
    }

    /**
     * Sends a request without blocking. Timeouts are enforced by a sweeper, not per request.
     */
    public CompletableFuture<JsonRpcResponse> sendAsync(final String method, final List<?> params) {
        return sendAsync(method, params, null);
    }

    private CompletableFuture<JsonRpcResponse> sendAsync(
            final String method, final List<?> params, final @Nullable SubscriptionSink sink) {
        final WebSocket socket;
        try {
            socket = connect();
        } catch (RpcException e) {
            return CompletableFuture.failedFuture(e);
        }
        final long id = ids.incrementAndGet();
        final String payload;
        try {
            payload = MAPPER.writeValueAsString(JsonRpcRequest.of(method, params, id));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(new RpcException(
                    -32700, "Unable to serialize JSON-RPC request for " + method, null, id, e));
        }
        final PendingRequest pending = new PendingRequest(method, new CompletableFuture<>(), System.nanoTime(), sink);
        pendingRequests.put(id, pending);
        socket.sendText(payload, true).whenComplete((ws, error) -> {
            if (error != null && pendingRequests.remove(id, pending)) {
                pending.future.completeExceptionally(
                        new RpcException(-32000, "Failed to send " + method, null, id, error));
            }
        });
        return pending.future;
    }

    private JsonRpcResponse await(final String method, final CompletableFuture<JsonRpcResponse> future) {
        final long start = System.nanoTime();
        final JsonRpcResponse response;
        try {
            response = future.get();
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RpcException rpc) {
                throw rpc;
            }
            throw new RpcException(-32000, "Request failed: " + cause.getMessage(), null, null, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException(-32000, "Request interrupted", null, null, e);
        }
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        if (response.hasError()) {
            final JsonRpcError err = response.error();
            DebugLogger.logRpc(LogFormatter.formatRpcError(method, err.code(), err.message(), durationMicros));
            throw new RpcException(err.code(), err.message(), RpcUtils.extractErrorData(err.data()),
                    parseId(response.id()));
        }
        DebugLogger.logRpc(LogFormatter.formatRpc(method, durationMicros));
        return response;
    }

    // ==================== Subscriptions ====================

    @Override
    public String subscribe(
            final String kind,
            final List<?> params,
            final Consumer<Object> onNotification,
            final Consumer<Throwable> onError) throws RpcException {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(onNotification, "onNotification");
        Objects.requireNonNull(onError, "onError");
        final List<Object> fullParams = new ArrayList<>();
        fullParams.add(kind);
        if (params != null) {
            fullParams.addAll(params);
        }
        final JsonRpcResponse response =
                await("eth_subscribe", sendAsync("eth_subscribe", fullParams, new SubscriptionSink(onNotification, onError)));
        final String id = response.resultAsString();
        if (id == null) {
            throw new RpcException(-32000, "eth_subscribe returned no subscription id", null, parseId(response.id()));
        }
        return id;
    }

    @Override
    public boolean unsubscribe(final String subscriptionId) throws RpcException {
        if (subscriptions.remove(subscriptionId) == null || webSocket == null) {
            return false;
        }
        final JsonRpcResponse response = send("eth_unsubscribe", List.of(subscriptionId));
        return Boolean.TRUE.equals(response.result());
    }

    public int activeSubscriptions() {
        return subscriptions.size();
    }

    // ==================== Lifecycle ====================

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        sweeper.cancel(false);
        timeouts.shutdownNow();
        final WebSocket socket;
        synchronized (connectLock) {
            socket = webSocket;
            webSocket = null;
        }
        failAll(new RpcException(-32000, "Provider closed", null, null));
        if (socket != null) {
            try {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "closing").get(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                socket.abort();
            } catch (ExecutionException | TimeoutException e) {
                log.debug("WebSocket close handshake did not complete: {}", e.toString());
                socket.abort();
            }
        }
    }

    // ==================== Inbound ====================

    private void handleMessage(final CharSequence text) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(text.toString());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed WebSocket frame: {}", e.getOriginalMessage());
            return;
        }
        if (root.isArray()) {
            root.forEach(this::handleNode);
        } else {
            handleNode(root);
        }
    }

    private void handleNode(final JsonNode node) {
        if ("eth_subscription".equals(node.path("method").asText(null))) {
            final JsonNode params = node.path("params");
            final String subscriptionId = params.path("subscription").asText(null);
            final SubscriptionSink sink = subscriptionId == null ? null : subscriptions.get(subscriptionId);
            if (sink == null) {
                log.debug("Notification for unknown subscription {}", subscriptionId);
                return;
            }
            final Object result = MAPPER.convertValue(params.get("result"), Object.class);
            sink.deliver(subscriptionId, result);
            return;
        }
        final Long id = node.hasNonNull("id") ? parseId(node.get("id").asText()) : null;
        final PendingRequest pending = id == null ? null : pendingRequests.remove(id);
        if (pending == null) {
            return;
        }
        final JsonRpcResponse response;
        try {
            response = MAPPER.treeToValue(node, JsonRpcResponse.class);
        } catch (JsonProcessingException e) {
            pending.future.completeExceptionally(new RpcException(
                    -32700, "Unable to parse JSON-RPC response for method " + pending.method, node.toString(), id, e));
            return;
        }
        if (pending.sink != null && !response.hasError() && response.result() != null) {
            // registered before the caller is released so no early notification is lost
            subscriptions.put(response.resultAsString(), pending.sink);
        }
        pending.future.complete(response);
    }

    private static @Nullable Long parseId(final @Nullable String id) {
        if (id == null) {
            return null;
        }
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private final class Listener implements WebSocket.Listener {
        private final StringBuilder buffer = new StringBuilder(4096);

        @Override
        public void onOpen(final WebSocket socket) {
            socket.request(Long.MAX_VALUE);
        }

        @Override
        public CompletionStage<?> onText(final WebSocket socket, final CharSequence data, final boolean last) {
            if (buffer.length() == 0 && last) {
                handleMessage(data);
            } else {
                buffer.append(data);
                if (last) {
                    handleMessage(buffer);
                    buffer.setLength(0);
                }
            }
            return null;
        }

        @Override
        public CompletionStage<?> onClose(final WebSocket socket, final int statusCode, final String reason) {
            connectionLost(socket, new TransportStreamException(
                    "WebSocket closed with status " + statusCode + (reason.isEmpty() ? "" : ": " + reason)));
            return null;
        }

        @Override
        public void onError(final WebSocket socket, final Throwable error) {
            connectionLost(socket, error);
        }
    }

    private record PendingRequest(
            String method,
            CompletableFuture<JsonRpcResponse> future,
            long startNanos,
            @Nullable SubscriptionSink sink) {}

    private static final class SubscriptionSink {
        private final Consumer<Object> onNotification;
        private final Consumer<Throwable> onError;
        private final AtomicBoolean failed = new AtomicBoolean(false);

        SubscriptionSink(final Consumer<Object> onNotification, final Consumer<Throwable> onError) {
            this.onNotification = onNotification;
            this.onError = onError;
        }

        void deliver(final String subscriptionId, final Object result) {
            DebugLogger.logRpc(LogFormatter.formatNotification(subscriptionId, result instanceof List<?> l ? l.size() : 1));
            try {
                onNotification.accept(result);
            } catch (RuntimeException e) {
                log.error("Subscription {} handler failed", subscriptionId, e);
            }
        }

        void fail(final Throwable cause) {
            if (failed.compareAndSet(false, true)) {
                try {
                    onError.accept(cause);
                } catch (RuntimeException e) {
                    log.error("Subscription error handler failed", e);
                }
            }
        }
    }
}
