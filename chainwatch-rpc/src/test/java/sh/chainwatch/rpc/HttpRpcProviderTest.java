// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.chainwatch.core.ChainwatchDebug;
import sh.chainwatch.core.error.RpcException;
import sh.chainwatch.core.error.TransportStartException;

class HttpRpcProviderTest {

    private HttpServer server;
    private URI baseUri;
    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("sh.chainwatch.debug");

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        ChainwatchDebug.setEnabled(false);
        debugLogger.detachAndStopAllAppenders();
        server.stop(0);
    }

    @Test
    void returnsResultAndSendsConfiguredHeaders() {
        AtomicReference<String> apiKey = new AtomicReference<>();
        AtomicReference<String> body = new AtomicReference<>();
        server.createContext("/", exchange -> {
            apiKey.set(exchange.getRequestHeaders().getFirst("X-Api-Key"));
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, """
                    {"jsonrpc":"2.0","result":"0x10","id":1}
                    """);
        });

        RpcProvider provider = HttpRpcProvider.create(
                new RpcConfig(baseUri.toString(), null, null, Map.of("X-Api-Key", "secret")));
        JsonRpcResponse response = provider.send("eth_blockNumber", List.of());

        assertEquals("0x10", response.resultAsString());
        assertEquals("secret", apiKey.get());
        assertTrue(body.get().contains("\"method\":\"eth_blockNumber\""));
        assertTrue(body.get().contains("\"jsonrpc\":\"2.0\""));
    }

    @Test
    void httpErrorStatusMapsToRpcException() {
        server.createContext("/", exchange -> respond(exchange, 503, "upstream unavailable"));

        RpcProvider provider = HttpRpcProvider.create(baseUri.toString());
        RpcException ex = assertThrows(RpcException.class, () -> provider.send("eth_getLogs", List.of()));

        assertEquals(-32001, ex.code());
        assertEquals("upstream unavailable", ex.data());
        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    void jsonRpcErrorKeepsCodeAndFlattensData() {
        server.createContext("/", exchange -> respond(exchange, 200, """
                {"jsonrpc":"2.0","error":{"code":-32005,"message":"limit exceeded","data":{"detail":"range"}},"id":1}
                """));

        RpcProvider provider = HttpRpcProvider.create(baseUri.toString());
        RpcException ex = assertThrows(RpcException.class, () -> provider.send("eth_getLogs", List.of()));

        assertEquals(-32005, ex.code());
        assertEquals("range", ex.data());
        assertEquals(1L, ex.requestId());
    }

    @Test
    void unparseableBodyIsReported() {
        server.createContext("/", exchange -> respond(exchange, 200, "<html>not json</html>"));

        RpcProvider provider = HttpRpcProvider.create(baseUri.toString());
        RpcException ex = assertThrows(RpcException.class, () -> provider.send("eth_chainId", List.of()));

        assertEquals(-32700, ex.code());
    }

    @Test
    void cannotSubscribe() {
        RpcProvider provider = HttpRpcProvider.create(baseUri.toString());

        assertThrows(UnsupportedOperationException.class,
                () -> provider.subscribe("newHeads", List.of(), n -> { }, e -> { }));
    }

    @Test
    void servesAsReadChannelOfTransport() {
        server.createContext("/", exchange -> respond(exchange, 200, """
                {"jsonrpc":"2.0","result":"0x1b4","id":1}
                """));
        RpcChainTransport transport = new RpcChainTransport(HttpRpcProvider.create(baseUri.toString()));

        assertEquals(436L, transport.getBlockNumber());
        assertThrows(TransportStartException.class, () -> transport.watchBlocks(block -> { }, error -> { }));
        transport.close();
    }

    @Test
    void logsTrafficWhenRpcDebugEnabled() {
        server.createContext("/", exchange -> respond(exchange, 500, "oops"));
        ChainwatchDebug.setRpcLogging(true);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);

        RpcProvider provider = HttpRpcProvider.create(baseUri.toString());
        assertThrows(RpcException.class, () -> provider.send("eth_blockNumber", List.of()));

        assertFalse(appender.list.isEmpty());
        String message = appender.list.get(0).getFormattedMessage();
        assertTrue(message.contains("[RPC-ERROR]"));
        assertTrue(message.contains("method=eth_blockNumber"));
    }

    private void respond(final HttpExchange exchange, final int statusCode, final String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
