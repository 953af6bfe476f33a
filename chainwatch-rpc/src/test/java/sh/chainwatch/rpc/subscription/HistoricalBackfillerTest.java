// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc.subscription;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.chainwatch.core.abi.EventAbi;
import sh.chainwatch.core.error.BackfillException;
import sh.chainwatch.core.error.RpcException;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.rpc.FakeChainTransport;
import sh.chainwatch.rpc.Fixtures;
import sh.chainwatch.rpc.LogQuery;

@ExtendWith(MockitoExtension.class)
class HistoricalBackfillerTest {

    @Mock
    private SubscriptionMetrics metrics;

    private FakeChainTransport transport;
    private ManualExecutor io;
    private HistoricalBackfiller backfiller;

    @BeforeEach
    void setUp() {
        transport = new FakeChainTransport();
        io = new ManualExecutor();
        backfiller = new HistoricalBackfiller(
                transport, new EventDispatcher(new ManualScheduler(), metrics), io, metrics);
    }

    @Test
    void deliversInBlockThenLogIndexOrder() {
        transport.logs(List.of(Fixtures.log(5, 1), Fixtures.log(3, 0), Fixtures.log(5, 0)));
        List<LogEntry> received = new ArrayList<>();

        CompletableFuture<Integer> done = backfiller.backfill(request(0, 10L), received::add, () -> true);
        io.runAll();

        assertEquals(3, done.join());
        assertEquals(List.of(3L, 5L, 5L), received.stream().map(LogEntry::blockNumber).toList());
        assertEquals(List.of(0L, 0L, 1L), received.stream().map(LogEntry::logIndex).toList());
        verify(metrics).onBackfillCompleted(SubscriptionKey.contractEvent(Fixtures.TOKEN, "Transfer"), 3);
    }

    @Test
    void missingToBlockResolvesToHead() {
        transport.blockNumber(42);

        backfiller.scan(request(7, null));

        LogQuery query = transport.logQueries().get(0);
        assertEquals(7, query.fromBlock());
        assertEquals(42, query.toBlock());
        assertEquals(1, transport.blockNumberCalls());
    }

    @Test
    void negativeFromBlockIsClampedToGenesis() {
        backfiller.scan(request(-100, 5L));

        assertEquals(0, transport.logQueries().get(0).fromBlock());
    }

    @Test
    void emptyRangeMakesNoQuery() {
        transport.blockNumber(10);

        List<LogEntry> logs = backfiller.scan(request(50, null));

        assertTrue(logs.isEmpty());
        assertTrue(transport.logQueries().isEmpty());
    }

    @Test
    void abiNarrowsQueryToEventTopic() {
        backfiller.scan(new BackfillRequest(Fixtures.TOKEN, "Transfer", 0, 1L, EventAbi.of(Fixtures.TRANSFER_DECL)));

        assertNotNull(transport.logQueries().get(0).filter().event());
    }

    @Test
    void failedScanCompletesWithBackfillException() {
        transport.failLogs(new RpcException(-32005, "query returned more than 10000 results", null, 3L));

        CompletableFuture<Integer> done = backfiller.backfill(request(0, 100L), log -> { }, () -> true);
        io.runAll();

        CompletionException ex = assertThrows(CompletionException.class, done::join);
        BackfillException cause = assertInstanceOf(BackfillException.class, ex.getCause());
        assertEquals(0, cause.fromBlock());
        assertEquals(100L, cause.toBlock());
        assertInstanceOf(RpcException.class, cause.getCause());
        assertEquals(0, backfiller.inFlightCount());
    }

    @Test
    void resultsAreDroppedWhenNoLongerWanted() {
        transport.logs(List.of(Fixtures.log(1, 0)));
        List<LogEntry> received = new ArrayList<>();

        CompletableFuture<Integer> done = backfiller.backfill(request(0, 10L), received::add, () -> false);
        io.runAll();

        assertEquals(0, done.join());
        assertTrue(received.isEmpty());
        assertEquals(1, transport.logQueries().size());
    }

    @Test
    void awaitInFlightWaitsForRunningScans() {
        transport.logs(List.of(Fixtures.log(1, 0)));
        backfiller.backfill(request(0, 10L), log -> { }, () -> true);

        assertEquals(1, backfiller.inFlightCount());
        assertFalse(backfiller.awaitInFlight(Duration.ofMillis(20)));

        io.runAll();
        assertTrue(backfiller.awaitInFlight(Duration.ofMillis(20)));
        assertEquals(0, backfiller.inFlightCount());
    }

    @Test
    void abandonCancelsRunningScans() {
        CompletableFuture<Integer> done = backfiller.backfill(request(0, 10L), log -> { }, () -> true);

        backfiller.abandon();

        assertTrue(done.isCancelled());
        assertEquals(0, backfiller.inFlightCount());
    }

    private static BackfillRequest request(final long from, final Long to) {
        return new BackfillRequest(Fixtures.TOKEN, "Transfer", from, to, EventAbi.empty());
    }
}
