// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.chainwatch.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import sh.chainwatch.core.abi.EventAbi;
import sh.chainwatch.core.error.BackfillException;
import sh.chainwatch.core.error.RpcException;
import sh.chainwatch.core.error.TransportStartException;
import sh.chainwatch.core.model.BlockHeader;
import sh.chainwatch.core.model.LogEntry;
import sh.chainwatch.core.types.Address;
import sh.chainwatch.rpc.FakeChainTransport.FakeWatch;
import sh.chainwatch.rpc.subscription.EventDispatcher;
import sh.chainwatch.rpc.subscription.ManualExecutor;
import sh.chainwatch.rpc.subscription.ManualScheduler;
import sh.chainwatch.rpc.subscription.ReconnectConfig;
import sh.chainwatch.rpc.subscription.ReconnectPhase;
import sh.chainwatch.rpc.subscription.Subscription;
import sh.chainwatch.rpc.subscription.SubscriptionKey;

class ChainWatcherTest {

    private static final SubscriptionKey.ContractEvent TRANSFER =
            SubscriptionKey.contractEvent(Fixtures.TOKEN, "Transfer");

    private final Logger watcherLogger = (Logger) LoggerFactory.getLogger(ChainWatcher.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    private FakeChainTransport transport;
    private ManualScheduler scheduler;
    private ManualExecutor io;
    private ChainWatcher watcher;

    @BeforeEach
    void setUp() {
        appender.start();
        watcherLogger.addAppender(appender);
        transport = new FakeChainTransport();
        scheduler = new ManualScheduler();
        io = new ManualExecutor();
        watcher = ChainWatcher.builder(transport)
                .reconnect(new ReconnectConfig(Duration.ofMillis(1000), 2))
                .drainTimeout(Duration.ofMillis(100))
                .scheduler(scheduler)
                .ioExecutor(io)
                .build();
    }

    @AfterEach
    void tearDown() {
        watcherLogger.detachAppender(appender);
        watcher.destroy(false);
    }

    @Test
    void contractEventWatchStopsWithSecondUnsubscribe() {
        List<LogEntry> a = new ArrayList<>();
        List<LogEntry> b = new ArrayList<>();
        Subscription first = watcher.onContractEvent(Fixtures.TOKEN, "Transfer", a::add);
        Subscription second = watcher.onContractEvent(
                new Address("0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa"), "Transfer", b::add);
        assertEquals(1, transport.startCount());

        first.unsubscribe();
        assertEquals(1, transport.openWatches().size());

        second.unsubscribe();
        assertTrue(transport.openWatches().isEmpty());
        assertTrue(watcher.activeSubscriptions().isEmpty());
    }

    @Test
    void threeErrorsRetryAtOneAndTwoSecondsThenStall() {
        watcher.onBlock(block -> { });

        transport.lastWatch().fail("e1");
        assertEquals(List.of(1000L), scheduler.pendingDelays());
        scheduler.advance(1000);

        transport.lastWatch().fail("e2");
        assertEquals(List.of(2000L), scheduler.pendingDelays());
        scheduler.advance(2000);

        transport.lastWatch().fail("e3");
        assertEquals(0, scheduler.pendingCount());
        assertEquals(ReconnectPhase.STALLED, watcher.status(SubscriptionKey.BLOCKS).orElseThrow().phase());

        assertTrue(watcher.resetSubscription(SubscriptionKey.BLOCKS));
        assertEquals(ReconnectPhase.ACTIVE, watcher.status(SubscriptionKey.BLOCKS).orElseThrow().phase());
    }

    @Test
    void reconnectConfigAppliesToKeysCreatedLater() {
        watcher.onBlock(block -> { });
        watcher.setReconnectConfig(250L, null);

        watcher.onContractEvent(Fixtures.TOKEN, "Transfer", log -> { });
        transport.watches().get(0).fail("down");
        transport.watches().get(1).fail("down");

        assertEquals(List.of(1000L, 250L), scheduler.pendingDelays());
        assertEquals(2, watcher.reconnectConfig().maxAttempts());
        assertEquals(Duration.ofMillis(250), watcher.reconnectConfig().baseDelay());
    }

    @Test
    void offContractEventByAddressRemovesAllItsEvents() {
        watcher.onContractEvent(Fixtures.TOKEN, "Transfer", log -> { });
        watcher.onContractEvent(Fixtures.TOKEN, "Approval", log -> { });
        watcher.onContractEvent(Fixtures.OTHER, "Transfer", log -> { });

        watcher.offContractEvent(Fixtures.TOKEN);

        assertEquals(List.of(SubscriptionKey.contractEvent(Fixtures.OTHER, "Transfer")),
                watcher.activeSubscriptions());
        watcher.offContractEvent(Fixtures.OTHER, "Transfer");
        assertTrue(watcher.activeSubscriptions().isEmpty());
    }

    @Test
    void offBlockAndOffTransactionStopTheirWatches() {
        watcher.onBlock(block -> { });
        watcher.onBlock(block -> { });
        watcher.onTransaction(tx -> { });

        watcher.offBlock();
        watcher.offTransaction();

        assertTrue(transport.openWatches().isEmpty());
    }

    @Test
    void backfillReplaysHistoryInChainOrder() {
        transport.logs(List.of(Fixtures.log(5, 1), Fixtures.log(3, 0), Fixtures.log(5, 0)));
        List<LogEntry> received = new ArrayList<>();

        watcher.onContractEvent(Fixtures.TOKEN, "Transfer", received::add,
                ContractEventOptions.builder()
                        .abi(EventAbi.of(Fixtures.TRANSFER_DECL))
                        .fromBlock(0)
                        .toBlock(10)
                        .build());
        io.runAll();
        transport.lastWatch().emit(List.of(Fixtures.log(11, 0)));

        assertEquals(List.of(3L, 5L, 5L, 11L), received.stream().map(LogEntry::blockNumber).toList());
        assertTrue(transport.lastWatch().filter().event() != null);
    }

    @Test
    void backfillDroppedWhenListenerRemovedBeforeScanCompletes() {
        transport.logs(List.of(Fixtures.log(1, 0)));
        List<LogEntry> received = new ArrayList<>();
        Subscription subscription = watcher.onContractEvent(Fixtures.TOKEN, "Transfer", received::add,
                ContractEventOptions.builder().fromBlock(0).build());

        subscription.unsubscribe();
        io.runAll();

        assertTrue(received.isEmpty());
        assertEquals(1, transport.logQueries().size());
    }

    @Test
    void failedBackfillIsLoggedAndLiveWatchStays() {
        transport.failLogs(new RpcException(-32000, "header not found", null, 1L));

        watcher.onContractEvent(Fixtures.TOKEN, "Transfer", log -> { },
                ContractEventOptions.builder().fromBlock(0).toBlock(5).build());
        io.runAll();

        ILoggingEvent error = appender.list.stream()
                .filter(e -> e.getLevel() == Level.ERROR)
                .findFirst()
                .orElseThrow();
        assertTrue(error.getFormattedMessage().startsWith("Backfill for"));
        assertEquals(BackfillException.class.getName(), error.getThrowableProxy().getClassName());
        assertTrue(watcher.status(TRANSFER).isPresent());
    }

    @Test
    void firstListenerSeesStartFailure() {
        transport.failNextStart("provider cannot push");

        assertThrows(TransportStartException.class, () -> watcher.onBlock(block -> { }));
        assertTrue(watcher.status(SubscriptionKey.BLOCKS).isEmpty());
    }

    @Test
    void getContractEventsReturnsSortedLogs() {
        transport.blockNumber(20);
        transport.logs(List.of(Fixtures.log(9, 2), Fixtures.log(4, 7)));

        List<LogEntry> logs = watcher.getContractEvents(Fixtures.TOKEN, "Transfer", 0, null, EventAbi.empty());

        assertEquals(List.of(4L, 9L), logs.stream().map(LogEntry::blockNumber).toList());
        assertEquals(20, transport.logQueries().get(0).toBlock());
        assertEquals(20, watcher.getBlockNumber());
    }

    @Test
    void destroyWithCleanupSilencesEverything() throws Exception {
        List<BlockHeader> blocks = new ArrayList<>();
        watcher.onBlock(blocks::add);
        FakeWatch watch = transport.lastWatch();
        watcher.onContractEvent(Fixtures.TOKEN, "Transfer", log -> { });
        transport.lastWatch().fail("down");

        CompletableFuture<Void> done = watcher.destroy(true);
        done.get(5, TimeUnit.SECONDS);

        assertSame(done, watcher.destroy(true));
        assertTrue(transport.openWatches().isEmpty());
        assertEquals(0, scheduler.pendingCount());
        assertEquals(1, transport.closeCount());
        watch.emit(Fixtures.header(1));
        assertTrue(blocks.isEmpty());
        assertTrue(watcher.isClosed());
    }

    @Test
    void closedWatcherRejectsCalls() {
        watcher.close();

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> watcher.onBlock(block -> { }));
        assertEquals("ChainWatcher is closed", ex.getMessage());
        assertThrows(IllegalStateException.class, () -> watcher.getBlockNumber());
    }

    @Test
    void watchersShareNothing() {
        FakeChainTransport otherTransport = new FakeChainTransport();
        ManualScheduler otherScheduler = new ManualScheduler();
        ChainWatcher other = ChainWatcher.builder(otherTransport)
                .scheduler(otherScheduler)
                .ioExecutor(new ManualExecutor())
                .build();
        try {
            watcher.onBlock(block -> { });
            other.onBlock(block -> { });
            watcher.setReconnectConfig(10L, 1);

            transport.lastWatch().fail("down");
            otherTransport.lastWatch().fail("down");

            assertEquals(List.of(1000L), scheduler.pendingDelays());
            assertEquals(List.of(3000L), otherScheduler.pendingDelays());
            watcher.destroy(false);
            assertFalse(other.isClosed());
            assertEquals(0, otherTransport.closeCount());
            assertNotSame(watcher.reconnectConfig(), other.reconnectConfig());
        } finally {
            other.destroy(false);
        }
    }

    @Test
    void listenerThrowingErrorLeavesOthersServedOnDefaultEventLoop() throws Exception {
        FakeChainTransport live = new FakeChainTransport();
        ChainWatcher real = ChainWatcher.create(live);
        Logger dispatcherLogger = (Logger) LoggerFactory.getLogger(EventDispatcher.class);
        ListAppender<ILoggingEvent> errors = new ListAppender<>();
        errors.start();
        dispatcherLogger.addAppender(errors);
        try {
            List<Long> seen = new CopyOnWriteArrayList<>();
            CountDownLatch done = new CountDownLatch(2);
            real.onBlock(block -> {
                throw new AssertionError("broken listener");
            });
            real.onBlock(block -> {
                seen.add(block.number());
                done.countDown();
            });

            live.lastWatch().emit(Fixtures.header(7));
            live.lastWatch().emit(Fixtures.header(8));

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(List.of(7L, 8L), seen);
            assertEquals(2, errors.list.stream().filter(e -> e.getLevel() == Level.ERROR).count());
        } finally {
            dispatcherLogger.detachAppender(errors);
            real.close();
        }
    }

    @Test
    void optionsRejectToBlockWithoutFromBlock() {
        assertThrows(IllegalArgumentException.class,
                () -> ContractEventOptions.builder().toBlock(5).build());
    }
}
