// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import static io.strand.events.TestBlocks.ccEvent;
import static io.strand.events.TestBlocks.filteredReceived;
import static io.strand.events.TestBlocks.received;
import static io.strand.events.TestBlocks.tx;
import static io.strand.events.TestBlocks.validTx;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.strand.core.error.BlockDecodingException;
import io.strand.core.model.TxValidationCode;
import io.strand.events.BackpressurePolicy;
import io.strand.events.BlockEvent;
import io.strand.events.BlockFilter;
import io.strand.events.CcEvent;
import io.strand.events.ConnectionEvent;
import io.strand.events.EventKind;
import io.strand.events.EventMetrics;
import io.strand.events.EventServiceConfig;
import io.strand.events.FilteredBlockEvent;
import io.strand.events.Registration;
import io.strand.events.TxStatusEvent;
import io.strand.events.internal.Subscriber.BlockSubscriber;
import io.strand.events.internal.Subscriber.ChaincodeSubscriber;
import io.strand.events.internal.Subscriber.ConnectionSubscriber;
import io.strand.events.internal.Subscriber.FilteredBlockSubscriber;
import io.strand.events.internal.Subscriber.TxStatusSubscriber;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

@ExtendWith(MockitoExtension.class)
class DispatcherTest {

    @Mock
    private EventMetrics metrics;

    private final SubscriberRegistry registry = new SubscriberRegistry();
    private final Logger logger = (Logger) LoggerFactory.getLogger("io.strand.events.test.dispatcher");
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void setUp() {
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAndStopAllAppenders();
    }

    private Dispatcher dispatcher(BackpressurePolicy policy, Duration consumerTimeout) {
        return new Dispatcher(registry, EventServiceConfig.builder()
                .backpressurePolicy(policy)
                .consumerTimeout(consumerTimeout)
                .logger(logger)
                .metrics(metrics)
                .build());
    }

    private Dispatcher dispatcher() {
        return dispatcher(BackpressurePolicy.DROP, Duration.ofMillis(500));
    }

    private BoundedEventChannel<BlockEvent> blockChannel(int capacity, BlockFilter filter) {
        BoundedEventChannel<BlockEvent> channel = new BoundedEventChannel<>(capacity);
        registry.insert(new BlockSubscriber(filter, channel));
        return channel;
    }

    private BoundedEventChannel<BlockEvent> blockChannel(int capacity) {
        return blockChannel(capacity, null);
    }

    private static <T> List<T> drain(BoundedEventChannel<T> channel) throws InterruptedException {
        List<T> events = new ArrayList<>();
        T event;
        while ((event = channel.poll(0, TimeUnit.MILLISECONDS)) != null) {
            events.add(event);
        }
        return events;
    }

    @Test
    void everyBlockSubscriberReceivesEachBlockOnce() throws Exception {
        Dispatcher dispatcher = dispatcher();
        List<BoundedEventChannel<BlockEvent>> channels = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            channels.add(blockChannel(10));
        }

        dispatcher.dispatch(received(1));
        dispatcher.dispatch(received(2));

        for (BoundedEventChannel<BlockEvent> channel : channels) {
            List<BlockEvent> events = drain(channel);
            assertEquals(2, events.size());
            assertEquals(1, events.get(0).block().number());
            assertEquals(2, events.get(1).block().number());
        }
        verify(metrics, times(10)).onEventDelivered(EventKind.BLOCK);
        verify(metrics).onBlockDispatched(eq(1L), any(Duration.class));
    }

    @Test
    void blockFilterDecidesDelivery() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<BlockEvent> never = blockChannel(10, b -> false);
        BoundedEventChannel<BlockEvent> always = blockChannel(10, b -> true);
        BoundedEventChannel<BlockEvent> even = blockChannel(10, b -> b.number() % 2 == 0);

        for (long n = 1; n <= 4; n++) {
            dispatcher.dispatch(received(n));
        }

        assertEquals(0, drain(never).size());
        assertEquals(4, drain(always).size());
        assertEquals(List.of(2L, 4L), drain(even).stream().map(e -> e.block().number()).toList());
    }

    @Test
    void throwingFilterSkipsOnlyItsSubscriber() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<BlockEvent> broken = blockChannel(10, b -> {
            throw new IllegalStateException("filter bug");
        });
        BoundedEventChannel<BlockEvent> healthy = blockChannel(10);

        dispatcher.dispatch(received(1));

        assertEquals(0, broken.size());
        assertEquals(1, healthy.size());
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
                && e.getFormattedMessage().contains("Block filter failed on block 1")));
    }

    @Test
    void txStatusDeliveredOnceBeforeNextBlock() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<TxStatusEvent> status = new BoundedEventChannel<>(10);
        registry.insert(new TxStatusSubscriber("abc123", status));
        BoundedEventChannel<BlockEvent> blocks = blockChannel(10);

        dispatcher.dispatch(received(10, validTx("other"), validTx("abc123")));
        assertEquals(1, status.size());
        dispatcher.dispatch(received(11, validTx("unrelated")));

        List<TxStatusEvent> events = drain(status);
        assertEquals(List.of(new TxStatusEvent("abc123", TxValidationCode.VALID, 10)), events);
        assertEquals(2, drain(blocks).size());
    }

    @Test
    void txStatusReportsInvalidTransactions() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<TxStatusEvent> status = new BoundedEventChannel<>(10);
        registry.insert(new TxStatusSubscriber("tx9", status));

        dispatcher.dispatch(received(3, tx("tx9", TxValidationCode.MVCC_READ_CONFLICT)));

        assertEquals(TxValidationCode.MVCC_READ_CONFLICT, status.poll(0, TimeUnit.MILLISECONDS).txValidationCode());
    }

    @Test
    void chaincodeSubscriberMatchesIdExactlyAndNameByPattern() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<CcEvent> cc = new BoundedEventChannel<>(10);
        registry.insert(new ChaincodeSubscriber("cc1", Pattern.compile("^evt.*"), cc));

        dispatcher.dispatch(received(5,
                validTx("t1", ccEvent("cc1", "t1", "evt1")),
                validTx("t2", ccEvent("cc1", "t2", "evtX")),
                validTx("t3", ccEvent("cc2", "t3", "evt1")),
                validTx("t4", ccEvent("cc1", "t4", "other"))));

        List<CcEvent> events = drain(cc);
        assertEquals(List.of("evt1", "evtX"), events.stream().map(CcEvent::eventName).toList());
        assertEquals("t1", events.get(0).txId());
        assertEquals(5, events.get(0).blockNumber());
        assertArrayEquals("evt1".getBytes(StandardCharsets.UTF_8), events.get(0).payload());
    }

    @Test
    void chaincodeEventsOfInvalidTransactionsAreNotPublished() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<CcEvent> cc = new BoundedEventChannel<>(10);
        registry.insert(new ChaincodeSubscriber("cc1", Pattern.compile("evt"), cc));

        dispatcher.dispatch(received(5,
                tx("bad", TxValidationCode.ENDORSEMENT_POLICY_FAILURE, ccEvent("cc1", "bad", "evt1")),
                validTx("good", ccEvent("cc1", "good", "evt2"))));

        assertEquals(List.of("good"), drain(cc).stream().map(CcEvent::txId).toList());
    }

    @Test
    void filteredSubscriberGetsBlockDerivedFromFullBlock() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<FilteredBlockEvent> filtered = new BoundedEventChannel<>(10);
        registry.insert(new FilteredBlockSubscriber(filtered));

        dispatcher.dispatch(received(8, validTx("t1", ccEvent("cc1", "t1", "evt1"))));

        FilteredBlockEvent event = filtered.poll(0, TimeUnit.MILLISECONDS);
        assertNotNull(event);
        assertEquals(8, event.filteredBlock().number());
        assertEquals(0, event.filteredBlock().filteredTransactions().get(0).chaincodeEvents().get(0).payload().length);
    }

    @Test
    void filteredBlockFeedsFilteredTxStatusAndChaincodeButNotBlockSubscribers() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<BlockEvent> blocks = blockChannel(10);
        BoundedEventChannel<FilteredBlockEvent> filtered = new BoundedEventChannel<>(10);
        registry.insert(new FilteredBlockSubscriber(filtered));
        BoundedEventChannel<TxStatusEvent> status = new BoundedEventChannel<>(10);
        registry.insert(new TxStatusSubscriber("t1", status));
        BoundedEventChannel<CcEvent> cc = new BoundedEventChannel<>(10);
        registry.insert(new ChaincodeSubscriber("cc1", Pattern.compile("evt"), cc));

        dispatcher.dispatch(filteredReceived(4, validTx("t1", ccEvent("cc1", "t1", "evt1"))));

        assertEquals(0, blocks.size());
        assertEquals(1, filtered.size());
        assertEquals(1, status.size());
        CcEvent ccEvent = cc.poll(0, TimeUnit.MILLISECONDS);
        assertNotNull(ccEvent);
        assertEquals(0, ccEvent.payload().length);
    }

    @Test
    void replayedBlocksAreSkipped() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<BlockEvent> blocks = blockChannel(10);
        assertNull(dispatcher.resumeFrom());

        dispatcher.dispatch(received(1));
        dispatcher.dispatch(received(2));
        dispatcher.dispatch(received(2));
        dispatcher.dispatch(received(1));
        dispatcher.dispatch(received(3));

        assertEquals(List.of(1L, 2L, 3L), drain(blocks).stream().map(e -> e.block().number()).toList());
        assertEquals(4L, dispatcher.resumeFrom());
        assertEquals(3L, dispatcher.lastBlockNumber());
    }

    @Test
    void dropPolicyDropsForStalledSubscriberOnly() throws Exception {
        Dispatcher dispatcher = dispatcher(BackpressurePolicy.DROP, Duration.ofMillis(500));
        BoundedEventChannel<BlockEvent> fast = blockChannel(1);
        BoundedEventChannel<BlockEvent> stalled = blockChannel(1);

        List<Long> fastSeen = new ArrayList<>();
        for (long n = 1; n <= 3; n++) {
            dispatcher.dispatch(received(n));
            fastSeen.add(fast.take().block().number());
        }

        assertEquals(List.of(1L, 2L, 3L), fastSeen);
        assertEquals(1, stalled.size());
        assertEquals(1, stalled.take().block().number());
        assertEquals(2, stalled.droppedCount());
        assertEquals(0, fast.droppedCount());
        verify(metrics, times(2)).onEventDropped(EventKind.BLOCK);
    }

    @Test
    void timeoutPolicyWaitsThenDrops() throws Exception {
        Dispatcher dispatcher = dispatcher(BackpressurePolicy.TIMEOUT, Duration.ofMillis(50));
        BoundedEventChannel<BlockEvent> fast = blockChannel(1);
        BoundedEventChannel<BlockEvent> stalled = blockChannel(1);

        dispatcher.dispatch(received(1));
        fast.take();
        long start = System.nanoTime();
        dispatcher.dispatch(received(2));
        long elapsed = System.nanoTime() - start;

        assertTrue(elapsed >= TimeUnit.MILLISECONDS.toNanos(40), "waited " + elapsed + "ns");
        assertEquals(2, fast.take().block().number());
        assertEquals(1, stalled.droppedCount());
        assertEquals(1, stalled.take().block().number());
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
                && e.getFormattedMessage().contains("Subscriber channel full")));
    }

    @Test
    void blockPolicyStallsUntilConsumerMakesRoom() throws Exception {
        Dispatcher dispatcher = dispatcher(BackpressurePolicy.BLOCK, Duration.ofMillis(500));
        BoundedEventChannel<BlockEvent> stalled = blockChannel(1);

        dispatcher.dispatch(received(1));
        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> {
            try {
                dispatcher.dispatch(received(2));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(100);
        assertFalse(second.isDone());
        assertEquals(1, stalled.take().block().number());
        second.get(5, TimeUnit.SECONDS);
        assertEquals(2, stalled.take().block().number());
        assertEquals(0, stalled.droppedCount());
        verify(metrics, never()).onEventDropped(any());
    }

    @Test
    void blockPolicyReleasedWhenChannelCloses() throws Exception {
        Dispatcher dispatcher = dispatcher(BackpressurePolicy.BLOCK, Duration.ofMillis(500));
        BoundedEventChannel<BlockEvent> stalled = blockChannel(1);
        dispatcher.dispatch(received(1));

        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> {
            try {
                dispatcher.dispatch(received(2));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        stalled.close();

        second.get(5, TimeUnit.SECONDS);
        assertEquals(0, stalled.droppedCount());
    }

    @Test
    void unregisteredSubscriberReceivesNothingFurther() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<BlockEvent> channel = new BoundedEventChannel<>(10);
        Registration handle = registry.insert(new BlockSubscriber(null, channel));

        dispatcher.dispatch(received(1));
        registry.remove(handle);
        channel.close();
        dispatcher.dispatch(received(2));

        assertEquals(List.of(1L), drain(channel).stream().map(e -> e.block().number()).toList());
        assertEquals(0, channel.droppedCount());
    }

    @Test
    void dispatchErrorIsReportedToConnectionSubscribers() throws Exception {
        Dispatcher dispatcher = dispatcher();
        BoundedEventChannel<ConnectionEvent> connection = new BoundedEventChannel<>(10);
        registry.insert(new ConnectionSubscriber(connection));
        BlockDecodingException error = new BlockDecodingException("bad frame");

        dispatcher.reportDispatchError(error);

        ConnectionEvent event = connection.poll(0, TimeUnit.MILLISECONDS);
        assertNotNull(event);
        assertTrue(event.connected());
        assertSame(error, event.error());
        verify(metrics).onDispatchError(error);
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR));
    }

    @Test
    void connectionEventsNeverBlock() {
        Dispatcher dispatcher = dispatcher(BackpressurePolicy.BLOCK, Duration.ofMillis(500));
        BoundedEventChannel<ConnectionEvent> connection = new BoundedEventChannel<>(1);
        registry.insert(new ConnectionSubscriber(connection));

        dispatcher.publishConnectionEvent(ConnectionEvent.connectedEvent());
        dispatcher.publishConnectionEvent(ConnectionEvent.disconnected(new IllegalStateException("gone")));

        assertEquals(1, connection.size());
        assertEquals(1, connection.droppedCount());
        verify(metrics).onEventDropped(EventKind.CONNECTION);
    }

    @Test
    void blockLatencyIsReported() throws Exception {
        Dispatcher dispatcher = dispatcher();
        dispatcher.dispatch(received(42));
        verify(metrics).onBlockDispatched(eq(42L), any(Duration.class));
        verify(metrics, never()).onBlockDispatched(eq(41L), any(Duration.class));
        verify(metrics, times(1)).onBlockDispatched(anyLong(), any());
    }
}
