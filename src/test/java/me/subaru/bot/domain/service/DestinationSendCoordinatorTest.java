package me.subaru.bot.domain.service;

import me.subaru.bot.domain.model.Destination;
import me.subaru.bot.infrastructure.config.BotProperties;
import me.subaru.bot.port.inbound.ChatTransportPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DestinationSendCoordinatorTest {

    private static final Destination ROOM = Destination.room("!room:example.org");

    private ChatTransportPort transport;
    private ExecutorService pool;
    private BotProperties properties;
    private DestinationSendCoordinator coordinator;

    @BeforeEach
    void setUp() {
        transport = mock(ChatTransportPort.class);
        AtomicInteger txnCounter = new AtomicInteger();
        when(transport.newTransactionId()).thenAnswer(invocation -> "txn-" + txnCounter.incrementAndGet());
        pool = Executors.newFixedThreadPool(4);
        properties = new BotProperties();
        properties.getDispatcher().setSendAttempts(3);
        properties.getDispatcher().setSendBackoff(Duration.ofMillis(10));
        coordinator = new DestinationSendCoordinator(transport, pool, properties);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void messagesToSameDestinationKeepOrder() {
        List<String> sent = Collections.synchronizedList(new ArrayList<>());
        when(transport.sendMessage(eq(ROOM), anyString(), anyString())).thenAnswer(invocation -> {
            sent.add(invocation.getArgument(1));
            return CompletableFuture.completedFuture(null);
        });

        for (int i = 0; i < 50; i++) {
            coordinator.enqueue(ROOM, "msg-" + i);
        }

        assertTrue(coordinator.awaitIdle(Duration.ofSeconds(5)));
        assertEquals(50, sent.size());
        for (int i = 0; i < 50; i++) {
            assertEquals("msg-" + i, sent.get(i));
        }
    }

    @Test
    void failedSendIsRetriedBeforeNextMessage() {
        List<String> sent = Collections.synchronizedList(new ArrayList<>());
        when(transport.sendMessage(eq(ROOM), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new ChatTransportPort.TransportSendException("502")))
                .thenAnswer(invocation -> {
                    sent.add(invocation.getArgument(1));
                    return CompletableFuture.completedFuture(null);
                });

        CompletableFuture<Boolean> first = coordinator.enqueue(ROOM, "first");
        CompletableFuture<Boolean> second = coordinator.enqueue(ROOM, "second");

        assertTrue(first.join());
        assertTrue(second.join());
        assertEquals(List.of("first", "second"), sent);
        verify(transport, times(3)).sendMessage(eq(ROOM), anyString(), anyString());
    }

    @Test
    void messageIsDroppedAfterLastAttempt() {
        when(transport.sendMessage(eq(ROOM), eq("doomed"), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new ChatTransportPort.TransportSendException("403")));
        when(transport.sendMessage(eq(ROOM), eq("next"), anyString())).thenReturn(CompletableFuture.completedFuture(null));

        CompletableFuture<Boolean> doomed = coordinator.enqueue(ROOM, "doomed");
        CompletableFuture<Boolean> next = coordinator.enqueue(ROOM, "next");

        assertFalse(doomed.join());
        assertTrue(next.join());
        verify(transport, times(3)).sendMessage(eq(ROOM), eq("doomed"), anyString());
    }

    @Test
    void synchronousTransportExceptionIsRetried() {
        when(transport.sendMessage(eq(ROOM), anyString(), anyString()))
                .thenThrow(new IllegalStateException("not logged in"))
                .thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(coordinator.enqueue(ROOM, "hello").join());
    }

    @Test
    void slowDestinationDoesNotBlockOthers() throws InterruptedException {
        Destination other = Destination.room("!other:example.org");
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch otherSent = new CountDownLatch(1);
        when(transport.sendMessage(eq(ROOM), anyString(), anyString())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(null);
        });
        when(transport.sendMessage(eq(other), anyString(), anyString())).thenAnswer(invocation -> {
            otherSent.countDown();
            return CompletableFuture.completedFuture(null);
        });

        coordinator.enqueue(ROOM, "slow");
        coordinator.enqueue(other, "fast");

        assertTrue(otherSent.await(2, TimeUnit.SECONDS));
        release.countDown();
        assertTrue(coordinator.awaitIdle(Duration.ofSeconds(2)));
    }

    @Test
    void abandonedSendsCompleteWithFalse() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        when(transport.sendMessage(eq(ROOM), anyString(), anyString())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(null);
        });
        coordinator.enqueue(ROOM, "in flight");
        CompletableFuture<Boolean> queued = coordinator.enqueue(ROOM, "queued");

        assertEquals(1, coordinator.abandonPending());
        release.countDown();

        assertFalse(queued.join());
    }

    @Test
    void retriesReuseTheTransactionIdOfTheMessage() {
        List<String> transactionIds = Collections.synchronizedList(new ArrayList<>());
        when(transport.sendMessage(eq(ROOM), anyString(), anyString())).thenAnswer(invocation -> {
            transactionIds.add(invocation.getArgument(1) + "@" + invocation.getArgument(2));
            if (transactionIds.size() < 3) {
                return CompletableFuture.failedFuture(new ChatTransportPort.TransportSendException("read timeout"));
            }
            return CompletableFuture.completedFuture(null);
        });

        assertTrue(coordinator.enqueue(ROOM, "once").join());
        assertTrue(coordinator.enqueue(ROOM, "twice").join());

        assertEquals(List.of("once@txn-1", "once@txn-1", "once@txn-1", "twice@txn-2"), transactionIds);
    }

    @Test
    void sendRejectedByStoppedPoolCompletesWithFalse() {
        pool.shutdownNow();

        CompletableFuture<Boolean> result = coordinator.enqueue(ROOM, "too late");

        assertTrue(result.isDone());
        assertFalse(result.join());
        assertEquals(0, coordinator.pendingCount());
        verify(transport, never()).sendMessage(any(), anyString(), anyString());
    }
}
