package com.qqsuccubus.chatgw.gateway.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.qqsuccubus.chatgw.core.error.TransientBrokerException;
import com.qqsuccubus.chatgw.core.event.EventTypes;
import com.qqsuccubus.chatgw.core.event.PlatformEvent;
import com.qqsuccubus.chatgw.core.metrics.MetricsNames;
import com.qqsuccubus.chatgw.core.metrics.MetricsTags;
import com.qqsuccubus.chatgw.core.util.JsonUtils;
import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import com.qqsuccubus.chatgw.gateway.metrics.MetricsService;
import com.qqsuccubus.chatgw.gateway.testsupport.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for EventPublisher.
 * The broker and the fallback buffer are in-memory; all delays run on virtual time.
 */
class EventPublisherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Duration FIRST_RECONNECT = Duration.ofSeconds(1);

    private GatewayConfig config;
    private VirtualTimeScheduler timer;
    private SimpleMeterRegistry registry;
    private MetricsService metricsService;
    private TestBrokerTransport transport;
    private TestFallbackBuffer buffer;
    private EventPublisher publisher;

    @BeforeEach
    void setUp() {
        config = TestConfigs.gatewayConfig(Path.of("sessions"));
        timer = VirtualTimeScheduler.create();
        registry = new SimpleMeterRegistry();
        metricsService = new MetricsService(registry, config);
        transport = new TestBrokerTransport();
        buffer = new TestFallbackBuffer();
        publisher = new EventPublisher(config, transport, buffer, metricsService,
                Clock.fixed(NOW, ZoneOffset.UTC), timer);
    }

    private static PlatformEvent event(int seq) {
        return PlatformEvent.builder()
                .sessionId("session-a")
                .type(EventTypes.MESSAGE_RECEIVED)
                .occurredAt(NOW)
                .field("seq", seq)
                .build();
    }

    private void publish(int... seqs) {
        for (int seq : seqs) {
            StepVerifier.create(publisher.publishEvent(event(seq))).verifyComplete();
        }
    }

    private void startDisconnected() {
        transport.setFailConnects(true);
        publisher.initialize().block();
        transport.setFailConnects(false);
    }

    // ========== Direct Publish Tests ==========

    @Test
    @DisplayName("Should publish directly while connected and the buffer is empty")
    void testPublishDirect() {
        // Given
        publisher.initialize().block();

        // When
        publish(1);

        // Then
        assertTrue(publisher.isConnected());
        List<TestBrokerTransport.Published> published = transport.getPublished();
        assertEquals(1, published.size());
        assertEquals("session-a", published.get(0).key);
        JsonNode json = JsonUtils.readTree(published.get(0).payload);
        assertEquals("whatsapp_unofficial", json.get("platform").asText());
        assertEquals(EventTypes.MESSAGE_RECEIVED, json.get("type").asText());
        assertEquals(1, json.get("seq").asInt());
        assertEquals(0, bufferSize());
        assertEquals(1.0, registry.get(MetricsNames.EVENTS_PUBLISHED_TOTAL)
                .tag(MetricsTags.RESULT, "direct").counter().count());
    }

    // ========== Buffer And Drain Tests ==========

    @Test
    @DisplayName("Should buffer events while disconnected and replay them in order after reconnect")
    void testBufferWhileDisconnectedAndReplayInOrder() {
        // Given
        startDisconnected();

        // When
        publish(1, 2, 3);

        // Then
        assertTrue(transport.getPublished().isEmpty());
        assertEquals(3, bufferSize());
        assertTrue(buffer.entries().get(0).contains("\"bufferedAt\""));

        timer.advanceTimeBy(Duration.ofMinutes(1));

        assertTrue(publisher.isConnected());
        assertFalse(publisher.isDraining());
        assertEquals(List.of(1, 2, 3), publishedSeqs());
        assertEquals(0, bufferSize());
        transport.getPublished().forEach(p -> assertNull(JsonUtils.readTree(p.payload).get("bufferedAt")));
        assertEquals(3.0, metricsService.getBufferedCount());
        assertEquals(3.0, registry.get(MetricsNames.EVENTS_PUBLISHED_TOTAL)
                .tag(MetricsTags.RESULT, "replayed").counter().count());
    }

    @Test
    @DisplayName("Should queue events published during a drain behind the backlog")
    void testEventsDuringDrainQueueBehindBacklog() {
        // Given
        startDisconnected();
        publish(1, 2, 3);

        // When
        timer.advanceTimeBy(FIRST_RECONNECT);
        assertTrue(publisher.isDraining());
        publish(4);

        // Then
        assertEquals(List.of(1, 2), publishedSeqs());
        timer.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(List.of(1, 2, 3, 4), publishedSeqs());
        assertFalse(publisher.isDraining());

        publish(5);
        assertEquals(List.of(1, 2, 3, 4, 5), publishedSeqs());
        assertEquals(4.0, metricsService.getBufferedCount());
    }

    @Test
    @DisplayName("Should buffer a rejected event and republish it through the drain")
    void testPublishFailureBuffersAndRedrains() {
        // Given
        publisher.initialize().block();
        transport.failPublishCall(1);

        // When
        publish(1);
        publish(2);

        // Then
        assertTrue(publisher.isConnected());
        timer.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(List.of(1, 2), publishedSeqs());
        assertEquals(0, bufferSize());
        assertEquals(2.0, metricsService.getBufferedCount());
        assertEquals(0.0, metricsService.getLostCount());
    }

    @Test
    @DisplayName("Should keep the failed entry at the head and retry the drain")
    void testDrainFailureKeepsHeadAndRetries() {
        // Given
        startDisconnected();
        publish(1, 2, 3);
        transport.failPublishCall(2);

        // When
        timer.advanceTimeBy(FIRST_RECONNECT);

        // Then
        assertEquals(List.of(1), publishedSeqs());
        assertEquals(2, bufferSize());
        assertEquals(2, JsonUtils.readTree(buffer.entries().get(0)).get("seq").asInt());
        assertTrue(publisher.isConnected());
        assertTrue(publisher.isDraining());

        publish(4);
        timer.advanceTimeBy(Duration.ofSeconds(5));
        assertEquals(List.of(1, 2, 3, 4), publishedSeqs());
        assertEquals(0, bufferSize());
        assertFalse(publisher.isDraining());
    }

    @Test
    @DisplayName("Should buffer after a connection loss and drain on the new connection")
    void testConnectionLossReconnects() {
        // Given
        publisher.initialize().block();
        TestBrokerTransport.TestBrokerConnection first = transport.lastConnection();

        // When
        first.drop();
        publish(1);

        // Then
        assertFalse(publisher.isConnected());
        assertEquals(1, bufferSize());

        timer.advanceTimeBy(Duration.ofMinutes(1));
        assertTrue(publisher.isConnected());
        assertEquals(2, transport.getConnectAttempts());
        assertEquals(List.of(1), publishedSeqs());
        assertEquals(0, bufferSize());
    }

    // ========== Failure Tests ==========

    @Test
    @DisplayName("Should complete and count the event as lost when the buffer rejects it")
    void testPublishNeverErrorsWhenBufferFails() {
        // Given
        startDisconnected();
        buffer.setFailAppends(true);

        // When & Then
        StepVerifier.create(publisher.publishEvent(event(1)))
                .then(() -> timer.advanceTimeBy(Duration.ofSeconds(10)))
                .verifyComplete();

        assertEquals(1.0, metricsService.getLostCount());
        assertEquals(0.0, metricsService.getBufferedCount());
        assertEquals(4, buffer.getAppendAttempts());
    }

    @Test
    @DisplayName("Should complete and count the event as lost when serialization fails")
    void testPublishNeverErrorsOnSerializationFailure() {
        // Given
        publisher.initialize().block();
        PlatformEvent unserializable = PlatformEvent.builder()
                .sessionId("session-a")
                .type(EventTypes.MESSAGE_RECEIVED)
                .field("body", new Object())
                .build();

        // When & Then
        StepVerifier.create(publisher.publishEvent(unserializable)).verifyComplete();
        assertEquals(1.0, metricsService.getLostCount());
        assertTrue(transport.getPublished().isEmpty());
    }

    @Test
    @DisplayName("Should buffer the event when the connection throws instead of signalling an error")
    void testPublishBuffersWhenConnectionThrows() {
        // Given
        publisher.initialize().block();
        transport.setThrowOnPublish(true);

        // When
        publish(1);

        // Then
        assertEquals(1, bufferSize());
        assertEquals(1.0, metricsService.getBufferedCount());
        assertEquals(0.0, metricsService.getLostCount());
        assertTrue(transport.getPublished().isEmpty());

        transport.setThrowOnPublish(false);
        timer.advanceTimeBy(Duration.ofSeconds(2));
        assertEquals(List.of(1), publishedSeqs());
        assertEquals(0, bufferSize());
    }

    // ========== Reconnect Tests ==========

    @Test
    @DisplayName("Should re-initialize on the next buffered event once reconnect attempts are exhausted")
    void testReconnectAttemptsCapped() {
        // Given
        int maxAttempts = config.getBrokerRetryAttempts();
        transport.setFailConnects(true);
        publisher.initialize().block();
        timer.advanceTimeBy(Duration.ofMinutes(5));
        assertEquals(1 + maxAttempts, transport.getConnectAttempts());
        assertEquals(maxAttempts, (int) registry.get(MetricsNames.BROKER_RECONNECT_TOTAL).counter().count());
        assertFalse(publisher.reconnect());

        // When
        transport.setFailConnects(false);
        timer.advanceTimeBy(Duration.ofHours(24));
        assertEquals(1 + maxAttempts, transport.getConnectAttempts());
        publish(1);
        timer.advanceTimeBy(Duration.ofSeconds(1));

        // Then
        assertEquals(2 + maxAttempts, transport.getConnectAttempts());
        assertTrue(publisher.isConnected());
        assertEquals(List.of(1), publishedSeqs());
        assertEquals(0, bufferSize());
        assertEquals(0, publisher.getReconnectAttempts());
    }

    @Test
    @DisplayName("Should restart the backoff schedule when re-initializing against a broker that is still down")
    void testReinitializeWhileBrokerStillDown() {
        // Given
        int maxAttempts = config.getBrokerRetryAttempts();
        transport.setFailConnects(true);
        publisher.initialize().block();
        timer.advanceTimeBy(Duration.ofMinutes(5));

        // When
        publish(1);
        publish(2);

        // Then
        assertEquals(2 + maxAttempts, transport.getConnectAttempts());
        assertEquals(1, publisher.getReconnectAttempts());
        timer.advanceTimeBy(FIRST_RECONNECT);
        assertEquals(3 + maxAttempts, transport.getConnectAttempts());
        assertEquals(2, bufferSize());
        assertFalse(publisher.isConnected());
    }

    @Test
    @DisplayName("Should back off exponentially between reconnect attempts")
    void testReconnectBackoff() {
        // Given
        transport.setFailConnects(true);
        publisher.initialize().block();

        // When & Then
        timer.advanceTimeBy(Duration.ofMillis(999));
        assertEquals(1, transport.getConnectAttempts());
        timer.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(2, transport.getConnectAttempts());
        timer.advanceTimeBy(Duration.ofSeconds(2));
        assertEquals(3, transport.getConnectAttempts());
        timer.advanceTimeBy(Duration.ofSeconds(4));
        assertEquals(4, transport.getConnectAttempts());
        timer.advanceTimeBy(Duration.ofSeconds(4));
        assertEquals(5, transport.getConnectAttempts());
        assertEquals(5, publisher.getReconnectAttempts());
    }

    @Test
    @DisplayName("Should ignore initialize while a connect is in progress")
    void testInitializeWhileConnectingIsNoOp() {
        // Given
        transport.setHangConnects(true);
        publisher.initialize().subscribe();

        // When
        StepVerifier.create(publisher.initialize()).verifyComplete();

        // Then
        assertEquals(1, transport.getConnectAttempts());
        assertFalse(publisher.isConnected());
    }

    @Test
    @DisplayName("Should allow a new connect after an in-progress connect is cancelled")
    void testInitializeAfterCancelledConnect() {
        // Given
        transport.setHangConnects(true);
        Disposable firstAttempt = publisher.initialize().subscribe();

        // When
        firstAttempt.dispose();
        transport.setHangConnects(false);
        publisher.initialize().block();

        // Then
        assertEquals(2, transport.getConnectAttempts());
        assertTrue(publisher.isConnected());
    }

    @Test
    @DisplayName("Should close the connection and the buffer and stop reconnecting")
    void testClose() {
        // Given
        publisher.initialize().block();
        TestBrokerTransport.TestBrokerConnection connection = transport.lastConnection();

        // When
        publisher.close().block();

        // Then
        assertFalse(connection.isOpen());
        assertTrue(buffer.isClosed());
        assertFalse(publisher.isConnected());
        assertFalse(publisher.reconnect());
    }

    private long bufferSize() {
        return buffer.size().block();
    }

    private List<Integer> publishedSeqs() {
        return transport.getPublished().stream()
                .map(p -> JsonUtils.readTree(p.payload).get("seq").asInt())
                .collect(Collectors.toList());
    }

    /**
     * Test stub for the broker: records acknowledged publishes across connections.
     */
    private static class TestBrokerTransport implements IBrokerTransport {
        private final List<Published> published = new CopyOnWriteArrayList<>();
        private final List<TestBrokerConnection> connections = new CopyOnWriteArrayList<>();
        private final Set<Integer> failingCalls = ConcurrentHashMap.newKeySet();
        private final AtomicInteger publishCalls = new AtomicInteger();
        private final AtomicInteger connectAttempts = new AtomicInteger();
        private volatile boolean failConnects;
        private volatile boolean hangConnects;
        private volatile boolean throwOnPublish;

        @Override
        public Mono<IBrokerConnection> connect() {
            return Mono.defer(() -> {
                connectAttempts.incrementAndGet();
                if (hangConnects) {
                    return Mono.never();
                }
                if (failConnects) {
                    return Mono.error(new TransientBrokerException("broker unreachable"));
                }
                TestBrokerConnection connection = new TestBrokerConnection();
                connections.add(connection);
                return Mono.just(connection);
            });
        }

        void setFailConnects(boolean failConnects) {
            this.failConnects = failConnects;
        }

        void setHangConnects(boolean hangConnects) {
            this.hangConnects = hangConnects;
        }

        void setThrowOnPublish(boolean throwOnPublish) {
            this.throwOnPublish = throwOnPublish;
        }

        /**
         * Makes the n-th publish call from now on fail (1-based).
         */
        void failPublishCall(int n) {
            failingCalls.add(publishCalls.get() + n);
        }

        int getConnectAttempts() {
            return connectAttempts.get();
        }

        List<Published> getPublished() {
            return new ArrayList<>(published);
        }

        TestBrokerConnection lastConnection() {
            return connections.get(connections.size() - 1);
        }

        private static class Published {
            final String key;
            final String payload;

            Published(String key, String payload) {
                this.key = key;
                this.payload = payload;
            }
        }

        private class TestBrokerConnection implements IBrokerConnection {
            private final Sinks.Empty<Void> closeSink = Sinks.empty();
            private volatile boolean open = true;

            @Override
            public Mono<Void> publish(@Nullable String key, String payload) {
                if (throwOnPublish) {
                    throw new IllegalStateException("producer already closed");
                }
                return Mono.defer(() -> {
                    int call = publishCalls.incrementAndGet();
                    if (!open || failingCalls.remove(call)) {
                        return Mono.error(new TransientBrokerException("publish rejected"));
                    }
                    published.add(new Published(key, payload));
                    return Mono.empty();
                });
            }

            @Override
            public Mono<Void> closeSignal() {
                return closeSink.asMono();
            }

            @Override
            public boolean isOpen() {
                return open;
            }

            @Override
            public void close() {
                open = false;
                closeSink.tryEmitEmpty();
            }

            void drop() {
                open = false;
                closeSink.tryEmitError(new TransientBrokerException("connection reset"));
            }
        }
    }

    /**
     * Test stub for the fallback buffer, kept in a list.
     */
    private static class TestFallbackBuffer implements IFallbackBuffer {
        private final LinkedList<String> entries = new LinkedList<>();
        private final AtomicInteger appendAttempts = new AtomicInteger();
        private volatile boolean failAppends;
        private volatile boolean closed;

        @Override
        public Mono<Void> append(String entry) {
            return Mono.fromRunnable(() -> {
                appendAttempts.incrementAndGet();
                if (failAppends) {
                    throw new IllegalStateException("buffer unavailable");
                }
                synchronized (entries) {
                    entries.addLast(entry);
                }
            });
        }

        @Override
        public Mono<List<String>> peekBatch(int count) {
            return Mono.fromCallable(() -> {
                synchronized (entries) {
                    return entries.stream().limit(count).collect(Collectors.toList());
                }
            });
        }

        @Override
        public Mono<String> removeHead() {
            return Mono.fromCallable(() -> {
                synchronized (entries) {
                    return entries.pollFirst();
                }
            });
        }

        @Override
        public Mono<Long> size() {
            return Mono.fromCallable(() -> {
                synchronized (entries) {
                    return (long) entries.size();
                }
            });
        }

        @Override
        public void close() {
            closed = true;
        }

        List<String> entries() {
            synchronized (entries) {
                return new ArrayList<>(entries);
            }
        }

        void setFailAppends(boolean failAppends) {
            this.failAppends = failAppends;
        }

        int getAppendAttempts() {
            return appendAttempts.get();
        }

        boolean isClosed() {
            return closed;
        }
    }
}
