package com.qqsuccubus.chatgw.gateway.message;

import com.qqsuccubus.chatgw.core.error.NotActiveException;
import com.qqsuccubus.chatgw.core.error.NotFoundException;
import com.qqsuccubus.chatgw.core.error.ValidationException;
import com.qqsuccubus.chatgw.core.event.EventTypes;
import com.qqsuccubus.chatgw.core.event.PlatformEvent;
import com.qqsuccubus.chatgw.core.model.SessionConfig;
import com.qqsuccubus.chatgw.core.model.SessionStatus;
import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import com.qqsuccubus.chatgw.gateway.metrics.MetricsService;
import com.qqsuccubus.chatgw.gateway.protocol.ConnectionEvent;
import com.qqsuccubus.chatgw.gateway.protocol.MessageReceipt;
import com.qqsuccubus.chatgw.gateway.protocol.OutboundContent;
import com.qqsuccubus.chatgw.gateway.session.SessionManager;
import com.qqsuccubus.chatgw.gateway.testsupport.FakeProtocolClient;
import com.qqsuccubus.chatgw.gateway.testsupport.FakeProtocolClient.FakeConnection;
import com.qqsuccubus.chatgw.gateway.testsupport.InMemorySessionStore;
import com.qqsuccubus.chatgw.gateway.testsupport.MutableClock;
import com.qqsuccubus.chatgw.gateway.testsupport.RecordingEventPublisher;
import com.qqsuccubus.chatgw.gateway.testsupport.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private static final String TO = "5511999990000@s.whatsapp.net";

    @TempDir
    Path sessionsDir;

    private InMemorySessionStore store;
    private FakeProtocolClient protocolClient;
    private RecordingEventPublisher eventPublisher;
    private SessionManager sessionManager;
    private MessageService messageService;

    @BeforeEach
    void setUp() {
        GatewayConfig config = TestConfigs.gatewayConfig(sessionsDir);
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        store = new InMemorySessionStore(clock);
        protocolClient = new FakeProtocolClient();
        eventPublisher = new RecordingEventPublisher();
        sessionManager = new SessionManager(config, store, protocolClient, eventPublisher,
                payload -> "data:image/png;base64," + payload,
                new MetricsService(new SimpleMeterRegistry(), config), clock, VirtualTimeScheduler.create());
        messageService = new MessageService(store, sessionManager, eventPublisher, clock);
    }

    private FakeConnection connectedSession() {
        store.put("session-a", SessionStatus.INITIALIZING, SessionConfig.empty());
        sessionManager.startSession("session-a").block();
        FakeConnection connection = protocolClient.lastConnection();
        connection.emit(ConnectionEvent.open());
        return connection;
    }

    @Test
    @DisplayName("Should send over the live connection and publish a sent status")
    void testSendText() {
        // Given
        FakeConnection connection = connectedSession();

        // When
        MessageReceipt receipt = messageService.sendText("session-a", TO, "hello").block();

        // Then
        assertNotNull(receipt);
        assertEquals("msg-1", receipt.getId());
        assertEquals(1, connection.getSent().size());
        assertEquals("hello", connection.getSent().get(0).getFields().get("text"));

        List<PlatformEvent> statuses = eventPublisher.eventsOfType(EventTypes.MESSAGE_STATUS);
        assertEquals(1, statuses.size());
        assertEquals("sent", statuses.get(0).getPayload().get("status"));
        assertEquals("msg-1", statuses.get(0).getPayload().get("messageId"));
        assertEquals(TO, statuses.get(0).getPayload().get("chatId"));
    }

    @Test
    @DisplayName("Should refuse to send while the session is not connected")
    void testSendWhenNotConnected() {
        // Given
        store.put("session-a", SessionStatus.INITIALIZING, SessionConfig.empty());
        sessionManager.startSession("session-a").block();

        // When & Then
        StepVerifier.create(messageService.sendText("session-a", TO, "hello"))
                .expectError(NotActiveException.class)
                .verify();
        assertTrue(protocolClient.lastConnection().getSent().isEmpty());
    }

    @Test
    @DisplayName("Should refuse to send when a connected session has no live connection")
    void testSendWithoutLiveConnection() {
        // Given
        store.put("session-a", SessionStatus.CONNECTED, SessionConfig.empty());

        // When & Then
        StepVerifier.create(messageService.sendText("session-a", TO, "hello"))
                .expectError(NotActiveException.class)
                .verify();
        assertTrue(eventPublisher.getEvents().isEmpty());
    }

    @Test
    @DisplayName("Should validate recipient and content type before looking up the session")
    void testSendValidation() {
        StepVerifier.create(messageService.send("missing", OutboundContent.builder().build()))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ValidationException);
                    ValidationException validation = (ValidationException) error;
                    assertTrue(validation.getFieldErrors().containsKey("to"));
                    assertTrue(validation.getFieldErrors().containsKey("type"));
                })
                .verify();

        StepVerifier.create(messageService.sendText("missing", TO, "hello"))
                .expectError(NotFoundException.class)
                .verify();
    }
}
