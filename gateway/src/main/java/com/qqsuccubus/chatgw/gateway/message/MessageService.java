package com.qqsuccubus.chatgw.gateway.message;

import com.qqsuccubus.chatgw.core.error.ConnectionException;
import com.qqsuccubus.chatgw.core.error.GatewayException;
import com.qqsuccubus.chatgw.core.error.NotActiveException;
import com.qqsuccubus.chatgw.core.error.ValidationException;
import com.qqsuccubus.chatgw.core.model.SessionStatus;
import com.qqsuccubus.chatgw.gateway.events.IEventPublisher;
import com.qqsuccubus.chatgw.gateway.protocol.MessageReceipt;
import com.qqsuccubus.chatgw.gateway.protocol.OutboundContent;
import com.qqsuccubus.chatgw.gateway.session.ISessionManager;
import com.qqsuccubus.chatgw.gateway.session.ISessionStore;
import com.qqsuccubus.chatgw.gateway.session.PlatformEventFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sends content through the live connection of a connected session.
 */
public class MessageService {
    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final ISessionStore sessionStore;
    private final ISessionManager sessionManager;
    private final IEventPublisher eventPublisher;
    private final Clock clock;

    public MessageService(ISessionStore sessionStore, ISessionManager sessionManager,
                          IEventPublisher eventPublisher, Clock clock) {
        this.sessionStore = sessionStore;
        this.sessionManager = sessionManager;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Sends content and publishes a {@code message_status} event with status {@code sent}.
     *
     * @return Mono of the platform receipt, erroring with NotActive unless the session is
     * {@code connected} with a live connection
     */
    public Mono<MessageReceipt> send(String sessionId, OutboundContent content) {
        return Mono.fromRunnable(() -> validate(content))
            .then(Mono.defer(() -> sessionStore.findById(sessionId)))
            .flatMap(record -> {
                if (record.getStatus() != SessionStatus.CONNECTED) {
                    return Mono.error(new NotActiveException(sessionId, "status is " + record.getStatus()));
                }
                return sessionManager.getLiveConnection(sessionId)
                    .map(connection -> connection.send(content))
                    .orElseGet(() -> Mono.error(new NotActiveException(sessionId)));
            })
            .onErrorMap(err -> !(err instanceof GatewayException),
                err -> new ConnectionException("Failed to send message on session " + sessionId + ": "
                    + err.getMessage(), err))
            .flatMap(receipt -> {
                Instant sentAt = receipt.getSentAt() != null ? receipt.getSentAt() : clock.instant();
                log.debug("Session {}: message {} sent to {}", sessionId, receipt.getId(), content.getTo());
                return eventPublisher.publishEvent(PlatformEventFactory.messageStatus(
                        sessionId, receipt.getId(), content.getTo(), "sent", sentAt))
                    .thenReturn(receipt);
            });
    }

    public Mono<MessageReceipt> sendText(String sessionId, String to, String text) {
        return send(sessionId, OutboundContent.text(to, text));
    }

    private static void validate(OutboundContent content) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (content == null) {
            errors.put("body", List.of("content is required"));
            throw new ValidationException(errors);
        }
        if (content.getTo() == null || content.getTo().isBlank()) {
            errors.computeIfAbsent("to", f -> new ArrayList<>()).add("recipient is required");
        }
        if (content.getType() == null || content.getType().isBlank()) {
            errors.computeIfAbsent("type", f -> new ArrayList<>()).add("content type is required");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
