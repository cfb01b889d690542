package com.qqsuccubus.chatgw.gateway.session;

import com.qqsuccubus.chatgw.core.event.EventTypes;
import com.qqsuccubus.chatgw.core.event.PlatformEvent;
import com.qqsuccubus.chatgw.core.model.SessionStatus;
import com.qqsuccubus.chatgw.gateway.protocol.InboundMessage;
import com.qqsuccubus.chatgw.gateway.protocol.PresenceUpdate;
import com.qqsuccubus.chatgw.gateway.protocol.ReceiptUpdate;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps connection-level occurrences to {@link PlatformEvent}s.
 */
public final class PlatformEventFactory {
    private PlatformEventFactory() {
    }

    private static final String GROUP_SUFFIX = "@g.us";

    public static PlatformEvent sessionStatus(String sessionId, SessionStatus status,
                                              @Nullable String reason, Instant at) {
        PlatformEvent.PlatformEventBuilder event = PlatformEvent.builder()
            .sessionId(sessionId)
            .type(EventTypes.SESSION_STATUS)
            .occurredAt(at)
            .field("status", status.getValue());
        if (reason != null) {
            event.field("reason", reason);
        }
        return event.build();
    }

    public static PlatformEvent messageReceived(String sessionId, InboundMessage message, Instant receivedAt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", message.getId());
        body.put("chatId", message.getChatId());
        body.put("from", addressPart(message.getChatId()));
        body.put("isGroup", message.getChatId() != null && message.getChatId().endsWith(GROUP_SUFFIX));
        if (message.getPushName() != null) {
            body.put("pushName", message.getPushName());
        }
        body.put("type", message.getContentType());
        body.put("content", message.getContent());
        Instant sentAt = message.getTimestamp() != null ? message.getTimestamp() : receivedAt;
        body.put("timestamp", sentAt.toString());

        return PlatformEvent.builder()
            .sessionId(sessionId)
            .type(EventTypes.MESSAGE_RECEIVED)
            .occurredAt(sentAt)
            .field("message", body)
            .build();
    }

    public static PlatformEvent messageStatus(String sessionId, ReceiptUpdate receipt, Instant receivedAt) {
        Instant at = receipt.getAt() != null ? receipt.getAt() : receivedAt;
        return messageStatus(sessionId, receipt.getMessageId(), receipt.getChatId(),
            receipt.getKind().name().toLowerCase(Locale.ROOT), at);
    }

    public static PlatformEvent messageStatus(String sessionId, String messageId, @Nullable String chatId,
                                              String status, Instant at) {
        PlatformEvent.PlatformEventBuilder event = PlatformEvent.builder()
            .sessionId(sessionId)
            .type(EventTypes.MESSAGE_STATUS)
            .occurredAt(at)
            .field("messageId", messageId)
            .field("status", status)
            .field("timestamp", at.toString());
        if (chatId != null) {
            event.field("chatId", chatId);
        }
        return event.build();
    }

    public static PlatformEvent presence(String sessionId, PresenceUpdate update, Instant at) {
        return PlatformEvent.builder()
            .sessionId(sessionId)
            .type(EventTypes.PRESENCE_UPDATE)
            .occurredAt(at)
            .field("chatId", update.getChatId())
            .field("phoneNumber", addressPart(update.getChatId()))
            .field("presence", update.getPresence())
            .build();
    }

    /**
     * Address without the server suffix: {@code 5511999990000@s.whatsapp.net} becomes {@code 5511999990000}.
     */
    static String addressPart(@Nullable String chatId) {
        if (chatId == null) {
            return null;
        }
        int at = chatId.indexOf('@');
        return at >= 0 ? chatId.substring(0, at) : chatId;
    }
}
