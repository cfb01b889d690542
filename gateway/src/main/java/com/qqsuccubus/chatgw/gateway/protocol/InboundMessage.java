package com.qqsuccubus.chatgw.gateway.protocol;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Message delivered by the transport, already decoded by the protocol client.
 */
@Value
@Builder
public class InboundMessage {
    String id;
    /**
     * Remote chat address, e.g. {@code 5511999990000@s.whatsapp.net}.
     */
    String chatId;
    boolean fromMe;
    String pushName;
    Instant timestamp;
    /**
     * Content kind: text, image, video, audio, document, location, contact, sticker, reaction...
     */
    String contentType;
    @Singular("content")
    Map<String, Object> content;
}
