package com.qqsuccubus.chatgw.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.chatgw.core.util.JsonUtils;

import java.time.Instant;
import java.util.Map;

/**
 * JSON shape of events on the broker and in the fallback buffer.
 * <p>
 * <b>Broker object:</b>
 * {@code {platform, timestamp, type, sessionId, occurredAt, ...payload}}, with
 * {@code timestamp} in ISO-8601. Reserved fields win over payload fields of the
 * same name.
 * </p>
 * <p>
 * <b>Fallback entry:</b> the same object plus {@code bufferedAt}.
 * </p>
 */
public final class EventWireFormat {
    private EventWireFormat() {
    }

    public static final String PLATFORM = "platform";
    public static final String TIMESTAMP = "timestamp";
    public static final String TYPE = "type";
    public static final String SESSION_ID = "sessionId";
    public static final String OCCURRED_AT = "occurredAt";
    public static final String BUFFERED_AT = "bufferedAt";

    /**
     * Serializes an event tagged with the platform discriminator and the publish time.
     *
     * @param event    Event to serialize
     * @param platform Fixed platform discriminator
     * @param taggedAt Publish time written to {@code timestamp}
     * @return JSON object string
     */
    public static String serialize(PlatformEvent event, String platform, Instant taggedAt) {
        ObjectNode node = JsonUtils.mapper().createObjectNode();
        for (Map.Entry<String, Object> field : event.getPayload().entrySet()) {
            node.set(field.getKey(), JsonUtils.mapper().valueToTree(field.getValue()));
        }
        node.put(PLATFORM, platform);
        node.put(TIMESTAMP, taggedAt.toString());
        node.put(TYPE, event.getType());
        node.put(SESSION_ID, event.getSessionId());
        node.put(OCCURRED_AT, event.getOccurredAt().toString());
        return JsonUtils.writeValueAsString(node);
    }

    /**
     * Adds {@code bufferedAt} to a serialized event.
     */
    public static String markBuffered(String eventJson, Instant bufferedAt) {
        JsonNode node = JsonUtils.readTree(eventJson);
        if (!(node instanceof ObjectNode)) {
            throw new IllegalArgumentException("Event is not a JSON object");
        }
        ObjectNode object = (ObjectNode) node;
        object.put(BUFFERED_AT, bufferedAt.toString());
        return JsonUtils.writeValueAsString(object);
    }
}
