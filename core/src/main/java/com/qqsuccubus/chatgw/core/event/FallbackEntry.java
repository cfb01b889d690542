package com.qqsuccubus.chatgw.core.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.qqsuccubus.chatgw.core.util.JsonUtils;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * One stored entry of the fallback buffer.
 * <p>
 * {@code raw} is the exact stored string; {@code eventJson} is what gets
 * republished (the stored object without {@code bufferedAt}).
 * </p>
 */
@Value
public class FallbackEntry {
    String raw;
    String eventJson;
    @Nullable
    Instant bufferedAt;

    public static FallbackEntry create(String eventJson, Instant bufferedAt) {
        return new FallbackEntry(EventWireFormat.markBuffered(eventJson, bufferedAt), eventJson, bufferedAt);
    }

    /**
     * Parses a stored entry. Entries that are not JSON objects are republished verbatim.
     */
    public static FallbackEntry parse(String raw) {
        JsonNode node;
        try {
            node = JsonUtils.readTree(raw);
        } catch (IllegalArgumentException e) {
            return new FallbackEntry(raw, raw, null);
        }
        if (!(node instanceof ObjectNode)) {
            return new FallbackEntry(raw, raw, null);
        }
        ObjectNode object = ((ObjectNode) node).deepCopy();
        JsonNode bufferedAt = object.remove(EventWireFormat.BUFFERED_AT);
        return new FallbackEntry(raw, JsonUtils.writeValueAsString(object), parseInstant(bufferedAt));
    }

    private static Instant parseInstant(JsonNode value) {
        if (value == null || !value.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
