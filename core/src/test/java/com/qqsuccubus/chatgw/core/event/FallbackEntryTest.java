package com.qqsuccubus.chatgw.core.event;

import com.qqsuccubus.chatgw.core.util.JsonUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class FallbackEntryTest {

    private static final Instant BUFFERED = Instant.parse("2024-05-01T10:00:05Z");

    @Test
    @DisplayName("Should republish the original event without bufferedAt")
    void testParseStripsBufferedAt() {
        String eventJson = "{\"type\":\"message_status\",\"sessionId\":\"s-1\"}";
        FallbackEntry stored = FallbackEntry.create(eventJson, BUFFERED);

        FallbackEntry parsed = FallbackEntry.parse(stored.getRaw());

        assertEquals(stored.getRaw(), parsed.getRaw());
        assertEquals(BUFFERED, parsed.getBufferedAt());
        assertEquals(JsonUtils.readTree(eventJson), JsonUtils.readTree(parsed.getEventJson()));
        assertFalse(parsed.getEventJson().contains("bufferedAt"));
    }

    @Test
    @DisplayName("Should republish entries that are not JSON objects verbatim")
    void testParseNonObject() {
        FallbackEntry garbage = FallbackEntry.parse("not json at all");
        FallbackEntry array = FallbackEntry.parse("[1,2,3]");

        assertEquals("not json at all", garbage.getEventJson());
        assertNull(garbage.getBufferedAt());
        assertEquals("[1,2,3]", array.getEventJson());
    }

    @Test
    @DisplayName("Should ignore an unparseable bufferedAt")
    void testParseBadTimestamp() {
        FallbackEntry parsed = FallbackEntry.parse("{\"type\":\"x\",\"bufferedAt\":\"yesterday\"}");

        assertNull(parsed.getBufferedAt());
        assertEquals("{\"type\":\"x\"}", parsed.getEventJson());
    }
}
