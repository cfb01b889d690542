package com.qqsuccubus.chatgw.core.model;

import com.qqsuccubus.chatgw.core.util.JsonUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionConfigTest {

    private static final SessionConfig DEFAULTS = SessionConfig.builder()
        .restartOnAuthFail(true)
        .maxRetries(0)
        .qrTimeoutMs(60_000)
        .build();

    @Test
    @DisplayName("Should fill unset fields from the defaults")
    void testWithDefaults() {
        SessionConfig config = SessionConfig.builder().qrTimeoutMs(30_000).build();

        SessionConfig effective = config.withDefaults(DEFAULTS);

        assertEquals(30_000, effective.getQrTimeoutMs());
        assertEquals(0, effective.getMaxRetries());
        assertTrue(effective.getRestartOnAuthFail());
    }

    @Test
    @DisplayName("Should let patch fields win and keep the rest")
    void testMerge() {
        SessionConfig stored = SessionConfig.builder().qrTimeoutMs(30_000).maxRetries(3).build();
        SessionConfig patch = SessionConfig.builder().maxRetries(5).restartOnAuthFail(false).build();

        SessionConfig merged = stored.merge(patch);

        assertEquals(30_000, merged.getQrTimeoutMs());
        assertEquals(5, merged.getMaxRetries());
        assertFalse(merged.getRestartOnAuthFail());
        assertSame(stored, stored.merge(null));
    }

    @Test
    @DisplayName("Should treat only an explicit false as disabling auth-failure restarts")
    void testRestartOnAuthFailDisabled() {
        assertFalse(SessionConfig.empty().isRestartOnAuthFailDisabled());
        assertFalse(SessionConfig.builder().restartOnAuthFail(true).build().isRestartOnAuthFailDisabled());
        assertTrue(SessionConfig.builder().restartOnAuthFail(false).build().isRestartOnAuthFailDisabled());
    }

    @Test
    @DisplayName("Should omit unset fields in JSON and read them back")
    void testJson() {
        SessionConfig config = SessionConfig.builder().maxRetries(2).build();

        String json = JsonUtils.writeValueAsString(config);

        assertEquals("{\"maxRetries\":2}", json);
        assertEquals(config, JsonUtils.readValue(json, SessionConfig.class));
    }
}
