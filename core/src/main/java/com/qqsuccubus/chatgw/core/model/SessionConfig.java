package com.qqsuccubus.chatgw.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-session connection settings.
 * <p>
 * Every field is optional; {@link #withDefaults(SessionConfig)} fills the gaps
 * from the service-wide defaults. A {@code maxRetries} of zero means unlimited.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionConfig {
    Boolean restartOnAuthFail;
    Integer maxRetries;
    Integer qrTimeoutMs;

    public static SessionConfig empty() {
        return SessionConfig.builder().build();
    }

    /**
     * Returns a copy where every unset field takes the value from {@code defaults}.
     */
    public SessionConfig withDefaults(SessionConfig defaults) {
        if (defaults == null) {
            return this;
        }
        return SessionConfig.builder()
            .restartOnAuthFail(restartOnAuthFail != null ? restartOnAuthFail : defaults.restartOnAuthFail)
            .maxRetries(maxRetries != null ? maxRetries : defaults.maxRetries)
            .qrTimeoutMs(qrTimeoutMs != null ? qrTimeoutMs : defaults.qrTimeoutMs)
            .build();
    }

    /**
     * Applies a partial update: fields set on {@code patch} win.
     */
    public SessionConfig merge(SessionConfig patch) {
        if (patch == null) {
            return this;
        }
        return SessionConfig.builder()
            .restartOnAuthFail(patch.restartOnAuthFail != null ? patch.restartOnAuthFail : restartOnAuthFail)
            .maxRetries(patch.maxRetries != null ? patch.maxRetries : maxRetries)
            .qrTimeoutMs(patch.qrTimeoutMs != null ? patch.qrTimeoutMs : qrTimeoutMs)
            .build();
    }

    /**
     * True only when the flag was explicitly set to {@code false}.
     */
    @JsonIgnore
    public boolean isRestartOnAuthFailDisabled() {
        return Boolean.FALSE.equals(restartOnAuthFail);
    }
}
