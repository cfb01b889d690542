package com.qqsuccubus.chatgw.core.redis;

/**
 * Redis keyspace for the Session Store and the event fallback buffer.
 * <p>
 * All keys share the {@code chatgw:} prefix.
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    private static final String PREFIX = "chatgw:";

    /**
     * Session record: {@code chatgw:session:{sessionId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> {@code id, name, status, config (JSON), webhookUrl, createdAt, updatedAt}
     * </p>
     *
     * @param sessionId Session identifier
     * @return Redis key
     */
    public static String session(String sessionId) {
        return PREFIX + "session:" + sessionId;
    }

    /**
     * Index of all session ids: {@code chatgw:sessions} (Set).
     */
    public static String sessionIndex() {
        return PREFIX + "sessions";
    }

    /**
     * Default fallback buffer: {@code chatgw:events:fallback}
     * <p>
     * <b>Type:</b> List, RPUSH on buffer, LPOP after confirmed republish.
     * </p>
     */
    public static String eventsFallback() {
        return PREFIX + "events:fallback";
    }
}
