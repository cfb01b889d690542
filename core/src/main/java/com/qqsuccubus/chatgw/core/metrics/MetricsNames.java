package com.qqsuccubus.chatgw.core.metrics;

/**
 * Micrometer metric names.
 * <p>
 * <b>Naming convention:</b> {@code chatgw.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: events acknowledged by the broker.
     * <p>
     * Tags: nodeId, result (direct/replayed)
     * </p>
     */
    public static final String EVENTS_PUBLISHED_TOTAL = "chatgw.events.published.total";

    /**
     * Counter: events written to the fallback buffer.
     */
    public static final String EVENTS_BUFFERED_TOTAL = "chatgw.events.buffered.total";

    /**
     * Counter: events that could be neither published nor buffered.
     */
    public static final String EVENTS_LOST_TOTAL = "chatgw.events.lost.total";

    /**
     * Timer: broker publish latency until acknowledgement.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String BROKER_PUBLISH_LATENCY = "chatgw.broker.publish.latency";

    /**
     * Counter: broker reconnect attempts.
     */
    public static final String BROKER_RECONNECT_TOTAL = "chatgw.broker.reconnect.total";

    /**
     * Counter: session status transitions.
     * <p>
     * Tags: nodeId, status
     * </p>
     */
    public static final String SESSION_TRANSITIONS_TOTAL = "chatgw.session.transitions.total";

    /**
     * Counter: session reconnects scheduled after a transport close.
     */
    public static final String SESSION_RECONNECTS_TOTAL = "chatgw.session.reconnects.total";

    /**
     * Counter: QR pairing codes issued.
     */
    public static final String QR_ISSUED_TOTAL = "chatgw.session.qr.issued.total";

    /**
     * Gauge: live protocol connections in the registry.
     */
    public static final String SESSIONS_LIVE = "chatgw.session.live";
}
