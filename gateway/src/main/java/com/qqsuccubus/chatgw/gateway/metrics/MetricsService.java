package com.qqsuccubus.chatgw.gateway.metrics;

import com.qqsuccubus.chatgw.core.metrics.MetricsNames;
import com.qqsuccubus.chatgw.core.metrics.MetricsTags;
import com.qqsuccubus.chatgw.core.model.SessionStatus;
import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import reactor.netty.Metrics;

import javax.annotation.Nullable;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics service for a gateway node.
 * <p>
 * Built with {@link #withPrometheus(GatewayConfig)} the node's meters, together with
 * the HTTP meters reactor-netty reports to the global registry, are served by
 * {@link #scrape()} on {@code /metrics}.
 * </p>
 */
public class MetricsService {

    private final MeterRegistry registry;
    @Nullable
    private final PrometheusMeterRegistry prometheusRegistry;
    private final String nodeId;

    // Event pipeline
    private final Counter publishedDirect;
    private final Counter publishedReplayed;
    private final Counter buffered;
    private final Counter lost;
    private final Counter brokerReconnects;
    private final Timer brokerPublishLatency;

    // Session lifecycle
    private final Counter sessionReconnects;
    private final Counter qrIssued;

    public MetricsService(MeterRegistry registry, GatewayConfig config) {
        this(registry, null, config);
    }

    private MetricsService(MeterRegistry registry, @Nullable PrometheusMeterRegistry prometheusRegistry,
                           GatewayConfig config) {
        this.registry = registry;
        this.prometheusRegistry = prometheusRegistry;
        this.nodeId = config.getNodeId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        publishedDirect = Counter.builder(MetricsNames.EVENTS_PUBLISHED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, "direct")
            .description("Events acknowledged by the broker on first attempt")
            .register(registry);

        publishedReplayed = Counter.builder(MetricsNames.EVENTS_PUBLISHED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.RESULT, "replayed")
            .description("Events republished from the fallback buffer")
            .register(registry);

        buffered = Counter.builder(MetricsNames.EVENTS_BUFFERED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Events written to the fallback buffer")
            .register(registry);

        lost = Counter.builder(MetricsNames.EVENTS_LOST_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Events that could be neither published nor buffered")
            .register(registry);

        brokerReconnects = Counter.builder(MetricsNames.BROKER_RECONNECT_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Broker reconnect attempts")
            .register(registry);

        brokerPublishLatency = Timer.builder(MetricsNames.BROKER_PUBLISH_LATENCY)
            .tag(MetricsTags.TOPIC, config.getEventsTopic())
            .description("Broker publish latency until acknowledgement")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(250),
                Duration.ofMillis(500)
            )
            .register(registry);

        sessionReconnects = Counter.builder(MetricsNames.SESSION_RECONNECTS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Session restarts scheduled after a transport close or QR failure")
            .register(registry);

        qrIssued = Counter.builder(MetricsNames.QR_ISSUED_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("QR pairing codes issued")
            .register(registry);
    }

    /**
     * Exposes the number of live protocol connections as a gauge.
     *
     * @param liveSessions supplier read on every scrape
     */
    public void bindLiveSessions(Supplier<Number> liveSessions) {
        Gauge.builder(MetricsNames.SESSIONS_LIVE, liveSessions)
            .tag(MetricsTags.NODE_ID, nodeId)
            .description("Live protocol connections on this node")
            .register(registry);
    }

    public void recordPublished(boolean replayed) {
        if (replayed) {
            publishedReplayed.increment();
        } else {
            publishedDirect.increment();
        }
    }

    public void recordBuffered() {
        buffered.increment();
    }

    public void recordLost() {
        lost.increment();
    }

    public void recordBrokerReconnect() {
        brokerReconnects.increment();
    }

    /**
     * Records broker publish latency.
     *
     * @param startNanos value of {@link System#nanoTime()} before the send
     */
    public void recordBrokerPublishLatency(long startNanos) {
        brokerPublishLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordTransition(SessionStatus status) {
        Counter.builder(MetricsNames.SESSION_TRANSITIONS_TOTAL)
            .tag(MetricsTags.NODE_ID, nodeId)
            .tag(MetricsTags.STATUS, status.getValue())
            .description("Session status transitions")
            .register(registry)
            .increment();
    }

    public void recordSessionReconnect() {
        sessionReconnects.increment();
    }

    public void recordQrIssued() {
        qrIssued.increment();
    }

    public double getLostCount() {
        return lost.count();
    }

    public double getBufferedCount() {
        return buffered.count();
    }

    /**
     * Metrics for a running node: meters go to reactor-netty's global registry, which
     * gains a Prometheus backend for scraping.
     */
    public static MetricsService withPrometheus(GatewayConfig config) {
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MeterRegistry global = Metrics.REGISTRY;
        if (global instanceof CompositeMeterRegistry composite) {
            composite.add(prometheus);
            return new MetricsService(global, prometheus, config);
        }
        // No composite to attach to: the gateway meters alone are scraped
        return new MetricsService(prometheus, prometheus, config);
    }

    /**
     * Current meters in Prometheus text format.
     *
     * @throws IllegalStateException if this service was not built with {@link #withPrometheus}
     */
    public String scrape() {
        if (prometheusRegistry == null) {
            throw new IllegalStateException("Prometheus export is not enabled for node " + nodeId);
        }
        return prometheusRegistry.scrape();
    }
}
