package com.qqsuccubus.chatgw.gateway;

import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import com.qqsuccubus.chatgw.gateway.events.EventPublisher;
import com.qqsuccubus.chatgw.gateway.events.KafkaBrokerTransport;
import com.qqsuccubus.chatgw.gateway.events.RedisFallbackBuffer;
import com.qqsuccubus.chatgw.gateway.http.HttpServer;
import com.qqsuccubus.chatgw.gateway.message.MessageService;
import com.qqsuccubus.chatgw.gateway.metrics.MetricsService;
import com.qqsuccubus.chatgw.gateway.protocol.ProtocolClient;
import com.qqsuccubus.chatgw.gateway.session.QrCodeRenderer;
import com.qqsuccubus.chatgw.gateway.session.RedisSessionStore;
import com.qqsuccubus.chatgw.gateway.session.SessionManager;
import com.qqsuccubus.chatgw.gateway.session.SessionService;
import io.lettuce.core.RedisClient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.ServiceLoader;

/**
 * Main entry point for a gateway node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Keep one protocol connection per stored session</li>
 *   <li>Publish platform events to Kafka, buffering in Redis during outages</li>
 *   <li>Expose /healthz, /readyz and /metrics endpoints</li>
 * </ul>
 * </p>
 * <p>
 * The protocol client is supplied by an external module registered under
 * {@code META-INF/services/com.qqsuccubus.chatgw.gateway.protocol.ProtocolClient}.
 * An API layer embedding the gateway calls {@link #start} and uses
 * {@link #getSessionService()} and {@link #getMessageService()}.
 * </p>
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class GatewayApp {
    private static final Logger log = LoggerFactory.getLogger(GatewayApp.class);

    private final GatewayConfig config;
    @Getter
    private final SessionService sessionService;
    @Getter
    private final MessageService messageService;
    private final SessionManager sessionManager;
    private final EventPublisher eventPublisher;
    private final RedisSessionStore sessionStore;
    private final RedisClient redisClient;
    private final HttpServer httpServer;

    public static void main(String[] args) {
        GatewayConfig config = GatewayConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        GatewayApp app = start(config, loadProtocolClient());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            MDC.put("nodeId", config.getNodeId());
            log.info("Shutdown signal received, initiating graceful shutdown...");
            app.stop();
        }));

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    /**
     * Wires and starts all services of a node.
     */
    public static GatewayApp start(GatewayConfig config, ProtocolClient protocolClient) {
        log.info("Starting chat gateway node: {}", config.getNodeId());
        log.info("  Kafka: {} (topic {})", config.getKafkaBootstrap(), config.getEventsTopic());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  Sessions dir: {}", config.getSessionsDir().toAbsolutePath());

        Clock clock = Clock.systemUTC();

        // Setup metrics registry with Prometheus support
        MetricsService metricsService = MetricsService.withPrometheus(config);

        // Initialize services
        RedisClient redisClient = RedisClient.create(config.getRedisUrl());
        RedisSessionStore sessionStore = new RedisSessionStore(redisClient, clock);
        EventPublisher eventPublisher = new EventPublisher(
            config,
            new KafkaBrokerTransport(config),
            new RedisFallbackBuffer(redisClient, config.getFallbackKey()),
            metricsService,
            clock,
            Schedulers.parallel()
        );
        SessionManager sessionManager = new SessionManager(
            config, sessionStore, protocolClient, eventPublisher, new QrCodeRenderer(),
            metricsService, clock, Schedulers.parallel()
        );
        SessionService sessionService = new SessionService(config, sessionStore, sessionManager, Schedulers.parallel());
        MessageService messageService = new MessageService(sessionStore, sessionManager, eventPublisher, clock);

        // Runs in the background: events buffer in Redis until the broker is reachable
        eventPublisher.initialize().subscribe(
            ignored -> {
            },
            err -> log.error("Broker initialization failed", err));

        sessionService.resumeSessions()
            .onErrorResume(err -> {
                log.error("Failed to resume sessions", err);
                return Mono.just(0L);
            })
            .block(Duration.ofSeconds(30));

        HttpServer httpServer = new HttpServer(config, sessionManager, eventPublisher, metricsService);
        httpServer.start();

        log.info("Chat gateway node {} is ready", config.getNodeId());

        return new GatewayApp(config, sessionService, messageService, sessionManager,
            eventPublisher, sessionStore, redisClient, httpServer);
    }

    /**
     * Stops the HTTP server, closes live connections without logging out, then the
     * event pipeline and the Redis connections.
     */
    public void stop() {
        httpServer.stop();

        // Credentials stay valid: sessions resume on the next start
        sessionManager.closeAll().block(Duration.ofSeconds(10));

        eventPublisher.close().block(Duration.ofSeconds(10));
        sessionStore.close();
        redisClient.shutdown();

        log.info("Chat gateway node {} stopped", config.getNodeId());
    }

    private static ProtocolClient loadProtocolClient() {
        return ServiceLoader.load(ProtocolClient.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No " + ProtocolClient.class.getName() + " implementation on the classpath"));
    }
}
