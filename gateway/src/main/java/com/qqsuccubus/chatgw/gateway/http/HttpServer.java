package com.qqsuccubus.chatgw.gateway.http;

import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import com.qqsuccubus.chatgw.gateway.events.IEventPublisher;
import com.qqsuccubus.chatgw.gateway.metrics.MetricsService;
import com.qqsuccubus.chatgw.gateway.session.ISessionManager;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * Operational HTTP server: liveness, readiness and Prometheus metrics.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final GatewayConfig config;
    private final ISessionManager sessionManager;
    private final IEventPublisher eventPublisher;
    private final MetricsService metricsService;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Not ready while events can only go to the fallback buffer
                .get("/readyz", (req, res) -> {
                    if (!eventPublisher.isConnected()) {
                        return res.status(503).sendString(Mono.just("Not Ready - broker disconnected"));
                    }
                    return res.status(200).sendString(Mono.just(String.format(
                        "Ready - %d live sessions", sessionManager.getActiveSessionIds().size())));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsService.scrape()))
                )
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
