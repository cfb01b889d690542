package com.qqsuccubus.chatgw.gateway.config;

import com.qqsuccubus.chatgw.core.model.SessionConfig;
import com.qqsuccubus.chatgw.core.msg.Topics;
import com.qqsuccubus.chatgw.core.redis.Keys;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration for a gateway node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class GatewayConfig {

    String nodeId;
    int httpPort;

    // Broker transport
    String kafkaBootstrap;
    String eventsTopic;
    int brokerRetryAttempts;
    Duration brokerRetryBaseDelay;
    Duration brokerRetryMaxDelay;
    Duration brokerRequestTimeout;
    String eventPlatform;

    // Fallback buffer + session store
    String redisUrl;
    String fallbackKey;
    int drainBatchSize;
    Duration drainBatchPause;

    // Session lifecycle
    Path sessionsDir;
    Duration sessionReconnectDelay;
    Duration qrRetryDelay;
    Duration qrWaitTimeout;
    int defaultQrTimeoutMs;
    int defaultMaxRetries;      // 0 = unlimited
    boolean defaultRestartOnAuthFail;

    /**
     * Service-wide defaults applied to sessions that leave a field unset.
     */
    public SessionConfig sessionDefaults() {
        return SessionConfig.builder()
            .restartOnAuthFail(defaultRestartOnAuthFail)
            .maxRetries(defaultMaxRetries)
            .qrTimeoutMs(defaultQrTimeoutMs)
            .build();
    }

    public static GatewayConfig fromEnv() {
        return GatewayConfig.builder()
            .nodeId(getEnv("NODE_ID", "gateway-node-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
            .eventsTopic(getEnv("EVENTS_TOPIC", Topics.PLATFORM_EVENTS))
            .brokerRetryAttempts(Integer.parseInt(getEnv("BROKER_RETRY_ATTEMPTS", "5")))
            .brokerRetryBaseDelay(Duration.ofMillis(Long.parseLong(getEnv("BROKER_RETRY_BASE_MS", "5000"))))
            .brokerRetryMaxDelay(Duration.ofMillis(Long.parseLong(getEnv("BROKER_RETRY_MAX_MS", "30000"))))
            .brokerRequestTimeout(Duration.ofMillis(Long.parseLong(getEnv("BROKER_REQUEST_TIMEOUT_MS", "10000"))))
            .eventPlatform(getEnv("EVENT_PLATFORM", "whatsapp_unofficial"))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .fallbackKey(getEnv("FALLBACK_KEY", Keys.eventsFallback()))
            .drainBatchSize(Integer.parseInt(getEnv("DRAIN_BATCH_SIZE", "100")))
            .drainBatchPause(Duration.ofMillis(Long.parseLong(getEnv("DRAIN_BATCH_PAUSE_MS", "100"))))
            .sessionsDir(Path.of(getEnv("SESSIONS_DIR", "sessions")))
            .sessionReconnectDelay(Duration.ofMillis(Long.parseLong(getEnv("SESSION_RECONNECT_DELAY_MS", "5000"))))
            .qrRetryDelay(Duration.ofMillis(Long.parseLong(getEnv("QR_RETRY_DELAY_MS", "1000"))))
            .qrWaitTimeout(Duration.ofMillis(Long.parseLong(getEnv("QR_WAIT_TIMEOUT_MS", "2000"))))
            .defaultQrTimeoutMs(Integer.parseInt(getEnv("QR_TIMEOUT_MS", "60000")))
            .defaultMaxRetries(Integer.parseInt(getEnv("SESSION_MAX_RETRIES", "0")))
            .defaultRestartOnAuthFail(Boolean.parseBoolean(getEnv("RESTART_ON_AUTH_FAIL", "true")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
