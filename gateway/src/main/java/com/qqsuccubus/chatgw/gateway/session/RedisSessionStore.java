package com.qqsuccubus.chatgw.gateway.session;

import com.qqsuccubus.chatgw.core.error.NotFoundException;
import com.qqsuccubus.chatgw.core.model.CreateSessionRequest;
import com.qqsuccubus.chatgw.core.model.SessionConfig;
import com.qqsuccubus.chatgw.core.model.SessionPage;
import com.qqsuccubus.chatgw.core.model.SessionRecord;
import com.qqsuccubus.chatgw.core.model.SessionStatus;
import com.qqsuccubus.chatgw.core.model.UpdateSessionRequest;
import com.qqsuccubus.chatgw.core.redis.Keys;
import com.qqsuccubus.chatgw.core.util.JsonUtils;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.Value;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Session Store backed by Redis hashes.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API. Each session is
 * one hash under {@link Keys#session(String)}; {@link Keys#sessionIndex()} holds
 * the ids for listing.
 * </p>
 */
public class RedisSessionStore implements ISessionStore {
    private static final Logger log = LoggerFactory.getLogger(RedisSessionStore.class);

    private static final String F_ID = "id";
    private static final String F_NAME = "name";
    private static final String F_STATUS = "status";
    private static final String F_CONFIG = "config";
    private static final String F_WEBHOOK_URL = "webhookUrl";
    private static final String F_CREATED_AT = "createdAt";
    private static final String F_UPDATED_AT = "updatedAt";

    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final Clock clock;

    public RedisSessionStore(RedisClient client, Clock clock) {
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.clock = clock;
        log.info("Session store connected to Redis");
    }

    @Override
    public Mono<SessionRecord> create(CreateSessionRequest request) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            SessionRecord record = SessionRecord.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .status(SessionStatus.INITIALIZING)
                .config(request.getConfig() != null ? request.getConfig() : SessionConfig.empty())
                .webhookUrl(request.getWebhookUrl())
                .createdAt(now)
                .updatedAt(now)
                .build();

            return commands.hset(Keys.session(record.getId()), toHash(record))
                .then(commands.sadd(Keys.sessionIndex(), record.getId()))
                .thenReturn(record)
                .doOnSuccess(r -> log.info("Session {} created (name={})", r.getId(), r.getName()))
                .doOnError(err -> log.error("Failed to create session {}", record.getId(), err));
        });
    }

    @Override
    public Mono<SessionRecord> findById(String sessionId) {
        return commands.hgetall(Keys.session(sessionId))
            .collectMap(KeyValue::getKey, Value::getValue)
            .flatMap(hash -> hash.isEmpty()
                ? Mono.error(NotFoundException.session(sessionId))
                : Mono.just(fromHash(hash)));
    }

    @Override
    public Mono<SessionPage> findAll(@Nullable SessionStatus status, int page, int limit) {
        int safePage = Math.max(1, page);
        int safeLimit = Math.max(1, limit);

        return commands.smembers(Keys.sessionIndex())
            .flatMap(id -> findById(id)
                .onErrorResume(NotFoundException.class, err -> {
                    // Stale index entry: the hash is gone
                    log.debug("Dropping stale session index entry {}", id);
                    return commands.srem(Keys.sessionIndex(), id).then(Mono.empty());
                }))
            .filter(record -> status == null || record.getStatus() == status)
            .collectList()
            .map(records -> {
                List<SessionRecord> sorted = records.stream()
                    .sorted(Comparator.comparing(SessionRecord::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                    .collect(Collectors.toList());
                List<SessionRecord> pageContent = sorted.stream()
                    .skip((long) (safePage - 1) * safeLimit)
                    .limit(safeLimit)
                    .collect(Collectors.toList());
                return new SessionPage(pageContent, sorted.size(), safePage, safeLimit);
            });
    }

    @Override
    public Mono<SessionRecord> update(String sessionId, UpdateSessionRequest request) {
        return findById(sessionId)
            .flatMap(existing -> {
                SessionRecord updated = existing.toBuilder()
                    .name(request.getName() != null ? request.getName() : existing.getName())
                    .config(existing.getConfig().merge(request.getConfig()))
                    .webhookUrl(request.getWebhookUrl() != null ? request.getWebhookUrl() : existing.getWebhookUrl())
                    .updatedAt(clock.instant())
                    .build();
                return commands.hset(Keys.session(sessionId), toHash(updated)).thenReturn(updated);
            })
            .doOnError(err -> log.error("Failed to update session {}", sessionId, err));
    }

    @Override
    public Mono<Void> updateStatus(String sessionId, SessionStatus status) {
        String key = Keys.session(sessionId);
        return commands.exists(key)
            .flatMap(count -> {
                if (count == 0) {
                    return Mono.error(NotFoundException.session(sessionId));
                }
                Map<String, String> fields = new HashMap<>();
                fields.put(F_STATUS, status.getValue());
                fields.put(F_UPDATED_AT, clock.instant().toString());
                return commands.hset(key, fields).then();
            });
    }

    @Override
    public Mono<Void> delete(String sessionId) {
        return commands.del(Keys.session(sessionId))
            .then(commands.srem(Keys.sessionIndex(), sessionId))
            .then()
            .doOnSuccess(v -> log.info("Session {} deleted from store", sessionId))
            .doOnError(err -> log.error("Failed to delete session {}", sessionId, err));
    }

    @Override
    public void close() {
        connection.close();
        log.info("Session store connection closed");
    }

    private static Map<String, String> toHash(SessionRecord record) {
        Map<String, String> hash = new HashMap<>();
        hash.put(F_ID, record.getId());
        hash.put(F_STATUS, record.getStatus().getValue());
        hash.put(F_CONFIG, JsonUtils.writeValueAsString(record.getConfig()));
        if (record.getName() != null) {
            hash.put(F_NAME, record.getName());
        }
        if (record.getWebhookUrl() != null) {
            hash.put(F_WEBHOOK_URL, record.getWebhookUrl());
        }
        if (record.getCreatedAt() != null) {
            hash.put(F_CREATED_AT, record.getCreatedAt().toString());
        }
        if (record.getUpdatedAt() != null) {
            hash.put(F_UPDATED_AT, record.getUpdatedAt().toString());
        }
        return hash;
    }

    static SessionRecord fromHash(Map<String, String> hash) {
        String config = hash.get(F_CONFIG);
        return SessionRecord.builder()
            .id(hash.get(F_ID))
            .name(hash.get(F_NAME))
            .status(SessionStatus.fromValue(hash.get(F_STATUS)))
            .config(config != null ? JsonUtils.readValue(config, SessionConfig.class) : SessionConfig.empty())
            .webhookUrl(hash.get(F_WEBHOOK_URL))
            .createdAt(parseInstant(hash.get(F_CREATED_AT)))
            .updatedAt(parseInstant(hash.get(F_UPDATED_AT)))
            .build();
    }

    private static Instant parseInstant(String value) {
        return value != null ? Instant.parse(value) : null;
    }
}
