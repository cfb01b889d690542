package com.qqsuccubus.chatgw.gateway.events;

import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fallback buffer on a Redis list: RPUSH to append, LRANGE to peek, LPOP to remove.
 */
public class RedisFallbackBuffer implements IFallbackBuffer {
    private static final Logger log = LoggerFactory.getLogger(RedisFallbackBuffer.class);

    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final String key;

    public RedisFallbackBuffer(RedisClient client, String key) {
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.key = key;
        log.info("Fallback buffer connected to Redis (key {})", key);
    }

    @Override
    public Mono<Void> append(String entry) {
        return commands.rpush(key, entry)
            .doOnNext(length -> log.debug("Fallback buffer length now {}", length))
            .then();
    }

    @Override
    public Mono<List<String>> peekBatch(int count) {
        return commands.lrange(key, 0, count - 1L).collectList();
    }

    @Override
    public Mono<String> removeHead() {
        return commands.lpop(key);
    }

    @Override
    public Mono<Long> size() {
        return commands.llen(key);
    }

    @Override
    public void close() {
        connection.close();
        log.info("Fallback buffer connection closed");
    }
}
