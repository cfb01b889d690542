package com.qqsuccubus.chatgw.gateway.events;

import com.qqsuccubus.chatgw.core.error.TransientBrokerException;
import com.qqsuccubus.chatgw.gateway.config.GatewayConfig;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.RetriableException;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Broker transport on Kafka.
 * <p>
 * Kafka clients reconnect on their own, so a connection counts as lost once a
 * publish fails with a retriable or timeout error; the pipeline then reconnects
 * with its own backoff.
 * </p>
 */
public class KafkaBrokerTransport implements IBrokerTransport {
    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerTransport.class);

    private static final int DEFAULT_PARTITIONS = 3;       // Events are keyed by session id
    private static final short REPLICATION_FACTOR = 1;     // Replication factor (1 for dev, 3+ for prod)

    private final GatewayConfig config;

    public KafkaBrokerTransport(GatewayConfig config) {
        this.config = config;
    }

    @Override
    public Mono<IBrokerConnection> connect() {
        return Mono.fromCallable(() -> AdminClient.create(adminProps()))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(admin -> verifyCluster(admin)
                .then(createTopicIfNotExists(admin, config.getEventsTopic(), DEFAULT_PARTITIONS, REPLICATION_FACTOR))
                .then(Mono.fromCallable(() -> (IBrokerConnection) new KafkaBrokerConnection(
                    KafkaSender.create(senderOptions()), admin)))
                .onErrorResume(err -> {
                    // Partial initialization: release the admin client before reporting
                    admin.close(Duration.ZERO);
                    return Mono.error(err);
                }))
            .onErrorMap(err -> !(err instanceof TransientBrokerException),
                err -> new TransientBrokerException(
                    "Broker unavailable at " + config.getKafkaBootstrap() + ": " + err.getMessage(), err))
            .doOnNext(conn -> log.info("Connected to Kafka at {} (topic {})",
                config.getKafkaBootstrap(), config.getEventsTopic()));
    }

    private Map<String, Object> adminProps() {
        int timeoutMs = (int) config.getBrokerRequestTimeout().toMillis();
        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        adminProps.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
        adminProps.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
        return adminProps;
    }

    private SenderOptions<String, String> senderOptions() {
        int timeoutMs = (int) config.getBrokerRequestTimeout().toMillis();
        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.CLIENT_ID_CONFIG, "chat-gateway-" + config.getNodeId());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all"); // Required for idempotent producer
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        // Fail sends within the request timeout so they reach the fallback buffer
        producerProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Math.max(1000, timeoutMs / 2));
        producerProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, timeoutMs);
        producerProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, timeoutMs);
        return SenderOptions.create(producerProps);
    }

    private Mono<Void> verifyCluster(AdminClient admin) {
        return Mono.fromFuture(() -> admin.describeCluster().nodes().toCompletionStage().toCompletableFuture())
            .timeout(config.getBrokerRequestTimeout())
            .flatMap(nodes -> nodes.isEmpty()
                ? Mono.<Void>error(new TransientBrokerException("Kafka cluster reports no brokers"))
                : Mono.<Void>empty());
    }

    /**
     * Creates a Kafka topic if it doesn't already exist. Idempotent.
     */
    private Mono<Void> createTopicIfNotExists(AdminClient admin, String topicName, int partitions,
                                              short replicationFactor) {
        return Mono.fromFuture(() -> admin.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.<Void>empty();
                }

                return Mono.fromFuture(() -> {
                        NewTopic newTopic = new NewTopic(topicName, partitions, replicationFactor);

                        log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                            topicName, partitions, replicationFactor);

                        return admin.createTopics(Collections.singleton(newTopic))
                            .all()
                            .toCompletionStage()
                            .toCompletableFuture();
                    })
                    .then()
                    .onErrorResume(err -> {
                        if (err instanceof TopicExistsException || err.getCause() instanceof TopicExistsException) {
                            log.debug("Topic {} was created concurrently", topicName);
                            return Mono.empty();
                        }
                        return Mono.error(err);
                    });
            })
            .timeout(config.getBrokerRequestTimeout());
    }

    private class KafkaBrokerConnection implements IBrokerConnection {
        private final KafkaSender<String, String> sender;
        private final AdminClient admin;
        private final Sinks.Empty<Void> closed = Sinks.empty();
        private final AtomicBoolean open = new AtomicBoolean(true);

        KafkaBrokerConnection(KafkaSender<String, String> sender, AdminClient admin) {
            this.sender = sender;
            this.admin = admin;
        }

        @Override
        public Mono<Void> publish(@Nullable String key, String payload) {
            if (!open.get()) {
                return Mono.error(new TransientBrokerException("Kafka connection is closed"));
            }
            ProducerRecord<String, String> record = new ProducerRecord<>(config.getEventsTopic(), key, payload);

            return sender.send(Mono.just(SenderRecord.create(record, null)))
                .next()
                .timeout(config.getBrokerRequestTimeout())
                .flatMap(result -> result.exception() != null
                    ? Mono.<Void>error(result.exception())
                    : Mono.<Void>empty())
                .onErrorMap(err -> {
                    if (isTransportFailure(err)) {
                        markLost(err);
                    }
                    return err instanceof TransientBrokerException
                        ? err
                        : new TransientBrokerException("Kafka publish failed: " + err.getMessage(), err);
                });
        }

        @Override
        public Mono<Void> closeSignal() {
            return closed.asMono();
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        @Override
        public void close() {
            if (!open.compareAndSet(true, false)) {
                return;
            }
            try {
                sender.close();
            } finally {
                admin.close(Duration.ofSeconds(5));
                closed.tryEmitEmpty();
                log.info("Kafka connection closed");
            }
        }

        private void markLost(Throwable cause) {
            if (!open.compareAndSet(true, false)) {
                return;
            }
            log.warn("Kafka connection lost: {}", cause.getMessage());
            // Off the sender's callback thread: closing the producer blocks
            Schedulers.boundedElastic().schedule(() -> {
                sender.close();
                admin.close(Duration.ZERO);
            });
            closed.tryEmitError(cause);
        }

        private boolean isTransportFailure(Throwable err) {
            return err instanceof RetriableException
                || err instanceof TimeoutException
                || err instanceof IllegalStateException;
        }
    }
}
