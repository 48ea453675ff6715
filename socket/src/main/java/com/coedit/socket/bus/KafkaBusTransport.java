package com.coedit.socket.bus;

import com.coedit.core.msg.Topics;
import com.coedit.socket.config.SocketConfig;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka transport: a single topic for all documents, keyed by document id.
 * <p>
 * Keying by document id keeps every document on one partition, so envelopes of a document are
 * read in publish order. Each node consumes the whole topic with its own consumer group starting
 * at the latest offset; per-document filtering happens in {@link MessageBus}, which is why
 * {@link #listen} and {@link #unlisten} do nothing here.
 * </p>
 */
public class KafkaBusTransport implements BusTransport {
    private static final Logger log = LoggerFactory.getLogger(KafkaBusTransport.class);

    private static final int DEFAULT_PARTITIONS = 6;
    private static final short REPLICATION_FACTOR = 1;    // 1 for dev, 3+ for prod

    private final SocketConfig config;
    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;

    public KafkaBusTransport(SocketConfig config) {
        this.config = config;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all"); // Required for idempotent producer
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        producerProps.put(ProducerConfig.LINGER_MS_CONFIG, "1");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka producer and admin client initialized ({})", config.getKafkaBootstrap());
    }

    @Override
    public Mono<Void> send(String documentId, String payload) {
        ProducerRecord<String, String> record = new ProducerRecord<>(Topics.DOCUMENT_EVENTS, documentId, payload);
        return sender.send(Mono.just(SenderRecord.create(record, documentId)))
            .doOnNext(result -> log.debug("Sent envelope for document {} to partition {}",
                result.correlationMetadata(), result.recordMetadata().partition()))
            .then();
    }

    @Override
    public Mono<Void> listen(String documentId) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> unlisten(String documentId) {
        return Mono.empty();
    }

    @Override
    public Flux<String> messages() {
        return createTopicIfNotExists(Topics.DOCUMENT_EVENTS, DEFAULT_PARTITIONS, REPLICATION_FACTOR)
            .thenMany(Flux.defer(() -> {
                Map<String, Object> consumerProps = new HashMap<>();
                consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
                consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, Topics.groupFor(config.getInstanceId()));
                consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                // Envelopes are live traffic; a restarted node must not replay history
                consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
                consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

                ReceiverOptions<String, String> options = ReceiverOptions.<String, String>create(consumerProps)
                    .subscription(Collections.singleton(Topics.DOCUMENT_EVENTS));

                log.info("Node {} consuming {} as group {}", config.getInstanceId(),
                    Topics.DOCUMENT_EVENTS, Topics.groupFor(config.getInstanceId()));

                return KafkaReceiver.create(options).receive();
            }))
            .map(record -> {
                record.receiverOffset().acknowledge();
                return record.value();
            });
    }

    /**
     * Creates the topic if it doesn't already exist; a concurrent creation by another node is fine.
     */
    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                    topicName, partitions, replicationFactor);

                return Mono.fromFuture(() -> adminClient
                    .createTopics(Collections.singleton(new NewTopic(topicName, partitions, replicationFactor)))
                    .all()
                    .toCompletionStage()
                    .toCompletableFuture());
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException || error instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
            sender.close();
            adminClient.close();
            log.info("Kafka bus transport stopped");
        });
    }

    @Override
    public String name() {
        return "kafka";
    }
}
