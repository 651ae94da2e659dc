package com.z254.lazarus.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka wiring for signal intake and event publishing.
 * <p>
 * Only active with {@code lazarus.kafka.enabled=true}; without it the REST API is the only ingress
 * and outbound events are logged.
 */
@Configuration
@ConditionalOnProperty(name = "lazarus.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final LazarusProperties.Kafka config;

    public KafkaConfig(KafkaProperties kafkaProperties, LazarusProperties lazarusProperties) {
        this.kafkaProperties = kafkaProperties;
        this.config = lazarusProperties.getKafka();
    }

    // ==================== Producer ====================

    /**
     * Events are serialized with the application's ObjectMapper so timestamps match the REST API.
     */
    @Bean
    public ProducerFactory<String, Object> producerFactory(ObjectMapper objectMapper) {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");

        JsonSerializer<Object> valueSerializer = new JsonSerializer<>(objectMapper);
        valueSerializer.setAddTypeInfo(false);
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), valueSerializer);
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> producerFactory) {
        KafkaTemplate<String, Object> template = new KafkaTemplate<>(producerFactory);
        template.setObservationEnabled(true);
        return template;
    }

    // ==================== Consumer ====================

    /**
     * Signals are read as raw JSON strings so one malformed record cannot stall the partition.
     */
    @Bean
    public ConsumerFactory<String, String> consumerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildConsumerProperties(null));
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.putIfAbsent(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), new StringDeserializer());
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);
        factory.setConcurrency(config.getListenerConcurrency());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        return factory;
    }

    // ==================== Topics ====================

    @Bean
    public KafkaAdmin.NewTopics lazarusTopics() {
        LazarusProperties.Kafka.Topics topics = config.getTopics();
        return new KafkaAdmin.NewTopics(
                topic(topics.getFailureSignals(), Duration.ofDays(7)),
                topic(topics.getEscalations(), Duration.ofDays(30)),
                topic(topics.getIncidentEvents(), Duration.ofDays(30)));
    }

    private NewTopic topic(String name, Duration retention) {
        return TopicBuilder.name(name)
                .partitions(config.getPartitions())
                .replicas(config.getReplicas())
                .config("retention.ms", String.valueOf(retention.toMillis()))
                .build();
    }
}
