package com.driftpool.trip.integration;

import com.driftpool.shared.events.TripStatusChangedEvent;
import com.driftpool.shared.util.KafkaTopics;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.support.serializer.JsonDeserializer;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Consumer side for integration tests: reads TripStatusChangedEvent from the embedded broker.
 */
@TestConfiguration
class TestKafkaConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Bean
    public ConsumerFactory<String, TripStatusChangedEvent> testConsumerFactory() {
        JsonDeserializer<TripStatusChangedEvent> deserializer =
                new JsonDeserializer<>(TripStatusChangedEvent.class, false);
        deserializer.addTrustedPackages("*");

        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "trip-integration-test");
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, true);
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), deserializer);
    }

    @Bean
    public AcceptedTripCollector acceptedTripCollector() {
        return new AcceptedTripCollector();
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, TripStatusChangedEvent>
    kafkaListenerContainerFactory(ConsumerFactory<String, TripStatusChangedEvent> testConsumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, TripStatusChangedEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(testConsumerFactory);
        return factory;
    }

    /** Kafka messages land here; the test reads from this queue. */
    static class AcceptedTripCollector {

        private final LinkedBlockingQueue<TripStatusChangedEvent> messages = new LinkedBlockingQueue<>();

        @KafkaListener(topics = KafkaTopics.TRIP_ACCEPTED, groupId = "trip-integration-test")
        public void capture(TripStatusChangedEvent event) {
            messages.add(event);
        }

        TripStatusChangedEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
            return messages.poll(timeout, unit);
        }
    }
}
