package com.driftpool.trip.lifecycle;

import com.driftpool.shared.enums.TripStatus;
import com.driftpool.shared.events.PaymentEvent;
import com.driftpool.shared.events.TripStatusChangedEvent;
import com.driftpool.shared.util.KafkaTopics;
import com.driftpool.trip.entity.Trip;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Publishes committed trip and payment changes for downstream consumers (notifications, analytics).
 * Publishing happens after the trip write; a broker failure is logged and never undoes the write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void statusChanged(Trip trip, TripStatus previousStatus, String reason) {
        TripStatusChangedEvent event = TripStatusChangedEvent.builder()
                .tripId(trip.getId().toString())
                .riderId(trip.getRiderId())
                .driverId(trip.getDriverId())
                .previousStatus(previousStatus)
                .status(trip.getStatus())
                .paymentStatus(trip.getPaymentStatus())
                .lockedContribution(trip.getLockedContribution())
                .reason(reason)
                .tenantId(trip.getTenantId())
                .changedAt(Instant.now())
                .build();
        send(topicFor(previousStatus, trip.getStatus()), event.getTripId(), event);
    }

    public void payment(PaymentEvent event, boolean failed) {
        send(failed ? KafkaTopics.PAYMENT_FAILED : KafkaTopics.PAYMENT_SETTLED, event.getTripId(), event);
    }

    static String topicFor(TripStatus previous, TripStatus current) {
        if (previous == null) {
            return KafkaTopics.TRIP_REQUESTED;
        }
        return switch (current) {
            case ACCEPTED, DRIVER_ARRIVING -> previous == TripStatus.REQUESTED
                    ? KafkaTopics.TRIP_ACCEPTED
                    : KafkaTopics.TRIP_STATUS_CHANGED;
            case CANCELLED -> KafkaTopics.TRIP_CANCELLED;
            case EXPIRED   -> KafkaTopics.TRIP_EXPIRED;
            case COMPLETED -> KafkaTopics.TRIP_COMPLETED;
            default        -> KafkaTopics.TRIP_STATUS_CHANGED;
        };
    }

    private void send(String topic, String key, Object event) {
        try {
            kafkaTemplate.send(topic, key, event).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.warn("Failed to publish {} for trip {}: {}", topic, key, ex.getMessage());
                }
            });
        } catch (KafkaException e) {
            log.error("Kafka unavailable, dropping {} for trip {}: {}", topic, key, e.getMessage());
        }
    }
}
