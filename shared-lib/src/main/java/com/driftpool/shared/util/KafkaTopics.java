package com.driftpool.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String TRIP_REQUESTED        = "trip.requested";
    public static final String TRIP_ACCEPTED         = "trip.accepted";
    public static final String TRIP_STATUS_CHANGED   = "trip.status.changed";
    public static final String TRIP_CANCELLED        = "trip.cancelled";
    public static final String TRIP_EXPIRED          = "trip.expired";
    public static final String TRIP_COMPLETED        = "trip.completed";
    public static final String PAYMENT_SETTLED       = "payment.settled";
    public static final String PAYMENT_FAILED        = "payment.failed";
}
