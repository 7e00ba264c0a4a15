package com.driftpool.trip.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Trip lifecycle counters, exposed at /actuator/prometheus:
 *
 *   trip_requests_total{outcome="created|rejected"}
 *   trip_accept_total{outcome="won|conflict"}
 *   trip_declines_total
 *   trip_resends_total
 *   trip_terminal_total{status="completed|cancelled|expired"}
 */
@Component
public class TripMetrics {

    private final Counter tripCreatedCounter;
    private final Counter tripRejectedCounter;
    private final Counter acceptWonCounter;
    private final Counter acceptConflictCounter;
    private final Counter declineCounter;
    private final Counter resendCounter;
    private final Counter completedCounter;
    private final Counter cancelledCounter;
    private final Counter expiredCounter;

    public TripMetrics(MeterRegistry registry) {
        this.tripCreatedCounter = Counter.builder("trip.requests")
                .tag("outcome", "created")
                .description("Trips successfully requested")
                .register(registry);

        this.tripRejectedCounter = Counter.builder("trip.requests")
                .tag("outcome", "rejected")
                .description("Trip requests rejected (validation, out of service area)")
                .register(registry);

        this.acceptWonCounter = Counter.builder("trip.accept")
                .tag("outcome", "won")
                .description("Accept calls that won the conditional write")
                .register(registry);

        this.acceptConflictCounter = Counter.builder("trip.accept")
                .tag("outcome", "conflict")
                .description("Accept calls rejected because the trip was already taken")
                .register(registry);

        this.declineCounter = Counter.builder("trip.declines")
                .description("Explicit driver declines")
                .register(registry);

        this.resendCounter = Counter.builder("trip.resends")
                .description("Rider resends of an open request")
                .register(registry);

        this.completedCounter = Counter.builder("trip.terminal")
                .tag("status", "completed")
                .register(registry);

        this.cancelledCounter = Counter.builder("trip.terminal")
                .tag("status", "cancelled")
                .register(registry);

        this.expiredCounter = Counter.builder("trip.terminal")
                .tag("status", "expired")
                .register(registry);
    }

    public void recordTripCreated()     { tripCreatedCounter.increment(); }
    public void recordTripRejected()    { tripRejectedCounter.increment(); }
    public void recordAcceptWon()       { acceptWonCounter.increment(); }
    public void recordAcceptConflict()  { acceptConflictCounter.increment(); }
    public void recordDecline()         { declineCounter.increment(); }
    public void recordResend()          { resendCounter.increment(); }
    public void recordCompleted()       { completedCounter.increment(); }
    public void recordCancelled()       { cancelledCounter.increment(); }
    public void recordExpired()         { expiredCounter.increment(); }
}
