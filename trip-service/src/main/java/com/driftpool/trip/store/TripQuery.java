package com.driftpool.trip.store;

import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.shared.enums.TripStatus;
import com.driftpool.trip.entity.Trip;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.Set;

/**
 * Filter over trips, ordered by {@code requestedAt} (newest first unless {@code oldestFirst}).
 * Null fields do not constrain the result.
 */
@Value
@Builder
public class TripQuery {

    Set<TripStatus> statuses;
    Set<PaymentStatus> paymentStatuses;
    String riderId;
    Instant requestedBefore;
    Instant ratingDeadlineBefore;
    Instant paymentClaimedBefore;
    Boolean earningsCredited;
    /** Only trips that name a driver and owe them a positive cancellation compensation. */
    boolean compensationDue;
    boolean oldestFirst;
    @Builder.Default
    int limit = 100;

    public static TripQuery openRequests(int limit) {
        return TripQuery.builder()
                .statuses(Set.of(TripStatus.REQUESTED))
                .limit(limit)
                .build();
    }

    public boolean matches(Trip trip) {
        if (statuses != null && !statuses.contains(trip.getStatus())) {
            return false;
        }
        if (paymentStatuses != null && !paymentStatuses.contains(trip.getPaymentStatus())) {
            return false;
        }
        if (riderId != null && !riderId.equals(trip.getRiderId())) {
            return false;
        }
        if (requestedBefore != null
                && (trip.getRequestedAt() == null || !trip.getRequestedAt().isBefore(requestedBefore))) {
            return false;
        }
        if (earningsCredited != null && trip.isEarningsCredited() != earningsCredited) {
            return false;
        }
        if (compensationDue && (!trip.hasDriver() || trip.getDriverCompensation() == null
                || trip.getDriverCompensation().signum() <= 0)) {
            return false;
        }
        if (paymentClaimedBefore != null
                && (trip.getPaymentClaimedAt() == null || !trip.getPaymentClaimedAt().isBefore(paymentClaimedBefore))) {
            return false;
        }
        return ratingDeadlineBefore == null
                || (trip.getRatingDeadline() != null && trip.getRatingDeadline().isBefore(ratingDeadlineBefore));
    }

    public Comparator<Trip> ordering() {
        Comparator<Trip> byRequestedAt = Comparator.comparing(Trip::getRequestedAt,
                Comparator.nullsFirst(Comparator.naturalOrder()));
        return oldestFirst ? byRequestedAt : byRequestedAt.reversed();
    }
}
