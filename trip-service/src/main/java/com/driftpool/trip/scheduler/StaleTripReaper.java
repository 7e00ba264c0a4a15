package com.driftpool.trip.scheduler;

import com.driftpool.shared.enums.TripStatus;
import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.lifecycle.TripEventPublisher;
import com.driftpool.trip.metrics.TripMetrics;
import com.driftpool.trip.payment.PaymentOrchestrator;
import com.driftpool.trip.store.TripQuery;
import com.driftpool.trip.store.TripStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Expires ride requests nobody accepted within {@code driftpool.reaper.max-age} (30 minutes).
 *
 * Each expiry is a conditional write that still requires REQUESTED with no driver, so a driver
 * accepting at the same moment either wins outright or loses cleanly. Only the writer that
 * actually expired the trip releases its payment hold. The Redis lock just keeps instances from
 * sweeping the same rows at once; correctness does not depend on it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleTripReaper {

    private static final String LOCK_KEY = "lock:sweep:stale-trips";
    private static final String EXPIRY_REASON = "No driver accepted within the request window";
    private static final int BATCH_SIZE = 200;

    private final TripStore tripStore;
    private final PaymentOrchestrator paymentOrchestrator;
    private final TripEventPublisher eventPublisher;
    private final TripMetrics metrics;
    private final RedissonClient redissonClient;
    private final TripEngineProperties properties;
    private final Clock clock;

    @Scheduled(initialDelayString = "${driftpool.reaper.initial-delay-ms:60000}",
               fixedDelayString = "${driftpool.reaper.interval-ms:60000}")
    public void scheduledSweep() {
        sweep();
    }

    /** @return number of trips this instance expired */
    public int sweep() {
        RLock lock = redissonClient.getLock(LOCK_KEY);
        try {
            if (!lock.tryLock(0, 50, TimeUnit.SECONDS)) {
                log.debug("Stale-trip sweep already running on another instance");
                return 0;
            }
            Instant cutoff = cutoff();
            return expireAll(tripStore.find(TripQuery.builder()
                    .statuses(Set.of(TripStatus.REQUESTED))
                    .requestedBefore(cutoff)
                    .oldestFirst(true)
                    .limit(BATCH_SIZE)
                    .build()), cutoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while acquiring stale-trip sweep lock", e);
            return 0;
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    /** Expires one rider's stale requests, e.g. before they open a new one. */
    public int expireStaleTripsForRider(String riderId) {
        Instant cutoff = cutoff();
        return expireAll(tripStore.find(TripQuery.builder()
                .statuses(Set.of(TripStatus.REQUESTED))
                .riderId(riderId)
                .requestedBefore(cutoff)
                .build()), cutoff);
    }

    private int expireAll(List<Trip> candidates, Instant cutoff) {
        int expired = 0;
        for (Trip trip : candidates) {
            if (expire(trip, cutoff)) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} stale trip request(s) older than {}", expired, cutoff);
        }
        return expired;
    }

    private boolean expire(Trip trip, Instant cutoff) {
        Instant now = clock.instant();
        Optional<Trip> won = tripStore.conditionalUpdate(trip.getId(),
                t -> t.getStatus() == TripStatus.REQUESTED
                        && !t.hasDriver()
                        && t.getRequestedAt() != null
                        && t.getRequestedAt().isBefore(cutoff),
                t -> {
                    t.transitionTo(TripStatus.EXPIRED);
                    t.setExpiredAt(now);
                    t.setExpiryReason(EXPIRY_REASON);
                });
        if (won.isEmpty()) {
            log.debug("Trip {} no longer stale, skipping", trip.getId());
            return false;
        }
        Trip expired = won.get();
        metrics.recordExpired();
        eventPublisher.statusChanged(expired, TripStatus.REQUESTED, EXPIRY_REASON);
        paymentOrchestrator.releaseHold(expired);
        return true;
    }

    private Instant cutoff() {
        return clock.instant().minus(properties.getReaper().getMaxAge());
    }
}
