package com.driftpool.trip.store;

import com.driftpool.trip.entity.Trip;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * In-process fan-out of committed trip writes. Subscribers that fall behind drop changes rather
 * than slow writers down; every consumer re-reads the store, so a dropped change only delays it.
 */
@Slf4j
@Component
public class TripChangeFeed {

    private final Sinks.Many<Trip> sink = Sinks.many().multicast().directBestEffort();

    public synchronized void publish(Trip trip) {
        Sinks.EmitResult result = sink.tryEmitNext(trip);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Change for trip {} not delivered to subscribers: {}", trip.getId(), result);
        }
    }

    public Flux<Trip> changes() {
        return sink.asFlux();
    }

    /**
     * Runs {@code reader} on subscribe and again after every change. Bursts of changes collapse
     * into a single re-read; reads happen off the writer's thread.
     */
    public <T> Flux<T> snapshots(Callable<T> reader) {
        Flux<T> refreshes = changes()
                .onBackpressureLatest()
                .publishOn(Schedulers.boundedElastic(), 1)
                .map(changed -> read(reader));
        return Flux.merge(Mono.fromCallable(reader).subscribeOn(Schedulers.boundedElastic()), refreshes);
    }

    /**
     * Current state of one trip, then each committed version of it. Completes once the trip
     * reaches a terminal status.
     */
    public Flux<Trip> entity(UUID tripId, Callable<Optional<Trip>> reader) {
        Mono<Trip> current = Mono.fromCallable(() -> reader.call().orElse(null))
                .subscribeOn(Schedulers.boundedElastic());
        return Flux.merge(current, changes().filter(t -> tripId.equals(t.getId())))
                .takeUntil(t -> t.getStatus().isTerminal());
    }

    private static <T> T read(Callable<T> reader) {
        try {
            return reader.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Snapshot read failed", e);
        }
    }
}
