package com.driftpool.trip.store;

import com.driftpool.trip.entity.Trip;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Document-store view of trips: point reads, conditional writes and change-feed subscriptions.
 */
public interface TripStore {

    Trip create(Trip trip);

    Optional<Trip> get(UUID tripId);

    /**
     * Applies {@code patch} only if {@code precondition} holds against the latest committed state,
     * atomically with respect to every other write on the same trip.
     *
     * @return the updated trip, or empty if the trip is missing, the precondition failed, or a
     *         concurrent writer committed first. An empty result means nothing was written.
     */
    Optional<Trip> conditionalUpdate(UUID tripId, Predicate<Trip> precondition, Consumer<Trip> patch);

    List<Trip> find(TripQuery query);

    /**
     * Lazy stream of result snapshots for {@code query}: the current result on subscribe, then a
     * fresh result after every trip write. Cancelling the subscription has no effect on the data.
     */
    Flux<List<Trip>> subscribe(TripQuery query);

    /** Current state of one trip on subscribe, then every committed change to it. */
    Flux<Trip> watch(UUID tripId);
}
