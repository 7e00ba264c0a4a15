package com.driftpool.trip.store;

import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.repository.TripRepository;
import jakarta.persistence.OptimisticLockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Relational trip store.
 *
 * Each conditional write runs in its own short transaction: re-read the row, test the
 * precondition, apply the patch and flush. The flush is guarded by the {@code @Version} column,
 * so when two writers evaluate the precondition against the same version only the first commit
 * lands; the second fails its version check and is reported as a rejection. Callers never hold a
 * transaction across gateway calls.
 */
@Slf4j
@Component
public class JpaTripStore implements TripStore {

    private final TripRepository tripRepository;
    private final TripChangeFeed changeFeed;
    private final TransactionTemplate writeTx;

    public JpaTripStore(TripRepository tripRepository,
                        TripChangeFeed changeFeed,
                        PlatformTransactionManager transactionManager) {
        this.tripRepository = tripRepository;
        this.changeFeed = changeFeed;
        this.writeTx = new TransactionTemplate(transactionManager);
        this.writeTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public Trip create(Trip trip) {
        Trip saved = writeTx.execute(status -> tripRepository.saveAndFlush(trip));
        changeFeed.publish(saved);
        return saved;
    }

    @Override
    public Optional<Trip> get(UUID tripId) {
        return tripRepository.findById(tripId);
    }

    @Override
    public Optional<Trip> conditionalUpdate(UUID tripId, Predicate<Trip> precondition, Consumer<Trip> patch) {
        Optional<Trip> updated;
        try {
            updated = writeTx.execute(status -> {
                Optional<Trip> current = tripRepository.findById(tripId);
                if (current.isEmpty() || !precondition.test(current.get())) {
                    return Optional.<Trip>empty();
                }
                Trip trip = current.get();
                patch.accept(trip);
                return Optional.of(tripRepository.saveAndFlush(trip));
            });
        } catch (OptimisticLockException | ObjectOptimisticLockingFailureException e) {
            log.warn("Conditional write on trip {} rejected: a concurrent writer committed first", tripId);
            return Optional.empty();
        }

        if (updated == null || updated.isEmpty()) {
            log.debug("Conditional write on trip {} rejected: precondition not met", tripId);
            return Optional.empty();
        }
        changeFeed.publish(updated.get());
        return updated;
    }

    @Override
    public List<Trip> find(TripQuery query) {
        return tripRepository.findAll(TripSpecifications.from(query),
                        PageRequest.of(0, query.getLimit(), TripSpecifications.sort(query)))
                .getContent();
    }

    @Override
    public Flux<List<Trip>> subscribe(TripQuery query) {
        return changeFeed.snapshots(() -> find(query));
    }

    @Override
    public Flux<Trip> watch(UUID tripId) {
        return changeFeed.entity(tripId, () -> get(tripId));
    }
}
