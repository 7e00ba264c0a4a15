package com.driftpool.trip.payment;

import com.driftpool.trip.entity.DriverEarnings;
import com.driftpool.trip.repository.DriverEarningsRepository;
import com.driftpool.trip.repository.TripRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Driver earnings ledger. Each trip credits at most once: the trip's {@code earningsCredited}
 * flag is flipped by a guarded UPDATE in the same transaction as the ledger increment, so a
 * repeated or concurrent credit finds the flag already set and changes nothing.
 *
 * A driver's ledger row is opened in its own transaction the first time it is needed, so two
 * first credits for the same driver both end up locking the one row instead of both inserting it.
 */
@Slf4j
@Service
public class DriverEarningsService {

    private final TripRepository tripRepository;
    private final DriverEarningsRepository earningsRepository;
    private final TransactionTemplate openLedgerTx;

    public DriverEarningsService(TripRepository tripRepository,
                                 DriverEarningsRepository earningsRepository,
                                 PlatformTransactionManager transactionManager) {
        this.tripRepository = tripRepository;
        this.earningsRepository = earningsRepository;
        this.openLedgerTx = new TransactionTemplate(transactionManager);
        this.openLedgerTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Transactional
    public boolean creditTrip(UUID tripId, String driverId, BigDecimal fare, BigDecimal tip) {
        if (tripRepository.markEarningsCredited(tripId) == 0) {
            log.info("Earnings for trip {} already credited, skipping", tripId);
            return false;
        }
        BigDecimal safeTip = tip == null ? BigDecimal.ZERO : tip;
        DriverEarnings earnings = lockOrCreate(driverId);
        earnings.setTotalEarnings(earnings.getTotalEarnings().add(fare).add(safeTip));
        earnings.setTotalTips(earnings.getTotalTips().add(safeTip));
        earnings.setTotalTrips(earnings.getTotalTrips() + 1);
        earningsRepository.save(earnings);

        log.info("Credited driver {} with {} (+{} tip) for trip {}", driverId, fare, safeTip, tripId);
        return true;
    }

    @Transactional
    public boolean creditCancellationCompensation(UUID tripId, String driverId, BigDecimal compensation) {
        if (tripRepository.markEarningsCredited(tripId) == 0) {
            log.info("Compensation for trip {} already credited, skipping", tripId);
            return false;
        }
        DriverEarnings earnings = lockOrCreate(driverId);
        earnings.setTotalEarnings(earnings.getTotalEarnings().add(compensation));
        earnings.setCancellationCompensation(earnings.getCancellationCompensation().add(compensation));
        earningsRepository.save(earnings);

        log.info("Credited driver {} with cancellation compensation {} for trip {}", driverId, compensation, tripId);
        return true;
    }

    public Optional<DriverEarnings> getEarnings(String driverId) {
        return earningsRepository.findById(driverId);
    }

    private DriverEarnings lockOrCreate(String driverId) {
        Optional<DriverEarnings> existing = earningsRepository.findForUpdate(driverId);
        if (existing.isPresent()) {
            return existing.get();
        }
        openLedger(driverId);
        return earningsRepository.findForUpdate(driverId)
                .orElseThrow(() -> new IllegalStateException("Earnings ledger for driver " + driverId + " missing after open"));
    }

    private void openLedger(String driverId) {
        try {
            openLedgerTx.executeWithoutResult(status ->
                    earningsRepository.saveAndFlush(DriverEarnings.builder().driverId(driverId).build()));
            log.info("Opened earnings ledger for driver {}", driverId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Earnings ledger for driver {} was opened concurrently", driverId);
        }
    }
}
