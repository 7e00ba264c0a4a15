package com.driftpool.trip.payment;

import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.store.TripQuery;
import com.driftpool.trip.store.TripStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;

/**
 * Retries trips whose payment was left in a flagged status after the orchestrator's own retries
 * ran out. Each trip goes back through {@link PaymentOrchestrator#reconcile}, which re-checks the
 * status and reuses the same idempotency keys, so a gateway call that actually went through the
 * first time is replayed rather than repeated. Claims abandoned mid-call (a crashed instance) are
 * flagged first so they are retried in the same pass.
 */
@Slf4j
@Component
public class PaymentReconciliationJob {

    private static final int BATCH_SIZE = 100;

    private final TripStore tripStore;
    private final PaymentOrchestrator paymentOrchestrator;
    private final Counter reconciledCounter;
    private final Counter stillFlaggedCounter;

    public PaymentReconciliationJob(TripStore tripStore,
                                    PaymentOrchestrator paymentOrchestrator,
                                    MeterRegistry meterRegistry) {
        this.tripStore           = tripStore;
        this.paymentOrchestrator = paymentOrchestrator;
        this.reconciledCounter   = Counter.builder("payment.reconciliation.success")
                .description("Flagged trip payments settled by reconciliation")
                .register(meterRegistry);
        this.stillFlaggedCounter = Counter.builder("payment.reconciliation.failed")
                .description("Flagged trip payments still failing after a reconciliation pass")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${driftpool.payment.reconciliation-interval-ms:300000}")
    public void scheduledReconciliation() {
        reconcileFlaggedPayments();
        int credited = paymentOrchestrator.creditOutstandingEarnings();
        if (credited > 0) {
            log.info("Reconciliation: credited {} trip(s) with outstanding driver earnings", credited);
        }
    }

    public int reconcileFlaggedPayments() {
        int abandoned = paymentOrchestrator.releaseAbandonedClaims();
        if (abandoned > 0) {
            log.warn("Reconciliation: flagged {} abandoned payment claim(s)", abandoned);
        }
        List<Trip> flagged = tripStore.find(TripQuery.builder()
                .paymentStatuses(EnumSet.of(PaymentStatus.CAPTURE_FAILED, PaymentStatus.CHARGE_FAILED,
                        PaymentStatus.REFUND_FAILED, PaymentStatus.RELEASE_FAILED))
                .oldestFirst(true)
                .limit(BATCH_SIZE)
                .build());
        if (flagged.isEmpty()) {
            return 0;
        }
        log.info("Reconciliation: found {} flagged trip payment(s)", flagged.size());

        int settled = 0;
        for (Trip trip : flagged) {
            PaymentStatus before = trip.getPaymentStatus();
            Trip after = paymentOrchestrator.reconcile(trip);
            if (after.getPaymentStatus().isFlagged()) {
                stillFlaggedCounter.increment();
                log.warn("Reconciliation: trip {} still {}", trip.getId(), after.getPaymentStatus());
            } else {
                settled++;
                reconciledCounter.increment();
                log.info("Reconciliation: trip {} moved {} -> {}", trip.getId(), before, after.getPaymentStatus());
            }
        }
        return settled;
    }
}
