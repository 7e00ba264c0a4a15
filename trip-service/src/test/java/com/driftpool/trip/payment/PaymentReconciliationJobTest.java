package com.driftpool.trip.payment;

import com.driftpool.shared.enums.PaymentFlow;
import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.shared.enums.TripStatus;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.store.InMemoryTripStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentReconciliationJobTest {

    @Mock private PaymentOrchestrator paymentOrchestrator;

    private InMemoryTripStore tripStore;
    private SimpleMeterRegistry meterRegistry;
    private PaymentReconciliationJob job;

    @BeforeEach
    void setUp() {
        tripStore = new InMemoryTripStore();
        meterRegistry = new SimpleMeterRegistry();
        job = new PaymentReconciliationJob(tripStore, paymentOrchestrator, meterRegistry);
    }

    private Trip seed(PaymentStatus paymentStatus) {
        return tripStore.create(Trip.builder()
                .riderId("rider-1")
                .driverId("driver-1")
                .status(TripStatus.COMPLETED)
                .paymentFlow(PaymentFlow.AUTHORIZATION_HOLD)
                .paymentStatus(paymentStatus)
                .lockedContribution(new BigDecimal("20.00"))
                .requestedAt(Instant.parse("2024-03-12T17:00:00Z"))
                .build());
    }

    private static Trip withStatus(Trip trip, PaymentStatus status) {
        trip.setPaymentStatus(status);
        return trip;
    }

    @Test
    void retriesOnlyFlaggedPaymentsAndCountsOutcomes() {
        Trip recovers = seed(PaymentStatus.CAPTURE_FAILED);
        seed(PaymentStatus.REFUND_FAILED);
        seed(PaymentStatus.CAPTURED);

        when(paymentOrchestrator.reconcile(any(Trip.class))).thenAnswer(inv -> {
            Trip trip = inv.getArgument(0);
            return trip.getId().equals(recovers.getId())
                    ? withStatus(trip, PaymentStatus.CAPTURED)
                    : withStatus(trip, PaymentStatus.REFUND_FAILED);
        });

        assertThat(job.reconcileFlaggedPayments()).isEqualTo(1);
        assertThat(meterRegistry.counter("payment.reconciliation.success").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("payment.reconciliation.failed").count()).isEqualTo(1.0);
        verify(paymentOrchestrator, times(2)).reconcile(any(Trip.class));
    }

    @Test
    void nothingFlaggedMeansNoWork() {
        seed(PaymentStatus.CAPTURED);

        assertThat(job.reconcileFlaggedPayments()).isZero();
        verify(paymentOrchestrator, never()).reconcile(any());
    }

    @Test
    void scheduledRunFlagsAbandonedClaimsBeforeRetryingAndCatchesUpEarnings() {
        Trip abandoned = seed(PaymentStatus.CAPTURING);
        when(paymentOrchestrator.releaseAbandonedClaims()).thenAnswer(inv -> {
            tripStore.rewrite(abandoned.getId(), t -> t.setPaymentStatus(PaymentStatus.CAPTURE_FAILED));
            return 1;
        });
        when(paymentOrchestrator.reconcile(any(Trip.class)))
                .thenAnswer(inv -> withStatus(inv.getArgument(0), PaymentStatus.CAPTURED));

        job.scheduledReconciliation();

        InOrder order = inOrder(paymentOrchestrator);
        order.verify(paymentOrchestrator).releaseAbandonedClaims();
        order.verify(paymentOrchestrator).reconcile(any(Trip.class));
        order.verify(paymentOrchestrator).creditOutstandingEarnings();
        assertThat(meterRegistry.counter("payment.reconciliation.success").count()).isEqualTo(1.0);
    }
}
