package com.driftpool.trip.payment;

import com.driftpool.shared.enums.PaymentFlow;
import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.shared.enums.TripStatus;
import com.driftpool.trip.cancellation.CancellationDecision;
import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.lifecycle.TripEventPublisher;
import com.driftpool.trip.metrics.PaymentMetrics;
import com.driftpool.trip.store.InMemoryTripStore;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-03-12T17:00:00Z");
    private static final BigDecimal TWENTY = new BigDecimal("20.00");
    private static final BigDecimal TEN = new BigDecimal("10.00");

    @Mock private PaymentGateway gateway;
    @Mock private DriverEarningsService earningsService;
    @Mock private TripEventPublisher eventPublisher;

    private InMemoryTripStore tripStore;
    private PaymentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        tripStore = new InMemoryTripStore();
        orchestrator = new PaymentOrchestrator(gateway, new BoundedRetry(3, IntervalFunction.of(1)), tripStore,
                earningsService, eventPublisher, new PaymentMetrics(new SimpleMeterRegistry()),
                new TripEngineProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Trip seed(PaymentFlow flow, PaymentStatus paymentStatus, TripStatus status, String reference) {
        return tripStore.create(Trip.builder()
                .tenantId("default")
                .riderId("rider-1")
                .driverId(status == TripStatus.REQUESTED ? null : "driver-1")
                .status(status)
                .paymentFlow(flow)
                .paymentStatus(paymentStatus)
                .paymentReference(reference)
                .lockedContribution(TWENTY)
                .currency("KYD")
                .requestedAt(NOW)
                .build());
    }

    private static CancellationDecision split(BigDecimal fee, BigDecimal refund) {
        return new CancellationDecision(fee, refund, fee, "TEST");
    }

    @Test
    @DisplayName("Transient capture failures exhaust the retry budget and flag CAPTURE_FAILED")
    void captureExhaustedIsFlagged() {
        Trip trip = seed(PaymentFlow.AUTHORIZATION_HOLD, PaymentStatus.AUTHORIZED, TripStatus.DRIVER_ARRIVING, "hold-1");
        when(gateway.capture(eq("hold-1"), anyString()))
                .thenThrow(PaymentGatewayException.transientFailure("TIMEOUT", "gateway timed out"));

        Trip result = orchestrator.settleOnAccept(trip);

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURE_FAILED);
        assertThat(result.getPaymentFailureReason()).contains("TIMEOUT");
        verify(gateway, times(3)).capture("hold-1", trip.getId() + ":capture");
        verify(eventPublisher).payment(any(), eq(true));
    }

    @Test
    @DisplayName("A capture that succeeds on the second attempt is recorded as CAPTURED")
    void captureRecoversOnRetry() {
        Trip trip = seed(PaymentFlow.AUTHORIZATION_HOLD, PaymentStatus.AUTHORIZED, TripStatus.DRIVER_ARRIVING, "hold-1");
        when(gateway.capture(eq("hold-1"), anyString()))
                .thenThrow(PaymentGatewayException.transientFailure("HTTP_503", "unavailable"))
                .thenReturn(new GatewayResult("hold-1", "captured"));

        Trip result = orchestrator.settleOnAccept(trip);

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURED);
        verify(gateway, times(2)).capture(eq("hold-1"), anyString());
    }

    @Test
    @DisplayName("A hard decline is not retried")
    void hardDeclineNotRetried() {
        Trip trip = seed(PaymentFlow.VERIFICATION, PaymentStatus.VERIFIED, TripStatus.DRIVER_ARRIVING, null);
        when(gateway.charge(anyString(), any(), anyString(), anyString()))
                .thenThrow(PaymentGatewayException.rejected("CARD_DECLINED", "insufficient funds"));

        Trip result = orchestrator.settleOnAccept(trip);

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.CHARGE_FAILED);
        verify(gateway, times(1)).charge(anyString(), any(), anyString(), anyString());
    }

    @Test
    @DisplayName("Releasing the same hold twice reaches the gateway once")
    void releaseHappensOnce() {
        Trip trip = seed(PaymentFlow.AUTHORIZATION_HOLD, PaymentStatus.AUTHORIZED, TripStatus.EXPIRED, "hold-1");
        when(gateway.release(eq("hold-1"), anyString())).thenReturn(new GatewayResult("hold-1", "released"));

        Trip first = orchestrator.releaseHold(trip);
        Trip second = orchestrator.releaseHold(first);

        assertThat(second.getPaymentStatus()).isEqualTo(PaymentStatus.CANCELLED);
        verify(gateway, times(1)).release("hold-1", trip.getId() + ":release");
    }

    @Test
    @DisplayName("Cancelling a held trip with a fee captures the hold and refunds the remainder")
    void cancelHeldTripWithFee() {
        Trip trip = seed(PaymentFlow.AUTHORIZATION_HOLD, PaymentStatus.AUTHORIZED, TripStatus.CANCELLED, "hold-1");
        when(gateway.capture(eq("hold-1"), anyString())).thenReturn(new GatewayResult("hold-1", "captured"));
        when(gateway.refund(eq("hold-1"), any(), anyString())).thenReturn(new GatewayResult("rf-1", "refunded"));

        Trip result = orchestrator.settleCancellation(trip, split(TEN, TEN));

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.PARTIALLY_REFUNDED);
        verify(gateway).capture("hold-1", trip.getId() + ":cancel-capture");
        verify(gateway).refund("hold-1", TEN, trip.getId() + ":refund");
        verify(gateway, never()).release(anyString(), anyString());
    }

    @Test
    @DisplayName("Cancelling a charged trip with no fee refunds everything")
    void cancelChargedTripFullRefund() {
        Trip trip = seed(PaymentFlow.VERIFICATION, PaymentStatus.CAPTURED, TripStatus.CANCELLED, "ch-1");
        when(gateway.refund(eq("ch-1"), any(), anyString())).thenReturn(new GatewayResult("rf-1", "refunded"));

        Trip result = orchestrator.settleCancellation(trip, split(BigDecimal.ZERO.setScale(2), TWENTY));

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
        verify(gateway).refund("ch-1", TWENTY, trip.getId() + ":refund");
    }

    @Test
    @DisplayName("Cancelling an uncollected trip with no fee touches no gateway")
    void cancelUncollectedNoFee() {
        Trip trip = seed(PaymentFlow.VERIFICATION, PaymentStatus.VERIFIED, TripStatus.CANCELLED, null);

        Trip result = orchestrator.settleCancellation(trip, split(BigDecimal.ZERO.setScale(2), TWENTY));

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.CANCELLED);
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("Cancelling an uncollected trip with a fee charges only the fee")
    void cancelUncollectedChargesFee() {
        Trip trip = seed(PaymentFlow.NONE, PaymentStatus.PENDING, TripStatus.CANCELLED, null);
        when(gateway.charge(eq("rider-1"), eq(TEN), eq("KYD"), anyString())).thenReturn(new GatewayResult("ch-9", "charged"));

        Trip result = orchestrator.settleCancellation(trip, split(TEN, TEN));

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURED);
        assertThat(result.getPaymentReference()).isEqualTo("ch-9");
        verify(gateway).charge("rider-1", TEN, "KYD", trip.getId() + ":cancel-fee");
    }

    @Test
    @DisplayName("Reconciliation retries a flagged capture on a completed trip")
    void reconcileFlaggedCapture() {
        Trip trip = seed(PaymentFlow.AUTHORIZATION_HOLD, PaymentStatus.CAPTURE_FAILED, TripStatus.COMPLETED, "hold-1");
        when(gateway.capture(eq("hold-1"), anyString())).thenReturn(new GatewayResult("hold-1", "captured"));

        assertThat(orchestrator.reconcile(trip).getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURED);
    }

    @Test
    @DisplayName("Completion does not collect twice")
    void completionSkipsCapturedTrip() {
        Trip trip = seed(PaymentFlow.VERIFICATION, PaymentStatus.CAPTURED, TripStatus.AWAITING_TIP, "ch-1");

        assertThat(orchestrator.captureOnCompletion(trip).getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURED);
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("A failed tip charge flags only the tip")
    void tipChargeFailure() {
        Trip trip = seed(PaymentFlow.VERIFICATION, PaymentStatus.CAPTURED, TripStatus.COMPLETED, "ch-1");
        tripStore.rewrite(trip.getId(), t -> t.setTip(new BigDecimal("5.00")));
        when(gateway.charge(anyString(), any(), anyString(), anyString()))
                .thenThrow(PaymentGatewayException.rejected("CARD_DECLINED", "declined"));

        Trip result = orchestrator.chargeTip(tripStore.get(trip.getId()).orElseThrow());

        assertThat(result.getTipPaymentStatus()).isEqualTo(PaymentStatus.CHARGE_FAILED);
        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURED);
    }

    @Test
    @DisplayName("Earnings are only credited for completed trips")
    void earningsOnlyForCompletedTrips() {
        Trip inProgress = seed(PaymentFlow.VERIFICATION, PaymentStatus.CAPTURED, TripStatus.IN_PROGRESS, "ch-1");
        assertThat(orchestrator.creditDriverEarnings(inProgress)).isFalse();
        verifyNoInteractions(earningsService);

        Trip completed = seed(PaymentFlow.VERIFICATION, PaymentStatus.CAPTURED, TripStatus.COMPLETED, "ch-2");
        when(earningsService.creditTrip(completed.getId(), "driver-1", TWENTY, null)).thenReturn(true);

        assertThat(orchestrator.creditDriverEarnings(completed)).isTrue();
    }

    @Test
    @DisplayName("An unexpected gateway exception is flagged instead of leaving the payment VERIFIED")
    void unexpectedGatewayExceptionFlagged() {
        Trip trip = seed(PaymentFlow.VERIFICATION, PaymentStatus.VERIFIED, TripStatus.DRIVER_ARRIVING, null);
        when(gateway.charge(anyString(), any(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("connection reset"));

        Trip result = orchestrator.settleOnAccept(trip);

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.CHARGE_FAILED);
        assertThat(result.getPaymentFailureReason()).contains("GATEWAY_ERROR");
        assertThat(result.getPaymentClaimedAt()).isNull();
        verify(gateway, times(1)).charge(anyString(), any(), anyString(), anyString());
        verify(eventPublisher).payment(any(), eq(true));
    }

    @Test
    @DisplayName("No collection is started on a trip that was already cancelled")
    void noCollectionOnCancelledTrip() {
        Trip trip = seed(PaymentFlow.VERIFICATION, PaymentStatus.VERIFIED, TripStatus.CANCELLED, null);

        Trip result = orchestrator.settleOnAccept(trip);

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.VERIFIED);
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("A cancellation leaves a payment in flight to its claimer")
    void cancellationDefersToInFlightClaim() {
        Trip trip = seed(PaymentFlow.VERIFICATION, PaymentStatus.CHARGING, TripStatus.CANCELLED, null);

        Trip result = orchestrator.settleCancellation(trip, split(TEN, TEN));

        assertThat(result.getPaymentStatus()).isEqualTo(PaymentStatus.CHARGING);
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("Claims older than the claim timeout are flagged for reconciliation; recent ones are left alone")
    void abandonedClaimsFlagged() {
        Trip abandoned = seed(PaymentFlow.VERIFICATION, PaymentStatus.CHARGING, TripStatus.DRIVER_ARRIVING, null);
        tripStore.rewrite(abandoned.getId(), t -> t.setPaymentClaimedAt(NOW.minus(Duration.ofMinutes(10))));
        Trip recent = seed(PaymentFlow.AUTHORIZATION_HOLD, PaymentStatus.CAPTURING, TripStatus.DRIVER_ARRIVING, "hold-1");
        tripStore.rewrite(recent.getId(), t -> t.setPaymentClaimedAt(NOW.minus(Duration.ofMinutes(1))));

        assertThat(orchestrator.releaseAbandonedClaims()).isEqualTo(1);

        Trip flagged = tripStore.get(abandoned.getId()).orElseThrow();
        assertThat(flagged.getPaymentStatus()).isEqualTo(PaymentStatus.CHARGE_FAILED);
        assertThat(flagged.getPaymentClaimedAt()).isNull();
        assertThat(tripStore.get(recent.getId()).orElseThrow().getPaymentStatus()).isEqualTo(PaymentStatus.CAPTURING);
        verifyNoInteractions(gateway);
    }

    @Test
    @DisplayName("A ledger failure is reported as not credited and the catch-up credits the trip later")
    void creditFailureLeftForCatchUp() {
        Trip completed = seed(PaymentFlow.VERIFICATION, PaymentStatus.CAPTURED, TripStatus.COMPLETED, "ch-1");
        when(earningsService.creditTrip(completed.getId(), "driver-1", TWENTY, null))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates \"driver_earnings_pkey\""))
                .thenReturn(true);

        assertThat(orchestrator.creditDriverEarnings(completed)).isFalse();
        assertThat(orchestrator.creditOutstandingEarnings()).isEqualTo(1);

        verify(earningsService, times(2)).creditTrip(completed.getId(), "driver-1", TWENTY, null);
    }

    @Test
    @DisplayName("The catch-up also credits owed cancellation compensation")
    void catchUpCreditsCompensation() {
        Trip cancelled = seed(PaymentFlow.VERIFICATION, PaymentStatus.PARTIALLY_REFUNDED, TripStatus.CANCELLED, "ch-1");
        tripStore.rewrite(cancelled.getId(), t -> {
            t.setCancellationFee(TEN);
            t.setRefundAmount(TEN);
            t.setDriverCompensation(TEN);
        });
        when(earningsService.creditCancellationCompensation(cancelled.getId(), "driver-1", TEN)).thenReturn(true);

        assertThat(orchestrator.creditOutstandingEarnings()).isEqualTo(1);
    }
}
