package com.driftpool.trip.payment;

import com.driftpool.shared.enums.PaymentFlow;
import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.shared.enums.TripStatus;
import com.driftpool.shared.events.PaymentEvent;
import com.driftpool.trip.cancellation.CancellationDecision;
import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.lifecycle.TripEventPublisher;
import com.driftpool.trip.metrics.PaymentMetrics;
import com.driftpool.trip.store.TripQuery;
import com.driftpool.trip.store.TripStore;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Moves money for trips through the {@link PaymentGateway}.
 *
 * Every gateway call is claimed first: a conditional write moves the payment from the status it
 * was observed in to an in-flight status ({@code CHARGING}, {@code CAPTURING}, ...). Only the
 * claimer calls the gateway and only the claimer records the outcome, so a hold is captured or
 * released at most once even when the reaper, a cancellation and the reconciliation job reach
 * the same trip together.
 *
 * A cancellation that lands while a collection is in flight leaves the money alone; the collector
 * sees the cancelled trip when it records its outcome and settles the cancellation split against
 * what it just collected. A collection that has not been claimed yet is never started on a
 * cancelled or expired trip.
 *
 * Gateway failures never reach the caller: once {@link BoundedRetry} gives up the trip is left in a
 * flagged status ({@code CAPTURE_FAILED}, {@code CHARGE_FAILED}, ...) for reconciliation.
 * None of these methods run inside a trip transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentOrchestrator {

    private static final Set<PaymentStatus> CAPTURABLE = EnumSet.of(PaymentStatus.AUTHORIZED, PaymentStatus.CAPTURE_FAILED);
    private static final Set<PaymentStatus> CHARGEABLE =
            EnumSet.of(PaymentStatus.PENDING, PaymentStatus.VERIFIED, PaymentStatus.CHARGE_FAILED);
    private static final Set<PaymentStatus> RELEASABLE =
            EnumSet.of(PaymentStatus.AUTHORIZED, PaymentStatus.CAPTURE_FAILED, PaymentStatus.RELEASE_FAILED);
    private static final Set<PaymentStatus> REFUNDABLE = EnumSet.of(PaymentStatus.CAPTURED, PaymentStatus.REFUND_FAILED);
    private static final Set<PaymentStatus> TIP_CHARGEABLE = EnumSet.of(PaymentStatus.PENDING, PaymentStatus.CHARGE_FAILED);
    private static final int CLAIM_SWEEP_BATCH = 100;

    private final PaymentGateway gateway;
    private final BoundedRetry paymentRetry;
    private final TripStore tripStore;
    private final DriverEarningsService earningsService;
    private final TripEventPublisher eventPublisher;
    private final PaymentMetrics paymentMetrics;
    private final TripEngineProperties properties;
    private final Clock clock;

    /** Places the hold for an authorization-hold trip right after it is created. */
    public Trip authorizeHold(Trip trip) {
        if (trip.getPaymentFlow() != PaymentFlow.AUTHORIZATION_HOLD || trip.getPaymentStatus() != PaymentStatus.PENDING) {
            return trip;
        }
        BigDecimal amount = trip.getLockedContribution();
        return run(trip, GatewayStep.builder()
                .operation("authorize")
                .amount(amount)
                .from(EnumSet.of(PaymentStatus.PENDING))
                .inFlight(PaymentStatus.AUTHORIZING)
                .collecting(true)
                .call(t -> gateway.authorize(customerOf(t), amount, currency(), key(t, "authorize")))
                .onSuccess((t, result) -> {
                    t.setPaymentStatus(PaymentStatus.AUTHORIZED);
                    t.setPaymentReference(result.reference());
                })
                .failedStatus(PaymentStatus.AUTHORIZATION_FAILED)
                .build());
    }

    /**
     * Collects the locked contribution once a driver has committed: the verification flow charges
     * the saved card, the hold flow captures. A trip waiting for the rider to pay is left alone.
     */
    public Trip settleOnAccept(Trip trip) {
        switch (trip.getPaymentFlow()) {
            case VERIFICATION:
                return charge(trip, trip.getLockedContribution(), "charge", true);
            case AUTHORIZATION_HOLD:
                return capture(trip, "capture", true);
            default:
                return trip;
        }
    }

    /** Rider paid for a trip the driver accepted in waiting-for-payment mode. */
    public Trip chargeOnPaymentConfirmation(Trip trip) {
        return charge(trip, trip.getLockedContribution(), "charge", true);
    }

    /** Last chance to collect at completion when acceptance-time collection failed or never ran. */
    public Trip captureOnCompletion(Trip trip) {
        PaymentStatus status = trip.getPaymentStatus();
        if (status == PaymentStatus.CAPTURED) {
            return trip;
        }
        if (CAPTURABLE.contains(status)) {
            return capture(trip, "capture", true);
        }
        if (CHARGEABLE.contains(status)) {
            return charge(trip, trip.getLockedContribution(), "charge", true);
        }
        log.warn("Trip {} completed with payment status {}, nothing to collect", trip.getId(), status);
        return trip;
    }

    public Trip chargeTip(Trip trip) {
        BigDecimal tip = trip.getTip();
        if (tip == null || tip.signum() <= 0) {
            return trip;
        }
        if (trip.getTipPaymentStatus() == PaymentStatus.CAPTURED) {
            return trip;
        }
        return run(trip, GatewayStep.builder()
                .operation("tip")
                .amount(tip)
                .tip(true)
                .from(TIP_CHARGEABLE)
                .inFlight(PaymentStatus.CHARGING)
                .call(t -> gateway.charge(customerOf(t), tip, currency(), key(t, "tip")))
                .onSuccess((t, result) -> t.setTipPaymentStatus(PaymentStatus.CAPTURED))
                .failedStatus(PaymentStatus.CHARGE_FAILED)
                .build());
    }

    /** Voids an outstanding hold. Only an {@code AUTHORIZED} (or previously failed) hold is touched. */
    public Trip releaseHold(Trip trip) {
        if (!RELEASABLE.contains(trip.getPaymentStatus()) || trip.getPaymentReference() == null) {
            return trip;
        }
        return run(trip, GatewayStep.builder()
                .operation("release")
                .amount(trip.getLockedContribution())
                .from(RELEASABLE)
                .inFlight(PaymentStatus.RELEASING)
                .requiresReference(true)
                .call(t -> gateway.release(t.getPaymentReference(), key(t, "release")))
                .onSuccess((t, result) -> t.setPaymentStatus(PaymentStatus.CANCELLED))
                .failedStatus(PaymentStatus.RELEASE_FAILED)
                .build());
    }

    /**
     * Applies a cancellation split to whatever has been collected so far: keep the fee and refund the
     * rest of a captured payment, capture a hold and refund the remainder, or charge just the fee
     * when nothing was collected yet. With no fee, holds are released and captures fully refunded.
     * A payment still in flight is left to its claimer, which settles once it has recorded.
     */
    public Trip settleCancellation(Trip trip, CancellationDecision decision) {
        PaymentStatus status = trip.getPaymentStatus();
        if (status.isInFlight()) {
            log.info("Trip {} cancelled with payment {} in flight, its claimer settles the cancellation", trip.getId(), status);
            return trip;
        }
        if (CAPTURABLE.contains(status)) {
            if (!decision.chargesFee()) {
                return releaseHold(trip);
            }
            Trip captured = capture(trip, "cancel-capture", false);
            return captured.getPaymentStatus() == PaymentStatus.CAPTURED ? refundRemainder(captured, decision) : captured;
        }
        if (CHARGEABLE.contains(status)) {
            if (!decision.chargesFee()) {
                return tripStore.conditionalUpdate(trip.getId(),
                                t -> CHARGEABLE.contains(t.getPaymentStatus()),
                                t -> t.setPaymentStatus(PaymentStatus.CANCELLED))
                        .orElseGet(() -> current(trip));
            }
            return charge(trip, decision.cancellationFee(), "cancel-fee", false);
        }
        if (REFUNDABLE.contains(status)) {
            return refundRemainder(trip, decision);
        }
        if (status == PaymentStatus.RELEASE_FAILED) {
            return releaseHold(trip);
        }
        log.debug("Nothing to settle for cancelled trip {} in payment status {}", trip.getId(), status);
        return trip;
    }

    /** Out-of-band retry for a trip left in a flagged payment status. */
    public Trip reconcile(Trip trip) {
        if (trip.getStatus() == TripStatus.CANCELLED) {
            return settleCancellation(trip, decisionOf(trip));
        }
        if (trip.getStatus() == TripStatus.EXPIRED) {
            return releaseHold(trip);
        }
        return captureOnCompletion(trip);
    }

    /**
     * Flags claims whose gateway call never recorded an outcome within the claim timeout, so that
     * reconciliation picks them up. The replay reuses the claim's idempotency key.
     */
    public int releaseAbandonedClaims() {
        Instant cutoff = clock.instant().minus(properties.getPayment().getClaimTimeout());
        List<Trip> abandoned = tripStore.find(TripQuery.builder()
                .paymentStatuses(PaymentStatus.inFlightStatuses())
                .paymentClaimedBefore(cutoff)
                .oldestFirst(true)
                .limit(CLAIM_SWEEP_BATCH)
                .build());
        int released = 0;
        for (Trip trip : abandoned) {
            PaymentStatus inFlight = trip.getPaymentStatus();
            Instant claimedAt = trip.getPaymentClaimedAt();
            Optional<Trip> flagged = tripStore.conditionalUpdate(trip.getId(),
                    t -> t.getPaymentStatus() == inFlight && Objects.equals(t.getPaymentClaimedAt(), claimedAt),
                    t -> {
                        t.setPaymentStatus(inFlight.failedCounterpart());
                        t.setPaymentClaimedAt(null);
                        t.setPaymentFailureReason("No outcome recorded for " + inFlight + " claimed at " + claimedAt);
                    });
            if (flagged.isPresent()) {
                released++;
                log.warn("Trip {} payment claim {} from {} abandoned, flagged {}",
                        trip.getId(), inFlight, claimedAt, flagged.get().getPaymentStatus());
            }
        }
        return released;
    }

    /**
     * Credits the driver for a completed trip. A ledger failure is logged and left to
     * {@link #creditOutstandingEarnings()}; it never fails the trip operation that triggered it.
     */
    public boolean creditDriverEarnings(Trip trip) {
        if (!trip.hasDriver() || trip.getStatus() != TripStatus.COMPLETED || trip.isEarningsCredited()) {
            return false;
        }
        BigDecimal fare = trip.getFinalCost() != null ? trip.getFinalCost() : trip.getLockedContribution();
        try {
            return earningsService.creditTrip(trip.getId(), trip.getDriverId(), fare, trip.getTip());
        } catch (DataAccessException | TransactionException e) {
            log.error("Crediting earnings for trip {} failed, left for the earnings catch-up", trip.getId(), e);
            return false;
        }
    }

    public boolean creditCancellationCompensation(Trip trip, CancellationDecision decision) {
        if (!trip.hasDriver() || decision.driverCompensation().signum() <= 0 || trip.isEarningsCredited()) {
            return false;
        }
        try {
            return earningsService.creditCancellationCompensation(trip.getId(), trip.getDriverId(), decision.driverCompensation());
        } catch (DataAccessException | TransactionException e) {
            log.error("Crediting cancellation compensation for trip {} failed, left for the earnings catch-up", trip.getId(), e);
            return false;
        }
    }

    /** Credits completed trips and owed compensations whose earlier credit attempt failed. */
    public int creditOutstandingEarnings() {
        int credited = 0;
        for (Trip trip : tripStore.find(TripQuery.builder()
                .statuses(EnumSet.of(TripStatus.COMPLETED))
                .earningsCredited(false)
                .oldestFirst(true)
                .limit(CLAIM_SWEEP_BATCH)
                .build())) {
            if (creditDriverEarnings(trip)) {
                credited++;
            }
        }
        for (Trip trip : tripStore.find(TripQuery.builder()
                .statuses(EnumSet.of(TripStatus.CANCELLED))
                .earningsCredited(false)
                .compensationDue(true)
                .oldestFirst(true)
                .limit(CLAIM_SWEEP_BATCH)
                .build())) {
            if (creditCancellationCompensation(trip, decisionOf(trip))) {
                credited++;
            }
        }
        return credited;
    }

    // --- gateway operations ---

    private Trip capture(Trip trip, String operation, boolean collecting) {
        if (!CAPTURABLE.contains(trip.getPaymentStatus()) || trip.getPaymentReference() == null) {
            return trip;
        }
        return run(trip, GatewayStep.builder()
                .operation(operation)
                .amount(trip.getLockedContribution())
                .from(CAPTURABLE)
                .inFlight(PaymentStatus.CAPTURING)
                .requiresReference(true)
                .collecting(collecting)
                .call(t -> gateway.capture(t.getPaymentReference(), key(t, operation)))
                .onSuccess((t, result) -> t.setPaymentStatus(PaymentStatus.CAPTURED))
                .failedStatus(PaymentStatus.CAPTURE_FAILED)
                .build());
    }

    private Trip charge(Trip trip, BigDecimal amount, String operation, boolean collecting) {
        if (!CHARGEABLE.contains(trip.getPaymentStatus())) {
            return trip;
        }
        return run(trip, GatewayStep.builder()
                .operation(operation)
                .amount(amount)
                .from(CHARGEABLE)
                .inFlight(PaymentStatus.CHARGING)
                .collecting(collecting)
                .call(t -> gateway.charge(customerOf(t), amount, currency(), key(t, operation)))
                .onSuccess((t, result) -> {
                    t.setPaymentStatus(PaymentStatus.CAPTURED);
                    t.setPaymentReference(result.reference());
                })
                .failedStatus(PaymentStatus.CHARGE_FAILED)
                .build());
    }

    private Trip refundRemainder(Trip trip, CancellationDecision decision) {
        BigDecimal refund = decision.refundAmount();
        if (refund.signum() <= 0 || !REFUNDABLE.contains(trip.getPaymentStatus())) {
            return trip;
        }
        PaymentStatus refunded = decision.chargesFee() ? PaymentStatus.PARTIALLY_REFUNDED : PaymentStatus.REFUNDED;
        return run(trip, GatewayStep.builder()
                .operation("refund")
                .amount(refund)
                .from(REFUNDABLE)
                .inFlight(PaymentStatus.REFUNDING)
                .requiresReference(true)
                .call(t -> gateway.refund(t.getPaymentReference(), refund, key(t, "refund")))
                .onSuccess((t, result) -> t.setPaymentStatus(refunded))
                .failedStatus(PaymentStatus.REFUND_FAILED)
                .build());
    }

    private Trip run(Trip trip, GatewayStep step) {
        Instant claimedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Optional<Trip> claimed = tripStore.conditionalUpdate(trip.getId(),
                t -> step.from.contains(step.statusOf(t))
                        && (!step.requiresReference || t.getPaymentReference() != null)
                        && (!step.collecting || !isClosed(t)),
                t -> step.claim(t, claimedAt));
        if (claimed.isEmpty()) {
            log.debug("Payment {} for trip {} not claimed, payment or trip status moved on", step.operation, trip.getId());
            return current(trip);
        }

        Trip owned = claimed.get();
        Predicate<Trip> stillOwned = t -> step.statusOf(t) == step.inFlight
                && (step.tip || Objects.equals(t.getPaymentClaimedAt(), claimedAt));
        RetryOutcome<GatewayResult> outcome = paymentRetry.execute(step.operation + " for trip " + trip.getId(),
                () -> step.call.apply(owned));

        Trip recorded;
        if (outcome.isSuccess()) {
            paymentMetrics.recordSuccess(step.operation, outcome.getAttempts());
            GatewayResult result = outcome.getValue();
            recorded = record(owned, step, stillOwned, t -> {
                step.onSuccess.accept(t, result);
                step.release(t);
            });
            publish(owned, step, result.reference(), result.status(), outcome, false);
            log.info("Payment {} for trip {} succeeded after {} attempt(s), ref={}",
                    step.operation, trip.getId(), outcome.getAttempts(), result.reference());
        } else {
            paymentMetrics.recordExhausted(step.operation, outcome.getAttempts());
            String reason = outcome.failureReason();
            recorded = record(owned, step, stillOwned, t -> {
                step.fail(t, reason);
                step.release(t);
            });
            publish(owned, step, owned.getPaymentReference(), "failed", outcome, true);
            log.warn("Payment {} for trip {} flagged for reconciliation: {}", step.operation, trip.getId(), reason);
        }

        if (step.collecting && isClosed(recorded)) {
            log.info("Trip {} closed as {} while {} was in flight, settling now", trip.getId(), recorded.getStatus(), step.operation);
            return recorded.getStatus() == TripStatus.CANCELLED
                    ? settleCancellation(recorded, decisionOf(recorded))
                    : releaseHold(recorded);
        }
        return recorded;
    }

    private Trip record(Trip owned, GatewayStep step, Predicate<Trip> stillOwned, Consumer<Trip> outcome) {
        Optional<Trip> recorded = tripStore.conditionalUpdate(owned.getId(), stillOwned, outcome);
        if (recorded.isPresent()) {
            return recorded.get();
        }
        // Only the abandoned-claim sweep takes a claim away, and it leaves the trip flagged.
        log.error("Payment {} outcome for trip {} not recorded: claim was flagged as abandoned, reconciliation replays it",
                step.operation, owned.getId());
        return current(owned);
    }

    private void publish(Trip trip, GatewayStep step, String reference, String status,
                         RetryOutcome<GatewayResult> outcome, boolean failed) {
        eventPublisher.payment(PaymentEvent.builder()
                .tripId(trip.getId().toString())
                .riderId(trip.getRiderId())
                .driverId(trip.getDriverId())
                .operation(step.operation)
                .amount(step.amount)
                .currency(currency())
                .paymentReference(reference)
                .status(status)
                .attempts(outcome.getAttempts())
                .failureReason(outcome.failureReason())
                .eventTime(clock.instant())
                .build(), failed);
    }

    private Trip current(Trip trip) {
        return tripStore.get(trip.getId()).orElse(trip);
    }

    private static boolean isClosed(Trip trip) {
        return trip.getStatus() == TripStatus.CANCELLED || trip.getStatus() == TripStatus.EXPIRED;
    }

    private static CancellationDecision decisionOf(Trip trip) {
        BigDecimal fee = trip.getCancellationFee() != null ? trip.getCancellationFee() : BigDecimal.ZERO;
        BigDecimal refund = trip.getRefundAmount() != null ? trip.getRefundAmount() : BigDecimal.ZERO;
        BigDecimal compensation = trip.getDriverCompensation() != null ? trip.getDriverCompensation() : BigDecimal.ZERO;
        return new CancellationDecision(fee, refund, compensation, "RECONCILIATION");
    }

    private static String customerOf(Trip trip) {
        return trip.getPaymentMethodId() != null ? trip.getPaymentMethodId() : trip.getRiderId();
    }

    private static String key(Trip trip, String operation) {
        return trip.getId() + ":" + operation;
    }

    private String currency() {
        return properties.getCurrency();
    }

    /**
     * One claimed gateway call. {@code collecting} steps take money for a live trip and are never
     * claimed once the trip is cancelled or expired. Tip steps work on {@code tipPaymentStatus},
     * where a null status counts as not yet charged.
     */
    @Builder
    private static final class GatewayStep {
        private final String operation;
        private final BigDecimal amount;
        private final boolean tip;
        private final Set<PaymentStatus> from;
        private final PaymentStatus inFlight;
        private final boolean requiresReference;
        private final boolean collecting;
        private final Function<Trip, GatewayResult> call;
        private final BiConsumer<Trip, GatewayResult> onSuccess;
        private final PaymentStatus failedStatus;

        PaymentStatus statusOf(Trip trip) {
            if (tip) {
                return trip.getTipPaymentStatus() == null ? PaymentStatus.PENDING : trip.getTipPaymentStatus();
            }
            return trip.getPaymentStatus();
        }

        void claim(Trip trip, Instant claimedAt) {
            if (tip) {
                trip.setTipPaymentStatus(inFlight);
            } else {
                trip.setPaymentStatus(inFlight);
                trip.setPaymentClaimedAt(claimedAt);
            }
        }

        void fail(Trip trip, String reason) {
            if (tip) {
                trip.setTipPaymentStatus(failedStatus);
            } else {
                trip.setPaymentStatus(failedStatus);
                trip.setPaymentFailureReason(reason);
            }
        }

        void release(Trip trip) {
            if (!tip) {
                trip.setPaymentClaimedAt(null);
            }
        }
    }
}
