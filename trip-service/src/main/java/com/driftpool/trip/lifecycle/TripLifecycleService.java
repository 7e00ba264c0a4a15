package com.driftpool.trip.lifecycle;

import com.driftpool.shared.context.ActorContext;
import com.driftpool.shared.enums.ActorRole;
import com.driftpool.shared.enums.PaymentFlow;
import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.shared.enums.TripStatus;
import com.driftpool.shared.util.GeoUtil;
import com.driftpool.trip.cancellation.CancellationAdjudicator;
import com.driftpool.trip.cancellation.CancellationDecision;
import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.entity.DriverSnapshot;
import com.driftpool.trip.entity.GeoLocation;
import com.driftpool.trip.entity.PricingResult;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.exception.AlreadyAcceptedException;
import com.driftpool.trip.exception.InvalidTripStateException;
import com.driftpool.trip.exception.TripAccessDeniedException;
import com.driftpool.trip.exception.TripNotFoundException;
import com.driftpool.trip.exception.TripValidationException;
import com.driftpool.trip.matching.BlockListCache;
import com.driftpool.trip.metrics.TripMetrics;
import com.driftpool.trip.model.CancellationRequest;
import com.driftpool.trip.model.CompletionReport;
import com.driftpool.trip.model.GeoPoint;
import com.driftpool.trip.model.TripRequest;
import com.driftpool.trip.payment.PaymentOrchestrator;
import com.driftpool.trip.pricing.TripPricingService;
import com.driftpool.trip.scheduler.StaleTripReaper;
import com.driftpool.trip.store.TripQuery;
import com.driftpool.trip.store.TripStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Owns every trip status change.
 *
 * Each write is a {@link TripStore#conditionalUpdate} whose precondition restates what the caller
 * observed, so of two racing writers exactly one commits and the other gets a conflict without
 * anything being written. Payment work runs after the winning write and outside it.
 *
 * Flows:
 *   accept (payment flow NONE)           REQUESTED -> ACCEPTED, rider pays, -> DRIVER_ARRIVING
 *   accept (verification / hold)         REQUESTED -> DRIVER_ARRIVING, locked amount collected
 *   arrive, start, complete              -> DRIVER_ARRIVED -> IN_PROGRESS -> AWAITING_TIP
 *   tip, skip, tip window lapses         AWAITING_TIP -> COMPLETED, driver credited once
 */
@Slf4j
@Service
public class TripLifecycleService {

    private final TripStore tripStore;
    private final TripPricingService pricingService;
    private final CancellationAdjudicator adjudicator;
    private final PaymentOrchestrator paymentOrchestrator;
    private final StaleTripReaper staleTripReaper;
    private final BlockListCache blockListCache;
    private final RouteSampler routeSampler;
    private final TripEventPublisher eventPublisher;
    private final TripMetrics metrics;
    private final TripEngineProperties properties;
    private final Clock clock;

    public TripLifecycleService(TripStore tripStore,
                                TripPricingService pricingService,
                                CancellationAdjudicator adjudicator,
                                PaymentOrchestrator paymentOrchestrator,
                                StaleTripReaper staleTripReaper,
                                BlockListCache blockListCache,
                                RouteSampler routeSampler,
                                TripEventPublisher eventPublisher,
                                TripMetrics metrics,
                                TripEngineProperties properties,
                                Clock clock) {
        this.tripStore = tripStore;
        this.pricingService = pricingService;
        this.adjudicator = adjudicator;
        this.paymentOrchestrator = paymentOrchestrator;
        this.staleTripReaper = staleTripReaper;
        this.blockListCache = blockListCache;
        this.routeSampler = routeSampler;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    // --- request ---

    /** Opens a new request. The rider's own requests past the request window are expired first. */
    public Trip requestTrip(ActorContext rider, TripRequest req) {
        requireRole(rider, ActorRole.RIDER);
        validate(req);
        staleTripReaper.expireStaleTripsForRider(rider.userId());

        GeoPoint pickup = new GeoPoint(req.getPickupLat(), req.getPickupLng());
        GeoPoint destination = new GeoPoint(req.getDestinationLat(), req.getDestinationLng());
        Instant now = clock.instant();

        PricingResult pricing;
        try {
            pricing = pricingService.quote(pickup, destination, req.getDistanceMiles(), req.getDurationMinutes(), now);
        } catch (RuntimeException e) {
            metrics.recordTripRejected();
            throw e;
        }
        BigDecimal contribution = chooseContribution(req.getContribution(), pricing);

        PaymentFlow flow = req.getPaymentFlow() != null ? req.getPaymentFlow() : PaymentFlow.VERIFICATION;
        Trip trip = Trip.builder()
                .tenantId(rider.tenantId())
                .riderId(rider.userId())
                .pickup(GeoLocation.builder()
                        .latitude(pickup.latitude()).longitude(pickup.longitude())
                        .address(req.getPickupAddress()).build())
                .destination(GeoLocation.builder()
                        .latitude(destination.latitude()).longitude(destination.longitude())
                        .address(req.getDestinationAddress()).build())
                .stops(req.getStops() != null ? new ArrayList<>(req.getStops()) : new ArrayList<>())
                .routeDistanceMiles(req.getDistanceMiles())
                .routeDurationMinutes(req.getDurationMinutes())
                .pricing(pricing)
                .vehicleType(req.getVehicleType())
                .currency(properties.getCurrency())
                .paymentFlow(flow)
                .paymentStatus(flow == PaymentFlow.VERIFICATION ? PaymentStatus.VERIFIED : PaymentStatus.PENDING)
                .paymentMethodId(req.getPaymentMethodId())
                .searchRadiusKm(req.getSearchRadiusKm() != null
                        ? Math.min(req.getSearchRadiusKm(), properties.getMatching().getMaxRadiusKm())
                        : properties.getMatching().getDefaultRadiusKm())
                .requestedAt(now)
                .build();
        trip.lockContribution(contribution);
        trip.transitionTo(TripStatus.REQUESTED);

        Trip created = tripStore.create(trip);
        metrics.recordTripCreated();
        eventPublisher.statusChanged(created, null, "requested");
        log.info("Trip {} requested by rider {}: {} locked at {}",
                created.getId(), rider.userId(), pricing.getDisplayText(), created.getLockedContribution());

        if (flow == PaymentFlow.AUTHORIZATION_HOLD) {
            return paymentOrchestrator.authorizeHold(created);
        }
        return created;
    }

    /** Refreshes the quote after a route change. The locked contribution is left as it was. */
    public Trip repriceTrip(ActorContext rider, UUID tripId, double distanceMiles, double durationMinutes) {
        if (distanceMiles < 0 || durationMinutes < 0) {
            throw new TripValidationException("Distance and duration must be non-negative");
        }
        Trip current = load(tripId);
        requireRider(rider, current);
        requireStatus(current, TripStatus.REQUESTED);

        PricingResult pricing = pricingService.quote(current.getPickup().toPoint(), current.getDestination().toPoint(),
                distanceMiles, durationMinutes, clock.instant());
        Trip repriced = tripStore.conditionalUpdate(tripId,
                        t -> t.getStatus() == TripStatus.REQUESTED,
                        t -> {
                            t.setPricing(pricing);
                            t.setRouteDistanceMiles(distanceMiles);
                            t.setRouteDurationMinutes(durationMinutes);
                        })
                .orElseThrow(() -> InvalidTripStateException.stateChanged(tripId));
        log.debug("Trip {} repriced to {} (locked {})", tripId, pricing.getSuggestedContribution(), repriced.getLockedContribution());
        return repriced;
    }

    // --- matching ---

    public Trip acceptTrip(ActorContext driver, UUID tripId, DriverSnapshot snapshot) {
        requireRole(driver, ActorRole.DRIVER);
        String driverId = driver.userId();
        Trip current = load(tripId);

        if (current.getDeclinedBy().contains(driverId)) {
            throw new InvalidTripStateException("Driver " + driverId + " declined trip " + tripId);
        }
        if (blockListCache.isBlocked(driverId, current.getRiderId())) {
            throw new TripAccessDeniedException("Driver " + driverId + " cannot be matched with this rider");
        }
        if (current.getStatus() != TripStatus.REQUESTED || current.hasDriver()) {
            metrics.recordAcceptConflict();
            throw new AlreadyAcceptedException(tripId);
        }

        TripStatus next = current.getPaymentFlow() == PaymentFlow.NONE ? TripStatus.ACCEPTED : TripStatus.DRIVER_ARRIVING;
        Instant now = clock.instant();
        Optional<Trip> won = tripStore.conditionalUpdate(tripId,
                t -> t.getStatus() == TripStatus.REQUESTED
                        && !t.hasDriver()
                        && !t.getDeclinedBy().contains(driverId)
                        && t.getPaymentStatus().isDisplayableToDrivers(),
                t -> {
                    t.assignDriver(driverId, snapshot);
                    t.transitionTo(next);
                    t.setAcceptedAt(now);
                });
        if (won.isEmpty()) {
            metrics.recordAcceptConflict();
            log.info("Driver {} lost the race for trip {}", driverId, tripId);
            throw new AlreadyAcceptedException(tripId);
        }

        Trip accepted = won.get();
        metrics.recordAcceptWon();
        eventPublisher.statusChanged(accepted, TripStatus.REQUESTED, "accepted");
        log.info("Trip {} accepted by driver {} -> {}", tripId, driverId, next);

        if (accepted.getPaymentFlow() != PaymentFlow.NONE) {
            return paymentOrchestrator.settleOnAccept(accepted);
        }
        return accepted;
    }

    /** Rider pays for a trip whose driver accepted in waiting-for-payment mode. */
    public Trip confirmPayment(ActorContext rider, UUID tripId) {
        Trip current = load(tripId);
        requireRider(rider, current);
        requireStatus(current, TripStatus.ACCEPTED);

        Trip confirmed = tripStore.conditionalUpdate(tripId,
                        t -> t.getStatus() == TripStatus.ACCEPTED,
                        t -> t.transitionTo(TripStatus.DRIVER_ARRIVING))
                .orElseThrow(() -> InvalidTripStateException.stateChanged(tripId));
        eventPublisher.statusChanged(confirmed, TripStatus.ACCEPTED, "payment confirmed");
        log.info("Rider {} confirmed payment for trip {}", rider.userId(), tripId);
        return paymentOrchestrator.chargeOnPaymentConfirmation(confirmed);
    }

    public Trip declineTrip(ActorContext driver, UUID tripId) {
        requireRole(driver, ActorRole.DRIVER);
        String driverId = driver.userId();
        Trip current = load(tripId);
        if (current.getDeclinedBy().contains(driverId)) {
            return current;
        }
        requireStatus(current, TripStatus.REQUESTED);

        Trip declined = tripStore.conditionalUpdate(tripId,
                        t -> t.getStatus() == TripStatus.REQUESTED && !t.hasDriver(),
                        t -> t.recordDecline(driverId))
                .orElseThrow(() -> InvalidTripStateException.stateChanged(tripId));
        metrics.recordDecline();
        log.info("Driver {} declined trip {}", driverId, tripId);
        return declined;
    }

    /**
     * Puts an unanswered request back in front of drivers: fresh {@code requestedAt}, optional wider
     * radius (capped at the configured maximum). Drivers who declined still do not see it.
     */
    public Trip resendTrip(ActorContext rider, UUID tripId, Double widenRadiusKm) {
        if (widenRadiusKm != null && widenRadiusKm <= 0) {
            throw new TripValidationException("Search radius must be positive");
        }
        Trip current = load(tripId);
        requireRider(rider, current);
        requireStatus(current, TripStatus.REQUESTED);

        double maxRadius = properties.getMatching().getMaxRadiusKm();
        Instant now = clock.instant();
        Trip resent = tripStore.conditionalUpdate(tripId,
                        t -> t.getStatus() == TripStatus.REQUESTED && !t.hasDriver(),
                        t -> {
                            t.setRequestedAt(now);
                            t.setResendCount(t.getResendCount() + 1);
                            if (widenRadiusKm != null) {
                                double currentRadius = t.getSearchRadiusKm() != null ? t.getSearchRadiusKm() : 0.0;
                                t.setSearchRadiusKm(Math.min(maxRadius, Math.max(currentRadius, widenRadiusKm)));
                            }
                        })
                .orElseThrow(() -> InvalidTripStateException.stateChanged(tripId));
        metrics.recordResend();
        eventPublisher.statusChanged(resent, TripStatus.REQUESTED, "resent");
        log.info("Trip {} resent (#{}) radius {}km", tripId, resent.getResendCount(), resent.getSearchRadiusKm());
        return resent;
    }

    // --- driver progress ---

    public Trip markDriverArrived(ActorContext driver, UUID tripId) {
        Instant now = clock.instant();
        return advance(driver, tripId, TripStatus.DRIVER_ARRIVING, TripStatus.DRIVER_ARRIVED,
                t -> t.setArrivedAt(now), "driver arrived");
    }

    public Trip startTrip(ActorContext driver, UUID tripId) {
        Instant now = clock.instant();
        return advance(driver, tripId, TripStatus.DRIVER_ARRIVED, TripStatus.IN_PROGRESS,
                t -> t.setStartedAt(now), "trip started");
    }

    public Trip completeTrip(ActorContext driver, UUID tripId, CompletionReport report) {
        CompletionReport safeReport = report != null ? report : CompletionReport.builder().build();
        if (safeReport.getFinalCost() != null && safeReport.getFinalCost().signum() < 0) {
            throw new TripValidationException("Final cost must be non-negative");
        }
        Instant now = clock.instant();
        String routeJson = routeSampler.toJson(safeReport.getRouteTraveled());

        Trip completed = advance(driver, tripId, TripStatus.IN_PROGRESS, TripStatus.AWAITING_TIP, t -> {
            BigDecimal finalCost = safeReport.getFinalCost() != null ? safeReport.getFinalCost() : t.getLockedContribution();
            t.setFinalCost(finalCost.setScale(2, RoundingMode.HALF_UP));
            t.setActualDistanceMiles(safeReport.getActualDistanceMiles());
            t.setActualDurationMinutes(safeReport.getActualDurationMinutes());
            if (safeReport.getFinalLat() != null && safeReport.getFinalLng() != null) {
                t.setFinalLocation(GeoLocation.builder()
                        .latitude(safeReport.getFinalLat())
                        .longitude(safeReport.getFinalLng())
                        .address(safeReport.getFinalAddress())
                        .build());
            }
            t.setRouteTraveledJson(routeJson);
            t.setCompletedAt(now);
            t.setRatingDeadline(now.plus(properties.getLifecycle().getTipWindow()));
        }, "dropped off");

        return paymentOrchestrator.captureOnCompletion(completed);
    }

    // --- tip window ---

    public Trip addTip(ActorContext rider, UUID tripId, BigDecimal tip) {
        if (tip == null || tip.signum() < 0) {
            throw new TripValidationException("Tip must be zero or more");
        }
        Trip current = load(tripId);
        requireRider(rider, current);
        requireStatus(current, TripStatus.AWAITING_TIP);
        return finalizeTrip(tripId, tip, "tip added")
                .orElseThrow(() -> InvalidTripStateException.stateChanged(tripId));
    }

    public Trip skipTip(ActorContext rider, UUID tripId) {
        Trip current = load(tripId);
        requireRider(rider, current);
        requireStatus(current, TripStatus.AWAITING_TIP);
        return finalizeTrip(tripId, BigDecimal.ZERO, "tip skipped")
                .orElseThrow(() -> InvalidTripStateException.stateChanged(tripId));
    }

    /** Completes every trip whose tip window has lapsed. Safe to run concurrently. */
    public int finalizeExpiredTipWindows() {
        List<Trip> lapsed = tripStore.find(TripQuery.builder()
                .statuses(Set.of(TripStatus.AWAITING_TIP))
                .ratingDeadlineBefore(clock.instant())
                .oldestFirst(true)
                .build());
        int finalized = 0;
        for (Trip trip : lapsed) {
            if (finalizeTrip(trip.getId(), BigDecimal.ZERO, "tip window closed").isPresent()) {
                finalized++;
            }
        }
        if (finalized > 0) {
            log.info("Finalized {} trip(s) with lapsed tip windows", finalized);
        }
        return finalized;
    }

    private Optional<Trip> finalizeTrip(UUID tripId, BigDecimal tip, String reason) {
        BigDecimal scaledTip = tip.setScale(2, RoundingMode.HALF_UP);
        Instant now = clock.instant();
        Optional<Trip> won = tripStore.conditionalUpdate(tripId,
                t -> t.getStatus() == TripStatus.AWAITING_TIP,
                t -> {
                    BigDecimal finalCost = t.getFinalCost() != null ? t.getFinalCost() : t.getLockedContribution();
                    t.setTip(scaledTip);
                    t.setTotalWithTip(finalCost.add(scaledTip));
                    t.setFinalizedAt(now);
                    t.transitionTo(TripStatus.COMPLETED);
                });
        if (won.isEmpty()) {
            log.debug("Trip {} already finalized", tripId);
            return won;
        }

        Trip completed = won.get();
        metrics.recordCompleted();
        eventPublisher.statusChanged(completed, TripStatus.AWAITING_TIP, reason);
        log.info("Trip {} completed ({}), tip {}", tripId, reason, scaledTip);

        Trip settled = paymentOrchestrator.chargeTip(completed);
        paymentOrchestrator.creditDriverEarnings(settled);
        return Optional.of(settled);
    }

    // --- cancellation ---

    public Trip cancelTrip(ActorContext actor, UUID tripId, CancellationRequest request) {
        if (request == null || request.getReasonType() == null) {
            throw new TripValidationException("A cancellation reason is required");
        }
        Trip current = load(tripId);
        if (actor.isRider()) {
            requireRider(actor, current);
        } else {
            requireAssignedDriver(actor, current);
        }
        TripStatus observed = current.getStatus();
        if (!observed.isCancellable()) {
            throw new InvalidTripStateException("Trip " + tripId + " cannot be cancelled in status " + observed);
        }

        CancellationDecision decision = adjudicator.adjudicate(actor.role(), observed,
                request.getReasonType(), current.getLockedContribution());
        String observedDriver = current.getDriverId();
        Instant now = clock.instant();

        Trip cancelled = tripStore.conditionalUpdate(tripId,
                        t -> t.getStatus() == observed && sameDriver(t, observedDriver),
                        t -> {
                            t.transitionTo(TripStatus.CANCELLED);
                            t.setCancelledAt(now);
                            t.setCancelledBy(actor.role());
                            t.setCancellationReasonType(request.getReasonType());
                            t.setCancellationReason(request.getReason());
                            t.setCancellationFee(decision.cancellationFee());
                            t.setRefundAmount(decision.refundAmount());
                            t.setDriverCompensation(decision.driverCompensation());
                        })
                .orElseThrow(() -> InvalidTripStateException.stateChanged(tripId));

        metrics.recordCancelled();
        eventPublisher.statusChanged(cancelled, observed, decision.rule());
        log.info("Trip {} cancelled by {} {} in {} ({}): fee={} refund={} compensation={}",
                tripId, actor.role(), actor.userId(), observed, decision.rule(),
                decision.cancellationFee(), decision.refundAmount(), decision.driverCompensation());

        Trip settled = paymentOrchestrator.settleCancellation(cancelled, decision);
        paymentOrchestrator.creditCancellationCompensation(settled, decision);
        return settled;
    }

    // --- reads ---

    public Trip getTrip(ActorContext actor, UUID tripId) {
        Trip trip = load(tripId);
        requireVisible(actor, trip);
        return trip;
    }

    /** Current state, then every change, until the trip reaches a terminal status. */
    public Flux<Trip> watchTrip(ActorContext actor, UUID tripId) {
        requireVisible(actor, load(tripId));
        return tripStore.watch(tripId);
    }

    public List<Trip> riderTrips(ActorContext rider, int limit) {
        requireRole(rider, ActorRole.RIDER);
        return tripStore.find(TripQuery.builder().riderId(rider.userId()).limit(limit).build());
    }

    // --- helpers ---

    private Trip advance(ActorContext driver, UUID tripId, TripStatus from, TripStatus to,
                         Consumer<Trip> stamp, String reason) {
        Trip current = load(tripId);
        requireAssignedDriver(driver, current);
        requireStatus(current, from);

        String driverId = driver.userId();
        Trip advanced = tripStore.conditionalUpdate(tripId,
                        t -> t.getStatus() == from && t.isAssignedTo(driverId),
                        t -> {
                            t.transitionTo(to);
                            stamp.accept(t);
                        })
                .orElseThrow(() -> InvalidTripStateException.stateChanged(tripId));
        eventPublisher.statusChanged(advanced, from, reason);
        log.info("Trip {} {} -> {} ({})", tripId, from, to, reason);
        return advanced;
    }

    private BigDecimal chooseContribution(BigDecimal requested, PricingResult pricing) {
        if (requested == null) {
            return pricing.getSuggestedContribution();
        }
        BigDecimal amount = requested.setScale(2, RoundingMode.HALF_UP);
        if (amount.compareTo(pricing.getMinContribution()) < 0 || amount.compareTo(pricing.getMaxContribution()) > 0) {
            metrics.recordTripRejected();
            throw new TripValidationException("Contribution " + amount + " must be between "
                    + pricing.getMinContribution() + " and " + pricing.getMaxContribution());
        }
        return amount;
    }

    private void validate(TripRequest req) {
        if (req == null) {
            throw new TripValidationException("Trip request is required");
        }
        if (req.getPickupLat() == null || req.getPickupLng() == null
                || !GeoUtil.isValidCoordinate(req.getPickupLat(), req.getPickupLng())) {
            throw new TripValidationException("A valid pickup location is required");
        }
        if (req.getDestinationLat() == null || req.getDestinationLng() == null
                || !GeoUtil.isValidCoordinate(req.getDestinationLat(), req.getDestinationLng())) {
            throw new TripValidationException("A valid destination is required");
        }
        if (req.getDistanceMiles() == null || req.getDistanceMiles() < 0
                || req.getDurationMinutes() == null || req.getDurationMinutes() < 0) {
            throw new TripValidationException("Route distance and duration must be non-negative");
        }
        if (req.getStops() != null && req.getStops().size() > Trip.MAX_STOPS) {
            throw new TripValidationException("At most " + Trip.MAX_STOPS + " stops are allowed");
        }
        if (req.getContribution() != null && req.getContribution().signum() <= 0) {
            throw new TripValidationException("Contribution must be positive");
        }
    }

    private Trip load(UUID tripId) {
        return tripStore.get(tripId).orElseThrow(() -> new TripNotFoundException(tripId));
    }

    private static boolean sameDriver(Trip trip, String driverId) {
        return driverId == null ? !trip.hasDriver() : trip.isAssignedTo(driverId);
    }

    private static void requireStatus(Trip trip, TripStatus expected) {
        if (trip.getStatus() != expected) {
            throw new InvalidTripStateException("Trip " + trip.getId() + " is " + trip.getStatus() + ", expected " + expected);
        }
    }

    private static void requireRole(ActorContext actor, ActorRole role) {
        if (actor.role() != role) {
            throw new TripAccessDeniedException("Only a " + role.name().toLowerCase() + " can do this");
        }
    }

    private static void requireRider(ActorContext actor, Trip trip) {
        if (!actor.isRider() || !actor.userId().equals(trip.getRiderId())) {
            throw new TripAccessDeniedException("Trip " + trip.getId() + " belongs to another rider");
        }
    }

    private static void requireAssignedDriver(ActorContext actor, Trip trip) {
        if (!actor.isDriver() || !trip.isAssignedTo(actor.userId())) {
            throw new TripAccessDeniedException("Driver " + actor.userId() + " is not assigned to trip " + trip.getId());
        }
    }

    private static void requireVisible(ActorContext actor, Trip trip) {
        boolean visible = actor.isRider()
                ? actor.userId().equals(trip.getRiderId())
                : trip.isAssignedTo(actor.userId()) || (!trip.hasDriver() && trip.getStatus() == TripStatus.REQUESTED);
        if (!visible) {
            throw new TripAccessDeniedException("Trip " + trip.getId() + " is not visible to " + actor.userId());
        }
    }
}
