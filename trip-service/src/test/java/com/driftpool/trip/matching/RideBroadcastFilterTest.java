package com.driftpool.trip.matching;

import com.driftpool.shared.enums.PaymentFlow;
import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.shared.enums.TripStatus;
import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.entity.GeoLocation;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.model.GeoPoint;
import com.driftpool.trip.store.InMemoryTripStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class RideBroadcastFilterTest {

    private static final Instant NOW = Instant.parse("2024-03-12T17:00:00Z");
    private static final String DRIVER = "driver-1";
    private static final GeoPoint DRIVER_AT = new GeoPoint(19.34, -81.40);

    // ~0.75 km, ~2.4 km and ~14 km from the driver
    private static final GeoLocation NEAR = new GeoLocation(19.345, -81.395, "Seven Mile Beach");
    private static final GeoLocation CLOSE = new GeoLocation(19.36, -81.39, "West Bay Road");
    private static final GeoLocation FAR = new GeoLocation(19.285, -81.28, "Bodden Town");

    @Mock private BlockListCache blockListCache;

    private InMemoryTripStore tripStore;
    private RideBroadcastFilter filter;

    @BeforeEach
    void setUp() {
        tripStore = new InMemoryTripStore();
        filter = new RideBroadcastFilter(tripStore, blockListCache, new TripEngineProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(blockListCache.blockedFor(DRIVER)).thenReturn(Set.of());
    }

    private static Trip open(GeoLocation pickup) {
        return Trip.builder()
                .id(UUID.randomUUID())
                .riderId("rider-" + pickup.getAddress())
                .status(TripStatus.REQUESTED)
                .pickup(pickup)
                .paymentFlow(PaymentFlow.VERIFICATION)
                .paymentStatus(PaymentStatus.VERIFIED)
                .lockedContribution(new BigDecimal("20.00"))
                .requestedAt(NOW.minusSeconds(30))
                .build();
    }

    @Test
    @DisplayName("Visible requests are sorted nearest first with a pickup estimate")
    void sortedByDistance() {
        Trip close = open(CLOSE);
        Trip near = open(NEAR);

        List<RideCandidate> visible = filter.filter(List.of(close, near), DRIVER, DRIVER_AT, NOW);

        assertThat(visible).extracting(RideCandidate::getTrip).containsExactly(near, close);
        assertThat(visible.get(0).getDistanceFromDriverKm()).isLessThan(1.0);
        // 2.4 km at 30 km/h
        assertThat(visible.get(1).getEstimatedPickupMinutes()).isEqualTo(5);
    }

    @Test
    @DisplayName("Declined requests are hidden from that driver only")
    void declinedHidden() {
        Trip trip = open(NEAR);
        trip.recordDecline(DRIVER);

        assertThat(filter.filter(List.of(trip), DRIVER, DRIVER_AT, NOW)).isEmpty();
        assertThat(filter.filter(List.of(trip), "driver-2", DRIVER_AT, NOW)).hasSize(1);
    }

    @Test
    @DisplayName("Requests from blocked riders are hidden")
    void blockedRiderHidden() {
        Trip trip = open(NEAR);
        lenient().when(blockListCache.blockedFor(DRIVER)).thenReturn(Set.of(trip.getRiderId()));

        assertThat(filter.filter(List.of(trip), DRIVER, DRIVER_AT, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Assigned, non-REQUESTED and undisplayable-payment requests are hidden")
    void unavailableHidden() {
        Trip assigned = open(NEAR);
        assigned.assignDriver("driver-9", null);
        Trip cancelled = open(NEAR);
        cancelled.transitionTo(TripStatus.CANCELLED);
        Trip failedHold = open(NEAR);
        failedHold.setPaymentStatus(PaymentStatus.AUTHORIZATION_FAILED);

        assertThat(filter.filter(List.of(assigned, cancelled, failedHold), DRIVER, DRIVER_AT, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Requests older than five minutes are hidden")
    void staleHidden() {
        Trip fresh = open(NEAR);
        fresh.setRequestedAt(NOW.minus(Duration.ofMinutes(5)));
        Trip stale = open(NEAR);
        stale.setRequestedAt(NOW.minus(Duration.ofMinutes(5)).minusSeconds(1));

        assertThat(filter.filter(List.of(fresh, stale), DRIVER, DRIVER_AT, NOW))
                .extracting(RideCandidate::getTrip).containsExactly(fresh);
    }

    @Test
    @DisplayName("Radius is the larger of the default and the trip's own radius")
    void radiusUsesLargerValue() {
        Trip far = open(FAR);
        assertThat(filter.filter(List.of(far), DRIVER, DRIVER_AT, NOW)).isEmpty();

        far.setSearchRadiusKm(20.0);
        assertThat(filter.filter(List.of(far), DRIVER, DRIVER_AT, NOW)).hasSize(1);

        Trip narrow = open(CLOSE);
        narrow.setSearchRadiusKm(1.0);
        assertThat(filter.radiusFor(narrow)).isEqualTo(10.0);
        assertThat(filter.filter(List.of(narrow), DRIVER, DRIVER_AT, NOW)).hasSize(1);
    }

    @Test
    @DisplayName("No driver location means nothing is shown")
    void noLocation() {
        assertThat(filter.filter(List.of(open(NEAR)), DRIVER, null, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Live view re-emits when a new request is created")
    void watchReactsToNewRequests() {
        tripStore.create(open(NEAR));

        StepVerifier.create(filter.watch(DRIVER, Flux.just(DRIVER_AT).concatWith(Flux.never())))
                .expectNextMatches(candidates -> candidates.size() == 1)
                .then(() -> tripStore.create(open(CLOSE)))
                .expectNextMatches(candidates -> candidates.size() == 2)
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }
}
