package com.driftpool.trip.matching;

import com.driftpool.shared.enums.TripStatus;
import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.model.GeoPoint;
import com.driftpool.trip.store.TripQuery;
import com.driftpool.trip.store.TripStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Decides which open ride requests a driver is shown.
 *
 * A request is hidden when the driver declined it, either party blocked the other, it already has a
 * driver or left REQUESTED, its payment is not in a displayable state, it is older than the
 * staleness window, or its pickup is outside the search radius. The radius is the larger of the
 * configured default and the trip's own (possibly widened) radius.
 */
@Slf4j
@Component
public class RideBroadcastFilter {

    private final TripStore tripStore;
    private final BlockListCache blockListCache;
    private final TripEngineProperties.Matching matching;
    private final Clock clock;

    public RideBroadcastFilter(TripStore tripStore,
                               BlockListCache blockListCache,
                               TripEngineProperties properties,
                               Clock clock) {
        this.tripStore = tripStore;
        this.blockListCache = blockListCache;
        this.matching = properties.getMatching();
        this.clock = clock;
    }

    public List<RideCandidate> filter(Collection<Trip> openTrips, String driverId, GeoPoint driverLocation, Instant now) {
        if (driverLocation == null) {
            return List.of();
        }
        Set<String> blocked = blockListCache.blockedFor(driverId);
        Instant staleBefore = now.minus(matching.getStalenessWindow());

        List<RideCandidate> visible = new ArrayList<>();
        for (Trip trip : openTrips) {
            if (trip.getDeclinedBy().contains(driverId)) continue;
            if (blocked.contains(trip.getRiderId())) continue;
            if (trip.hasDriver() || trip.getStatus() != TripStatus.REQUESTED) continue;
            if (trip.getPaymentStatus() == null || !trip.getPaymentStatus().isDisplayableToDrivers()) continue;
            if (trip.getRequestedAt() == null || trip.getRequestedAt().isBefore(staleBefore)) continue;
            if (trip.getPickup() == null || !trip.getPickup().hasCoordinates()) continue;

            double distanceKm = driverLocation.distanceKmTo(trip.getPickup().toPoint());
            if (distanceKm > radiusFor(trip)) continue;

            visible.add(RideCandidate.builder()
                    .trip(trip)
                    .distanceFromDriverKm(distanceKm)
                    .estimatedPickupMinutes(estimatedPickupMinutes(distanceKm))
                    .build());
        }
        visible.sort(Comparator.comparingDouble(RideCandidate::getDistanceFromDriverKm));
        log.debug("Driver {} sees {} of {} open request(s)", driverId, visible.size(), openTrips.size());
        return visible;
    }

    /**
     * Live view for one driver, recomputed whenever the open requests change, the driver moves, or
     * the refresh tick fires. Emits nothing until the driver's first location is known.
     */
    @SuppressWarnings("unchecked")
    public Flux<List<RideCandidate>> watch(String driverId, Flux<GeoPoint> driverLocations) {
        Flux<List<Trip>> openRequests = tripStore.subscribe(TripQuery.openRequests(matching.getOpenRequestLimit()));
        Flux<Long> ticks = Flux.interval(Duration.ZERO, matching.getRefreshInterval());
        return Flux.<Object, List<RideCandidate>>combineLatest(
                        latest -> filter((List<Trip>) latest[0], driverId, (GeoPoint) latest[1], clock.instant()),
                        openRequests, driverLocations, ticks)
                .distinctUntilChanged();
    }

    double radiusFor(Trip trip) {
        Double tripRadius = trip.getSearchRadiusKm();
        return tripRadius == null
                ? matching.getDefaultRadiusKm()
                : Math.max(matching.getDefaultRadiusKm(), tripRadius);
    }

    int estimatedPickupMinutes(double distanceKm) {
        double kmPerMinute = matching.getAverageSpeedKmh() / 60.0;
        return (int) Math.ceil(distanceKm / kmPerMinute);
    }
}
