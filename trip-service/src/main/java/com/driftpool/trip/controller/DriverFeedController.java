package com.driftpool.trip.controller;

import com.driftpool.shared.context.ActorContext;
import com.driftpool.shared.dto.ApiResponse;
import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.entity.DriverEarnings;
import com.driftpool.trip.exception.TripAccessDeniedException;
import com.driftpool.trip.matching.DriverLocationRegistry;
import com.driftpool.trip.matching.RideBroadcastFilter;
import com.driftpool.trip.matching.RideCandidate;
import com.driftpool.trip.model.LocationUpdate;
import com.driftpool.trip.payment.DriverEarningsService;
import com.driftpool.trip.store.TripQuery;
import com.driftpool.trip.store.TripStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.List;

import static com.driftpool.shared.context.ActorContext.HEADER_TENANT_ID;
import static com.driftpool.shared.context.ActorContext.HEADER_USER_ID;
import static com.driftpool.shared.context.ActorContext.HEADER_USER_ROLE;

/**
 * Driver-facing feed: location pings in, visible ride requests out.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/drivers/{driverId}")
@RequiredArgsConstructor
public class DriverFeedController {

    private final RideBroadcastFilter broadcastFilter;
    private final DriverLocationRegistry locationRegistry;
    private final DriverEarningsService earningsService;
    private final TripStore tripStore;
    private final TripEngineProperties properties;
    private final Clock clock;

    @PostMapping("/location")
    public ResponseEntity<ApiResponse<Void>> updateLocation(
            @PathVariable("driverId") String driverId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @Valid @RequestBody LocationUpdate update) {

        requireSelf(ActorContext.fromHeaders(userId, role, tenantId), driverId);
        locationRegistry.update(driverId, update.toPoint());
        return ResponseEntity.ok(ApiResponse.ok(null));
    }

    @GetMapping(value = "/ride-requests", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<List<RideCandidate>> rideRequestStream(
            @PathVariable("driverId") String driverId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        requireSelf(ActorContext.fromHeaders(userId, role, tenantId), driverId);
        log.info("Driver {} subscribed to ride requests", driverId);
        return broadcastFilter.watch(driverId, locationRegistry.locations(driverId))
                .doFinally(signal -> log.info("Driver {} ride-request stream ended: {}", driverId, signal));
    }

    @GetMapping("/ride-requests/current")
    public ResponseEntity<ApiResponse<List<RideCandidate>>> currentRideRequests(
            @PathVariable("driverId") String driverId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        requireSelf(ActorContext.fromHeaders(userId, role, tenantId), driverId);
        List<RideCandidate> visible = locationRegistry.latest(driverId)
                .map(location -> broadcastFilter.filter(
                        tripStore.find(TripQuery.openRequests(properties.getMatching().getOpenRequestLimit())),
                        driverId, location, clock.instant()))
                .orElse(List.of());
        return ResponseEntity.ok(ApiResponse.ok(visible));
    }

    @GetMapping("/earnings")
    public ResponseEntity<ApiResponse<DriverEarnings>> earnings(
            @PathVariable("driverId") String driverId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        requireSelf(ActorContext.fromHeaders(userId, role, tenantId), driverId);
        DriverEarnings earnings = earningsService.getEarnings(driverId)
                .orElseGet(() -> DriverEarnings.builder().driverId(driverId).build());
        return ResponseEntity.ok(ApiResponse.ok(earnings));
    }

    private static void requireSelf(ActorContext actor, String driverId) {
        if (!actor.isDriver() || !actor.userId().equals(driverId)) {
            throw new TripAccessDeniedException("Feed for driver " + driverId + " is not available to " + actor.userId());
        }
    }
}
