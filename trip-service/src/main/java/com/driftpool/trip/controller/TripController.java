package com.driftpool.trip.controller;

import com.driftpool.shared.context.ActorContext;
import com.driftpool.shared.dto.ApiResponse;
import com.driftpool.trip.entity.PricingResult;
import com.driftpool.trip.entity.Trip;
import com.driftpool.trip.lifecycle.TripLifecycleService;
import com.driftpool.trip.model.AcceptTripRequest;
import com.driftpool.trip.model.CancellationRequest;
import com.driftpool.trip.model.CompletionReport;
import com.driftpool.trip.model.GeoPoint;
import com.driftpool.trip.model.QuoteRequest;
import com.driftpool.trip.model.RepriceRequest;
import com.driftpool.trip.model.ResendTripRequest;
import com.driftpool.trip.model.TipRequest;
import com.driftpool.trip.model.TripRequest;
import com.driftpool.trip.pricing.TripPricingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

import static com.driftpool.shared.context.ActorContext.HEADER_TENANT_ID;
import static com.driftpool.shared.context.ActorContext.HEADER_USER_ID;
import static com.driftpool.shared.context.ActorContext.HEADER_USER_ROLE;

@Slf4j
@RestController
@RequestMapping("/api/v1/trips")
@RequiredArgsConstructor
public class TripController {

    private final TripLifecycleService lifecycleService;
    private final TripPricingService pricingService;
    private final Clock clock;

    @PostMapping("/quote")
    public ResponseEntity<ApiResponse<PricingResult>> quote(@Valid @RequestBody QuoteRequest request) {
        PricingResult pricing = pricingService.quote(
                new GeoPoint(request.getPickupLat(), request.getPickupLng()),
                new GeoPoint(request.getDestinationLat(), request.getDestinationLng()),
                request.getDistanceMiles(), request.getDurationMinutes(), clock.instant());
        return ResponseEntity.ok(ApiResponse.ok(pricing));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Trip>> requestTrip(
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @Valid @RequestBody TripRequest request) {

        Trip trip = lifecycleService.requestTrip(ActorContext.fromHeaders(userId, role, tenantId), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(trip));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Trip>>> myTrips(
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @RequestParam(value = "limit", defaultValue = "20") int limit) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.riderTrips(ActorContext.fromHeaders(userId, role, tenantId), limit)));
    }

    @GetMapping("/{tripId}")
    public ResponseEntity<ApiResponse<Trip>> getTrip(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.getTrip(ActorContext.fromHeaders(userId, role, tenantId), tripId)));
    }

    @GetMapping(value = "/{tripId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<Trip> watchTrip(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        return lifecycleService.watchTrip(ActorContext.fromHeaders(userId, role, tenantId), tripId);
    }

    @PostMapping("/{tripId}/reprice")
    public ResponseEntity<ApiResponse<Trip>> reprice(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @Valid @RequestBody RepriceRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.repriceTrip(
                ActorContext.fromHeaders(userId, role, tenantId), tripId,
                request.getDistanceMiles(), request.getDurationMinutes())));
    }

    @PostMapping("/{tripId}/accept")
    public ResponseEntity<ApiResponse<Trip>> accept(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @RequestBody(required = false) AcceptTripRequest request) {

        AcceptTripRequest profile = request != null ? request : new AcceptTripRequest();
        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.acceptTrip(
                ActorContext.fromHeaders(userId, role, tenantId), tripId, profile.toSnapshot())));
    }

    @PostMapping("/{tripId}/confirm-payment")
    public ResponseEntity<ApiResponse<Trip>> confirmPayment(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.confirmPayment(ActorContext.fromHeaders(userId, role, tenantId), tripId)));
    }

    @PostMapping("/{tripId}/decline")
    public ResponseEntity<ApiResponse<Trip>> decline(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.declineTrip(ActorContext.fromHeaders(userId, role, tenantId), tripId)));
    }

    @PostMapping("/{tripId}/resend")
    public ResponseEntity<ApiResponse<Trip>> resend(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @Valid @RequestBody(required = false) ResendTripRequest request) {

        Double widen = request != null ? request.getWidenRadiusKm() : null;
        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.resendTrip(ActorContext.fromHeaders(userId, role, tenantId), tripId, widen)));
    }

    @PostMapping("/{tripId}/arrived")
    public ResponseEntity<ApiResponse<Trip>> arrived(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.markDriverArrived(ActorContext.fromHeaders(userId, role, tenantId), tripId)));
    }

    @PostMapping("/{tripId}/start")
    public ResponseEntity<ApiResponse<Trip>> start(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.startTrip(ActorContext.fromHeaders(userId, role, tenantId), tripId)));
    }

    @PostMapping("/{tripId}/complete")
    public ResponseEntity<ApiResponse<Trip>> complete(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @Valid @RequestBody CompletionReport report) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.completeTrip(ActorContext.fromHeaders(userId, role, tenantId), tripId, report)));
    }

    @PostMapping("/{tripId}/tip")
    public ResponseEntity<ApiResponse<Trip>> tip(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @Valid @RequestBody TipRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(lifecycleService.addTip(
                ActorContext.fromHeaders(userId, role, tenantId), tripId, request.getAmount())));
    }

    @PostMapping("/{tripId}/skip-tip")
    public ResponseEntity<ApiResponse<Trip>> skipTip(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.skipTip(ActorContext.fromHeaders(userId, role, tenantId), tripId)));
    }

    @PostMapping("/{tripId}/cancel")
    public ResponseEntity<ApiResponse<Trip>> cancel(
            @PathVariable("tripId") UUID tripId,
            @RequestHeader(HEADER_USER_ID) String userId,
            @RequestHeader(HEADER_USER_ROLE) String role,
            @RequestHeader(value = HEADER_TENANT_ID, required = false) String tenantId,
            @Valid @RequestBody CancellationRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(
                lifecycleService.cancelTrip(ActorContext.fromHeaders(userId, role, tenantId), tripId, request)));
    }
}
