package com.driftpool.trip.pricing;

import com.driftpool.trip.model.GeoPoint;

import java.time.LocalDateTime;

/**
 * Inputs to a price quote. {@code requestTime} is local island time.
 */
public record PricingRequest(GeoPoint pickup,
                             GeoPoint destination,
                             double distanceMiles,
                             double durationMinutes,
                             LocalDateTime requestTime) {
}
