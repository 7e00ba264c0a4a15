package com.driftpool.trip.pricing;

import com.driftpool.trip.config.TripEngineProperties;
import com.driftpool.trip.entity.PricingResult;
import com.driftpool.trip.model.GeoPoint;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Adapts wall-clock instants to the island-local time the pricing bands are defined in.
 */
@Service
public class TripPricingService {

    private final ZonePricingEngine engine;
    private final ZoneId serviceZone;

    public TripPricingService(ZonePricingEngine engine, TripEngineProperties properties) {
        this.engine = engine;
        this.serviceZone = ZoneId.of(properties.getTimeZone());
    }

    public PricingResult quote(GeoPoint pickup, GeoPoint destination,
                               double distanceMiles, double durationMinutes, Instant at) {
        LocalDateTime localTime = LocalDateTime.ofInstant(at, serviceZone);
        return engine.calculate(new PricingRequest(pickup, destination, distanceMiles, durationMinutes, localTime));
    }
}
