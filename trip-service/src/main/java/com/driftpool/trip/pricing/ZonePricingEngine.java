package com.driftpool.trip.pricing;

import com.driftpool.trip.entity.PricingResult;
import com.driftpool.trip.exception.OutOfServiceAreaException;
import com.driftpool.trip.exception.TripValidationException;
import com.driftpool.trip.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Zone-based cost-sharing calculator. Pure: same inputs, same quote, no I/O.
 *
 * Resolution order:
 *   1. pickup and destination in the same zone  → zone flat rate × time-of-day multiplier
 *   2. either end in the airport zone           → fixed airport contribution for the other zone
 *   3. otherwise (cross-zone)                   → (ZONE_EXIT_FEE + miles × PER_MILE + minutes × PER_MINUTE) × multiplier
 *
 * Every quote carries a ±10% band: min = suggested × 0.90, max = suggested × 1.10.
 */
@Slf4j
public class ZonePricingEngine {

    private static final BigDecimal ZONE_EXIT_FEE             = new BigDecimal("5.00");
    private static final BigDecimal PER_MILE_RATE             = new BigDecimal("1.50");
    private static final BigDecimal PER_MINUTE_RATE           = new BigDecimal("0.30");
    private static final BigDecimal DEFAULT_AIRPORT_CONTRIBUTION = new BigDecimal("30.00");
    private static final BigDecimal BAND_LOW                  = new BigDecimal("0.90");
    private static final BigDecimal BAND_HIGH                 = new BigDecimal("1.10");
    private static final String AIRPORT_LABEL                 = "Airport";

    private final ZoneCatalog zoneCatalog;

    public ZonePricingEngine(ZoneCatalog zoneCatalog) {
        this.zoneCatalog = zoneCatalog;
    }

    public PricingResult calculate(PricingRequest request) {
        validate(request);

        Zone pickupZone = resolve(request.pickup(), "Pickup");
        Zone destinationZone = resolve(request.destination(), "Destination");
        TimeBand band = TimeBand.at(request.requestTime().toLocalTime());

        PricingResult.PricingResultBuilder result = PricingResult.builder()
                .pickupZoneId(pickupZone.getId())
                .pickupZoneName(pickupZone.getDisplayName())
                .destinationZoneId(destinationZone.getId())
                .destinationZoneName(destinationZone.getDisplayName());

        BigDecimal suggested;
        if (pickupZone.getId().equals(destinationZone.getId())) {
            BigDecimal flatRate = money(pickupZone.getFlatRate());
            suggested = money(flatRate.multiply(band.multiplier()));
            result.withinZone(true)
                    .flatRate(flatRate)
                    .timeMultiplier(band.multiplier())
                    .timeBand(band.label())
                    .displayText("Within " + pickupZone.getDisplayName());

        } else if (pickupZone.isAirport() || destinationZone.isAirport()) {
            Zone other = pickupZone.isAirport() ? destinationZone : pickupZone;
            suggested = other.getAirportContribution() != null
                    ? money(other.getAirportContribution())
                    : DEFAULT_AIRPORT_CONTRIBUTION;
            result.airportTrip(true)
                    .flatRate(suggested)
                    .timeMultiplier(BigDecimal.ONE.setScale(2))
                    .timeBand(TimeBand.STANDARD.label())
                    .displayText(pickupZone.isAirport()
                            ? AIRPORT_LABEL + " → " + destinationZone.getDisplayName()
                            : pickupZone.getDisplayName() + " → " + AIRPORT_LABEL);

        } else {
            BigDecimal distanceCost = money(BigDecimal.valueOf(request.distanceMiles()).multiply(PER_MILE_RATE));
            BigDecimal timeCost = money(BigDecimal.valueOf(request.durationMinutes()).multiply(PER_MINUTE_RATE));
            BigDecimal subtotal = ZONE_EXIT_FEE.add(distanceCost).add(timeCost);
            suggested = money(subtotal.multiply(band.multiplier()));
            result.zoneExitFee(ZONE_EXIT_FEE)
                    .distanceCost(distanceCost)
                    .timeCost(timeCost)
                    .timeMultiplier(band.multiplier())
                    .timeBand(band.label())
                    .displayText(pickupZone.getDisplayName() + " → " + destinationZone.getDisplayName());
        }

        PricingResult priced = result
                .suggestedContribution(suggested)
                .minContribution(money(suggested.multiply(BAND_LOW)))
                .maxContribution(money(suggested.multiply(BAND_HIGH)))
                .build();

        log.debug("Pricing: {} ({} mi, {} min, band={}) -> {}",
                priced.getDisplayText(), request.distanceMiles(), request.durationMinutes(), band, suggested);
        return priced;
    }

    private Zone resolve(GeoPoint point, String label) {
        return zoneCatalog.resolve(point.latitude(), point.longitude())
                .orElseThrow(() -> new OutOfServiceAreaException(
                        label + " (" + point.latitude() + ", " + point.longitude() + ") is outside the service area"));
    }

    private static void validate(PricingRequest request) {
        if (request == null || request.pickup() == null || request.destination() == null) {
            throw new TripValidationException("Pickup and destination coordinates are required");
        }
        if (request.requestTime() == null) {
            throw new TripValidationException("Request time is required");
        }
        if (!(request.distanceMiles() >= 0) || !(request.durationMinutes() >= 0)) {
            throw new TripValidationException("Route distance and duration must be non-negative");
        }
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
