package com.driftpool.trip.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Output of the zone pricing engine, stored on the trip as the quote shown to the rider.
 * Recomputing it never touches the trip's locked contribution.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingResult {

    @Column(name = "pickup_zone_id")
    private String pickupZoneId;

    @Column(name = "pickup_zone_name")
    private String pickupZoneName;

    @Column(name = "destination_zone_id")
    private String destinationZoneId;

    @Column(name = "destination_zone_name")
    private String destinationZoneName;

    @Column(name = "within_zone")
    private boolean withinZone;

    @Column(name = "airport_trip")
    private boolean airportTrip;

    @Column(name = "zone_exit_fee", precision = 10, scale = 2)
    private BigDecimal zoneExitFee;

    @Column(name = "distance_cost", precision = 10, scale = 2)
    private BigDecimal distanceCost;

    @Column(name = "time_cost", precision = 10, scale = 2)
    private BigDecimal timeCost;

    @Column(name = "flat_rate", precision = 10, scale = 2)
    private BigDecimal flatRate;

    @Column(name = "time_multiplier", precision = 4, scale = 2)
    private BigDecimal timeMultiplier;

    @Column(name = "time_band")
    private String timeBand;

    @Column(name = "suggested_contribution", precision = 10, scale = 2)
    private BigDecimal suggestedContribution;

    @Column(name = "min_contribution", precision = 10, scale = 2)
    private BigDecimal minContribution;

    @Column(name = "max_contribution", precision = 10, scale = 2)
    private BigDecimal maxContribution;

    @Column(name = "pricing_display_text")
    private String displayText;
}
