package com.driftpool.trip.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** What the driver app reports when the rider is dropped off. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionReport {

    /** Null means the locked contribution stands. */
    @DecimalMin("0.0")
    private BigDecimal finalCost;

    @DecimalMin("0.0")
    private Double actualDistanceMiles;

    @DecimalMin("0.0")
    private Double actualDurationMinutes;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double finalLat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double finalLng;

    private String finalAddress;

    @Builder.Default
    private List<GeoPoint> routeTraveled = new ArrayList<>();
}
