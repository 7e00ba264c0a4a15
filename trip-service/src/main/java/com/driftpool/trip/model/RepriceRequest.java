package com.driftpool.trip.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RepriceRequest {

    @NotNull
    @DecimalMin("0.0")
    private Double distanceMiles;

    @NotNull
    @DecimalMin("0.0")
    private Double durationMinutes;
}
