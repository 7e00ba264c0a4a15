package com.driftpool.trip.model;

import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

@Data
public class ResendTripRequest {

    /** New search radius; ignored unless larger than the current one. */
    @DecimalMin(value = "0.0", inclusive = false)
    private Double widenRadiusKm;
}
