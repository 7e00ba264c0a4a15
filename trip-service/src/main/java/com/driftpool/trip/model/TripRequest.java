package com.driftpool.trip.model;

import com.driftpool.shared.enums.PaymentFlow;
import com.driftpool.shared.enums.VehicleType;
import com.driftpool.trip.entity.GeoLocation;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripRequest {

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    private String pickupAddress;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double destinationLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double destinationLng;

    private String destinationAddress;

    @Size(max = 2)
    @Builder.Default
    private List<GeoLocation> stops = new ArrayList<>();

    @NotNull
    @DecimalMin("0.0")
    private Double distanceMiles;

    @NotNull
    @DecimalMin("0.0")
    private Double durationMinutes;

    /** Rider's chosen amount; must sit inside the quoted band. Null takes the suggestion. */
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal contribution;

    private VehicleType vehicleType;

    private PaymentFlow paymentFlow;

    private String paymentMethodId;

    @DecimalMin(value = "0.0", inclusive = false)
    private Double searchRadiusKm;
}
