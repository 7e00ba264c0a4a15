package com.driftpool.trip.model;

import com.driftpool.trip.entity.DriverSnapshot;
import lombok.Data;

/** Driver profile as it should appear on the trip from now on. */
@Data
public class AcceptTripRequest {

    private String driverName;
    private Double driverRating;
    private String vehicleMake;
    private String vehicleModel;
    private String vehicleColor;
    private String vehiclePlate;

    public DriverSnapshot toSnapshot() {
        return DriverSnapshot.builder()
                .name(driverName)
                .rating(driverRating)
                .vehicleMake(vehicleMake)
                .vehicleModel(vehicleModel)
                .vehicleColor(vehicleColor)
                .vehiclePlate(vehiclePlate)
                .build();
    }
}
