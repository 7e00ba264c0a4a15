package com.driftpool.trip.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Driver details copied onto the trip at accept time. Later profile edits never reach it.
 */
@Embeddable
@Getter
@Builder
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class DriverSnapshot {

    @Column(name = "driver_name")
    private String name;

    @Column(name = "driver_rating")
    private Double rating;

    @Column(name = "vehicle_make")
    private String vehicleMake;

    @Column(name = "vehicle_model")
    private String vehicleModel;

    @Column(name = "vehicle_color")
    private String vehicleColor;

    @Column(name = "vehicle_plate")
    private String vehiclePlate;
}
