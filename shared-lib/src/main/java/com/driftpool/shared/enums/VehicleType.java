package com.driftpool.shared.enums;

public enum VehicleType {
    STANDARD,
    COMFORT,
    XL
}
