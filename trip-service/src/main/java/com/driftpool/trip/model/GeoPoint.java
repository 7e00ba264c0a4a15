package com.driftpool.trip.model;

import com.driftpool.shared.util.GeoUtil;

public record GeoPoint(double latitude, double longitude) {

    public double distanceKmTo(GeoPoint other) {
        return GeoUtil.distanceKm(latitude, longitude, other.latitude, other.longitude);
    }
}
