package com.driftpool.trip.exception;

import java.util.UUID;

public class TripNotFoundException extends TripException {

    public TripNotFoundException(UUID tripId) {
        super("TRIP_NOT_FOUND", "Trip " + tripId + " not found");
    }
}
