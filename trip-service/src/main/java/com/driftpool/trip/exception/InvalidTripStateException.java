package com.driftpool.trip.exception;

public class InvalidTripStateException extends TripException {

    public InvalidTripStateException(String message) {
        super("INVALID_STATE", message);
    }

    public InvalidTripStateException(String code, String message) {
        super(code, message);
    }

    public static InvalidTripStateException stateChanged(Object tripId) {
        return new InvalidTripStateException("TRIP_STATE_CHANGED",
                "Trip " + tripId + " changed state concurrently; nothing was applied");
    }
}
