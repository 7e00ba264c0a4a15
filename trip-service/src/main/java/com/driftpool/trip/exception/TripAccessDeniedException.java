package com.driftpool.trip.exception;

public class TripAccessDeniedException extends TripException {

    public TripAccessDeniedException(String message) {
        super("FORBIDDEN", message);
    }
}
