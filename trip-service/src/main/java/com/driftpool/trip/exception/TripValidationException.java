package com.driftpool.trip.exception;

/** Malformed input. Rejected before anything is persisted. */
public class TripValidationException extends TripException {

    public TripValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
