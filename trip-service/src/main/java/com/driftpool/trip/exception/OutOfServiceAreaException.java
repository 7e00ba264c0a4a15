package com.driftpool.trip.exception;

public class OutOfServiceAreaException extends TripException {

    public OutOfServiceAreaException(String message) {
        super("OUT_OF_SERVICE_AREA", message);
    }
}
