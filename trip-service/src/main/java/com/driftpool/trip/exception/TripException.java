package com.driftpool.trip.exception;

public class TripException extends RuntimeException {

    private final String code;

    public TripException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
