package com.driftpool.trip.exception;

import java.util.UUID;

/**
 * The accept lost the conditional write. Callers show "ride taken" and must not retry.
 */
public class AlreadyAcceptedException extends TripException {

    public AlreadyAcceptedException(UUID tripId) {
        super("RIDE_ALREADY_ACCEPTED", "Trip " + tripId + " was just accepted by another driver or is no longer available.");
    }
}
