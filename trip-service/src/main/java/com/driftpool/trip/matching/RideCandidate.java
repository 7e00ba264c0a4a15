package com.driftpool.trip.matching;

import com.driftpool.trip.entity.Trip;
import lombok.Builder;
import lombok.Data;

/**
 * An open request as one driver sees it: the trip plus how far away its pickup is.
 */
@Data
@Builder
public class RideCandidate {

    private Trip trip;
    private double distanceFromDriverKm;
    private int estimatedPickupMinutes;
}
