package com.driftpool.shared.enums;

/**
 * How the rider's contribution is collected.
 *
 * NONE               - nothing taken yet; the rider pays after a driver accepts.
 * VERIFICATION       - card validated at request time, charged when a driver accepts.
 * AUTHORIZATION_HOLD - funds held at request time, captured on accept/complete or released on cancel/expiry.
 */
public enum PaymentFlow {
    NONE,
    VERIFICATION,
    AUTHORIZATION_HOLD
}
