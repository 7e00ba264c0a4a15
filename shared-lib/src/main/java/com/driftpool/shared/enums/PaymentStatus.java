package com.driftpool.shared.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Payment state of a trip. The {@code -ING} states mark a gateway call that has been claimed and
 * is still in flight; only the claimer moves the trip out of them.
 */
public enum PaymentStatus {
    PENDING,
    VERIFIED,
    AUTHORIZING,
    AUTHORIZED,
    AUTHORIZATION_FAILED,
    CAPTURING,
    CAPTURED,
    CAPTURE_FAILED,
    CHARGING,
    CHARGE_FAILED,
    CANCELLED,
    REFUNDING,
    REFUNDED,
    PARTIALLY_REFUNDED,
    REFUND_FAILED,
    RELEASING,
    RELEASE_FAILED;

    // Pre-payment states a driver may still be offered; abandoned or failed ones are hidden.
    private static final Set<PaymentStatus> DISPLAYABLE = EnumSet.of(PENDING, VERIFIED, AUTHORIZED);

    private static final Set<PaymentStatus> FLAGGED =
            EnumSet.of(AUTHORIZATION_FAILED, CAPTURE_FAILED, CHARGE_FAILED, REFUND_FAILED, RELEASE_FAILED);

    private static final Set<PaymentStatus> IN_FLIGHT = EnumSet.of(AUTHORIZING, CAPTURING, CHARGING, REFUNDING, RELEASING);

    public boolean isDisplayableToDrivers() {
        return DISPLAYABLE.contains(this);
    }

    /** Needs out-of-band reconciliation. */
    public boolean isFlagged() {
        return FLAGGED.contains(this);
    }

    public static Set<PaymentStatus> inFlightStatuses() {
        return EnumSet.copyOf(IN_FLIGHT);
    }

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    /** The flagged status an abandoned in-flight claim falls back to. */
    public PaymentStatus failedCounterpart() {
        return switch (this) {
            case AUTHORIZING -> AUTHORIZATION_FAILED;
            case CAPTURING -> CAPTURE_FAILED;
            case CHARGING -> CHARGE_FAILED;
            case REFUNDING -> REFUND_FAILED;
            case RELEASING -> RELEASE_FAILED;
            default -> throw new IllegalStateException(this + " is not an in-flight status");
        };
    }
}
