package com.driftpool.shared.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Trip lifecycle states.
 *
 *   REQUESTED ──accept──▶ ACCEPTED (awaiting rider payment) ──pay──▶ DRIVER_ARRIVING
 *   REQUESTED ──accept──▶ DRIVER_ARRIVING ──▶ DRIVER_ARRIVED ──▶ IN_PROGRESS ──▶ AWAITING_TIP ──▶ COMPLETED
 *   REQUESTED ──sweep──▶ EXPIRED
 *   any cancellable state ──cancel──▶ CANCELLED
 *
 * COMPLETED, CANCELLED and EXPIRED are terminal.
 */
public enum TripStatus {
    REQUESTED,
    ACCEPTED,
    DRIVER_ARRIVING,
    DRIVER_ARRIVED,
    IN_PROGRESS,
    AWAITING_TIP,
    COMPLETED,
    CANCELLED,
    EXPIRED;

    private static final Set<TripStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, EXPIRED);
    private static final Set<TripStatus> CANCELLABLE =
            EnumSet.of(REQUESTED, ACCEPTED, DRIVER_ARRIVING, DRIVER_ARRIVED, IN_PROGRESS);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isCancellable() {
        return CANCELLABLE.contains(this);
    }

    /** Driver is committed and travelling to (or waiting at) the pickup point. */
    public boolean isDriverEnRoute() {
        return this == DRIVER_ARRIVING || this == DRIVER_ARRIVED;
    }

    public boolean canTransitionTo(TripStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == CANCELLED) {
            return isCancellable();
        }
        return switch (this) {
            case REQUESTED       -> next == REQUESTED || next == ACCEPTED || next == DRIVER_ARRIVING || next == EXPIRED;
            case ACCEPTED        -> next == DRIVER_ARRIVING;
            case DRIVER_ARRIVING -> next == DRIVER_ARRIVED;
            case DRIVER_ARRIVED  -> next == IN_PROGRESS;
            case IN_PROGRESS     -> next == AWAITING_TIP;
            case AWAITING_TIP    -> next == COMPLETED;
            default              -> false;
        };
    }
}
