package com.driftpool.shared.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TripStatusTest {

    @Test
    @DisplayName("Terminal states never transition anywhere, including CANCELLED")
    void terminalStatesAreClosed() {
        for (TripStatus terminal : new TripStatus[]{TripStatus.COMPLETED, TripStatus.CANCELLED, TripStatus.EXPIRED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (TripStatus next : TripStatus.values()) {
                assertThat(terminal.canTransitionTo(next))
                        .as("%s -> %s", terminal, next)
                        .isFalse();
            }
        }
    }

    @Test
    @DisplayName("Accept may land in ACCEPTED or DRIVER_ARRIVING; resend stays in REQUESTED")
    void requestedTransitions() {
        assertThat(TripStatus.REQUESTED.canTransitionTo(TripStatus.ACCEPTED)).isTrue();
        assertThat(TripStatus.REQUESTED.canTransitionTo(TripStatus.DRIVER_ARRIVING)).isTrue();
        assertThat(TripStatus.REQUESTED.canTransitionTo(TripStatus.REQUESTED)).isTrue();
        assertThat(TripStatus.REQUESTED.canTransitionTo(TripStatus.EXPIRED)).isTrue();
        assertThat(TripStatus.REQUESTED.canTransitionTo(TripStatus.IN_PROGRESS)).isFalse();
        assertThat(TripStatus.REQUESTED.canTransitionTo(TripStatus.COMPLETED)).isFalse();
    }

    @Test
    @DisplayName("Only REQUESTED trips can expire")
    void onlyRequestedExpires() {
        for (TripStatus status : TripStatus.values()) {
            boolean expected = status == TripStatus.REQUESTED;
            assertThat(status.canTransitionTo(TripStatus.EXPIRED)).as("%s -> EXPIRED", status).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("Completion path cannot be skipped")
    void noSkippingStates() {
        assertThat(TripStatus.DRIVER_ARRIVING.canTransitionTo(TripStatus.IN_PROGRESS)).isFalse();
        assertThat(TripStatus.IN_PROGRESS.canTransitionTo(TripStatus.COMPLETED)).isFalse();
        assertThat(TripStatus.AWAITING_TIP.canTransitionTo(TripStatus.CANCELLED)).isFalse();
        assertThat(TripStatus.AWAITING_TIP.canTransitionTo(TripStatus.COMPLETED)).isTrue();
    }

    @Test
    @DisplayName("Payment display set holds only pre-payment states")
    void paymentDisplaySet() {
        assertThat(PaymentStatus.PENDING.isDisplayableToDrivers()).isTrue();
        assertThat(PaymentStatus.VERIFIED.isDisplayableToDrivers()).isTrue();
        assertThat(PaymentStatus.AUTHORIZED.isDisplayableToDrivers()).isTrue();
        assertThat(PaymentStatus.AUTHORIZATION_FAILED.isDisplayableToDrivers()).isFalse();
        assertThat(PaymentStatus.CANCELLED.isDisplayableToDrivers()).isFalse();
        assertThat(PaymentStatus.REFUNDED.isDisplayableToDrivers()).isFalse();
    }

    @Test
    @DisplayName("Reason types classify fault on exactly one side at most")
    void reasonFaults() {
        assertThat(CancellationReasonType.RIDER_NO_SHOW.isRiderFault()).isTrue();
        assertThat(CancellationReasonType.VEHICLE_ISSUE.isDriverFault()).isTrue();
        for (CancellationReasonType type : CancellationReasonType.values()) {
            assertThat(type.isRiderFault() && type.isDriverFault()).isFalse();
        }
    }
}
