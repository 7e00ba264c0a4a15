package com.driftpool.trip.cancellation;

import com.driftpool.shared.enums.ActorRole;
import com.driftpool.shared.enums.CancellationReasonType;
import com.driftpool.shared.enums.TripStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Fee split rules. For every decision: fee + refund == locked amount, fee <= amount, refund >= 0.
 */
class CancellationAdjudicatorTest {

    private static final BigDecimal TWENTY = new BigDecimal("20.00");

    private CancellationAdjudicator adjudicator;

    @BeforeEach
    void setUp() {
        adjudicator = new CancellationAdjudicator();
    }

    @Test
    @DisplayName("Rider cancels while driver is on the way: 20.00 splits into fee 10, refund 10, driver 10")
    void riderCancelsWhileDriverArriving() {
        CancellationDecision decision = adjudicator.adjudicate(ActorRole.RIDER, TripStatus.DRIVER_ARRIVING,
                CancellationReasonType.RIDER_CHANGED_PLANS, TWENTY);

        assertThat(decision.cancellationFee()).isEqualByComparingTo("10.00");
        assertThat(decision.refundAmount()).isEqualByComparingTo("10.00");
        assertThat(decision.driverCompensation()).isEqualByComparingTo("10.00");
        assertThat(decision.rule()).isEqualTo("RIDER_LATE_CANCELLATION");
    }

    @Test
    @DisplayName("Rider cancels before anyone accepted: full refund")
    void riderCancelsEarly() {
        CancellationDecision decision = adjudicator.adjudicate(ActorRole.RIDER, TripStatus.REQUESTED,
                CancellationReasonType.RIDER_CHANGED_PLANS, TWENTY);

        assertThat(decision.cancellationFee()).isEqualByComparingTo("0.00");
        assertThat(decision.refundAmount()).isEqualByComparingTo("20.00");
        assertThat(decision.chargesFee()).isFalse();
    }

    @Test
    @DisplayName("Rider-fault reason charges the fee even before the driver is en route")
    void riderFaultReason() {
        CancellationDecision decision = adjudicator.adjudicate(ActorRole.RIDER, TripStatus.ACCEPTED,
                CancellationReasonType.RIDER_CANCELLED_AFTER_COMMIT, TWENTY);
        assertThat(decision.cancellationFee()).isEqualByComparingTo("10.00");
    }

    @Test
    @DisplayName("Driver cancels for a rider no-show: driver compensated with half")
    void driverCancelsRiderNoShow() {
        CancellationDecision decision = adjudicator.adjudicate(ActorRole.DRIVER, TripStatus.DRIVER_ARRIVED,
                CancellationReasonType.RIDER_NO_SHOW, TWENTY);

        assertThat(decision.driverCompensation()).isEqualByComparingTo("10.00");
        assertThat(decision.rule()).isEqualTo("DRIVER_CANCELLED_RIDER_FAULT");
    }

    @Test
    @DisplayName("Driver cancels for own emergency: rider refunded in full, no compensation")
    void driverFault() {
        CancellationDecision decision = adjudicator.adjudicate(ActorRole.DRIVER, TripStatus.DRIVER_ARRIVING,
                CancellationReasonType.DRIVER_EMERGENCY, TWENTY);

        assertThat(decision.refundAmount()).isEqualByComparingTo("20.00");
        assertThat(decision.driverCompensation()).isEqualByComparingTo("0.00");
        assertThat(decision.rule()).isEqualTo("DRIVER_FAULT");
    }

    @Test
    @DisplayName("Odd cents round the fee half-up and the refund absorbs the remainder")
    void oddCents() {
        CancellationDecision decision = adjudicator.adjudicate(ActorRole.RIDER, TripStatus.DRIVER_ARRIVED,
                CancellationReasonType.OTHER, new BigDecimal("9.99"));

        assertThat(decision.cancellationFee()).isEqualByComparingTo("5.00");
        assertThat(decision.refundAmount()).isEqualByComparingTo("4.99");
    }

    @Test
    @DisplayName("Missing locked amount is treated as zero")
    void nullAmount() {
        CancellationDecision decision = adjudicator.adjudicate(ActorRole.RIDER, TripStatus.DRIVER_ARRIVING,
                CancellationReasonType.OTHER, null);
        assertThat(decision.cancellationFee()).isEqualByComparingTo("0.00");
        assertThat(decision.refundAmount()).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("fee + refund == amount for every role, status and reason")
    void feeConservation() {
        BigDecimal[] amounts = {new BigDecimal("0.01"), new BigDecimal("9.99"), TWENTY, new BigDecimal("123.45")};
        for (ActorRole role : ActorRole.values()) {
            for (TripStatus status : TripStatus.values()) {
                if (!status.isCancellable()) continue;
                for (CancellationReasonType reason : CancellationReasonType.values()) {
                    for (BigDecimal amount : amounts) {
                        CancellationDecision d = adjudicator.adjudicate(role, status, reason, amount);
                        assertThat(d.cancellationFee().add(d.refundAmount())).isEqualByComparingTo(amount);
                        assertThat(d.refundAmount().signum()).isGreaterThanOrEqualTo(0);
                        assertThat(d.cancellationFee()).isLessThanOrEqualTo(amount);
                        assertThat(d.driverCompensation()).isIn(d.cancellationFee(), BigDecimal.ZERO.setScale(2));
                    }
                }
            }
        }
    }
}
