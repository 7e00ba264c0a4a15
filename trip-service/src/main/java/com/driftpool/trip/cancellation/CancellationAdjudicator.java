package com.driftpool.trip.cancellation;

import com.driftpool.shared.enums.ActorRole;
import com.driftpool.shared.enums.CancellationReasonType;
import com.driftpool.shared.enums.TripStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fault-based fee split for cancelled trips.
 *
 *   rider cancels while driver en route, or rider-fault reason  → fee = 50% of locked amount, paid to driver
 *   driver cancels citing rider fault                           → fee = 50%, paid to driver
 *   driver cancels citing own fault (emergency, vehicle)        → full refund, no compensation
 *   anything else (early rider cancel, decline, no drivers)     → full refund, no compensation
 *
 * fee = round(amount × 0.5, 2), refund = amount − fee.
 */
@Slf4j
@Component
public class CancellationAdjudicator {

    private static final BigDecimal FEE_RATE = new BigDecimal("0.5");

    public CancellationDecision adjudicate(ActorRole cancelledBy,
                                           TripStatus currentStatus,
                                           CancellationReasonType reasonType,
                                           BigDecimal lockedContribution) {
        BigDecimal amount = lockedContribution == null || lockedContribution.signum() < 0
                ? BigDecimal.ZERO.setScale(2)
                : lockedContribution.setScale(2, RoundingMode.HALF_UP);
        boolean riderFault = reasonType != null && reasonType.isRiderFault();
        boolean driverFault = reasonType != null && reasonType.isDriverFault();

        CancellationDecision decision;
        if (cancelledBy == ActorRole.RIDER && (currentStatus.isDriverEnRoute() || riderFault)) {
            decision = split(amount, "RIDER_LATE_CANCELLATION");
        } else if (cancelledBy == ActorRole.DRIVER && riderFault) {
            decision = split(amount, "DRIVER_CANCELLED_RIDER_FAULT");
        } else if (cancelledBy == ActorRole.DRIVER && driverFault) {
            decision = fullRefund(amount, "DRIVER_FAULT");
        } else {
            decision = fullRefund(amount, "NO_FAULT");
        }

        log.debug("Cancellation by {} in {} ({}) on {} -> fee={} refund={} comp={} [{}]",
                cancelledBy, currentStatus, reasonType, amount,
                decision.cancellationFee(), decision.refundAmount(), decision.driverCompensation(), decision.rule());
        return decision;
    }

    private static CancellationDecision split(BigDecimal amount, String rule) {
        BigDecimal fee = amount.multiply(FEE_RATE).setScale(2, RoundingMode.HALF_UP);
        return new CancellationDecision(fee, amount.subtract(fee), fee, rule);
    }

    private static CancellationDecision fullRefund(BigDecimal amount, String rule) {
        BigDecimal zero = BigDecimal.ZERO.setScale(2);
        return new CancellationDecision(zero, amount, zero, rule);
    }
}
