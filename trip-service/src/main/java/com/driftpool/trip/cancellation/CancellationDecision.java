package com.driftpool.trip.cancellation;

import java.math.BigDecimal;

/**
 * Money split for one cancellation. {@code cancellationFee + refundAmount} always equals the
 * locked contribution, and the driver receives either nothing or the whole fee.
 */
public record CancellationDecision(BigDecimal cancellationFee,
                                   BigDecimal refundAmount,
                                   BigDecimal driverCompensation,
                                   String rule) {

    public boolean chargesFee() {
        return cancellationFee.signum() > 0;
    }
}
