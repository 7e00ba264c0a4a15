package com.driftpool.shared.events;

import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.shared.enums.TripStatus;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TripStatusChangedEvent {

    private String tripId;
    private String riderId;
    private String driverId;
    private TripStatus previousStatus;
    private TripStatus status;
    private PaymentStatus paymentStatus;
    private BigDecimal lockedContribution;
    private String reason;
    private String tenantId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant changedAt;
}
