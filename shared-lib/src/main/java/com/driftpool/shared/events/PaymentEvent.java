package com.driftpool.shared.events;

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
public class PaymentEvent {

    private String tripId;
    private String riderId;
    private String driverId;
    private String operation;
    private BigDecimal amount;
    private String currency;
    private String paymentReference;
    private String status;
    private int attempts;
    private String failureReason;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant eventTime;
}
