package com.driftpool.trip.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class TipRequest {

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal amount;
}
