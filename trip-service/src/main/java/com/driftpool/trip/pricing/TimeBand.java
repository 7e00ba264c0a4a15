package com.driftpool.trip.pricing;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Named time-of-day multipliers, evaluated in local island time.
 * Late night takes precedence where the bands overlap.
 */
public enum TimeBand {
    LATE_NIGHT("Late Night", new BigDecimal("1.25")),
    EARLY_MORNING("Early Morning", new BigDecimal("1.15")),
    STANDARD("Standard", new BigDecimal("1.00"));

    private static final int LATE_NIGHT_START_HOUR    = 22;
    private static final int LATE_NIGHT_END_HOUR      = 6;
    private static final int EARLY_MORNING_END_HOUR   = 7;

    private final String label;
    private final BigDecimal multiplier;

    TimeBand(String label, BigDecimal multiplier) {
        this.label = label;
        this.multiplier = multiplier;
    }

    public static TimeBand at(LocalTime time) {
        int hour = time.getHour();
        if (hour >= LATE_NIGHT_START_HOUR || hour < LATE_NIGHT_END_HOUR) {
            return LATE_NIGHT;
        }
        if (hour < EARLY_MORNING_END_HOUR) {
            return EARLY_MORNING;
        }
        return STANDARD;
    }

    public String label() {
        return label;
    }

    public BigDecimal multiplier() {
        return multiplier;
    }
}
