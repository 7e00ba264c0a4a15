package com.driftpool.trip.pricing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

class TimeBandTest {

    @Test
    @DisplayName("22:00 through 05:59 is late night")
    void lateNight() {
        assertThat(TimeBand.at(LocalTime.of(22, 0))).isEqualTo(TimeBand.LATE_NIGHT);
        assertThat(TimeBand.at(LocalTime.of(3, 15))).isEqualTo(TimeBand.LATE_NIGHT);
        assertThat(TimeBand.at(LocalTime.of(5, 59))).isEqualTo(TimeBand.LATE_NIGHT);
    }

    @Test
    @DisplayName("06:00 through 06:59 is early morning, 07:00 onwards standard")
    void earlyMorningThenStandard() {
        assertThat(TimeBand.at(LocalTime.of(6, 0))).isEqualTo(TimeBand.EARLY_MORNING);
        assertThat(TimeBand.at(LocalTime.of(6, 59))).isEqualTo(TimeBand.EARLY_MORNING);
        assertThat(TimeBand.at(LocalTime.of(7, 0))).isEqualTo(TimeBand.STANDARD);
        assertThat(TimeBand.at(LocalTime.of(21, 59))).isEqualTo(TimeBand.STANDARD);
    }
}
