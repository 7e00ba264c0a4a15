package com.driftpool.trip.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Running earnings totals per driver. Rows are only ever incremented, once per trip.
 */
@Entity
@Table(name = "driver_earnings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "driverId")
public class DriverEarnings {

    @Id
    @Column(name = "driver_id")
    private String driverId;

    @Version
    private Long version;

    @Column(name = "total_earnings", precision = 12, scale = 2, nullable = false)
    @Builder.Default
    private BigDecimal totalEarnings = BigDecimal.ZERO;

    @Column(name = "total_tips", precision = 12, scale = 2, nullable = false)
    @Builder.Default
    private BigDecimal totalTips = BigDecimal.ZERO;

    @Column(name = "cancellation_compensation", precision = 12, scale = 2, nullable = false)
    @Builder.Default
    private BigDecimal cancellationCompensation = BigDecimal.ZERO;

    @Column(name = "total_trips", nullable = false)
    private int totalTrips;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
