package com.driftpool.trip.entity;

import com.driftpool.shared.enums.ActorRole;
import com.driftpool.shared.enums.CancellationReasonType;
import com.driftpool.shared.enums.PaymentFlow;
import com.driftpool.shared.enums.PaymentStatus;
import com.driftpool.shared.enums.TripStatus;
import com.driftpool.shared.enums.VehicleType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "trips",
        indexes = {
                @Index(name = "idx_trip_rider", columnList = "rider_id"),
                @Index(name = "idx_trip_driver", columnList = "driver_id"),
                @Index(name = "idx_trip_status_requested", columnList = "status, requested_at"),
                @Index(name = "idx_trip_payment_status", columnList = "payment_status")
        })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Trip {

    public static final int MAX_STOPS = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    /**
     * Optimistic lock version. Every conditional write flushes against it, so two writers that
     * read the same snapshot cannot both commit: the second sees a stale version and is rejected.
     */
    @Version
    @Column(nullable = false)
    private Long version;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(name = "rider_id", nullable = false)
    private String riderId;

    @Setter(AccessLevel.NONE)
    @Column(name = "driver_id")
    private String driverId;

    @Setter(AccessLevel.NONE)
    @Embedded
    private DriverSnapshot driverInfo;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TripStatus status;

    // --- geography ---

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "pickup_lat", nullable = false)),
            @AttributeOverride(name = "longitude", column = @Column(name = "pickup_lng", nullable = false)),
            @AttributeOverride(name = "address", column = @Column(name = "pickup_address", length = 512))
    })
    private GeoLocation pickup;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "destination_lat", nullable = false)),
            @AttributeOverride(name = "longitude", column = @Column(name = "destination_lng", nullable = false)),
            @AttributeOverride(name = "address", column = @Column(name = "destination_address", length = 512))
    })
    private GeoLocation destination;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trip_stops", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "stop_index")
    @Builder.Default
    private List<GeoLocation> stops = new ArrayList<>();

    @Column(name = "route_distance_miles")
    private double routeDistanceMiles;

    @Column(name = "route_duration_minutes")
    private double routeDurationMinutes;

    // --- commercial ---

    @Embedded
    private PricingResult pricing;

    @Setter(AccessLevel.NONE)
    @Column(name = "locked_contribution", precision = 10, scale = 2)
    private BigDecimal lockedContribution;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_type")
    private VehicleType vehicleType;

    @Column(name = "final_cost", precision = 10, scale = 2)
    private BigDecimal finalCost;

    @Column(name = "tip", precision = 10, scale = 2)
    private BigDecimal tip;

    @Column(name = "total_with_tip", precision = 10, scale = 2)
    private BigDecimal totalWithTip;

    @Column(name = "currency", length = 3)
    private String currency;

    // --- payment ---

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_flow", nullable = false)
    private PaymentFlow paymentFlow;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false)
    private PaymentStatus paymentStatus;

    @Column(name = "payment_method_id")
    private String paymentMethodId;

    @Column(name = "payment_reference")
    private String paymentReference;

    @Column(name = "payment_failure_reason", length = 512)
    private String paymentFailureReason;

    /** When the in-flight gateway call on {@code paymentStatus} was claimed; null when none is. */
    @Column(name = "payment_claimed_at")
    private Instant paymentClaimedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "tip_payment_status")
    private PaymentStatus tipPaymentStatus;

    // --- matching bookkeeping ---

    @Setter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trip_declined_drivers", joinColumns = @JoinColumn(name = "trip_id"))
    @Column(name = "driver_id")
    @Builder.Default
    private Set<String> declinedBy = new HashSet<>();

    @Column(name = "search_radius_km")
    private Double searchRadiusKm;

    @Column(name = "resend_count")
    private int resendCount;

    // --- timestamps ---

    @Column(name = "requested_at")
    private Instant requestedAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    @Column(name = "arrived_at")
    private Instant arrivedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "finalized_at")
    private Instant finalizedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "expired_at")
    private Instant expiredAt;

    @Column(name = "rating_deadline")
    private Instant ratingDeadline;

    // --- completion record ---

    @Column(name = "actual_distance_miles")
    private Double actualDistanceMiles;

    @Column(name = "actual_duration_minutes")
    private Double actualDurationMinutes;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "latitude", column = @Column(name = "final_lat")),
            @AttributeOverride(name = "longitude", column = @Column(name = "final_lng")),
            @AttributeOverride(name = "address", column = @Column(name = "final_address", length = 512))
    })
    private GeoLocation finalLocation;

    @JsonIgnore
    @Column(name = "route_traveled", columnDefinition = "TEXT")
    private String routeTraveledJson;

    // --- cancellation / expiry record ---

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by")
    private ActorRole cancelledBy;

    @Column(name = "cancellation_reason", length = 512)
    private String cancellationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancellation_reason_type")
    private CancellationReasonType cancellationReasonType;

    @Column(name = "cancellation_fee", precision = 10, scale = 2)
    private BigDecimal cancellationFee;

    @Column(name = "refund_amount", precision = 10, scale = 2)
    private BigDecimal refundAmount;

    @Column(name = "driver_compensation", precision = 10, scale = 2)
    private BigDecimal driverCompensation;

    @Column(name = "expiry_reason")
    private String expiryReason;

    @Column(name = "earnings_credited", nullable = false)
    private boolean earningsCredited;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // --- guarded mutations ---

    public void transitionTo(TripStatus next) {
        if (status != null && !status.canTransitionTo(next)) {
            throw new IllegalStateException("Trip " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public void assignDriver(String newDriverId, DriverSnapshot snapshot) {
        if (driverId != null) {
            throw new IllegalStateException("Trip " + id + " is already assigned to driver " + driverId);
        }
        this.driverId = newDriverId;
        this.driverInfo = snapshot;
    }

    public void lockContribution(BigDecimal amount) {
        if (lockedContribution != null) {
            throw new IllegalStateException("Contribution for trip " + id + " is already locked at " + lockedContribution);
        }
        this.lockedContribution = amount.setScale(2, RoundingMode.HALF_UP);
    }

    public boolean recordDecline(String declinedDriverId) {
        return declinedBy.add(declinedDriverId);
    }

    public Set<String> getDeclinedBy() {
        return Collections.unmodifiableSet(declinedBy);
    }

    @JsonIgnore
    public boolean hasDriver() {
        return driverId != null;
    }

    @JsonIgnore
    public boolean isAssignedTo(String candidateDriverId) {
        return driverId != null && driverId.equals(candidateDriverId);
    }
}
