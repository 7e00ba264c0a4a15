package com.driftpool.trip.entity;

import com.driftpool.shared.enums.BlockReason;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One directed block: {@code blockerId} no longer wants to be matched with {@code blockedId}.
 * Matching treats the relation as mutual.
 */
@Entity
@Table(name = "user_blocks",
        uniqueConstraints = @UniqueConstraint(name = "uk_block_pair", columnNames = {"blocker_id", "blocked_id"}),
        indexes = {
                @Index(name = "idx_block_blocker", columnList = "blocker_id"),
                @Index(name = "idx_block_blocked", columnList = "blocked_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class UserBlock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "blocker_id", nullable = false)
    private String blockerId;

    @Column(name = "blocked_id", nullable = false)
    private String blockedId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason_type", nullable = false)
    private BlockReason reasonType;

    @Column(name = "reason", length = 512)
    private String reason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
