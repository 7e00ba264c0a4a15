package com.driftpool.shared.context;

import com.driftpool.shared.enums.ActorRole;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of the caller behind a single request.
 *
 * Built once at the edge (controller headers X-User-ID / X-User-Role / X-Tenant-ID) and passed
 * explicitly into every lifecycle call; nothing is held in thread-local or static state.
 */
public record ActorContext(String userId, ActorRole role, String tenantId) {

    public static final String HEADER_USER_ID   = "X-User-ID";
    public static final String HEADER_USER_ROLE = "X-User-Role";
    public static final String HEADER_TENANT_ID = "X-Tenant-ID";
    public static final String DEFAULT_TENANT   = "default";

    public ActorContext {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        Objects.requireNonNull(role, "role is required");
        tenantId = tenantId == null || tenantId.isBlank() ? DEFAULT_TENANT : tenantId;
    }

    /** @throws IllegalArgumentException for a missing user id or an unknown role */
    public static ActorContext fromHeaders(String userId, String role, String tenantId) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException(HEADER_USER_ROLE + " header is required");
        }
        return new ActorContext(userId, ActorRole.valueOf(role.trim().toUpperCase(Locale.ROOT)), tenantId);
    }

    public static ActorContext rider(String riderId) {
        return new ActorContext(riderId, ActorRole.RIDER, DEFAULT_TENANT);
    }

    public static ActorContext driver(String driverId) {
        return new ActorContext(driverId, ActorRole.DRIVER, DEFAULT_TENANT);
    }

    public boolean isRider() {
        return role == ActorRole.RIDER;
    }

    public boolean isDriver() {
        return role == ActorRole.DRIVER;
    }
}
