package com.driftpool.trip.repository;

import com.driftpool.trip.entity.Trip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface TripRepository extends JpaRepository<Trip, UUID>, JpaSpecificationExecutor<Trip> {

    /**
     * Flips the earnings flag exactly once. Bumps the version so an in-flight entity write that
     * read the old flag fails its optimistic check instead of resetting it.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trip t SET t.earningsCredited = true, t.version = t.version + 1 "
            + "WHERE t.id = :id AND t.earningsCredited = false")
    int markEarningsCredited(@Param("id") UUID id);
}
