package com.driftpool.trip.repository;

import com.driftpool.trip.entity.DriverEarnings;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DriverEarningsRepository extends JpaRepository<DriverEarnings, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM DriverEarnings e WHERE e.driverId = :driverId")
    Optional<DriverEarnings> findForUpdate(@Param("driverId") String driverId);
}
