package com.driftpool.trip.repository;

import com.driftpool.trip.entity.UserBlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserBlockRepository extends JpaRepository<UserBlock, UUID> {

    List<UserBlock> findByBlockerId(String blockerId);

    List<UserBlock> findByBlockedId(String blockedId);

    Optional<UserBlock> findByBlockerIdAndBlockedId(String blockerId, String blockedId);
}
