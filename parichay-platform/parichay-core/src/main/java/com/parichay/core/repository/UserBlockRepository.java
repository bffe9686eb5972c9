package com.parichay.core.repository;

import com.parichay.core.domain.UserBlock;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for directed user blocks and platform bans.
 */
@Repository
public interface UserBlockRepository extends JpaRepository<UserBlock, UUID> {

    /**
     * The single active block for an ordered pair, if any.
     */
    Optional<UserBlock> findByActivePairKey(String activePairKey);

    List<UserBlock> findByBlockerIdAndActiveTrueOrderByCreatedAtDesc(UUID blockerId);

    List<UserBlock> findByBlockedIdAndActiveTrue(UUID blockedId);

    @Query("SELECT b.id FROM UserBlock b WHERE b.active = true AND b.permanent = false " +
           "AND b.expiresAt <= :now ORDER BY b.expiresAt")
    List<UUID> findExpiredIds(@Param("now") Instant now, Pageable pageable);

    /**
     * Conditional deactivation; a no-op returning 0 when the block is already inactive.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE UserBlock b SET b.active = false, b.activePairKey = null, b.unblockedAt = :now, " +
           "b.unblockedBy = :actor, b.updatedAt = :now, b.version = b.version + 1 " +
           "WHERE b.id = :id AND b.active = true")
    int deactivateIfActive(@Param("id") UUID id, @Param("actor") UUID actor, @Param("now") Instant now);
}
