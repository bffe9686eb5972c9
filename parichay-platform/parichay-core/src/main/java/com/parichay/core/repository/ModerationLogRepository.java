package com.parichay.core.repository;

import com.parichay.core.domain.ModerationLog;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only moderation ledger.
 */
@Repository
public interface ModerationLogRepository extends JpaRepository<ModerationLog, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM ModerationLog l WHERE l.id = :id")
    Optional<ModerationLog> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Per-user strike history in write order. Strike counts are assigned under the
     * user's strike lock, so they order entries that share a timestamp.
     */
    List<ModerationLog> findBySubjectUserIdOrderByUserStrikeCountAscCreatedAtAscIdAsc(UUID subjectUserId);

    List<ModerationLog> findByTargetIdOrderByCreatedAtDesc(UUID targetId);

    long countByCreatedAtGreaterThanEqual(Instant since);

    @Query("SELECT l.subjectUserId AS userId, COUNT(l) AS strikes FROM ModerationLog l " +
           "WHERE l.strikeBearing = true AND l.createdAt >= :since " +
           "GROUP BY l.subjectUserId ORDER BY COUNT(l) DESC")
    List<OffenderCount> findTopOffenders(@Param("since") Instant since, Pageable pageable);

    interface OffenderCount {
        UUID getUserId();
        long getStrikes();
    }
}
