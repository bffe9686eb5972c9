package com.parichay.core.repository;

import com.parichay.core.domain.ChatContextLink;
import com.parichay.core.domain.ContextType;
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

@Repository
public interface ChatContextLinkRepository extends JpaRepository<ChatContextLink, UUID> {

    Optional<ChatContextLink> findByRoomIdAndActiveTrue(UUID roomId);

    List<ChatContextLink> findByRoomIdOrderByCreatedAtDesc(UUID roomId);

    List<ChatContextLink> findByContextTypeAndContextIdAndActiveTrue(ContextType contextType, UUID contextId);

    @Query("SELECT l FROM ChatContextLink l WHERE l.active = true AND l.expiresAt <= :now ORDER BY l.expiresAt")
    List<ChatContextLink> findExpired(@Param("now") Instant now, Pageable pageable);

    /**
     * Deactivates the link only if it is still active. Returns the number of rows changed,
     * so exactly one concurrent caller sees 1.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ChatContextLink l SET l.active = false, l.activeRoomKey = null, l.deactivatedAt = :now, " +
           "l.deactivationReason = :reason, l.updatedAt = :now, l.version = l.version + 1 " +
           "WHERE l.id = :id AND l.active = true")
    int deactivateIfActive(@Param("id") UUID id, @Param("reason") String reason, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM ChatContextLink l WHERE l.roomId = :roomId")
    int deleteByRoomId(@Param("roomId") UUID roomId);
}
