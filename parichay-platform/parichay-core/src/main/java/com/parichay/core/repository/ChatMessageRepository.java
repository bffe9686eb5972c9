package com.parichay.core.repository;

import com.parichay.core.domain.ChatMessage;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for chat messages.
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

    /**
     * Room timeline as seen by {@code viewer}: newest first, moderator-removed messages
     * and the viewer's own hidden messages left out.
     */
    @Query("SELECT m FROM ChatMessage m WHERE m.roomId = :roomId AND m.deleted = false " +
           "AND NOT (m.hidden = true AND m.senderId = :viewer) ORDER BY m.sentAt DESC, m.id DESC")
    List<ChatMessage> findTimeline(@Param("roomId") UUID roomId, @Param("viewer") UUID viewer, Pageable pageable);

    List<ChatMessage> findTop10ByRoomIdOrderBySentAtDesc(UUID roomId);

    Page<ChatMessage> findByFlaggedTrueAndDeletedFalseOrderBySentAtDesc(Pageable pageable);

    List<ChatMessage> findByRoomIdAndFlaggedTrueOrderBySentAtDesc(UUID roomId);

    long countByFlaggedTrueAndDeletedFalse();

    long countByRoomIdAndSenderIdNotAndReadAtIsNull(UUID roomId, UUID senderId);

    long countByRoomId(UUID roomId);

    @Modifying
    @Query("UPDATE ChatMessage m SET m.readAt = :now WHERE m.roomId = :roomId " +
           "AND m.senderId <> :readerId AND m.readAt IS NULL")
    int markReadFor(@Param("roomId") UUID roomId, @Param("readerId") UUID readerId, @Param("now") Instant now);

    /**
     * Drops reply references pointing into a room that is about to be purged.
     */
    @Modifying
    @Query("UPDATE ChatMessage m SET m.replyToId = null WHERE m.replyToId IN " +
           "(SELECT x.id FROM ChatMessage x WHERE x.roomId = :roomId)")
    int clearRepliesInto(@Param("roomId") UUID roomId);

    @Modifying
    @Query("DELETE FROM ChatMessage m WHERE m.roomId = :roomId")
    int deleteByRoomId(@Param("roomId") UUID roomId);
}
