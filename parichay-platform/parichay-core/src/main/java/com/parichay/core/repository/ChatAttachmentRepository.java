package com.parichay.core.repository;

import com.parichay.core.domain.ChatAttachment;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ChatAttachmentRepository extends JpaRepository<ChatAttachment, UUID> {

    List<ChatAttachment> findByMessageIdAndDeletedFalse(UUID messageId);

    @Query("SELECT a.id FROM ChatAttachment a WHERE a.deleted = false AND a.expiresAt <= :now ORDER BY a.expiresAt")
    List<UUID> findExpiredIds(@Param("now") Instant now, Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE ChatAttachment a SET a.deleted = true, a.deletedAt = :now, a.downloadAllowed = false, " +
           "a.version = a.version + 1 WHERE a.id = :id AND a.deleted = false")
    int softDeleteIfLive(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM ChatAttachment a WHERE a.roomId = :roomId")
    int deleteByRoomId(@Param("roomId") UUID roomId);
}
