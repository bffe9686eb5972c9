package com.parichay.core.repository;

import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
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
 * Repository for chat rooms.
 */
@Repository
public interface ChatRoomRepository extends JpaRepository<ChatRoom, UUID> {

    /**
     * Loads the room holding its row lock until the surrounding transaction ends.
     * Every aggregate write (counters, status) goes through this.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ChatRoom r WHERE r.id = :id")
    Optional<ChatRoom> findByIdForUpdate(@Param("id") UUID id);

    Optional<ChatRoom> findByUniquenessKey(String uniquenessKey);

    /**
     * Inbox of a user, most recent conversation first.
     */
    @Query("SELECT r FROM ChatRoom r WHERE (r.userLow = :userId OR r.userHigh = :userId) AND r.deleted = false " +
           "ORDER BY r.lastMessageAt DESC NULLS LAST, r.createdAt DESC")
    List<ChatRoom> findInbox(@Param("userId") UUID userId, Pageable pageable);

    @Query("SELECT r FROM ChatRoom r WHERE r.userLow = :low AND r.userHigh = :high " +
           "AND r.deleted = false AND r.status <> :closed")
    List<ChatRoom> findOpenRoomsOfPair(@Param("low") UUID low, @Param("high") UUID high,
                                       @Param("closed") RoomStatus closed);

    @Query("SELECT r FROM ChatRoom r WHERE (r.userLow = :userId OR r.userHigh = :userId) " +
           "AND r.deleted = false AND r.status <> :closed")
    List<ChatRoom> findOpenRoomsOfUser(@Param("userId") UUID userId, @Param("closed") RoomStatus closed);

    Page<ChatRoom> findByStatusAndDeletedFalseOrderByUpdatedAtDesc(RoomStatus status, Pageable pageable);

    long countByStatusAndDeletedFalse(RoomStatus status);

    /**
     * Live rooms whose timed mute has run out.
     */
    @Query("SELECT r.id FROM ChatRoom r WHERE r.mutedUntil <= :now AND r.deleted = false " +
           "AND r.status <> :closed ORDER BY r.mutedUntil")
    List<UUID> findMuteExpiredIds(@Param("now") Instant now, @Param("closed") RoomStatus closed, Pageable pageable);

    /**
     * Soft-deleted rooms whose retention window has passed.
     */
    @Query("SELECT r.id FROM ChatRoom r WHERE r.deleted = true AND r.deletedAt < :cutoff ORDER BY r.deletedAt")
    List<UUID> findPurgeableIds(@Param("cutoff") Instant cutoff, Pageable pageable);
}
