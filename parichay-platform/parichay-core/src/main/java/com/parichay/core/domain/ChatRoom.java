package com.parichay.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Context-bound conversation between exactly two users.
 *
 * Participants are stored in canonical order. The room is the owner of its
 * messages, attachments and context links, and the single writer of its own
 * aggregates (counters, last-message pointer, status fields).
 *
 * Status machine:
 * <pre>
 *   active &lt;-&gt; muted
 *   active | muted  -&gt; blocked
 *   blocked         -&gt; active            (unblock)
 *   active | muted | blocked -&gt; reported (remembers the prior status)
 *   reported        -&gt; prior status      (dismissal)
 *   *               -&gt; closed            (terminal)
 * </pre>
 * While reported, mute and block requests act on the remembered prior status.
 */
@Entity
@Table(name = "chat_rooms",
    uniqueConstraints = @UniqueConstraint(name = "uq_chat_rooms_pair_context", columnNames = "uniqueness_key"),
    indexes = {
        @Index(name = "idx_chat_rooms_users", columnList = "user_low, user_high"),
        @Index(name = "idx_chat_rooms_status", columnList = "status, deleted"),
        @Index(name = "idx_chat_rooms_context", columnList = "context_type, context_id"),
        @Index(name = "idx_chat_rooms_last_message", columnList = "last_message_at"),
        @Index(name = "idx_chat_rooms_muted_until", columnList = "muted_until")
    })
public class ChatRoom {

    private static final Map<RoomStatus, Set<RoomStatus>> PARTICIPANT_TRANSITIONS = new EnumMap<>(RoomStatus.class);

    static {
        PARTICIPANT_TRANSITIONS.put(RoomStatus.ACTIVE, EnumSet.of(RoomStatus.MUTED, RoomStatus.BLOCKED));
        PARTICIPANT_TRANSITIONS.put(RoomStatus.MUTED, EnumSet.of(RoomStatus.ACTIVE, RoomStatus.BLOCKED));
        PARTICIPANT_TRANSITIONS.put(RoomStatus.BLOCKED, EnumSet.of(RoomStatus.ACTIVE));
        PARTICIPANT_TRANSITIONS.put(RoomStatus.REPORTED, EnumSet.noneOf(RoomStatus.class));
        PARTICIPANT_TRANSITIONS.put(RoomStatus.CLOSED, EnumSet.noneOf(RoomStatus.class));
    }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_low", nullable = false)
    private UUID userLow;

    @NotNull
    @Column(name = "user_high", nullable = false)
    private UUID userHigh;

    @NotNull
    @Convert(converter = ContextType.JpaConverter.class)
    @Column(name = "context_type", nullable = false, length = 20)
    private ContextType contextType;

    @Column(name = "context_id")
    private UUID contextId;

    @NotNull
    @Convert(converter = RoomStatus.JpaConverter.class)
    @Column(nullable = false, length = 20)
    private RoomStatus status;

    @Convert(converter = RoomStatus.JpaConverter.class)
    @Column(name = "pre_report_status", length = 20)
    private RoomStatus preReportStatus;

    @Column(name = "muted_by")
    private UUID mutedBy;

    @Column(name = "muted_at")
    private Instant mutedAt;

    @Column(name = "muted_until")
    private Instant mutedUntil;

    @Column(name = "blocked_by")
    private UUID blockedBy;

    @Column(name = "blocked_at")
    private Instant blockedAt;

    @Column(name = "block_reason", length = 255)
    private String blockReason;

    @Column(name = "reported_by")
    private UUID reportedBy;

    @Column(name = "reported_at")
    private Instant reportedAt;

    @Column(name = "report_reason", length = 255)
    private String reportReason;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "closed_by")
    private UUID closedBy;

    @Column(name = "close_reason", length = 255)
    private String closeReason;

    @Column(name = "last_message_id")
    private UUID lastMessageId;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "message_count", nullable = false)
    private int messageCount;

    @Column(name = "unread_count_low", nullable = false)
    private int unreadCountLow;

    @Column(name = "unread_count_high", nullable = false)
    private int unreadCountHigh;

    @Column(nullable = false)
    private boolean deleted;

    @Column(name = "deleted_by")
    private UUID deletedBy;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    /**
     * low:high:context_type:context_id while the room is not deleted, null afterwards.
     * Backs the one-room-per-pair-per-context rule with a plain unique constraint.
     */
    @Column(name = "uniqueness_key", length = 200)
    private String uniquenessKey;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected ChatRoom() {}

    public static ChatRoom open(UUID userA, UUID userB, ContextType contextType, UUID contextId, Instant now) {
        if (userA == null || userB == null) {
            throw new IllegalArgumentException("Both participants are required");
        }
        if (contextType == null) {
            throw new IllegalArgumentException("Context type is required");
        }
        if (userA.equals(userB)) {
            throw new ValidationException("SELF_CHAT", "A user cannot open a chat with themselves");
        }
        CanonicalPair pair = CanonicalPair.of(userA, userB);

        var room = new ChatRoom();
        room.userLow = pair.low();
        room.userHigh = pair.high();
        room.contextType = contextType;
        room.contextId = contextId;
        room.status = RoomStatus.ACTIVE;
        room.uniquenessKey = uniquenessKey(pair, contextType, contextId);
        room.createdAt = now;
        room.updatedAt = now;
        return room;
    }

    public static String uniquenessKey(CanonicalPair pair, ContextType contextType, UUID contextId) {
        return pair.key() + ":" + contextType.wireValue() + ":" + (contextId == null ? "-" : contextId.toString());
    }

    // ==================== Participants ====================

    public CanonicalPair participants() {
        return new CanonicalPair(userLow, userHigh);
    }

    public boolean isParticipant(UUID userId) {
        return userLow.equals(userId) || userHigh.equals(userId);
    }

    public UUID otherParticipant(UUID userId) {
        requireParticipant(userId);
        return userLow.equals(userId) ? userHigh : userLow;
    }

    public void requireParticipant(UUID userId) {
        if (!isParticipant(userId)) {
            throw new ForbiddenException("NOT_PARTICIPANT", "User " + userId + " is not a participant of room " + id);
        }
    }

    public int unreadCountFor(UUID userId) {
        requireParticipant(userId);
        return userLow.equals(userId) ? unreadCountLow : unreadCountHigh;
    }

    // ==================== Aggregates ====================

    /**
     * Applies one delivered message to the counters. Callers hold the room row lock.
     */
    public void recordMessage(UUID senderId, UUID messageId, Instant sentAt) {
        requireParticipant(senderId);
        messageCount++;
        if (userLow.equals(senderId)) {
            unreadCountHigh++;
        } else {
            unreadCountLow++;
        }
        lastMessageId = messageId;
        lastMessageAt = sentAt;
        updatedAt = sentAt;
    }

    public void markRead(UUID readerId, Instant now) {
        requireParticipant(readerId);
        if (userLow.equals(readerId)) {
            unreadCountLow = 0;
        } else {
            unreadCountHigh = 0;
        }
        updatedAt = now;
    }

    // ==================== Status machine ====================

    /**
     * Status the room would have without a pending report.
     */
    public RoomStatus underlyingStatus() {
        return status == RoomStatus.REPORTED ? preReportStatus : status;
    }

    /**
     * Moves the room to {@code target}. Returns false when the request is a no-op: closing a
     * closed room, or asking a reported room for the status it already has underneath. A
     * reported room only leaves review through {@link #restoreFromReport(Instant)}.
     */
    public boolean transitionTo(RoomStatus target, UUID actor, String reason, Instant now) {
        if (target == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        if (status == RoomStatus.CLOSED) {
            if (target == RoomStatus.CLOSED) {
                return false;
            }
            throw invalidTransition(target);
        }
        switch (target) {
            case CLOSED -> close(actor, reason, now);
            case REPORTED -> {
                if (status == RoomStatus.REPORTED) {
                    throw invalidTransition(target);
                }
                markReported(actor, reason, now);
            }
            default -> {
                if (status == RoomStatus.REPORTED && target == preReportStatus) {
                    return false;
                }
                changeUnderlying(target, actor, reason, now);
            }
        }
        return true;
    }

    /**
     * Puts the room under review. Already reported rooms keep their first reporter.
     */
    public boolean markReported(UUID reporter, String reason, Instant now) {
        if (status == RoomStatus.CLOSED) {
            throw invalidTransition(RoomStatus.REPORTED);
        }
        if (status == RoomStatus.REPORTED) {
            return false;
        }
        preReportStatus = status;
        status = RoomStatus.REPORTED;
        reportedBy = reporter;
        reportedAt = now;
        reportReason = truncate(reason);
        updatedAt = now;
        return true;
    }

    /**
     * Returns a reported room to the status it had before the report.
     */
    public void restoreFromReport(Instant now) {
        if (status != RoomStatus.REPORTED) {
            throw invalidTransition(preReportStatus == null ? RoomStatus.ACTIVE : preReportStatus);
        }
        status = preReportStatus == null ? RoomStatus.ACTIVE : preReportStatus;
        preReportStatus = null;
        clearReportFields();
        updatedAt = now;
    }

    /**
     * Bounds the current mute. Only a room muted underneath can carry a mute expiry.
     */
    public void limitMute(Instant until) {
        if (underlyingStatus() != RoomStatus.MUTED) {
            throw invalidTransition(RoomStatus.MUTED);
        }
        mutedUntil = until;
    }

    public boolean isMuteExpired(Instant now) {
        return underlyingStatus() == RoomStatus.MUTED && mutedUntil != null && !mutedUntil.isAfter(now);
    }

    /**
     * Lifts a timed mute whose end has passed. A room under review keeps its reported
     * status and comes back active when the review ends.
     */
    public boolean liftExpiredMute(Instant now) {
        if (status == RoomStatus.CLOSED || !isMuteExpired(now)) {
            return false;
        }
        changeUnderlying(RoomStatus.ACTIVE, mutedBy, null, now);
        return true;
    }

    /**
     * Records a user block between the participants. No-op when already blocked or closed.
     */
    public boolean applyBlock(UUID blocker, String reason, Instant now) {
        if (status == RoomStatus.CLOSED || underlyingStatus() == RoomStatus.BLOCKED) {
            return false;
        }
        changeUnderlying(RoomStatus.BLOCKED, blocker, reason, now);
        return true;
    }

    /**
     * Lifts a block held by {@code blocker}. When the other participant still blocks,
     * the room stays blocked under their name.
     */
    public boolean releaseBlock(UUID blocker, UUID remainingBlocker, Instant now) {
        if (status == RoomStatus.CLOSED || underlyingStatus() != RoomStatus.BLOCKED) {
            return false;
        }
        if (remainingBlocker != null) {
            if (!remainingBlocker.equals(blockedBy)) {
                blockedBy = remainingBlocker;
                blockedAt = now;
                blockReason = null;
                updatedAt = now;
            }
            return false;
        }
        changeUnderlying(RoomStatus.ACTIVE, blocker, null, now);
        return true;
    }

    public void softDelete(UUID actor, Instant now) {
        if (deleted) {
            return;
        }
        deleted = true;
        deletedBy = actor;
        deletedAt = now;
        uniquenessKey = null;
        updatedAt = now;
    }

    private void close(UUID actor, String reason, Instant now) {
        clearMuteFields();
        clearBlockFields();
        clearReportFields();
        preReportStatus = null;
        status = RoomStatus.CLOSED;
        closedAt = now;
        closedBy = actor;
        closeReason = truncate(reason);
        updatedAt = now;
    }

    private void changeUnderlying(RoomStatus target, UUID actor, String reason, Instant now) {
        RoomStatus from = underlyingStatus();
        if (!PARTICIPANT_TRANSITIONS.get(from).contains(target)) {
            throw invalidTransition(target);
        }
        if (from == RoomStatus.MUTED) {
            clearMuteFields();
        } else if (from == RoomStatus.BLOCKED) {
            clearBlockFields();
        }
        if (target == RoomStatus.MUTED) {
            mutedBy = actor;
            mutedAt = now;
        } else if (target == RoomStatus.BLOCKED) {
            blockedBy = actor;
            blockedAt = now;
            blockReason = truncate(reason);
        }
        if (status == RoomStatus.REPORTED) {
            preReportStatus = target;
        } else {
            status = target;
        }
        updatedAt = now;
    }

    private ConflictException invalidTransition(RoomStatus target) {
        return new ConflictException("INVALID_TRANSITION",
                "Room " + id + " cannot move from " + status.wireValue() + " to " + target.wireValue());
    }

    private void clearMuteFields() {
        mutedBy = null;
        mutedAt = null;
        mutedUntil = null;
    }

    private void clearBlockFields() {
        blockedBy = null;
        blockedAt = null;
        blockReason = null;
    }

    private void clearReportFields() {
        reportedBy = null;
        reportedAt = null;
        reportReason = null;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 255) {
            return value;
        }
        return value.substring(0, 255);
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getUserLow() { return userLow; }
    public UUID getUserHigh() { return userHigh; }
    public ContextType getContextType() { return contextType; }
    public UUID getContextId() { return contextId; }
    public RoomStatus getStatus() { return status; }
    public RoomStatus getPreReportStatus() { return preReportStatus; }
    public UUID getMutedBy() { return mutedBy; }
    public Instant getMutedAt() { return mutedAt; }
    public Instant getMutedUntil() { return mutedUntil; }
    public UUID getBlockedBy() { return blockedBy; }
    public Instant getBlockedAt() { return blockedAt; }
    public String getBlockReason() { return blockReason; }
    public UUID getReportedBy() { return reportedBy; }
    public Instant getReportedAt() { return reportedAt; }
    public String getReportReason() { return reportReason; }
    public Instant getClosedAt() { return closedAt; }
    public UUID getClosedBy() { return closedBy; }
    public String getCloseReason() { return closeReason; }
    public UUID getLastMessageId() { return lastMessageId; }
    public Instant getLastMessageAt() { return lastMessageAt; }
    public int getMessageCount() { return messageCount; }
    public int getUnreadCountLow() { return unreadCountLow; }
    public int getUnreadCountHigh() { return unreadCountHigh; }
    public boolean isDeleted() { return deleted; }
    public UUID getDeletedBy() { return deletedBy; }
    public Instant getDeletedAt() { return deletedAt; }
    public String getUniquenessKey() { return uniquenessKey; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }

    public enum RoomStatus implements WireEnum {
        ACTIVE("active"),
        MUTED("muted"),
        BLOCKED("blocked"),
        REPORTED("reported"),
        CLOSED("closed");

        private final String wireValue;

        RoomStatus(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static RoomStatus fromWire(String value) {
            return WireEnum.fromWire(RoomStatus.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<RoomStatus> {
            public JpaConverter() {
                super(RoomStatus.class);
            }
        }
    }
}
