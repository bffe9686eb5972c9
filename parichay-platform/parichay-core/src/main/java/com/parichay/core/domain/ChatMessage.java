package com.parichay.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * A single message inside a chat room.
 *
 * Content is opaque (encrypted at rest by convention). Three lifecycle flags are
 * independent: {@code deleted} is moderator removal visible to everyone,
 * {@code hidden} is a sender-local soft delete, {@code retracted} is a sender recall
 * that keeps the content for moderation but stops it from being rendered.
 */
@Entity
@Table(name = "chat_messages", indexes = {
    @Index(name = "idx_chat_messages_room_sent", columnList = "room_id, sent_at"),
    @Index(name = "idx_chat_messages_sender", columnList = "sender_id, sent_at"),
    @Index(name = "idx_chat_messages_unread", columnList = "room_id, read_at"),
    @Index(name = "idx_chat_messages_flagged", columnList = "flagged, sent_at")
})
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "room_id", nullable = false, updatable = false)
    private UUID roomId;

    @NotNull
    @Column(name = "sender_id", nullable = false, updatable = false)
    private UUID senderId;

    @NotNull
    @Convert(converter = MessageType.JpaConverter.class)
    @Column(name = "message_type", nullable = false, length = 20)
    private MessageType messageType;

    @NotNull
    @Column(nullable = false, length = 5000)
    private String content;

    @Column(nullable = false)
    private boolean encrypted;

    @Column(name = "reply_to_id")
    private UUID replyToId;

    @Embedded
    private SafetyFlags safetyFlags;

    @Column(nullable = false)
    private boolean flagged;

    @Convert(converter = FlaggedBy.JpaConverter.class)
    @Column(name = "flagged_by", length = 20)
    private FlaggedBy flaggedBy;

    @Column(name = "flagged_reason", length = 255)
    private String flaggedReason;

    @Column(name = "report_count", nullable = false)
    private int reportCount;

    @Column(nullable = false)
    private boolean deleted;

    @Column(name = "deleted_by")
    private UUID deletedBy;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(nullable = false)
    private boolean hidden;

    @Column(nullable = false)
    private boolean retracted;

    @NotNull
    @Column(name = "sent_at", nullable = false, updatable = false)
    private Instant sentAt;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "edited_at")
    private Instant editedAt;

    protected ChatMessage() {}

    public static ChatMessage compose(UUID roomId, UUID senderId, MessageType type, String content,
                                      UUID replyToId, SafetyFlags flags, Instant sentAt) {
        if (roomId == null || senderId == null) {
            throw new IllegalArgumentException("Room and sender are required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Message type is required");
        }
        if (content == null) {
            throw new IllegalArgumentException("Content is required");
        }

        var message = new ChatMessage();
        message.roomId = roomId;
        message.senderId = senderId;
        message.messageType = type;
        message.content = content;
        message.encrypted = true;
        message.replyToId = replyToId;
        message.sentAt = sentAt;
        message.applyScan(flags);
        return message;
    }

    /**
     * Stores detector results; any match flags the message for review on behalf of the system.
     * An admin flag is never downgraded by a re-scan.
     */
    public void applyScan(SafetyFlags flags) {
        this.safetyFlags = flags == null ? SafetyFlags.NONE : flags;
        if (flaggedBy == FlaggedBy.ADMIN) {
            return;
        }
        if (safetyFlags.any()) {
            flagged = true;
            flaggedBy = FlaggedBy.SYSTEM;
            flaggedReason = "auto: " + String.join(",", safetyFlags.matchedDetectors());
        } else {
            flagged = false;
            flaggedBy = null;
            flaggedReason = null;
        }
    }

    public void flagByAdmin(String reason) {
        flagged = true;
        flaggedBy = FlaggedBy.ADMIN;
        flaggedReason = reason;
    }

    public void retract(UUID actor) {
        requireSender(actor, "retract");
        retracted = true;
    }

    public void hideForSender(UUID actor) {
        requireSender(actor, "hide");
        hidden = true;
    }

    public void edit(UUID actor, String newContent, SafetyFlags flags, Instant now) {
        requireSender(actor, "edit");
        if (deleted || retracted) {
            throw new ConflictException("MESSAGE_NOT_EDITABLE", "Message " + id + " can no longer be edited");
        }
        content = newContent;
        editedAt = now;
        applyScan(flags);
    }

    public void removeByModerator(UUID moderator, Instant now) {
        if (deleted) {
            return;
        }
        deleted = true;
        deletedBy = moderator;
        deletedAt = now;
    }

    public void restore() {
        deleted = false;
        deletedBy = null;
        deletedAt = null;
    }

    public void incrementReportCount() {
        reportCount++;
    }

    public void markRead(Instant now) {
        if (readAt == null) {
            readAt = now;
        }
    }

    public boolean isSentBy(UUID userId) {
        return senderId.equals(userId);
    }

    private void requireSender(UUID actor, String operation) {
        if (!isSentBy(actor)) {
            throw new ForbiddenException("NOT_SENDER", "Only the sender may " + operation + " message " + id);
        }
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getRoomId() { return roomId; }
    public UUID getSenderId() { return senderId; }
    public MessageType getMessageType() { return messageType; }
    public String getContent() { return content; }
    public boolean isEncrypted() { return encrypted; }
    public UUID getReplyToId() { return replyToId; }
    public SafetyFlags getSafetyFlags() { return safetyFlags == null ? SafetyFlags.NONE : safetyFlags; }
    public boolean isFlagged() { return flagged; }
    public FlaggedBy getFlaggedBy() { return flaggedBy; }
    public String getFlaggedReason() { return flaggedReason; }
    public int getReportCount() { return reportCount; }
    public boolean isDeleted() { return deleted; }
    public UUID getDeletedBy() { return deletedBy; }
    public Instant getDeletedAt() { return deletedAt; }
    public boolean isHidden() { return hidden; }
    public boolean isRetracted() { return retracted; }
    public Instant getSentAt() { return sentAt; }
    public Instant getReadAt() { return readAt; }
    public Instant getEditedAt() { return editedAt; }

    public enum MessageType implements WireEnum {
        TEXT("text"),
        IMAGE("image"),
        FILE("file"),
        VOICE("voice");

        private final String wireValue;

        MessageType(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static MessageType fromWire(String value) {
            return WireEnum.fromWire(MessageType.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<MessageType> {
            public JpaConverter() {
                super(MessageType.class);
            }
        }
    }

    public enum FlaggedBy implements WireEnum {
        SYSTEM("system"),
        ADMIN("admin");

        private final String wireValue;

        FlaggedBy(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<FlaggedBy> {
            public JpaConverter() {
                super(FlaggedBy.class);
            }
        }
    }
}
