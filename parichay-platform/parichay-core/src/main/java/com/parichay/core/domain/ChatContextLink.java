package com.parichay.core.domain;

import com.parichay.core.error.ConflictException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Binds a room to the context it was started from (profile, job post, listing, help request).
 * At most one link per room is active; {@code activeRoomKey} mirrors the room id while active
 * and carries the unique constraint.
 */
@Entity
@Table(name = "chat_context_links",
    uniqueConstraints = @UniqueConstraint(name = "uq_chat_context_links_active_room", columnNames = "active_room_key"),
    indexes = {
        @Index(name = "idx_chat_context_links_room", columnList = "room_id"),
        @Index(name = "idx_chat_context_links_context", columnList = "context_type, context_id"),
        @Index(name = "idx_chat_context_links_expiry", columnList = "active, expires_at")
    })
public class ChatContextLink {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "room_id", nullable = false, updatable = false)
    private UUID roomId;

    @NotNull
    @Convert(converter = ContextType.JpaConverter.class)
    @Column(name = "context_type", nullable = false, length = 20)
    private ContextType contextType;

    @NotNull
    @Column(name = "context_id", nullable = false)
    private UUID contextId;

    @Column(name = "initiated_from", length = 50)
    private String initiatedFrom;

    @Column(name = "requires_approval", nullable = false)
    private boolean requiresApproval;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "approved_by")
    private UUID approvedBy;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "deactivation_reason", length = 255)
    private String deactivationReason;

    @Column(name = "active_room_key", length = 36)
    private String activeRoomKey;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected ChatContextLink() {}

    public static ChatContextLink create(UUID roomId, ContextType contextType, UUID contextId,
                                         String initiatedFrom, boolean requiresApproval,
                                         Instant expiresAt, Instant now) {
        if (roomId == null || contextType == null || contextId == null) {
            throw new IllegalArgumentException("Room and context reference are required");
        }
        var link = new ChatContextLink();
        link.roomId = roomId;
        link.contextType = contextType;
        link.contextId = contextId;
        link.initiatedFrom = initiatedFrom;
        link.requiresApproval = requiresApproval;
        link.expiresAt = expiresAt;
        link.active = true;
        link.activeRoomKey = roomId.toString();
        link.createdAt = now;
        link.updatedAt = now;
        return link;
    }

    public void approve(UUID approver, Instant now) {
        if (!active) {
            throw new ConflictException("LINK_INACTIVE", "Context link " + id + " is no longer active");
        }
        if (!requiresApproval) {
            throw new ConflictException("NOT_REQUIRED", "Context link " + id + " does not require approval");
        }
        if (approvedAt != null) {
            throw new ConflictException("ALREADY_APPROVED", "Context link " + id + " is already approved");
        }
        approvedAt = now;
        approvedBy = approver;
        updatedAt = now;
    }

    /**
     * Returns false when the link was already inactive.
     */
    public boolean deactivate(String reason, Instant now) {
        if (!active) {
            return false;
        }
        active = false;
        activeRoomKey = null;
        deactivatedAt = now;
        deactivationReason = reason;
        updatedAt = now;
        return true;
    }

    public boolean isAwaitingApproval() {
        return active && requiresApproval && approvedAt == null;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getRoomId() { return roomId; }
    public ContextType getContextType() { return contextType; }
    public UUID getContextId() { return contextId; }
    public String getInitiatedFrom() { return initiatedFrom; }
    public boolean isRequiresApproval() { return requiresApproval; }
    public Instant getApprovedAt() { return approvedAt; }
    public UUID getApprovedBy() { return approvedBy; }
    public Instant getExpiresAt() { return expiresAt; }
    public boolean isActive() { return active; }
    public Instant getDeactivatedAt() { return deactivatedAt; }
    public String getDeactivationReason() { return deactivationReason; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
