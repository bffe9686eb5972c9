package com.parichay.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Directed block from {@code blockerId} to {@code blockedId}.
 * Platform bans use {@link PlatformActors#PLATFORM} as the blocker.
 */
@Entity
@Table(name = "user_blocks",
    uniqueConstraints = @UniqueConstraint(name = "uq_user_blocks_active_pair", columnNames = "active_pair_key"),
    indexes = {
        @Index(name = "idx_user_blocks_blocker", columnList = "blocker_id, active"),
        @Index(name = "idx_user_blocks_blocked", columnList = "blocked_id, active"),
        @Index(name = "idx_user_blocks_expiry", columnList = "active, expires_at")
    })
public class UserBlock {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "blocker_id", nullable = false, updatable = false)
    private UUID blockerId;

    @NotNull
    @Column(name = "blocked_id", nullable = false, updatable = false)
    private UUID blockedId;

    @Column(name = "block_reason", length = 255)
    private String blockReason;

    @NotNull
    @Convert(converter = BlockType.JpaConverter.class)
    @Column(name = "block_type", nullable = false, length = 20)
    private BlockType blockType;

    @Column(nullable = false)
    private boolean permanent;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "blocked_by_admin")
    private UUID blockedByAdmin;

    @Column(name = "admin_reason", length = 255)
    private String adminReason;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "unblocked_at")
    private Instant unblockedAt;

    @Column(name = "unblocked_by")
    private UUID unblockedBy;

    @Column(name = "active_pair_key", length = 80)
    private String activePairKey;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected UserBlock() {}

    public static UserBlock manual(UUID blockerId, UUID blockedId, String reason, boolean permanent,
                                   Instant expiresAt, Instant now) {
        var block = base(blockerId, blockedId, BlockType.MANUAL, permanent, expiresAt, now);
        block.blockReason = reason;
        return block;
    }

    public static UserBlock platformBan(UUID adminId, UUID userId, BlockType type, String reason,
                                        Instant expiresAt, Instant now) {
        var block = base(PlatformActors.PLATFORM, userId, type, expiresAt == null, expiresAt, now);
        block.blockedByAdmin = adminId;
        block.adminReason = reason;
        block.blockReason = reason;
        return block;
    }

    private static UserBlock base(UUID blockerId, UUID blockedId, BlockType type, boolean permanent,
                                  Instant expiresAt, Instant now) {
        if (blockerId == null || blockedId == null) {
            throw new IllegalArgumentException("Blocker and blocked user are required");
        }
        if (blockerId.equals(blockedId)) {
            throw new ValidationException("SELF_BLOCK", "A user cannot block themselves");
        }
        if (!permanent && (expiresAt == null || !expiresAt.isAfter(now))) {
            throw new ValidationException("INVALID_EXPIRY", "Temporary blocks need an expiry in the future");
        }
        var block = new UserBlock();
        block.blockerId = blockerId;
        block.blockedId = blockedId;
        block.blockType = type;
        block.permanent = permanent;
        block.expiresAt = permanent ? null : expiresAt;
        block.active = true;
        block.activePairKey = pairKey(blockerId, blockedId);
        block.createdAt = now;
        block.updatedAt = now;
        return block;
    }

    public static String pairKey(UUID blockerId, UUID blockedId) {
        return blockerId + ":" + blockedId;
    }

    public void deactivate(UUID actor, Instant now) {
        if (!active) {
            throw new ConflictException("ALREADY_INACTIVE", "Block " + id + " is already inactive");
        }
        active = false;
        activePairKey = null;
        unblockedAt = now;
        unblockedBy = actor;
        updatedAt = now;
    }

    public boolean isExpired(Instant now) {
        return !permanent && expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isInForce(Instant now) {
        return active && !isExpired(now);
    }

    public boolean isPlatformBan() {
        return PlatformActors.PLATFORM.equals(blockerId);
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getBlockerId() { return blockerId; }
    public UUID getBlockedId() { return blockedId; }
    public String getBlockReason() { return blockReason; }
    public BlockType getBlockType() { return blockType; }
    public boolean isPermanent() { return permanent; }
    public Instant getExpiresAt() { return expiresAt; }
    public UUID getBlockedByAdmin() { return blockedByAdmin; }
    public String getAdminReason() { return adminReason; }
    public boolean isActive() { return active; }
    public Instant getUnblockedAt() { return unblockedAt; }
    public UUID getUnblockedBy() { return unblockedBy; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public enum BlockType implements WireEnum {
        MANUAL("manual"),
        ADMIN("admin"),
        AUTOMATIC("automatic");

        private final String wireValue;

        BlockType(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static BlockType fromWire(String value) {
            return WireEnum.fromWire(BlockType.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<BlockType> {
            public JpaConverter() {
                super(BlockType.class);
            }
        }
    }
}
