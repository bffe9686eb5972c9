package com.parichay.api.block;

import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.domain.PlatformActors;
import com.parichay.core.domain.UserBlock;
import com.parichay.core.domain.UserBlock.BlockType;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.NotFoundException;
import com.parichay.core.error.ValidationException;
import com.parichay.core.repository.UserBlockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Directed user blocks and platform-wide bans.
 *
 * A block from A to B is independent of a block from B to A. Shared rooms of the pair
 * are moved to blocked while at least one direction is in force. Platform bans are
 * blocks held by {@link PlatformActors#PLATFORM}; they do not touch rooms, they only
 * stop the banned user from sending.
 *
 * {@link #isBlocked} and {@link #canMessage} may deactivate expired rows, so callers
 * must not hold a room lock when calling them.
 */
@Service
public class BlockService {

    private static final Logger log = LoggerFactory.getLogger(BlockService.class);

    private final UserBlockRepository blockRepository;
    private final ChatRoomService roomService;
    private final TransactionRetryExecutor tx;
    private final Clock clock;
    private final int batchSize;

    public BlockService(
            UserBlockRepository blockRepository,
            ChatRoomService roomService,
            TransactionRetryExecutor tx,
            Clock clock,
            @Value("${parichay.sweep.batch-size:100}") int batchSize) {
        this.blockRepository = blockRepository;
        this.roomService = roomService;
        this.tx = tx;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    // ==================== User blocks ====================

    public UserBlock block(UUID blockerId, UUID blockedId, String reason) {
        return block(blockerId, blockedId, reason, true, null);
    }

    public UserBlock block(UUID blockerId, UUID blockedId, String reason, boolean permanent, Instant expiresAt) {
        Objects.requireNonNull(blockerId, "blockerId");
        Objects.requireNonNull(blockedId, "blockedId");
        if (PlatformActors.isReserved(blockerId) || PlatformActors.isReserved(blockedId)) {
            throw new ValidationException("RESERVED_USER", "Reserved platform identities cannot be blocked");
        }
        return tx.execute(() -> {
            Instant now = clock.instant();
            UserBlock block = UserBlock.manual(blockerId, blockedId, reason, permanent, expiresAt, now);
            Optional<UserBlock> existing = blockRepository.findByActivePairKey(
                    UserBlock.pairKey(blockerId, blockedId));
            if (existing.isPresent()) {
                if (existing.get().isInForce(now)) {
                    throw alreadyBlocked(blockedId);
                }
                retire(existing.get(), now);
            }
            UserBlock saved;
            try {
                saved = blockRepository.saveAndFlush(block);
            } catch (DataIntegrityViolationException e) {
                throw alreadyBlocked(blockedId);
            }
            int rooms = roomService.applyBlockBetween(blockerId, blockedId, reason);
            log.info("User {} blocked {} ({} rooms blocked)", blockerId, blockedId, rooms);
            return saved;
        });
    }

    /**
     * Lifts a block. Only the blocker may lift a user block; platform bans go through
     * {@link #adminUnblock}.
     */
    public UserBlock unblock(UUID blockId, UUID actor) {
        return tx.execute(() -> {
            UserBlock block = findBlock(blockId);
            if (!block.getBlockerId().equals(actor)) {
                throw new ForbiddenException("NOT_BLOCKER", "Only the blocker may lift block " + blockId);
            }
            deactivate(block, actor);
            return block;
        });
    }

    public UserBlock adminUnblock(UUID blockId, UUID adminId) {
        return tx.execute(() -> {
            UserBlock block = findBlock(blockId);
            deactivate(block, adminId);
            return block;
        });
    }

    public UserBlock unblockPair(UUID blockerId, UUID blockedId) {
        return tx.execute(() -> {
            UserBlock block = blockRepository.findByActivePairKey(UserBlock.pairKey(blockerId, blockedId))
                    .orElseThrow(() -> new NotFoundException("NOT_BLOCKED",
                            "User " + blockerId + " has no active block on " + blockedId));
            deactivate(block, blockerId);
            return block;
        });
    }

    // ==================== Platform bans ====================

    /**
     * Bans a user platform-wide, permanently when {@code durationMinutes} is null.
     * An existing ban that is at least as strong stays in force and is returned instead.
     */
    public UserBlock platformBan(UUID actor, UUID userId, BlockType type, Integer durationMinutes, String reason) {
        Objects.requireNonNull(userId, "userId");
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new ValidationException("INVALID_DURATION", "Ban duration must be positive");
        }
        return tx.execute(() -> {
            Instant now = clock.instant();
            Instant expiresAt = durationMinutes == null ? null : now.plus(Duration.ofMinutes(durationMinutes));
            Optional<UserBlock> existing = blockRepository.findByActivePairKey(
                    UserBlock.pairKey(PlatformActors.PLATFORM, userId));
            if (existing.isPresent()) {
                UserBlock current = existing.get();
                if (current.isInForce(now) && outlasts(current, expiresAt)) {
                    log.info("User {} already holds a ban at least as long, keeping ban {}", userId, current.getId());
                    return current;
                }
                retire(current, now);
            }
            UserBlock saved;
            try {
                saved = blockRepository.saveAndFlush(
                        UserBlock.platformBan(actor, userId, type, reason, expiresAt, now));
            } catch (DataIntegrityViolationException e) {
                throw new ConflictException("ALREADY_BANNED", "User " + userId + " was banned concurrently", e);
            }
            log.info("User {} banned platform-wide by {} ({})", userId, actor,
                    durationMinutes == null ? "permanent" : durationMinutes + " minutes");
            return saved;
        });
    }

    public UserBlock adminBlock(UUID adminId, UUID userId, Integer durationMinutes, String reason) {
        return platformBan(adminId, userId, BlockType.ADMIN, durationMinutes, reason);
    }

    /**
     * Returns false when the user had no active platform ban.
     */
    public boolean liftPlatformBans(UUID userId, UUID actor) {
        return tx.execute(() -> {
            Optional<UserBlock> ban = blockRepository.findByActivePairKey(
                    UserBlock.pairKey(PlatformActors.PLATFORM, userId));
            if (ban.isEmpty()) {
                return false;
            }
            ban.get().deactivate(actor, clock.instant());
            log.info("Platform ban of user {} lifted by {}", userId, actor);
            return true;
        });
    }

    // ==================== Queries ====================

    /**
     * Whether {@code from} currently blocks {@code to}. An expired block found on the way
     * is deactivated and its rooms released.
     */
    public boolean isBlocked(UUID from, UUID to) {
        return tx.execute(() -> {
            Optional<UserBlock> block = blockRepository.findByActivePairKey(UserBlock.pairKey(from, to));
            if (block.isEmpty()) {
                return false;
            }
            Instant now = clock.instant();
            if (block.get().isInForce(now)) {
                return true;
            }
            expire(block.get(), now);
            return false;
        });
    }

    public boolean isBanned(UUID userId) {
        return isBlocked(PlatformActors.PLATFORM, userId);
    }

    /**
     * Whether the sender's own blocks and bans allow it to message the recipient. A block
     * placed by the recipient is not consulted here; see {@link #blockedEitherWay(UUID, UUID)}.
     */
    public boolean canMessage(UUID sender, UUID recipient) {
        return !isBlocked(sender, recipient) && !isBanned(sender);
    }

    public boolean blockedEitherWay(UUID userA, UUID userB) {
        return isBlocked(userA, userB) || isBlocked(userB, userA);
    }

    @Transactional(readOnly = true)
    public List<UserBlock> listBlocks(UUID blockerId) {
        return blockRepository.findByBlockerIdAndActiveTrueOrderByCreatedAtDesc(blockerId);
    }

    @Transactional(readOnly = true)
    public List<UserBlock> listPlatformBans() {
        return blockRepository.findByBlockerIdAndActiveTrueOrderByCreatedAtDesc(PlatformActors.PLATFORM);
    }

    @Transactional(readOnly = true)
    public Optional<UserBlock> activePlatformBan(UUID userId) {
        return blockRepository.findByActivePairKey(UserBlock.pairKey(PlatformActors.PLATFORM, userId));
    }

    // ==================== Sweep ====================

    /**
     * Deactivates one batch of expired blocks. Each block is handled in its own
     * transaction; a failure is logged and the batch continues.
     *
     * @return number of blocks this call deactivated
     */
    public int sweepExpired(Instant now) {
        List<UUID> ids = blockRepository.findExpiredIds(now, PageRequest.of(0, batchSize));
        int expired = 0;
        for (UUID id : ids) {
            try {
                if (tx.execute(() -> expireById(id, now))) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to expire block {}: {}", id, e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Expired {} blocks", expired);
        }
        return expired;
    }

    private boolean expireById(UUID id, Instant now) {
        Optional<UserBlock> block = blockRepository.findById(id);
        if (block.isEmpty() || blockRepository.deactivateIfActive(id, PlatformActors.SYSTEM, now) == 0) {
            return false;
        }
        releaseRooms(block.get());
        return true;
    }

    private void expire(UserBlock block, Instant now) {
        block.deactivate(PlatformActors.SYSTEM, now);
        blockRepository.saveAndFlush(block);
        releaseRooms(block);
        log.info("Block {} expired", block.getId());
    }

    private void deactivate(UserBlock block, UUID actor) {
        block.deactivate(actor, clock.instant());
        blockRepository.saveAndFlush(block);
        releaseRooms(block);
        log.info("Block {} of {} on {} lifted by {}", block.getId(), block.getBlockerId(), block.getBlockedId(), actor);
    }

    /**
     * Clears an expired active row so a new block for the same pair can be inserted.
     */
    private void retire(UserBlock stale, Instant now) {
        stale.deactivate(PlatformActors.SYSTEM, now);
        blockRepository.saveAndFlush(stale);
        releaseRooms(stale);
    }

    private void releaseRooms(UserBlock block) {
        if (block.isPlatformBan()) {
            return;
        }
        UUID blocker = block.getBlockerId();
        UUID blocked = block.getBlockedId();
        Instant now = clock.instant();
        boolean reverseInForce = blockRepository.findByActivePairKey(UserBlock.pairKey(blocked, blocker))
                .map(reverse -> reverse.isInForce(now))
                .orElse(false);
        roomService.releaseBlockBetween(blocker, blocked, reverseInForce ? blocked : null);
    }

    private UserBlock findBlock(UUID blockId) {
        return blockRepository.findById(blockId)
                .orElseThrow(() -> new NotFoundException("BLOCK_NOT_FOUND", "Block not found: " + blockId));
    }

    private static boolean outlasts(UserBlock current, Instant requestedExpiry) {
        if (current.isPermanent()) {
            return true;
        }
        return requestedExpiry != null && !current.getExpiresAt().isBefore(requestedExpiry);
    }

    private static ConflictException alreadyBlocked(UUID blockedId) {
        return new ConflictException("ALREADY_BLOCKED", "User " + blockedId + " is already blocked");
    }
}
