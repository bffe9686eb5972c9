package com.parichay.api.room;

import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.domain.CanonicalPair;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.domain.ContextType;
import com.parichay.core.domain.PlatformActors;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.NotFoundException;
import com.parichay.core.error.ValidationException;
import com.parichay.core.repository.ChatMessageRepository;
import com.parichay.core.repository.ChatRoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner of room lifecycle and room aggregates.
 *
 * Every write locks the room row first, so counters and status fields of one room are
 * changed by one transaction at a time. Rooms are unique per canonical pair and context
 * among non-deleted rooms; the unique key column is the enforcement point, the lookup
 * before insert only produces a nicer error.
 */
@Service
public class ChatRoomService {

    private static final Logger log = LoggerFactory.getLogger(ChatRoomService.class);

    private final ChatRoomRepository roomRepository;
    private final ChatMessageRepository messageRepository;
    private final TransactionRetryExecutor tx;
    private final Clock clock;
    private final int batchSize;

    public ChatRoomService(
            ChatRoomRepository roomRepository,
            ChatMessageRepository messageRepository,
            TransactionRetryExecutor tx,
            Clock clock,
            @Value("${parichay.sweep.batch-size:100}") int batchSize) {
        this.roomRepository = roomRepository;
        this.messageRepository = messageRepository;
        this.tx = tx;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    // ==================== Creation ====================

    public ChatRoom createRoom(UUID userA, UUID userB, ContextType contextType, UUID contextId) {
        Objects.requireNonNull(userA, "userA");
        Objects.requireNonNull(userB, "userB");
        Objects.requireNonNull(contextType, "contextType");
        if (PlatformActors.isReserved(userA) || PlatformActors.isReserved(userB)) {
            throw new ValidationException("RESERVED_USER", "Reserved platform identities cannot chat");
        }
        return tx.execute(() -> {
            ChatRoom room = ChatRoom.open(userA, userB, contextType, contextId, clock.instant());
            if (roomRepository.findByUniquenessKey(room.getUniquenessKey()).isPresent()) {
                throw duplicate(contextType, contextId);
            }
            ChatRoom saved;
            try {
                saved = roomRepository.saveAndFlush(room);
            } catch (DataIntegrityViolationException e) {
                throw duplicate(contextType, contextId);
            }
            log.info("Created {} room {}", contextType.wireValue(), saved.getId());
            return saved;
        });
    }

    /**
     * Returns the live room of the pair for the context, creating it when absent.
     * A concurrent creator winning the insert race is resolved by reading its room.
     */
    public ChatRoom getOrCreateRoom(UUID userA, UUID userB, ContextType contextType, UUID contextId) {
        Optional<ChatRoom> existing = findRoom(userA, userB, contextType, contextId);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return createRoom(userA, userB, contextType, contextId);
        } catch (ConflictException e) {
            if (!"DUPLICATE_ROOM".equals(e.getCode())) {
                throw e;
            }
            return findRoom(userA, userB, contextType, contextId).orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ChatRoom> findRoom(UUID userA, UUID userB, ContextType contextType, UUID contextId) {
        String key = ChatRoom.uniquenessKey(CanonicalPair.of(userA, userB), contextType, contextId);
        return roomRepository.findByUniquenessKey(key);
    }

    // ==================== Status machine ====================

    /**
     * Participant-driven status change. Closing is reserved to the platform and admins,
     * see {@link #closeRoom}.
     */
    public ChatRoom transitionStatus(UUID roomId, UUID actor, RoomStatus target, String reason) {
        Objects.requireNonNull(target, "target");
        return tx.execute(() -> {
            ChatRoom room = lockForUpdate(roomId);
            Instant now = clock.instant();
            if (target == RoomStatus.CLOSED) {
                if (!PlatformActors.SYSTEM.equals(actor)) {
                    throw new ForbiddenException("ADMIN_ONLY", "Only moderators or the platform may close a room");
                }
                room.transitionTo(RoomStatus.CLOSED, actor, reason, now);
                return room;
            }
            room.requireParticipant(actor);
            RoomStatus underlying = room.underlyingStatus();
            if (target == RoomStatus.ACTIVE && underlying == RoomStatus.BLOCKED && !actor.equals(room.getBlockedBy())) {
                throw new ForbiddenException("NOT_BLOCKER", "Only the user who blocked may unblock room " + roomId);
            }
            if (target == RoomStatus.ACTIVE && underlying == RoomStatus.MUTED && !actor.equals(room.getMutedBy())) {
                throw new ForbiddenException("NOT_MUTER", "Only the user who muted may unmute room " + roomId);
            }
            room.transitionTo(target, actor, reason, now);
            log.info("Room {} moved to {} (underlying {})", roomId, room.getStatus().wireValue(),
                    room.underlyingStatus() == null ? "-" : room.underlyingStatus().wireValue());
            return room;
        });
    }

    /**
     * Terminal close. Returns false when the room was already closed.
     */
    public boolean closeRoom(UUID roomId, UUID actor, String reason) {
        return tx.execute(() -> {
            ChatRoom room = lockForUpdate(roomId);
            boolean changed = room.transitionTo(RoomStatus.CLOSED, actor, reason, clock.instant());
            if (changed) {
                log.info("Closed room {}: {}", roomId, reason);
            }
            return changed;
        });
    }

    /**
     * Close used by sweeps: tolerates rooms that were deleted meanwhile.
     */
    public boolean closeIfLive(UUID roomId, UUID actor, String reason) {
        return tx.execute(() -> {
            Optional<ChatRoom> room = roomRepository.findByIdForUpdate(roomId).filter(r -> !r.isDeleted());
            if (room.isEmpty()) {
                log.warn("Skipping close of missing room {}", roomId);
                return false;
            }
            boolean changed = room.get().transitionTo(RoomStatus.CLOSED, actor, reason, clock.instant());
            if (changed) {
                log.info("Closed room {}: {}", roomId, reason);
            }
            return changed;
        });
    }

    public List<UUID> closeAllRoomsOf(UUID userId, UUID actor, String reason) {
        return tx.execute(() -> {
            List<UUID> closed = new ArrayList<>();
            for (ChatRoom room : lockInOrder(roomRepository.findOpenRoomsOfUser(userId, RoomStatus.CLOSED))) {
                if (room.transitionTo(RoomStatus.CLOSED, actor, reason, clock.instant())) {
                    closed.add(room.getId());
                }
            }
            if (!closed.isEmpty()) {
                log.info("Closed {} rooms of user {}", closed.size(), userId);
            }
            return closed;
        });
    }

    public void softDeleteRoom(UUID roomId, UUID actor) {
        tx.run(() -> {
            ChatRoom room = lockForUpdate(roomId);
            room.requireParticipant(actor);
            room.softDelete(actor, clock.instant());
            log.info("Soft-deleted room {}", roomId);
        });
    }

    /**
     * Puts the room under review unless it is closed or already reported.
     */
    public boolean markReported(UUID roomId, UUID reporter, String reason) {
        return tx.execute(() -> {
            ChatRoom room = lockForUpdate(roomId);
            if (room.getStatus() == RoomStatus.CLOSED) {
                return false;
            }
            return room.markReported(reporter, reason, clock.instant());
        });
    }

    /**
     * Ends the review of a reported room. Rooms deleted meanwhile are left alone.
     */
    public boolean restoreFromReport(UUID roomId) {
        return tx.execute(() -> {
            Optional<ChatRoom> live = roomRepository.findByIdForUpdate(roomId).filter(r -> !r.isDeleted());
            if (live.isEmpty() || live.get().getStatus() != RoomStatus.REPORTED) {
                return false;
            }
            ChatRoom room = live.get();
            room.restoreFromReport(clock.instant());
            log.info("Room {} restored to {} after review", roomId, room.getStatus().wireValue());
            return true;
        });
    }

    /**
     * Moderator mute, lifted by {@link #sweepExpiredMutes} after {@code durationMinutes} when
     * one is given. No-op unless the room is currently active underneath.
     */
    public boolean muteByModerator(UUID roomId, UUID moderator, Integer durationMinutes) {
        return tx.execute(() -> {
            ChatRoom room = lockForUpdate(roomId);
            if (room.getStatus() == RoomStatus.CLOSED || room.underlyingStatus() != RoomStatus.ACTIVE) {
                return false;
            }
            Instant now = clock.instant();
            room.transitionTo(RoomStatus.MUTED, moderator, null, now);
            if (durationMinutes != null) {
                room.limitMute(now.plus(Duration.ofMinutes(durationMinutes)));
            }
            return true;
        });
    }

    public boolean unmuteByModerator(UUID roomId) {
        return tx.execute(() -> {
            ChatRoom room = lockForUpdate(roomId);
            if (room.getStatus() == RoomStatus.CLOSED || room.underlyingStatus() != RoomStatus.MUTED) {
                return false;
            }
            room.transitionTo(RoomStatus.ACTIVE, room.getMutedBy(), null, clock.instant());
            return true;
        });
    }

    /**
     * Lifts timed mutes that have run out, one room per transaction. Returns the rooms
     * that became unmuted.
     */
    public List<UUID> sweepExpiredMutes(Instant now) {
        List<UUID> lifted = new ArrayList<>();
        for (UUID roomId : roomRepository.findMuteExpiredIds(now, RoomStatus.CLOSED, PageRequest.of(0, batchSize))) {
            try {
                boolean changed = tx.execute(() -> roomRepository.findByIdForUpdate(roomId)
                        .map(room -> room.liftExpiredMute(now))
                        .orElse(false));
                if (changed) {
                    lifted.add(roomId);
                }
            } catch (RuntimeException e) {
                log.warn("Could not lift expired mute of room {}: {}", roomId, e.getMessage());
            }
        }
        if (!lifted.isEmpty()) {
            log.info("Lifted {} expired room mutes", lifted.size());
        }
        return lifted;
    }

    // ==================== Blocks ====================

    /**
     * Moves every open room shared by the pair into blocked.
     */
    public int applyBlockBetween(UUID blocker, UUID blocked, String reason) {
        return tx.execute(() -> {
            int changed = 0;
            for (ChatRoom room : lockInOrder(openRoomsOfPair(blocker, blocked))) {
                if (room.applyBlock(blocker, reason, clock.instant())) {
                    changed++;
                }
            }
            return changed;
        });
    }

    /**
     * Lifts the room-level block of {@code blocker}. Rooms stay blocked under
     * {@code remainingBlocker} when the reverse block is still in force.
     */
    public int releaseBlockBetween(UUID blocker, UUID blocked, UUID remainingBlocker) {
        return tx.execute(() -> {
            int changed = 0;
            for (ChatRoom room : lockInOrder(openRoomsOfPair(blocker, blocked))) {
                if (room.releaseBlock(blocker, remainingBlocker, clock.instant())) {
                    changed++;
                }
            }
            return changed;
        });
    }

    // ==================== Aggregates ====================

    /**
     * Loads and locks a live room. Must run inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ChatRoom lockForUpdate(UUID roomId) {
        return roomRepository.findByIdForUpdate(roomId)
                .filter(room -> !room.isDeleted())
                .orElseThrow(() -> new NotFoundException("ROOM_NOT_FOUND", "Chat room not found: " + roomId));
    }

    public void recordMessage(UUID roomId, UUID senderId, UUID messageId, Instant sentAt) {
        tx.run(() -> lockForUpdate(roomId).recordMessage(senderId, messageId, sentAt));
    }

    public void markRead(UUID roomId, UUID readerId) {
        tx.run(() -> {
            ChatRoom room = lockForUpdate(roomId);
            Instant now = clock.instant();
            room.markRead(readerId, now);
            messageRepository.markReadFor(roomId, readerId, now);
        });
    }

    // ==================== Reads ====================

    @Transactional(readOnly = true)
    public ChatRoom getRoom(UUID roomId) {
        return roomRepository.findById(roomId)
                .filter(room -> !room.isDeleted())
                .orElseThrow(() -> new NotFoundException("ROOM_NOT_FOUND", "Chat room not found: " + roomId));
    }

    @Transactional(readOnly = true)
    public ChatRoom getRoomForParticipant(UUID roomId, UUID userId) {
        ChatRoom room = getRoom(roomId);
        room.requireParticipant(userId);
        return room;
    }

    @Transactional(readOnly = true)
    public List<ChatRoom> inbox(UUID userId, int page, int size) {
        return roomRepository.findInbox(userId, PageRequest.of(page, size));
    }

    @Transactional(readOnly = true)
    public Page<ChatRoom> roomsByStatus(RoomStatus status, int page, int size) {
        return roomRepository.findByStatusAndDeletedFalseOrderByUpdatedAtDesc(status, PageRequest.of(page, size));
    }

    @Transactional(readOnly = true)
    public int unreadCountFor(UUID roomId, UUID userId) {
        return getRoom(roomId).unreadCountFor(userId);
    }

    @Transactional(readOnly = true)
    public long countByStatus(RoomStatus status) {
        return roomRepository.countByStatusAndDeletedFalse(status);
    }

    private List<ChatRoom> openRoomsOfPair(UUID a, UUID b) {
        CanonicalPair pair = CanonicalPair.of(a, b);
        return roomRepository.findOpenRoomsOfPair(pair.low(), pair.high(), RoomStatus.CLOSED);
    }

    /**
     * Locks rooms in id order so two multi-room writers cannot deadlock each other.
     */
    private List<ChatRoom> lockInOrder(List<ChatRoom> rooms) {
        List<ChatRoom> locked = new ArrayList<>(rooms.size());
        rooms.stream()
                .map(ChatRoom::getId)
                .sorted(Comparator.comparing(UUID::toString))
                .forEach(id -> roomRepository.findByIdForUpdate(id).ifPresent(locked::add));
        return locked;
    }

    private static ConflictException duplicate(ContextType contextType, UUID contextId) {
        return new ConflictException("DUPLICATE_ROOM",
                "A " + contextType.wireValue() + " room already exists for this pair"
                        + (contextId == null ? "" : " and context " + contextId));
    }
}
