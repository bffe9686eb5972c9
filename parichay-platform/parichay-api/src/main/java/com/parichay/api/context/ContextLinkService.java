package com.parichay.api.context;

import com.parichay.api.collaborator.ContextDirectory;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.domain.ChatContextLink;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.domain.ContextType;
import com.parichay.core.domain.PlatformActors;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.DependencyUnavailableException;
import com.parichay.core.error.NotFoundException;
import com.parichay.core.error.ValidationException;
import com.parichay.core.repository.ChatContextLinkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Binds rooms to the real-world context they were opened for.
 *
 * A room has at most one active link. When the link expires or its context is
 * revoked the room is closed. Deactivation is a conditional update, so concurrent
 * sweeps close each room once.
 */
@Service
public class ContextLinkService {

    private static final Logger log = LoggerFactory.getLogger(ContextLinkService.class);

    static final String EXPIRED_REASON = "context expired";

    private final ChatContextLinkRepository linkRepository;
    private final ChatRoomService roomService;
    private final ContextDirectory contextDirectory;
    private final TransactionRetryExecutor tx;
    private final Clock clock;
    private final int batchSize;

    public ContextLinkService(
            ChatContextLinkRepository linkRepository,
            ChatRoomService roomService,
            ContextDirectory contextDirectory,
            TransactionRetryExecutor tx,
            Clock clock,
            @Value("${parichay.sweep.batch-size:100}") int batchSize) {
        this.linkRepository = linkRepository;
        this.roomService = roomService;
        this.contextDirectory = contextDirectory;
        this.tx = tx;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    public ChatContextLink linkContext(UUID roomId, ContextType contextType, UUID contextId,
                                       String initiatedFrom, boolean requiresApproval, Instant expiresAt) {
        if (contextType == null || contextId == null) {
            throw new ValidationException("CONTEXT_REQUIRED", "Context type and id are required");
        }
        if (expiresAt != null && !expiresAt.isAfter(clock.instant())) {
            throw new ValidationException("INVALID_EXPIRY", "Link expiry must be in the future");
        }
        requireContextExists(contextType, contextId);

        Optional<ChatContextLink> linked = tx.execute(() -> {
            ChatRoom room = roomService.lockForUpdate(roomId);
            if (room.getStatus() == RoomStatus.CLOSED) {
                throw new ConflictException("ROOM_CLOSED", "Room " + roomId + " is closed");
            }
            Instant now = clock.instant();
            Optional<ChatContextLink> current = linkRepository.findByRoomIdAndActiveTrue(roomId);
            if (current.isPresent()) {
                if (!current.get().isExpired(now)) {
                    throw linkExists(roomId);
                }
                // an expired link ends its room even when the sweep has not reached it yet
                if (linkRepository.deactivateIfActive(current.get().getId(), EXPIRED_REASON, now) > 0) {
                    roomService.closeIfLive(roomId, PlatformActors.SYSTEM, EXPIRED_REASON);
                    log.info("Closed room {} on relink: context link {} had expired", roomId, current.get().getId());
                }
                return Optional.<ChatContextLink>empty();
            }
            ChatContextLink saved;
            try {
                saved = linkRepository.saveAndFlush(ChatContextLink.create(
                        roomId, contextType, contextId, initiatedFrom, requiresApproval, expiresAt, now));
            } catch (DataIntegrityViolationException e) {
                throw linkExists(roomId);
            }
            log.info("Linked room {} to {} context {}", roomId, contextType.wireValue(), contextId);
            return Optional.of(saved);
        });
        return linked.orElseThrow(() -> new ConflictException("ROOM_CLOSED",
                "Room " + roomId + " was closed because its context link expired"));
    }

    /**
     * Approves a link that gates messaging. The approver must be a participant and the
     * context must still be open.
     */
    public ChatContextLink approve(UUID linkId, UUID approver) {
        ChatContextLink snapshot = getLink(linkId);
        if (!contextActive(snapshot.getContextType(), snapshot.getContextId())) {
            throw new ConflictException("CONTEXT_INACTIVE",
                    "Context " + snapshot.getContextId() + " no longer accepts conversations");
        }
        return tx.execute(() -> {
            ChatContextLink link = getLink(linkId);
            roomService.getRoom(link.getRoomId()).requireParticipant(approver);
            link.approve(approver, clock.instant());
            log.info("Context link {} approved by {}", linkId, approver);
            return link;
        });
    }

    /**
     * Deactivates one batch of expired links and closes their rooms.
     *
     * @return ids of the rooms this call closed
     */
    public List<UUID> sweepExpired(Instant now) {
        List<ChatContextLink> expired = linkRepository.findExpired(now, PageRequest.of(0, batchSize));
        List<UUID> closed = new ArrayList<>();
        for (ChatContextLink link : expired) {
            deactivateAndClose(link, EXPIRED_REASON, now).ifPresent(closed::add);
        }
        if (!closed.isEmpty()) {
            log.info("Closed {} rooms with expired context", closed.size());
        }
        return closed;
    }

    /**
     * Called when the owning service withdraws a context (profile hidden, job filled).
     *
     * @return ids of the rooms this call closed
     */
    public List<UUID> revokeContext(ContextType contextType, UUID contextId, String reason) {
        String effectiveReason = reason == null || reason.isBlank() ? "context revoked" : reason;
        Instant now = clock.instant();
        List<UUID> closed = new ArrayList<>();
        for (ChatContextLink link : linkRepository.findByContextTypeAndContextIdAndActiveTrue(contextType, contextId)) {
            deactivateAndClose(link, effectiveReason, now).ifPresent(closed::add);
        }
        log.info("Revoked {} context {}: {} rooms closed", contextType.wireValue(), contextId, closed.size());
        return closed;
    }

    @Transactional(readOnly = true)
    public boolean isAwaitingApproval(UUID roomId) {
        return linkRepository.findByRoomIdAndActiveTrue(roomId)
                .map(ChatContextLink::isAwaitingApproval)
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public Optional<ChatContextLink> activeLink(UUID roomId) {
        return linkRepository.findByRoomIdAndActiveTrue(roomId);
    }

    @Transactional(readOnly = true)
    public List<ChatContextLink> linkHistory(UUID roomId) {
        return linkRepository.findByRoomIdOrderByCreatedAtDesc(roomId);
    }

    @Transactional(readOnly = true)
    public ChatContextLink getLink(UUID linkId) {
        return linkRepository.findById(linkId)
                .orElseThrow(() -> new NotFoundException("LINK_NOT_FOUND", "Context link not found: " + linkId));
    }

    public void requireContextExists(ContextType contextType, UUID contextId) {
        boolean exists;
        try {
            exists = contextDirectory.contextExists(contextType, contextId);
        } catch (RuntimeException e) {
            throw new DependencyUnavailableException("context-directory", e);
        }
        if (!exists) {
            throw new ValidationException("CONTEXT_NOT_FOUND",
                    "No " + contextType.wireValue() + " context " + contextId);
        }
    }

    public boolean contextActive(ContextType contextType, UUID contextId) {
        try {
            return contextDirectory.contextActive(contextType, contextId);
        } catch (RuntimeException e) {
            throw new DependencyUnavailableException("context-directory", e);
        }
    }

    private Optional<UUID> deactivateAndClose(ChatContextLink link, String reason, Instant now) {
        try {
            return tx.execute(() -> {
                if (linkRepository.deactivateIfActive(link.getId(), reason, now) == 0) {
                    return Optional.<UUID>empty();
                }
                boolean closed = roomService.closeIfLive(link.getRoomId(), PlatformActors.SYSTEM, reason);
                return closed ? Optional.of(link.getRoomId()) : Optional.<UUID>empty();
            });
        } catch (RuntimeException e) {
            log.warn("Failed to deactivate context link {}: {}", link.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private static ConflictException linkExists(UUID roomId) {
        return new ConflictException("LINK_EXISTS", "Room " + roomId + " already has an active context link");
    }
}
