package com.parichay.api.context;

import com.parichay.api.block.BlockService;
import com.parichay.api.message.MessageService;
import com.parichay.api.room.ChatRoomService;
import com.parichay.core.domain.ChatContextLink;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatMessage.MessageType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ContextType;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for starting a conversation from a context page (interest accepted,
 * candidate shortlisted, business inquiry).
 *
 * Each step commits on its own: a failure while sending the first message leaves the
 * room and link in place, and calling again continues from there.
 */
@Service
public class ChatInitiationService {

    private static final Logger log = LoggerFactory.getLogger(ChatInitiationService.class);

    private final ChatRoomService roomService;
    private final BlockService blockService;
    private final ContextLinkService contextLinkService;
    private final MessageService messageService;

    public ChatInitiationService(
            ChatRoomService roomService,
            BlockService blockService,
            ContextLinkService contextLinkService,
            MessageService messageService) {
        this.roomService = roomService;
        this.blockService = blockService;
        this.contextLinkService = contextLinkService;
        this.messageService = messageService;
    }

    public InitiationResult initiateChat(UUID initiator, UUID otherUser, ContextType contextType,
                                         UUID contextId, String initialMessage) {
        if (contextType == null) {
            throw new ValidationException("CONTEXT_REQUIRED", "Context type is required");
        }
        if (initiator.equals(otherUser)) {
            throw new ValidationException("SELF_CHAT", "A user cannot open a chat with themselves");
        }
        if (contextId != null) {
            contextLinkService.requireContextExists(contextType, contextId);
            if (!contextLinkService.contextActive(contextType, contextId)) {
                throw new ConflictException("CONTEXT_INACTIVE",
                        "Context " + contextId + " no longer accepts conversations");
            }
        }
        if (blockService.blockedEitherWay(initiator, otherUser) || blockService.isBanned(initiator)) {
            throw new ForbiddenException("MESSAGING_BLOCKED", "User " + initiator + " cannot message " + otherUser);
        }

        boolean created = roomService.findRoom(initiator, otherUser, contextType, contextId).isEmpty();
        ChatRoom room = roomService.getOrCreateRoom(initiator, otherUser, contextType, contextId);

        ChatContextLink link = null;
        if (contextId != null) {
            link = ensureLink(room, contextType, contextId);
        }

        ChatMessage message = null;
        if (initialMessage != null && !initialMessage.isBlank()) {
            message = messageService.sendMessage(room.getId(), initiator, MessageType.TEXT, initialMessage, null);
        }
        log.info("User {} initiated {} chat {} (new: {})", initiator, contextType.wireValue(), room.getId(), created);
        return new InitiationResult(room.getId(), created, link == null ? null : link.getId(),
                message == null ? null : message.getId());
    }

    private ChatContextLink ensureLink(ChatRoom room, ContextType contextType, UUID contextId) {
        Optional<ChatContextLink> existing = contextLinkService.activeLink(room.getId());
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            return contextLinkService.linkContext(room.getId(), contextType, contextId,
                    initiatedFrom(contextType), false, null);
        } catch (ConflictException e) {
            if (!"LINK_EXISTS".equals(e.getCode())) {
                throw e;
            }
            return contextLinkService.activeLink(room.getId()).orElseThrow(() -> e);
        }
    }

    static String initiatedFrom(ContextType contextType) {
        return switch (contextType) {
            case MARRIAGE -> "marriage_interest";
            case JOB -> "job_shortlist";
            case BUSINESS -> "business_inquiry";
            case HELP -> "help_request";
            case GENERAL -> "direct";
        };
    }

    public record InitiationResult(UUID roomId, boolean created, UUID contextLinkId, UUID messageId) {}
}
