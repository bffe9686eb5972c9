package com.parichay.api.message;

import com.parichay.api.block.BlockService;
import com.parichay.api.context.ContextLinkService;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.safety.ContentSafetyScanner;
import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatMessage.MessageType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.domain.SafetyFlags;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.NotFoundException;
import com.parichay.core.error.ValidationException;
import com.parichay.core.repository.ChatMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Message pipeline: permission checks, content scan, persistence and room counters.
 *
 * The message insert and the room counter update commit together under the room row
 * lock. Flagging is advisory; flagged messages are still delivered.
 */
@Service
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final ChatMessageRepository messageRepository;
    private final ChatRoomService roomService;
    private final BlockService blockService;
    private final ContextLinkService contextLinkService;
    private final ContentSafetyScanner scanner;
    private final TransactionRetryExecutor tx;
    private final Clock clock;
    private final int maxLength;

    public MessageService(
            ChatMessageRepository messageRepository,
            ChatRoomService roomService,
            BlockService blockService,
            ContextLinkService contextLinkService,
            ContentSafetyScanner scanner,
            TransactionRetryExecutor tx,
            Clock clock,
            @Value("${parichay.message.max-length:5000}") int maxLength) {
        this.messageRepository = messageRepository;
        this.roomService = roomService;
        this.blockService = blockService;
        this.contextLinkService = contextLinkService;
        this.scanner = scanner;
        this.tx = tx;
        this.clock = clock;
        this.maxLength = maxLength;
    }

    // ==================== Sending ====================

    public ChatMessage sendMessage(UUID roomId, UUID senderId, MessageType type, String content, UUID replyToId) {
        ChatRoom snapshot = roomService.getRoom(roomId);
        UUID recipient = snapshot.otherParticipant(senderId);
        if (blockService.blockedEitherWay(senderId, recipient) || blockService.isBanned(senderId)) {
            throw new ForbiddenException("MESSAGING_BLOCKED", "User " + senderId + " cannot message " + recipient);
        }
        if (contextLinkService.isAwaitingApproval(roomId)) {
            throw new ForbiddenException("AWAITING_APPROVAL", "Room " + roomId + " is waiting for context approval");
        }
        String body = validateContent(content);
        SafetyFlags flags = scanner.scan(body);
        MessageType messageType = type == null ? MessageType.TEXT : type;

        ChatMessage saved = tx.execute(() -> {
            ChatRoom room = roomService.lockForUpdate(roomId);
            requireSendable(room, senderId);
            if (replyToId != null) {
                requireReplyTarget(roomId, replyToId);
            }
            ChatMessage message = ChatMessage.compose(roomId, senderId, messageType, body, replyToId,
                    flags, clock.instant());
            message = messageRepository.save(message);
            roomService.recordMessage(roomId, senderId, message.getId(), message.getSentAt());
            return message;
        });
        if (saved.isFlagged()) {
            log.info("Message {} in room {} flagged: {}", saved.getId(), roomId, saved.getFlaggedReason());
        }
        return saved;
    }

    // ==================== Sender actions ====================

    /**
     * Sender recall. No time window; the content stays stored for moderation.
     */
    public ChatMessage retractMessage(UUID messageId, UUID actor) {
        return tx.execute(() -> {
            ChatMessage message = findMessage(messageId);
            message.retract(actor);
            return message;
        });
    }

    public ChatMessage hideMessage(UUID messageId, UUID actor) {
        return tx.execute(() -> {
            ChatMessage message = findMessage(messageId);
            message.hideForSender(actor);
            return message;
        });
    }

    public ChatMessage editMessage(UUID messageId, UUID actor, String content) {
        String body = validateContent(content);
        SafetyFlags flags = scanner.scan(body);
        return tx.execute(() -> {
            ChatMessage message = findMessage(messageId);
            message.edit(actor, body, flags, clock.instant());
            return message;
        });
    }

    /**
     * Moderator delete removes the message for everyone. A sender deleting their own
     * message without moderator rights recalls and hides it.
     */
    public ChatMessage deleteMessage(UUID messageId, UUID actor, boolean byModerator) {
        if (byModerator) {
            return moderatorRemove(messageId, actor);
        }
        return tx.execute(() -> {
            ChatMessage message = findMessage(messageId);
            if (!message.isSentBy(actor)) {
                throw new ForbiddenException("NOT_SENDER", "Only the sender or a moderator may delete message " + messageId);
            }
            message.retract(actor);
            message.hideForSender(actor);
            return message;
        });
    }

    // ==================== Moderation ====================

    public ChatMessage moderatorRemove(UUID messageId, UUID moderator) {
        return tx.execute(() -> {
            ChatMessage message = findMessage(messageId);
            message.removeByModerator(moderator, clock.instant());
            log.info("Message {} removed by moderator {}", messageId, moderator);
            return message;
        });
    }

    public ChatMessage restoreMessage(UUID messageId) {
        return tx.execute(() -> {
            ChatMessage message = findMessage(messageId);
            message.restore();
            log.info("Message {} restored", messageId);
            return message;
        });
    }

    public ChatMessage flagMessage(UUID messageId, UUID adminId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("REASON_REQUIRED", "A flag reason is required");
        }
        return tx.execute(() -> {
            ChatMessage message = findMessage(messageId);
            message.flagByAdmin(reason);
            log.info("Message {} flagged by admin {}", messageId, adminId);
            return message;
        });
    }

    public void incrementReportCount(UUID messageId) {
        tx.run(() -> findMessage(messageId).incrementReportCount());
    }

    // ==================== Reads ====================

    /**
     * Newest-first page of the room as the viewer sees it. Reading the timeline marks the
     * other participant's messages as read.
     */
    public List<MessageView> timeline(UUID roomId, UUID viewer, int page, int size) {
        roomService.getRoomForParticipant(roomId, viewer);
        List<MessageView> views = messageRepository.findTimeline(roomId, viewer, PageRequest.of(page, size))
                .stream()
                .map(MessageView::of)
                .toList();
        roomService.markRead(roomId, viewer);
        return views;
    }

    @Transactional(readOnly = true)
    public ChatMessage getMessage(UUID messageId) {
        return findMessage(messageId);
    }

    /**
     * Full message including retracted and removed content, for moderators only.
     */
    @Transactional(readOnly = true)
    public ChatMessage moderationView(UUID messageId) {
        return findMessage(messageId);
    }

    @Transactional(readOnly = true)
    public Page<ChatMessage> flaggedMessages(int page, int size) {
        return messageRepository.findByFlaggedTrueAndDeletedFalseOrderBySentAtDesc(PageRequest.of(page, size));
    }

    @Transactional(readOnly = true)
    public List<ChatMessage> suspiciousMessages(UUID roomId) {
        return messageRepository.findByRoomIdAndFlaggedTrueOrderBySentAtDesc(roomId);
    }

    @Transactional(readOnly = true)
    public List<ChatMessage> recentMessages(UUID roomId) {
        return messageRepository.findTop10ByRoomIdOrderBySentAtDesc(roomId);
    }

    @Transactional(readOnly = true)
    public long countFlagged() {
        return messageRepository.countByFlaggedTrueAndDeletedFalse();
    }

    private ChatMessage findMessage(UUID messageId) {
        return messageRepository.findById(messageId)
                .orElseThrow(() -> new NotFoundException("MESSAGE_NOT_FOUND", "Message not found: " + messageId));
    }

    private void requireSendable(ChatRoom room, UUID senderId) {
        room.requireParticipant(senderId);
        if (room.getStatus() == RoomStatus.CLOSED) {
            throw new ForbiddenException("ROOM_CLOSED", "Room " + room.getId() + " is closed");
        }
        if (room.underlyingStatus() == RoomStatus.BLOCKED) {
            throw new ForbiddenException("ROOM_BLOCKED", "Room " + room.getId() + " is blocked");
        }
    }

    private void requireReplyTarget(UUID roomId, UUID replyToId) {
        ChatMessage target = messageRepository.findById(replyToId)
                .orElseThrow(() -> new ValidationException("INVALID_REPLY", "Reply target not found: " + replyToId));
        if (!target.getRoomId().equals(roomId)) {
            throw new ValidationException("INVALID_REPLY", "Reply target belongs to another room");
        }
    }

    private String validateContent(String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("EMPTY_CONTENT", "Message content is required");
        }
        if (content.length() > maxLength) {
            throw new ValidationException("CONTENT_TOO_LONG", "Message content exceeds " + maxLength + " characters");
        }
        return content;
    }

    /**
     * Timeline entry. Retracted messages are rendered without content.
     */
    public record MessageView(
            UUID id,
            UUID roomId,
            UUID senderId,
            MessageType messageType,
            String content,
            UUID replyToId,
            boolean flagged,
            boolean retracted,
            Instant sentAt,
            Instant readAt,
            Instant editedAt
    ) {
        static MessageView of(ChatMessage message) {
            return new MessageView(
                    message.getId(),
                    message.getRoomId(),
                    message.getSenderId(),
                    message.getMessageType(),
                    message.isRetracted() ? null : message.getContent(),
                    message.getReplyToId(),
                    message.isFlagged(),
                    message.isRetracted(),
                    message.getSentAt(),
                    message.getReadAt(),
                    message.getEditedAt());
        }
    }
}
