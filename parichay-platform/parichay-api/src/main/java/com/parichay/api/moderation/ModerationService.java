package com.parichay.api.moderation;

import com.parichay.api.block.BlockService;
import com.parichay.api.message.MessageService;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatReport;
import com.parichay.core.domain.ChatReport.ActionTaken;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ModerationLog;
import com.parichay.core.domain.ModerationLog.AppealDecision;
import com.parichay.core.domain.ModerationLog.Entry;
import com.parichay.core.domain.ModerationLog.ModerationAction;
import com.parichay.core.domain.ModerationLog.TargetType;
import com.parichay.core.domain.PlatformActors;
import com.parichay.core.domain.UserBlock.BlockType;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Admin command surface. Each command changes the owning store and appends its ledger
 * entry in one transaction. Strike-bearing commands are followed by an escalation check
 * in a separate transaction; an escalation it triggers is not evaluated again.
 */
@Service
public class ModerationService {

    private static final Logger log = LoggerFactory.getLogger(ModerationService.class);

    private final ModerationLedgerService ledger;
    private final ChatRoomService roomService;
    private final MessageService messageService;
    private final BlockService blockService;
    private final TransactionRetryExecutor tx;

    public ModerationService(
            ModerationLedgerService ledger,
            ChatRoomService roomService,
            MessageService messageService,
            BlockService blockService,
            TransactionRetryExecutor tx) {
        this.ledger = ledger;
        this.roomService = roomService;
        this.messageService = messageService;
        this.blockService = blockService;
        this.tx = tx;
    }

    // ==================== Messages ====================

    public ModerationLog hideMessage(UUID adminId, UUID messageId, String reason) {
        return removeMessage(adminId, messageId, ModerationAction.MESSAGE_HIDE, reason);
    }

    public ModerationLog deleteMessage(UUID adminId, UUID messageId, String reason) {
        return removeMessage(adminId, messageId, ModerationAction.MESSAGE_DELETE, reason);
    }

    public ModerationLog removeContent(UUID adminId, UUID messageId, String reason) {
        return removeMessage(adminId, messageId, ModerationAction.CONTENT_REMOVE, reason);
    }

    private ModerationLog removeMessage(UUID adminId, UUID messageId, ModerationAction action, String reason) {
        requireReason(reason);
        return recordAndEscalate(() -> {
            ChatMessage message = messageService.moderatorRemove(messageId, adminId);
            return ledger.recordAction(Entry.of(adminId, TargetType.MESSAGE, messageId, action, reason)
                    .withRoom(message.getRoomId())
                    .withMessage(messageId));
        });
    }

    // ==================== Users ====================

    public ModerationLog warnUser(UUID adminId, UUID userId, String reason) {
        requireReason(reason);
        return recordAndEscalate(() ->
                ledger.recordAction(Entry.of(adminId, TargetType.USER, userId, ModerationAction.USER_WARN, reason)));
    }

    public ModerationLog banUserTemporarily(UUID adminId, UUID userId, int durationMinutes, String reason) {
        requireReason(reason);
        if (durationMinutes <= 0) {
            throw new ValidationException("INVALID_DURATION", "Ban duration must be positive");
        }
        return recordAndEscalate(() -> {
            blockService.adminBlock(adminId, userId, durationMinutes, reason);
            return ledger.recordAction(Entry.of(adminId, TargetType.USER, userId, ModerationAction.USER_BAN, reason)
                    .withDuration(durationMinutes));
        });
    }

    /**
     * Permanent platform ban. Every open room of the user is closed as well.
     */
    public ModerationLog banUserPermanently(UUID adminId, UUID userId, String reason) {
        requireReason(reason);
        return recordAndEscalate(() -> banPermanently(adminId, userId, reason, null));
    }

    public ModerationLog unbanUser(UUID adminId, UUID userId, String reason) {
        requireReason(reason);
        return tx.execute(() -> {
            if (!blockService.liftPlatformBans(userId, adminId)) {
                throw new ConflictException("NOT_BANNED", "User " + userId + " has no active platform ban");
            }
            return ledger.recordAction(Entry.of(adminId, TargetType.USER, userId, ModerationAction.USER_UNBAN, reason));
        });
    }

    // ==================== Rooms ====================

    public ModerationLog warnInRoom(UUID adminId, UUID roomId, UUID offenderId, String reason) {
        requireReason(reason);
        return recordAndEscalate(() -> {
            requireOffender(roomService.getRoom(roomId), offenderId);
            return ledger.recordAction(Entry.of(adminId, TargetType.CHAT_ROOM, roomId, ModerationAction.CHAT_WARNING, reason)
                    .withRoom(roomId)
                    .withOffender(offenderId));
        });
    }

    /**
     * Mutes the room on behalf of the moderator. The strike goes to {@code offenderId}
     * when one is named.
     */
    public ModerationLog muteRoom(UUID adminId, UUID roomId, UUID offenderId, Integer durationMinutes, String reason) {
        requireReason(reason);
        return recordAndEscalate(() -> muteRoomFor(adminId, roomId, offenderId, durationMinutes, reason, null));
    }

    public ModerationLog closeRoom(UUID adminId, UUID roomId, String reason) {
        requireReason(reason);
        return tx.execute(() -> {
            roomService.closeRoom(roomId, adminId, reason);
            return ledger.recordAction(Entry.of(adminId, TargetType.CHAT_ROOM, roomId, ModerationAction.CHAT_CLOSE, reason)
                    .withRoom(roomId));
        });
    }

    // ==================== Reports ====================

    /**
     * Applies the action chosen when resolving a report and appends exactly one ledger
     * entry for it. Runs inside the caller's transaction; the caller runs
     * {@link #escalateIfNeeded} after committing.
     */
    public ModerationLog applyReportAction(UUID adminId, ChatReport report, ActionTaken action, String notes) {
        String reason = "report " + report.getId() + ": " + report.getReportType().wireValue();
        UUID offender = report.getReportedUserId();
        return tx.execute(() -> switch (action) {
            case WARNING -> ledger.recordAction(
                    Entry.of(adminId, TargetType.USER, offender, ModerationAction.USER_WARN, reason)
                            .withNotes(notes)
                            .withReport(report.getId())
                            .withRoom(report.getRoomId()));
            case MUTE -> muteRoomFor(adminId, report.getRoomId(), offender, null, reason, report.getId());
            case BAN -> banPermanently(adminId, offender, reason, report.getId());
            case NONE -> throw new IllegalArgumentException("Report action none has no ledger effect");
        });
    }

    /**
     * Non-strike bookkeeping entry for a report decision (resolve without action,
     * dismiss, legal escalation).
     */
    public ModerationLog recordReportDecision(UUID adminId, ChatReport report, ModerationAction action, String notes) {
        if (action != ModerationAction.REPORT_RESOLVE && action != ModerationAction.REPORT_DISMISS
                && action != ModerationAction.REPORT_ESCALATE) {
            throw new IllegalArgumentException("Not a report decision: " + action);
        }
        String reason = action.wireValue() + ": " + report.getReportType().wireValue();
        return ledger.recordAction(Entry.of(adminId, TargetType.CHAT_ROOM, report.getRoomId(), action, reason)
                .withNotes(notes)
                .withReport(report.getId())
                .withRoom(report.getRoomId())
                .withMessage(report.getMessageId()));
    }

    // ==================== Appeals & escalation ====================

    /**
     * Decides an appeal and, when it is overturned, applies the reversal in the same
     * transaction.
     */
    public AppealOutcome decideAppeal(UUID reviewerId, UUID logId, AppealDecision decision) {
        return tx.execute(() -> {
            AppealOutcome outcome = ledger.decideAppeal(logId, reviewerId, decision);
            outcome.reversal().ifPresent(intent -> applyReversal(intent, reviewerId));
            return outcome;
        });
    }

    public void escalateIfNeeded(ModerationLog entry) {
        if (entry == null || !entry.isStrikeBearing() || entry.getSubjectUserId() == null) {
            return;
        }
        applyEscalation(entry.getSubjectUserId());
    }

    /**
     * Re-evaluates the user's history under the strike lock and applies the automatic
     * platform mute when the policy asks for one.
     */
    public Optional<ModerationLog> applyEscalation(UUID userId) {
        return tx.execute(() -> ledger.evaluateEscalationLocked(userId).map(decision -> {
            blockService.platformBan(PlatformActors.SYSTEM, userId, BlockType.AUTOMATIC,
                    decision.durationMinutes(), decision.reason());
            ModerationLog entry = ledger.recordAction(
                    Entry.of(PlatformActors.SYSTEM, TargetType.USER, userId, decision.action(), decision.reason())
                            .withDuration(decision.durationMinutes()));
            log.info("User {} automatically muted for {} minutes after {} strikes", userId,
                    decision.durationMinutes(), decision.effectiveStrikes());
            return entry;
        }));
    }

    private void applyReversal(ReversalIntent intent, UUID reviewerId) {
        switch (intent.kind()) {
            case LIFT_PLATFORM_BAN -> blockService.liftPlatformBans(intent.userId(), reviewerId);
            case UNMUTE_ROOM -> roomService.unmuteByModerator(intent.roomId());
            case RESTORE_MESSAGE -> messageService.restoreMessage(intent.messageId());
        }
        log.info("Reversed moderation action {} ({})", intent.logId(), intent.kind());
    }

    private ModerationLog muteRoomFor(UUID adminId, UUID roomId, UUID offenderId, Integer durationMinutes,
                                      String reason, UUID reportId) {
        if (durationMinutes != null && durationMinutes <= 0) {
            throw new ValidationException("INVALID_DURATION", "Duration must be positive");
        }
        if (offenderId != null) {
            requireOffender(roomService.getRoom(roomId), offenderId);
        }
        if (!roomService.muteByModerator(roomId, adminId, durationMinutes)) {
            log.info("Room {} not muted by {}: it is not active", roomId, adminId);
        }
        return ledger.recordAction(Entry.of(adminId, TargetType.CHAT_ROOM, roomId, ModerationAction.CHAT_MUTE, reason)
                .withDuration(durationMinutes)
                .withRoom(roomId)
                .withReport(reportId)
                .withOffender(offenderId));
    }

    private ModerationLog banPermanently(UUID adminId, UUID userId, String reason, UUID reportId) {
        blockService.adminBlock(adminId, userId, null, reason);
        roomService.closeAllRoomsOf(userId, adminId, reason);
        return ledger.recordAction(Entry.of(adminId, TargetType.USER, userId, ModerationAction.USER_BAN, reason)
                .withReport(reportId));
    }

    private ModerationLog recordAndEscalate(Supplier<ModerationLog> command) {
        ModerationLog entry = tx.execute(command);
        escalateIfNeeded(entry);
        return entry;
    }

    private static void requireOffender(ChatRoom room, UUID offenderId) {
        if (offenderId == null || !room.isParticipant(offenderId)) {
            throw new ValidationException("OFFENDER_NOT_PARTICIPANT",
                    "Offender must be a participant of room " + room.getId());
        }
    }

    private static void requireReason(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("REASON_REQUIRED", "A moderation reason is required");
        }
    }
}
