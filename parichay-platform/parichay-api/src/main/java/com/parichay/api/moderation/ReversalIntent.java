package com.parichay.api.moderation;

import com.parichay.core.domain.ModerationLog;
import com.parichay.core.domain.ModerationLog.TargetType;

import java.util.Optional;
import java.util.UUID;

/**
 * What has to be undone after an appeal against a ledger entry was overturned.
 * The ledger only describes the reversal; the owning store applies it.
 */
public record ReversalIntent(Kind kind, UUID logId, UUID userId, UUID roomId, UUID messageId) {

    public enum Kind {
        LIFT_PLATFORM_BAN,
        UNMUTE_ROOM,
        RESTORE_MESSAGE
    }

    public static Optional<ReversalIntent> forOverturned(ModerationLog entry) {
        if (!entry.isOverturned()) {
            return Optional.empty();
        }
        return switch (entry.getAction()) {
            case USER_BAN, USER_MUTE -> Optional.of(new ReversalIntent(
                    Kind.LIFT_PLATFORM_BAN, entry.getId(), entry.getSubjectUserId(), null, null));
            case CHAT_MUTE -> entry.getTargetType() == TargetType.CHAT_ROOM
                    ? Optional.of(new ReversalIntent(Kind.UNMUTE_ROOM, entry.getId(), null, entry.getTargetId(), null))
                    : Optional.empty();
            case MESSAGE_DELETE, MESSAGE_HIDE, CONTENT_REMOVE -> entry.getTargetType() == TargetType.MESSAGE
                    ? Optional.of(new ReversalIntent(Kind.RESTORE_MESSAGE, entry.getId(), null,
                            entry.getRelatedRoomId(), entry.getTargetId()))
                    : Optional.empty();
            default -> Optional.empty();
        };
    }
}
