package com.parichay.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Append-only record of one moderation action.
 *
 * The entry itself never changes after insert except for its appeal fields.
 * {@code userStrikeCount} is the subject's running strike total after this entry.
 */
@Entity
@Table(name = "chat_moderation_logs", indexes = {
    @Index(name = "idx_moderation_logs_subject", columnList = "subject_user_id, created_at"),
    @Index(name = "idx_moderation_logs_target", columnList = "target_type, target_id"),
    @Index(name = "idx_moderation_logs_admin", columnList = "admin_id, created_at"),
    @Index(name = "idx_moderation_logs_appeal", columnList = "appeal_decision")
})
public class ModerationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "admin_id", nullable = false, updatable = false)
    private UUID adminId;

    @NotNull
    @Convert(converter = TargetType.JpaConverter.class)
    @Column(name = "target_type", nullable = false, length = 20, updatable = false)
    private TargetType targetType;

    @NotNull
    @Column(name = "target_id", nullable = false, updatable = false)
    private UUID targetId;

    @NotNull
    @Convert(converter = ModerationAction.JpaConverter.class)
    @Column(nullable = false, length = 30, updatable = false)
    private ModerationAction action;

    @NotNull
    @Column(nullable = false, length = 1000, updatable = false)
    private String reason;

    @Column(name = "duration_minutes", updatable = false)
    private Integer durationMinutes;

    @Column(length = 2000, updatable = false)
    private String notes;

    @Column(name = "related_report_id", updatable = false)
    private UUID relatedReportId;

    @Column(name = "related_room_id", updatable = false)
    private UUID relatedRoomId;

    @Column(name = "related_message_id", updatable = false)
    private UUID relatedMessageId;

    @Column(name = "subject_user_id", updatable = false)
    private UUID subjectUserId;

    @Column(name = "strike_bearing", nullable = false, updatable = false)
    private boolean strikeBearing;

    @Column(name = "user_strike_count", nullable = false, updatable = false)
    private int userStrikeCount;

    @Column(name = "appeal_allowed", nullable = false, updatable = false)
    private boolean appealAllowed;

    @Column(name = "appeal_deadline", updatable = false)
    private Instant appealDeadline;

    @Column(name = "appealed_at")
    private Instant appealedAt;

    @Column(name = "appeal_reason", length = 2000)
    private String appealReason;

    @Convert(converter = AppealDecision.JpaConverter.class)
    @Column(name = "appeal_decision", length = 20)
    private AppealDecision appealDecision;

    @Column(name = "appeal_reviewed_by")
    private UUID appealReviewedBy;

    @Column(name = "appeal_decided_at")
    private Instant appealDecidedAt;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected ModerationLog() {}

    public static ModerationLog record(Entry entry, UUID subjectUserId, int userStrikeCount,
                                       Instant appealDeadline, Instant now) {
        if (entry.reason() == null || entry.reason().isBlank()) {
            throw new ValidationException("REASON_REQUIRED", "A moderation reason is required");
        }
        if (entry.durationMinutes() != null && entry.durationMinutes() <= 0) {
            throw new ValidationException("INVALID_DURATION", "Duration must be positive");
        }
        var log = new ModerationLog();
        log.adminId = entry.adminId();
        log.targetType = entry.targetType();
        log.targetId = entry.targetId();
        log.action = entry.action();
        log.reason = entry.reason();
        log.durationMinutes = entry.durationMinutes();
        log.notes = entry.notes();
        log.relatedReportId = entry.relatedReportId();
        log.relatedRoomId = entry.relatedRoomId();
        log.relatedMessageId = entry.relatedMessageId();
        log.subjectUserId = subjectUserId;
        log.strikeBearing = subjectUserId != null && entry.action().isStrikeBearing();
        log.userStrikeCount = userStrikeCount;
        log.appealAllowed = log.strikeBearing && appealDeadline != null;
        log.appealDeadline = log.appealAllowed ? appealDeadline : null;
        log.createdAt = now;
        return log;
    }

    public void fileAppeal(UUID userId, String appealReason, Instant now) {
        if (subjectUserId == null || !subjectUserId.equals(userId)) {
            throw new ForbiddenException("NOT_SUBJECT", "Only the affected user may appeal moderation action " + id);
        }
        if (appealDecision != null) {
            throw new ConflictException("ALREADY_APPEALED", "Moderation action " + id + " was already appealed");
        }
        if (!appealAllowed || appealDeadline == null || now.isAfter(appealDeadline)) {
            throw new ConflictException("APPEAL_WINDOW_CLOSED", "Appeal window for moderation action " + id + " is closed");
        }
        this.appealedAt = now;
        this.appealReason = appealReason;
        this.appealDecision = AppealDecision.PENDING;
    }

    public void decideAppeal(UUID reviewer, AppealDecision decision, Instant now) {
        if (decision == null || decision == AppealDecision.PENDING) {
            throw new ValidationException("INVALID_DECISION", "Appeal decision must be upheld or overturned");
        }
        if (appealDecision != AppealDecision.PENDING) {
            throw new ConflictException(appealDecision == null ? "NO_PENDING_APPEAL" : "APPEAL_ALREADY_DECIDED",
                    "Moderation action " + id + " has no pending appeal");
        }
        this.appealDecision = decision;
        this.appealReviewedBy = reviewer;
        this.appealDecidedAt = now;
    }

    public boolean isOverturned() {
        return appealDecision == AppealDecision.OVERTURNED;
    }

    /**
     * Strike-bearing and not overturned on appeal.
     */
    public boolean countsAsStrike() {
        return strikeBearing && !isOverturned();
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getAdminId() { return adminId; }
    public TargetType getTargetType() { return targetType; }
    public UUID getTargetId() { return targetId; }
    public ModerationAction getAction() { return action; }
    public String getReason() { return reason; }
    public Integer getDurationMinutes() { return durationMinutes; }
    public String getNotes() { return notes; }
    public UUID getRelatedReportId() { return relatedReportId; }
    public UUID getRelatedRoomId() { return relatedRoomId; }
    public UUID getRelatedMessageId() { return relatedMessageId; }
    public UUID getSubjectUserId() { return subjectUserId; }
    public boolean isStrikeBearing() { return strikeBearing; }
    public int getUserStrikeCount() { return userStrikeCount; }
    public boolean isAppealAllowed() { return appealAllowed; }
    public Instant getAppealDeadline() { return appealDeadline; }
    public Instant getAppealedAt() { return appealedAt; }
    public String getAppealReason() { return appealReason; }
    public AppealDecision getAppealDecision() { return appealDecision; }
    public UUID getAppealReviewedBy() { return appealReviewedBy; }
    public Instant getAppealDecidedAt() { return appealDecidedAt; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Immutable input of a ledger write.
     */
    public record Entry(
            UUID adminId,
            TargetType targetType,
            UUID targetId,
            ModerationAction action,
            String reason,
            Integer durationMinutes,
            String notes,
            UUID relatedReportId,
            UUID relatedRoomId,
            UUID relatedMessageId,
            UUID offenderId
    ) {
        public Entry {
            if (adminId == null || targetType == null || targetId == null || action == null) {
                throw new IllegalArgumentException("Admin, target and action are required");
            }
        }

        public static Entry of(UUID adminId, TargetType targetType, UUID targetId,
                               ModerationAction action, String reason) {
            return new Entry(adminId, targetType, targetId, action, reason, null, null, null, null, null, null);
        }

        public Entry withDuration(Integer minutes) {
            return new Entry(adminId, targetType, targetId, action, reason, minutes, notes,
                    relatedReportId, relatedRoomId, relatedMessageId, offenderId);
        }

        public Entry withNotes(String value) {
            return new Entry(adminId, targetType, targetId, action, reason, durationMinutes, value,
                    relatedReportId, relatedRoomId, relatedMessageId, offenderId);
        }

        public Entry withReport(UUID reportId) {
            return new Entry(adminId, targetType, targetId, action, reason, durationMinutes, notes,
                    reportId, relatedRoomId, relatedMessageId, offenderId);
        }

        public Entry withRoom(UUID roomId) {
            return new Entry(adminId, targetType, targetId, action, reason, durationMinutes, notes,
                    relatedReportId, roomId, relatedMessageId, offenderId);
        }

        public Entry withMessage(UUID messageId) {
            return new Entry(adminId, targetType, targetId, action, reason, durationMinutes, notes,
                    relatedReportId, relatedRoomId, messageId, offenderId);
        }

        public Entry withOffender(UUID userId) {
            return new Entry(adminId, targetType, targetId, action, reason, durationMinutes, notes,
                    relatedReportId, relatedRoomId, relatedMessageId, userId);
        }
    }

    public enum TargetType implements WireEnum {
        CHAT_ROOM("chat_room"),
        MESSAGE("message"),
        USER("user");

        private final String wireValue;

        TargetType(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static TargetType fromWire(String value) {
            return WireEnum.fromWire(TargetType.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<TargetType> {
            public JpaConverter() {
                super(TargetType.class);
            }
        }
    }

    public enum ModerationAction implements WireEnum {
        CHAT_WARNING("chat_warning"),
        CHAT_MUTE("chat_mute"),
        CHAT_CLOSE("chat_close"),
        MESSAGE_DELETE("message_delete"),
        MESSAGE_HIDE("message_hide"),
        USER_WARN("user_warn"),
        USER_MUTE("user_mute"),
        USER_BAN("user_ban"),
        USER_UNBAN("user_unban"),
        CONTENT_REMOVE("content_remove"),
        REPORT_RESOLVE("report_resolve"),
        REPORT_DISMISS("report_dismiss"),
        REPORT_ESCALATE("report_escalate");

        private static final Set<ModerationAction> STRIKE_BEARING = EnumSet.of(
                CHAT_WARNING, CHAT_MUTE, MESSAGE_DELETE, MESSAGE_HIDE,
                CONTENT_REMOVE, USER_WARN, USER_MUTE, USER_BAN);

        private final String wireValue;

        ModerationAction(String wireValue) {
            this.wireValue = wireValue;
        }

        public static Set<ModerationAction> strikeBearing() {
            return EnumSet.copyOf(STRIKE_BEARING);
        }

        public boolean isStrikeBearing() {
            return STRIKE_BEARING.contains(this);
        }

        /**
         * Actions that put a platform-level restriction on the subject user.
         */
        public boolean isBan() {
            return this == USER_BAN || this == USER_MUTE;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static ModerationAction fromWire(String value) {
            return WireEnum.fromWire(ModerationAction.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<ModerationAction> {
            public JpaConverter() {
                super(ModerationAction.class);
            }
        }
    }

    public enum AppealDecision implements WireEnum {
        PENDING("pending"),
        UPHELD("upheld"),
        OVERTURNED("overturned");

        private final String wireValue;

        AppealDecision(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static AppealDecision fromWire(String value) {
            return WireEnum.fromWire(AppealDecision.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<AppealDecision> {
            public JpaConverter() {
                super(AppealDecision.class);
            }
        }
    }
}
