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
 * Abuse report against a room, optionally pinned to one message.
 *
 * Status only moves forward: pending -> investigating -> resolved | dismissed,
 * pending may also be closed directly.
 */
@Entity
@Table(name = "chat_reports", indexes = {
    @Index(name = "idx_chat_reports_status_created", columnList = "status, created_at"),
    @Index(name = "idx_chat_reports_room", columnList = "room_id, status"),
    @Index(name = "idx_chat_reports_reported_user", columnList = "reported_user_id"),
    @Index(name = "idx_chat_reports_reporter_room", columnList = "reporter_id, room_id, created_at")
})
public class ChatReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "room_id", nullable = false, updatable = false)
    private UUID roomId;

    @Column(name = "message_id", updatable = false)
    private UUID messageId;

    @NotNull
    @Column(name = "reporter_id", nullable = false, updatable = false)
    private UUID reporterId;

    @NotNull
    @Column(name = "reported_user_id", nullable = false, updatable = false)
    private UUID reportedUserId;

    @NotNull
    @Convert(converter = ReportType.JpaConverter.class)
    @Column(name = "report_type", nullable = false, length = 30)
    private ReportType reportType;

    @NotNull
    @Column(nullable = false, length = 2000)
    private String description;

    @Column(name = "screenshot_url", length = 500)
    private String screenshotUrl;

    @Convert(converter = EvidencePayloadConverter.class)
    @Column(length = 8000)
    private EvidencePayload evidence;

    @NotNull
    @Convert(converter = ReportStatus.JpaConverter.class)
    @Column(nullable = false, length = 20)
    private ReportStatus status;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "review_notes", length = 2000)
    private String reviewNotes;

    @Convert(converter = ActionTaken.JpaConverter.class)
    @Column(name = "action_taken", length = 20)
    private ActionTaken actionTaken;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "escalated_to_legal", nullable = false)
    private boolean escalatedToLegal;

    @Column(name = "legal_notes", length = 2000)
    private String legalNotes;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected ChatReport() {}

    public static ChatReport file(UUID roomId, UUID messageId, UUID reporterId, UUID reportedUserId,
                                  ReportType type, String description, EvidencePayload evidence,
                                  String screenshotUrl, Instant now) {
        if (roomId == null || reporterId == null || reportedUserId == null || type == null) {
            throw new IllegalArgumentException("Room, reporter, reported user and type are required");
        }
        if (reporterId.equals(reportedUserId)) {
            throw new ValidationException("SELF_REPORT", "A user cannot report themselves");
        }
        if (description == null || description.isBlank()) {
            throw new ValidationException("DESCRIPTION_REQUIRED", "Report description is required");
        }
        var report = new ChatReport();
        report.roomId = roomId;
        report.messageId = messageId;
        report.reporterId = reporterId;
        report.reportedUserId = reportedUserId;
        report.reportType = type;
        report.description = description.strip();
        report.evidence = evidence == null ? null : evidence.validated();
        report.screenshotUrl = screenshotUrl;
        report.status = ReportStatus.PENDING;
        report.actionTaken = ActionTaken.NONE;
        report.createdAt = now;
        report.updatedAt = now;
        return report;
    }

    public void startInvestigation(UUID reviewer, Instant now) {
        if (status != ReportStatus.PENDING) {
            throw new ConflictException(status.isFinal() ? "ALREADY_FINAL" : "INVALID_TRANSITION",
                    "Report " + id + " is " + status.wireValue());
        }
        status = ReportStatus.INVESTIGATING;
        reviewedBy = reviewer;
        updatedAt = now;
    }

    public void close(UUID reviewer, ReportStatus decision, ActionTaken action, String notes, Instant now) {
        if (decision == null || !decision.isFinal()) {
            throw new ValidationException("INVALID_DECISION", "Decision must be resolved or dismissed");
        }
        if (status.isFinal()) {
            throw new ConflictException("ALREADY_FINAL", "Report " + id + " is already " + status.wireValue());
        }
        ActionTaken effective = action == null ? ActionTaken.NONE : action;
        if (decision == ReportStatus.DISMISSED && effective != ActionTaken.NONE) {
            throw new ValidationException("INVALID_DECISION", "A dismissed report cannot carry an action");
        }
        status = decision;
        reviewedBy = reviewer;
        reviewNotes = notes;
        actionTaken = effective;
        resolvedAt = now;
        updatedAt = now;
    }

    public void escalateToLegal(String notes, Instant now) {
        escalatedToLegal = true;
        legalNotes = notes;
        updatedAt = now;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getRoomId() { return roomId; }
    public UUID getMessageId() { return messageId; }
    public UUID getReporterId() { return reporterId; }
    public UUID getReportedUserId() { return reportedUserId; }
    public ReportType getReportType() { return reportType; }
    public String getDescription() { return description; }
    public String getScreenshotUrl() { return screenshotUrl; }
    public EvidencePayload getEvidence() { return evidence; }
    public ReportStatus getStatus() { return status; }
    public UUID getReviewedBy() { return reviewedBy; }
    public String getReviewNotes() { return reviewNotes; }
    public ActionTaken getActionTaken() { return actionTaken; }
    public Instant getResolvedAt() { return resolvedAt; }
    public boolean isEscalatedToLegal() { return escalatedToLegal; }
    public String getLegalNotes() { return legalNotes; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public enum ReportType implements WireEnum {
        ABUSE("abuse"),
        HARASSMENT("harassment"),
        SCAM("scam"),
        HATE_SPEECH("hate_speech"),
        SEXUAL_CONTENT("sexual_content"),
        SPAM("spam"),
        FRAUD("fraud"),
        IMPERSONATION("impersonation"),
        OTHER("other");

        private final String wireValue;

        ReportType(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static ReportType fromWire(String value) {
            return WireEnum.fromWire(ReportType.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<ReportType> {
            public JpaConverter() {
                super(ReportType.class);
            }
        }
    }

    public enum ReportStatus implements WireEnum {
        PENDING("pending"),
        INVESTIGATING("investigating"),
        RESOLVED("resolved"),
        DISMISSED("dismissed");

        private final String wireValue;

        ReportStatus(String wireValue) {
            this.wireValue = wireValue;
        }

        public boolean isFinal() {
            return this == RESOLVED || this == DISMISSED;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static ReportStatus fromWire(String value) {
            return WireEnum.fromWire(ReportStatus.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<ReportStatus> {
            public JpaConverter() {
                super(ReportStatus.class);
            }
        }
    }

    public enum ActionTaken implements WireEnum {
        NONE("none"),
        WARNING("warning"),
        MUTE("mute"),
        BAN("ban");

        private final String wireValue;

        ActionTaken(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static ActionTaken fromWire(String value) {
            return WireEnum.fromWire(ActionTaken.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<ActionTaken> {
            public JpaConverter() {
                super(ActionTaken.class);
            }
        }
    }
}
