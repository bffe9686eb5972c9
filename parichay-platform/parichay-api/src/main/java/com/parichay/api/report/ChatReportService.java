package com.parichay.api.report;

import com.parichay.api.message.MessageService;
import com.parichay.api.moderation.ModerationService;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatReport;
import com.parichay.core.domain.ChatReport.ActionTaken;
import com.parichay.core.domain.ChatReport.ReportStatus;
import com.parichay.core.domain.ChatReport.ReportType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.EvidencePayload;
import com.parichay.core.domain.ModerationLog;
import com.parichay.core.domain.ModerationLog.ModerationAction;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.NotFoundException;
import com.parichay.core.error.ValidationException;
import com.parichay.core.repository.ChatReportRepository;
import com.parichay.core.repository.ChatReportRepository.TypeCount;
import com.parichay.core.repository.ChatReportRepository.UserReportCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Abuse report workflow: filing, review and closing.
 *
 * Filing puts the room under review. Closing the last open report of a room returns it
 * to the status it had before. A resolution with an action appends exactly one ledger
 * entry through {@link ModerationService}.
 */
@Service
public class ChatReportService {

    private static final Logger log = LoggerFactory.getLogger(ChatReportService.class);

    private static final Set<ReportStatus> OPEN = EnumSet.of(ReportStatus.PENDING, ReportStatus.INVESTIGATING);

    private final ChatReportRepository reportRepository;
    private final ChatRoomService roomService;
    private final MessageService messageService;
    private final ModerationService moderationService;
    private final TransactionRetryExecutor tx;
    private final Clock clock;
    private final Duration duplicateWindow;

    public ChatReportService(
            ChatReportRepository reportRepository,
            ChatRoomService roomService,
            MessageService messageService,
            ModerationService moderationService,
            TransactionRetryExecutor tx,
            Clock clock,
            @Value("${parichay.report.duplicate-window-hours:24}") int duplicateWindowHours) {
        this.reportRepository = reportRepository;
        this.roomService = roomService;
        this.messageService = messageService;
        this.moderationService = moderationService;
        this.tx = tx;
        this.clock = clock;
        this.duplicateWindow = Duration.ofHours(duplicateWindowHours);
    }

    public ChatReport fileReport(FileReportCommand command) {
        if (command.reporterId().equals(command.reportedUserId())) {
            throw new ValidationException("SELF_REPORT", "A user cannot report themselves");
        }
        return tx.execute(() -> {
            ChatRoom room = roomService.lockForUpdate(command.roomId());
            if (!room.otherParticipant(command.reporterId()).equals(command.reportedUserId())) {
                throw new ValidationException("REPORTED_NOT_PARTICIPANT",
                        "Reported user is not the other participant of room " + room.getId());
            }
            if (command.messageId() != null) {
                ChatMessage message = messageService.getMessage(command.messageId());
                if (!message.getRoomId().equals(room.getId())) {
                    throw new ValidationException("MESSAGE_NOT_IN_ROOM",
                            "Message " + command.messageId() + " does not belong to room " + room.getId());
                }
            }
            Instant now = clock.instant();
            long recent = reportRepository.countRecentByReporter(command.reporterId(), room.getId(),
                    now.minus(duplicateWindow), ReportStatus.DISMISSED);
            if (recent > 0) {
                throw new ConflictException("ALREADY_REPORTED_RECENTLY",
                        "Room " + room.getId() + " was already reported by this user recently");
            }

            ChatReport report = reportRepository.save(ChatReport.file(room.getId(), command.messageId(),
                    command.reporterId(), command.reportedUserId(), command.reportType(), command.description(),
                    command.evidence(), command.screenshotUrl(), now));
            if (command.messageId() != null) {
                messageService.incrementReportCount(command.messageId());
            }
            boolean underReview = roomService.markReported(room.getId(), command.reporterId(),
                    command.reportType().wireValue());
            log.info("Report {} filed on room {} ({}, room under review: {})", report.getId(), room.getId(),
                    command.reportType().wireValue(), underReview);
            return report;
        });
    }

    public ChatReport investigate(UUID reportId, UUID reviewerId) {
        return tx.execute(() -> {
            ChatReport report = findReport(reportId);
            report.startInvestigation(reviewerId, clock.instant());
            log.info("Report {} under investigation by {}", reportId, reviewerId);
            return report;
        });
    }

    /**
     * Closes a report as resolved or dismissed. The room goes back to its previous status
     * when no other open report references it.
     */
    public ChatReport resolve(UUID reportId, UUID reviewerId, ReportStatus decision, ActionTaken action, String notes) {
        Resolution resolution = tx.execute(() -> {
            ChatReport report = findReport(reportId);
            report.close(reviewerId, decision, action, notes, clock.instant());
            ModerationLog entry;
            if (report.getActionTaken() != ActionTaken.NONE) {
                entry = moderationService.applyReportAction(reviewerId, report, report.getActionTaken(), notes);
            } else {
                entry = moderationService.recordReportDecision(reviewerId, report,
                        decision == ReportStatus.RESOLVED ? ModerationAction.REPORT_RESOLVE : ModerationAction.REPORT_DISMISS,
                        notes);
            }
            reportRepository.flush();
            if (reportRepository.countByRoomIdAndStatusIn(report.getRoomId(), OPEN) == 0) {
                roomService.restoreFromReport(report.getRoomId());
            }
            log.info("Report {} {} by {} (action {})", reportId, decision.wireValue(), reviewerId,
                    report.getActionTaken().wireValue());
            return new Resolution(report, entry);
        });
        moderationService.escalateIfNeeded(resolution.entry());
        return resolution.report();
    }

    public ChatReport dismiss(UUID reportId, UUID reviewerId, String notes) {
        return resolve(reportId, reviewerId, ReportStatus.DISMISSED, ActionTaken.NONE, notes);
    }

    /**
     * Marks the report for legal follow-up. The review status is left unchanged.
     */
    public ChatReport escalateToLegal(UUID reportId, UUID adminId, String notes) {
        return tx.execute(() -> {
            ChatReport report = findReport(reportId);
            report.escalateToLegal(notes, clock.instant());
            moderationService.recordReportDecision(adminId, report, ModerationAction.REPORT_ESCALATE, notes);
            log.info("Report {} escalated to legal by {}", reportId, adminId);
            return report;
        });
    }

    // ==================== Reads ====================

    @Transactional(readOnly = true)
    public ChatReport getReport(UUID reportId) {
        return findReport(reportId);
    }

    /**
     * The report with the reported message and the latest messages of the room, shown to
     * moderators with full content.
     */
    @Transactional(readOnly = true)
    public ReportEvidence evidenceFor(UUID reportId) {
        ChatReport report = findReport(reportId);
        ChatMessage reported = report.getMessageId() == null ? null : messageService.moderationView(report.getMessageId());
        return new ReportEvidence(report, reported, messageService.recentMessages(report.getRoomId()));
    }

    @Transactional(readOnly = true)
    public Page<ChatReport> pendingReports(ReportType type, int page, int size) {
        PageRequest pageable = PageRequest.of(page, size);
        if (type == null) {
            return reportRepository.findByStatusOrderByCreatedAtDesc(ReportStatus.PENDING, pageable);
        }
        return reportRepository.findByStatusAndReportTypeOrderByCreatedAtDesc(ReportStatus.PENDING, type, pageable);
    }

    @Transactional(readOnly = true)
    public List<ChatReport> reportsAboutUser(UUID userId) {
        return reportRepository.findByReportedUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Users with at least {@code minReports} open reports against them.
     */
    @Transactional(readOnly = true)
    public List<UserReportCount> frequentlyReportedUsers(int minReports) {
        return reportRepository.findFrequentlyReported(OPEN, Math.max(1, minReports));
    }

    @Transactional(readOnly = true)
    public ReportStats reportStats(Instant since) {
        Map<String, Long> byType = new TreeMap<>();
        for (TypeCount count : reportRepository.countByTypeSince(since)) {
            byType.put(count.getReportType().wireValue(), count.getTotal());
        }
        return new ReportStats(
                reportRepository.countByStatus(ReportStatus.PENDING),
                reportRepository.countByStatus(ReportStatus.INVESTIGATING),
                reportRepository.countByStatus(ReportStatus.RESOLVED),
                reportRepository.countByStatus(ReportStatus.DISMISSED),
                byType);
    }

    private ChatReport findReport(UUID reportId) {
        return reportRepository.findById(reportId)
                .orElseThrow(() -> new NotFoundException("REPORT_NOT_FOUND", "Report not found: " + reportId));
    }

    private record Resolution(ChatReport report, ModerationLog entry) {}

    public record FileReportCommand(
            UUID roomId,
            UUID messageId,
            UUID reporterId,
            UUID reportedUserId,
            ReportType reportType,
            String description,
            EvidencePayload evidence,
            String screenshotUrl
    ) {}

    public record ReportEvidence(ChatReport report, ChatMessage reportedMessage, List<ChatMessage> recentMessages) {}

    public record ReportStats(
            long pending,
            long investigating,
            long resolved,
            long dismissed,
            Map<String, Long> byType
    ) {}
}
