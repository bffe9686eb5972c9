package com.parichay.api.admin;

import com.parichay.api.attachment.AttachmentService;
import com.parichay.api.block.BlockService;
import com.parichay.api.context.ContextLinkService;
import com.parichay.api.message.MessageService;
import com.parichay.api.moderation.AppealOutcome;
import com.parichay.api.moderation.ModerationDashboardService;
import com.parichay.api.moderation.ModerationDashboardService.DashboardStats;
import com.parichay.api.moderation.ModerationLedgerService;
import com.parichay.api.moderation.ModerationService;
import com.parichay.api.report.ChatReportService;
import com.parichay.api.report.ChatReportService.ReportEvidence;
import com.parichay.api.room.ChatRoomService;
import com.parichay.core.domain.ChatAttachment;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatReport;
import com.parichay.core.domain.ChatReport.ActionTaken;
import com.parichay.core.domain.ChatReport.ReportStatus;
import com.parichay.core.domain.ChatReport.ReportType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.domain.ContextType;
import com.parichay.core.domain.ModerationLog;
import com.parichay.core.domain.ModerationLog.AppealDecision;
import com.parichay.core.domain.UserBlock;
import com.parichay.core.repository.ChatReportRepository.UserReportCount;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin API for report review and moderation commands.
 *
 * Every command requires {@code X-Admin-ID}; verifying that the caller really is an
 * admin is left to the gateway in front of this service.
 */
@RestController
@RequestMapping("/api/v1/admin/chat")
public class AdminChatController {

    private final ModerationService moderationService;
    private final ModerationLedgerService ledger;
    private final ModerationDashboardService dashboardService;
    private final ChatReportService reportService;
    private final MessageService messageService;
    private final ChatRoomService roomService;
    private final BlockService blockService;
    private final ContextLinkService contextLinkService;
    private final AttachmentService attachmentService;

    public AdminChatController(
            ModerationService moderationService,
            ModerationLedgerService ledger,
            ModerationDashboardService dashboardService,
            ChatReportService reportService,
            MessageService messageService,
            ChatRoomService roomService,
            BlockService blockService,
            ContextLinkService contextLinkService,
            AttachmentService attachmentService) {
        this.moderationService = moderationService;
        this.ledger = ledger;
        this.dashboardService = dashboardService;
        this.reportService = reportService;
        this.messageService = messageService;
        this.roomService = roomService;
        this.blockService = blockService;
        this.contextLinkService = contextLinkService;
        this.attachmentService = attachmentService;
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardStats> dashboard(@RequestHeader("X-Admin-ID") UUID adminId) {
        return ResponseEntity.ok(dashboardService.stats());
    }

    // ==================== Reports ====================

    @GetMapping("/reports")
    public ResponseEntity<Page<ChatReport>> pendingReports(
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(reportService.pendingReports(ReportType.fromWire(type), page, size));
    }

    @GetMapping("/reports/{reportId}/evidence")
    public ResponseEntity<ReportEvidence> evidence(
            @PathVariable UUID reportId,
            @RequestHeader("X-Admin-ID") UUID adminId) {
        return ResponseEntity.ok(reportService.evidenceFor(reportId));
    }

    @PostMapping("/reports/{reportId}/investigate")
    public ResponseEntity<ChatReport> investigate(
            @PathVariable UUID reportId,
            @RequestHeader("X-Admin-ID") UUID adminId) {
        return ResponseEntity.ok(reportService.investigate(reportId, adminId));
    }

    /**
     * Resolve a report, optionally with an action against the reported user.
     * POST /api/v1/admin/chat/reports/{reportId}/resolve
     */
    @PostMapping("/reports/{reportId}/resolve")
    public ResponseEntity<ChatReport> resolve(
            @PathVariable UUID reportId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ResolveReportRequest request) {
        ActionTaken action = request.actionTaken() == null ? ActionTaken.NONE : request.actionTaken();
        return ResponseEntity.ok(reportService.resolve(reportId, adminId, ReportStatus.RESOLVED, action, request.notes()));
    }

    @PostMapping("/reports/{reportId}/dismiss")
    public ResponseEntity<ChatReport> dismiss(
            @PathVariable UUID reportId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody NotesRequest request) {
        return ResponseEntity.ok(reportService.dismiss(reportId, adminId, request.notes()));
    }

    @PostMapping("/reports/{reportId}/escalate")
    public ResponseEntity<ChatReport> escalate(
            @PathVariable UUID reportId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody NotesRequest request) {
        return ResponseEntity.ok(reportService.escalateToLegal(reportId, adminId, request.notes()));
    }

    @GetMapping("/reports/frequent")
    public ResponseEntity<List<UserReportCount>> frequentlyReported(
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestParam(defaultValue = "3") int minReports) {
        return ResponseEntity.ok(reportService.frequentlyReportedUsers(minReports));
    }

    // ==================== Messages ====================

    @GetMapping("/messages/flagged")
    public ResponseEntity<Page<ChatMessage>> flaggedMessages(
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(messageService.flaggedMessages(page, size));
    }

    @PostMapping("/messages/{messageId}/flag")
    public ResponseEntity<ChatMessage> flagMessage(
            @PathVariable UUID messageId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(messageService.flagMessage(messageId, adminId, request.reason()));
    }

    @PostMapping("/messages/{messageId}/hide")
    public ResponseEntity<ModerationLog> hideMessage(
            @PathVariable UUID messageId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(moderationService.hideMessage(adminId, messageId, request.reason()));
    }

    @PostMapping("/messages/{messageId}/delete")
    public ResponseEntity<ModerationLog> deleteMessage(
            @PathVariable UUID messageId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(moderationService.deleteMessage(adminId, messageId, request.reason()));
    }

    @PostMapping("/messages/{messageId}/remove-content")
    public ResponseEntity<ModerationLog> removeContent(
            @PathVariable UUID messageId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(moderationService.removeContent(adminId, messageId, request.reason()));
    }

    // ==================== Users ====================

    @PostMapping("/users/{userId}/warn")
    public ResponseEntity<ModerationLog> warnUser(
            @PathVariable UUID userId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(moderationService.warnUser(adminId, userId, request.reason()));
    }

    /**
     * Platform ban. Without a duration the ban is permanent and closes the user's rooms.
     * POST /api/v1/admin/chat/users/{userId}/ban
     */
    @PostMapping("/users/{userId}/ban")
    public ResponseEntity<ModerationLog> banUser(
            @PathVariable UUID userId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody BanRequest request) {
        ModerationLog entry = request.durationMinutes() == null
                ? moderationService.banUserPermanently(adminId, userId, request.reason())
                : moderationService.banUserTemporarily(adminId, userId, request.durationMinutes(), request.reason());
        return ResponseEntity.ok(entry);
    }

    @PostMapping("/users/{userId}/unban")
    public ResponseEntity<ModerationLog> unbanUser(
            @PathVariable UUID userId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(moderationService.unbanUser(adminId, userId, request.reason()));
    }

    @GetMapping("/users/{userId}/history")
    public ResponseEntity<UserHistory> userHistory(
            @PathVariable UUID userId,
            @RequestHeader("X-Admin-ID") UUID adminId) {
        return ResponseEntity.ok(new UserHistory(
                userId,
                ledger.strikeCount(userId),
                blockService.isBanned(userId),
                ledger.strikeHistory(userId),
                reportService.reportsAboutUser(userId)));
    }

    @GetMapping("/bans")
    public ResponseEntity<List<UserBlock>> platformBans(@RequestHeader("X-Admin-ID") UUID adminId) {
        return ResponseEntity.ok(blockService.listPlatformBans());
    }

    @DeleteMapping("/blocks/{blockId}")
    public ResponseEntity<UserBlock> removeBlock(
            @PathVariable UUID blockId,
            @RequestHeader("X-Admin-ID") UUID adminId) {
        return ResponseEntity.ok(blockService.adminUnblock(blockId, adminId));
    }

    // ==================== Rooms ====================

    @GetMapping("/rooms")
    public ResponseEntity<Page<ChatRoom>> roomsByStatus(
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestParam(defaultValue = "reported") String status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(roomService.roomsByStatus(RoomStatus.fromWire(status), page, size));
    }

    @GetMapping("/rooms/{roomId}/suspicious")
    public ResponseEntity<List<ChatMessage>> suspiciousMessages(
            @PathVariable UUID roomId,
            @RequestHeader("X-Admin-ID") UUID adminId) {
        return ResponseEntity.ok(messageService.suspiciousMessages(roomId));
    }

    @PostMapping("/rooms/{roomId}/warn")
    public ResponseEntity<ModerationLog> warnInRoom(
            @PathVariable UUID roomId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody RoomActionRequest request) {
        return ResponseEntity.ok(moderationService.warnInRoom(adminId, roomId, request.offenderId(), request.reason()));
    }

    @PostMapping("/rooms/{roomId}/mute")
    public ResponseEntity<ModerationLog> muteRoom(
            @PathVariable UUID roomId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody RoomActionRequest request) {
        return ResponseEntity.ok(moderationService.muteRoom(adminId, roomId, request.offenderId(),
                request.durationMinutes(), request.reason()));
    }

    @PostMapping("/rooms/{roomId}/close")
    public ResponseEntity<ModerationLog> closeRoom(
            @PathVariable UUID roomId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(moderationService.closeRoom(adminId, roomId, request.reason()));
    }

    // ==================== Appeals ====================

    @PostMapping("/appeals/{logId}/decide")
    public ResponseEntity<ModerationLog> decideAppeal(
            @PathVariable UUID logId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody AppealDecisionRequest request) {
        AppealOutcome outcome = moderationService.decideAppeal(adminId, logId, request.decision());
        return ResponseEntity.ok(outcome.entry());
    }

    // ==================== Context & attachments ====================

    /**
     * Withdraws a context and closes the rooms linked to it.
     * POST /api/v1/admin/chat/contexts/{contextType}/{contextId}/revoke
     */
    @PostMapping("/contexts/{contextType}/{contextId}/revoke")
    public ResponseEntity<Map<String, Object>> revokeContext(
            @PathVariable String contextType,
            @PathVariable UUID contextId,
            @RequestHeader("X-Admin-ID") UUID adminId,
            @RequestBody ReasonRequest request) {
        List<UUID> closed = contextLinkService.revokeContext(ContextType.fromWire(contextType), contextId,
                request.reason());
        return ResponseEntity.ok(Map.of("contextId", contextId, "closedRooms", closed));
    }

    @PostMapping("/attachments/{attachmentId}/scan")
    public ResponseEntity<ChatAttachment> scanAttachment(
            @PathVariable UUID attachmentId,
            @RequestHeader("X-Admin-ID") UUID adminId) {
        return ResponseEntity.ok(attachmentService.recordScan(attachmentId));
    }

    public record ResolveReportRequest(ActionTaken actionTaken, String notes) {}

    public record NotesRequest(String notes) {}

    public record ReasonRequest(String reason) {}

    public record BanRequest(Integer durationMinutes, String reason) {}

    public record RoomActionRequest(UUID offenderId, Integer durationMinutes, String reason) {}

    public record AppealDecisionRequest(AppealDecision decision) {}

    public record UserHistory(
            UUID userId,
            int strikeCount,
            boolean banned,
            List<ModerationLog> actions,
            List<ChatReport> reports
    ) {}
}
