package com.parichay.api.report;

import com.parichay.api.report.ChatReportService.FileReportCommand;
import com.parichay.core.domain.ChatReport;
import com.parichay.core.domain.ChatReport.ReportType;
import com.parichay.core.domain.EvidencePayload;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for filing abuse reports. Review happens through the admin API.
 */
@RestController
@RequestMapping("/api/v1/chat/reports")
public class ChatReportController {

    private final ChatReportService reportService;

    public ChatReportController(ChatReportService reportService) {
        this.reportService = reportService;
    }

    @PostMapping
    public ResponseEntity<ChatReport> fileReport(
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody FileReportRequest request) {
        ChatReport report = reportService.fileReport(new FileReportCommand(
                request.roomId(),
                request.messageId(),
                userId,
                request.reportedUserId(),
                request.reportType(),
                request.description(),
                request.evidence(),
                request.screenshotUrl()));
        return ResponseEntity.status(HttpStatus.CREATED).body(report);
    }

    public record FileReportRequest(
            UUID roomId,
            UUID messageId,
            UUID reportedUserId,
            ReportType reportType,
            String description,
            EvidencePayload evidence,
            String screenshotUrl
    ) {}
}
