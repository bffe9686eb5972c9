package com.parichay.api.health;

import com.parichay.core.domain.ChatReport.ReportStatus;
import com.parichay.core.repository.ChatMessageRepository;
import com.parichay.core.repository.ChatReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness of the chat store plus the moderation backlog a load balancer or on-call
 * dashboard polls.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final ChatReportRepository reportRepository;
    private final ChatMessageRepository messageRepository;
    private final Clock clock;
    private final boolean sweepsEnabled;

    public HealthController(
            ChatReportRepository reportRepository,
            ChatMessageRepository messageRepository,
            Clock clock,
            @Value("${parichay.sweep.enabled:true}") boolean sweepsEnabled) {
        this.reportRepository = reportRepository;
        this.messageRepository = messageRepository;
        this.clock = clock;
        this.sweepsEnabled = sweepsEnabled;
    }

    /**
     * UP with backlog counts when the chat store answers, DOWN with 503 otherwise.
     * GET /api/v1/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());
        body.put("sweepsEnabled", sweepsEnabled);
        try {
            long pendingReports = reportRepository.countByStatus(ReportStatus.PENDING);
            long flaggedMessages = messageRepository.countByFlaggedTrueAndDeletedFalse();
            body.put("status", "UP");
            body.put("database", "UP");
            body.put("pendingReports", pendingReports);
            body.put("flaggedMessages", flaggedMessages);
            return ResponseEntity.ok(body);
        } catch (DataAccessException e) {
            log.warn("Health check could not reach the chat store: {}", e.getMessage());
            body.put("status", "DOWN");
            body.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
