package com.parichay.api.moderation;

import com.parichay.core.domain.ModerationLog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * The caller's own moderation record and appeals.
 */
@RestController
@RequestMapping("/api/v1/chat/moderation")
public class UserModerationController {

    private final ModerationLedgerService ledger;

    public UserModerationController(ModerationLedgerService ledger) {
        this.ledger = ledger;
    }

    @GetMapping("/strikes")
    public ResponseEntity<StrikeSummary> strikes(@RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(new StrikeSummary(userId, ledger.strikeCount(userId), ledger.strikeHistory(userId)));
    }

    /**
     * Appeal a moderation action taken against the caller.
     * POST /api/v1/chat/moderation/actions/{logId}/appeal
     */
    @PostMapping("/actions/{logId}/appeal")
    public ResponseEntity<ModerationLog> appeal(
            @PathVariable UUID logId,
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody AppealRequest request) {
        return ResponseEntity.ok(ledger.fileAppeal(logId, userId, request.reason()));
    }

    public record AppealRequest(String reason) {}

    public record StrikeSummary(UUID userId, int strikeCount, List<ModerationLog> history) {}
}
