package com.parichay.api.moderation;

import com.parichay.core.domain.ModerationLog.ModerationAction;

import java.util.UUID;

/**
 * Automatic restriction the ledger asks for once a user crosses the strike threshold.
 */
public record EscalationDecision(
        UUID userId,
        ModerationAction action,
        int durationMinutes,
        int effectiveStrikes,
        String reason
) {}
