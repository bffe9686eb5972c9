package com.parichay.api.moderation;

import com.parichay.core.domain.ModerationLog;
import com.parichay.core.domain.ModerationLog.ModerationAction;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Strike escalation rule.
 *
 * Effective strikes are strike-bearing entries whose appeal was not overturned. Once
 * they reach the threshold the user gets a temporary platform mute, unless a ban or
 * mute that still stands was already recorded after the most recent ordinary strike.
 * Evaluation is a pure function of the history.
 */
@Component
public class EscalationPolicy {

    public static final int DEFAULT_STRIKE_THRESHOLD = 3;
    public static final int DEFAULT_AUTO_BAN_MINUTES = 24 * 60;

    private final int strikeThreshold;
    private final int autoBanMinutes;

    public EscalationPolicy(
            @Value("${parichay.moderation.strike-threshold:" + DEFAULT_STRIKE_THRESHOLD + "}") int strikeThreshold,
            @Value("${parichay.moderation.auto-ban-minutes:" + DEFAULT_AUTO_BAN_MINUTES + "}") int autoBanMinutes) {
        if (strikeThreshold < 1) {
            throw new IllegalArgumentException("strike-threshold must be at least 1");
        }
        if (autoBanMinutes < 1) {
            throw new IllegalArgumentException("auto-ban-minutes must be at least 1");
        }
        this.strikeThreshold = strikeThreshold;
        this.autoBanMinutes = autoBanMinutes;
    }

    public static EscalationPolicy withDefaults() {
        return new EscalationPolicy(DEFAULT_STRIKE_THRESHOLD, DEFAULT_AUTO_BAN_MINUTES);
    }

    /**
     * @param history the user's ledger entries in write order
     */
    public Optional<EscalationDecision> evaluate(UUID userId, List<ModerationLog> history) {
        int effective = 0;
        int lastOrdinaryStrike = -1;
        for (int i = 0; i < history.size(); i++) {
            ModerationLog entry = history.get(i);
            if (!entry.countsAsStrike()) {
                continue;
            }
            effective++;
            if (!entry.getAction().isBan()) {
                lastOrdinaryStrike = i;
            }
        }
        if (effective < strikeThreshold || lastOrdinaryStrike < 0) {
            return Optional.empty();
        }
        for (int i = lastOrdinaryStrike + 1; i < history.size(); i++) {
            ModerationLog entry = history.get(i);
            if (entry.getAction().isBan() && !entry.isOverturned()) {
                return Optional.empty();
            }
        }
        return Optional.of(new EscalationDecision(userId, ModerationAction.USER_MUTE, autoBanMinutes, effective,
                "automatic: " + effective + " strikes"));
    }

    public int getStrikeThreshold() {
        return strikeThreshold;
    }

    public int getAutoBanMinutes() {
        return autoBanMinutes;
    }
}
