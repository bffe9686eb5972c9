package com.parichay.api.moderation;

import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ModerationLog;
import com.parichay.core.domain.ModerationLog.AppealDecision;
import com.parichay.core.domain.ModerationLog.Entry;
import com.parichay.core.domain.UserStrikeRecord;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.NotFoundException;
import com.parichay.core.repository.ChatMessageRepository;
import com.parichay.core.repository.ModerationLogRepository;
import com.parichay.core.repository.ModerationLogRepository.OffenderCount;
import com.parichay.core.repository.UserStrikeRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only moderation ledger with per-user strike accounting and appeals.
 *
 * Strike-bearing entries add one strike to the subject user. Writes for the same user
 * are serialized on the user's {@link UserStrikeRecord} row, so counts recorded on
 * consecutive entries are consecutive. The count never goes down; an overturned appeal
 * only stops the entry from counting towards escalation.
 */
@Service
public class ModerationLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ModerationLedgerService.class);

    private final ModerationLogRepository logRepository;
    private final UserStrikeRecordRepository strikeRepository;
    private final ChatMessageRepository messageRepository;
    private final EscalationPolicy escalationPolicy;
    private final TransactionRetryExecutor tx;
    private final Clock clock;
    private final Duration appealWindow;

    public ModerationLedgerService(
            ModerationLogRepository logRepository,
            UserStrikeRecordRepository strikeRepository,
            ChatMessageRepository messageRepository,
            EscalationPolicy escalationPolicy,
            TransactionRetryExecutor tx,
            Clock clock,
            @Value("${parichay.moderation.appeal-window-days:7}") int appealWindowDays) {
        this.logRepository = logRepository;
        this.strikeRepository = strikeRepository;
        this.messageRepository = messageRepository;
        this.escalationPolicy = escalationPolicy;
        this.tx = tx;
        this.clock = clock;
        this.appealWindow = Duration.ofDays(appealWindowDays);
    }

    public ModerationLog recordAction(Entry entry) {
        return tx.execute(() -> {
            Instant now = clock.instant();
            UUID subject = resolveSubject(entry);
            int count = 0;
            boolean strike = subject != null && entry.action().isStrikeBearing();
            if (subject != null) {
                UserStrikeRecord record = lockStrikeRecord(subject, now);
                count = strike ? record.addStrike(now) : record.getStrikeCount();
            }
            Instant deadline = strike ? now.plus(appealWindow) : null;
            ModerationLog saved = logRepository.save(ModerationLog.record(entry, subject, count, deadline, now));
            if (strike) {
                log.info("Moderation {} by {} on {} {}: strike {} for user {}", entry.action().wireValue(),
                        entry.adminId(), entry.targetType().wireValue(), entry.targetId(), count, subject);
            } else {
                log.info("Moderation {} by {} on {} {}", entry.action().wireValue(), entry.adminId(),
                        entry.targetType().wireValue(), entry.targetId());
            }
            return saved;
        });
    }

    public ModerationLog fileAppeal(UUID logId, UUID userId, String reason) {
        return tx.execute(() -> {
            ModerationLog entry = lockEntry(logId);
            try {
                entry.fileAppeal(userId, reason, clock.instant());
            } catch (ConflictException e) {
                log.warn("Rejected appeal by {} on moderation action {}: {}", userId, logId, e.getCode());
                throw e;
            }
            log.info("User {} appealed moderation action {}", userId, logId);
            return entry;
        });
    }

    /**
     * Decides a pending appeal. An overturned entry comes back with the reversal the
     * caller has to apply.
     */
    public AppealOutcome decideAppeal(UUID logId, UUID reviewer, AppealDecision decision) {
        return tx.execute(() -> {
            ModerationLog entry = lockEntry(logId);
            entry.decideAppeal(reviewer, decision, clock.instant());
            log.info("Appeal on moderation action {} {} by {}", logId, decision.wireValue(), reviewer);
            return new AppealOutcome(entry, ReversalIntent.forOverturned(entry));
        });
    }

    /**
     * Runs the escalation rule over the user's current history.
     */
    @Transactional(readOnly = true)
    public Optional<EscalationDecision> evaluateEscalation(UUID userId) {
        return escalationPolicy.evaluate(userId, strikeHistory(userId));
    }

    /**
     * Same as {@link #evaluateEscalation} but holds the user's strike row lock, so two
     * concurrent escalations of one user are applied once. Must run inside a transaction.
     */
    public Optional<EscalationDecision> evaluateEscalationLocked(UUID userId) {
        lockStrikeRecord(userId, clock.instant());
        return escalationPolicy.evaluate(userId, logRepository.findBySubjectUserIdOrderByUserStrikeCountAscCreatedAtAscIdAsc(userId));
    }

    // ==================== Reads ====================

    @Transactional(readOnly = true)
    public List<ModerationLog> strikeHistory(UUID userId) {
        return logRepository.findBySubjectUserIdOrderByUserStrikeCountAscCreatedAtAscIdAsc(userId);
    }

    @Transactional(readOnly = true)
    public List<ModerationLog> logsForTarget(UUID targetId) {
        return logRepository.findByTargetIdOrderByCreatedAtDesc(targetId);
    }

    @Transactional(readOnly = true)
    public int strikeCount(UUID userId) {
        return strikeRepository.findById(userId).map(UserStrikeRecord::getStrikeCount).orElse(0);
    }

    @Transactional(readOnly = true)
    public ModerationLog getEntry(UUID logId) {
        return logRepository.findById(logId)
                .orElseThrow(() -> new NotFoundException("LOG_NOT_FOUND", "Moderation action not found: " + logId));
    }

    @Transactional(readOnly = true)
    public long countSince(Instant since) {
        return logRepository.countByCreatedAtGreaterThanEqual(since);
    }

    @Transactional(readOnly = true)
    public List<OffenderCount> topOffenders(Instant since, int limit) {
        return logRepository.findTopOffenders(since, PageRequest.of(0, limit));
    }

    private UUID resolveSubject(Entry entry) {
        return switch (entry.targetType()) {
            case USER -> entry.targetId();
            case MESSAGE -> messageRepository.findById(entry.targetId())
                    .map(ChatMessage::getSenderId)
                    .orElse(entry.offenderId());
            case CHAT_ROOM -> entry.offenderId();
        };
    }

    /**
     * Locks the user's strike row, creating it first when the user has none yet.
     * A concurrent creator winning the insert is fine; both then lock the same row.
     */
    private UserStrikeRecord lockStrikeRecord(UUID userId, Instant now) {
        Optional<UserStrikeRecord> record = strikeRepository.findByIdForUpdate(userId);
        if (record.isPresent()) {
            return record.get();
        }
        try {
            tx.executeInNewTransaction(() -> strikeRepository.saveAndFlush(UserStrikeRecord.create(userId, now)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Strike record of user {} created concurrently", userId);
        }
        return strikeRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("Strike record missing for user " + userId));
    }

    private ModerationLog lockEntry(UUID logId) {
        return logRepository.findByIdForUpdate(logId)
                .orElseThrow(() -> new NotFoundException("LOG_NOT_FOUND", "Moderation action not found: " + logId));
    }
}
