package com.parichay.api.maintenance;

import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.repository.ChatAttachmentRepository;
import com.parichay.core.repository.ChatContextLinkRepository;
import com.parichay.core.repository.ChatMessageRepository;
import com.parichay.core.repository.ChatRoomRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Physically removes soft-deleted rooms once their retention window has passed.
 * Reports and ledger entries referencing a purged room are kept.
 */
@Service
public class CompactionService {

    private static final Logger log = LoggerFactory.getLogger(CompactionService.class);

    private final ChatRoomRepository roomRepository;
    private final ChatMessageRepository messageRepository;
    private final ChatAttachmentRepository attachmentRepository;
    private final ChatContextLinkRepository linkRepository;
    private final TransactionRetryExecutor tx;
    private final Duration retention;
    private final int batchSize;

    public CompactionService(
            ChatRoomRepository roomRepository,
            ChatMessageRepository messageRepository,
            ChatAttachmentRepository attachmentRepository,
            ChatContextLinkRepository linkRepository,
            TransactionRetryExecutor tx,
            @Value("${parichay.compaction.retention-days:30}") int retentionDays,
            @Value("${parichay.sweep.batch-size:100}") int batchSize) {
        this.roomRepository = roomRepository;
        this.messageRepository = messageRepository;
        this.attachmentRepository = attachmentRepository;
        this.linkRepository = linkRepository;
        this.tx = tx;
        this.retention = Duration.ofDays(retentionDays);
        this.batchSize = batchSize;
    }

    public Duration getRetention() {
        return retention;
    }

    /**
     * Purges one batch of rooms soft-deleted before {@code now} minus the retention window.
     *
     * @return number of rooms purged
     */
    public int purgeDeletedRooms(Instant now) {
        int purged = 0;
        for (UUID roomId : roomRepository.findPurgeableIds(now.minus(retention), PageRequest.of(0, batchSize))) {
            try {
                tx.run(() -> purgeRoom(roomId));
                purged++;
            } catch (RuntimeException e) {
                log.warn("Failed to purge room {}: {}", roomId, e.getMessage());
            }
        }
        if (purged > 0) {
            log.info("Purged {} deleted rooms", purged);
        }
        return purged;
    }

    private void purgeRoom(UUID roomId) {
        messageRepository.clearRepliesInto(roomId);
        int attachments = attachmentRepository.deleteByRoomId(roomId);
        int links = linkRepository.deleteByRoomId(roomId);
        int messages = messageRepository.deleteByRoomId(roomId);
        roomRepository.deleteById(roomId);
        log.debug("Purged room {} ({} messages, {} attachments, {} links)", roomId, messages, attachments, links);
    }
}
