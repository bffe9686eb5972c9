package com.parichay.api.maintenance;

import com.parichay.api.attachment.AttachmentService;
import com.parichay.api.block.BlockService;
import com.parichay.api.context.ContextLinkService;
import com.parichay.api.room.ChatRoomService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Periodic expiry work: timed blocks, context links, timed room mutes, attachments and
 * purge of long-deleted rooms. Each sweep handles one bounded batch per run; a failing sweep does
 * not stop the others.
 */
@Component
@ConditionalOnProperty(name = "parichay.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class SweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SweepScheduler.class);

    private final BlockService blockService;
    private final ContextLinkService contextLinkService;
    private final ChatRoomService roomService;
    private final AttachmentService attachmentService;
    private final CompactionService compactionService;
    private final Clock clock;

    public SweepScheduler(
            BlockService blockService,
            ContextLinkService contextLinkService,
            ChatRoomService roomService,
            AttachmentService attachmentService,
            CompactionService compactionService,
            Clock clock) {
        this.blockService = blockService;
        this.contextLinkService = contextLinkService;
        this.roomService = roomService;
        this.attachmentService = attachmentService;
        this.compactionService = compactionService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${parichay.sweep.interval-ms:60000}")
    public void sweep() {
        Instant now = clock.instant();
        try {
            blockService.sweepExpired(now);
        } catch (RuntimeException e) {
            log.warn("Block expiry sweep failed: {}", e.getMessage());
        }
        try {
            List<UUID> closed = contextLinkService.sweepExpired(now);
            if (!closed.isEmpty()) {
                log.info("Closed {} rooms whose context expired", closed.size());
            }
        } catch (RuntimeException e) {
            log.warn("Context link expiry sweep failed: {}", e.getMessage());
        }
        try {
            roomService.sweepExpiredMutes(now);
        } catch (RuntimeException e) {
            log.warn("Room mute expiry sweep failed: {}", e.getMessage());
        }
        try {
            attachmentService.sweepExpired(now);
        } catch (RuntimeException e) {
            log.warn("Attachment expiry sweep failed: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${parichay.compaction.interval-ms:3600000}")
    public void compact() {
        try {
            compactionService.purgeDeletedRooms(clock.instant());
        } catch (RuntimeException e) {
            log.warn("Room compaction failed: {}", e.getMessage());
        }
    }
}
