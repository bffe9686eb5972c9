package com.parichay.api.attachment;

import com.parichay.api.collaborator.FileScanner;
import com.parichay.api.message.MessageService;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.TransactionRetryExecutor;
import com.parichay.core.domain.ChatAttachment;
import com.parichay.core.domain.ChatAttachment.ScanStatus;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.error.DependencyUnavailableException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.NotFoundException;
import com.parichay.core.error.ValidationException;
import com.parichay.core.repository.ChatAttachmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Attachment metadata and download gating. File bytes live in external storage; this
 * service only tracks where they are and whether they may be handed out.
 *
 * Downloads stay closed until the antivirus scan reports the file clean and a
 * participant releases it.
 */
@Service
public class AttachmentService {

    private static final Logger log = LoggerFactory.getLogger(AttachmentService.class);

    private static final Pattern SHA256_HEX = Pattern.compile("[0-9a-fA-F]{64}");

    private final ChatAttachmentRepository attachmentRepository;
    private final MessageService messageService;
    private final ChatRoomService roomService;
    private final FileScanner fileScanner;
    private final TransactionRetryExecutor tx;
    private final Clock clock;
    private final long maxSizeBytes;
    private final int batchSize;

    public AttachmentService(
            ChatAttachmentRepository attachmentRepository,
            MessageService messageService,
            ChatRoomService roomService,
            FileScanner fileScanner,
            TransactionRetryExecutor tx,
            Clock clock,
            @Value("${parichay.attachment.max-size-bytes:10485760}") long maxSizeBytes,
            @Value("${parichay.sweep.batch-size:100}") int batchSize) {
        this.attachmentRepository = attachmentRepository;
        this.messageService = messageService;
        this.roomService = roomService;
        this.fileScanner = fileScanner;
        this.tx = tx;
        this.clock = clock;
        this.maxSizeBytes = maxSizeBytes;
        this.batchSize = batchSize;
    }

    public ChatAttachment registerAttachment(UUID messageId, UUID uploaderId, AttachmentMetadata metadata) {
        validate(metadata);
        ChatMessage message = messageService.getMessage(messageId);
        if (!message.isSentBy(uploaderId)) {
            throw new ForbiddenException("NOT_SENDER", "Only the sender may attach files to message " + messageId);
        }
        return tx.execute(() -> {
            ChatAttachment saved = attachmentRepository.save(ChatAttachment.register(
                    messageId, message.getRoomId(), uploaderId,
                    metadata.fileName().strip(), metadata.fileType(), metadata.fileSize(), metadata.mimeType(),
                    metadata.filePath(), metadata.encryptedFilePath(), metadata.fileHash().toLowerCase(Locale.ROOT),
                    metadata.expiresAt(), clock.instant()));
            log.info("Registered attachment {} on message {}", saved.getId(), messageId);
            return saved;
        });
    }

    /**
     * Runs the antivirus scan and stores its verdict.
     */
    public ChatAttachment recordScan(UUID attachmentId) {
        ChatAttachment snapshot = getAttachment(attachmentId);
        ScanStatus verdict;
        try {
            verdict = fileScanner.scanFile(snapshot.getFilePath());
        } catch (RuntimeException e) {
            throw new DependencyUnavailableException("file-scanner", e);
        }
        if (verdict == null) {
            throw new DependencyUnavailableException("file-scanner", null);
        }
        return tx.execute(() -> {
            ChatAttachment attachment = findAttachment(attachmentId);
            attachment.recordScan(verdict, clock.instant());
            if (verdict == ScanStatus.CLEAN) {
                log.info("Attachment {} scanned clean", attachmentId);
            } else {
                log.warn("Attachment {} scanned {}", attachmentId, verdict.wireValue());
            }
            return attachment;
        });
    }

    public ChatAttachment allowDownload(UUID attachmentId, UUID actor) {
        return tx.execute(() -> {
            ChatAttachment attachment = findAttachment(attachmentId);
            roomService.getRoom(attachment.getRoomId()).requireParticipant(actor);
            attachment.allowDownload();
            return attachment;
        });
    }

    /**
     * Counts a download by a room participant. Fails unless the attachment is released,
     * clean and unexpired.
     */
    public ChatAttachment recordDownload(UUID attachmentId, UUID requesterId) {
        return tx.execute(() -> {
            ChatAttachment attachment = findAttachment(attachmentId);
            roomService.getRoom(attachment.getRoomId()).requireParticipant(requesterId);
            if (!attachment.isDownloadable(clock.instant())) {
                throw new ForbiddenException("DOWNLOAD_NOT_ALLOWED", "Attachment " + attachmentId + " cannot be downloaded");
            }
            attachment.recordDownload();
            return attachment;
        });
    }

    public ChatAttachment softDelete(UUID attachmentId, UUID actor) {
        return tx.execute(() -> {
            ChatAttachment attachment = findAttachment(attachmentId);
            if (!attachment.getUploadedBy().equals(actor)) {
                throw new ForbiddenException("NOT_UPLOADER", "Only the uploader may delete attachment " + attachmentId);
            }
            attachment.softDelete(clock.instant());
            return attachment;
        });
    }

    /**
     * Soft-deletes one batch of expired attachments.
     *
     * @return number of attachments this call deleted
     */
    public int sweepExpired(Instant now) {
        int deleted = 0;
        for (UUID id : attachmentRepository.findExpiredIds(now, PageRequest.of(0, batchSize))) {
            try {
                deleted += tx.execute(() -> attachmentRepository.softDeleteIfLive(id, now));
            } catch (RuntimeException e) {
                log.warn("Failed to expire attachment {}: {}", id, e.getMessage());
            }
        }
        if (deleted > 0) {
            log.info("Expired {} attachments", deleted);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<ChatAttachment> attachmentsFor(UUID messageId, UUID viewerId) {
        ChatMessage message = messageService.getMessage(messageId);
        roomService.getRoom(message.getRoomId()).requireParticipant(viewerId);
        return attachmentRepository.findByMessageIdAndDeletedFalse(messageId);
    }

    @Transactional(readOnly = true)
    public ChatAttachment getAttachment(UUID attachmentId) {
        return findAttachment(attachmentId);
    }

    private ChatAttachment findAttachment(UUID attachmentId) {
        return attachmentRepository.findById(attachmentId)
                .orElseThrow(() -> new NotFoundException("ATTACHMENT_NOT_FOUND", "Attachment not found: " + attachmentId));
    }

    private void validate(AttachmentMetadata metadata) {
        if (metadata == null || metadata.fileName() == null || metadata.fileName().isBlank()) {
            throw new ValidationException("FILE_NAME_REQUIRED", "File name is required");
        }
        if (metadata.fileType() == null || metadata.fileType().isBlank()) {
            throw new ValidationException("FILE_TYPE_REQUIRED", "File type is required");
        }
        if (metadata.filePath() == null || metadata.filePath().isBlank()) {
            throw new ValidationException("FILE_PATH_REQUIRED", "Storage path is required");
        }
        if (metadata.fileSize() <= 0 || metadata.fileSize() > maxSizeBytes) {
            throw new ValidationException("INVALID_FILE_SIZE", "File size must be between 1 and " + maxSizeBytes + " bytes");
        }
        if (metadata.fileHash() == null || !SHA256_HEX.matcher(metadata.fileHash()).matches()) {
            throw new ValidationException("INVALID_FILE_HASH", "File hash must be a SHA-256 hex digest");
        }
        if (metadata.expiresAt() != null && !metadata.expiresAt().isAfter(clock.instant())) {
            throw new ValidationException("INVALID_EXPIRY", "Attachment expiry must be in the future");
        }
    }

    public record AttachmentMetadata(
            String fileName,
            String fileType,
            long fileSize,
            String mimeType,
            String filePath,
            String encryptedFilePath,
            String fileHash,
            Instant expiresAt
    ) {}
}
