package com.parichay.api.attachment;

import com.parichay.api.attachment.AttachmentService.AttachmentMetadata;
import com.parichay.core.domain.ChatAttachment;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for attachment metadata. Uploads go straight to storage; clients register
 * the stored file here afterwards.
 */
@RestController
@RequestMapping("/api/v1/chat")
public class AttachmentController {

    private final AttachmentService attachmentService;

    public AttachmentController(AttachmentService attachmentService) {
        this.attachmentService = attachmentService;
    }

    @PostMapping("/messages/{messageId}/attachments")
    public ResponseEntity<ChatAttachment> register(
            @PathVariable UUID messageId,
            @RequestHeader("X-User-ID") UUID userId,
            @RequestBody AttachmentMetadata metadata) {
        ChatAttachment attachment = attachmentService.registerAttachment(messageId, userId, metadata);
        return ResponseEntity.status(HttpStatus.CREATED).body(attachment);
    }

    @GetMapping("/messages/{messageId}/attachments")
    public ResponseEntity<List<ChatAttachment>> list(
            @PathVariable UUID messageId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(attachmentService.attachmentsFor(messageId, userId));
    }

    @PostMapping("/attachments/{attachmentId}/allow-download")
    public ResponseEntity<ChatAttachment> allowDownload(
            @PathVariable UUID attachmentId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(attachmentService.allowDownload(attachmentId, userId));
    }

    /**
     * Counts a download and hands back the storage location.
     * POST /api/v1/chat/attachments/{attachmentId}/download
     */
    @PostMapping("/attachments/{attachmentId}/download")
    public ResponseEntity<ChatAttachment> download(
            @PathVariable UUID attachmentId,
            @RequestHeader("X-User-ID") UUID userId) {
        return ResponseEntity.ok(attachmentService.recordDownload(attachmentId, userId));
    }

    @DeleteMapping("/attachments/{attachmentId}")
    public ResponseEntity<Void> delete(
            @PathVariable UUID attachmentId,
            @RequestHeader("X-User-ID") UUID userId) {
        attachmentService.softDelete(attachmentId, userId);
        return ResponseEntity.noContent().build();
    }
}
