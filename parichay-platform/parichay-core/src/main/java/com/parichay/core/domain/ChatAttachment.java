package com.parichay.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.parichay.core.error.ConflictException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * File metadata attached to a message. Bytes live in external storage;
 * only paths and the SHA-256 integrity hash are kept here.
 */
@Entity
@Table(name = "chat_attachments", indexes = {
    @Index(name = "idx_chat_attachments_message", columnList = "message_id"),
    @Index(name = "idx_chat_attachments_room", columnList = "room_id"),
    @Index(name = "idx_chat_attachments_expiry", columnList = "deleted, expires_at")
})
public class ChatAttachment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "message_id", nullable = false, updatable = false)
    private UUID messageId;

    @NotNull
    @Column(name = "room_id", nullable = false, updatable = false)
    private UUID roomId;

    @NotNull
    @Column(name = "uploaded_by", nullable = false, updatable = false)
    private UUID uploadedBy;

    @NotNull
    @Column(name = "file_name", nullable = false, length = 255)
    private String fileName;

    @NotNull
    @Column(name = "file_type", nullable = false, length = 50)
    private String fileType;

    @Column(name = "file_size", nullable = false)
    private long fileSize;

    @Column(name = "mime_type", length = 100)
    private String mimeType;

    @NotNull
    @Column(name = "file_path", nullable = false, length = 500)
    private String filePath;

    @Column(name = "encrypted_file_path", length = 500)
    private String encryptedFilePath;

    @NotNull
    @Column(name = "file_hash", nullable = false, length = 64)
    private String fileHash;

    @Column(nullable = false)
    private boolean encrypted;

    @Column(name = "download_allowed", nullable = false)
    private boolean downloadAllowed;

    @Column(name = "download_count", nullable = false)
    private int downloadCount;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @NotNull
    @Convert(converter = ScanStatus.JpaConverter.class)
    @Column(name = "scan_status", nullable = false, length = 20)
    private ScanStatus scanStatus;

    @Column(name = "scanned_at")
    private Instant scannedAt;

    @Column(nullable = false)
    private boolean deleted;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected ChatAttachment() {}

    public static ChatAttachment register(UUID messageId, UUID roomId, UUID uploadedBy, String fileName,
                                          String fileType, long fileSize, String mimeType, String filePath,
                                          String encryptedFilePath, String fileHash, Instant expiresAt,
                                          Instant now) {
        var attachment = new ChatAttachment();
        attachment.messageId = messageId;
        attachment.roomId = roomId;
        attachment.uploadedBy = uploadedBy;
        attachment.fileName = fileName;
        attachment.fileType = fileType;
        attachment.fileSize = fileSize;
        attachment.mimeType = mimeType;
        attachment.filePath = filePath;
        attachment.encryptedFilePath = encryptedFilePath;
        attachment.fileHash = fileHash;
        attachment.encrypted = encryptedFilePath != null;
        attachment.expiresAt = expiresAt;
        attachment.scanStatus = ScanStatus.UNSCANNED;
        attachment.createdAt = now;
        return attachment;
    }

    /**
     * Stores a scan result. Anything other than clean revokes download access.
     */
    public void recordScan(ScanStatus result, Instant now) {
        if (result == null) {
            throw new IllegalArgumentException("Scan result is required");
        }
        scanStatus = result;
        scannedAt = now;
        if (result != ScanStatus.CLEAN) {
            downloadAllowed = false;
        }
    }

    public void allowDownload() {
        if (scanStatus != ScanStatus.CLEAN) {
            throw new ConflictException("NOT_SCANNED_CLEAN",
                    "Attachment " + id + " has scan status " + scanStatus.wireValue());
        }
        downloadAllowed = true;
    }

    public boolean isDownloadable(Instant now) {
        return !deleted && downloadAllowed && scanStatus == ScanStatus.CLEAN && !isExpired(now);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public void recordDownload() {
        downloadCount++;
    }

    public boolean softDelete(Instant now) {
        if (deleted) {
            return false;
        }
        deleted = true;
        deletedAt = now;
        downloadAllowed = false;
        return true;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getMessageId() { return messageId; }
    public UUID getRoomId() { return roomId; }
    public UUID getUploadedBy() { return uploadedBy; }
    public String getFileName() { return fileName; }
    public String getFileType() { return fileType; }
    public long getFileSize() { return fileSize; }
    public String getMimeType() { return mimeType; }
    public String getFilePath() { return filePath; }
    public String getEncryptedFilePath() { return encryptedFilePath; }
    public String getFileHash() { return fileHash; }
    public boolean isEncrypted() { return encrypted; }
    public boolean isDownloadAllowed() { return downloadAllowed; }
    public int getDownloadCount() { return downloadCount; }
    public Instant getExpiresAt() { return expiresAt; }
    public ScanStatus getScanStatus() { return scanStatus; }
    public Instant getScannedAt() { return scannedAt; }
    public boolean isDeleted() { return deleted; }
    public Instant getDeletedAt() { return deletedAt; }
    public Instant getCreatedAt() { return createdAt; }

    public enum ScanStatus implements WireEnum {
        UNSCANNED("unscanned"),
        CLEAN("clean"),
        INFECTED("infected"),
        SUSPICIOUS("suspicious");

        private final String wireValue;

        ScanStatus(String wireValue) {
            this.wireValue = wireValue;
        }

        @JsonValue
        @Override
        public String wireValue() {
            return wireValue;
        }

        @JsonCreator
        public static ScanStatus fromWire(String value) {
            return WireEnum.fromWire(ScanStatus.class, value);
        }

        @Converter
        public static class JpaConverter extends WireEnumConverter<ScanStatus> {
            public JpaConverter() {
                super(ScanStatus.class);
            }
        }
    }
}
