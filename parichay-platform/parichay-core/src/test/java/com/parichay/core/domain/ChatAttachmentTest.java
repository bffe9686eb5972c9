package com.parichay.core.domain;

import com.parichay.core.domain.ChatAttachment.ScanStatus;
import com.parichay.core.error.ConflictException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class ChatAttachmentTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private ChatAttachment attachment(Instant expiresAt) {
        return ChatAttachment.register(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
                "photo.jpg", "image", 2048, "image/jpeg", "/store/photo.jpg", "/store/photo.jpg.enc",
                "a".repeat(64), expiresAt, NOW);
    }

    @Test
    void downloadIsRefusedUntilScannedClean() {
        ChatAttachment attachment = attachment(null);

        assertThat(attachment.isDownloadAllowed()).isFalse();
        assertThatThrownBy(attachment::allowDownload)
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("NOT_SCANNED_CLEAN");

        attachment.recordScan(ScanStatus.CLEAN, NOW);
        attachment.allowDownload();

        assertThat(attachment.isDownloadable(NOW)).isTrue();
    }

    @Test
    void laterInfectedScanRevokesDownload() {
        ChatAttachment attachment = attachment(null);
        attachment.recordScan(ScanStatus.CLEAN, NOW);
        attachment.allowDownload();

        attachment.recordScan(ScanStatus.INFECTED, NOW.plusSeconds(60));

        assertThat(attachment.isDownloadAllowed()).isFalse();
        assertThatThrownBy(attachment::allowDownload).isInstanceOf(ConflictException.class);
    }

    @Test
    void expiredAttachmentIsNotDownloadable() {
        ChatAttachment attachment = attachment(NOW.plusSeconds(30));
        attachment.recordScan(ScanStatus.CLEAN, NOW);
        attachment.allowDownload();

        assertThat(attachment.isDownloadable(NOW.plusSeconds(29))).isTrue();
        assertThat(attachment.isDownloadable(NOW.plusSeconds(30))).isFalse();
    }
}
