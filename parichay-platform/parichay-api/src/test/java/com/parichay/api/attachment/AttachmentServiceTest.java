package com.parichay.api.attachment;

import com.parichay.api.ParichayApiApplication;
import com.parichay.api.attachment.AttachmentService.AttachmentMetadata;
import com.parichay.api.message.MessageService;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.ChatTestConfig;
import com.parichay.api.support.DatabaseCleaner;
import com.parichay.api.support.MutableClock;
import com.parichay.api.support.StubFileScanner;
import com.parichay.core.domain.ChatAttachment;
import com.parichay.core.domain.ChatAttachment.ScanStatus;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatMessage.MessageType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ContextType;
import com.parichay.core.error.ConflictException;
import com.parichay.core.error.DependencyUnavailableException;
import com.parichay.core.error.ForbiddenException;
import com.parichay.core.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = ParichayApiApplication.class)
@Import(ChatTestConfig.class)
@ActiveProfiles("test")
class AttachmentServiceTest {

    private static final String HASH = "9F86D081884C7D659A2FEAA0C55AD015A3BF4F1B2B0B822CD15D6C15B0F00A08";

    @Autowired
    private AttachmentService attachmentService;

    @Autowired
    private ChatRoomService roomService;

    @Autowired
    private MessageService messageService;

    @Autowired
    private StubFileScanner fileScanner;

    @Autowired
    private MutableClock clock;

    @Autowired
    private DatabaseCleaner cleaner;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    private ChatMessage message;

    @BeforeEach
    void setUp() {
        cleaner.reset();
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.JOB, UUID.randomUUID());
        message = messageService.sendMessage(room.getId(), alice, MessageType.FILE, "resume attached", null);
    }

    private static AttachmentMetadata resume(long size, String hash, Instant expiresAt) {
        return new AttachmentMetadata(" resume.pdf ", "document", size, "application/pdf",
                "chat/2026/resume.pdf", null, hash, expiresAt);
    }

    @Test
    void registeredAttachmentStartsUnscanned() {
        ChatAttachment attachment = attachmentService.registerAttachment(message.getId(), alice, resume(2048, HASH, null));

        assertThat(attachment.getFileName()).isEqualTo("resume.pdf");
        assertThat(attachment.getFileHash()).isEqualTo(HASH.toLowerCase());
        assertThat(attachment.getScanStatus()).isEqualTo(ScanStatus.UNSCANNED);
        assertThat(attachment.isDownloadAllowed()).isFalse();
        assertThat(attachmentService.attachmentsFor(message.getId(), bob)).hasSize(1);
    }

    @Test
    void onlyTheSenderMayAttach() {
        assertThatThrownBy(() -> attachmentService.registerAttachment(message.getId(), bob, resume(2048, HASH, null)))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("NOT_SENDER");
    }

    @Test
    void metadataIsValidated() {
        assertThatThrownBy(() -> attachmentService.registerAttachment(message.getId(), alice, resume(0, HASH, null)))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("INVALID_FILE_SIZE");
        assertThatThrownBy(() -> attachmentService.registerAttachment(message.getId(), alice, resume(10, "abc", null)))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("INVALID_FILE_HASH");
        assertThatThrownBy(() -> attachmentService.registerAttachment(message.getId(), alice,
                resume(10, HASH, clock.instant().minusSeconds(1))))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("INVALID_EXPIRY");
    }

    @Test
    void cleanAndReleasedAttachmentCanBeDownloaded() {
        ChatAttachment attachment = attachmentService.registerAttachment(message.getId(), alice, resume(2048, HASH, null));

        assertThatThrownBy(() -> attachmentService.allowDownload(attachment.getId(), bob))
                .isInstanceOf(ConflictException.class)
                .extracting("code").isEqualTo("NOT_SCANNED_CLEAN");

        attachmentService.recordScan(attachment.getId());
        attachmentService.allowDownload(attachment.getId(), bob);
        ChatAttachment downloaded = attachmentService.recordDownload(attachment.getId(), bob);

        assertThat(downloaded.getDownloadCount()).isEqualTo(1);
        assertThatThrownBy(() -> attachmentService.recordDownload(attachment.getId(), UUID.randomUUID()))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("NOT_PARTICIPANT");
    }

    @Test
    void infectedAttachmentIsNeverDownloadable() {
        ChatAttachment attachment = attachmentService.registerAttachment(message.getId(), alice, resume(2048, HASH, null));
        fileScanner.setVerdict(ScanStatus.INFECTED);

        assertThat(attachmentService.recordScan(attachment.getId()).getScanStatus()).isEqualTo(ScanStatus.INFECTED);
        assertThatThrownBy(() -> attachmentService.recordDownload(attachment.getId(), bob))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("DOWNLOAD_NOT_ALLOWED");
    }

    @Test
    void scannerOutageLeavesTheAttachmentUnscanned() {
        ChatAttachment attachment = attachmentService.registerAttachment(message.getId(), alice, resume(2048, HASH, null));
        fileScanner.setUnavailable(true);

        assertThatThrownBy(() -> attachmentService.recordScan(attachment.getId()))
                .isInstanceOf(DependencyUnavailableException.class);
        assertThat(attachmentService.getAttachment(attachment.getId()).getScanStatus()).isEqualTo(ScanStatus.UNSCANNED);
    }

    @Test
    void expiredAttachmentsAreSweptAway() {
        ChatAttachment attachment = attachmentService.registerAttachment(message.getId(), alice,
                resume(2048, HASH, clock.instant().plus(Duration.ofDays(1))));
        attachmentService.recordScan(attachment.getId());
        attachmentService.allowDownload(attachment.getId(), alice);

        clock.advance(Duration.ofDays(2));

        assertThatThrownBy(() -> attachmentService.recordDownload(attachment.getId(), bob))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("DOWNLOAD_NOT_ALLOWED");
        assertThat(attachmentService.sweepExpired(clock.instant())).isEqualTo(1);
        assertThat(attachmentService.attachmentsFor(message.getId(), bob)).isEmpty();
        assertThat(attachmentService.sweepExpired(clock.instant())).isZero();
    }

    @Test
    void onlyTheUploaderMayDelete() {
        ChatAttachment attachment = attachmentService.registerAttachment(message.getId(), alice, resume(2048, HASH, null));

        assertThatThrownBy(() -> attachmentService.softDelete(attachment.getId(), bob))
                .isInstanceOf(ForbiddenException.class)
                .extracting("code").isEqualTo("NOT_UPLOADER");

        attachmentService.softDelete(attachment.getId(), alice);
        assertThat(attachmentService.attachmentsFor(message.getId(), bob)).isEmpty();
    }
}
