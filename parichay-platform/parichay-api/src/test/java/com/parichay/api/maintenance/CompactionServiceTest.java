package com.parichay.api.maintenance;

import com.parichay.api.ParichayApiApplication;
import com.parichay.api.message.MessageService;
import com.parichay.api.report.ChatReportService;
import com.parichay.api.report.ChatReportService.FileReportCommand;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.ChatTestConfig;
import com.parichay.api.support.DatabaseCleaner;
import com.parichay.api.support.MutableClock;
import com.parichay.core.domain.ChatMessage;
import com.parichay.core.domain.ChatMessage.MessageType;
import com.parichay.core.domain.ChatReport;
import com.parichay.core.domain.ChatReport.ReportType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ContextType;
import com.parichay.core.repository.ChatMessageRepository;
import com.parichay.core.repository.ChatReportRepository;
import com.parichay.core.repository.ChatRoomRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = ParichayApiApplication.class)
@Import(ChatTestConfig.class)
@ActiveProfiles("test")
class CompactionServiceTest {

    @Autowired
    private CompactionService compactionService;

    @Autowired
    private ChatRoomService roomService;

    @Autowired
    private MessageService messageService;

    @Autowired
    private ChatReportService reportService;

    @Autowired
    private ChatRoomRepository roomRepository;

    @Autowired
    private ChatMessageRepository messageRepository;

    @Autowired
    private ChatReportRepository reportRepository;

    @Autowired
    private MutableClock clock;

    @Autowired
    private DatabaseCleaner cleaner;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        cleaner.reset();
    }

    @Test
    void deletedRoomIsPurgedAfterRetention() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.MARRIAGE, UUID.randomUUID());
        ChatMessage first = messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "hello", null);
        messageService.sendMessage(room.getId(), bob, MessageType.TEXT, "hi", first.getId());
        ChatReport report = reportService.fileReport(new FileReportCommand(room.getId(), first.getId(), bob, alice,
                ReportType.SPAM, "unsolicited", null, null));
        roomService.softDeleteRoom(room.getId(), alice);

        clock.advance(Duration.ofDays(29));
        assertThat(compactionService.purgeDeletedRooms(clock.instant())).isZero();

        clock.advance(Duration.ofDays(2));
        assertThat(compactionService.purgeDeletedRooms(clock.instant())).isEqualTo(1);

        assertThat(roomRepository.findById(room.getId())).isEmpty();
        assertThat(messageRepository.countByRoomId(room.getId())).isZero();
        assertThat(reportRepository.findById(report.getId())).isPresent();
        assertThat(compactionService.purgeDeletedRooms(clock.instant())).isZero();
    }

    @Test
    void liveRoomsAreNeverPurged() {
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.GENERAL, null);
        messageService.sendMessage(room.getId(), alice, MessageType.TEXT, "hello", null);

        clock.advance(Duration.ofDays(365));

        assertThat(compactionService.purgeDeletedRooms(clock.instant())).isZero();
        assertThat(messageRepository.countByRoomId(room.getId())).isEqualTo(1);
    }
}
