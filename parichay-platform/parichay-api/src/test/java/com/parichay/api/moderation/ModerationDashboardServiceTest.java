package com.parichay.api.moderation;

import com.parichay.api.ParichayApiApplication;
import com.parichay.api.moderation.ModerationDashboardService.DashboardStats;
import com.parichay.api.report.ChatReportService;
import com.parichay.api.report.ChatReportService.FileReportCommand;
import com.parichay.api.room.ChatRoomService;
import com.parichay.api.support.ChatTestConfig;
import com.parichay.api.support.DatabaseCleaner;
import com.parichay.core.domain.ChatReport.ReportType;
import com.parichay.core.domain.ChatRoom;
import com.parichay.core.domain.ContextType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(classes = ParichayApiApplication.class)
@Import(ChatTestConfig.class)
@ActiveProfiles("test")
class ModerationDashboardServiceTest {

    @Autowired
    private ModerationDashboardService dashboardService;

    @Autowired
    private ModerationService moderationService;

    @Autowired
    private ChatReportService reportService;

    @Autowired
    private ChatRoomService roomService;

    @Autowired
    private DatabaseCleaner cleaner;

    @BeforeEach
    void setUp() {
        cleaner.reset();
    }

    @Test
    void emptyPlatformHasZeroCounts() {
        DashboardStats stats = dashboardService.stats();

        assertThat(stats.roomsByStatus()).containsEntry("active", 0L).containsEntry("closed", 0L);
        assertThat(stats.flaggedMessages()).isZero();
        assertThat(stats.actionsLast24h()).isZero();
        assertThat(stats.topOffenders()).isEmpty();
    }

    @Test
    void statsReflectReportsAndStrikes() {
        UUID alice = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        UUID admin = UUID.randomUUID();
        ChatRoom room = roomService.createRoom(alice, bob, ContextType.GENERAL, null);
        roomService.createRoom(alice, UUID.randomUUID(), ContextType.GENERAL, null);
        reportService.fileReport(new FileReportCommand(room.getId(), null, alice, bob,
                ReportType.SCAM, "asked for money", null, null));
        moderationService.warnUser(admin, bob, "scam attempt");
        moderationService.banUserTemporarily(admin, UUID.randomUUID(), 60, "spam");

        DashboardStats stats = dashboardService.stats();

        assertThat(stats.roomsByStatus()).containsEntry("active", 1L).containsEntry("reported", 1L);
        assertThat(stats.reports().pending()).isEqualTo(1);
        assertThat(stats.reports().byType()).containsEntry("scam", 1L);
        assertThat(stats.activePlatformBans()).isEqualTo(1);
        assertThat(stats.actionsLast24h()).isEqualTo(2);
        assertThat(stats.topOffenders()).hasSize(2);
    }
}
