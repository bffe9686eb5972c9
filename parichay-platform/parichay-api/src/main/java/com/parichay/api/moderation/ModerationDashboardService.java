package com.parichay.api.moderation;

import com.parichay.api.block.BlockService;
import com.parichay.api.message.MessageService;
import com.parichay.api.report.ChatReportService;
import com.parichay.api.report.ChatReportService.ReportStats;
import com.parichay.api.room.ChatRoomService;
import com.parichay.core.domain.ChatRoom.RoomStatus;
import com.parichay.core.repository.ChatReportRepository.UserReportCount;
import com.parichay.core.repository.ModerationLogRepository.OffenderCount;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only numbers for the moderation dashboard.
 */
@Service
public class ModerationDashboardService {

    private static final Duration RECENT = Duration.ofHours(24);
    private static final int TOP_OFFENDERS = 10;
    private static final int FREQUENT_REPORT_THRESHOLD = 3;

    private final ChatRoomService roomService;
    private final MessageService messageService;
    private final ChatReportService reportService;
    private final BlockService blockService;
    private final ModerationLedgerService ledger;
    private final Clock clock;

    public ModerationDashboardService(
            ChatRoomService roomService,
            MessageService messageService,
            ChatReportService reportService,
            BlockService blockService,
            ModerationLedgerService ledger,
            Clock clock) {
        this.roomService = roomService;
        this.messageService = messageService;
        this.reportService = reportService;
        this.blockService = blockService;
        this.ledger = ledger;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public DashboardStats stats() {
        Instant since = clock.instant().minus(RECENT);
        Map<String, Long> rooms = new TreeMap<>();
        for (RoomStatus status : RoomStatus.values()) {
            rooms.put(status.wireValue(), roomService.countByStatus(status));
        }
        return new DashboardStats(
                rooms,
                messageService.countFlagged(),
                reportService.reportStats(since),
                blockService.listPlatformBans().size(),
                ledger.countSince(since),
                ledger.topOffenders(since, TOP_OFFENDERS),
                reportService.frequentlyReportedUsers(FREQUENT_REPORT_THRESHOLD));
    }

    public record DashboardStats(
            Map<String, Long> roomsByStatus,
            long flaggedMessages,
            ReportStats reports,
            int activePlatformBans,
            long actionsLast24h,
            List<OffenderCount> topOffenders,
            List<UserReportCount> frequentlyReported
    ) {}
}
