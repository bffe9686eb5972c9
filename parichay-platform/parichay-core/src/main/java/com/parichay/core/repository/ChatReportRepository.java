package com.parichay.core.repository;

import com.parichay.core.domain.ChatReport;
import com.parichay.core.domain.ChatReport.ReportStatus;
import com.parichay.core.domain.ChatReport.ReportType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for abuse reports.
 */
@Repository
public interface ChatReportRepository extends JpaRepository<ChatReport, UUID> {

    Page<ChatReport> findByStatusOrderByCreatedAtDesc(ReportStatus status, Pageable pageable);

    Page<ChatReport> findByStatusAndReportTypeOrderByCreatedAtDesc(ReportStatus status, ReportType type,
                                                                  Pageable pageable);

    List<ChatReport> findByReportedUserIdOrderByCreatedAtDesc(UUID reportedUserId);

    long countByRoomIdAndStatusIn(UUID roomId, Collection<ReportStatus> statuses);

    long countByStatus(ReportStatus status);

    /**
     * Non-dismissed reports filed by the same reporter on the same room since {@code since}.
     */
    @Query("SELECT COUNT(r) FROM ChatReport r WHERE r.reporterId = :reporterId AND r.roomId = :roomId " +
           "AND r.createdAt > :since AND r.status <> :dismissed")
    long countRecentByReporter(@Param("reporterId") UUID reporterId, @Param("roomId") UUID roomId,
                               @Param("since") Instant since, @Param("dismissed") ReportStatus dismissed);

    /**
     * Users with at least {@code minReports} reports in one of the given statuses.
     */
    @Query("SELECT r.reportedUserId AS userId, COUNT(r) AS reportCount FROM ChatReport r " +
           "WHERE r.status IN :statuses " +
           "GROUP BY r.reportedUserId HAVING COUNT(r) >= :minReports ORDER BY COUNT(r) DESC")
    List<UserReportCount> findFrequentlyReported(@Param("statuses") Collection<ReportStatus> statuses,
                                                 @Param("minReports") long minReports);

    @Query("SELECT r.reportType AS reportType, COUNT(r) AS total FROM ChatReport r " +
           "WHERE r.createdAt >= :since GROUP BY r.reportType")
    List<TypeCount> countByTypeSince(@Param("since") Instant since);

    interface UserReportCount {
        UUID getUserId();
        long getReportCount();
    }

    interface TypeCount {
        ReportType getReportType();
        long getTotal();
    }
}
