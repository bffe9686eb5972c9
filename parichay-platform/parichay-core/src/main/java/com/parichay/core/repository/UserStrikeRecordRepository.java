package com.parichay.core.repository;

import com.parichay.core.domain.UserStrikeRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserStrikeRecordRepository extends JpaRepository<UserStrikeRecord, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM UserStrikeRecord s WHERE s.userId = :userId")
    Optional<UserStrikeRecord> findByIdForUpdate(@Param("userId") UUID userId);
}
