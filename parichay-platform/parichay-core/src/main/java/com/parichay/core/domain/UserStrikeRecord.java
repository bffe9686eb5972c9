package com.parichay.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Running strike total of one user. The row is locked while a ledger entry is written
 * so concurrent actions against the same user get consecutive counts.
 */
@Entity
@Table(name = "user_strike_records")
public class UserStrikeRecord {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "strike_count", nullable = false)
    private int strikeCount;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected UserStrikeRecord() {}

    public static UserStrikeRecord create(UUID userId, Instant now) {
        var record = new UserStrikeRecord();
        record.userId = userId;
        record.strikeCount = 0;
        record.updatedAt = now;
        return record;
    }

    /**
     * Monotonic: the count never decreases, overturned appeals included.
     */
    public int addStrike(Instant now) {
        strikeCount++;
        updatedAt = now;
        return strikeCount;
    }

    // Getters
    public UUID getUserId() { return userId; }
    public int getStrikeCount() { return strikeCount; }
    public Instant getUpdatedAt() { return updatedAt; }
}
