package com.parichay.core.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Two participant identities in deterministic order.
 * Ordering is lexicographic on the canonical string form of the identifiers,
 * so the same pair always yields the same key regardless of who initiated.
 */
public record CanonicalPair(UUID low, UUID high) {

    public CanonicalPair {
        Objects.requireNonNull(low, "low");
        Objects.requireNonNull(high, "high");
        if (low.toString().compareTo(high.toString()) > 0) {
            throw new IllegalArgumentException("Pair is not in canonical order");
        }
    }

    public static CanonicalPair of(UUID a, UUID b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return a.toString().compareTo(b.toString()) <= 0 ? new CanonicalPair(a, b) : new CanonicalPair(b, a);
    }

    public boolean contains(UUID userId) {
        return low.equals(userId) || high.equals(userId);
    }

    public UUID other(UUID userId) {
        if (low.equals(userId)) {
            return high;
        }
        if (high.equals(userId)) {
            return low;
        }
        throw new IllegalArgumentException("User is not part of the pair: " + userId);
    }

    public String key() {
        return low + ":" + high;
    }
}
