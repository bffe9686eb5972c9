package com.parichay.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.parichay.core.error.ValidationException;

import java.util.List;
import java.util.UUID;

/**
 * Structured evidence attached to a report. Stored as a JSON document whose
 * {@code schemaVersion} is checked when the report is filed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvidencePayload(
        int schemaVersion,
        List<UUID> messageIds,
        List<String> links,
        String note
) {

    public static final int CURRENT_VERSION = 1;
    private static final int MAX_ITEMS = 50;
    private static final int MAX_NOTE_LENGTH = 2000;

    public EvidencePayload {
        messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static EvidencePayload of(List<UUID> messageIds, List<String> links, String note) {
        return new EvidencePayload(CURRENT_VERSION, messageIds, links, note);
    }

    public EvidencePayload validated() {
        if (schemaVersion != CURRENT_VERSION) {
            throw new ValidationException("UNSUPPORTED_EVIDENCE_VERSION",
                    "Evidence schema version " + schemaVersion + " is not supported");
        }
        if (messageIds.size() > MAX_ITEMS || links.size() > MAX_ITEMS) {
            throw new ValidationException("EVIDENCE_TOO_LARGE", "Evidence lists are limited to " + MAX_ITEMS + " items");
        }
        if (note != null && note.length() > MAX_NOTE_LENGTH) {
            throw new ValidationException("EVIDENCE_TOO_LARGE", "Evidence note exceeds " + MAX_NOTE_LENGTH + " characters");
        }
        return this;
    }
}
