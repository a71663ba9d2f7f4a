package com.knowledge.graph.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An append-only note attached to an entity or edge.
 *
 * @param content   note text
 * @param addedBy   who or what added the note (user id, extraction job, agent)
 * @param sourceId  provenance source key, may be null
 * @param addedAt   when the note was appended
 * @param expiresAt optional expiry, null for notes that never expire
 */
public record Note(
        String content,
        String addedBy,
        String sourceId,
        Instant addedAt,
        Instant expiresAt
) {
    public Note {
        Objects.requireNonNull(content, "content is required");
        if (content.isBlank()) {
            throw new IllegalArgumentException("Note content must not be blank");
        }
        if (addedAt == null) {
            addedAt = Instant.now();
        }
    }

    public static Note of(String content, String addedBy) {
        return new Note(content, addedBy, null, Instant.now(), null);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
