package com.knowledge.graph.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.graph.core.model.Note;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Encodes notes as JSON strings, the form they take inside a node's {@code notes} list.
 */
public final class NoteCodec {
    private static final Logger log = LoggerFactory.getLogger(NoteCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private NoteCodec() {
    }

    public static String encode(Note note) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("content", note.content());
        fields.put("added_by", note.addedBy());
        fields.put("source_id", note.sourceId());
        fields.put("added_at", note.addedAt().toEpochMilli());
        fields.put("expires_at", note.expiresAt() != null ? note.expiresAt().toEpochMilli() : null);
        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Note cannot be encoded: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes one stored note. Plain strings written by older clients become notes
     * with only content.
     */
    public static Optional<Note> decode(String stored) {
        if (stored == null || stored.isBlank()) {
            return Optional.empty();
        }
        if (!stored.trim().startsWith("{")) {
            return Optional.of(new Note(stored, null, null, Instant.EPOCH, null));
        }
        try {
            Map<String, Object> fields = MAPPER.readValue(stored, MAP_TYPE);
            Object content = fields.get("content");
            if (content == null || content.toString().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(new Note(
                    content.toString(),
                    (String) fields.get("added_by"),
                    (String) fields.get("source_id"),
                    toInstant(fields.get("added_at")),
                    toInstant(fields.get("expires_at"))));
        } catch (JsonProcessingException e) {
            log.warn("note.decode.failed value='{}' error={}", stored, e.getMessage());
            return Optional.empty();
        }
    }

    public static List<Note> decodeAll(Object stored) {
        List<Note> notes = new ArrayList<>();
        if (stored instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    decode(item.toString()).ifPresent(notes::add);
                }
            }
        }
        return notes;
    }

    private static Instant toInstant(Object value) {
        return value instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }
}
