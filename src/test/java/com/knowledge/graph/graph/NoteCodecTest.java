package com.knowledge.graph.graph;

import com.knowledge.graph.core.model.Note;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NoteCodec Tests")
class NoteCodecTest {

    @Test
    @DisplayName("Encoded notes are JSON objects with epoch-millisecond timestamps")
    void encodesAsJson() {
        Note note = new Note("Prefers \"quoted\" text", "user-1", "src-9",
                Instant.ofEpochMilli(1_700_000_000_000L), null);

        String encoded = NoteCodec.encode(note);

        assertTrue(encoded.startsWith("{"));
        assertTrue(encoded.contains("\"added_at\":1700000000000"));
        assertEquals(Optional.of(note), NoteCodec.decode(encoded));
    }

    @Test
    @DisplayName("Plain strings decode to content-only notes")
    void legacyPlainString() {
        Note note = NoteCodec.decode("met at the conference").orElseThrow();

        assertEquals("met at the conference", note.content());
        assertNull(note.addedBy());
        assertEquals(Instant.EPOCH, note.addedAt());
    }

    @Test
    @DisplayName("Malformed JSON and blank content are skipped")
    void malformedSkipped() {
        assertTrue(NoteCodec.decode("{not json").isEmpty());
        assertTrue(NoteCodec.decode("{\"content\": \"  \"}").isEmpty());
        assertTrue(NoteCodec.decode("").isEmpty());
    }

    @Test
    @DisplayName("decodeAll ignores nulls and non-list values")
    void decodeAll() {
        List<Note> notes = NoteCodec.decodeAll(Arrays.asList("first", null, "{\"content\":\"second\"}"));

        assertEquals(List.of("first", "second"), notes.stream().map(Note::content).toList());
        assertTrue(NoteCodec.decodeAll("not a list").isEmpty());
        assertTrue(NoteCodec.decodeAll(null).isEmpty());
    }
}
