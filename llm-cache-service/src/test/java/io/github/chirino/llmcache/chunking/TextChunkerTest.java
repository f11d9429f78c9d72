package io.github.chirino.llmcache.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

    private static final String ALPHABET_25 = "abcdefghijklmnopqrstuvwxy";

    @Test
    void splits_with_overlap_and_ends_at_input_length() {
        List<TextChunk> chunks = TextChunker.split(ALPHABET_25, 10, 3);

        assertEquals(4, chunks.size());
        assertChunk(chunks.get(0), 0, 0, 10);
        assertChunk(chunks.get(1), 1, 7, 17);
        assertChunk(chunks.get(2), 2, 14, 24);
        assertChunk(chunks.get(3), 3, 21, 25);
        assertEquals("vwxy", chunks.get(3).text());
    }

    @Test
    void consecutive_chunks_share_the_overlap() {
        String text = "x".repeat(40) + "y".repeat(40) + "z".repeat(17);
        List<TextChunk> chunks = TextChunker.split(text, 20, 5);

        assertEquals(0, chunks.get(0).start());
        assertEquals(text.length(), chunks.get(chunks.size() - 1).end());
        for (int i = 1; i < chunks.size(); i++) {
            TextChunk previous = chunks.get(i - 1);
            TextChunk current = chunks.get(i);
            assertEquals(previous.end() - 5, current.start());
            assertEquals(i, current.seq());
            assertTrue(current.text().length() <= 20);
            assertEquals(text.substring(current.start(), current.end()), current.text());
        }
    }

    @Test
    void short_text_yields_single_chunk() {
        List<TextChunk> chunks = TextChunker.split("hello", 1200, 150);

        assertEquals(1, chunks.size());
        assertEquals("hello", chunks.get(0).text());
    }

    @Test
    void text_of_exactly_one_chunk_is_not_split_again() {
        List<TextChunk> chunks = TextChunker.split("0123456789", 10, 3);

        assertEquals(1, chunks.size());
        assertChunk(chunks.get(0), 0, 0, 10);
    }

    @Test
    void empty_text_yields_one_empty_chunk() {
        List<TextChunk> chunks = TextChunker.split("", 10, 3);

        assertEquals(1, chunks.size());
        assertEquals("", chunks.get(0).text());
        assertEquals(0, chunks.get(0).seq());
    }

    @Test
    void overlap_not_smaller_than_size_still_advances() {
        List<TextChunk> chunks = TextChunker.split("abcdef", 3, 7);

        assertEquals(4, chunks.size());
        assertEquals("abc", chunks.get(0).text());
        assertEquals("bcd", chunks.get(1).text());
        assertEquals("def", chunks.get(3).text());
    }

    @Test
    void rejects_invalid_parameters() {
        assertThrows(IllegalArgumentException.class, () -> TextChunker.split("abc", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> TextChunker.split("abc", -1, 0));
        assertThrows(IllegalArgumentException.class, () -> TextChunker.split("abc", 10, -1));
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(0, 0));
    }

    @Test
    void configured_instance_uses_its_settings() {
        TextChunker chunker = new TextChunker(10, 3);

        assertEquals(4, chunker.split(ALPHABET_25).size());
        assertEquals(1, new TextChunker().split(ALPHABET_25).size());
    }

    private static void assertChunk(TextChunk chunk, int seq, int start, int end) {
        assertEquals(seq, chunk.seq());
        assertEquals(start, chunk.start());
        assertEquals(end, chunk.end());
        assertEquals(ALPHABET_25.substring(start, end), chunk.text());
    }
}
