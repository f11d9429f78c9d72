package io.github.chirino.llmcache.chunking;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Splits text into an ordered sequence of overlapping fragments.
 *
 * <p>Each fragment is at most {@code size} characters long and starts {@code size - overlap}
 * characters after the previous one. The last fragment always ends at the end of the text. An
 * overlap of {@code size} or more is clamped to {@code size - 1} so that every step advances.
 */
@ApplicationScoped
public class TextChunker {

    public static final int DEFAULT_SIZE = 1200;
    public static final int DEFAULT_OVERLAP = 150;

    private final int size;
    private final int overlap;

    @Inject
    public TextChunker(
            @ConfigProperty(name = "llm-cache.chunking.size", defaultValue = "1200") int size,
            @ConfigProperty(name = "llm-cache.chunking.overlap", defaultValue = "150")
                    int overlap) {
        validate(size, overlap);
        this.size = size;
        this.overlap = overlap;
    }

    public TextChunker() {
        this(DEFAULT_SIZE, DEFAULT_OVERLAP);
    }

    public List<TextChunk> split(String text) {
        return split(text, size, overlap);
    }

    public static List<TextChunk> split(String text, int size, int overlap) {
        validate(size, overlap);
        String source = text == null ? "" : text;
        int step = size - Math.min(overlap, size - 1);

        List<TextChunk> chunks = new ArrayList<>();
        if (source.isEmpty()) {
            chunks.add(new TextChunk(0, 0, 0, ""));
            return chunks;
        }

        int start = 0;
        int seq = 0;
        while (true) {
            int end = Math.min(start + size, source.length());
            chunks.add(new TextChunk(seq++, start, end, source.substring(start, end)));
            if (end == source.length()) {
                return chunks;
            }
            start += step;
        }
    }

    private static void validate(int size, int overlap) {
        if (size <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, was " + size);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("Chunk overlap must not be negative, was " + overlap);
        }
    }
}
