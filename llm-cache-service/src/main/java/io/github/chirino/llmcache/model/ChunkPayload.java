package io.github.chirino.llmcache.model;

/** One fragment of an item's text. {@code embedding} is null when the fragment was not embedded. */
public record ChunkPayload(int seq, String text, float[] embedding) {

    public boolean embedded() {
        return embedding != null && embedding.length > 0;
    }
}
