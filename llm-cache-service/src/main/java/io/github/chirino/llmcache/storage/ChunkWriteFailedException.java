package io.github.chirino.llmcache.storage;

/** Persisting an item's chunks failed. The item itself may already be committed. */
public class ChunkWriteFailedException extends RuntimeException {

    public ChunkWriteFailedException(String message) {
        super(message);
    }

    public ChunkWriteFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
