package io.github.chirino.llmcache.vector;

/** The backing store has no similarity-search capability. Not retried. */
public class VectorIndexUnsupportedException extends RuntimeException {

    public VectorIndexUnsupportedException(String message, Throwable cause) {
        super(message, cause);
    }
}
