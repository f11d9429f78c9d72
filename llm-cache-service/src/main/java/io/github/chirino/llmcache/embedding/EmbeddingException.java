package io.github.chirino.llmcache.embedding;

/** Base class of all failures reported by an {@link EmbeddingGateway}. */
public abstract class EmbeddingException extends RuntimeException {

    protected EmbeddingException(String message) {
        super(message);
    }

    protected EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
