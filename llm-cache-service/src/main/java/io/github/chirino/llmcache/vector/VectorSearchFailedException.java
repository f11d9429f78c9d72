package io.github.chirino.llmcache.vector;

public class VectorSearchFailedException extends RuntimeException {

    public VectorSearchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
