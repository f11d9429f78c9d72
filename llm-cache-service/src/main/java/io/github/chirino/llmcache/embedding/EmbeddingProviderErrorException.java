package io.github.chirino.llmcache.embedding;

/** The provider call failed or returned a non-success status. */
public class EmbeddingProviderErrorException extends EmbeddingException {

    public EmbeddingProviderErrorException(String message) {
        super(message);
    }

    public EmbeddingProviderErrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
