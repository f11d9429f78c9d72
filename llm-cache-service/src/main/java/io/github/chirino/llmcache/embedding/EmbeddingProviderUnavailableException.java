package io.github.chirino.llmcache.embedding;

/** The provider cannot be called at all, e.g. credentials are missing or embedding is disabled. */
public class EmbeddingProviderUnavailableException extends EmbeddingException {

    public EmbeddingProviderUnavailableException(String message) {
        super(message);
    }
}
