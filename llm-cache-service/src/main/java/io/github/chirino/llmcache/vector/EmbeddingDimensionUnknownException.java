package io.github.chirino.llmcache.vector;

/**
 * The index cannot be created because the embedding gateway does not know its vector size yet.
 * Resolves itself once an embedding call succeeds.
 */
public class EmbeddingDimensionUnknownException extends RuntimeException {

    public EmbeddingDimensionUnknownException(String modelId) {
        super(
                "Embedding gateway "
                        + modelId
                        + " did not report a vector dimension; cannot create vector index");
    }
}
