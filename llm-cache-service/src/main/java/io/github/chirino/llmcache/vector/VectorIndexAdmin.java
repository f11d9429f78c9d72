package io.github.chirino.llmcache.vector;

import io.smallrye.mutiny.Uni;

/** Existence check and creation of the backend's chunk similarity index. */
public interface VectorIndexAdmin {

    String indexName();

    /**
     * @throws VectorIndexUnsupportedException (as a failure) when the backend has no similarity
     *     search capability
     */
    Uni<Boolean> indexExists();

    /** Creates the index; an index created concurrently by someone else counts as success. */
    Uni<Void> createIndex(int dimension);
}
