package io.github.chirino.llmcache.storage;

import io.github.chirino.llmcache.model.CacheEntry;
import io.github.chirino.llmcache.model.CacheWritePayload;
import io.github.chirino.llmcache.model.CacheWriteResult;
import io.github.chirino.llmcache.model.ChunkPayload;
import io.github.chirino.llmcache.model.VectorSearchQuery;
import io.github.chirino.llmcache.model.VectorSearchResult;
import io.smallrye.mutiny.Uni;
import java.util.List;
import java.util.Optional;

/**
 * Storage backend behind the cache HTTP surface. Combines versioned item storage, per-item chunk
 * vectors and namespace-scoped similarity search.
 */
public interface CacheStorage {

    /** Value reported by {@link #getTtl(String)} for an item that exists but never expires. */
    long NO_TTL = -1L;

    /**
     * Upserts the item and, when every chunk carries an embedding, replaces the item's chunk set.
     * A failed chunk write is reported as {@code index_write_failed}; the item write stays
     * committed.
     */
    Uni<CacheWriteResult> write(CacheWritePayload payload, List<ChunkPayload> chunks);

    /** Empty when the item does not exist or belongs to another namespace. */
    Uni<Optional<CacheEntry>> read(String namespace, String itemId);

    /** Removes the item, its namespace membership and its chunks. */
    Uni<Boolean> delete(String namespace, String itemId);

    /** A sample of at most {@code count} live item ids; not a stable ordering. */
    Uni<List<String>> list(String namespace, int count);

    Uni<Boolean> setTtl(String itemId, long ttlSeconds);

    /**
     * @return empty when the item does not exist, {@link #NO_TTL} when it never expires, otherwise
     *     the remaining seconds
     */
    Uni<Optional<Long>> getTtl(String itemId);

    /** Hits of the query's namespace, ascending by score and at most {@code topK} long. */
    Uni<List<VectorSearchResult>> vectorSearch(VectorSearchQuery query);
}
