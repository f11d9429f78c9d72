package io.github.chirino.llmcache.model;

/**
 * A versioned, namespaced cache record as persisted by the item store. {@code metaJson} is the
 * opaque serialized side-data; timestamps are epoch milliseconds.
 */
public record CacheItem(
        String itemId,
        String namespace,
        String text,
        String metaJson,
        long createdAt,
        long updatedAt,
        Integer ttlSeconds,
        long version) {}
