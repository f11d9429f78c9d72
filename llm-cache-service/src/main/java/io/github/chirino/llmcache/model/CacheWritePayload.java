package io.github.chirino.llmcache.model;

/** Item fields of a cache write. {@code itemId} is null when the store should generate one. */
public record CacheWritePayload(
        String namespace, String itemId, String text, String metaJson, Integer ttlSeconds) {

    public boolean hasTtl() {
        return ttlSeconds != null && ttlSeconds > 0;
    }
}
