package io.github.chirino.llmcache.redis;

/** Key layout of the cache in Redis. Chunk hashes live under the prefix indexed by RediSearch. */
final class RedisKeys {

    static final String ITEM_PREFIX = "l1:item:";
    static final String CHUNK_PREFIX = "l1:chunk:";
    static final String ITEM_CHUNKS_PREFIX = "l1:item_chunks:";
    static final String CHUNK_INDEX = "idx:l1:chunks";
    static final String VECTOR_FIELD = "vec";

    private RedisKeys() {}

    static String item(String itemId) {
        return ITEM_PREFIX + itemId;
    }

    static String namespaceItems(String namespace) {
        return "l1:ns:" + namespace + ":items";
    }

    static String chunk(String chunkId) {
        return CHUNK_PREFIX + chunkId;
    }

    static String itemChunks(String itemId) {
        return ITEM_CHUNKS_PREFIX + itemId;
    }

    static String chunkId(String itemId, int seq) {
        return itemId + "#" + seq;
    }

    static String stripChunkPrefix(String key) {
        return key.startsWith(CHUNK_PREFIX) ? key.substring(CHUNK_PREFIX.length()) : key;
    }
}
