package io.github.chirino.llmcache.redis;

import io.github.chirino.llmcache.model.ChunkPayload;
import io.github.chirino.llmcache.storage.ChunkWriteFailedException;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.transactions.ReactiveTransactionalRedisDataSource;
import io.smallrye.mutiny.Uni;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chunk hashes of an item, written under {@code l1:chunk:<itemId>#<seq>} and tracked by the set
 * {@code l1:item_chunks:<itemId>}. The vector is stored as a binary hash field next to the string
 * fields so the RediSearch index picks it up.
 */
public class RedisChunkStore {

    static final String CHUNK_ID = "chunk_id";
    static final String ITEM_ID = "item_id";
    static final String NAMESPACE = "ns";
    static final String SEQ = "seq";
    static final String TEXT = "text";
    static final String META_JSON = "meta_json";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";

    private final ReactiveRedisDataSource dataSource;
    private final ReactiveSetCommands<String, String> sets;
    private final ReactiveKeyCommands<String> keys;
    private final Clock clock;

    public RedisChunkStore(ReactiveRedisDataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.sets = dataSource.set(String.class);
        this.keys = dataSource.key();
        this.clock = clock;
    }

    /**
     * Replaces every chunk of the item in one transaction. The previous chunk hashes are deleted
     * along with the membership set, so a shorter rewrite leaves no stale chunk behind.
     *
     * @param ttlSeconds expiry applied to each chunk and to the membership set, or null for none
     */
    public Uni<Void> replaceChunks(
            String namespace,
            String itemId,
            String metaJson,
            List<ChunkPayload> chunks,
            Integer ttlSeconds) {
        String membersKey = RedisKeys.itemChunks(itemId);
        return sets.smembers(membersKey)
                .flatMap(
                        previous ->
                                dataSource.withTransaction(
                                        tx ->
                                                writeChunks(
                                                        tx,
                                                        namespace,
                                                        itemId,
                                                        metaJson,
                                                        chunks,
                                                        ttlSeconds,
                                                        previous)))
                .flatMap(
                        result -> {
                            if (result.discarded()) {
                                return Uni.createFrom()
                                        .failure(
                                                new ChunkWriteFailedException(
                                                        "Chunk transaction for item "
                                                                + itemId
                                                                + " was discarded"));
                            }
                            return Uni.createFrom().voidItem();
                        });
    }

    private Uni<Void> writeChunks(
            ReactiveTransactionalRedisDataSource tx,
            String namespace,
            String itemId,
            String metaJson,
            List<ChunkPayload> chunks,
            Integer ttlSeconds,
            Set<String> previous) {
        String membersKey = RedisKeys.itemChunks(itemId);
        String now = String.valueOf(clock.millis());

        List<String> stale = new ArrayList<>();
        stale.add(membersKey);
        if (previous != null) {
            for (String chunkId : previous) {
                stale.add(RedisKeys.chunk(chunkId));
            }
        }
        Uni<Void> pipeline = tx.key().del(stale.toArray(String[]::new));

        for (ChunkPayload chunk : chunks) {
            String chunkId = RedisKeys.chunkId(itemId, chunk.seq());
            String key = RedisKeys.chunk(chunkId);
            Map<String, String> fields = new HashMap<>();
            fields.put(CHUNK_ID, chunkId);
            fields.put(ITEM_ID, itemId);
            fields.put(NAMESPACE, namespace);
            fields.put(SEQ, String.valueOf(chunk.seq()));
            fields.put(TEXT, chunk.text());
            fields.put(META_JSON, metaJson == null ? "" : metaJson);
            fields.put(CREATED_AT, now);
            fields.put(UPDATED_AT, now);

            pipeline = pipeline.chain(() -> tx.hash(String.class).hset(key, fields));
            if (chunk.embedded()) {
                byte[] vector = VectorCodec.toBytes(chunk.embedding());
                pipeline =
                        pipeline.chain(
                                () ->
                                        tx.hash(String.class, String.class, byte[].class)
                                                .hset(key, RedisKeys.VECTOR_FIELD, vector));
            }
            pipeline = pipeline.chain(() -> tx.set(String.class).sadd(membersKey, chunkId));
            if (ttlSeconds != null) {
                pipeline = pipeline.chain(() -> tx.key().expire(key, ttlSeconds.longValue()));
            }
        }
        if (ttlSeconds != null && !chunks.isEmpty()) {
            pipeline = pipeline.chain(() -> tx.key().expire(membersKey, ttlSeconds.longValue()));
        }
        return pipeline;
    }

    /** Deletes every chunk of the item along with its membership set. */
    public Uni<Integer> deleteChunks(String itemId) {
        String membersKey = RedisKeys.itemChunks(itemId);
        return sets.smembers(membersKey)
                .flatMap(
                        chunkIds -> {
                            List<String> targets = new ArrayList<>();
                            targets.add(membersKey);
                            for (String chunkId : chunkIds) {
                                targets.add(RedisKeys.chunk(chunkId));
                            }
                            return keys.del(targets.toArray(String[]::new));
                        });
    }

    /** Applies the item's new expiry to its chunks. */
    public Uni<Void> expireChunks(String itemId, long ttlSeconds) {
        String membersKey = RedisKeys.itemChunks(itemId);
        return sets.smembers(membersKey)
                .flatMap(
                        chunkIds -> {
                            if (chunkIds.isEmpty()) {
                                return Uni.createFrom().voidItem();
                            }
                            List<Uni<Boolean>> expiries = new ArrayList<>(chunkIds.size() + 1);
                            expiries.add(keys.expire(membersKey, ttlSeconds));
                            for (String chunkId : chunkIds) {
                                expiries.add(keys.expire(RedisKeys.chunk(chunkId), ttlSeconds));
                            }
                            return Uni.join().all(expiries).andFailFast().replaceWithVoid();
                        });
    }
}
