package io.github.chirino.llmcache.redis;

import io.github.chirino.llmcache.model.CacheItem;
import io.github.chirino.llmcache.model.CacheWritePayload;
import io.github.chirino.llmcache.storage.CacheItemIds;
import io.github.chirino.llmcache.storage.CacheStorage;
import io.github.chirino.llmcache.storage.ConcurrentItemUpdateException;
import io.github.chirino.llmcache.storage.ItemVersioning;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.hash.ReactiveTransactionalHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.transactions.ReactiveTransactionalRedisDataSource;
import io.smallrye.mutiny.Uni;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Versioned items stored as Redis hashes under {@code l1:item:<id>}, with one membership set per
 * namespace.
 *
 * <p>The version bump reads the previous {@code created_at}/{@code version} and writes the new hash
 * in a transaction that {@code WATCH}es the item key. If a concurrent writer touches the key in
 * between, the transaction is discarded and the write is attempted again, up to {@code
 * maxWriteAttempts} times.
 */
public class RedisItemStore {

    private static final Logger LOG = Logger.getLogger(RedisItemStore.class);

    static final String ITEM_ID = "item_id";
    static final String NAMESPACE = "ns";
    static final String TEXT = "text";
    static final String META_JSON = "meta_json";
    static final String CREATED_AT = "created_at";
    static final String UPDATED_AT = "updated_at";
    static final String TTL_SECONDS = "ttl_s";
    static final String VERSION = "version";

    private final ReactiveRedisDataSource dataSource;
    private final ReactiveHashCommands<String, String, String> hashes;
    private final ReactiveSetCommands<String, String> sets;
    private final ReactiveKeyCommands<String> keys;
    private final Clock clock;
    private final int maxWriteAttempts;

    public RedisItemStore(ReactiveRedisDataSource dataSource, Clock clock, int maxWriteAttempts) {
        this.dataSource = dataSource;
        this.hashes = dataSource.hash(String.class);
        this.sets = dataSource.set(String.class);
        this.keys = dataSource.key();
        this.clock = clock;
        this.maxWriteAttempts = Math.max(1, maxWriteAttempts);
    }

    /** Creates or replaces the item and returns its id. */
    public Uni<String> upsert(CacheWritePayload payload) {
        String itemId = CacheItemIds.resolve(payload.itemId(), payload.namespace(), clock.millis());
        return attemptUpsert(itemId, payload, 1);
    }

    private Uni<String> attemptUpsert(String itemId, CacheWritePayload payload, int attempt) {
        String key = RedisKeys.item(itemId);
        return dataSource
                .withTransaction(
                        pre -> pre.hash(String.class).hmget(key, CREATED_AT, VERSION, NAMESPACE),
                        (Map<String, String> previous, ReactiveTransactionalRedisDataSource tx) ->
                                writeItem(tx, itemId, payload, previous),
                        key)
                .flatMap(
                        result -> {
                            if (!result.discarded()) {
                                return Uni.createFrom().item(itemId);
                            }
                            if (attempt >= maxWriteAttempts) {
                                return Uni.createFrom()
                                        .failure(
                                                new ConcurrentItemUpdateException(
                                                        itemId, attempt));
                            }
                            LOG.debugf(
                                    "Concurrent update of item %s, retrying (attempt %d)",
                                    itemId, attempt + 1);
                            return attemptUpsert(itemId, payload, attempt + 1);
                        });
    }

    private Uni<Void> writeItem(
            ReactiveTransactionalRedisDataSource tx,
            String itemId,
            CacheWritePayload payload,
            Map<String, String> previous) {
        String key = RedisKeys.item(itemId);
        String previousNamespace = previous == null ? null : previous.get(NAMESPACE);
        boolean moved =
                previousNamespace != null && !previousNamespace.equals(payload.namespace());
        // An id taken over by another namespace starts a new item.
        ItemVersioning.Stamp stamp =
                previous == null || moved
                        ? ItemVersioning.first(clock.millis())
                        : ItemVersioning.next(
                                ItemVersioning.parse(previous.get(CREATED_AT)),
                                ItemVersioning.parse(previous.get(VERSION)),
                                clock.millis());

        Map<String, String> fields = new HashMap<>();
        fields.put(ITEM_ID, itemId);
        fields.put(NAMESPACE, payload.namespace());
        fields.put(TEXT, payload.text());
        fields.put(META_JSON, payload.metaJson() == null ? "" : payload.metaJson());
        fields.put(CREATED_AT, String.valueOf(stamp.createdAt()));
        fields.put(UPDATED_AT, String.valueOf(stamp.updatedAt()));
        fields.put(TTL_SECONDS, payload.hasTtl() ? String.valueOf(payload.ttlSeconds()) : "");
        fields.put(VERSION, String.valueOf(stamp.version()));

        ReactiveTransactionalHashCommands<String, String, String> txHashes = tx.hash(String.class);
        Uni<Void> write = txHashes.hset(key, fields);
        if (moved) {
            write =
                    write.chain(
                            () ->
                                    tx.set(String.class)
                                            .srem(
                                                    RedisKeys.namespaceItems(previousNamespace),
                                                    itemId));
        }
        write =
                write
                        .chain(
                                () ->
                                        tx.set(String.class)
                                                .sadd(
                                                        RedisKeys.namespaceItems(
                                                                payload.namespace()),
                                                        itemId));
        if (payload.hasTtl()) {
            return write.chain(() -> tx.key().expire(key, payload.ttlSeconds().longValue()));
        }
        // A rewrite fully replaces the item, including a TTL set by an earlier write.
        return write.chain(() -> tx.key().persist(key));
    }

    /** Empty when the item is missing or owned by another namespace. */
    public Uni<Optional<CacheItem>> get(String namespace, String itemId) {
        return hashes.hgetall(RedisKeys.item(itemId))
                .map(
                        hash -> {
                            if (hash == null || hash.isEmpty()) {
                                return Optional.<CacheItem>empty();
                            }
                            if (!namespace.equals(hash.get(NAMESPACE))) {
                                return Optional.<CacheItem>empty();
                            }
                            return Optional.of(toItem(itemId, hash));
                        });
    }

    /** Returns false when the item is missing or owned by another namespace. */
    public Uni<Boolean> delete(String namespace, String itemId) {
        String key = RedisKeys.item(itemId);
        return hashes.hget(key, NAMESPACE)
                .flatMap(
                        owner -> {
                            if (owner == null || !owner.equals(namespace)) {
                                return Uni.createFrom().item(false);
                            }
                            return dataSource
                                    .withTransaction(
                                            tx ->
                                                    tx.key()
                                                            .del(key)
                                                            .chain(
                                                                    () ->
                                                                            tx.set(String.class)
                                                                                    .srem(
                                                                                            RedisKeys
                                                                                                    .namespaceItems(
                                                                                                            namespace),
                                                                                            itemId)))
                                    .map(result -> !result.discarded());
                        });
    }

    /**
     * Samples the namespace membership set. Members whose item has expired are left out of the
     * result and removed from the set in the background.
     */
    public Uni<List<String>> listIds(String namespace, int count) {
        String membersKey = RedisKeys.namespaceItems(namespace);
        return sets.srandmember(membersKey, count)
                .flatMap(
                        ids -> {
                            if (ids == null || ids.isEmpty()) {
                                return Uni.createFrom().item(List.<String>of());
                            }
                            List<Uni<Boolean>> checks = new ArrayList<>(ids.size());
                            for (String id : ids) {
                                checks.add(keys.exists(RedisKeys.item(id)));
                            }
                            return Uni.join()
                                    .all(checks)
                                    .andFailFast()
                                    .map(exists -> liveIds(membersKey, ids, exists));
                        });
    }

    private List<String> liveIds(String membersKey, List<String> ids, List<Boolean> exists) {
        List<String> live = new ArrayList<>(ids.size());
        List<String> stale = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            if (Boolean.TRUE.equals(exists.get(i))) {
                live.add(ids.get(i));
            } else {
                stale.add(ids.get(i));
            }
        }
        if (!stale.isEmpty()) {
            sets.srem(membersKey, stale.toArray(String[]::new))
                    .subscribe()
                    .with(
                            removed -> LOG.debugf("Pruned %d expired members of %s", removed, membersKey),
                            failure ->
                                    LOG.warnf(
                                            failure,
                                            "Failed to prune expired members of %s",
                                            membersKey));
        }
        return live;
    }

    /** Empty when the key is missing; {@link CacheStorage#NO_TTL} when it has no expiry. */
    public Uni<Optional<Long>> ttl(String itemId) {
        return dataSource
                .execute("TTL", RedisKeys.item(itemId))
                .map(
                        response -> {
                            long ttl = response == null ? -2 : response.toLong();
                            if (ttl == -2) {
                                return Optional.<Long>empty();
                            }
                            return Optional.of(ttl < 0 ? CacheStorage.NO_TTL : ttl);
                        });
    }

    public Uni<Boolean> expire(String itemId, long ttlSeconds) {
        String key = RedisKeys.item(itemId);
        return keys.expire(key, ttlSeconds)
                .flatMap(
                        applied -> {
                            if (!Boolean.TRUE.equals(applied)) {
                                return Uni.createFrom().item(false);
                            }
                            return hashes.hset(key, TTL_SECONDS, String.valueOf(ttlSeconds))
                                    .replaceWith(true);
                        });
    }

    private static CacheItem toItem(String itemId, Map<String, String> hash) {
        Long createdAt = ItemVersioning.parse(hash.get(CREATED_AT));
        Long updatedAt = ItemVersioning.parse(hash.get(UPDATED_AT));
        Long ttl = ItemVersioning.parse(hash.get(TTL_SECONDS));
        Long version = ItemVersioning.parse(hash.get(VERSION));
        String metaJson = hash.get(META_JSON);
        return new CacheItem(
                hash.getOrDefault(ITEM_ID, itemId),
                hash.get(NAMESPACE),
                hash.getOrDefault(TEXT, ""),
                metaJson == null || metaJson.isEmpty() ? null : metaJson,
                createdAt == null ? 0L : createdAt,
                updatedAt == null ? 0L : updatedAt,
                ttl == null ? null : ttl.intValue(),
                version == null ? 1L : version);
    }
}
