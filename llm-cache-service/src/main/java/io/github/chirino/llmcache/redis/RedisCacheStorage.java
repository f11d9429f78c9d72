package io.github.chirino.llmcache.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.llmcache.embedding.EmbeddingGateway;
import io.github.chirino.llmcache.model.CacheEntry;
import io.github.chirino.llmcache.model.CacheWritePayload;
import io.github.chirino.llmcache.model.CacheWriteResult;
import io.github.chirino.llmcache.model.ChunkPayload;
import io.github.chirino.llmcache.model.VectorErrorCode;
import io.github.chirino.llmcache.model.VectorSearchQuery;
import io.github.chirino.llmcache.model.VectorSearchResult;
import io.github.chirino.llmcache.storage.CacheStorage;
import io.github.chirino.llmcache.storage.InvalidCacheRequestException;
import io.github.chirino.llmcache.storage.MetaJson;
import io.github.chirino.llmcache.storage.VectorSearchResults;
import io.github.chirino.llmcache.vector.ChunkIndexManager;
import io.github.chirino.llmcache.vector.VectorSearchFailedException;
import io.quarkus.redis.client.RedisClientName;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Redis Stack backed cache storage. Items and chunks are hashes, similarity search goes through a
 * RediSearch vector index that is created on the first search.
 */
@ApplicationScoped
public class RedisCacheStorage implements CacheStorage {

    private static final Logger LOG = Logger.getLogger(RedisCacheStorage.class);

    private boolean redisEnabled;
    private String clientName;
    private Duration redisTimeout;
    private Duration embeddingTimeout;
    private int maxWriteAttempts;
    private Instance<ReactiveRedisDataSource> redisSources;
    private EmbeddingGateway embeddingGateway;
    private ObjectMapper objectMapper;

    private volatile RedisItemStore items;
    private volatile RedisChunkStore chunks;
    private volatile RedisVectorSearch search;
    private volatile ChunkIndexManager indexManager;

    protected RedisCacheStorage() {}

    @Inject
    public RedisCacheStorage(
            @ConfigProperty(name = "llm-cache.storage.type", defaultValue = "redis")
                    String storageType,
            @ConfigProperty(name = "llm-cache.redis.client") Optional<String> clientName,
            @ConfigProperty(name = "llm-cache.redis.timeout", defaultValue = "PT5S")
                    Duration redisTimeout,
            @ConfigProperty(name = "llm-cache.embedding.timeout", defaultValue = "PT10S")
                    Duration embeddingTimeout,
            @ConfigProperty(name = "llm-cache.item.max-write-attempts", defaultValue = "3")
                    int maxWriteAttempts,
            @Any Instance<ReactiveRedisDataSource> redisSources,
            EmbeddingGateway embeddingGateway,
            ObjectMapper objectMapper) {
        this.redisEnabled = "redis".equalsIgnoreCase(storageType.trim());
        this.clientName = clientName.filter(it -> !it.isBlank()).orElse(null);
        this.redisTimeout = redisTimeout;
        this.embeddingTimeout = embeddingTimeout;
        this.maxWriteAttempts = maxWriteAttempts;
        this.redisSources = redisSources;
        this.embeddingGateway = embeddingGateway;
        this.objectMapper = objectMapper;
    }

    RedisCacheStorage(
            RedisItemStore items,
            RedisChunkStore chunks,
            RedisVectorSearch search,
            ChunkIndexManager indexManager,
            EmbeddingGateway embeddingGateway,
            ObjectMapper objectMapper,
            Duration timeout) {
        this.redisEnabled = true;
        this.items = items;
        this.chunks = chunks;
        this.search = search;
        this.indexManager = indexManager;
        this.embeddingGateway = embeddingGateway;
        this.objectMapper = objectMapper;
        this.redisTimeout = timeout;
        this.embeddingTimeout = timeout;
    }

    @PostConstruct
    void init() {
        if (!redisEnabled) {
            return;
        }
        Instance<ReactiveRedisDataSource> selected =
                clientName != null
                        ? redisSources.select(RedisClientName.Literal.of(clientName))
                        : redisSources;
        if (selected.isUnsatisfied()) {
            LOG.warnf(
                    "Cache storage is set to redis (llm-cache.storage.type=redis) but Redis"
                            + " client '%s' is not available.",
                    clientName == null ? "<default>" : clientName);
            return;
        }
        ReactiveRedisDataSource dataSource = selected.get();
        Clock clock = Clock.systemUTC();
        items = new RedisItemStore(dataSource, clock, maxWriteAttempts);
        chunks = new RedisChunkStore(dataSource, clock);
        search = new RedisVectorSearch(dataSource, objectMapper);
        indexManager = new ChunkIndexManager(new RedisChunkIndexAdmin(dataSource));
    }

    public boolean available() {
        return items != null;
    }

    @Override
    public Uni<CacheWriteResult> write(CacheWritePayload payload, List<ChunkPayload> fragments) {
        return requireAvailable()
                .flatMap(ignored -> bounded(items.upsert(payload)))
                .flatMap(itemId -> writeChunks(payload, itemId, fragments));
    }

    private Uni<CacheWriteResult> writeChunks(
            CacheWritePayload payload, String itemId, List<ChunkPayload> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return dropChunks(itemId);
        }
        if (!fragments.stream().allMatch(ChunkPayload::embedded)) {
            LOG.debugf("Item %s has chunks without embeddings; skipping vectorization", itemId);
            return dropChunks(itemId);
        }
        return bounded(
                        chunks.replaceChunks(
                                payload.namespace(),
                                itemId,
                                payload.metaJson(),
                                fragments,
                                payload.hasTtl() ? payload.ttlSeconds() : null))
                .replaceWith(CacheWriteResult.vectorized(itemId))
                .onFailure()
                .recoverWithItem(
                        failure -> {
                            LOG.warnf(
                                    failure,
                                    "Failed to write %d chunks of item %s",
                                    fragments.size(),
                                    itemId);
                            return CacheWriteResult.failed(
                                    itemId,
                                    VectorErrorCode.INDEX_WRITE_FAILED,
                                    failure.getMessage());
                        });
    }

    /** Chunks of an earlier version must not stay searchable once the item is rewritten. */
    private Uni<CacheWriteResult> dropChunks(String itemId) {
        return bounded(chunks.deleteChunks(itemId))
                .replaceWith(CacheWriteResult.notVectorized(itemId))
                .onFailure()
                .recoverWithItem(
                        failure -> {
                            LOG.warnf(
                                    failure,
                                    "Failed to drop previous chunks of rewritten item %s",
                                    itemId);
                            return CacheWriteResult.notVectorized(itemId);
                        });
    }

    @Override
    public Uni<Optional<CacheEntry>> read(String namespace, String itemId) {
        return requireAvailable()
                .flatMap(ignored -> bounded(items.get(namespace, itemId)))
                .map(
                        item ->
                                item.map(
                                        it ->
                                                new CacheEntry(
                                                        it,
                                                        MetaJson.parse(
                                                                objectMapper, it.metaJson()))));
    }

    @Override
    public Uni<Boolean> delete(String namespace, String itemId) {
        return requireAvailable()
                .flatMap(ignored -> bounded(items.delete(namespace, itemId)))
                .flatMap(
                        deleted -> {
                            if (!deleted) {
                                return Uni.createFrom().item(false);
                            }
                            return bounded(chunks.deleteChunks(itemId))
                                    .replaceWith(true)
                                    .onFailure()
                                    .recoverWithItem(
                                            failure -> {
                                                LOG.warnf(
                                                        failure,
                                                        "Deleted item %s but failed to delete its"
                                                                + " chunks",
                                                        itemId);
                                                return true;
                                            });
                        });
    }

    @Override
    public Uni<List<String>> list(String namespace, int count) {
        return requireAvailable().flatMap(ignored -> bounded(items.listIds(namespace, count)));
    }

    @Override
    public Uni<Boolean> setTtl(String itemId, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return Uni.createFrom()
                    .failure(new InvalidCacheRequestException("ttl_s must be positive"));
        }
        return requireAvailable()
                .flatMap(ignored -> bounded(items.expire(itemId, ttlSeconds)))
                .flatMap(
                        applied -> {
                            if (!applied) {
                                return Uni.createFrom().item(false);
                            }
                            return bounded(chunks.expireChunks(itemId, ttlSeconds))
                                    .replaceWith(true)
                                    .onFailure()
                                    .recoverWithItem(
                                            failure -> {
                                                LOG.warnf(
                                                        failure,
                                                        "Failed to apply TTL to chunks of item %s",
                                                        itemId);
                                                return true;
                                            });
                        });
    }

    @Override
    public Uni<Optional<Long>> getTtl(String itemId) {
        return requireAvailable().flatMap(ignored -> bounded(items.ttl(itemId)));
    }

    @Override
    public Uni<List<VectorSearchResult>> vectorSearch(VectorSearchQuery query) {
        return requireAvailable()
                .flatMap(
                        ignored ->
                                embeddingGateway.embedAsync(
                                        List.of(query.query()), embeddingTimeout))
                .map(vectors -> vectors.get(0))
                .call(ignored -> bounded(indexManager.ensureReady(embeddingGateway)))
                .flatMap(vector -> bounded(search.search(query.namespace(), vector, query.topK())))
                .map(
                        hits ->
                                VectorSearchResults.rank(
                                        hits,
                                        query.namespace(),
                                        query.topK(),
                                        query.maxDistance()))
                .onFailure(failure -> !(failure instanceof VectorSearchFailedException))
                .transform(
                        failure ->
                                new VectorSearchFailedException(
                                        "Vector search failed: " + failure.getMessage(), failure));
    }

    private Uni<Void> requireAvailable() {
        if (!available()) {
            return Uni.createFrom()
                    .failure(new IllegalStateException("Redis cache storage is not available"));
        }
        return Uni.createFrom().voidItem();
    }

    private <T> Uni<T> bounded(Uni<T> operation) {
        return operation
                .ifNoItem()
                .after(redisTimeout)
                .failWith(
                        () ->
                                new IllegalStateException(
                                        "Redis operation timed out after " + redisTimeout));
    }
}
