package io.github.chirino.llmcache.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.llmcache.embedding.EmbeddingGateway;
import io.github.chirino.llmcache.model.CacheEntry;
import io.github.chirino.llmcache.model.CacheItem;
import io.github.chirino.llmcache.model.CacheWritePayload;
import io.github.chirino.llmcache.model.CacheWriteResult;
import io.github.chirino.llmcache.model.ChunkPayload;
import io.github.chirino.llmcache.model.VectorSearchQuery;
import io.github.chirino.llmcache.model.VectorSearchResult;
import io.github.chirino.llmcache.vector.VectorSearchFailedException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Process-local storage for development and tests. Expired items are dropped lazily on access, and
 * similarity is the cosine distance computed over every embedded chunk of the namespace.
 */
@ApplicationScoped
public class InMemoryCacheStorage implements CacheStorage {

    private record StoredItem(CacheItem item, Long expiresAt) {

        boolean liveAt(long now) {
            return expiresAt == null || now < expiresAt;
        }
    }

    private final Map<String, StoredItem> items = new ConcurrentHashMap<>();
    private final Map<String, List<ChunkPayload>> chunks = new ConcurrentHashMap<>();

    private EmbeddingGateway embeddingGateway;
    private ObjectMapper objectMapper;
    private Duration embeddingTimeout;
    private Clock clock;

    protected InMemoryCacheStorage() {}

    @Inject
    public InMemoryCacheStorage(
            EmbeddingGateway embeddingGateway,
            ObjectMapper objectMapper,
            @ConfigProperty(name = "llm-cache.embedding.timeout", defaultValue = "PT10S")
                    Duration embeddingTimeout) {
        this(embeddingGateway, objectMapper, embeddingTimeout, Clock.systemUTC());
    }

    InMemoryCacheStorage(
            EmbeddingGateway embeddingGateway,
            ObjectMapper objectMapper,
            Duration embeddingTimeout,
            Clock clock) {
        this.embeddingGateway = embeddingGateway;
        this.objectMapper = objectMapper;
        this.embeddingTimeout = embeddingTimeout;
        this.clock = clock;
    }

    @Override
    public Uni<CacheWriteResult> write(CacheWritePayload payload, List<ChunkPayload> fragments) {
        return Uni.createFrom()
                .item(
                        () -> {
                            String itemId = upsert(payload);
                            if (fragments == null
                                    || fragments.isEmpty()
                                    || !fragments.stream().allMatch(ChunkPayload::embedded)) {
                                // Chunks of the previous version must not stay searchable.
                                chunks.remove(itemId);
                                return CacheWriteResult.notVectorized(itemId);
                            }
                            chunks.put(itemId, List.copyOf(fragments));
                            return CacheWriteResult.vectorized(itemId);
                        });
    }

    private String upsert(CacheWritePayload payload) {
        long now = clock.millis();
        String itemId = CacheItemIds.resolve(payload.itemId(), payload.namespace(), now);
        items.compute(
                itemId,
                (id, previous) -> {
                    boolean live =
                            previous != null
                                    && previous.liveAt(now)
                                    && payload.namespace().equals(previous.item().namespace());
                    if (previous != null && !live) {
                        chunks.remove(id);
                    }
                    ItemVersioning.Stamp stamp =
                            ItemVersioning.next(
                                    live ? previous.item().createdAt() : null,
                                    live ? previous.item().version() : null,
                                    now);
                    CacheItem item =
                            new CacheItem(
                                    id,
                                    payload.namespace(),
                                    payload.text(),
                                    payload.metaJson(),
                                    stamp.createdAt(),
                                    stamp.updatedAt(),
                                    payload.hasTtl() ? payload.ttlSeconds() : null,
                                    stamp.version());
                    Long expiresAt = payload.hasTtl() ? now + payload.ttlSeconds() * 1000L : null;
                    return new StoredItem(item, expiresAt);
                });
        return itemId;
    }

    @Override
    public Uni<Optional<CacheEntry>> read(String namespace, String itemId) {
        return Uni.createFrom()
                .item(
                        () ->
                                live(itemId)
                                        .map(StoredItem::item)
                                        .filter(item -> namespace.equals(item.namespace()))
                                        .map(
                                                item ->
                                                        new CacheEntry(
                                                                item,
                                                                MetaJson.parse(
                                                                        objectMapper,
                                                                        item.metaJson()))));
    }

    @Override
    public Uni<Boolean> delete(String namespace, String itemId) {
        return Uni.createFrom()
                .item(
                        () -> {
                            Optional<StoredItem> stored = live(itemId);
                            if (stored.isEmpty()
                                    || !namespace.equals(stored.get().item().namespace())) {
                                return false;
                            }
                            items.remove(itemId);
                            chunks.remove(itemId);
                            return true;
                        });
    }

    @Override
    public Uni<List<String>> list(String namespace, int count) {
        return Uni.createFrom()
                .item(
                        () -> {
                            long now = clock.millis();
                            List<String> ids = new ArrayList<>();
                            for (StoredItem stored : List.copyOf(items.values())) {
                                if (ids.size() >= count) {
                                    break;
                                }
                                if (!stored.liveAt(now)) {
                                    evict(stored.item().itemId());
                                } else if (namespace.equals(stored.item().namespace())) {
                                    ids.add(stored.item().itemId());
                                }
                            }
                            return ids;
                        });
    }

    @Override
    public Uni<Boolean> setTtl(String itemId, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return Uni.createFrom()
                    .failure(new InvalidCacheRequestException("ttl_s must be positive"));
        }
        return Uni.createFrom()
                .item(
                        () -> {
                            long now = clock.millis();
                            StoredItem updated =
                                    items.computeIfPresent(
                                            itemId,
                                            (id, stored) -> {
                                                if (!stored.liveAt(now)) {
                                                    return null;
                                                }
                                                CacheItem item = stored.item();
                                                return new StoredItem(
                                                        new CacheItem(
                                                                item.itemId(),
                                                                item.namespace(),
                                                                item.text(),
                                                                item.metaJson(),
                                                                item.createdAt(),
                                                                item.updatedAt(),
                                                                (int) ttlSeconds,
                                                                item.version()),
                                                        now + ttlSeconds * 1000L);
                                            });
                            if (updated == null) {
                                chunks.remove(itemId);
                                return false;
                            }
                            return true;
                        });
    }

    @Override
    public Uni<Optional<Long>> getTtl(String itemId) {
        return Uni.createFrom()
                .item(
                        () -> {
                            long now = clock.millis();
                            return live(itemId)
                                    .map(
                                            stored ->
                                                    stored.expiresAt() == null
                                                            ? NO_TTL
                                                            : (stored.expiresAt() - now + 999)
                                                                    / 1000);
                        });
    }

    @Override
    public Uni<List<VectorSearchResult>> vectorSearch(VectorSearchQuery query) {
        return embeddingGateway
                .embedAsync(List.of(query.query()), embeddingTimeout)
                .map(vectors -> search(query, vectors.get(0)))
                .onFailure(failure -> !(failure instanceof VectorSearchFailedException))
                .transform(
                        failure ->
                                new VectorSearchFailedException(
                                        "Vector search failed: " + failure.getMessage(), failure));
    }

    private List<VectorSearchResult> search(VectorSearchQuery query, float[] vector) {
        long now = clock.millis();
        List<VectorSearchResult> hits = new ArrayList<>();
        for (StoredItem stored : List.copyOf(items.values())) {
            CacheItem item = stored.item();
            if (!stored.liveAt(now) || !query.namespace().equals(item.namespace())) {
                continue;
            }
            for (ChunkPayload chunk : chunks.getOrDefault(item.itemId(), List.of())) {
                if (!chunk.embedded()) {
                    continue;
                }
                hits.add(
                        new VectorSearchResult(
                                item.itemId() + "#" + chunk.seq(),
                                item.itemId(),
                                item.namespace(),
                                chunk.text(),
                                cosineDistance(vector, chunk.embedding()),
                                MetaJson.parse(objectMapper, item.metaJson())));
            }
        }
        return VectorSearchResults.rank(hits, query.namespace(), query.topK(), query.maxDistance());
    }

    static double cosineDistance(float[] a, float[] b) {
        if (a.length != b.length) {
            return Double.NaN;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return Double.NaN;
        }
        return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private Optional<StoredItem> live(String itemId) {
        StoredItem stored = items.get(itemId);
        if (stored == null) {
            return Optional.empty();
        }
        if (!stored.liveAt(clock.millis())) {
            evict(itemId);
            return Optional.empty();
        }
        return Optional.of(stored);
    }

    private void evict(String itemId) {
        items.computeIfPresent(
                itemId, (id, stored) -> stored.liveAt(clock.millis()) ? stored : null);
        if (!items.containsKey(itemId)) {
            chunks.remove(itemId);
        }
    }
}
