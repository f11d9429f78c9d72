package io.github.chirino.llmcache.storage;

import io.github.chirino.llmcache.model.CacheEntry;
import io.github.chirino.llmcache.model.CacheWritePayload;
import io.github.chirino.llmcache.model.CacheWriteResult;
import io.github.chirino.llmcache.model.ChunkPayload;
import io.github.chirino.llmcache.model.VectorSearchQuery;
import io.github.chirino.llmcache.model.VectorSearchResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.smallrye.mutiny.Uni;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decorator that wraps a CacheStorage implementation with timing metrics. Every operation is
 * recorded with the Micrometer timer "llm-cache.storage.operation", tagged with the operation name
 * and whether it succeeded.
 */
public class MeteredCacheStorage implements CacheStorage {

    static final String METRIC = "llm-cache.storage.operation";

    private final MeterRegistry registry;
    private final CacheStorage delegate;

    public MeteredCacheStorage(MeterRegistry registry, CacheStorage delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    public CacheStorage delegate() {
        return delegate;
    }

    @Override
    public Uni<CacheWriteResult> write(CacheWritePayload payload, List<ChunkPayload> chunks) {
        return timed("write", () -> delegate.write(payload, chunks));
    }

    @Override
    public Uni<Optional<CacheEntry>> read(String namespace, String itemId) {
        return timed("read", () -> delegate.read(namespace, itemId));
    }

    @Override
    public Uni<Boolean> delete(String namespace, String itemId) {
        return timed("delete", () -> delegate.delete(namespace, itemId));
    }

    @Override
    public Uni<List<String>> list(String namespace, int count) {
        return timed("list", () -> delegate.list(namespace, count));
    }

    @Override
    public Uni<Boolean> setTtl(String itemId, long ttlSeconds) {
        return timed("setTtl", () -> delegate.setTtl(itemId, ttlSeconds));
    }

    @Override
    public Uni<Optional<Long>> getTtl(String itemId) {
        return timed("getTtl", () -> delegate.getTtl(itemId));
    }

    @Override
    public Uni<List<VectorSearchResult>> vectorSearch(VectorSearchQuery query) {
        return timed("vectorSearch", () -> delegate.vectorSearch(query));
    }

    private <T> Uni<T> timed(String operation, Supplier<Uni<T>> call) {
        return Uni.createFrom()
                .deferred(
                        () -> {
                            Timer.Sample sample = Timer.start(registry);
                            return call.get()
                                    .onTermination()
                                    .invoke(
                                            (item, failure, cancelled) ->
                                                    sample.stop(
                                                            registry.timer(
                                                                    METRIC,
                                                                    "operation",
                                                                    operation,
                                                                    "outcome",
                                                                    failure == null
                                                                            ? "success"
                                                                            : "failure")));
                        });
    }
}
