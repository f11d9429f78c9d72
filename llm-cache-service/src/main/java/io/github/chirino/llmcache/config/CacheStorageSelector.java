package io.github.chirino.llmcache.config;

import io.github.chirino.llmcache.redis.RedisCacheStorage;
import io.github.chirino.llmcache.storage.CacheStorage;
import io.github.chirino.llmcache.storage.InMemoryCacheStorage;
import io.github.chirino.llmcache.storage.MeteredCacheStorage;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class CacheStorageSelector {

    @ConfigProperty(name = "llm-cache.storage.type", defaultValue = "redis")
    String storageType;

    @Inject Instance<RedisCacheStorage> redisCacheStorage;

    @Inject Instance<InMemoryCacheStorage> inMemoryCacheStorage;

    @Inject MeterRegistry meterRegistry;

    private CacheStorage meteredStorage;

    @PostConstruct
    void init() {
        meteredStorage = new MeteredCacheStorage(meterRegistry, selectDelegate());
    }

    public CacheStorage getStorage() {
        return meteredStorage;
    }

    private CacheStorage selectDelegate() {
        String type = storageType == null ? "redis" : storageType.trim().toLowerCase();
        return switch (type) {
            case "redis" -> redisCacheStorage.get();
            case "memory", "in-memory" -> inMemoryCacheStorage.get();
            default ->
                    throw new IllegalStateException(
                            "Unsupported llm-cache.storage.type: " + storageType);
        };
    }
}
