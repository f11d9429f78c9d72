package io.github.chirino.llmcache.client;

import io.github.chirino.llmcache.client.model.CacheWriteRequest;
import io.github.chirino.llmcache.client.model.CacheWriteResponse;
import io.github.chirino.llmcache.client.model.CachedItem;
import io.github.chirino.llmcache.client.model.VectorSearchHit;
import io.github.chirino.llmcache.client.model.VectorSearchRequest;
import io.smallrye.mutiny.Uni;
import java.util.List;
import java.util.Optional;

/** The cache operations used by {@link io.github.chirino.llmcache.client.dedup.CacheDedup}. */
public interface CacheServiceClient {

    Uni<Optional<CachedItem>> get(String namespace, String itemId);

    Uni<List<VectorSearchHit>> search(VectorSearchRequest request);

    Uni<CacheWriteResponse> write(CacheWriteRequest request);
}
