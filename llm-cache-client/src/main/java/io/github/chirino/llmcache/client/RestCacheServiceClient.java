package io.github.chirino.llmcache.client;

import io.github.chirino.llmcache.client.model.CacheWriteRequest;
import io.github.chirino.llmcache.client.model.CacheWriteResponse;
import io.github.chirino.llmcache.client.model.CachedItem;
import io.github.chirino.llmcache.client.model.VectorSearchHit;
import io.github.chirino.llmcache.client.model.VectorSearchRequest;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.rest.client.inject.RestClient;

@ApplicationScoped
public class RestCacheServiceClient implements CacheServiceClient {

    private final CacheServiceApi api;

    @Inject
    public RestCacheServiceClient(@RestClient CacheServiceApi api) {
        this.api = api;
    }

    @Override
    public Uni<Optional<CachedItem>> get(String namespace, String itemId) {
        return api.get(namespace, itemId)
                .map(Optional::ofNullable)
                .onFailure(RestCacheServiceClient::isNotFound)
                .recoverWithItem(Optional.empty());
    }

    @Override
    public Uni<List<VectorSearchHit>> search(VectorSearchRequest request) {
        return api.search(request)
                .map(
                        response ->
                                response == null || response.getResults() == null
                                        ? List.<VectorSearchHit>of()
                                        : response.getResults());
    }

    @Override
    public Uni<CacheWriteResponse> write(CacheWriteRequest request) {
        return api.write(request);
    }

    static boolean isNotFound(Throwable failure) {
        return failure instanceof WebApplicationException wae
                && wae.getResponse() != null
                && wae.getResponse().getStatus() == Response.Status.NOT_FOUND.getStatusCode();
    }
}
