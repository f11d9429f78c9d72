package io.github.chirino.llmcache.client;

import io.github.chirino.llmcache.client.model.CacheWriteRequest;
import io.github.chirino.llmcache.client.model.CacheWriteResponse;
import io.github.chirino.llmcache.client.model.CachedItem;
import io.github.chirino.llmcache.client.model.VectorSearchRequest;
import io.github.chirino.llmcache.client.model.VectorSearchResponse;
import io.smallrye.mutiny.Uni;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the cache service. The base URL is configured with {@code
 * quarkus.rest-client.llm-cache.url}.
 */
@RegisterRestClient(configKey = "llm-cache")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface CacheServiceApi {

    @POST
    @Path("/cache.write")
    Uni<CacheWriteResponse> write(CacheWriteRequest request);

    /** Fails with a 404 {@code WebApplicationException} when the item is absent. */
    @GET
    @Path("/cache.get")
    Uni<CachedItem> get(@QueryParam("ns") String namespace, @QueryParam("item_id") String itemId);

    @POST
    @Path("/search.vector")
    Uni<VectorSearchResponse> search(VectorSearchRequest request);
}
