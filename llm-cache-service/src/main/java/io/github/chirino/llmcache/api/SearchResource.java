package io.github.chirino.llmcache.api;

import io.github.chirino.llmcache.api.dto.VectorSearchHit;
import io.github.chirino.llmcache.api.dto.VectorSearchRequest;
import io.github.chirino.llmcache.api.dto.VectorSearchResponse;
import io.github.chirino.llmcache.config.CacheStorageSelector;
import io.github.chirino.llmcache.model.VectorSearchQuery;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SearchResource {

    @Inject CacheStorageSelector storageSelector;

    @ConfigProperty(name = "llm-cache.search.default-top-k", defaultValue = "8")
    int defaultTopK;

    @POST
    @Path("/search.vector")
    public Uni<VectorSearchResponse> searchVector(@Valid @NotNull VectorSearchRequest request) {
        VectorSearchQuery query =
                new VectorSearchQuery(
                        request.getNamespace(),
                        request.getQuery(),
                        request.getTopK() != null ? request.getTopK() : defaultTopK,
                        request.getMaxDistance());
        return storageSelector
                .getStorage()
                .vectorSearch(query)
                .map(
                        results ->
                                new VectorSearchResponse(
                                        results.stream().map(VectorSearchHit::from).toList()));
    }
}
