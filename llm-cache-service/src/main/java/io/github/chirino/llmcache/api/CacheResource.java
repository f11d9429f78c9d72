package io.github.chirino.llmcache.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.llmcache.api.dto.CacheEntryResponse;
import io.github.chirino.llmcache.api.dto.CacheWriteRequest;
import io.github.chirino.llmcache.api.dto.CacheWriteResponse;
import io.github.chirino.llmcache.api.dto.DeleteItemRequest;
import io.github.chirino.llmcache.api.dto.TtlUpdateRequest;
import io.github.chirino.llmcache.config.CacheStorageSelector;
import io.github.chirino.llmcache.ingest.CacheWriteService;
import io.github.chirino.llmcache.model.CacheWritePayload;
import io.github.chirino.llmcache.storage.CacheItemNotFoundException;
import io.github.chirino.llmcache.storage.CacheStorage;
import io.github.chirino.llmcache.storage.InvalidCacheRequestException;
import io.github.chirino.llmcache.storage.MetaJson;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CacheResource {

    static final int DEFAULT_LIST_COUNT = 100;
    static final int MAX_LIST_COUNT = 1000;

    @Inject CacheStorageSelector storageSelector;

    @Inject CacheWriteService writeService;

    @Inject ObjectMapper objectMapper;

    @ConfigProperty(name = "llm-cache.ttl.max-seconds", defaultValue = "2592000")
    long maxTtlSeconds;

    private CacheStorage storage() {
        return storageSelector.getStorage();
    }

    @POST
    @Path("/cache.write")
    public Uni<CacheWriteResponse> write(@Valid @NotNull CacheWriteRequest request) {
        if (request.getTtlSeconds() != null) {
            checkTtl(request.getTtlSeconds());
        }
        CacheWritePayload payload =
                new CacheWritePayload(
                        request.getNamespace(),
                        request.getItemId(),
                        request.getText(),
                        MetaJson.serialize(objectMapper, request.getMeta()),
                        request.getTtlSeconds());
        return writeService.write(payload).map(CacheWriteResponse::from);
    }

    @GET
    @Path("/cache.get")
    public Uni<CacheEntryResponse> get(
            @QueryParam("ns") @NotBlank String namespace,
            @QueryParam("item_id") @NotBlank String itemId) {
        return storage()
                .read(namespace, itemId)
                .map(
                        entry ->
                                entry.map(CacheEntryResponse::from)
                                        .orElseThrow(
                                                () ->
                                                        new CacheItemNotFoundException(
                                                                namespace, itemId)));
    }

    @DELETE
    @Path("/cache.delete")
    public Uni<Map<String, Boolean>> delete(@Valid @NotNull DeleteItemRequest request) {
        return storage()
                .delete(request.getNamespace(), request.getItemId())
                .map(ok -> Map.of("ok", ok));
    }

    @GET
    @Path("/cache.list")
    public Uni<Map<String, List<String>>> list(
            @QueryParam("ns") @NotBlank String namespace, @QueryParam("count") String count) {
        int limit = parseCount(count);
        return storage().list(namespace, limit).map(ids -> Map.of("item_ids", ids));
    }

    @POST
    @Path("/cache.ttl")
    public Uni<Map<String, Boolean>> setTtl(@Valid @NotNull TtlUpdateRequest request) {
        checkTtl(request.getTtlSeconds());
        return storage()
                .setTtl(request.getItemId(), request.getTtlSeconds())
                .map(ok -> Map.of("ok", ok));
    }

    @GET
    @Path("/cache.ttl")
    public Uni<Map<String, Long>> getTtl(@QueryParam("item_id") @NotBlank String itemId) {
        return storage()
                .getTtl(itemId)
                .map(ttl -> Collections.singletonMap("ttl", ttl.orElse(null)));
    }

    private void checkTtl(long ttlSeconds) {
        if (ttlSeconds > maxTtlSeconds) {
            throw new InvalidCacheRequestException(
                    "ttl_s must not exceed " + maxTtlSeconds + " seconds");
        }
    }

    static int parseCount(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_LIST_COUNT;
        }
        int count;
        try {
            count = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidCacheRequestException("count must be an integer");
        }
        if (count < 1 || count > MAX_LIST_COUNT) {
            throw new InvalidCacheRequestException(
                    "count must be between 1 and " + MAX_LIST_COUNT);
        }
        return count;
    }
}
