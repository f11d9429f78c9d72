package io.github.chirino.llmcache.client.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.chirino.llmcache.client.CacheServiceClient;
import io.github.chirino.llmcache.client.model.CacheWriteRequest;
import io.github.chirino.llmcache.client.model.CachedItem;
import io.github.chirino.llmcache.client.model.VectorSearchHit;
import io.github.chirino.llmcache.client.model.VectorSearchRequest;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.jboss.logging.Logger;

/**
 * Wraps an expensive function with lookups against the cache service.
 *
 * <p>Arguments are serialized to canonical JSON (sorted keys). A call first reads the item stored
 * under {@code dedup:<namespace>:<sha1 of the JSON>}; on a miss it asks the similarity search for
 * the closest earlier call and reuses its response when the hit is within {@code maxDistance}.
 * Otherwise the wrapped function runs and its response is stored in the background.
 *
 * <p>Cache problems never fail a call: lookup errors and timeouts fall through to the wrapped
 * function, persistence errors are only logged.
 */
public class CacheDedup {

    private static final Logger LOG = Logger.getLogger(CacheDedup.class);

    static final String LOOKUP_COUNTER = "llm-cache.dedup.lookups";

    private final CacheServiceClient client;
    private final ObjectMapper objectMapper;
    private final ObjectMapper canonicalMapper;
    private final MeterRegistry meterRegistry;

    public CacheDedup(CacheServiceClient client) {
        this(client, new ObjectMapper(), null);
    }

    /**
     * @param objectMapper converts stored responses back to the wrapped function's result type
     * @param meterRegistry records lookup outcomes; may be null
     */
    public CacheDedup(
            CacheServiceClient client, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.canonicalMapper =
                JsonMapper.builder()
                        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                        .build();
        this.meterRegistry = meterRegistry;
    }

    public <A, R> Function<A, Uni<R>> wrap(
            DedupOptions options, Class<R> resultType, Function<A, Uni<R>> origin) {
        return wrap(options, objectMapper.constructType(resultType), origin);
    }

    public <A, R> Function<A, Uni<R>> wrap(
            DedupOptions options, TypeReference<R> resultType, Function<A, Uni<R>> origin) {
        return wrap(options, objectMapper.constructType(resultType), origin);
    }

    private <A, R> Function<A, Uni<R>> wrap(
            DedupOptions options, JavaType resultType, Function<A, Uni<R>> origin) {
        if (options == null) {
            throw new IllegalArgumentException("options are required");
        }
        return args -> {
            String serialized;
            try {
                serialized = canonicalJson(args);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                LOG.warnf("Failed to serialize arguments, skipping cache: %s", e.getMessage());
                return Uni.createFrom().deferred(() -> origin.apply(args));
            }
            String itemId = cacheId(options.namespace(), serialized);
            return this.<R>lookup(options, itemId, serialized, resultType)
                    .flatMap(
                            cached -> {
                                if (cached.isPresent()) {
                                    return Uni.createFrom().item(cached.get());
                                }
                                return Uni.createFrom()
                                        .deferred(() -> origin.apply(args))
                                        .invoke(
                                                result ->
                                                        persist(
                                                                options,
                                                                itemId,
                                                                serialized,
                                                                result));
                            });
        };
    }

    String canonicalJson(Object args) throws JsonProcessingException {
        Object plain = canonicalMapper.convertValue(args, Object.class);
        return canonicalMapper.writeValueAsString(plain);
    }

    static String cacheId(String namespace, String serialized) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] digest = sha1.digest(serialized.getBytes(StandardCharsets.UTF_8));
            return "dedup:" + namespace + ":" + HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }

    private <R> Uni<Optional<R>> lookup(
            DedupOptions options, String itemId, String serialized, JavaType resultType) {
        Uni<Optional<R>> exact =
                client.get(options.namespace(), itemId)
                        .map(item -> this.<R>storedResponse(item, resultType));
        return exact.flatMap(
                        hit -> {
                            if (hit.isPresent()) {
                                count("exact");
                                return Uni.createFrom().item(hit);
                            }
                            return this.<R>similar(options, serialized, resultType);
                        })
                .ifNoItem()
                .after(options.lookupTimeout())
                .fail()
                .onFailure()
                .recoverWithItem(
                        failure -> {
                            count("error");
                            LOG.warnf(
                                    "Cache lookup in namespace %s failed, calling through: %s",
                                    options.namespace(),
                                    failure.toString());
                            return Optional.empty();
                        });
    }

    private <R> Uni<Optional<R>> similar(
            DedupOptions options, String serialized, JavaType resultType) {
        VectorSearchRequest request =
                new VectorSearchRequest(options.namespace(), serialized, options.topK());
        return client.search(request)
                .flatMap(
                        hits -> {
                            VectorSearchHit best = best(hits);
                            if (best == null || !withinDistance(best, options.maxDistance())) {
                                count("miss");
                                return Uni.createFrom().item(Optional.<R>empty());
                            }
                            return client.get(options.namespace(), best.getItemId())
                                    .map(item -> this.<R>storedResponse(item, resultType))
                                    .invoke(hit -> count(hit.isPresent() ? "similar" : "miss"));
                        });
    }

    private static VectorSearchHit best(List<VectorSearchHit> hits) {
        VectorSearchHit best = null;
        for (VectorSearchHit hit : hits) {
            if (hit == null || hit.getItemId() == null) {
                continue;
            }
            if (best == null || score(hit) < score(best)) {
                best = hit;
            }
        }
        return best;
    }

    private static boolean withinDistance(VectorSearchHit hit, Double maxDistance) {
        return maxDistance == null || score(hit) < maxDistance;
    }

    private static double score(VectorSearchHit hit) {
        return hit.getScore() == null ? Double.POSITIVE_INFINITY : hit.getScore();
    }

    private <R> Optional<R> storedResponse(Optional<CachedItem> item, JavaType resultType) {
        if (item.isEmpty() || item.get().getMeta() == null) {
            return Optional.empty();
        }
        JsonNode response = item.get().getMeta().get("response");
        if (response == null || response.isNull()) {
            return Optional.empty();
        }
        R value = objectMapper.convertValue(response, resultType);
        return Optional.ofNullable(value);
    }

    private <R> void persist(DedupOptions options, String itemId, String serialized, R result) {
        CacheWriteRequest request = new CacheWriteRequest();
        request.setNamespace(options.namespace());
        request.setItemId(itemId);
        request.setText(serialized);
        request.setTtlSeconds(options.ttlSeconds());
        try {
            ObjectNode meta = objectMapper.createObjectNode();
            meta.set("response", objectMapper.valueToTree(result));
            meta.put("query", serialized);
            request.setMeta(meta);
        } catch (IllegalArgumentException e) {
            LOG.warnf("Failed to serialize response for %s, not caching: %s", itemId, e.getMessage());
            return;
        }
        Uni.createFrom()
                .deferred(() -> client.write(request))
                .subscribe()
                .with(
                        response -> {
                            if (response != null && response.getVectorError() != null) {
                                LOG.warnf(
                                        "Cached %s without vectors: %s",
                                        itemId,
                                        response.getVectorError());
                            }
                        },
                        failure -> LOG.warnf(failure, "Failed to cache response for %s", itemId));
    }

    private void count(String result) {
        if (meterRegistry != null) {
            meterRegistry.counter(LOOKUP_COUNTER, "result", result).increment();
        }
    }
}
