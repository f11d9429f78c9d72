package io.github.chirino.llmcache.client.dedup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.llmcache.client.CacheServiceClient;
import io.github.chirino.llmcache.client.model.CacheWriteRequest;
import io.github.chirino.llmcache.client.model.CacheWriteResponse;
import io.github.chirino.llmcache.client.model.CachedItem;
import io.github.chirino.llmcache.client.model.VectorSearchHit;
import io.github.chirino.llmcache.client.model.VectorSearchRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.mutiny.Uni;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class CacheDedupTest {

    private final FakeCacheClient client = new FakeCacheClient();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CacheDedup dedup = new CacheDedup(client, new ObjectMapper(), registry);
    private final AtomicInteger originCalls = new AtomicInteger();

    private final Function<Map<String, Object>, Uni<Answer>> origin =
            args -> {
                originCalls.incrementAndGet();
                return Uni.createFrom().item(new Answer("answer to " + args.get("prompt"), 42));
            };

    @Test
    void repeated_calls_invoke_origin_once() {
        Function<Map<String, Object>, Uni<Answer>> cached =
                dedup.wrap(DedupOptions.builder("llm").ttlSeconds(60).build(), Answer.class, origin);

        Answer first = cached.apply(Map.of("prompt", "hi")).await().indefinitely();
        Answer second = cached.apply(Map.of("prompt", "hi")).await().indefinitely();
        Answer third = cached.apply(Map.of("prompt", "hi")).await().indefinitely();

        assertEquals(1, originCalls.get());
        assertEquals(first, second);
        assertEquals(first, third);
        assertEquals(2.0, counter("exact"));

        CacheWriteRequest written = client.writes.get(0);
        assertEquals("llm", written.getNamespace());
        assertEquals(60, written.getTtlSeconds());
        assertEquals("{\"prompt\":\"hi\"}", written.getText());
        assertEquals("{\"prompt\":\"hi\"}", written.getMeta().get("query").asText());
        assertEquals(42, written.getMeta().get("response").get("tokens").asInt());
    }

    @Test
    void argument_key_order_does_not_change_cache_id() throws Exception {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", Map.of("y", 2, "x", 1));
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", Map.of("x", 1, "y", 2));
        ba.put("a", 1);

        String canonical = dedup.canonicalJson(ab);

        assertEquals("{\"a\":1,\"b\":{\"x\":1,\"y\":2}}", canonical);
        assertEquals(canonical, dedup.canonicalJson(ba));
        assertEquals(
                CacheDedup.cacheId("llm", canonical),
                CacheDedup.cacheId("llm", dedup.canonicalJson(ba)));
        assertTrue(CacheDedup.cacheId("llm", canonical).matches("dedup:llm:[0-9a-f]{40}"));
    }

    @Test
    void close_similarity_hit_is_reused() {
        client.store("llm", "dedup:llm:earlier", new Answer("earlier answer", 7));
        client.hits = List.of(new VectorSearchHit("dedup:llm:earlier#0", "dedup:llm:earlier", "q", 0.05));

        Answer answer =
                dedup.wrap(DedupOptions.builder("llm").maxDistance(0.1).build(), Answer.class, origin)
                        .apply(Map.of("prompt", "hello there"))
                        .await()
                        .indefinitely();

        assertEquals(new Answer("earlier answer", 7), answer);
        assertEquals(0, originCalls.get());
        assertEquals(1.0, counter("similar"));
    }

    @Test
    void distant_similarity_hit_recomputes() {
        client.store("llm", "dedup:llm:earlier", new Answer("earlier answer", 7));
        client.hits =
                List.of(
                        new VectorSearchHit("dedup:llm:earlier#0", "dedup:llm:earlier", "q", 0.1),
                        new VectorSearchHit("dedup:llm:earlier#1", "dedup:llm:earlier", "q", 0.4));

        Answer answer =
                dedup.wrap(DedupOptions.builder("llm").maxDistance(0.1).build(), Answer.class, origin)
                        .apply(Map.of("prompt", "hello there"))
                        .await()
                        .indefinitely();

        assertEquals("answer to hello there", answer.text());
        assertEquals(1, originCalls.get());
        assertEquals(1.0, counter("miss"));
    }

    @Test
    void lookup_failure_falls_through_to_origin() {
        client.failLookups = true;

        Answer answer =
                dedup.wrap(DedupOptions.builder("llm").build(), Answer.class, origin)
                        .apply(Map.of("prompt", "hi"))
                        .await()
                        .indefinitely();

        assertEquals("answer to hi", answer.text());
        assertEquals(1, originCalls.get());
        assertEquals(1.0, counter("error"));
    }

    @Test
    void slow_lookup_times_out_and_calls_origin() {
        client.hangLookups = true;

        Answer answer =
                dedup.wrap(
                                DedupOptions.builder("llm")
                                        .lookupTimeout(Duration.ofMillis(50))
                                        .build(),
                                Answer.class,
                                origin)
                        .apply(Map.of("prompt", "hi"))
                        .await()
                        .atMost(Duration.ofSeconds(5));

        assertEquals("answer to hi", answer.text());
        assertEquals(1.0, counter("error"));
    }

    @Test
    void failed_persist_does_not_fail_the_call() {
        client.failWrites = true;

        Answer answer =
                dedup.wrap(DedupOptions.builder("llm").build(), Answer.class, origin)
                        .apply(Map.of("prompt", "hi"))
                        .await()
                        .indefinitely();

        assertEquals("answer to hi", answer.text());
    }

    @Test
    void unserializable_arguments_skip_the_cache() {
        AtomicInteger calls = new AtomicInteger();
        Function<Object, Uni<String>> cached =
                dedup.wrap(
                        DedupOptions.builder("llm").build(),
                        String.class,
                        args -> {
                            calls.incrementAndGet();
                            return Uni.createFrom().item("computed");
                        });

        assertEquals("computed", cached.apply(new Object()).await().indefinitely());
        assertEquals(1, calls.get());
        assertEquals(0, client.lookups.get());
        assertTrue(client.writes.isEmpty());
    }

    @Test
    void namespace_is_required() {
        assertThrows(IllegalArgumentException.class, () -> DedupOptions.builder(" ").build());
        assertThrows(IllegalArgumentException.class, () -> DedupOptions.builder(null).build());
        assertEquals(1, DedupOptions.builder("llm").topK(0).build().topK());
    }

    private double counter(String result) {
        return registry.counter(CacheDedup.LOOKUP_COUNTER, "result", result).count();
    }

    public record Answer(String text, int tokens) {}

    /** Keeps written items in memory and answers searches with scripted hits. */
    private static final class FakeCacheClient implements CacheServiceClient {

        private final ObjectMapper mapper = new ObjectMapper();
        private final Map<String, CachedItem> items = new LinkedHashMap<>();
        final List<CacheWriteRequest> writes = new ArrayList<>();
        final AtomicInteger lookups = new AtomicInteger();
        List<VectorSearchHit> hits = List.of();
        boolean failLookups;
        boolean hangLookups;
        boolean failWrites;

        void store(String namespace, String itemId, Answer response) {
            CachedItem item = new CachedItem();
            item.setNamespace(namespace);
            item.setItemId(itemId);
            item.setMeta(mapper.createObjectNode().set("response", mapper.valueToTree(response)));
            items.put(namespace + "/" + itemId, item);
        }

        @Override
        public Uni<Optional<CachedItem>> get(String namespace, String itemId) {
            lookups.incrementAndGet();
            if (hangLookups) {
                return Uni.createFrom().nothing();
            }
            if (failLookups) {
                return Uni.createFrom().failure(new IllegalStateException("cache down"));
            }
            return Uni.createFrom().item(Optional.ofNullable(items.get(namespace + "/" + itemId)));
        }

        @Override
        public Uni<List<VectorSearchHit>> search(VectorSearchRequest request) {
            return Uni.createFrom().item(hits);
        }

        @Override
        public Uni<CacheWriteResponse> write(CacheWriteRequest request) {
            if (failWrites) {
                return Uni.createFrom().failure(new IllegalStateException("cache down"));
            }
            writes.add(request);
            CachedItem item = new CachedItem();
            item.setNamespace(request.getNamespace());
            item.setItemId(request.getItemId());
            item.setText(request.getText());
            item.setMeta(request.getMeta());
            items.put(request.getNamespace() + "/" + request.getItemId(), item);
            CacheWriteResponse response = new CacheWriteResponse();
            response.setItemId(request.getItemId());
            response.setVectorized(true);
            return Uni.createFrom().item(response);
        }
    }
}
