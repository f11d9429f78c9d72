package io.github.chirino.llmcache.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.llmcache.model.VectorSearchQuery;
import io.github.chirino.llmcache.vector.VectorSearchFailedException;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.smallrye.mutiny.Uni;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MeteredCacheStorageTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CacheStorage delegate = mock(CacheStorage.class);
    private final MeteredCacheStorage storage = new MeteredCacheStorage(registry, delegate);

    @Test
    void records_successful_operations() {
        when(delegate.getTtl("t:1")).thenReturn(Uni.createFrom().item(Optional.of(30L)));
        when(delegate.list("t", 10)).thenReturn(Uni.createFrom().item(List.of("t:1")));

        assertEquals(Optional.of(30L), storage.getTtl("t:1").await().indefinitely());
        assertEquals(List.of("t:1"), storage.list("t", 10).await().indefinitely());

        assertEquals(1, timer("getTtl", "success").count());
        assertEquals(1, timer("list", "success").count());
    }

    @Test
    void records_failed_operations() {
        VectorSearchQuery query = new VectorSearchQuery("t", "q", 8, null);
        when(delegate.vectorSearch(query))
                .thenReturn(Uni.createFrom().failure(new VectorSearchFailedException("boom", null)));

        assertThrows(
                VectorSearchFailedException.class,
                () -> storage.vectorSearch(query).await().indefinitely());

        assertEquals(1, timer("vectorSearch", "failure").count());
        assertNull(registry.find(MeteredCacheStorage.METRIC).tag("outcome", "success").timer());
    }

    @Test
    void delegate_is_only_called_on_subscription() {
        when(delegate.delete("t", "t:1")).thenReturn(Uni.createFrom().item(true));

        Uni<Boolean> pending = storage.delete("t", "t:1");
        verify(delegate, never()).delete("t", "t:1");

        assertEquals(true, pending.await().indefinitely());
        assertEquals(1, timer("delete", "success").count());
    }

    private Timer timer(String operation, String outcome) {
        Timer timer =
                registry.find(MeteredCacheStorage.METRIC)
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .timer();
        assertNotNull(timer, operation + "/" + outcome);
        return timer;
    }
}
