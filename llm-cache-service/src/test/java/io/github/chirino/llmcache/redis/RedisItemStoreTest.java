package io.github.chirino.llmcache.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.llmcache.model.CacheWritePayload;
import io.github.chirino.llmcache.storage.ConcurrentItemUpdateException;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.transactions.OptimisticLockingTransactionResult;
import io.smallrye.mutiny.Uni;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RedisItemStoreTest {

    private ReactiveRedisDataSource dataSource;
    private RedisItemStore store;

    @BeforeEach
    void setUp() {
        dataSource = mock(ReactiveRedisDataSource.class);
        store =
                new RedisItemStore(
                        dataSource,
                        Clock.fixed(Instant.ofEpochMilli(1_000), ZoneOffset.UTC),
                        3);
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsert_gives_up_after_max_attempts_when_the_watch_keeps_failing() {
        OptimisticLockingTransactionResult<Map<String, String>> discarded = transaction(true);
        when(dataSource.withTransaction(
                        any(Function.class), any(BiFunction.class), eq("l1:item:t:1")))
                .thenReturn(Uni.createFrom().item(discarded));

        ConcurrentItemUpdateException error =
                assertThrows(
                        ConcurrentItemUpdateException.class,
                        () -> store.upsert(payload()).await().indefinitely());

        assertEquals("t:1", error.getItemId());
        assertTrue(error.getMessage().contains("after 3 attempts"));
        verify(dataSource, times(3))
                .withTransaction(any(Function.class), any(BiFunction.class), eq("l1:item:t:1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void upsert_retries_after_a_discarded_transaction() {
        OptimisticLockingTransactionResult<Map<String, String>> discarded = transaction(true);
        OptimisticLockingTransactionResult<Map<String, String>> committed = transaction(false);
        when(dataSource.withTransaction(
                        any(Function.class), any(BiFunction.class), eq("l1:item:t:1")))
                .thenReturn(Uni.createFrom().item(discarded))
                .thenReturn(Uni.createFrom().item(committed));

        assertEquals("t:1", store.upsert(payload()).await().indefinitely());
        verify(dataSource, times(2))
                .withTransaction(any(Function.class), any(BiFunction.class), eq("l1:item:t:1"));
    }

    @SuppressWarnings("unchecked")
    private static OptimisticLockingTransactionResult<Map<String, String>> transaction(
            boolean discarded) {
        OptimisticLockingTransactionResult<Map<String, String>> result =
                mock(OptimisticLockingTransactionResult.class);
        when(result.discarded()).thenReturn(discarded);
        return result;
    }

    private static CacheWritePayload payload() {
        return new CacheWritePayload("t", "t:1", "hello", null, null);
    }
}
