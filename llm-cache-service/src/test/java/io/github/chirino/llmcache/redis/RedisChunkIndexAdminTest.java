package io.github.chirino.llmcache.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.chirino.llmcache.vector.VectorIndexUnsupportedException;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RedisChunkIndexAdminTest {

    private ReactiveRedisDataSource dataSource;
    private RedisChunkIndexAdmin admin;

    @BeforeEach
    void setUp() {
        dataSource = mock(ReactiveRedisDataSource.class);
        admin = new RedisChunkIndexAdmin(dataSource);
    }

    @Test
    void listing_without_redisearch_is_unsupported() {
        when(dataSource.execute(eq("FT._LIST"), any(String[].class)))
                .thenReturn(failure("ERR unknown command 'FT._LIST', with args beginning with: "));

        assertThrows(
                VectorIndexUnsupportedException.class,
                () -> admin.indexExists().await().indefinitely());
    }

    @Test
    void create_without_redisearch_is_unsupported() {
        when(dataSource.execute(eq("FT.CREATE"), any(String[].class)))
                .thenReturn(failure("ERR unknown command 'FT.CREATE'"));

        assertThrows(
                VectorIndexUnsupportedException.class,
                () -> admin.createIndex(64).await().indefinitely());
    }

    @Test
    void create_treats_an_existing_index_as_success() {
        when(dataSource.execute(eq("FT.CREATE"), any(String[].class)))
                .thenReturn(failure("Index already exists"));

        admin.createIndex(64).await().indefinitely();
    }

    @Test
    void other_create_errors_are_passed_through() {
        when(dataSource.execute(eq("FT.CREATE"), any(String[].class)))
                .thenReturn(failure("ERR Invalid field type for field `vec`"));

        IllegalStateException error =
                assertThrows(
                        IllegalStateException.class,
                        () -> admin.createIndex(64).await().indefinitely());
        assertEquals("ERR Invalid field type for field `vec`", error.getMessage());
    }

    @Test
    void unknown_command_is_found_in_the_cause_chain() {
        RuntimeException wrapped =
                new RuntimeException(
                        "pipeline failed",
                        new IllegalStateException("ERR unknown command 'FT.SEARCH'"));
        RuntimeException unrelated = new RuntimeException("connection reset");
        VectorIndexUnsupportedException unsupported =
                new VectorIndexUnsupportedException("already mapped", null);

        assertInstanceOf(
                VectorIndexUnsupportedException.class, RedisChunkIndexAdmin.mapUnsupported(wrapped));
        assertSame(unrelated, RedisChunkIndexAdmin.mapUnsupported(unrelated));
        assertSame(unsupported, RedisChunkIndexAdmin.mapUnsupported(unsupported));
    }

    private static Uni<Response> failure(String message) {
        return Uni.createFrom().failure(new IllegalStateException(message));
    }
}
