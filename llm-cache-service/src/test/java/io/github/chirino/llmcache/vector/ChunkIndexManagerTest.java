package io.github.chirino.llmcache.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.github.chirino.llmcache.embedding.EmbeddingGateway;
import io.github.chirino.llmcache.embedding.HashEmbeddingGateway;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class ChunkIndexManagerTest {

    private final EmbeddingGateway gateway = new HashEmbeddingGateway(16);

    @Test
    void creates_index_once_when_missing() {
        ScriptedAdmin admin = new ScriptedAdmin();
        ChunkIndexManager manager = new ChunkIndexManager(admin);

        manager.ensureReady(gateway).await().indefinitely();
        manager.ensureReady(gateway).await().indefinitely();

        assertEquals(ChunkIndexManager.State.READY, manager.state());
        assertEquals(1, admin.existsCalls);
        assertEquals(List.of(16), admin.createdDimensions);
    }

    @Test
    void does_not_create_existing_index() {
        ScriptedAdmin admin = new ScriptedAdmin();
        admin.exists = true;
        ChunkIndexManager manager = new ChunkIndexManager(admin);

        manager.ensureReady(gateway).await().indefinitely();

        assertEquals(ChunkIndexManager.State.READY, manager.state());
        assertEquals(List.of(), admin.createdDimensions);
    }

    @Test
    void concurrent_callers_share_one_attempt() {
        ScriptedAdmin admin = new ScriptedAdmin();
        admin.pendingExists = new CompletableFuture<>();
        ChunkIndexManager manager = new ChunkIndexManager(admin);

        UniAssertSubscriber<Void> first =
                manager.ensureReady(gateway).subscribe().withSubscriber(UniAssertSubscriber.create());
        UniAssertSubscriber<Void> second =
                manager.ensureReady(gateway).subscribe().withSubscriber(UniAssertSubscriber.create());

        assertEquals(ChunkIndexManager.State.INITIALIZING, manager.state());
        first.assertNotTerminated();
        second.assertNotTerminated();

        admin.pendingExists.complete(false);

        first.assertCompleted();
        second.assertCompleted();
        assertEquals(1, admin.existsCalls);
        assertEquals(List.of(16), admin.createdDimensions);
    }

    @Test
    void concurrent_callers_share_the_failure_and_the_next_call_retries() {
        ScriptedAdmin admin = new ScriptedAdmin();
        admin.pendingExists = new CompletableFuture<>();
        ChunkIndexManager manager = new ChunkIndexManager(admin);

        UniAssertSubscriber<Void> first =
                manager.ensureReady(gateway).subscribe().withSubscriber(UniAssertSubscriber.create());
        UniAssertSubscriber<Void> second =
                manager.ensureReady(gateway).subscribe().withSubscriber(UniAssertSubscriber.create());
        RuntimeException outage = new RuntimeException("connection reset");
        admin.pendingExists.completeExceptionally(outage);

        assertSame(outage, first.assertFailedWith(RuntimeException.class).getFailure());
        assertSame(outage, second.assertFailedWith(RuntimeException.class).getFailure());
        assertEquals(ChunkIndexManager.State.NOT_READY, manager.state());

        admin.pendingExists = null;
        manager.ensureReady(gateway).await().indefinitely();

        assertEquals(ChunkIndexManager.State.READY, manager.state());
        assertEquals(2, admin.existsCalls);
    }

    @Test
    void unknown_dimension_fails_and_is_retried() {
        ScriptedAdmin admin = new ScriptedAdmin();
        EmbeddingGateway noDimension = new HashEmbeddingGateway(16) {
            @Override
            public int dimensions() {
                return 0;
            }
        };
        ChunkIndexManager manager = new ChunkIndexManager(admin);

        manager.ensureReady(noDimension)
                .subscribe()
                .withSubscriber(UniAssertSubscriber.create())
                .assertFailedWith(EmbeddingDimensionUnknownException.class);
        assertEquals(ChunkIndexManager.State.NOT_READY, manager.state());

        manager.ensureReady(gateway).await().indefinitely();

        assertEquals(ChunkIndexManager.State.READY, manager.state());
        assertEquals(List.of(16), admin.createdDimensions);
    }

    @Test
    void unsupported_backend_is_remembered() {
        ScriptedAdmin admin = new ScriptedAdmin();
        admin.existsFailure =
                new VectorIndexUnsupportedException("no RediSearch", new RuntimeException());
        ChunkIndexManager manager = new ChunkIndexManager(admin);

        Throwable firstFailure =
                manager.ensureReady(gateway)
                        .subscribe()
                        .withSubscriber(UniAssertSubscriber.create())
                        .assertFailedWith(VectorIndexUnsupportedException.class)
                        .getFailure();
        admin.existsFailure = null;
        Throwable secondFailure =
                manager.ensureReady(gateway)
                        .subscribe()
                        .withSubscriber(UniAssertSubscriber.create())
                        .getFailure();

        assertInstanceOf(VectorIndexUnsupportedException.class, secondFailure);
        assertSame(firstFailure, secondFailure);
        assertEquals(1, admin.existsCalls);
    }

    private static final class ScriptedAdmin implements VectorIndexAdmin {

        boolean exists;
        CompletableFuture<Boolean> pendingExists;
        RuntimeException existsFailure;
        int existsCalls;
        final List<Integer> createdDimensions = new ArrayList<>();

        @Override
        public String indexName() {
            return "idx:test";
        }

        @Override
        public Uni<Boolean> indexExists() {
            existsCalls++;
            if (existsFailure != null) {
                return Uni.createFrom().failure(existsFailure);
            }
            if (pendingExists != null) {
                return Uni.createFrom().completionStage(pendingExists);
            }
            return Uni.createFrom().item(exists);
        }

        @Override
        public Uni<Void> createIndex(int dimension) {
            createdDimensions.add(dimension);
            exists = true;
            return Uni.createFrom().voidItem();
        }
    }
}
