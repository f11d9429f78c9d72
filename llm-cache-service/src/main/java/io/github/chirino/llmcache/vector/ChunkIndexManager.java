package io.github.chirino.llmcache.vector;

import io.github.chirino.llmcache.embedding.EmbeddingGateway;
import io.smallrye.mutiny.Uni;
import java.util.concurrent.CompletableFuture;
import org.jboss.logging.Logger;

/**
 * Lazily makes sure the chunk similarity index exists before it is first queried.
 *
 * <p>Concurrent callers of {@link #ensureReady(EmbeddingGateway)} share a single initialization
 * attempt. A failed attempt returns the manager to {@link State#NOT_READY} so the next caller
 * retries, except when the backend does not support similarity search at all: that failure is
 * remembered and reported to every later caller.
 *
 * <p>The monitor only guards state transitions; it is never held while waiting on the backend.
 */
public class ChunkIndexManager {

    private static final Logger LOG = Logger.getLogger(ChunkIndexManager.class);

    public enum State {
        NOT_READY,
        INITIALIZING,
        READY
    }

    private final VectorIndexAdmin admin;

    private State state = State.NOT_READY;
    private CompletableFuture<Void> inFlight;
    private VectorIndexUnsupportedException unsupported;

    public ChunkIndexManager(VectorIndexAdmin admin) {
        this.admin = admin;
    }

    public synchronized State state() {
        return state;
    }

    public Uni<Void> ensureReady(EmbeddingGateway gateway) {
        return Uni.createFrom()
                .emitter(
                        emitter ->
                                join(gateway)
                                        .whenComplete(
                                                (ignored, failure) -> {
                                                    if (failure != null) {
                                                        emitter.fail(failure);
                                                    } else {
                                                        emitter.complete(null);
                                                    }
                                                }));
    }

    private CompletableFuture<Void> join(EmbeddingGateway gateway) {
        CompletableFuture<Void> attempt;
        synchronized (this) {
            if (state == State.READY) {
                return CompletableFuture.completedFuture(null);
            }
            if (unsupported != null) {
                return CompletableFuture.failedFuture(unsupported);
            }
            if (state == State.INITIALIZING) {
                return inFlight;
            }
            state = State.INITIALIZING;
            attempt = new CompletableFuture<>();
            inFlight = attempt;
        }

        initialize(gateway)
                .subscribe()
                .with(ignored -> settle(attempt, null), failure -> settle(attempt, failure));
        return attempt;
    }

    private Uni<Void> initialize(EmbeddingGateway gateway) {
        return Uni.createFrom()
                .deferred(admin::indexExists)
                .flatMap(
                        exists -> {
                            if (Boolean.TRUE.equals(exists)) {
                                LOG.debugf("Vector index '%s' already exists", admin.indexName());
                                return Uni.createFrom().voidItem();
                            }
                            int dimension = gateway.dimensions();
                            if (dimension <= 0) {
                                return Uni.createFrom()
                                        .failure(
                                                new EmbeddingDimensionUnknownException(
                                                        gateway.modelId()));
                            }
                            return admin.createIndex(dimension)
                                    .invoke(
                                            () ->
                                                    LOG.infof(
                                                            "Created vector index '%s' with"
                                                                    + " dimension=%d",
                                                            admin.indexName(),
                                                            dimension));
                        });
    }

    private void settle(CompletableFuture<Void> attempt, Throwable failure) {
        synchronized (this) {
            inFlight = null;
            if (failure == null) {
                state = State.READY;
            } else {
                state = State.NOT_READY;
                if (failure instanceof VectorIndexUnsupportedException e) {
                    unsupported = e;
                }
            }
        }
        if (failure == null) {
            attempt.complete(null);
        } else {
            LOG.warnf(failure, "Failed to initialize vector index '%s'", admin.indexName());
            attempt.completeExceptionally(failure);
        }
    }
}
