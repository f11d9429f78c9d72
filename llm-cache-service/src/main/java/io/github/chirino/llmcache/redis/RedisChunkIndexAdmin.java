package io.github.chirino.llmcache.redis;

import io.github.chirino.llmcache.vector.VectorIndexAdmin;
import io.github.chirino.llmcache.vector.VectorIndexUnsupportedException;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

/** Creates the RediSearch index over the chunk hashes. Requires the RediSearch module. */
public class RedisChunkIndexAdmin implements VectorIndexAdmin {

    private static final Logger LOG = Logger.getLogger(RedisChunkIndexAdmin.class);

    private final ReactiveRedisDataSource dataSource;

    public RedisChunkIndexAdmin(ReactiveRedisDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public String indexName() {
        return RedisKeys.CHUNK_INDEX;
    }

    @Override
    public Uni<Boolean> indexExists() {
        return dataSource
                .execute("FT._LIST")
                .map(RedisChunkIndexAdmin::containsIndex)
                .onFailure()
                .transform(RedisChunkIndexAdmin::mapUnsupported);
    }

    @Override
    public Uni<Void> createIndex(int dimension) {
        return dataSource
                .execute(
                        "FT.CREATE",
                        RedisKeys.CHUNK_INDEX,
                        "ON",
                        "HASH",
                        "PREFIX",
                        "1",
                        RedisKeys.CHUNK_PREFIX,
                        "SCHEMA",
                        RedisChunkStore.NAMESPACE,
                        "TAG",
                        "SEPARATOR",
                        "|",
                        RedisChunkStore.ITEM_ID,
                        "TAG",
                        RedisChunkStore.TEXT,
                        "TEXT",
                        RedisChunkStore.META_JSON,
                        "TEXT",
                        RedisKeys.VECTOR_FIELD,
                        "VECTOR",
                        "FLAT",
                        "6",
                        "TYPE",
                        "FLOAT32",
                        "DIM",
                        String.valueOf(dimension),
                        "DISTANCE_METRIC",
                        "COSINE")
                .replaceWithVoid()
                .onFailure(RedisChunkIndexAdmin::isAlreadyExists)
                .recoverWithUni(
                        () -> {
                            LOG.infof(
                                    "Vector index '%s' was created concurrently",
                                    RedisKeys.CHUNK_INDEX);
                            return Uni.createFrom().voidItem();
                        })
                .onFailure()
                .transform(RedisChunkIndexAdmin::mapUnsupported);
    }

    private static boolean containsIndex(Response response) {
        if (response == null) {
            return false;
        }
        for (int i = 0; i < response.size(); i++) {
            Response name = response.get(i);
            if (name != null && RedisKeys.CHUNK_INDEX.equals(name.toString())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAlreadyExists(Throwable error) {
        return messageContains(error, "index already exists");
    }

    static Throwable mapUnsupported(Throwable error) {
        if (error instanceof VectorIndexUnsupportedException) {
            return error;
        }
        if (messageContains(error, "unknown command")) {
            return new VectorIndexUnsupportedException(
                    "Redis server does not provide RediSearch commands", error);
        }
        return error;
    }

    private static boolean messageContains(Throwable error, String fragment) {
        Throwable current = error;
        while (current != null) {
            String message = current.getMessage();
            if (message != null && message.toLowerCase().contains(fragment)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
