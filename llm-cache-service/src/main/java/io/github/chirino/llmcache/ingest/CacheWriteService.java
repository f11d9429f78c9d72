package io.github.chirino.llmcache.ingest;

import io.github.chirino.llmcache.chunking.TextChunk;
import io.github.chirino.llmcache.chunking.TextChunker;
import io.github.chirino.llmcache.config.CacheStorageSelector;
import io.github.chirino.llmcache.embedding.EmbeddingGateway;
import io.github.chirino.llmcache.model.CacheWritePayload;
import io.github.chirino.llmcache.model.CacheWriteResult;
import io.github.chirino.llmcache.model.ChunkPayload;
import io.github.chirino.llmcache.model.VectorErrorCode;
import io.github.chirino.llmcache.storage.CacheStorage;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Chunks and embeds the text of an incoming write before handing it to the storage. An embedding
 * failure never fails the write: the item is stored without vectors and the result carries
 * {@code embedding_failed}.
 */
@ApplicationScoped
public class CacheWriteService {

    private static final Logger LOG = Logger.getLogger(CacheWriteService.class);

    @Inject CacheStorageSelector storageSelector;

    @Inject TextChunker chunker;

    @Inject EmbeddingGateway embeddingGateway;

    @ConfigProperty(name = "llm-cache.vectorize.enabled", defaultValue = "true")
    boolean vectorizeEnabled;

    @ConfigProperty(name = "llm-cache.embedding.timeout", defaultValue = "PT10S")
    Duration embeddingTimeout;

    public Uni<CacheWriteResult> write(CacheWritePayload payload) {
        CacheStorage storage = storageSelector.getStorage();
        if (!vectorizeEnabled) {
            return storage.write(payload, List.of());
        }

        List<TextChunk> fragments = chunker.split(payload.text());
        List<String> texts = new ArrayList<>(fragments.size());
        for (TextChunk fragment : fragments) {
            texts.add(fragment.text());
        }

        return embeddingGateway
                .embedAsync(texts, embeddingTimeout)
                .onItemOrFailure()
                .transformToUni(
                        (vectors, failure) -> {
                            if (failure != null) {
                                LOG.warnf(
                                        "Embedding %d chunks with %s failed: %s",
                                        texts.size(),
                                        embeddingGateway.modelId(),
                                        failure.getMessage());
                                return storage.write(payload, unembedded(fragments))
                                        .map(
                                                result ->
                                                        result.withVectorError(
                                                                VectorErrorCode.EMBEDDING_FAILED,
                                                                failure.getMessage()));
                            }
                            return storage.write(payload, embedded(fragments, vectors));
                        });
    }

    private static List<ChunkPayload> unembedded(List<TextChunk> fragments) {
        List<ChunkPayload> chunks = new ArrayList<>(fragments.size());
        for (TextChunk fragment : fragments) {
            chunks.add(new ChunkPayload(fragment.seq(), fragment.text(), null));
        }
        return chunks;
    }

    private static List<ChunkPayload> embedded(List<TextChunk> fragments, List<float[]> vectors) {
        List<ChunkPayload> chunks = new ArrayList<>(fragments.size());
        for (int i = 0; i < fragments.size(); i++) {
            TextChunk fragment = fragments.get(i);
            chunks.add(new ChunkPayload(fragment.seq(), fragment.text(), vectors.get(i)));
        }
        return chunks;
    }
}
