package io.github.chirino.llmcache.embedding;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import java.time.Duration;
import java.util.List;

/**
 * Batch access to an embedding provider. Calls are synchronous and may be slow; use {@link
 * #embedAsync(List, Duration)} from reactive code.
 */
public interface EmbeddingGateway {

    /**
     * Embeds every text in one provider call.
     *
     * @return one vector per input text, in input order; empty without a provider call when {@code
     *     texts} is empty
     * @throws EmbeddingProviderUnavailableException when the provider cannot be used
     * @throws EmbeddingProviderErrorException when the provider call fails
     * @throws EmbeddingResponseMalformedException when the response does not match the input
     */
    List<float[]> embed(List<String> texts);

    /** Vector size produced by this gateway, or 0 while it is not yet known. */
    int dimensions();

    String modelId();

    default Uni<List<float[]>> embedAsync(List<String> texts, Duration timeout) {
        return Uni.createFrom()
                .item(() -> embed(texts))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .ifNoItem()
                .after(timeout)
                .failWith(
                        () ->
                                new EmbeddingProviderErrorException(
                                        "Embedding call to " + modelId() + " timed out after "
                                                + timeout));
    }
}
