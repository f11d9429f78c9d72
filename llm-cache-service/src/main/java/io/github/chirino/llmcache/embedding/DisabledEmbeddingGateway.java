package io.github.chirino.llmcache.embedding;

import java.util.List;

public class DisabledEmbeddingGateway implements EmbeddingGateway {

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        throw new EmbeddingProviderUnavailableException(
                "Embeddings are disabled (llm-cache.embedding.type=none)");
    }

    @Override
    public int dimensions() {
        return 0;
    }

    @Override
    public String modelId() {
        return "none";
    }
}
