package io.github.chirino.llmcache.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;

public class OpenAiEmbeddingGateway extends LangChain4jEmbeddingGateway {

    private final OpenAiEmbeddingModel model;
    private final String modelName;

    public OpenAiEmbeddingGateway(
            String apiKey,
            String modelName,
            String baseUrl,
            String organization,
            Integer dimensions,
            Duration timeout) {
        super(dimensions != null && dimensions > 0 ? dimensions : inferDimensions(modelName));
        this.modelName = modelName;

        if (apiKey == null || apiKey.isBlank()) {
            // Reported on the first embed call.
            this.model = null;
            return;
        }

        var builder =
                OpenAiEmbeddingModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .baseUrl(baseUrl)
                        .timeout(timeout);
        if (organization != null && !organization.isBlank()) {
            builder.organizationId(organization);
        }
        if (dimensions != null && dimensions > 0) {
            builder.dimensions(dimensions);
        }
        this.model = builder.build();
    }

    @Override
    protected EmbeddingModel model() {
        if (model == null) {
            throw new EmbeddingProviderUnavailableException(
                    "llm-cache.embedding.openai.api-key is not configured");
        }
        return model;
    }

    @Override
    public String modelId() {
        return "openai/" + modelName;
    }

    static int inferDimensions(String modelName) {
        if (modelName == null) {
            return 0;
        }
        return switch (modelName) {
            case "text-embedding-3-small", "text-embedding-ada-002" -> 1536;
            case "text-embedding-3-large" -> 3072;
            default -> 0;
        };
    }
}
