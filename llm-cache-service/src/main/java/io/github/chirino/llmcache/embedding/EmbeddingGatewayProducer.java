package io.github.chirino.llmcache.embedding;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class EmbeddingGatewayProducer {

    private static final Logger LOG = Logger.getLogger(EmbeddingGatewayProducer.class);

    @ConfigProperty(name = "llm-cache.embedding.type", defaultValue = "openai")
    String embeddingType;

    @ConfigProperty(name = "llm-cache.embedding.openai.api-key")
    Optional<String> openaiApiKey;

    // Fallback: picks up the generic OPENAI_API_KEY env var
    @ConfigProperty(name = "openai.api.key")
    Optional<String> genericOpenaiApiKey;

    @ConfigProperty(
            name = "llm-cache.embedding.openai.model-name",
            defaultValue = "text-embedding-3-small")
    String openaiModelName;

    @ConfigProperty(
            name = "llm-cache.embedding.openai.base-url",
            defaultValue = "https://api.openai.com/v1")
    String openaiBaseUrl;

    @ConfigProperty(name = "llm-cache.embedding.openai.organization")
    Optional<String> openaiOrganization;

    @ConfigProperty(name = "llm-cache.embedding.openai.dimensions")
    Optional<Integer> openaiDimensions;

    @ConfigProperty(name = "llm-cache.embedding.hash.dimension", defaultValue = "256")
    int hashDimension;

    @ConfigProperty(name = "llm-cache.embedding.timeout", defaultValue = "PT10S")
    Duration timeout;

    @Produces
    @Singleton
    public EmbeddingGateway embeddingGateway() {
        EmbeddingGateway gateway =
                switch (embeddingType.trim().toLowerCase(Locale.ROOT)) {
                    case "openai" ->
                            new OpenAiEmbeddingGateway(
                                    openaiApiKey
                                            .filter(key -> !key.isBlank())
                                            .or(() -> genericOpenaiApiKey)
                                            .orElse(null),
                                    openaiModelName,
                                    openaiBaseUrl,
                                    openaiOrganization.orElse(null),
                                    openaiDimensions.orElse(null),
                                    timeout);
                    case "local" -> new LocalEmbeddingGateway();
                    case "hash" -> new HashEmbeddingGateway(hashDimension);
                    case "none" -> new DisabledEmbeddingGateway();
                    default ->
                            throw new IllegalStateException(
                                    "Unsupported embedding type: "
                                            + embeddingType
                                            + ". Valid values: openai, local, hash, none");
                };
        LOG.infof(
                "Using embedding gateway %s (dimensions=%d)",
                gateway.modelId(), gateway.dimensions());
        return gateway;
    }
}
