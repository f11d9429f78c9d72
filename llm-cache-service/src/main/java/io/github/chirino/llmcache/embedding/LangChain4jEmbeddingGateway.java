package io.github.chirino.llmcache.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for gateways backed by a LangChain4j {@link EmbeddingModel}. Translates provider
 * failures into the {@link EmbeddingException} hierarchy and validates every response.
 */
public abstract class LangChain4jEmbeddingGateway implements EmbeddingGateway {

    private final AtomicInteger dimension;

    protected LangChain4jEmbeddingGateway(int knownDimension) {
        this.dimension = new AtomicInteger(Math.max(0, knownDimension));
    }

    /**
     * @throws EmbeddingProviderUnavailableException when the model cannot be used
     */
    protected abstract EmbeddingModel model();

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null) {
            throw new IllegalArgumentException("texts must not be null");
        }
        if (texts.isEmpty()) {
            return List.of();
        }
        EmbeddingModel model = model();

        Response<List<Embedding>> response;
        try {
            List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
            response = model.embedAll(segments);
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingProviderErrorException(
                    "Embedding request to " + modelId() + " failed: " + e.getMessage(), e);
        }

        List<float[]> vectors = validate(texts.size(), response);
        establishDimension(vectors.get(0).length);
        return vectors;
    }

    @Override
    public int dimensions() {
        return dimension.get();
    }

    private List<float[]> validate(int expected, Response<List<Embedding>> response) {
        List<Embedding> embeddings = response == null ? null : response.content();
        if (embeddings == null || embeddings.size() != expected) {
            throw new EmbeddingResponseMalformedException(
                    "Expected "
                            + expected
                            + " embeddings from "
                            + modelId()
                            + " but got "
                            + (embeddings == null ? "none" : embeddings.size()));
        }
        List<float[]> vectors = new ArrayList<>(expected);
        int width = -1;
        for (int i = 0; i < embeddings.size(); i++) {
            Embedding embedding = embeddings.get(i);
            float[] vector = embedding == null ? null : embedding.vector();
            if (vector == null || vector.length == 0) {
                throw new EmbeddingResponseMalformedException(
                        "Embedding " + i + " from " + modelId() + " has no vector data");
            }
            for (float value : vector) {
                if (!Float.isFinite(value)) {
                    throw new EmbeddingResponseMalformedException(
                            "Embedding " + i + " from " + modelId() + " is not numeric");
                }
            }
            if (width >= 0 && vector.length != width) {
                throw new EmbeddingResponseMalformedException(
                        "Embeddings from " + modelId() + " have inconsistent dimensions");
            }
            width = vector.length;
            vectors.add(vector);
        }
        return vectors;
    }

    private void establishDimension(int actual) {
        if (dimension.compareAndSet(0, actual)) {
            return;
        }
        int established = dimension.get();
        if (established != actual) {
            throw new EmbeddingResponseMalformedException(
                    "Expected "
                            + established
                            + "-dimensional embeddings from "
                            + modelId()
                            + " but got "
                            + actual);
        }
    }
}
