package io.github.chirino.llmcache.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;

/** In-process all-MiniLM-L6-v2 model. The ONNX runtime is loaded on first use. */
public class LocalEmbeddingGateway extends LangChain4jEmbeddingGateway {

    static final int DIMENSIONS = 384;

    private volatile AllMiniLmL6V2QuantizedEmbeddingModel model;

    public LocalEmbeddingGateway() {
        super(DIMENSIONS);
    }

    @Override
    protected EmbeddingModel model() {
        if (model == null) {
            synchronized (this) {
                if (model == null) {
                    model = new AllMiniLmL6V2QuantizedEmbeddingModel();
                }
            }
        }
        return model;
    }

    @Override
    public String modelId() {
        return "local/all-MiniLM-L6-v2";
    }
}
