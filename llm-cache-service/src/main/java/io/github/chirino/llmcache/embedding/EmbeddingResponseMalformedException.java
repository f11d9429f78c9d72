package io.github.chirino.llmcache.embedding;

/** The provider answered, but not with one well-formed vector per input text. */
public class EmbeddingResponseMalformedException extends EmbeddingException {

    public EmbeddingResponseMalformedException(String message) {
        super(message);
    }
}
