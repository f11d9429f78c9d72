package io.github.chirino.llmcache.model;

/** Reported in place of a failed vectorization; the item write itself still commits. */
public enum VectorErrorCode {
    EMBEDDING_FAILED("embedding_failed"),
    INDEX_WRITE_FAILED("index_write_failed");

    private final String code;

    VectorErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
