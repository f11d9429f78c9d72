package io.github.chirino.llmcache.model;

public record CacheWriteResult(
        String itemId, boolean vectorized, VectorErrorCode vectorError, String vectorErrorDetail) {

    public static CacheWriteResult vectorized(String itemId) {
        return new CacheWriteResult(itemId, true, null, null);
    }

    public static CacheWriteResult notVectorized(String itemId) {
        return new CacheWriteResult(itemId, false, null, null);
    }

    public static CacheWriteResult failed(String itemId, VectorErrorCode error, String detail) {
        return new CacheWriteResult(itemId, false, error, detail);
    }

    public CacheWriteResult withVectorError(VectorErrorCode error, String detail) {
        return new CacheWriteResult(itemId, false, error, detail);
    }
}
