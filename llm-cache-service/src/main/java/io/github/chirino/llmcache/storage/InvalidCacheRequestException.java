package io.github.chirino.llmcache.storage;

/** A request was rejected before any I/O because of its shape. */
public class InvalidCacheRequestException extends RuntimeException {

    public InvalidCacheRequestException(String message) {
        super(message);
    }
}
