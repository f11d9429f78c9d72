package io.github.chirino.llmcache.storage;

public class ConcurrentItemUpdateException extends RuntimeException {

    private final String itemId;

    public ConcurrentItemUpdateException(String itemId, int attempts) {
        super(
                "Item "
                        + itemId
                        + " was modified concurrently; gave up after "
                        + attempts
                        + " attempts");
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
