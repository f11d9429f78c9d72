package io.github.chirino.llmcache.storage;

/**
 * The item does not exist in the requested namespace. Items of other namespaces are reported the
 * same way.
 */
public class CacheItemNotFoundException extends RuntimeException {

    private final String namespace;
    private final String itemId;

    public CacheItemNotFoundException(String namespace, String itemId) {
        super("Cache item not found: " + namespace + "/" + itemId);
        this.namespace = namespace;
        this.itemId = itemId;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getItemId() {
        return itemId;
    }
}
