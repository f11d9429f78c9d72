package io.github.chirino.llmcache.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.chirino.llmcache.model.CacheEntry;
import io.github.chirino.llmcache.model.CacheItem;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheEntryResponse {

    @JsonProperty("item_id")
    private String itemId;

    @JsonProperty("ns")
    private String namespace;

    private String text;

    @JsonProperty("meta_json")
    private String metaJson;

    private JsonNode meta;

    @JsonProperty("created_at")
    private long createdAt;

    @JsonProperty("updated_at")
    private long updatedAt;

    @JsonProperty("ttl_s")
    private Integer ttlSeconds;

    private long version;

    public static CacheEntryResponse from(CacheEntry entry) {
        CacheItem item = entry.item();
        CacheEntryResponse response = new CacheEntryResponse();
        response.setItemId(item.itemId());
        response.setNamespace(item.namespace());
        response.setText(item.text());
        response.setMetaJson(item.metaJson());
        response.setMeta(entry.meta());
        response.setCreatedAt(item.createdAt());
        response.setUpdatedAt(item.updatedAt());
        response.setTtlSeconds(item.ttlSeconds());
        response.setVersion(item.version());
        return response;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getMetaJson() {
        return metaJson;
    }

    public void setMetaJson(String metaJson) {
        this.metaJson = metaJson;
    }

    public JsonNode getMeta() {
        return meta;
    }

    public void setMeta(JsonNode meta) {
        this.meta = meta;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Integer getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(Integer ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }
}
