package io.github.chirino.llmcache.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public class VectorSearchHit {

    @JsonProperty("chunk_id")
    private String chunkId;

    @JsonProperty("item_id")
    private String itemId;

    private String text;

    private Double score;

    private JsonNode meta;

    public VectorSearchHit() {}

    public VectorSearchHit(String chunkId, String itemId, String text, Double score) {
        this.chunkId = chunkId;
        this.itemId = itemId;
        this.text = text;
        this.score = score;
    }

    public String getChunkId() {
        return chunkId;
    }

    public void setChunkId(String chunkId) {
        this.chunkId = chunkId;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public Double getScore() {
        return score;
    }

    public void setScore(Double score) {
        this.score = score;
    }

    public JsonNode getMeta() {
        return meta;
    }

    public void setMeta(JsonNode meta) {
        this.meta = meta;
    }
}
