package io.github.chirino.llmcache.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.chirino.llmcache.model.VectorSearchResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class VectorSearchHit {

    @JsonProperty("chunk_id")
    private String chunkId;

    @JsonProperty("item_id")
    private String itemId;

    private String text;

    private Double score;

    private JsonNode meta;

    public static VectorSearchHit from(VectorSearchResult result) {
        VectorSearchHit hit = new VectorSearchHit();
        hit.setChunkId(result.chunkId());
        hit.setItemId(result.itemId());
        hit.setText(result.text());
        hit.setScore(Double.isNaN(result.score()) ? null : result.score());
        hit.setMeta(result.meta());
        return hit;
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
