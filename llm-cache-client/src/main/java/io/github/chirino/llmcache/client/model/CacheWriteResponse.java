package io.github.chirino.llmcache.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheWriteResponse {

    @JsonProperty("item_id")
    private String itemId;

    private boolean vectorized;

    @JsonProperty("vector_error")
    private String vectorError;

    @JsonProperty("vector_error_detail")
    private String vectorErrorDetail;

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public boolean isVectorized() {
        return vectorized;
    }

    public void setVectorized(boolean vectorized) {
        this.vectorized = vectorized;
    }

    public String getVectorError() {
        return vectorError;
    }

    public void setVectorError(String vectorError) {
        this.vectorError = vectorError;
    }

    public String getVectorErrorDetail() {
        return vectorErrorDetail;
    }

    public void setVectorErrorDetail(String vectorErrorDetail) {
        this.vectorErrorDetail = vectorErrorDetail;
    }
}
