package io.github.chirino.llmcache.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.chirino.llmcache.model.CacheWriteResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheWriteResponse {

    @JsonProperty("item_id")
    private String itemId;

    private boolean vectorized;

    @JsonProperty("vector_error")
    private String vectorError;

    @JsonProperty("vector_error_detail")
    private String vectorErrorDetail;

    public static CacheWriteResponse from(CacheWriteResult result) {
        CacheWriteResponse response = new CacheWriteResponse();
        response.setItemId(result.itemId());
        response.setVectorized(result.vectorized());
        if (result.vectorError() != null) {
            response.setVectorError(result.vectorError().code());
            response.setVectorErrorDetail(result.vectorErrorDetail());
        }
        return response;
    }

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
