package io.github.chirino.llmcache.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public class DeleteItemRequest {

    @NotBlank
    @JsonProperty("ns")
    private String namespace;

    @NotBlank
    @JsonProperty("item_id")
    private String itemId;

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }
}
