package io.github.chirino.llmcache.client.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class VectorSearchRequest {

    @JsonProperty("ns")
    private String namespace;

    private String query;

    @JsonProperty("top_k")
    private Integer topK;

    @JsonProperty("max_distance")
    private Double maxDistance;

    public VectorSearchRequest() {}

    public VectorSearchRequest(String namespace, String query, Integer topK) {
        this.namespace = namespace;
        this.query = query;
        this.topK = topK;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public Integer getTopK() {
        return topK;
    }

    public void setTopK(Integer topK) {
        this.topK = topK;
    }

    public Double getMaxDistance() {
        return maxDistance;
    }

    public void setMaxDistance(Double maxDistance) {
        this.maxDistance = maxDistance;
    }
}
