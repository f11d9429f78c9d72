package io.github.chirino.llmcache.api.dto;

import java.util.List;

public class VectorSearchResponse {

    private List<VectorSearchHit> results;

    public VectorSearchResponse() {}

    public VectorSearchResponse(List<VectorSearchHit> results) {
        this.results = results;
    }

    public List<VectorSearchHit> getResults() {
        return results;
    }

    public void setResults(List<VectorSearchHit> results) {
        this.results = results;
    }
}
