package io.github.chirino.llmcache.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class VectorSearchResponse {

    private List<VectorSearchHit> results;

    public List<VectorSearchHit> getResults() {
        return results;
    }

    public void setResults(List<VectorSearchHit> results) {
        this.results = results;
    }
}
