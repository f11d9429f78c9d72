package io.github.chirino.llmcache.storage;

import io.github.chirino.llmcache.model.VectorSearchResult;
import java.util.Comparator;
import java.util.List;

public final class VectorSearchResults {

    private VectorSearchResults() {}

    /**
     * Keeps hits of {@code namespace} within {@code maxDistance} (when set), sorted ascending by
     * score and truncated to {@code topK}. NaN scores sort last.
     */
    public static List<VectorSearchResult> rank(
            List<VectorSearchResult> hits, String namespace, int topK, Double maxDistance) {
        return hits.stream()
                .filter(hit -> namespace.equals(hit.namespace()))
                .filter(hit -> maxDistance == null || hit.score() <= maxDistance)
                .sorted(Comparator.comparingDouble(VectorSearchResults::sortKey))
                .limit(Math.max(0, topK))
                .toList();
    }

    private static double sortKey(VectorSearchResult hit) {
        return Double.isNaN(hit.score()) ? Double.POSITIVE_INFINITY : hit.score();
    }
}
