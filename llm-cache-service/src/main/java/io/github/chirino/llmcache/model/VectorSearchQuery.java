package io.github.chirino.llmcache.model;

/**
 * Similarity lookup scoped to one namespace. Hits are only filtered by {@code maxDistance} when it
 * is set.
 */
public record VectorSearchQuery(String namespace, String query, int topK, Double maxDistance) {}
