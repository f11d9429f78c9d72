package io.github.chirino.llmcache.model;

import com.fasterxml.jackson.databind.JsonNode;

/** A ranked chunk hit. Lower {@code score} means more similar. */
public record VectorSearchResult(
        String chunkId, String itemId, String namespace, String text, double score, JsonNode meta) {}
