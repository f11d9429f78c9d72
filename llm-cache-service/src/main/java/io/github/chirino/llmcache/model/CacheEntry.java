package io.github.chirino.llmcache.model;

import com.fasterxml.jackson.databind.JsonNode;

/** A {@link CacheItem} returned to readers, with its metadata parsed. {@code meta} may be null. */
public record CacheEntry(CacheItem item, JsonNode meta) {}
