package io.github.chirino.llmcache.client.dedup;

import java.time.Duration;

/** Settings of a deduplicated function. Only the namespace is required. */
public final class DedupOptions {

    public static final int DEFAULT_TOP_K = 1;
    public static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofSeconds(5);

    private final String namespace;
    private final Integer ttlSeconds;
    private final int topK;
    private final Double maxDistance;
    private final Duration lookupTimeout;

    private DedupOptions(Builder builder) {
        if (builder.namespace == null || builder.namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        this.namespace = builder.namespace;
        this.ttlSeconds = builder.ttlSeconds;
        this.topK = Math.max(1, builder.topK);
        this.maxDistance = builder.maxDistance;
        this.lookupTimeout = builder.lookupTimeout;
    }

    public static Builder builder(String namespace) {
        return new Builder().namespace(namespace);
    }

    public String namespace() {
        return namespace;
    }

    /** Null when stored responses never expire. */
    public Integer ttlSeconds() {
        return ttlSeconds;
    }

    public int topK() {
        return topK;
    }

    /** Null accepts the best similarity hit whatever its distance. */
    public Double maxDistance() {
        return maxDistance;
    }

    public Duration lookupTimeout() {
        return lookupTimeout;
    }

    public static final class Builder {

        private String namespace;
        private Integer ttlSeconds;
        private int topK = DEFAULT_TOP_K;
        private Double maxDistance;
        private Duration lookupTimeout = DEFAULT_LOOKUP_TIMEOUT;

        private Builder() {}

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder ttlSeconds(Integer ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder maxDistance(Double maxDistance) {
            this.maxDistance = maxDistance;
            return this;
        }

        public Builder lookupTimeout(Duration lookupTimeout) {
            this.lookupTimeout = lookupTimeout;
            return this;
        }

        public DedupOptions build() {
            return new DedupOptions(this);
        }
    }
}
