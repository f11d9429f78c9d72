package io.github.chirino.llmcache.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

/** Serialized item metadata. Unparsable metadata reads as absent rather than failing. */
public final class MetaJson {

    private static final Logger LOG = Logger.getLogger(MetaJson.class);

    private MetaJson() {}

    public static JsonNode parse(ObjectMapper objectMapper, String metaJson) {
        if (metaJson == null || metaJson.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(metaJson);
        } catch (JsonProcessingException e) {
            LOG.debugf("Ignoring unparsable item metadata: %s", e.getOriginalMessage());
            return null;
        }
    }

    public static String serialize(ObjectMapper objectMapper, JsonNode meta) {
        if (meta == null || meta.isNull() || meta.isMissingNode()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new InvalidCacheRequestException("meta is not serializable: " + e.getMessage());
        }
    }
}
