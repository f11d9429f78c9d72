package io.github.chirino.llmcache.redis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the documents out of an {@code FT.SEARCH} reply, in either the RESP2 array shape {@code
 * [total, key, [field, value, ...], ...]} or the RESP3 map shape {@code {results: [{id,
 * extra_attributes}]}}.
 */
final class FtSearchReplyParser {

    record Document(String key, Map<String, String> fields) {}

    private FtSearchReplyParser() {}

    static List<Document> parse(Object reply) {
        if (reply instanceof Map<?, ?> map) {
            return parseResp3(map);
        }
        if (reply instanceof List<?> list) {
            return parseResp2(list);
        }
        return List.of();
    }

    private static List<Document> parseResp2(List<?> reply) {
        List<Document> documents = new ArrayList<>();
        // Element 0 is the total count.
        for (int i = 1; i < reply.size(); i += 2) {
            String key = String.valueOf(reply.get(i));
            Object fields = i + 1 < reply.size() ? reply.get(i + 1) : null;
            documents.add(new Document(key, fields(fields)));
        }
        return documents;
    }

    private static List<Document> parseResp3(Map<?, ?> reply) {
        Object results = reply.get("results");
        if (!(results instanceof List<?> list)) {
            return List.of();
        }
        List<Document> documents = new ArrayList<>(list.size());
        for (Object entry : list) {
            if (!(entry instanceof Map<?, ?> result)) {
                continue;
            }
            Object id = result.get("id");
            documents.add(
                    new Document(
                            id == null ? "" : String.valueOf(id),
                            fields(result.get("extra_attributes"))));
        }
        return documents;
    }

    private static Map<String, String> fields(Object raw) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (raw instanceof Map<?, ?> map) {
            map.forEach((k, v) -> fields.put(String.valueOf(k), v == null ? null : String.valueOf(v)));
        } else if (raw instanceof List<?> list) {
            for (int i = 0; i + 1 < list.size(); i += 2) {
                Object value = list.get(i + 1);
                fields.put(String.valueOf(list.get(i)), value == null ? null : String.valueOf(value));
            }
        }
        return fields;
    }
}
