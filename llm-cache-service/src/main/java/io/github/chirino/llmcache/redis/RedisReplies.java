package io.github.chirino.llmcache.redis;

import io.vertx.mutiny.redis.client.Response;
import io.vertx.redis.client.ResponseType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Converts Redis replies into plain lists, maps and strings. */
final class RedisReplies {

    private RedisReplies() {}

    static Object toJava(Response response) {
        if (response == null) {
            return null;
        }
        if (response.type() != ResponseType.MULTI) {
            return response.toString();
        }
        Set<String> keys = mapKeys(response);
        if (keys != null) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : keys) {
                map.put(key, toJava(response.get(key)));
            }
            return map;
        }
        List<Object> list = new ArrayList<>(response.size());
        for (int i = 0; i < response.size(); i++) {
            list.add(toJava(response.get(i)));
        }
        return list;
    }

    private static Set<String> mapKeys(Response response) {
        try {
            Set<String> keys = response.getKeys();
            return keys == null || keys.isEmpty() ? null : keys;
        } catch (RuntimeException notAMap) {
            return null;
        }
    }
}
