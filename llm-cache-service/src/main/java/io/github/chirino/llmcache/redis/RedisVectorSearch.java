package io.github.chirino.llmcache.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.llmcache.model.VectorSearchResult;
import io.github.chirino.llmcache.storage.MetaJson;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.redis.client.Command;
import io.vertx.mutiny.redis.client.Request;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** KNN queries against the chunk index, pre-filtered by namespace tag. */
public class RedisVectorSearch {

    private static final Command FT_SEARCH = Command.create("FT.SEARCH");
    private static final String SCORE = "score";
    private static final String TAG_SPECIAL_CHARS = ",.<>{}[]\"':;!@#$%^&*()-+=~|/\\ ";

    private final ReactiveRedisDataSource dataSource;
    private final ObjectMapper objectMapper;

    public RedisVectorSearch(ReactiveRedisDataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    public Uni<List<VectorSearchResult>> search(String namespace, float[] vector, int k) {
        Request request =
                Request.cmd(FT_SEARCH)
                        .arg(RedisKeys.CHUNK_INDEX)
                        .arg(knnQuery(namespace, k))
                        .arg("PARAMS")
                        .arg("2")
                        .arg("blob_vec")
                        .arg(Buffer.buffer(VectorCodec.toBytes(vector)))
                        .arg("SORTBY")
                        .arg(SCORE)
                        .arg("ASC")
                        .arg("RETURN")
                        .arg("6")
                        .arg(RedisChunkStore.CHUNK_ID)
                        .arg(RedisChunkStore.ITEM_ID)
                        .arg(RedisChunkStore.NAMESPACE)
                        .arg(RedisChunkStore.TEXT)
                        .arg(SCORE)
                        .arg(RedisChunkStore.META_JSON)
                        .arg("DIALECT")
                        .arg("2")
                        .arg("LIMIT")
                        .arg("0")
                        .arg(String.valueOf(k));
        return dataSource
                .getRedis()
                .send(request)
                .map(response -> toResults(namespace, RedisReplies.toJava(response)));
    }

    static String knnQuery(String namespace, int k) {
        return "(@" + RedisChunkStore.NAMESPACE + ":{" + escapeTag(namespace) + "})=>[KNN " + k
                + " @" + RedisKeys.VECTOR_FIELD + " $blob_vec AS " + SCORE + "]";
    }

    static String escapeTag(String value) {
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (TAG_SPECIAL_CHARS.indexOf(c) >= 0) {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    List<VectorSearchResult> toResults(String namespace, Object reply) {
        List<FtSearchReplyParser.Document> documents = FtSearchReplyParser.parse(reply);
        List<VectorSearchResult> results = new ArrayList<>(documents.size());
        for (FtSearchReplyParser.Document document : documents) {
            Map<String, String> fields = document.fields();
            String chunkId = fields.get(RedisChunkStore.CHUNK_ID);
            if (chunkId == null || chunkId.isEmpty()) {
                chunkId = RedisKeys.stripChunkPrefix(document.key());
            }
            String hitNamespace = fields.get(RedisChunkStore.NAMESPACE);
            results.add(
                    new VectorSearchResult(
                            chunkId,
                            fields.getOrDefault(RedisChunkStore.ITEM_ID, ""),
                            hitNamespace == null ? namespace : hitNamespace,
                            fields.getOrDefault(RedisChunkStore.TEXT, ""),
                            parseScore(fields.get(SCORE)),
                            MetaJson.parse(objectMapper, fields.get(RedisChunkStore.META_JSON))));
        }
        return results;
    }

    private static double parseScore(String raw) {
        if (raw == null) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
