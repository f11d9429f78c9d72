package io.github.chirino.llmcache.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.llmcache.model.VectorSearchResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FtSearchReplyParserTest {

    @Test
    void parses_resp2_array_reply() {
        List<Object> reply =
                List.of(
                        "2",
                        "l1:chunk:t:1#0",
                        List.of("chunk_id", "t:1#0", "item_id", "t:1", "score", "0.12"),
                        "l1:chunk:t:2#3",
                        List.of("item_id", "t:2", "score", "0.5"));

        List<FtSearchReplyParser.Document> documents = FtSearchReplyParser.parse(reply);

        assertEquals(2, documents.size());
        assertEquals("l1:chunk:t:1#0", documents.get(0).key());
        assertEquals("0.12", documents.get(0).fields().get("score"));
        assertEquals("t:2", documents.get(1).fields().get("item_id"));
    }

    @Test
    void parses_resp3_map_reply() {
        Map<String, Object> reply =
                Map.of(
                        "total_results",
                        "1",
                        "results",
                        List.of(
                                Map.of(
                                        "id",
                                        "l1:chunk:t:1#0",
                                        "extra_attributes",
                                        Map.of("item_id", "t:1", "score", "0.3"))));

        List<FtSearchReplyParser.Document> documents = FtSearchReplyParser.parse(reply);

        assertEquals(1, documents.size());
        assertEquals("t:1", documents.get(0).fields().get("item_id"));
    }

    @Test
    void empty_or_unexpected_replies_have_no_documents() {
        assertTrue(FtSearchReplyParser.parse(List.of("0")).isEmpty());
        assertTrue(FtSearchReplyParser.parse(Map.of("total_results", "0")).isEmpty());
        assertTrue(FtSearchReplyParser.parse("OK").isEmpty());
        assertTrue(FtSearchReplyParser.parse(null).isEmpty());
    }

    @Test
    void converts_documents_to_results() {
        RedisVectorSearch search = new RedisVectorSearch(null, new ObjectMapper());
        List<Object> reply =
                List.of(
                        "2",
                        "l1:chunk:t:1#0",
                        List.of(
                                "item_id", "t:1",
                                "ns", "t",
                                "text", "hello",
                                "score", "0.25",
                                "meta_json", "{\"k\":1}"),
                        "l1:chunk:t:2#1",
                        List.of("item_id", "t:2", "score", "n/a", "meta_json", "{broken"));

        List<VectorSearchResult> results = search.toResults("t", reply);

        assertEquals("t:1#0", results.get(0).chunkId());
        assertEquals(0.25, results.get(0).score());
        assertEquals(1, results.get(0).meta().get("k").asInt());
        assertEquals("t", results.get(1).namespace());
        assertTrue(Double.isNaN(results.get(1).score()));
        assertNull(results.get(1).meta());
    }

    @Test
    void knn_query_escapes_namespace_tag() {
        assertEquals(
                "(@ns:{team\\-a\\:prod})=>[KNN 5 @vec $blob_vec AS score]",
                RedisVectorSearch.knnQuery("team-a:prod", 5));
        assertEquals("plain", RedisVectorSearch.escapeTag("plain"));
        assertEquals("a\\ b", RedisVectorSearch.escapeTag("a b"));
    }

    @Test
    void knn_query_escapes_dedup_style_namespaces() {
        assertEquals(
                "(@ns:{dedup\\:chat\\-v2\\:4f2a})=>[KNN 1 @vec $blob_vec AS score]",
                RedisVectorSearch.knnQuery("dedup:chat-v2:4f2a", 1));
        assertEquals("a\\,b\\|c\\{d\\}", RedisVectorSearch.escapeTag("a,b|c{d}"));
        assertEquals("user\\@example\\.com", RedisVectorSearch.escapeTag("user@example.com"));
        assertEquals("back\\\\slash", RedisVectorSearch.escapeTag("back\\slash"));
    }

    @Test
    void vectors_are_little_endian_float32() {
        byte[] bytes = VectorCodec.toBytes(new float[] {1.0f, -2.5f});

        assertEquals(8, bytes.length);
        // 1.0f = 0x3F800000
        assertEquals((byte) 0x00, bytes[0]);
        assertEquals((byte) 0x3F, bytes[3]);
        // -2.5f = 0xC0200000
        assertEquals((byte) 0x20, bytes[6]);
        assertEquals((byte) 0xC0, bytes[7]);
    }
}
