package de.bsommerfeld.scratchdb.agent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.scratchdb.core.config.SessionConfig;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolResultCacheTest {

    private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private GuardedSession session;
    private ToolResultCache cache;

    @BeforeEach
    void setUp() throws SQLException {
        session = GuardedSession.open(tempDir.resolve("scratch.db"), new SessionConfig());
        cache = new ToolResultCache(64);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private List<Map<String, Object>> rows() throws SQLException {
        return session.execute("SELECT * FROM \"__tool_results\" ORDER BY result_id", ps -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= rs.getMetaData().getColumnCount(); i++)
                        row.put(rs.getMetaData().getColumnName(i), rs.getObject(i));
                    rows.add(row);
                }
            }
            return rows;
        });
    }

    // =====================================================================
    // Store
    // =====================================================================

    @Test
    void store_shouldWriteJsonAndTextResults() throws SQLException {
        int written = cache.store(session, List.of(
                new ToolResult("step-1", "http_request", AT, "{\"items\":[{\"id\":1}]}"),
                new ToolResult("step-2", "web_search", AT, "line one\nline two")));

        assertEquals(2, written);
        List<Map<String, Object>> rows = rows();
        assertEquals(2, rows.size());

        Map<String, Object> json = rows.get(0);
        assertEquals(1, json.get("is_json"));
        assertEquals("object", json.get("json_type"));
        assertEquals("items", json.get("top_keys"));
        assertEquals("{\"items\":[{\"id\":1}]}", json.get("result_json"));
        assertNull(json.get("result_text"));
        assertNotNull(json.get("analysis_json"));
        assertEquals(AT.toString(), json.get("created_at"));

        Map<String, Object> text = rows.get(1);
        assertEquals(0, text.get("is_json"));
        assertEquals(2, text.get("line_count"));
        assertEquals("line one\nline two", text.get("result_text"));
        assertNull(text.get("result_json"));
    }

    @Test
    void store_shouldReplacePreviousContents() throws SQLException {
        cache.store(session, List.of(new ToolResult("old", "web_search", AT, "stale")));
        cache.store(session, List.of(new ToolResult("new", "web_search", AT, "fresh")));

        List<Map<String, Object>> rows = rows();
        assertEquals(1, rows.size());
        assertEquals("new", rows.get(0).get("result_id"));
    }

    @Test
    void store_shouldSkipSqlToolsAndEmptyResults() throws SQLException {
        int written = cache.store(session, List.of(
                new ToolResult("a", "sqlite_batch", AT, "{\"ok\":true}"),
                new ToolResult("b", "sqlite_query", AT, "rows"),
                new ToolResult("c", "web_search", AT, "")));

        assertEquals(0, written);
        assertTrue(rows().isEmpty());
    }

    @Test
    void store_shouldKeepTruncatedJsonAsText() throws SQLException {
        String big = "[" + "\"abcdefghij\",".repeat(10) + "\"end\"]";
        cache.store(session, List.of(new ToolResult("big", "http_request", AT, big)));

        Map<String, Object> row = rows().get(0);
        assertEquals(1, row.get("is_json"));
        assertEquals(1, row.get("is_truncated"));
        assertNull(row.get("result_json"));
        assertEquals(64, ((String) row.get("result_text")).length());
        assertEquals(big.length() - 64, ((Number) row.get("truncated_bytes")).intValue());
    }

    // =====================================================================
    // Analysis
    // =====================================================================

    @Test
    void truncateToBytes_shouldNotSplitMultiByteCharacters() {
        ToolResultCache.Truncation cut = ToolResultCache.truncateToBytes("aé€😀", 6);

        assertEquals("aé€", cut.text());
        assertEquals(4, cut.droppedBytes());
    }

    @Test
    void truncateToBytes_shouldCountUnpairedSurrogateAsOneByte() {
        String text = "x\uD800yz";
        ToolResultCache.Truncation cut = ToolResultCache.truncateToBytes(text, 3);

        assertEquals("x\uD800y", cut.text());
        assertEquals(3, cut.text().getBytes(StandardCharsets.UTF_8).length);
        assertEquals(1, cut.droppedBytes());
    }

    @Test
    void truncateToBytes_shouldKeepTextWithinLimit() {
        ToolResultCache.Truncation cut = ToolResultCache.truncateToBytes("short", 10);

        assertEquals("short", cut.text());
        assertEquals(0, cut.droppedBytes());
    }

    @Test
    void summarize_shouldFlagImagesBase64AndBinary() {
        ToolResultCache.Entry entry = cache.summarize(
                new ToolResult("img", "http_request", AT, "<img src=\"data:image/png;base64,AAAA\">"));

        assertTrue(entry.hasImages());
        assertTrue(entry.hasBase64());
        assertFalse(entry.binary());
        assertTrue(ToolResultCache.isProbablyBinary("ab\0cd"));
        assertTrue(ToolResultCache.isProbablyBinary("\u0001\u0002\u0003a"));
        assertFalse(ToolResultCache.isProbablyBinary("plain text\twith tabs\n"));
    }

    @Test
    void summarize_shouldTreatScalarJsonAsText() {
        ToolResultCache.Entry entry = cache.summarize(new ToolResult("n", "http_request", AT, "42"));

        assertFalse(entry.json());
        assertEquals("", entry.jsonType());
        assertEquals("42", entry.resultText());
    }

    @Test
    void infer_shouldDescribeShapeUpToMaxDepth() throws Exception {
        JsonNode doc = new ObjectMapper().readTree(
                "{\"data\":{\"rows\":[{\"cell\":{\"deep\":1}}]},\"count\":2}");

        JsonNode shape = JsonShapes.infer(doc);

        assertEquals("object", shape.get("type").asText());
        assertEquals("number", shape.at("/keys/count/type").asText());
        JsonNode rows = shape.at("/keys/data/keys/rows");
        assertEquals("array", rows.get("type").asText());
        assertEquals(1, rows.get("length").asInt());
        assertEquals("object", rows.at("/items/type").asText());
        assertTrue(rows.at("/items/keys").isMissingNode());
    }

    @Test
    void topKeys_shouldUseFirstElementOfArrays() throws Exception {
        JsonNode doc = new ObjectMapper().readTree("[{\"name\":\"a\",\"price\":1},{\"other\":2}]");

        assertEquals(List.of("name", "price"), JsonShapes.topKeys(doc));
    }
}
