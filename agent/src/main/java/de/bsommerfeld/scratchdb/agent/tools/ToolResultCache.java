package de.bsommerfeld.scratchdb.agent.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.db.SqlLoader;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes recent tool outputs into {@code __tool_results} so the agent can
 * query them with SQL instead of reading them from its prompt.
 *
 * <p>
 * Each store replaces the table contents. Results of the SQL tools
 * themselves are skipped. Text above the configured byte cap is cut on a
 * character boundary and kept in {@code result_text}; complete JSON goes to
 * {@code result_json} together with its inferred shape in
 * {@code analysis_json}.
 */
@Singleton
public class ToolResultCache {

    private static final Logger LOG = LoggerFactory.getLogger(ToolResultCache.class);

    static final Set<String> EXCLUDED_TOOLS = Set.of("sqlite_batch", "sqlite_query");

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern BASE64 = Pattern.compile("base64,", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE = Pattern.compile("data:image/|image_base64|image_url",
            Pattern.CASE_INSENSITIVE);
    private static final int BINARY_SAMPLE_CHARS = 1000;
    private static final double BINARY_RATIO = 0.3;

    private final int maxBytes;

    /** Column values of one {@code __tool_results} row. */
    record Entry(
            String resultId,
            String toolName,
            Instant createdAt,
            long bytes,
            int lineCount,
            boolean json,
            String jsonType,
            String topKeys,
            boolean binary,
            boolean hasImages,
            boolean hasBase64,
            boolean truncated,
            long truncatedBytes,
            String resultJson,
            String analysisJson,
            String resultText) {
    }

    record Truncation(String text, long droppedBytes) {
    }

    @Inject
    public ToolResultCache(ScratchDbConfig config) {
        this(config.getPrompt().getToolResultMaxBytes());
    }

    ToolResultCache(int maxBytes) {
        this.maxBytes = maxBytes;
    }

    public void ensureTable(GuardedSession session) throws SQLException {
        session.execute(SqlLoader.load("create-tool-results"));
    }

    /**
     * Replaces the cached results with {@code results}.
     *
     * @return number of rows written
     */
    public int store(GuardedSession session, List<ToolResult> results) throws SQLException {
        List<Entry> entries = new ArrayList<>();
        for (ToolResult result : results) {
            if (result.text() == null || result.text().isEmpty() || EXCLUDED_TOOLS.contains(result.toolName()))
                continue;
            entries.add(summarize(result));
        }

        session.begin();
        try {
            ensureTable(session);
            session.execute(SqlLoader.load("clear-tool-results"));
            if (!entries.isEmpty()) {
                session.execute(SqlLoader.load("insert-tool-result"), ps -> {
                    for (Entry entry : entries) {
                        bind(ps, entry);
                        ps.addBatch();
                    }
                    return ps.executeBatch();
                });
            }
            session.commit();
        } catch (SQLException | RuntimeException e) {
            session.rollback();
            throw e;
        }
        LOG.debug("Stored {} tool results ({} skipped)", entries.size(), results.size() - entries.size());
        return entries.size();
    }

    private static void bind(PreparedStatement ps, Entry entry) throws SQLException {
        ps.setString(1, entry.resultId());
        ps.setString(2, entry.toolName());
        if (entry.createdAt() == null) {
            ps.setNull(3, Types.VARCHAR);
        } else {
            ps.setString(3, entry.createdAt().toString());
        }
        ps.setLong(4, entry.bytes());
        ps.setInt(5, entry.lineCount());
        ps.setInt(6, entry.json() ? 1 : 0);
        ps.setString(7, entry.jsonType());
        ps.setString(8, entry.topKeys());
        ps.setInt(9, entry.binary() ? 1 : 0);
        ps.setInt(10, entry.hasImages() ? 1 : 0);
        ps.setInt(11, entry.hasBase64() ? 1 : 0);
        ps.setInt(12, entry.truncated() ? 1 : 0);
        ps.setLong(13, entry.truncatedBytes());
        ps.setString(14, entry.resultJson());
        ps.setString(15, entry.analysisJson());
        ps.setString(16, entry.resultText());
    }

    // =====================================================================
    // Analysis
    // =====================================================================

    Entry summarize(ToolResult result) {
        String text = result.text();
        long bytes = text.getBytes(StandardCharsets.UTF_8).length;
        int lineCount = text.isEmpty() ? 0 : (int) text.chars().filter(c -> c == '\n').count() + 1;

        JsonNode json = parseContainer(text);
        String jsonType = json == null ? "" : JsonShapes.typeOf(json);
        String topKeys = json == null ? "" : String.join(",", JsonShapes.topKeys(json));
        String analysis = json == null ? null : writeShape(json);

        Truncation truncation = truncateToBytes(text, maxBytes);
        boolean truncated = truncation.droppedBytes() > 0;
        String resultJson = json != null && !truncated ? truncation.text() : null;
        String resultText = resultJson == null ? truncation.text() : null;
        if (truncated) {
            LOG.warn("Tool result {} from {} truncated by {} bytes", result.resultId(), result.toolName(),
                    truncation.droppedBytes());
        }

        return new Entry(result.resultId(), result.toolName(), result.createdAt(), bytes, lineCount, json != null,
                jsonType, topKeys, isProbablyBinary(text), IMAGE.matcher(text).find(), BASE64.matcher(text).find(),
                truncated, truncation.droppedBytes(), resultJson, analysis, resultText);
    }

    /** @return the parsed document if {@code text} is a JSON object or array */
    private static JsonNode parseContainer(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("["))
            return null;
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            return node != null && node.isContainerNode() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String writeShape(JsonNode json) {
        try {
            return MAPPER.writeValueAsString(JsonShapes.infer(json));
        } catch (JsonProcessingException e) {
            LOG.debug("Failed to serialize JSON shape", e);
            return null;
        }
    }

    /**
     * Cuts {@code text} to at most {@code maxBytes} UTF-8 bytes without
     * splitting a character. The dropped count is measured against the cap.
     */
    static Truncation truncateToBytes(String text, int maxBytes) {
        long total = text.getBytes(StandardCharsets.UTF_8).length;
        if (total <= maxBytes)
            return new Truncation(text, 0);

        int bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int codePoint = text.codePointAt(end);
            int length = utf8Length(codePoint);
            if (bytes + length > maxBytes)
                break;
            bytes += length;
            end += Character.charCount(codePoint);
        }
        return new Truncation(text.substring(0, end), total - maxBytes);
    }

    private static int utf8Length(int codePoint) {
        // an unpaired surrogate is encoded as a single '?'
        if (codePoint < 0x80 || Character.isSurrogate((char) codePoint))
            return 1;
        if (codePoint < 0x800)
            return 2;
        if (codePoint < 0x10000)
            return 3;
        return 4;
    }

    static boolean isProbablyBinary(String text) {
        if (text.indexOf('\0') >= 0)
            return true;
        String sample = text.length() > BINARY_SAMPLE_CHARS ? text.substring(0, BINARY_SAMPLE_CHARS) : text;
        if (sample.isEmpty())
            return false;
        long control = sample.chars().filter(c -> c < 9 || (c > 13 && c < 32)).count();
        return (double) control / sample.length() > BINARY_RATIO;
    }
}
