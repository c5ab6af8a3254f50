package de.bsommerfeld.scratchdb.db.digest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The whole-database report. The summary fields are what the agent sees;
 * {@link #tables()} and {@link #relationships()} keep the full detail for
 * callers that want it.
 *
 * <p>
 * Two degenerate shapes exist: {@link #empty} for a database without user
 * tables (verdict {@code minimal}, action {@code skip}) and {@link #error}
 * for anything that could not be profiled (verdict {@code error}, action
 * {@code investigate}).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DatabaseDigest(
        long fileSize,
        long pageCount,
        int tableCount,
        int viewCount,
        int indexCount,
        int triggerCount,
        long totalRows,
        int totalColumns,
        String tablesSummary,
        String largestTables,
        int explicitFkCount,
        int implicitFkCount,
        String relationshipsSummary,
        double overallNullPct,
        String overallNullVerdict,
        double typeConsistency,
        String typeConsistencyVerdict,
        int detectedJsonColumns,
        int detectedDatetimeColumns,
        int detectedIdColumns,
        boolean hasJunctionTables,
        boolean hasLookupTables,
        boolean hasLogTables,
        boolean hasSoftDeletes,
        boolean hasTimestamps,
        boolean hasAuditFields,
        String schemaPattern,
        String verdict,
        String action,
        String flags,
        String sampleTable,
        List<TableDigest> tables,
        List<Relationship> relationships) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public DatabaseDigest {
        tables = List.copyOf(tables);
        relationships = List.copyOf(relationships);
    }

    static DatabaseDigest empty(long fileSize, long pageCount) {
        return new DatabaseDigest(fileSize, pageCount, 0, 0, 0, 0, 0, 0,
                "none", "none", 0, 0, "none",
                0, "n/a", 1.0, "n/a", 0, 0, 0,
                false, false, false, false, false, false,
                "empty", "minimal", "skip", "empty", "none", List.of(), List.of());
    }

    static DatabaseDigest error(String message) {
        String detail = message == null ? "unknown" : message;
        if (detail.length() > 50)
            detail = detail.substring(0, 50);
        return new DatabaseDigest(0, 0, 0, 0, 0, 0, 0, 0,
                "error", "error", 0, 0, "error",
                0, "error", 0, "error", 0, 0, 0,
                false, false, false, false, false, false,
                "error", "error", "investigate", "error: " + detail, "error", List.of(), List.of());
    }

    // =====================================================================
    // Rendering
    // =====================================================================

    /** One line: {@code tables=3 rows=120 verdict=clean action=query_directly schema=relational}. */
    public String summaryLine() {
        StringBuilder line = new StringBuilder()
                .append("tables=").append(tableCount)
                .append(" rows=").append(totalRows)
                .append(" verdict=").append(verdict)
                .append(" action=").append(action)
                .append(" schema=").append(schemaPattern);
        if (!flags.isEmpty())
            line.append(" flags=").append(flags);
        return line.toString();
    }

    /** The {@code <sqlite_digest>} block placed into the agent prompt. */
    public String toPrompt() {
        return "<sqlite_digest>\n"
                + "file: " + humanBytes(fileSize) + " | " + pageCount + " pages\n"
                + "schema: " + tableCount + " tables, " + viewCount + " views, "
                + indexCount + " indexes, " + triggerCount + " triggers\n"
                + "data: " + String.format(Locale.ROOT, "%,d", totalRows) + " total rows across "
                + totalColumns + " columns\n"
                + "\n"
                + "tables: " + tablesSummary + "\n"
                + "largest: " + largestTables + "\n"
                + "\n"
                + "relationships: " + explicitFkCount + " explicit FK, " + implicitFkCount + " implicit\n"
                + "  " + relationshipsSummary + "\n"
                + "\n"
                + "quality: nulls=" + overallNullVerdict + " (" + percent(overallNullPct) + ") | "
                + "types=" + typeConsistencyVerdict + " (" + percent(typeConsistency) + ")\n"
                + "content: " + detectedJsonColumns + " json cols, " + detectedDatetimeColumns
                + " datetime cols, " + detectedIdColumns + " id cols\n"
                + "\n"
                + "patterns: " + patternFlags() + "\n"
                + "schema_style: " + schemaPattern + "\n"
                + "\n"
                + "VERDICT: " + verdict + " -> " + action + "\n"
                + (flags.isEmpty() ? "" : "flags: " + flags) + "\n"
                + "\n"
                + "sample_table: " + sampleTable + "\n"
                + "</sqlite_digest>";
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize digest", e);
        }
    }

    private String patternFlags() {
        List<String> patterns = new ArrayList<>();
        if (hasJunctionTables)
            patterns.add("junction_tables");
        if (hasLookupTables)
            patterns.add("lookup_tables");
        if (hasLogTables)
            patterns.add("log_tables");
        if (hasSoftDeletes)
            patterns.add("soft_deletes");
        if (hasTimestamps)
            patterns.add("timestamps");
        if (hasAuditFields)
            patterns.add("audit_fields");
        return patterns.isEmpty() ? "none detected" : String.join(", ", patterns);
    }

    static String humanBytes(long bytes) {
        if (bytes < 1024)
            return bytes + "B";
        if (bytes < 1024L * 1024)
            return String.format(Locale.ROOT, "%.1fKB", bytes / 1024.0);
        if (bytes < 1024L * 1024 * 1024)
            return String.format(Locale.ROOT, "%.1fMB", bytes / (1024.0 * 1024));
        return String.format(Locale.ROOT, "%.1fGB", bytes / (1024.0 * 1024 * 1024));
    }

    static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.0f%%", fraction * 100);
    }
}
