package de.bsommerfeld.scratchdb.db.digest;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.config.PromptConfig;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.config.SessionConfig;
import de.bsommerfeld.scratchdb.db.SqlLoader;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import de.bsommerfeld.scratchdb.db.schema.BuiltinTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only statistical profiler for a scratch database.
 *
 * <p>
 * Looks at the first {@code digest-max-tables} user tables (by name) and
 * their first {@code digest-max-columns} columns. Each column is profiled
 * from a random sample of {@code digest-sample-size} rows. From the column
 * profiles it derives table roles, explicit and implicit relationships, a
 * schema shape and a verdict with a recommended action.
 *
 * <h3>Failure</h3>
 * Never throws. A missing or unreadable file, or any table that fails to
 * profile, yields {@link DatabaseDigest#error}.
 */
@Singleton
public class SchemaDigestor {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaDigestor.class);

    static final int MAX_IMPLICIT_RELATIONSHIPS = 20;
    static final long LARGE_TABLE_ROWS = 1_000_000;
    static final int SUMMARY_TABLES = 8;

    private static final List<String> SOFT_DELETE_COLUMNS = List.of("deleted_at", "is_deleted", "deleted",
            "removed_at");
    private static final List<String> TIMESTAMP_COLUMNS = List.of("created_at", "updated_at", "modified_at",
            "timestamp");
    private static final List<String> AUDIT_COLUMNS = List.of("created_by", "updated_by", "modified_by",
            "author_id");
    private static final List<String> LOG_NAME_PARTS = List.of("log", "audit", "history", "event", "activity");
    private static final List<String> LOG_TIME_COLUMNS = List.of("timestamp", "created_at", "logged_at",
            "event_time");
    private static final List<String> LOG_ACTION_COLUMNS = List.of("action", "event", "type", "operation");
    private static final List<String> LABEL_PARTS = List.of("name", "label", "value", "code", "title");

    private final PromptConfig prompt;
    private final SessionConfig session;

    @Inject
    public SchemaDigestor(ScratchDbConfig config) {
        this(config.getPrompt(), config.getSession());
    }

    SchemaDigestor(PromptConfig prompt, SessionConfig session) {
        this.prompt = prompt;
        this.session = session;
    }

    @FunctionalInterface
    private interface RowReader<T> {
        T read(ResultSet rs) throws SQLException;
    }

    private record ColumnInfo(String name, String declaredType, boolean primaryKey) {
    }

    // =====================================================================
    // Entry points
    // =====================================================================

    /** Opens the file read-only and profiles it. */
    public DatabaseDigest digest(Path dbPath) {
        if (dbPath == null || !Files.exists(dbPath))
            return DatabaseDigest.error("File not found: " + dbPath);

        try (GuardedSession db = GuardedSession.openReadOnly(dbPath, session)) {
            return analyze(db, Files.size(dbPath));
        } catch (SQLException | IOException | RuntimeException e) {
            LOG.warn("Failed to digest scratch database {}", dbPath, e);
            return DatabaseDigest.error(e.getMessage());
        }
    }

    /** Profiles through an already open session. */
    public DatabaseDigest digest(GuardedSession db) {
        try {
            return analyze(db, db.sizeBytes());
        } catch (SQLException | RuntimeException e) {
            LOG.warn("Failed to digest scratch database {}", db.path(), e);
            return DatabaseDigest.error(e.getMessage());
        }
    }

    // =====================================================================
    // Analysis
    // =====================================================================

    private DatabaseDigest analyze(GuardedSession db, long fileSize) throws SQLException {
        long pageCount = pageCount(db);

        List<String> tables = new ArrayList<>();
        int views = 0;
        int indexes = 0;
        int triggers = 0;
        for (String[] object : query(db, SqlLoader.load("select-schema-objects"),
                rs -> new String[] { rs.getString(1), rs.getString(2) })) {
            switch (object[0]) {
                case "table" -> tables.add(object[1]);
                case "view" -> views++;
                case "index" -> indexes++;
                case "trigger" -> triggers++;
                default -> {
                }
            }
        }
        if (tables.isEmpty())
            return DatabaseDigest.empty(fileSize, pageCount);

        List<TableDigest> digests = new ArrayList<>();
        List<ColumnDigest> columns = new ArrayList<>();
        for (String table : tables.subList(0, Math.min(prompt.getDigestMaxTables(), tables.size()))) {
            TableDigest digest = analyzeTable(db, table);
            digests.add(digest);
            columns.addAll(digest.columns());
        }

        List<Relationship> explicit = explicitForeignKeys(db, tables);
        List<Relationship> implicit = implicitForeignKeys(digests);
        List<Relationship> relationships = new ArrayList<>(explicit);
        relationships.addAll(implicit);

        long totalRows = digests.stream().mapToLong(TableDigest::rowCount).sum();
        int totalColumns = digests.stream().mapToInt(TableDigest::columnCount).sum();

        double overallNull = columns.stream().mapToDouble(ColumnDigest::nullPct).average().orElse(0);
        long consistent = columns.stream().filter(c -> !c.actualType().equals("MIXED")).count();
        double typeConsistency = (double) consistent / Math.max(1, columns.size());

        int jsonColumns = countPatterns(columns, "json");
        int datetimeColumns = countPatterns(columns, "datetime", "date", "timestamp");
        int idColumns = countPatterns(columns, "uuid", "hash", "id");

        Set<String> columnNames = columns.stream().map(c -> c.name().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        String schemaPattern = classifySchemaPattern(digests, relationships);
        String[] verdict = verdict(typeConsistency, overallNull, relationships.size(), schemaPattern, digests);

        LOG.debug("Digested {} tables ({} profiled) in {}", tables.size(), digests.size(), db.path());
        return new DatabaseDigest(
                fileSize, pageCount, tables.size(), views, indexes, triggers, totalRows, totalColumns,
                tablesSummary(digests, tables.size()), largestTables(digests),
                explicit.size(), implicit.size(), relationshipsSummary(relationships),
                ColumnProfiler.round(overallNull, 3), nullVerdict(overallNull),
                ColumnProfiler.round(typeConsistency, 3), typeVerdict(typeConsistency),
                jsonColumns, datetimeColumns, idColumns,
                digests.stream().anyMatch(TableDigest::junction),
                digests.stream().anyMatch(TableDigest::lookup),
                digests.stream().anyMatch(TableDigest::log),
                SOFT_DELETE_COLUMNS.stream().anyMatch(columnNames::contains),
                TIMESTAMP_COLUMNS.stream().anyMatch(columnNames::contains),
                AUDIT_COLUMNS.stream().anyMatch(columnNames::contains),
                schemaPattern, verdict[0], verdict[1],
                compileFlags(digests, columns, relationships), sampleTable(digests),
                digests, relationships);
    }

    private TableDigest analyzeTable(GuardedSession db, String table) throws SQLException {
        String quoted = BuiltinTables.quote(table);
        long rowCount = rowCount(db, quoted);

        List<ColumnInfo> columnInfo = query(db, "PRAGMA table_info(" + quoted + ")",
                rs -> new ColumnInfo(rs.getString("name"), rs.getString("type"), rs.getInt("pk") > 0));

        List<String> indexNames = query(db, "PRAGMA index_list(" + quoted + ")", rs -> rs.getString("name"));
        Set<String> indexedColumns = new HashSet<>();
        for (String index : indexNames) {
            try {
                for (String column : query(db, "PRAGMA index_info(" + BuiltinTables.quote(index) + ")",
                        rs -> rs.getString("name"))) {
                    if (column != null)
                        indexedColumns.add(column);
                }
            } catch (SQLException e) {
                LOG.debug("Skipping index {} of table {}", index, table, e);
            }
        }

        Map<String, String> foreignKeys = new LinkedHashMap<>();
        for (String[] fk : query(db, "PRAGMA foreign_key_list(" + quoted + ")",
                rs -> new String[] { rs.getString("from"), rs.getString("table"), rs.getString("to") })) {
            foreignKeys.put(fk[0], fk[2] == null ? fk[1] : fk[1] + "." + fk[2]);
        }

        List<String> pkColumns = columnInfo.stream().filter(ColumnInfo::primaryKey).map(ColumnInfo::name)
                .collect(Collectors.toList());
        String primaryKey = pkColumns.isEmpty() ? null
                : pkColumns.size() == 1 ? pkColumns.get(0) : "(" + String.join(", ", pkColumns) + ")";

        List<ColumnInfo> profiled = columnInfo.subList(0, Math.min(prompt.getDigestMaxColumns(), columnInfo.size()));
        Map<String, List<SqlValue>> sample = sample(db, quoted, profiled);

        List<ColumnDigest> columns = new ArrayList<>();
        for (ColumnInfo info : profiled) {
            String declared = info.declaredType() == null || info.declaredType().isEmpty() ? "NONE"
                    : info.declaredType();
            columns.add(ColumnProfiler.profile(info.name(), declared, sample.getOrDefault(info.name(), List.of()),
                    info.primaryKey(), foreignKeys.containsKey(info.name()), indexedColumns.contains(info.name())));
        }

        double nullDensity = columns.stream().mapToDouble(ColumnDigest::nullPct).average().orElse(0);
        List<String> foreignKeyText = foreignKeys.entrySet().stream()
                .map(e -> e.getKey() + " -> " + e.getValue()).collect(Collectors.toList());

        return new TableDigest(table, rowCount, columnInfo.size(), rowCount * columnInfo.size() * 50L, columns,
                primaryKey, foreignKeyText, indexNames, nullDensity,
                isJunction(columns), isLookup(rowCount, columns), isLog(table, columns));
    }

    private Map<String, List<SqlValue>> sample(GuardedSession db, String quotedTable, List<ColumnInfo> columns) {
        Map<String, List<SqlValue>> sample = new LinkedHashMap<>();
        if (columns.isEmpty())
            return sample;
        for (ColumnInfo column : columns)
            sample.put(column.name(), new ArrayList<>());

        String select = columns.stream().map(c -> BuiltinTables.quote(c.name())).collect(Collectors.joining(", "));
        String sql = "SELECT " + select + " FROM " + quotedTable + " ORDER BY RANDOM() LIMIT "
                + prompt.getDigestSampleSize();
        try {
            db.execute(sql, stmt -> {
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        for (int i = 0; i < columns.size(); i++)
                            sample.get(columns.get(i).name()).add(SqlValue.of(rs.getObject(i + 1)));
                    }
                }
                return null;
            });
        } catch (SQLException e) {
            LOG.debug("Sampling {} failed", quotedTable, e);
            return Map.of();
        }
        return sample;
    }

    private List<Relationship> explicitForeignKeys(GuardedSession db, List<String> tables) {
        List<Relationship> relationships = new ArrayList<>();
        for (String table : tables) {
            try {
                relationships.addAll(query(db, "PRAGMA foreign_key_list(" + BuiltinTables.quote(table) + ")",
                        rs -> Relationship.explicit(table, rs.getString("from"), rs.getString("table"),
                                rs.getString("to"))));
            } catch (SQLException e) {
                LOG.debug("Reading foreign keys of {} failed", table, e);
            }
        }
        return relationships;
    }

    /**
     * {@code <table>_id} columns that are neither key nor declared foreign key,
     * where {@code <table>} names a profiled table with a primary key. Only
     * exact (case-insensitive) name matches count.
     */
    static List<Relationship> implicitForeignKeys(List<TableDigest> tables) {
        Map<String, ColumnDigest> primaryKeys = new LinkedHashMap<>();
        for (TableDigest table : tables) {
            for (ColumnDigest column : table.columns()) {
                if (column.primaryKey())
                    primaryKeys.put(table.name(), column);
            }
        }

        List<Relationship> relationships = new ArrayList<>();
        for (TableDigest table : tables) {
            for (ColumnDigest column : table.columns()) {
                if (column.foreignKey() || column.primaryKey())
                    continue;
                String lower = column.name().toLowerCase(Locale.ROOT);
                if (!lower.endsWith("_id"))
                    continue;
                String noun = lower.substring(0, lower.length() - 3);
                for (TableDigest other : tables) {
                    if (!other.name().toLowerCase(Locale.ROOT).equals(noun))
                        continue;
                    ColumnDigest target = primaryKeys.get(other.name());
                    if (target != null)
                        relationships.add(Relationship.implicit(table.name(), column.name(), other.name(),
                                target.name()));
                    break;
                }
            }
        }
        return relationships.size() > MAX_IMPLICIT_RELATIONSHIPS
                ? new ArrayList<>(relationships.subList(0, MAX_IMPLICIT_RELATIONSHIPS))
                : relationships;
    }

    // =====================================================================
    // Table roles
    // =====================================================================

    static boolean isJunction(List<ColumnDigest> columns) {
        if (columns.size() < 2 || columns.size() > 5)
            return false;
        return columns.stream().filter(ColumnDigest::foreignKey).count() >= 2;
    }

    static boolean isLookup(long rowCount, List<ColumnDigest> columns) {
        if (rowCount > 100 || rowCount < 1)
            return false;
        if (columns.size() < 2 || columns.size() > 5)
            return false;
        boolean hasId = columns.stream()
                .anyMatch(c -> c.primaryKey() || c.name().toLowerCase(Locale.ROOT).contains("id"));
        boolean hasLabel = columns.stream()
                .anyMatch(c -> LABEL_PARTS.stream().anyMatch(c.name().toLowerCase(Locale.ROOT)::contains));
        return hasId && hasLabel;
    }

    static boolean isLog(String table, List<ColumnDigest> columns) {
        String lower = table.toLowerCase(Locale.ROOT);
        if (LOG_NAME_PARTS.stream().anyMatch(lower::contains))
            return true;
        Set<String> names = columns.stream().map(c -> c.name().toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
        return LOG_TIME_COLUMNS.stream().anyMatch(names::contains)
                && LOG_ACTION_COLUMNS.stream().anyMatch(names::contains);
    }

    // =====================================================================
    // Classification
    // =====================================================================

    static String nullVerdict(double nullPct) {
        if (nullPct < 0.05)
            return "dense";
        if (nullPct < 0.20)
            return "normal";
        if (nullPct < 0.50)
            return "sparse";
        return "very_sparse";
    }

    static String typeVerdict(double consistency) {
        if (consistency >= 0.95)
            return "excellent";
        if (consistency >= 0.80)
            return "good";
        if (consistency >= 0.60)
            return "fair";
        return "poor";
    }

    static String classifySchemaPattern(List<TableDigest> tables, List<Relationship> relationships) {
        if (tables.isEmpty())
            return "empty";
        if (tables.size() == 1 || relationships.isEmpty())
            return "flat";

        double density = (double) relationships.size() / tables.size();
        boolean hasJunction = tables.stream().anyMatch(TableDigest::junction);
        if (hasJunction && density > 1)
            return "normalized";

        if (density > 2) {
            Map<String, Long> targets = relationships.stream()
                    .collect(Collectors.groupingBy(Relationship::toTable, Collectors.counting()));
            long top = targets.values().stream().mapToLong(Long::longValue).max().orElse(0);
            if (top >= tables.size() * 0.5)
                return "star";
        }
        if (density > 1)
            return "normalized";
        if (density > 0.3)
            return "relational";
        return "loosely_coupled";
    }

    /** @return {@code [verdict, action]} */
    static String[] verdict(double typeConsistency, double nullPct, int relationshipCount, String schemaPattern,
            List<TableDigest> tables) {
        double score = typeConsistency * 0.3 + (1 - nullPct) * 0.2;
        if (relationshipCount > 0)
            score += 0.2;
        if (List.of("normalized", "star", "relational").contains(schemaPattern))
            score += 0.2;
        else if (schemaPattern.equals("flat"))
            score += 0.1;
        if (tables.stream().anyMatch(TableDigest::lookup))
            score += 0.05;
        if (tables.stream().anyMatch(TableDigest::log))
            score += 0.05;

        if (score >= 0.75)
            return new String[] { "clean", "query_directly" };
        if (score >= 0.55)
            return new String[] { "usable", "inspect_schema" };
        if (score >= 0.35)
            return new String[] { "messy", "needs_cleaning" };
        return new String[] { "chaotic", "investigate" };
    }

    static String compileFlags(List<TableDigest> tables, List<ColumnDigest> columns,
            List<Relationship> relationships) {
        List<String> flags = new ArrayList<>();
        long large = tables.stream().filter(t -> t.rowCount() > LARGE_TABLE_ROWS).count();
        if (large > 0)
            flags.add("large_tables(" + large + ")");
        long mixed = columns.stream().filter(c -> c.actualType().equals("MIXED")).count();
        if (mixed > 3)
            flags.add("mixed_types(" + mixed + ")");
        long json = columns.stream().filter(c -> c.actualType().equals("JSON")).count();
        if (json > 0)
            flags.add("has_json(" + json + ")");
        long highNull = columns.stream().filter(c -> c.nullPct() > 0.5).count();
        if (highNull > 3)
            flags.add("high_nulls(" + highNull + ")");
        if (relationships.isEmpty() && tables.size() > 1)
            flags.add("no_relationships");
        return String.join(",", flags);
    }

    // =====================================================================
    // Summaries
    // =====================================================================

    static String tablesSummary(List<TableDigest> tables, int totalTables) {
        List<String> parts = new ArrayList<>();
        for (TableDigest table : tables.subList(0, Math.min(SUMMARY_TABLES, tables.size())))
            parts.add(table.name() + "(" + table.columnCount() + ")");
        if (totalTables > SUMMARY_TABLES)
            parts.add("+" + (totalTables - SUMMARY_TABLES) + " more");
        return String.join(", ", parts);
    }

    static String largestTables(List<TableDigest> tables) {
        List<String> parts = tables.stream()
                .sorted(Comparator.comparingLong(TableDigest::rowCount).reversed())
                .limit(3)
                .map(t -> t.name() + ": " + String.format(Locale.ROOT, "%,d", t.rowCount()))
                .collect(Collectors.toList());
        return parts.isEmpty() ? "none" : String.join(", ", parts);
    }

    static String relationshipsSummary(List<Relationship> relationships) {
        if (relationships.isEmpty())
            return "none detected";
        List<String> parts = relationships.stream().limit(5).map(Relationship::toCompact)
                .collect(Collectors.toList());
        if (relationships.size() > 5)
            parts.add("+" + (relationships.size() - 5) + " more");
        return String.join("; ", parts);
    }

    /**
     * The most representative table: mid-sized (100 to 10000 rows) first,
     * then most foreign keys, then widest. Earlier tables win ties.
     */
    static String sampleTable(List<TableDigest> tables) {
        if (tables.isEmpty())
            return "no tables";
        Comparator<TableDigest> order = Comparator
                .comparingInt((TableDigest t) -> t.rowCount() > 100 && t.rowCount() < 10_000 ? 1 : 0)
                .thenComparingInt(t -> t.foreignKeys().size())
                .thenComparingInt(TableDigest::columnCount);
        TableDigest best = tables.get(0);
        for (TableDigest table : tables) {
            if (order.compare(table, best) > 0)
                best = table;
        }
        return best.toCompact();
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static int countPatterns(List<ColumnDigest> columns, String... patterns) {
        List<String> wanted = List.of(patterns);
        return (int) columns.stream().filter(c -> c.contentPattern() != null && wanted.contains(c.contentPattern()))
                .count();
    }

    private static long pageCount(GuardedSession db) {
        try {
            return db.execute("PRAGMA page_count", stmt -> {
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            });
        } catch (SQLException e) {
            LOG.debug("Reading page count failed", e);
            return 0L;
        }
    }

    private static long rowCount(GuardedSession db, String quotedTable) {
        try {
            return db.execute("SELECT COUNT(*) FROM " + quotedTable, stmt -> {
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            });
        } catch (SQLException e) {
            LOG.debug("Counting rows of {} failed", quotedTable, e);
            return 0L;
        }
    }

    private static <T> List<T> query(GuardedSession db, String sql, RowReader<T> reader) throws SQLException {
        return db.execute(sql, stmt -> {
            List<T> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next())
                    rows.add(reader.read(rs));
            }
            return rows;
        });
    }
}
