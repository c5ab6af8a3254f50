package de.bsommerfeld.scratchdb.db.schema;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.config.PromptConfig;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.config.SessionConfig;
import de.bsommerfeld.scratchdb.db.SqlLoader;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the schema text shown to the agent: one line per user table with
 * its row count and single-line {@code CREATE} statement.
 *
 * <p>
 * Output is bounded three ways: at most {@code schema-max-tables} tables
 * (then an omission line), each {@code CREATE} cut to
 * {@code schema-max-create-chars}, and the whole text capped at
 * {@code schema-max-bytes} UTF-8 bytes with a truncation notice. This method
 * never throws; an unreadable database yields a one-line failure text.
 */
@Singleton
public class SchemaSummary {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaSummary.class);

    static final String NOT_INITIALISED = "SQLite database not initialised - no schema present yet.";
    static final String NO_TABLES = "SQLite database has no user tables yet.";
    static final String TRUNCATED_NOTICE = "... (truncated - schema exceeds 30KB limit)";

    private final PromptConfig prompt;
    private final SessionConfig session;

    @Inject
    public SchemaSummary(ScratchDbConfig config) {
        this(config.getPrompt(), config.getSession());
    }

    SchemaSummary(PromptConfig prompt, SessionConfig session) {
        this.prompt = prompt;
        this.session = session;
    }

    public String render(Path dbPath) {
        if (dbPath == null || !Files.exists(dbPath))
            return NOT_INITIALISED;

        try (GuardedSession db = GuardedSession.openReadOnly(dbPath, session)) {
            List<String[]> tables = listTables(db);
            if (tables.isEmpty())
                return NO_TABLES;
            return renderTables(db, tables);
        } catch (SQLException | RuntimeException e) {
            LOG.warn("Failed to inspect scratch database {}", dbPath, e);
            return "Failed to inspect SQLite DB: " + e.getMessage();
        }
    }

    private String renderTables(GuardedSession db, List<String[]> tables) {
        Lines lines = new Lines(prompt.getSchemaMaxBytes());
        int limit = Math.min(tables.size(), prompt.getSchemaMaxTables());
        for (int i = 0; i < limit; i++) {
            String name = tables.get(i)[0];
            String create = truncate(collapseWhitespace(tables.get(i)[1]), prompt.getSchemaMaxCreateChars());
            String count = rowCount(db, name);
            String line = BuiltinTables.note(name)
                    .map(note -> "Table " + name + " (rows: " + count + ", " + note + "): " + create)
                    .orElseGet(() -> "Table " + name + " (rows: " + count + "): " + create);
            if (!lines.append(line)) {
                lines.append(TRUNCATED_NOTICE);
                return lines.toString();
            }
        }
        if (tables.size() > limit)
            lines.append("... (" + (tables.size() - limit) + " more tables omitted)");
        return lines.toString();
    }

    private static List<String[]> listTables(GuardedSession db) throws SQLException {
        return db.execute(SqlLoader.load("select-user-tables"), stmt -> {
            List<String[]> tables = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next())
                    tables.add(new String[] { rs.getString(1), rs.getString(2) });
            }
            return tables;
        });
    }

    private static String rowCount(GuardedSession db, String table) {
        try {
            return db.execute("SELECT COUNT(*) FROM " + BuiltinTables.quote(table), stmt -> {
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? String.valueOf(rs.getLong(1)) : "?";
                }
            });
        } catch (SQLException e) {
            LOG.debug("Row count failed for table {}", table, e);
            return "?";
        }
    }

    static String collapseWhitespace(String text) {
        if (text == null)
            return "";
        return String.join(" ", text.strip().split("\\s+"));
    }

    /** Cuts to {@code max} characters, ending in {@code ...} when cut. */
    static String truncate(String text, int max) {
        if (max <= 0)
            return "";
        if (text.length() <= max)
            return text;
        if (max <= 3)
            return text.substring(0, max);
        return text.substring(0, max - 3) + "...";
    }

    /** Newline-joined lines under a UTF-8 byte budget. */
    private static final class Lines {

        private final int maxBytes;
        private final List<String> lines = new ArrayList<>();
        private int totalBytes;

        Lines(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        boolean append(String line) {
            int length = line.getBytes(StandardCharsets.UTF_8).length + (lines.isEmpty() ? 0 : 1);
            if (totalBytes + length > maxBytes)
                return false;
            lines.add(line);
            totalBytes += length;
            return true;
        }

        @Override
        public String toString() {
            return String.join("\n", lines);
        }
    }
}
