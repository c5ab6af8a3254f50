package de.bsommerfeld.scratchdb.db.digest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.scratchdb.core.config.PromptConfig;
import de.bsommerfeld.scratchdb.core.config.SessionConfig;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaDigestorTest {

    @TempDir
    Path tempDir;

    private SchemaDigestor digestor;
    private Path dbPath;

    @BeforeEach
    void setUp() {
        digestor = new SchemaDigestor(new PromptConfig(), new SessionConfig());
        dbPath = tempDir.resolve("scratch.db");
    }

    private void run(String... statements) throws SQLException {
        try (GuardedSession session = GuardedSession.open(dbPath, new SessionConfig())) {
            for (String sql : statements)
                session.execute(sql);
        }
    }

    // =====================================================================
    // Degenerate databases
    // =====================================================================

    @Test
    void digest_shouldReturnMinimalDigestForEmptyDatabase() throws SQLException {
        run("CREATE TABLE t(a)", "DROP TABLE t");

        DatabaseDigest digest = digestor.digest(dbPath);

        assertEquals(0, digest.tableCount());
        assertEquals("minimal", digest.verdict());
        assertEquals("skip", digest.action());
        assertEquals("empty", digest.flags());
    }

    @Test
    void digest_shouldReturnErrorDigestForMissingFile() {
        DatabaseDigest digest = digestor.digest(tempDir.resolve("missing.db"));

        assertEquals("error", digest.verdict());
        assertEquals("investigate", digest.action());
        assertTrue(digest.flags().startsWith("error: File not found"));
        assertTrue(digest.flags().length() <= "error: ".length() + 50);
    }

    @Test
    void digest_shouldReturnErrorDigestForCorruptFile() throws Exception {
        Files.writeString(dbPath, "not a database file ".repeat(64));

        DatabaseDigest digest = digestor.digest(dbPath);

        assertEquals("error", digest.verdict());
        assertEquals(0, digest.tableCount());
    }

    // =====================================================================
    // Relationships and roles
    // =====================================================================

    @Test
    void digest_shouldFindExplicitForeignKeyAndLookupTable() throws SQLException {
        run("CREATE TABLE customers(id INTEGER PRIMARY KEY, email TEXT)",
                "CREATE TABLE orders(id INTEGER PRIMARY KEY, customer_id INTEGER REFERENCES customers(id), "
                        + "total REAL)",
                "CREATE TABLE status(id INTEGER PRIMARY KEY, name TEXT)",
                "INSERT INTO customers(email) VALUES ('a@example.com'), ('b@example.com')",
                "INSERT INTO orders(customer_id, total) VALUES (1, 9.5), (2, 12.0), (1, 3.25)",
                "INSERT INTO status(name) VALUES ('open'), ('closed')");

        DatabaseDigest digest = digestor.digest(dbPath);

        assertEquals(3, digest.tableCount());
        assertTrue(digest.explicitFkCount() >= 1);
        assertTrue(digest.hasLookupTables());
        assertEquals(7, digest.totalRows());
        assertEquals("orders.customer_id -> customers.id", digest.relationshipsSummary());

        TableDigest orders = digest.tables().stream().filter(t -> t.name().equals("orders")).findFirst()
                .orElseThrow();
        assertEquals("id", orders.primaryKey());
        assertEquals(List.of("customer_id -> customers.id"), orders.foreignKeys());
        ColumnDigest total = orders.columns().get(2);
        assertEquals("FLOAT", total.actualType());
        assertEquals(Double.valueOf(3.25), total.minValue());
        assertEquals(Double.valueOf(12.0), total.maxValue());
    }

    @Test
    void digest_shouldInferImplicitForeignKeyFromExactTableName() throws SQLException {
        run("CREATE TABLE user(id INTEGER PRIMARY KEY, name TEXT)",
                "CREATE TABLE post(id INTEGER PRIMARY KEY, user_id INTEGER, users_id INTEGER)",
                "INSERT INTO user(name) VALUES ('ann')",
                "INSERT INTO post(user_id, users_id) VALUES (1, 1)");

        DatabaseDigest digest = digestor.digest(dbPath);

        assertEquals(0, digest.explicitFkCount());
        assertEquals(1, digest.implicitFkCount());
        assertEquals("post.user_id -> user.id (80%)", digest.relationshipsSummary());
    }

    @Test
    void digest_shouldDetectLogTablesAndTimestamps() throws SQLException {
        run("CREATE TABLE trail(id INTEGER PRIMARY KEY, created_at TEXT, action TEXT)",
                "INSERT INTO trail(created_at, action) VALUES ('2024-01-01 10:00:00', 'login'), "
                        + "('2024-01-02 11:30:00', 'logout')");

        DatabaseDigest digest = digestor.digest(dbPath);

        assertTrue(digest.hasLogTables());
        assertTrue(digest.hasTimestamps());
        assertEquals(1, digest.detectedDatetimeColumns());
        assertEquals("flat", digest.schemaPattern());
    }

    // =====================================================================
    // Column profiling
    // =====================================================================

    @Test
    void digest_shouldProfileContentPatternsAndNulls() throws SQLException {
        run("CREATE TABLE docs(id TEXT, payload TEXT, note TEXT)",
                "INSERT INTO docs VALUES ('0f8fad5b-d9cb-469f-a165-70867728950e', '{\"a\": 1}', NULL)",
                "INSERT INTO docs VALUES ('7c9e6679-7425-40de-944e-07fc1f90ae7e', '{\"b\": 2}', NULL)",
                "INSERT INTO docs VALUES ('a3bb189e-8bf9-3888-9912-ace4e6543002', '[1, 2]', 'x')");

        DatabaseDigest digest = digestor.digest(dbPath);
        List<ColumnDigest> columns = digest.tables().get(0).columns();

        assertEquals("UUID", columns.get(0).actualType());
        assertEquals("uuid", columns.get(0).contentPattern());
        assertEquals("unique", columns.get(0).cardinalityClass());
        assertEquals("JSON", columns.get(1).actualType());
        assertEquals("json", columns.get(1).contentPattern());
        assertEquals(0.667, columns.get(2).nullPct());
        assertEquals(1, digest.detectedJsonColumns());
        assertEquals(1, digest.detectedIdColumns());
        assertTrue(digest.flags().contains("has_json(1)"));
    }

    @Test
    void digest_shouldMarkMixedTypes() throws SQLException {
        run("CREATE TABLE t(v)", "INSERT INTO t VALUES (1), ('two'), (3.0), (x'00')");

        ColumnDigest column = digestor.digest(dbPath).tables().get(0).columns().get(0);

        assertEquals("MIXED", column.actualType());
        assertEquals("NONE", column.declaredType());
    }

    @Test
    void digest_shouldHonourTableLimit() throws SQLException {
        PromptConfig prompt = new PromptConfig();
        prompt.setDigestMaxTables(1);
        run("CREATE TABLE a(x)", "CREATE TABLE b(x)");

        DatabaseDigest digest = new SchemaDigestor(prompt, new SessionConfig()).digest(dbPath);

        assertEquals(2, digest.tableCount());
        assertEquals(1, digest.tables().size());
    }

    // =====================================================================
    // Rendering
    // =====================================================================

    @Test
    void toPrompt_shouldRenderVerdictBlock() throws SQLException {
        run("CREATE TABLE t(a INTEGER)", "INSERT INTO t VALUES (1)");

        DatabaseDigest digest = digestor.digest(dbPath);
        String prompt = digest.toPrompt();

        assertTrue(prompt.startsWith("<sqlite_digest>\n"));
        assertTrue(prompt.endsWith("</sqlite_digest>"));
        assertTrue(prompt.contains("VERDICT: " + digest.verdict() + " -> " + digest.action()));
        assertTrue(digest.summaryLine().startsWith("tables=1 rows=1 verdict="));
    }

    @Test
    void toJson_shouldUseSnakeCaseKeys() throws Exception {
        run("CREATE TABLE t(a INTEGER PRIMARY KEY)", "INSERT INTO t VALUES (1)");

        JsonNode json = new ObjectMapper().readTree(digestor.digest(dbPath).toJson());

        assertEquals(1, json.get("table_count").asInt());
        assertTrue(json.get("tables").get(0).get("columns").get(0).get("primary_key").asBoolean());
    }
}
