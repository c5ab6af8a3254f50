package de.bsommerfeld.scratchdb.db.exec;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class SqlAutocorrectTest {

    private static final String SYNTAX = "[SQLITE_ERROR] SQL error or missing database (near \"CREATE\": syntax error)";

    @Test
    void suggest_shouldMoveWithClauseBehindCreateAs() {
        SqlAutocorrect.Rewrite rewrite = SqlAutocorrect.suggest(
                "WITH x AS (SELECT 1 AS a) CREATE TEMP TABLE t AS SELECT a FROM x", SYNTAX).orElseThrow();

        assertEquals("CREATE TEMP TABLE t AS WITH x AS (SELECT 1 AS a) SELECT a FROM x", rewrite.sql());
        assertEquals(SqlAutocorrect.MOVED_WITH_CLAUSE, rewrite.fix());
    }

    @Test
    void suggest_shouldHandleViews() {
        assertTrue(SqlAutocorrect.suggest("WITH x AS (SELECT 1) CREATE VIEW v AS SELECT * FROM x", SYNTAX)
                .isPresent());
    }

    @Test
    void suggest_shouldIgnoreNonSyntaxErrors() {
        assertTrue(SqlAutocorrect.suggest("WITH x AS (SELECT 1) CREATE TABLE t AS SELECT * FROM x",
                "no such table: y").isEmpty());
    }

    @Test
    void suggest_shouldIgnoreOtherShapes() {
        assertTrue(SqlAutocorrect.suggest("SELECT 1", SYNTAX).isEmpty());
        assertTrue(SqlAutocorrect.suggest("WITH x AS (SELECT 1) CREATE INDEX i ON t(a)", SYNTAX).isEmpty());
        assertTrue(SqlAutocorrect.suggest("WITH x AS (SELECT 'CREATE TABLE y AS SELECT') SELECT 1", SYNTAX)
                .isEmpty());
    }

    @Test
    void findTopLevelKeyword_shouldSkipNestedAndEmbeddedWords() {
        String sql = "SELECT (SELECT created FROM a) AS created_at";
        assertEquals(31, SqlAutocorrect.findTopLevelKeyword(sql, "AS", 0));
        assertEquals(-1, SqlAutocorrect.findTopLevelKeyword(sql, "CREATE", 0));
    }

    @Test
    void normalize_shouldCollapseWhitespaceAndTrailingSemicolons() {
        assertEquals("SELECT 1", SqlAutocorrect.normalize("  SELECT\n   1;; "));
    }

    @Test
    void errorHints_shouldClassifyByResultCodeAndMessage() {
        assertEquals(ErrorCode.CONSTRAINT_VIOLATION,
                ErrorHints.classify(new SQLException("UNIQUE constraint failed: t.a", null, 19)));
        assertEquals(ErrorCode.SYNTAX_ERROR, ErrorHints.classify(new SQLException(SYNTAX, null, 1)));
        assertEquals(ErrorCode.BUSY, ErrorHints.classify(new SQLException("database is locked", null, 5)));
        assertEquals(ErrorCode.SQL_ERROR, ErrorHints.classify(new SQLException("no such column: b", null, 1)));
        assertTrue(ErrorHints.hintFor("SELECTs to the left and right of UNION do not have the same number of "
                + "result columns").isPresent());
        assertTrue(ErrorHints.hintFor("out of memory").isEmpty());
    }
}
