package de.bsommerfeld.scratchdb.agent.tools;

import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.event.ApplicationEventBus;
import de.bsommerfeld.scratchdb.core.event.ControlEvents;
import de.bsommerfeld.scratchdb.db.digest.DatabaseDigest;
import de.bsommerfeld.scratchdb.db.digest.SchemaDigestor;
import de.bsommerfeld.scratchdb.db.exec.BatchExecutor;
import de.bsommerfeld.scratchdb.db.exec.BatchResult;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import de.bsommerfeld.scratchdb.db.schema.SchemaSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AgentSqlToolsTest {

    private static final AgentIdentity AGENT = new AgentIdentity("agent-a", "scope-1");

    @TempDir
    Path tempDir;

    @Mock
    ApplicationEventBus eventBus;

    private ScratchDbConfig config;
    private GuardedSession session;

    @BeforeEach
    void setUp() throws SQLException {
        config = new ScratchDbConfig();
        session = GuardedSession.open(tempDir.resolve("scratch.db"), config.getSession());
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private AgentSqlTools tools() {
        return new AgentSqlTools(AGENT, session, new BatchExecutor(config), new SchemaSummary(config),
                new SchemaDigestor(config), new ToolResultCache(config), eventBus);
    }

    @Test
    void batch_shouldRunStatementsWithoutWarning_belowSoftLimit() {
        BatchResult result = tools().batch(List.of(
                "CREATE TABLE notes (id INTEGER PRIMARY KEY, body TEXT)",
                "INSERT INTO notes (body) VALUES ('first')"), true);

        assertTrue(result.ok());
        assertNull(result.sizeWarning());
        verify(eventBus, never()).post(any());
    }

    @Test
    void batch_shouldPostSizeWarning_aboveSoftLimit() {
        config.getBatch().setSoftSizeLimitBytes(1);

        BatchResult result = tools().batch(List.of("CREATE TABLE notes (id INTEGER PRIMARY KEY)"), false);

        assertNotNull(result.sizeWarning());
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventBus).post(captor.capture());
        ControlEvents.ScratchDatabaseSizeWarningEvent event =
                (ControlEvents.ScratchDatabaseSizeWarningEvent) captor.getValue();
        assertEquals("agent-a", event.agentId());
        assertEquals(result.sizeBytes(), event.sizeBytes());
    }

    @Test
    void query_shouldReturnRows() {
        AgentSqlTools tools = tools();
        tools.batch(List.of("CREATE TABLE notes (body TEXT)", "INSERT INTO notes VALUES ('hello')"), true);

        BatchResult result = tools.query("SELECT body FROM notes");

        assertTrue(result.ok());
        assertEquals(1, result.results().size());
    }

    @Test
    void schemaAndDigest_shouldDescribeUserTables() {
        AgentSqlTools tools = tools();
        tools.batch(List.of("CREATE TABLE notes (id INTEGER PRIMARY KEY, body TEXT)",
                "INSERT INTO notes (body) VALUES ('a'), ('b')"), true);

        assertTrue(tools.schema().contains("Table notes (rows: 2)"));
        DatabaseDigest digest = tools.digest();
        assertNotNull(digest.summaryLine());
        assertTrue(digest.toPrompt().contains("notes"));
    }

    @Test
    void cacheToolResults_shouldMakeResultsQueryable() throws SQLException {
        AgentSqlTools tools = tools();

        int written = tools.cacheToolResults(List.of(
                new ToolResult("step-1", "web_search", Instant.parse("2026-03-01T10:00:00Z"), "found it")));
        BatchResult result = tools.query("SELECT result_text FROM __tool_results WHERE result_id = 'step-1'");

        assertEquals(1, written);
        assertTrue(result.ok());
    }
}
