package de.bsommerfeld.scratchdb.agent.cycle;

import de.bsommerfeld.scratchdb.agent.sync.AgentSettingsDomain;
import de.bsommerfeld.scratchdb.agent.sync.SkillDomain;
import de.bsommerfeld.scratchdb.agent.sync.SyncResult;
import de.bsommerfeld.scratchdb.agent.sync.TaskBoardDomain;
import de.bsommerfeld.scratchdb.agent.tools.ToolResultCache;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.domain.TaskStatus;
import de.bsommerfeld.scratchdb.core.event.ApplicationEventBus;
import de.bsommerfeld.scratchdb.db.digest.SchemaDigestor;
import de.bsommerfeld.scratchdb.db.exec.BatchExecutor;
import de.bsommerfeld.scratchdb.db.exec.BatchResult;
import de.bsommerfeld.scratchdb.db.schema.SchemaSummary;
import de.bsommerfeld.scratchdb.db.storage.FileSystemBlobStorage;
import de.bsommerfeld.scratchdb.db.storage.ScratchDatabaseLifecycle;
import de.bsommerfeld.scratchdb.db.storage.ScratchDatabaseLifecycle.PersistOutcome;
import de.bsommerfeld.scratchdb.db.store.InMemoryRecordStore;
import de.bsommerfeld.scratchdb.db.store.RecordStore;
import de.bsommerfeld.scratchdb.db.store.RecordStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

class ScratchCycleRunnerTest {

    private static final AgentIdentity AGENT = new AgentIdentity("agent-a", "scope-1");

    @TempDir
    Path tempDir;

    private ScratchDbConfig config;
    private ApplicationEventBus eventBus;
    private ScratchDatabaseLifecycle lifecycle;
    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        config = new ScratchDbConfig();
        eventBus = mock(ApplicationEventBus.class);
        lifecycle = new ScratchDatabaseLifecycle(config, new FileSystemBlobStorage(tempDir.resolve("blobs")),
                eventBus);
        store = new InMemoryRecordStore();
    }

    private ScratchCycleRunner runner(ScratchDatabaseLifecycle lifecycle, RecordStore store) {
        return new ScratchCycleRunner(lifecycle, config, store, eventBus, new BatchExecutor(config),
                new SchemaSummary(config), new SchemaDigestor(config), new ToolResultCache(config),
                new TaskBoardDomain(), new SkillDomain(agent -> Set.of("web_search")), new AgentSettingsDomain());
    }

    @Test
    void run_shouldReconcileEveryMirrorAndPersist() {
        CycleReport report = runner(lifecycle, store).run(AGENT, tools -> {
            BatchResult result = tools.batch(List.of(
                    "CREATE TABLE notes (id INTEGER PRIMARY KEY, body TEXT)",
                    "INSERT INTO notes (body) VALUES ('remember this')",
                    "INSERT INTO __kanban_cards (title) VALUES ('Summarize notes')",
                    "INSERT INTO __agent_skills (name, tools, instructions) VALUES ('digest', '[\"web_search\"]', 'Read all')",
                    "UPDATE __agent_config SET charter = 'Keep notes tidy'"), false);
            assertTrue(result.ok(), result.message());
        });

        assertTrue(report.errors().isEmpty(), report.errors().toString());
        assertEquals(PersistOutcome.PERSISTED, report.persistOutcome());
        assertEquals(List.of(TaskBoardDomain.NAME, SkillDomain.NAME, AgentSettingsDomain.NAME),
                new ArrayList<>(report.syncResults().keySet()));
        assertTrue(report.recordsChanged());

        assertEquals(1, report.syncResult(TaskBoardDomain.NAME).orElseThrow().created().size());
        assertEquals(List.of("digest@1"), report.syncResult(SkillDomain.NAME).orElseThrow().created());
        assertEquals(List.of("charter"), report.syncResult(AgentSettingsDomain.NAME).orElseThrow().updated());

        assertEquals(1, report.changedTaskBoard().orElseThrow().count(TaskStatus.TODO));
        assertTrue(report.digestIfPresent().isPresent());
        assertEquals("Keep notes tidy", store.findSettings("agent-a").charter());
    }

    @Test
    void run_shouldRestorePreviousCycle_andSeedDurableRecords() {
        ScratchCycleRunner runner = runner(lifecycle, store);
        runner.run(AGENT, tools -> tools.batch(List.of(
                "CREATE TABLE notes (body TEXT)",
                "INSERT INTO notes VALUES ('kept')",
                "INSERT INTO __kanban_cards (title) VALUES ('Carry over')"), false));

        List<Object> seen = new ArrayList<>();
        CycleReport second = runner.run(AGENT, tools -> {
            seen.add(tools.query("SELECT body FROM notes").results().get(0).rows().get(0).get("body"));
            seen.add(tools.query("SELECT title FROM __kanban_cards").results().get(0).rows().get(0).get("title"));
        });

        assertEquals(List.of("kept", "Carry over"), seen);
        assertFalse(second.recordsChanged());
        assertTrue(second.changedTaskBoard().isEmpty());
    }

    @Test
    void run_shouldStillReconcile_whenAgentWorkFails() {
        CycleReport report = runner(lifecycle, store).run(AGENT, tools -> {
            tools.batch(List.of("INSERT INTO __kanban_cards (title) VALUES ('Before failure')"), true);
            throw new IllegalStateException("model call failed");
        });

        assertTrue(report.errors().contains("Agent work failed: model call failed"));
        assertEquals(1, report.syncResult(TaskBoardDomain.NAME).orElseThrow().created().size());
        assertEquals(PersistOutcome.PERSISTED, report.persistOutcome());
    }

    @Test
    void run_shouldSkipOnlyTheMirrorWhoseSeedFailed() {
        InMemoryRecordStore failing = spy(store);
        doThrow(new RecordStoreException("cards unavailable")).when(failing).findVisibleCards(any());

        CycleReport report = runner(lifecycle, failing).run(AGENT, tools -> tools.batch(List.of(
                "UPDATE __agent_config SET schedule = '@daily'",
                "INSERT INTO __kanban_cards (title) VALUES ('Lost edit')"), true));

        assertTrue(report.errors().contains(
                "Failed to load task_board; edits to its table are discarded this cycle."));
        SyncResult board = report.syncResult(TaskBoardDomain.NAME).orElseThrow();
        assertFalse(board.changed());
        assertEquals(List.of("schedule"), report.syncResult(AgentSettingsDomain.NAME).orElseThrow().updated());
    }

    @Test
    void run_shouldCollectSyncErrors() {
        CycleReport report = runner(lifecycle, store).run(AGENT, tools -> tools.batch(List.of(
                "UPDATE __agent_config SET charter = 'ok', schedule = 'every minute'"), true));

        assertEquals(1, report.syncErrors().size());
        assertTrue(report.syncErrors().get(0).startsWith("Invalid schedule format: "));
        assertEquals(report.syncErrors(), report.errors());
    }

    @Test
    void run_shouldReportFailure_whenRestoreFails() throws IOException {
        ScratchDatabaseLifecycle broken = mock(ScratchDatabaseLifecycle.class);
        when(broken.restore(AGENT)).thenThrow(new IOException("no temp space"));

        CycleReport report = runner(broken, store).run(AGENT, tools -> fail("work must not run"));

        assertEquals(PersistOutcome.FAILED, report.persistOutcome());
        assertEquals(List.of("Failed to prepare scratch database: no temp space"), report.errors());
        assertTrue(report.syncResults().isEmpty());
    }
}
