package de.bsommerfeld.scratchdb.db.storage;

import de.bsommerfeld.scratchdb.core.config.SessionConfig;
import de.bsommerfeld.scratchdb.core.config.StorageConfig;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.event.ApplicationEventBus;
import de.bsommerfeld.scratchdb.core.event.ControlEvents;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ScratchDatabaseLifecycleTest {

    private static final AgentIdentity AGENT = new AgentIdentity("1234abcd-0000-0000-0000-000000000000", "scope-1");

    @TempDir
    Path tempDir;

    @Mock
    private ApplicationEventBus eventBus;

    private StorageConfig config;
    private FileSystemBlobStorage blobs;
    private ScratchDatabaseLifecycle lifecycle;
    private String key;

    @BeforeEach
    void setUp() {
        config = new StorageConfig();
        blobs = new FileSystemBlobStorage(tempDir.resolve("blobs"));
        lifecycle = new ScratchDatabaseLifecycle(config, blobs, eventBus);
        key = StorageKeys.archiveKey(config.getKeyPrefix(), AGENT.agentId());
    }

    private static void run(Path db, String... statements) throws SQLException {
        try (GuardedSession session = GuardedSession.open(db, new SessionConfig())) {
            for (String sql : statements)
                session.execute(sql);
        }
    }

    private static List<String> tables(Path db) throws SQLException {
        try (GuardedSession session = GuardedSession.openReadOnly(db, new SessionConfig())) {
            return session.execute("SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name", stmt -> {
                List<String> names = new ArrayList<>();
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next())
                        names.add(rs.getString(1));
                }
                return names;
            });
        }
    }

    // =====================================================================
    // Restore
    // =====================================================================

    @Test
    void restore_shouldStartEmptyWithoutArchive() throws IOException {
        CycleHandle handle = lifecycle.restore(AGENT);

        assertFalse(Files.exists(handle.dbPath()));
        assertEquals(ScratchDatabaseLifecycle.PersistOutcome.NOTHING_TO_PERSIST, lifecycle.persist(handle));
        assertTrue(handle.isReleased());
    }

    @Test
    void restore_shouldStartFreshOnCorruptArchive() throws IOException {
        Path garbage = tempDir.resolve("garbage.zst");
        Files.writeString(garbage, "not a zstd frame");
        blobs.put(key, garbage);

        CycleHandle handle = lifecycle.restore(AGENT);

        assertFalse(Files.exists(handle.dbPath()));
        handle.close();
    }

    // =====================================================================
    // Persist
    // =====================================================================

    @Test
    void persist_shouldRoundTripUserTablesAndDropEphemeralOnes() throws Exception {
        CycleHandle first = lifecycle.restore(AGENT);
        run(first.dbPath(),
                "CREATE TABLE notes(body TEXT)",
                "INSERT INTO notes VALUES ('remember me')",
                "CREATE TABLE __tool_results(result_id TEXT PRIMARY KEY)",
                "CREATE TABLE __kanban_cards(id TEXT)");

        assertEquals(ScratchDatabaseLifecycle.PersistOutcome.PERSISTED, lifecycle.persist(first));
        assertTrue(first.isReleased());
        assertFalse(Files.exists(first.dbPath()));
        assertTrue(blobs.exists(key));

        CycleHandle second = lifecycle.restore(AGENT);
        assertEquals(List.of("notes"), tables(second.dbPath()));
        lifecycle.persist(second);
        verify(eventBus, never()).post(any());
    }

    @Test
    void persist_shouldWipeArchiveAboveHardCeiling() throws Exception {
        CycleHandle first = lifecycle.restore(AGENT);
        run(first.dbPath(), "CREATE TABLE notes(body TEXT)");
        lifecycle.persist(first);
        assertTrue(blobs.exists(key));

        config.setHardSizeLimitBytes(1);
        CycleHandle second = lifecycle.restore(AGENT);
        assertTrue(Files.exists(second.dbPath()));

        assertEquals(ScratchDatabaseLifecycle.PersistOutcome.WIPED, lifecycle.persist(second));
        assertFalse(blobs.exists(key));
        verify(eventBus).post(any(ControlEvents.ScratchDatabaseWipedEvent.class));

        CycleHandle third = lifecycle.restore(AGENT);
        assertFalse(Files.exists(third.dbPath()));
        third.close();
    }

    @Test
    void persist_shouldReportFailureAndReleaseHandleWhenUploadFails() throws Exception {
        CycleHandle first = lifecycle.restore(AGENT);
        run(first.dbPath(), "CREATE TABLE kept(body TEXT)");
        assertEquals(ScratchDatabaseLifecycle.PersistOutcome.PERSISTED, lifecycle.persist(first));

        BlobStorage failing = spy(blobs);
        doThrow(new IOException("storage down")).when(failing).put(anyString(), any(Path.class));
        ScratchDatabaseLifecycle failingLifecycle = new ScratchDatabaseLifecycle(config, failing, eventBus);

        CycleHandle handle = failingLifecycle.restore(AGENT);
        run(handle.dbPath(), "CREATE TABLE lost(body TEXT)");

        assertEquals(ScratchDatabaseLifecycle.PersistOutcome.FAILED, failingLifecycle.persist(handle));
        assertTrue(handle.isReleased());
        assertFalse(Files.exists(handle.dbPath().getParent()));
        verify(failing, never()).delete(anyString());

        assertTrue(blobs.exists(key));
        CycleHandle next = lifecycle.restore(AGENT);
        try {
            assertEquals(List.of("kept"), tables(next.dbPath()));
        } finally {
            next.close();
        }
    }
}
