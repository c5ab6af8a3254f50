package de.bsommerfeld.scratchdb.db.store;

import de.bsommerfeld.scratchdb.core.domain.AgentSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the shared store behavior against a real temporary SQLite file, plus
 * the SQLite-specific startup and storage details.
 */
class SqlRecordStoreTest extends RecordStoreContract {

    @TempDir
    Path tempDir;

    @Override
    RecordStore createStore() {
        return new SqlRecordStore(tempDir.resolve("nested").resolve("records.db"));
    }

    @Test
    void constructor_shouldApplySchemaIdempotently() {
        store.inTransaction(tx -> {
            tx.saveSettings(AGENT, new AgentSettings("kept", null));
            return null;
        });

        SqlRecordStore reopened = new SqlRecordStore(tempDir.resolve("nested").resolve("records.db"));

        assertEquals("kept", reopened.findSettings(AGENT).charter());
    }

    @Test
    void insertSkill_shouldStoreToolsAsJsonArray() throws SQLException {
        store.inTransaction(tx -> {
            tx.insertSkill(skill("s1", "report", 1, java.util.List.of("sqlite_batch", "send_email")));
            return null;
        });

        try (Connection conn = ((SqlRecordStore) store).getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT tools FROM agent_skills WHERE id = 's1'")) {
            assertTrue(rs.next());
            assertEquals("[\"sqlite_batch\",\"send_email\"]", rs.getString(1));
        }
    }
}
