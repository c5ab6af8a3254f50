package de.bsommerfeld.scratchdb.db.storage;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.config.StorageConfig;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.event.ApplicationEventBus;
import de.bsommerfeld.scratchdb.core.event.ControlEvents;
import de.bsommerfeld.scratchdb.db.schema.BuiltinTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Owns the scratch database file for one processing cycle.
 *
 * <h3>Restore</h3>
 * Creates a private working directory and, when an archive exists under the
 * agent's key, decompresses it there. A corrupt or unreadable archive is
 * logged and the cycle starts with an empty database.
 *
 * <h3>Persist</h3>
 * <ol>
 * <li>drop every built-in ephemeral table</li>
 * <li>{@code VACUUM} and {@code PRAGMA optimize} on a plain connection</li>
 * <li>above the hard ceiling: delete the archive and write nothing</li>
 * <li>otherwise: compress and replace the archive</li>
 * </ol>
 * Failures are logged and never thrown. The handle is released on every
 * path.
 */
@Singleton
public class ScratchDatabaseLifecycle {

    private static final Logger LOG = LoggerFactory.getLogger(ScratchDatabaseLifecycle.class);

    /** What {@link #persist} did with the database. */
    public enum PersistOutcome {
        PERSISTED, WIPED, NOTHING_TO_PERSIST, FAILED
    }

    private final StorageConfig config;
    private final BlobStorage blobs;
    private final ApplicationEventBus eventBus;
    private final ZstdCodec codec;

    @Inject
    public ScratchDatabaseLifecycle(ScratchDbConfig config, BlobStorage blobs, ApplicationEventBus eventBus) {
        this(config.getStorage(), blobs, eventBus);
    }

    ScratchDatabaseLifecycle(StorageConfig config, BlobStorage blobs, ApplicationEventBus eventBus) {
        this.config = config;
        this.blobs = blobs;
        this.eventBus = eventBus;
        this.codec = new ZstdCodec(config.getCompressionLevel());
    }

    // =====================================================================
    // Restore
    // =====================================================================

    /**
     * @throws IOException only when the working directory cannot be created;
     *                     archive problems never fail the restore
     */
    public CycleHandle restore(AgentIdentity agent) throws IOException {
        String key = StorageKeys.archiveKey(config.getKeyPrefix(), agent.agentId());
        CycleHandle handle = new CycleHandle(agent.agentId(), key, Files.createTempDirectory("scratchdb-"));

        try {
            if (blobs.exists(key)) {
                try (InputStream in = blobs.open(key)) {
                    codec.decompress(in, handle.dbPath());
                }
                LOG.info("Restored scratch database for agent {} ({} bytes)", agent.agentId(),
                        Files.size(handle.dbPath()));
            } else {
                LOG.debug("No archive for agent {}, starting with an empty scratch database", agent.agentId());
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to restore scratch database for agent {}, starting fresh", agent.agentId(), e);
            Files.deleteIfExists(handle.dbPath());
        }
        return handle;
    }

    // =====================================================================
    // Persist
    // =====================================================================

    public PersistOutcome persist(CycleHandle handle) {
        try {
            Path dbPath = handle.dbPath();
            if (!Files.exists(dbPath))
                return PersistOutcome.NOTHING_TO_PERSIST;

            maintain(handle);
            long size = Files.size(dbPath);
            if (size > config.getHardSizeLimitBytes())
                return wipe(handle, size);
            return write(handle, size);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to persist scratch database for agent {}", handle.agentId(), e);
            return PersistOutcome.FAILED;
        } finally {
            handle.close();
        }
    }

    private void maintain(CycleHandle handle) {
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + handle.dbPath().toAbsolutePath());
                Statement stmt = conn.createStatement()) {
            for (String table : BuiltinTables.EPHEMERAL) {
                try {
                    stmt.execute("DROP TABLE IF EXISTS " + BuiltinTables.quote(table));
                } catch (SQLException e) {
                    LOG.debug("Failed to drop ephemeral table {}", table, e);
                }
            }
            stmt.execute("VACUUM");
            try {
                stmt.execute("PRAGMA optimize");
            } catch (SQLException e) {
                LOG.debug("PRAGMA optimize failed for agent {}", handle.agentId(), e);
            }
        } catch (SQLException e) {
            LOG.warn("Scratch database maintenance (VACUUM/optimize) failed for agent {}", handle.agentId(), e);
        }
    }

    private PersistOutcome wipe(CycleHandle handle, long size) throws IOException {
        LOG.info("Scratch database for agent {} exceeds the hard ceiling ({} MB), wiping instead of persisting",
                handle.agentId(), megabytes(size));
        blobs.delete(handle.archiveKey());
        eventBus.post(new ControlEvents.ScratchDatabaseWipedEvent(handle.agentId(), size));
        return PersistOutcome.WIPED;
    }

    private PersistOutcome write(CycleHandle handle, long size) throws IOException {
        Path compressed = handle.dbPath().resolveSibling(handle.dbPath().getFileName() + ZstdCodec.FILE_EXTENSION);
        try {
            codec.compress(handle.dbPath(), compressed);
            // put replaces the previous archive; a failed upload leaves it in place
            blobs.put(handle.archiveKey(), compressed);
            LOG.info("Persisted scratch database for agent {} ({} MB, {} bytes compressed)", handle.agentId(),
                    megabytes(size), Files.size(compressed));
            return PersistOutcome.PERSISTED;
        } finally {
            Files.deleteIfExists(compressed);
        }
    }

    private static String megabytes(long bytes) {
        return String.format(Locale.ROOT, "%.2f", bytes / (1024.0 * 1024.0));
    }
}
