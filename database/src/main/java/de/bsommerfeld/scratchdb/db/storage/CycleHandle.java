package de.bsommerfeld.scratchdb.db.storage;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The restored scratch database of one processing cycle. Everything that
 * needs the database file receives this handle (or its {@link #dbPath()});
 * there is no ambient "current database" anywhere else.
 *
 * <p>
 * Closing deletes the private working directory and with it the database
 * file. {@link ScratchDatabaseLifecycle#persist} always closes the handle.
 */
public final class CycleHandle implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CycleHandle.class);

    private final String agentId;
    private final String archiveKey;
    private final Path workDir;
    private final Path dbPath;
    private boolean released;

    CycleHandle(String agentId, String archiveKey, Path workDir) {
        this.agentId = agentId;
        this.archiveKey = archiveKey;
        this.workDir = workDir;
        this.dbPath = workDir.resolve("state.db");
    }

    public String agentId() {
        return agentId;
    }

    public String archiveKey() {
        return archiveKey;
    }

    public Path dbPath() {
        return dbPath;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        if (released)
            return;
        released = true;
        try {
            MoreFiles.deleteRecursively(workDir, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            LOG.warn("Failed to delete scratch working directory {} for agent {}", workDir, agentId, e);
        }
    }
}
