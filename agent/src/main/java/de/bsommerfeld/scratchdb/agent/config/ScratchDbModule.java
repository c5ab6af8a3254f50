package de.bsommerfeld.scratchdb.agent.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.scratchdb.agent.sync.ConfiguredToolCatalog;
import de.bsommerfeld.scratchdb.agent.sync.ToolCatalog;
import de.bsommerfeld.scratchdb.core.config.ApplicationMode;
import de.bsommerfeld.scratchdb.core.config.ConfigLoader;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.util.StorageUtils;
import de.bsommerfeld.scratchdb.db.storage.BlobStorage;
import de.bsommerfeld.scratchdb.db.storage.FileSystemBlobStorage;
import de.bsommerfeld.scratchdb.db.store.InMemoryRecordStore;
import de.bsommerfeld.scratchdb.db.store.RecordStore;
import de.bsommerfeld.scratchdb.db.store.SqlRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice wiring for the scratch database. Everything not bound here is a
 * {@code @Singleton} class injected just in time.
 */
public class ScratchDbModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ScratchDbModule.class);

    static final String APP_NAME = "scratchdb";

    private final ScratchDbConfig config;
    private final ApplicationMode mode;

    public ScratchDbModule() {
        this(ConfigLoader.load(), ApplicationMode.get());
    }

    public ScratchDbModule(ScratchDbConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(ScratchDbConfig.class).toInstance(config);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(RecordStore.class).to(InMemoryRecordStore.class);
        } else {
            bind(RecordStore.class).to(SqlRecordStore.class);
        }

        Path blobRoot = resolveBlobRoot(config.getStorage().getBlobRoot());
        LOG.info("Scratch database archives stored under: {}", blobRoot.toAbsolutePath());
        bind(BlobStorage.class).toInstance(new FileSystemBlobStorage(blobRoot));

        bind(ToolCatalog.class).to(ConfiguredToolCatalog.class);
    }

    static Path resolveBlobRoot(String configured) {
        if (configured == null || configured.isBlank())
            return StorageUtils.getBlobDir(APP_NAME);
        return Path.of(configured.trim());
    }
}
