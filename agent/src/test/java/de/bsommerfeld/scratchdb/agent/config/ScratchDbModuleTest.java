package de.bsommerfeld.scratchdb.agent.config;

import com.google.inject.Binding;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.spi.LinkedKeyBinding;
import de.bsommerfeld.scratchdb.agent.cycle.CycleReport;
import de.bsommerfeld.scratchdb.agent.cycle.ScratchCycleRunner;
import de.bsommerfeld.scratchdb.agent.sync.ToolCatalog;
import de.bsommerfeld.scratchdb.core.config.ApplicationMode;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.event.ApplicationEventBus;
import de.bsommerfeld.scratchdb.db.storage.BlobStorage;
import de.bsommerfeld.scratchdb.db.storage.FileSystemBlobStorage;
import de.bsommerfeld.scratchdb.db.storage.ScratchDatabaseLifecycle.PersistOutcome;
import de.bsommerfeld.scratchdb.db.store.InMemoryRecordStore;
import de.bsommerfeld.scratchdb.db.store.RecordStore;
import de.bsommerfeld.scratchdb.db.store.SqlRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScratchDbModuleTest {

    @TempDir
    Path tempDir;

    private ScratchDbConfig config;

    @BeforeEach
    void setUp() {
        config = new ScratchDbConfig();
        config.getStorage().setBlobRoot(tempDir.resolve("blobs").toString());
        config.setToolCatalog(List.of("web_search"));
    }

    @Test
    void testMode_shouldBindInMemoryStore() {
        Injector injector = Guice.createInjector(new ScratchDbModule(config, ApplicationMode.TEST));

        assertInstanceOf(InMemoryRecordStore.class, injector.getInstance(RecordStore.class));
        assertSame(injector.getInstance(RecordStore.class), injector.getInstance(RecordStore.class));
    }

    @Test
    void prodMode_shouldLinkSqlStore() {
        Injector injector = Guice.createInjector(new ScratchDbModule(config, ApplicationMode.PROD));

        Binding<RecordStore> binding = injector.getBinding(RecordStore.class);
        assertInstanceOf(LinkedKeyBinding.class, binding);
        assertEquals(SqlRecordStore.class,
                ((LinkedKeyBinding<?>) binding).getLinkedKey().getTypeLiteral().getRawType());
    }

    @Test
    void module_shouldBindConfiguredBlobRootAndToolCatalog() {
        Injector injector = Guice.createInjector(new ScratchDbModule(config, ApplicationMode.TEST));

        FileSystemBlobStorage blobs = (FileSystemBlobStorage) injector.getInstance(BlobStorage.class);
        assertEquals(tempDir.resolve("blobs"), blobs.root());
        ToolCatalog catalog = injector.getInstance(ToolCatalog.class);
        assertEquals(Set.of("web_search"), catalog.availableToolIds(new AgentIdentity("a", "s")));
        assertSame(injector.getInstance(ApplicationEventBus.class), injector.getInstance(ApplicationEventBus.class));
    }

    @Test
    void resolveBlobRoot_shouldFallBackToAppDataDir() {
        Path root = ScratchDbModule.resolveBlobRoot("  ");
        assertTrue(root.endsWith(Path.of("blobs")));
    }

    @Test
    void injectedRunner_shouldCompleteACycle() {
        Injector injector = Guice.createInjector(new ScratchDbModule(config, ApplicationMode.TEST));
        ScratchCycleRunner runner = injector.getInstance(ScratchCycleRunner.class);

        CycleReport report = runner.run(new AgentIdentity("agent-a", "scope-1"),
                tools -> tools.batch(List.of("CREATE TABLE t (x INTEGER)"), true));

        assertTrue(report.errors().isEmpty(), report.errors().toString());
        assertEquals(PersistOutcome.PERSISTED, report.persistOutcome());
    }
}
