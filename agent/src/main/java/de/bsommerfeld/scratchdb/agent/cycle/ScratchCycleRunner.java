package de.bsommerfeld.scratchdb.agent.cycle;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.scratchdb.agent.sync.AgentSettingsDomain;
import de.bsommerfeld.scratchdb.agent.sync.Baseline;
import de.bsommerfeld.scratchdb.agent.sync.MirrorSynchronizer;
import de.bsommerfeld.scratchdb.agent.sync.SkillDomain;
import de.bsommerfeld.scratchdb.agent.sync.SyncResult;
import de.bsommerfeld.scratchdb.agent.sync.TaskBoardDomain;
import de.bsommerfeld.scratchdb.agent.sync.TaskBoardSnapshot;
import de.bsommerfeld.scratchdb.agent.tools.AgentSqlTools;
import de.bsommerfeld.scratchdb.agent.tools.ToolResultCache;
import de.bsommerfeld.scratchdb.core.config.ScratchDbConfig;
import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.event.ApplicationEventBus;
import de.bsommerfeld.scratchdb.db.digest.DatabaseDigest;
import de.bsommerfeld.scratchdb.db.digest.SchemaDigestor;
import de.bsommerfeld.scratchdb.db.exec.BatchExecutor;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import de.bsommerfeld.scratchdb.db.schema.SchemaSummary;
import de.bsommerfeld.scratchdb.db.storage.CycleHandle;
import de.bsommerfeld.scratchdb.db.storage.ScratchDatabaseLifecycle;
import de.bsommerfeld.scratchdb.db.storage.ScratchDatabaseLifecycle.PersistOutcome;
import de.bsommerfeld.scratchdb.db.store.RecordStore;
import de.bsommerfeld.scratchdb.db.store.RecordStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one processing cycle for an agent end to end.
 *
 * <h3>Phases</h3>
 * <ol>
 * <li>restore the scratch database from its archive</li>
 * <li>open a guarded session and create the tool-result table</li>
 * <li>seed the task board, skill and agent config mirrors</li>
 * <li>run the agent's {@link CycleWork}</li>
 * <li>reconcile the three mirrors</li>
 * <li>digest the database, close the session, persist</li>
 * </ol>
 *
 * Each phase degrades on its own: a failed seed skips that mirror, failing
 * agent work still gets its edits reconciled, and a session that never
 * opened still releases the working copy through persist. Only a failed
 * restore ends the cycle early. Nothing here throws; every failure lands in
 * {@link CycleReport#errors()}.
 */
@Singleton
public class ScratchCycleRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScratchCycleRunner.class);

    private final ScratchDatabaseLifecycle lifecycle;
    private final ScratchDbConfig config;
    private final RecordStore store;
    private final ApplicationEventBus eventBus;
    private final BatchExecutor executor;
    private final SchemaSummary schemaSummary;
    private final SchemaDigestor digestor;
    private final ToolResultCache toolResults;
    private final TaskBoardDomain taskBoardDomain;
    private final List<MirrorSynchronizer<?, ?>> synchronizers;

    @Inject
    public ScratchCycleRunner(ScratchDatabaseLifecycle lifecycle, ScratchDbConfig config, RecordStore store,
            ApplicationEventBus eventBus, BatchExecutor executor, SchemaSummary schemaSummary,
            SchemaDigestor digestor, ToolResultCache toolResults, TaskBoardDomain taskBoardDomain,
            SkillDomain skillDomain, AgentSettingsDomain settingsDomain) {
        this.lifecycle = lifecycle;
        this.config = config;
        this.store = store;
        this.eventBus = eventBus;
        this.executor = executor;
        this.schemaSummary = schemaSummary;
        this.digestor = digestor;
        this.toolResults = toolResults;
        this.taskBoardDomain = taskBoardDomain;
        this.synchronizers = List.of(
                new MirrorSynchronizer<>(taskBoardDomain, store, eventBus),
                new MirrorSynchronizer<>(skillDomain, store, eventBus),
                new MirrorSynchronizer<>(settingsDomain, store, eventBus));
    }

    public CycleReport run(AgentIdentity agent, CycleWork work) {
        List<String> errors = new ArrayList<>();

        CycleHandle handle;
        try {
            handle = lifecycle.restore(agent);
        } catch (IOException e) {
            LOG.error("Failed to prepare scratch database for agent {}", agent.agentId(), e);
            errors.add("Failed to prepare scratch database: " + e.getMessage());
            return new CycleReport(agent.agentId(), Map.of(), null, null, errors, PersistOutcome.FAILED);
        }

        List<Mirror<?, ?>> mirrors = new ArrayList<>();
        for (MirrorSynchronizer<?, ?> sync : synchronizers)
            mirrors.add(Mirror.of(sync));

        Map<String, SyncResult> syncResults = new LinkedHashMap<>();
        TaskBoardSnapshot taskBoard = null;
        DatabaseDigest digest = null;

        try (GuardedSession session = GuardedSession.open(handle.dbPath(), config.getSession())) {
            AgentSqlTools tools = new AgentSqlTools(agent, session, executor, schemaSummary, digestor,
                    toolResults, eventBus);
            prepareToolResults(session, agent, errors);

            for (Mirror<?, ?> mirror : mirrors) {
                if (!mirror.seed(session, agent))
                    errors.add("Failed to load " + mirror.name() + "; edits to its table are discarded this cycle.");
            }

            runWork(agent, work, tools, errors);

            for (Mirror<?, ?> mirror : mirrors) {
                SyncResult result = mirror.reconcile(session, agent);
                syncResults.put(result.domain(), result);
                errors.addAll(result.errors());
            }

            SyncResult board = syncResults.get(TaskBoardDomain.NAME);
            if (board != null && board.changed())
                taskBoard = snapshotOrNull(agent, errors);

            digest = tools.digest();
        } catch (SQLException e) {
            LOG.error("Failed to open scratch database for agent {}", agent.agentId(), e);
            errors.add("Failed to open scratch database: " + e.getMessage());
        }

        PersistOutcome outcome = lifecycle.persist(handle);
        if (outcome == PersistOutcome.FAILED)
            errors.add("Failed to persist scratch database; this cycle's changes to it are lost.");

        LOG.info("Cycle for agent {} finished: persist={}, {} errors", agent.agentId(), outcome, errors.size());
        return new CycleReport(agent.agentId(), syncResults, taskBoard, digest, errors, outcome);
    }

    private void prepareToolResults(GuardedSession session, AgentIdentity agent, List<String> errors) {
        try {
            toolResults.ensureTable(session);
        } catch (SQLException e) {
            LOG.warn("Failed to create tool result table for agent {}", agent.agentId(), e);
            errors.add("Failed to create tool result table: " + e.getMessage());
        }
    }

    private void runWork(AgentIdentity agent, CycleWork work, AgentSqlTools tools, List<String> errors) {
        try {
            work.run(tools);
        } catch (SQLException | RuntimeException e) {
            LOG.error("Agent work failed for agent {}", agent.agentId(), e);
            errors.add("Agent work failed: " + e.getMessage());
        }
    }

    private TaskBoardSnapshot snapshotOrNull(AgentIdentity agent, List<String> errors) {
        try {
            return taskBoardDomain.snapshot(store, agent.agentId());
        } catch (RecordStoreException e) {
            LOG.warn("Failed to load task board for agent {}", agent.agentId(), e);
            errors.add("Failed to load task board: " + e.getMessage());
            return null;
        }
    }

    /** A synchronizer and its baseline for one cycle. */
    private static final class Mirror<D, R> {

        private final MirrorSynchronizer<D, R> sync;
        private Baseline<R> baseline;

        private Mirror(MirrorSynchronizer<D, R> sync) {
            this.sync = sync;
        }

        static <D, R> Mirror<D, R> of(MirrorSynchronizer<D, R> sync) {
            return new Mirror<>(sync);
        }

        String name() {
            return sync.domain().name();
        }

        boolean seed(GuardedSession session, AgentIdentity agent) {
            baseline = sync.seed(session, agent).orElse(null);
            return baseline != null;
        }

        SyncResult reconcile(GuardedSession session, AgentIdentity agent) {
            return sync.reconcile(session, agent, baseline);
        }
    }
}
