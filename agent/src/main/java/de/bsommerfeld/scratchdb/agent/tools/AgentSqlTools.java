package de.bsommerfeld.scratchdb.agent.tools;

import de.bsommerfeld.scratchdb.core.domain.AgentIdentity;
import de.bsommerfeld.scratchdb.core.event.ApplicationEventBus;
import de.bsommerfeld.scratchdb.core.event.ControlEvents;
import de.bsommerfeld.scratchdb.db.digest.DatabaseDigest;
import de.bsommerfeld.scratchdb.db.digest.SchemaDigestor;
import de.bsommerfeld.scratchdb.db.exec.BatchExecutor;
import de.bsommerfeld.scratchdb.db.exec.BatchResult;
import de.bsommerfeld.scratchdb.db.guard.GuardedSession;
import de.bsommerfeld.scratchdb.db.schema.SchemaSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;

/**
 * What the agent sees of its scratch database during one cycle: batches and
 * single queries, the schema text for its prompt, the digest, and the
 * tool-result cache. Bound to the cycle's session; not reusable across
 * cycles.
 */
public class AgentSqlTools {

    private static final Logger LOG = LoggerFactory.getLogger(AgentSqlTools.class);

    private final AgentIdentity agent;
    private final GuardedSession session;
    private final BatchExecutor executor;
    private final SchemaSummary schemaSummary;
    private final SchemaDigestor digestor;
    private final ToolResultCache toolResults;
    private final ApplicationEventBus eventBus;

    public AgentSqlTools(AgentIdentity agent, GuardedSession session, BatchExecutor executor,
            SchemaSummary schemaSummary, SchemaDigestor digestor, ToolResultCache toolResults,
            ApplicationEventBus eventBus) {
        this.agent = agent;
        this.session = session;
        this.executor = executor;
        this.schemaSummary = schemaSummary;
        this.digestor = digestor;
        this.toolResults = toolResults;
        this.eventBus = eventBus;
    }

    public AgentIdentity agent() {
        return agent;
    }

    /**
     * Runs a batch of statements.
     *
     * @param moreWorkNeeded {@code false} if this batch completes the agent's
     *                       work for the cycle
     */
    public BatchResult batch(List<String> operations, boolean moreWorkNeeded) {
        return warnOnSize(executor.execute(session, operations, moreWorkNeeded));
    }

    public BatchResult query(String sql) {
        return warnOnSize(executor.executeQuery(session, sql));
    }

    private BatchResult warnOnSize(BatchResult result) {
        if (result.sizeWarning() != null) {
            LOG.warn("Scratch database of agent {} is {} MB, above the soft limit", agent.agentId(),
                    result.dbSizeMb());
            eventBus.post(new ControlEvents.ScratchDatabaseSizeWarningEvent(agent.agentId(), result.sizeBytes()));
        }
        return result;
    }

    /** Schema text for the agent's prompt. */
    public String schema() {
        return schemaSummary.render(session.path());
    }

    public DatabaseDigest digest() {
        return digestor.digest(session);
    }

    /**
     * Replaces the cached tool results.
     *
     * @return number of results written
     */
    public int cacheToolResults(List<ToolResult> results) throws SQLException {
        return toolResults.store(session, results);
    }
}
